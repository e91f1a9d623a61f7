package com.metricore.service.core.query;

/** Lifecycle hooks of {@link QueryExecutor} for tests outside this package. */
public final class QueryExecutorAccess {

    private QueryExecutorAccess() {}

    public static void start(QueryExecutor executor, int workers) {
        executor.init(workers);
    }

    public static void stop(QueryExecutor executor) {
        executor.stop();
    }
}
