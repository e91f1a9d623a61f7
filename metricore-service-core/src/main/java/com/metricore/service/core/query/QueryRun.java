package com.metricore.service.core.query;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.model.QueryResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** State trail of one query run. */
public final class QueryRun {

    private final List<QueryState> trail = new ArrayList<>();
    private QueryResult result;
    private MetricsEngineException failure;

    synchronized void advance(QueryState next) {
        QueryState current = state();
        boolean allowed = current == null ? next == QueryState.PARSED || next == QueryState.FAILED : current.canAdvanceTo(next);
        if (!allowed) {
            throw new IllegalStateException("Illegal query transition " + current + " -> " + next);
        }
        trail.add(next);
    }

    synchronized void respond(QueryResult result) {
        advance(QueryState.RESPONDED);
        this.result = result;
    }

    synchronized void fail(MetricsEngineException failure) {
        if (state() != QueryState.FAILED) {
            trail.add(QueryState.FAILED);
        }
        this.failure = failure;
    }

    /** Current state, {@code null} before parsing completed. */
    public synchronized QueryState state() {
        return trail.isEmpty() ? null : trail.get(trail.size() - 1);
    }

    public synchronized List<QueryState> trail() {
        return List.copyOf(trail);
    }

    public synchronized Optional<QueryResult> result() {
        return Optional.ofNullable(result);
    }

    synchronized Optional<MetricsEngineException> failure() {
        return Optional.ofNullable(failure);
    }
}
