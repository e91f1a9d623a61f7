package com.metricore.service.core.query;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.service.core.config.MetricoreProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bounded worker pool running queries under a deadline. A query that misses its deadline fails
 * with TIMEOUT and its worker is cancelled.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QueryExecutor {

    private final MetricoreProperties properties;
    private final Clock clock;

    private ExecutorService executor;

    @PostConstruct
    void start() {
        init(properties.getQuery().getWorkers());
    }

    void init(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("metricore.query.workers must be positive, got " + workers);
        }
        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "metricore-query-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info(
                "Query executor started workers={}, defaultTimeout={}, maxTimeout={}",
                workers,
                properties.getQuery().getDefaultTimeout(),
                properties.getQuery().getMaxTimeout());
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public <T> T execute(Duration requestedTimeout, Function<QueryDeadline, T> query) {
        Duration timeout = resolveTimeout(requestedTimeout);
        QueryDeadline deadline = QueryDeadline.after(clock, timeout);
        Future<T> future = executor.submit(() -> query.apply(deadline));
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            deadline.cancel();
            future.cancel(true);
            log.warn("Query timed out after {}", timeout);
            throw MetricsEngineException.timeout("Query exceeded its time budget of " + timeout);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof MetricsEngineException engineException) {
                throw engineException;
            }
            log.error("Query worker failed", cause);
            throw MetricsEngineException.internal("Query failed unexpectedly", cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            deadline.cancel();
            future.cancel(true);
            throw MetricsEngineException.internal("Interrupted while waiting for query", ex);
        }
    }

    /** Caller timeout capped to the configured maximum; the default applies when none is given. */
    Duration resolveTimeout(Duration requested) {
        MetricoreProperties.Query config = properties.getQuery();
        if (requested == null) {
            return min(config.getDefaultTimeout(), config.getMaxTimeout());
        }
        if (requested.isNegative() || requested.isZero()) {
            throw MetricsEngineException.invalidArgument("Query timeout must be positive, got " + requested);
        }
        return min(requested, config.getMaxTimeout());
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
