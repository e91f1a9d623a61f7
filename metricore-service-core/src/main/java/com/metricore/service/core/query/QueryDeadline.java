package com.metricore.service.core.query;

import com.metricore.metric.error.MetricsEngineException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative time budget of one query. Long-running stages call {@link #check()} at bucket
 * granularity; the executor cancels the deadline when the caller stops waiting.
 */
public final class QueryDeadline {

    private static final QueryDeadline UNBOUNDED = new QueryDeadline(null, null);

    private final Clock clock;
    private final Instant expiresAt;
    private volatile boolean cancelled;

    private QueryDeadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static QueryDeadline after(Clock clock, Duration timeout) {
        return new QueryDeadline(clock, clock.instant().plus(timeout));
    }

    public static QueryDeadline unbounded() {
        return UNBOUNDED;
    }

    public void cancel() {
        if (this != UNBOUNDED) {
            cancelled = true;
        }
    }

    public boolean isExpired() {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            return true;
        }
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public void check() {
        if (isExpired()) {
            throw MetricsEngineException.timeout("Query exceeded its time budget");
        }
    }
}
