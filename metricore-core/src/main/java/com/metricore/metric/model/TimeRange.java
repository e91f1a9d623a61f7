package com.metricore.metric.model;

import com.metricore.metric.error.MetricsEngineException;

/** Half-open range {@code [start, end)} in seconds. {@code start == end} is a valid, empty range. */
public record TimeRange(double start, double end) {

    public TimeRange {
        if (!Double.isFinite(start) || !Double.isFinite(end)) {
            throw MetricsEngineException.invalidArgument("Time range bounds must be finite");
        }
        if (end < start) {
            throw MetricsEngineException.invalidArgument(
                    "Time range end " + end + " must not be before start " + start);
        }
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(double timestamp) {
        return timestamp >= start && timestamp < end;
    }

    public double length() {
        return end - start;
    }
}
