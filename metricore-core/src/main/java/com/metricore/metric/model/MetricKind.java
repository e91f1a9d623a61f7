package com.metricore.metric.model;

import com.metricore.metric.error.MetricsEngineException;
import java.util.Locale;

/**
 * Kind of a registered metric. Gauges hold instantaneous readings; counters hold cumulative
 * values that are conventionally non-decreasing per source (not enforced).
 */
public enum MetricKind {
    GAUGE,
    COUNTER;

    public static MetricKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw MetricsEngineException.invalidArgument("Metric kind is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "GAUGE" -> GAUGE;
            case "COUNTER", "COUNT" -> COUNTER;
            default -> throw MetricsEngineException.invalidArgument("Unsupported metric kind: " + value);
        };
    }
}
