package com.metricore.metric.expression;

import com.metricore.metric.error.MetricsEngineException;

/** Per-bucket reduction applied to the points of one window. */
public sealed interface Aggregation
        permits Aggregation.Average,
                Aggregation.Sum,
                Aggregation.Min,
                Aggregation.Max,
                Aggregation.Count,
                Aggregation.Percentile {

    Aggregation AVERAGE = new Average();
    Aggregation SUM = new Sum();
    Aggregation MIN = new Min();
    Aggregation MAX = new Max();
    Aggregation COUNT = new Count();

    String label();

    static Aggregation percentile(double percentile) {
        return new Percentile(percentile);
    }

    /** Resolves the parameterless operations by name; percentiles need {@link #percentile(double)}. */
    static Aggregation fromName(String name) {
        if (name == null || name.isBlank()) {
            throw MetricsEngineException.invalidArgument("Operation is required");
        }
        return switch (name.trim()) {
            case "Average" -> AVERAGE;
            case "Sum" -> SUM;
            case "Min" -> MIN;
            case "Max" -> MAX;
            case "Count" -> COUNT;
            default -> throw MetricsEngineException.invalidArgument("Unknown operation: " + name);
        };
    }

    record Average() implements Aggregation {
        @Override
        public String label() {
            return "Average";
        }
    }

    record Sum() implements Aggregation {
        @Override
        public String label() {
            return "Sum";
        }
    }

    record Min() implements Aggregation {
        @Override
        public String label() {
            return "Min";
        }
    }

    record Max() implements Aggregation {
        @Override
        public String label() {
            return "Max";
        }
    }

    record Count() implements Aggregation {
        @Override
        public String label() {
            return "Count";
        }
    }

    /** Nearest-rank percentile, {@code percentile} in {@code [0, 100]}. */
    record Percentile(double percentile) implements Aggregation {
        public Percentile {
            if (!(percentile >= 0.0d && percentile <= 100.0d)) {
                throw MetricsEngineException.invalidArgument("Percentile must be within [0, 100], got " + percentile);
            }
        }

        @Override
        public String label() {
            return "Percentile(" + percentile + ")";
        }
    }
}
