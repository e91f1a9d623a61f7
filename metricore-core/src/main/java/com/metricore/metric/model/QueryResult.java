package com.metricore.metric.model;

import java.util.List;

/** Final answer of a query: one unlabeled series, or one series per group. */
public sealed interface QueryResult permits QueryResult.Ungrouped, QueryResult.Grouped {

    static QueryResult empty() {
        return new Ungrouped(List.of());
    }

    record Ungrouped(List<SeriesPoint> points) implements QueryResult {
        public Ungrouped {
            points = List.copyOf(points);
        }
    }

    record Grouped(List<LabeledSeries> groups) implements QueryResult {
        public Grouped {
            groups = List.copyOf(groups);
        }
    }
}
