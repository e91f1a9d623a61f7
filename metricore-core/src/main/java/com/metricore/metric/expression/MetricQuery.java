package com.metricore.metric.expression;

import com.metricore.metric.filter.FilterExpression;
import com.metricore.metric.model.Tag;
import java.util.List;

/**
 * Per-metric selection: optional grouping tag key, exact-match tag filter (AND semantics) and an
 * optional post-aggregation output filter.
 */
public record MetricQuery(String groupBy, List<Tag> tags, FilterExpression outputFilter) {

    public MetricQuery {
        groupBy = groupBy == null || groupBy.isBlank() ? null : groupBy;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static MetricQuery all() {
        return new MetricQuery(null, List.of(), null);
    }

    public static MetricQuery groupedBy(String groupBy) {
        return new MetricQuery(groupBy, List.of(), null);
    }

    public static MetricQuery tagged(List<Tag> tags) {
        return new MetricQuery(null, tags, null);
    }

    public boolean grouped() {
        return groupBy != null;
    }
}
