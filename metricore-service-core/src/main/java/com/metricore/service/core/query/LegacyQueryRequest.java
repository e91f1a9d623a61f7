package com.metricore.service.core.query;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.expression.Aggregation;
import com.metricore.metric.expression.Expression;
import com.metricore.metric.expression.MetricQuery;
import com.metricore.metric.model.TimeRange;
import java.time.Duration;

/** Single-metric query: one aggregation over one metric, optionally grouped or tag filtered. */
public record LegacyQueryRequest(
        String metric, Aggregation aggregation, TimeRange range, Double duration, MetricQuery query, Duration timeout) {

    public LegacyQueryRequest {
        if (metric == null || metric.isBlank()) {
            throw MetricsEngineException.invalidArgument("Metric name is required");
        }
        if (aggregation == null) {
            throw MetricsEngineException.invalidArgument("Operation is required");
        }
        if (range == null) {
            throw MetricsEngineException.invalidArgument("Time range is required");
        }
        query = query == null ? MetricQuery.all() : query;
    }

    /** The equivalent expression query; the output filter moves to the top level. */
    public ExpressionQueryRequest toExpressionRequest() {
        MetricQuery selection = new MetricQuery(query.groupBy(), query.tags(), null);
        Expression.MetricRef ref = new Expression.MetricRef(metric, aggregation, selection);
        return new ExpressionQueryRequest(range, duration, ref, query.outputFilter(), timeout);
    }
}
