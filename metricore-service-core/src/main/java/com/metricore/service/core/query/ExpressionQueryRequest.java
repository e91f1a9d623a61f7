package com.metricore.service.core.query;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.expression.Expression;
import com.metricore.metric.filter.FilterExpression;
import com.metricore.metric.model.TimeRange;
import java.time.Duration;

/**
 * Typed expression query.
 *
 * @param duration window width in seconds; {@code null} reduces the whole range into one window
 * @param outputFilter applied to the evaluated result, may be {@code null}
 * @param timeout caller budget, {@code null} for the configured default
 */
public record ExpressionQueryRequest(
        TimeRange range, Double duration, Expression expression, FilterExpression outputFilter, Duration timeout) {

    public ExpressionQueryRequest {
        if (range == null) {
            throw MetricsEngineException.invalidArgument("Time range is required");
        }
        if (expression == null) {
            throw MetricsEngineException.invalidArgument("Expression is required");
        }
    }

    public static ExpressionQueryRequest of(TimeRange range, Double duration, Expression expression) {
        return new ExpressionQueryRequest(range, duration, expression, null, null);
    }
}
