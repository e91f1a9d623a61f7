package com.metricore.metric.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression tree over metric series.
 *
 * <pre>
 *   Divide(Average(used_memory), Average(total_memory))
 *   Multiply(Count(context_switches group by host), Value(0.1))
 * </pre>
 */
public sealed interface Expression
        permits Expression.MetricRef, Expression.Arithmetic, Expression.Value, Expression.FunctionCall {

    /** Aggregated, optionally grouped, series of one metric. */
    record MetricRef(String metric, Aggregation aggregation, MetricQuery query) implements Expression {
        public MetricRef {
            Objects.requireNonNull(metric, "metric");
            aggregation = aggregation == null ? Aggregation.AVERAGE : aggregation;
            query = query == null ? MetricQuery.all() : query;
        }

        public static MetricRef of(String metric, Aggregation aggregation) {
            return new MetricRef(metric, aggregation, MetricQuery.all());
        }
    }

    record Arithmetic(ArithmeticOperation operation, Expression left, Expression right) implements Expression {
        public Arithmetic {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /** Constant broadcast onto the timestamps produced by the rest of the tree. */
    record Value(double constant) implements Expression {}

    record FunctionCall(MetricFunction function, List<Expression> arguments) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(function, "function");
            arguments = List.copyOf(arguments);
        }
    }
}
