package com.metricore.metric.filter;

import com.metricore.metric.expression.ArithmeticOperation;
import com.metricore.metric.expression.MetricFunction;
import java.util.List;
import java.util.Objects;

/** Numeric operand of a filter, computed from the value of the point under test. */
public sealed interface TransformExpression
        permits TransformExpression.InputValue,
                TransformExpression.Value,
                TransformExpression.Arithmetic,
                TransformExpression.Function {

    TransformExpression INPUT_VALUE = new InputValue();

    static TransformExpression value(double constant) {
        return new Value(constant);
    }

    /** The value of the point being filtered. */
    record InputValue() implements TransformExpression {}

    record Value(double constant) implements TransformExpression {}

    record Arithmetic(ArithmeticOperation operation, TransformExpression left, TransformExpression right)
            implements TransformExpression {
        public Arithmetic {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Function(MetricFunction function, List<TransformExpression> arguments) implements TransformExpression {
        public Function {
            Objects.requireNonNull(function, "function");
            arguments = List.copyOf(arguments);
        }
    }
}
