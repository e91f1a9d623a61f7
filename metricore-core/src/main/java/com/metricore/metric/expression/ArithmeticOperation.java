package com.metricore.metric.expression;

import com.metricore.metric.error.MetricsEngineException;
import java.util.OptionalDouble;

public enum ArithmeticOperation {
    ADD("Add"),
    SUBTRACT("Subtract"),
    MULTIPLY("Multiply"),
    DIVIDE("Divide");

    private final String wireName;

    ArithmeticOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Applies the operation. Division by zero and non-finite results yield an empty value: the
     * sample is treated as missing rather than as an error.
     */
    public OptionalDouble apply(double left, double right) {
        double result = switch (this) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> {
                if (right == 0.0d) {
                    yield Double.NaN;
                }
                yield left / right;
            }
        };
        return Double.isFinite(result) ? OptionalDouble.of(result) : OptionalDouble.empty();
    }

    public static ArithmeticOperation fromValue(String value) {
        if (value != null) {
            for (ArithmeticOperation operation : values()) {
                if (operation.wireName.equals(value.trim())) {
                    return operation;
                }
            }
        }
        throw MetricsEngineException.invalidArgument("Unknown arithmetic operation: " + value);
    }
}
