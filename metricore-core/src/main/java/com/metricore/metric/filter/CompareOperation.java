package com.metricore.metric.filter;

import com.metricore.metric.error.MetricsEngineException;

public enum CompareOperation {
    EQUAL("Equal"),
    NOT_EQUAL("NotEqual"),
    GREATER_THAN("GreaterThan"),
    GREATER_THAN_OR_EQUAL("GreaterThanOrEqual"),
    LESS_THAN("LessThan"),
    LESS_THAN_OR_EQUAL("LessThanOrEqual");

    private final String wireName;

    CompareOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean test(double left, double right) {
        return switch (this) {
            case EQUAL -> left == right;
            case NOT_EQUAL -> left != right;
            case GREATER_THAN -> left > right;
            case GREATER_THAN_OR_EQUAL -> left >= right;
            case LESS_THAN -> left < right;
            case LESS_THAN_OR_EQUAL -> left <= right;
        };
    }

    public static CompareOperation fromValue(String value) {
        if (value != null) {
            for (CompareOperation operation : values()) {
                if (operation.wireName.equals(value.trim())) {
                    return operation;
                }
            }
        }
        throw MetricsEngineException.invalidArgument("Unknown compare operation: " + value);
    }
}
