package com.metricore.metric.expression;

import com.metricore.metric.error.MetricsEngineException;
import java.util.OptionalDouble;

/**
 * Scalar functions usable both in expression trees and in output-filter transforms. A result
 * outside the function's domain (negative square root, non-positive logarithm) is empty.
 */
public enum MetricFunction {
    ABS("Abs", 1),
    MAX("Max", 2),
    MIN("Min", 2),
    ROUND("Round", 1),
    CEIL("Ceil", 1),
    FLOOR("Floor", 1),
    SQRT("Sqrt", 1),
    SQUARE("Square", 1),
    POWER("Power", 2),
    EXPONENTIAL("Exponential", 1),
    LOG_E("LogE", 1),
    LOG_BASE("LogBase", 2),
    SIN("Sin", 1),
    COS("Cos", 1),
    TAN("Tan", 1);

    private final String wireName;
    private final int arity;

    MetricFunction(String wireName, int arity) {
        this.wireName = wireName;
        this.arity = arity;
    }

    public String wireName() {
        return wireName;
    }

    public void checkArity(int argumentCount) {
        if (argumentCount != arity) {
            throw MetricsEngineException.invalidArgument(
                    wireName + " expects " + arity + " argument(s), got " + argumentCount);
        }
    }

    public OptionalDouble apply(double... arguments) {
        checkArity(arguments.length);
        double x = arguments[0];
        double result = switch (this) {
            case ABS -> Math.abs(x);
            case MAX -> Math.max(x, arguments[1]);
            case MIN -> Math.min(x, arguments[1]);
            case ROUND -> Math.signum(x) * Math.floor(Math.abs(x) + 0.5d);
            case CEIL -> Math.ceil(x);
            case FLOOR -> Math.floor(x);
            case SQRT -> x >= 0.0d ? Math.sqrt(x) : Double.NaN;
            case SQUARE -> x * x;
            case POWER -> Math.pow(x, arguments[1]);
            case EXPONENTIAL -> Math.exp(x);
            case LOG_E -> x > 0.0d ? Math.log(x) : Double.NaN;
            case LOG_BASE -> x > 0.0d && arguments[1] > 0.0d ? Math.log(x) / Math.log(arguments[1]) : Double.NaN;
            case SIN -> Math.sin(x);
            case COS -> Math.cos(x);
            case TAN -> Math.tan(x);
        };
        return Double.isFinite(result) ? OptionalDouble.of(result) : OptionalDouble.empty();
    }

    public static MetricFunction fromValue(String value) {
        if (value != null) {
            for (MetricFunction function : values()) {
                if (function.wireName.equals(value.trim())) {
                    return function;
                }
            }
        }
        throw MetricsEngineException.invalidArgument("Unknown function: " + value);
    }
}
