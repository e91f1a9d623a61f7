package com.metricore.metric.error;

import lombok.Getter;

/** Predictable engine failure carrying an {@link ErrorKind}. */
@Getter
public class MetricsEngineException extends RuntimeException {

    private final ErrorKind kind;

    public MetricsEngineException(ErrorKind kind) {
        super(kind.defaultMessage());
        this.kind = kind;
    }

    public MetricsEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MetricsEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static MetricsEngineException notFound(String message) {
        return new MetricsEngineException(ErrorKind.NOT_FOUND, message);
    }

    public static MetricsEngineException conflict(String message) {
        return new MetricsEngineException(ErrorKind.CONFLICT, message);
    }

    public static MetricsEngineException invalidArgument(String message) {
        return new MetricsEngineException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static MetricsEngineException timeout(String message) {
        return new MetricsEngineException(ErrorKind.TIMEOUT, message);
    }

    public static MetricsEngineException internal(String message, Throwable cause) {
        return new MetricsEngineException(ErrorKind.INTERNAL, message, cause);
    }
}
