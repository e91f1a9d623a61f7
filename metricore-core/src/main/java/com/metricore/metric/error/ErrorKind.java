package com.metricore.metric.error;

/**
 * Failure categories surfaced by the engine. The boundary layer maps these to transport-level
 * status codes; the engine itself only produces the kind and a message.
 */
public enum ErrorKind {
    NOT_FOUND("Metric not found"),
    CONFLICT("Metric already exists with a different kind"),
    INVALID_ARGUMENT("Invalid argument provided"),
    TIMEOUT("Query exceeded its time budget"),
    INTERNAL("Internal engine failure");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
