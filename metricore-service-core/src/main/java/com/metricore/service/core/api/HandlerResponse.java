package com.metricore.service.core.api;

/** JSON body produced by {@link MetricsRequestHandler}; {@code success} tells data from an {@link ErrorPayload}. */
public record HandlerResponse(boolean success, String body) {

    static HandlerResponse ok(String body) {
        return new HandlerResponse(true, body);
    }

    static HandlerResponse error(String body) {
        return new HandlerResponse(false, body);
    }
}
