package com.metricore.service.core.api;

import com.metricore.metric.error.ErrorKind;
import com.metricore.metric.error.MetricsEngineException;

/** Error body returned by the request handler. */
public record ErrorPayload(ErrorKind kind, String message) {

    public static ErrorPayload from(Throwable error) {
        if (error instanceof MetricsEngineException engineException) {
            String message = engineException.getMessage() == null
                    ? engineException.getKind().defaultMessage()
                    : engineException.getMessage();
            return new ErrorPayload(engineException.getKind(), message);
        }
        return new ErrorPayload(ErrorKind.INTERNAL, ErrorKind.INTERNAL.defaultMessage());
    }
}
