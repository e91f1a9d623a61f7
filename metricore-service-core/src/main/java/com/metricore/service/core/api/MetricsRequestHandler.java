package com.metricore.service.core.api;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.model.MetricKind;
import com.metricore.metric.model.Point;
import java.util.List;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON request/response boundary over {@link MetricsEngine}. Request bodies are decoded into typed
 * requests before reaching the engine; every failure is answered with an {@link ErrorPayload} body
 * and never mixed with data.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsRequestHandler {

    private final MetricsEngine engine;
    private final RequestDecoder decoder;
    private final ResponseEncoder encoder;

    /** Body: {@code {"name": "cpu_usage", "kind": "gauge"}}. */
    public HandlerResponse registerMetric(String body) {
        return handle(() -> {
            RequestDecoder.Registration registration = decoder.decodeRegistration(body);
            engine.registerMetric(registration.name(), registration.kind());
            return encoder.encodeEmpty();
        });
    }

    /** Body: {@code {"key": "host"}}. */
    public HandlerResponse setAutoPrimaryTag(String metric, String body) {
        return handle(() -> {
            engine.setAutoPrimaryTag(metric, decoder.decodeAutoPrimaryTagKey(body));
            return encoder.encodeEmpty();
        });
    }

    /** Body: {@code [{"time": 1.0, "value": 0.2, "tags": ["core:0"]}, ...]}. */
    public HandlerResponse insert(String kind, String metric, String body, String source) {
        return handle(() -> {
            MetricKind metricKind = MetricKind.fromValue(kind);
            List<Point> points = decoder.decodePoints(body, metricKind);
            return encoder.encodeInserted(engine.insertBatch(metricKind, metric, points, source));
        });
    }

    public HandlerResponse legacyQuery(String metric, String body) {
        return handle(() -> encoder.encodeResult(engine.legacyQuery(decoder.decodeLegacyQuery(metric, body))));
    }

    public HandlerResponse expressionQuery(String body) {
        return handle(() -> encoder.encodeResult(engine.expressionQuery(decoder.decodeExpressionQuery(body))));
    }

    public HandlerResponse listMetrics() {
        return handle(() -> encoder.encodeMetrics(engine.listMetrics()));
    }

    private HandlerResponse handle(Supplier<String> action) {
        try {
            return HandlerResponse.ok(action.get());
        } catch (MetricsEngineException ex) {
            log.debug("Request rejected kind={} message={}", ex.getKind(), ex.getMessage());
            return HandlerResponse.error(encoder.encodeError(ErrorPayload.from(ex)));
        } catch (RuntimeException ex) {
            log.error("Request failed unexpectedly", ex);
            return HandlerResponse.error(encoder.encodeError(ErrorPayload.from(ex)));
        }
    }
}
