package com.metricore.service.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.model.LabeledSeries;
import com.metricore.metric.model.MetricDescriptor;
import com.metricore.metric.model.QueryResult;
import com.metricore.metric.model.SeriesPoint;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Encodes results as JSON: {@code {"value": [[t, v], ...]}} for ungrouped series and
 * {@code {"value": [["group", [[t, v], ...]], ...]}} for grouped ones.
 */
@Component
@RequiredArgsConstructor
public class ResponseEncoder {

    private final ObjectMapper objectMapper;

    public String encodeResult(QueryResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        if (result instanceof QueryResult.Grouped grouped) {
            ArrayNode groups = root.putArray("value");
            for (LabeledSeries series : grouped.groups()) {
                ArrayNode entry = groups.addArray();
                entry.add(series.label());
                entry.add(encodeSeries(series.points()));
            }
        } else {
            root.set("value", encodeSeries(((QueryResult.Ungrouped) result).points()));
        }
        return write(root);
    }

    public String encodeInserted(int count) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("num_inserted", count);
        return write(root);
    }

    public String encodeEmpty() {
        return write(objectMapper.createObjectNode());
    }

    public String encodeMetrics(List<MetricDescriptor> metrics) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode array = root.putArray("metrics");
        for (MetricDescriptor metric : metrics) {
            ObjectNode entry = array.addObject();
            entry.put("name", metric.name());
            entry.put("kind", metric.kind().name());
            metric.autoPrimaryTag().ifPresent(key -> entry.put("auto_primary_tag", key));
        }
        return write(root);
    }

    public String encodeError(ErrorPayload payload) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("kind", payload.kind().name());
        root.put("message", payload.message());
        return write(root);
    }

    private ArrayNode encodeSeries(List<SeriesPoint> points) {
        ArrayNode array = objectMapper.createArrayNode();
        for (SeriesPoint point : points) {
            array.addArray().add(point.timestamp()).add(point.value());
        }
        return array;
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw MetricsEngineException.internal("Failed to encode response", ex);
        }
    }
}
