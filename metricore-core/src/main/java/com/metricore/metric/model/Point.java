package com.metricore.metric.model;

import com.metricore.metric.error.MetricsEngineException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A stored sample. Timestamps are real-valued seconds; tags are keyed by tag key, so keys are
 * unique within a point.
 */
public record Point(double timestamp, double value, Map<String, String> tags) {

    public Point {
        if (!Double.isFinite(timestamp)) {
            throw MetricsEngineException.invalidArgument("Point time must be finite, got " + timestamp);
        }
        if (!Double.isFinite(value)) {
            throw MetricsEngineException.invalidArgument("Point value must be finite, got " + value);
        }
        tags = tags == null || tags.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static Point of(double timestamp, double value) {
        return new Point(timestamp, value, Map.of());
    }

    public static Point of(double timestamp, double value, Collection<Tag> tags) {
        Map<String, String> byKey = new LinkedHashMap<>();
        if (tags != null) {
            for (Tag tag : tags) {
                if (byKey.putIfAbsent(tag.key(), tag.value()) != null) {
                    throw MetricsEngineException.invalidArgument("Duplicate tag key '" + tag.key() + "' in point");
                }
            }
        }
        return new Point(timestamp, value, byKey);
    }

    public Optional<String> tagValue(String key) {
        return Optional.ofNullable(tags.get(key));
    }

    public boolean hasTag(Tag tag) {
        return tag.value().equals(tags.get(tag.key()));
    }

    public Point withTag(Tag tag) {
        Map<String, String> next = new LinkedHashMap<>(tags);
        next.put(tag.key(), tag.value());
        return new Point(timestamp, value, next);
    }
}
