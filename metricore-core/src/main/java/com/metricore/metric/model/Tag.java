package com.metricore.metric.model;

import com.metricore.metric.error.MetricsEngineException;

/** A {@code key:value} tag attached to a point. */
public record Tag(String key, String value) {

    public Tag {
        if (key == null || key.isEmpty()) {
            throw MetricsEngineException.invalidArgument("Tag key must not be empty");
        }
        if (value == null) {
            throw MetricsEngineException.invalidArgument("Tag value must not be null for key " + key);
        }
    }

    /** Parses the wire form {@code key:value}; exactly one separator is allowed. */
    public static Tag parse(String raw) {
        if (raw == null) {
            throw MetricsEngineException.invalidArgument("Tag must not be null");
        }
        String[] parts = raw.split(":", -1);
        if (parts.length != 2 || parts[0].isEmpty()) {
            throw MetricsEngineException.invalidArgument("Tag must be on the format key:value, got '" + raw + "'");
        }
        return new Tag(parts[0], parts[1]);
    }

    @Override
    public String toString() {
        return key + ":" + value;
    }
}
