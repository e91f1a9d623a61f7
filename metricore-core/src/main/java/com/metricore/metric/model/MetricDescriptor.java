package com.metricore.metric.model;

import java.util.Objects;
import java.util.Optional;

/** Immutable catalog entry for one metric. */
public record MetricDescriptor(String name, MetricKind kind, String autoPrimaryTagKey) {

    public MetricDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static MetricDescriptor of(String name, MetricKind kind) {
        return new MetricDescriptor(name, kind, null);
    }

    public Optional<String> autoPrimaryTag() {
        return Optional.ofNullable(autoPrimaryTagKey);
    }

    public MetricDescriptor withAutoPrimaryTagKey(String key) {
        return new MetricDescriptor(name, kind, key);
    }
}
