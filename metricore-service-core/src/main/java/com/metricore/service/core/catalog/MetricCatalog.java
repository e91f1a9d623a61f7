package com.metricore.service.core.catalog;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.model.MetricDescriptor;
import com.metricore.metric.model.MetricKind;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Registry of metric name to kind plus the optional auto-primary-tag key. A metric's kind never
 * changes once registered.
 */
@Slf4j
@Service
public class MetricCatalog {

    private final ConcurrentMap<String, MetricDescriptor> metrics = new ConcurrentHashMap<>();

    /**
     * Registers {@code name} with {@code kind}. Registering again with the same kind is a no-op that
     * returns the existing descriptor.
     *
     * @throws MetricsEngineException CONFLICT when the name exists with another kind
     */
    public MetricDescriptor register(String name, MetricKind kind) {
        if (name == null || name.isBlank()) {
            throw MetricsEngineException.invalidArgument("Metric name must not be blank");
        }
        if (kind == null) {
            throw MetricsEngineException.invalidArgument("Metric kind is required for " + name);
        }
        MetricDescriptor created = MetricDescriptor.of(name, kind);
        MetricDescriptor existing = metrics.putIfAbsent(name, created);
        if (existing == null) {
            log.info("Registered metric name={} kind={}", name, kind);
            return created;
        }
        if (existing.kind() != kind) {
            throw MetricsEngineException.conflict(
                    "Metric '" + name + "' already exists as " + existing.kind() + ", cannot register as " + kind);
        }
        return existing;
    }

    public MetricDescriptor setAutoPrimaryTag(String metric, String key) {
        if (key == null || key.isBlank() || key.contains(":")) {
            throw MetricsEngineException.invalidArgument("Auto primary tag key must be a non-blank tag key");
        }
        MetricDescriptor updated = metrics.computeIfPresent(metric, (name, current) -> current.withAutoPrimaryTagKey(key));
        if (updated == null) {
            throw notFound(metric);
        }
        log.info("Auto primary tag set metric={} key={}", metric, key);
        return updated;
    }

    public MetricDescriptor lookup(String name) {
        MetricDescriptor descriptor = name == null ? null : metrics.get(name);
        if (descriptor == null) {
            throw notFound(name);
        }
        return descriptor;
    }

    public List<MetricDescriptor> list() {
        return metrics.values().stream()
                .sorted(Comparator.comparing(MetricDescriptor::name))
                .toList();
    }

    private static MetricsEngineException notFound(String name) {
        return MetricsEngineException.notFound("Metric '" + name + "' not found");
    }
}
