package com.metricore.service.core.api;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.model.MetricDescriptor;
import com.metricore.metric.model.MetricKind;
import com.metricore.metric.model.Point;
import com.metricore.metric.model.QueryResult;
import com.metricore.service.core.catalog.MetricCatalog;
import com.metricore.service.core.config.MetricoreProperties;
import com.metricore.service.core.query.ExpressionQueryRequest;
import com.metricore.service.core.query.LegacyQueryRequest;
import com.metricore.service.core.query.QueryExecutor;
import com.metricore.service.core.query.QueryPlanner;
import com.metricore.service.core.store.IngestContext;
import com.metricore.service.core.store.PointStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Transport-agnostic entry point of the engine. */
@Service
@RequiredArgsConstructor
public class MetricsEngine {

    private final MetricCatalog catalog;
    private final PointStore store;
    private final QueryPlanner planner;
    private final QueryExecutor executor;
    private final MetricoreProperties properties;

    public MetricDescriptor registerMetric(String name, MetricKind kind) {
        return catalog.register(name, kind);
    }

    public MetricDescriptor setAutoPrimaryTag(String metric, String key) {
        return catalog.setAutoPrimaryTag(metric, key);
    }

    /**
     * Inserts a batch into a metric of the given kind.
     *
     * @param source identity of the inserting party, {@code null} for the configured default
     * @throws MetricsEngineException NOT_FOUND for an unknown metric, INVALID_ARGUMENT when the
     *     metric is registered with another kind
     */
    public int insertBatch(MetricKind kind, String metric, List<Point> points, String source) {
        MetricDescriptor descriptor = catalog.lookup(metric);
        if (descriptor.kind() != kind) {
            throw MetricsEngineException.invalidArgument(
                    "Metric '" + metric + "' is a " + descriptor.kind() + ", not a " + kind);
        }
        String identity = source == null || source.isBlank() ? properties.getIngest().getDefaultSource() : source;
        return store.insertBatch(metric, points, IngestContext.of(identity));
    }

    public QueryResult legacyQuery(LegacyQueryRequest request) {
        return expressionQuery(request.toExpressionRequest());
    }

    public QueryResult expressionQuery(ExpressionQueryRequest request) {
        return executor.execute(request.timeout(), deadline -> planner.execute(request, deadline));
    }

    public List<MetricDescriptor> listMetrics() {
        return catalog.list();
    }

    public int size(String metric) {
        return store.size(metric);
    }
}
