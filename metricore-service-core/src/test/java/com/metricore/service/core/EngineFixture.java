package com.metricore.service.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricore.service.core.aggregate.ReferenceAggregator;
import com.metricore.service.core.aggregate.WindowAggregator;
import com.metricore.service.core.api.MetricsEngine;
import com.metricore.service.core.api.MetricsRequestHandler;
import com.metricore.service.core.api.RequestDecoder;
import com.metricore.service.core.api.ResponseEncoder;
import com.metricore.service.core.catalog.MetricCatalog;
import com.metricore.service.core.config.MetricoreProperties;
import com.metricore.service.core.expression.ExpressionEvaluator;
import com.metricore.service.core.filter.OutputFilter;
import com.metricore.service.core.group.GroupPartitioner;
import com.metricore.service.core.query.QueryExecutor;
import com.metricore.service.core.query.QueryExecutorAccess;
import com.metricore.service.core.query.QueryPlanner;
import com.metricore.service.core.store.PointStore;
import java.time.Clock;

/** Engine wired by hand, without a Spring context. */
public final class EngineFixture {

    public final MetricoreProperties properties = new MetricoreProperties();
    public final MetricCatalog catalog = new MetricCatalog();
    public final PointStore store = new PointStore(catalog);
    public final OutputFilter outputFilter = new OutputFilter();
    public final ReferenceAggregator referenceAggregator =
            new ReferenceAggregator(store, new GroupPartitioner(), new WindowAggregator(), outputFilter);
    public final QueryPlanner planner =
            new QueryPlanner(catalog, referenceAggregator, new ExpressionEvaluator(), outputFilter);
    public final QueryExecutor executor = new QueryExecutor(properties, Clock.systemUTC());
    public final MetricsEngine engine = new MetricsEngine(catalog, store, planner, executor, properties);
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final MetricsRequestHandler handler =
            new MetricsRequestHandler(engine, new RequestDecoder(objectMapper), new ResponseEncoder(objectMapper));

    public EngineFixture() {
        QueryExecutorAccess.start(executor, 2);
    }

    public void close() {
        QueryExecutorAccess.stop(executor);
    }
}
