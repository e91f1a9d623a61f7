package com.metricore.service.core.aggregate;

import com.metricore.metric.expression.Expression;
import com.metricore.metric.expression.MetricQuery;
import com.metricore.metric.model.LabeledSeries;
import com.metricore.metric.model.Point;
import com.metricore.metric.model.SeriesPoint;
import com.metricore.metric.model.TimeRange;
import com.metricore.service.core.expression.EvaluatedValue;
import com.metricore.service.core.filter.OutputFilter;
import com.metricore.service.core.group.GroupPartitioner;
import com.metricore.service.core.group.PointGroup;
import com.metricore.service.core.query.QueryDeadline;
import com.metricore.service.core.store.PointStore;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Scans, partitions and window-aggregates the series of one metric reference. */
@Component
@RequiredArgsConstructor
public class ReferenceAggregator {

    private final PointStore store;
    private final GroupPartitioner partitioner;
    private final WindowAggregator aggregator;
    private final OutputFilter outputFilter;

    public EvaluatedValue aggregate(Expression.MetricRef ref, TimeRange range, Double duration, QueryDeadline deadline) {
        MetricQuery query = ref.query();
        List<Point> points = store.scan(ref.metric(), range, query.tags(), deadline);

        if (!query.grouped()) {
            List<SeriesPoint> series = aggregator.aggregate(points, range, duration, ref.aggregation(), deadline);
            return new EvaluatedValue.Single(outputFilter.apply(query.outputFilter(), series));
        }

        List<PointGroup> groups = partitioner.partition(points, query.groupBy());
        List<LabeledSeries> labeled = new ArrayList<>(groups.size());
        for (PointGroup group : groups) {
            List<SeriesPoint> series =
                    aggregator.aggregate(group.points(), range, duration, ref.aggregation(), deadline);
            labeled.add(new LabeledSeries(group.label(), outputFilter.apply(query.outputFilter(), series)));
        }
        return new EvaluatedValue.Grouped(labeled);
    }
}
