package com.metricore.service.core.store;

import com.metricore.metric.model.MetricDescriptor;
import com.metricore.metric.model.Point;
import com.metricore.metric.model.Tag;
import com.metricore.metric.model.TimeRange;
import com.metricore.service.core.catalog.MetricCatalog;
import com.metricore.service.core.query.QueryDeadline;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Append-only in-memory point storage, one partition per registered metric.
 *
 * <p>Appends to one metric are serialized; appends to different metrics run in parallel. Scans run
 * concurrently with appends: a scan sees every batch committed before it started and, once it has
 * seen a point, keeps seeing it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PointStore {

    private final MetricCatalog catalog;
    private final ConcurrentMap<String, MetricPartition> partitions = new ConcurrentHashMap<>();

    /**
     * Appends a batch. The batch is prepared in full (metric lookup, auto-primary tags) before any
     * point is written, so a rejected batch leaves the store untouched.
     *
     * @return number of points inserted
     */
    public int insertBatch(String metric, List<Point> points, IngestContext context) {
        MetricDescriptor descriptor = catalog.lookup(metric);
        List<Point> prepared = prepare(descriptor, points, context);
        if (prepared.isEmpty()) {
            return 0;
        }
        int inserted = partitions.computeIfAbsent(metric, ignored -> new MetricPartition()).append(prepared);
        log.debug("Inserted metric={} points={} source={}", metric, inserted, context.sourceIdentity());
        return inserted;
    }

    public List<Point> scan(String metric, TimeRange range, List<Tag> tagFilter) {
        return scan(metric, range, tagFilter, QueryDeadline.unbounded());
    }

    /** Points in {@code [start, end)} carrying every filter tag, ascending by timestamp. */
    public List<Point> scan(String metric, TimeRange range, List<Tag> tagFilter, QueryDeadline deadline) {
        catalog.lookup(metric);
        MetricPartition partition = partitions.get(metric);
        if (partition == null) {
            return List.of();
        }
        return partition.scan(range, tagFilter == null ? List.of() : tagFilter, deadline);
    }

    public int size(String metric) {
        catalog.lookup(metric);
        MetricPartition partition = partitions.get(metric);
        return partition == null ? 0 : partition.size();
    }

    private static List<Point> prepare(MetricDescriptor descriptor, List<Point> points, IngestContext context) {
        if (points == null || points.isEmpty()) {
            return List.of();
        }
        Optional<String> autoKey = descriptor.autoPrimaryTag();
        List<Point> prepared = new ArrayList<>(points.size());
        for (Point point : points) {
            if (autoKey.isPresent() && !point.tags().containsKey(autoKey.get())) {
                prepared.add(point.withTag(new Tag(autoKey.get(), context.sourceIdentity())));
            } else {
                prepared.add(point);
            }
        }
        return prepared;
    }
}
