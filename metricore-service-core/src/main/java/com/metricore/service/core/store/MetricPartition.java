package com.metricore.service.core.store;

import com.metricore.metric.model.Point;
import com.metricore.metric.model.Tag;
import com.metricore.metric.model.TimeRange;
import com.metricore.service.core.query.QueryDeadline;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Points of one metric. Writers are serialized by a per-partition lock; readers never lock and see
 * a weakly consistent view of the skip lists.
 */
final class MetricPartition {

    private static final int DEADLINE_CHECK_INTERVAL = 1024;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final ConcurrentSkipListMap<PointKey, Point> points = new ConcurrentSkipListMap<>();
    private final ConcurrentMap<Tag, TagIndex> tagIndexes = new ConcurrentHashMap<>();
    private long sequence; // guarded by writeLock

    int append(List<Point> batch) {
        writeLock.lock();
        try {
            for (Point point : batch) {
                PointKey key = new PointKey(point.timestamp(), sequence++);
                for (Map.Entry<String, String> tag : point.tags().entrySet()) {
                    tagIndexes
                            .computeIfAbsent(new Tag(tag.getKey(), tag.getValue()), ignored -> new TagIndex())
                            .add(key, point);
                }
                points.put(key, point);
            }
            return batch.size();
        } finally {
            writeLock.unlock();
        }
    }

    List<Point> scan(TimeRange range, List<Tag> filter, QueryDeadline deadline) {
        if (range.isEmpty()) {
            return List.of();
        }
        PointKey from = PointKey.lowerBound(range.start());
        PointKey to = PointKey.lowerBound(range.end());

        NavigableMap<PointKey, Point> source;
        if (filter.isEmpty()) {
            source = points.subMap(from, true, to, false);
        } else {
            TagIndex smallest = null;
            for (Tag tag : filter) {
                TagIndex index = tagIndexes.get(tag);
                if (index == null) {
                    return List.of();
                }
                if (smallest == null || index.size() < smallest.size()) {
                    smallest = index;
                }
            }
            source = smallest.range(from, to);
        }

        List<Point> result = new ArrayList<>();
        int visited = 0;
        for (Point point : source.values()) {
            if (++visited % DEADLINE_CHECK_INTERVAL == 0) {
                deadline.check();
            }
            if (matchesAll(point, filter)) {
                result.add(point);
            }
        }
        return result;
    }

    int size() {
        return points.size();
    }

    private static boolean matchesAll(Point point, List<Tag> filter) {
        for (Tag tag : filter) {
            if (!point.hasTag(tag)) {
                return false;
            }
        }
        return true;
    }
}
