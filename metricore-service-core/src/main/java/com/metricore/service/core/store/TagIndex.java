package com.metricore.service.core.store;

import com.metricore.metric.model.Point;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Timestamp-ordered index of the points carrying one {@code key:value} tag. */
final class TagIndex {

    private final ConcurrentSkipListMap<PointKey, Point> points = new ConcurrentSkipListMap<>();
    private final AtomicInteger size = new AtomicInteger();

    void add(PointKey key, Point point) {
        points.put(key, point);
        size.incrementAndGet();
    }

    int size() {
        return size.get();
    }

    NavigableMap<PointKey, Point> range(PointKey from, PointKey to) {
        return points.subMap(from, true, to, false);
    }
}
