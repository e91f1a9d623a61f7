package com.metricore.service.core.aggregate;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.expression.Aggregation;
import com.metricore.metric.model.Point;
import com.metricore.metric.model.SeriesPoint;
import com.metricore.metric.model.TimeRange;
import com.metricore.service.core.query.QueryDeadline;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Reduces points into fixed-width windows aligned to the range start. Window {@code i} covers
 * {@code [start + i*D, start + (i+1)*D)} and is reported at its start; windows without points are
 * omitted.
 */
@Component
public class WindowAggregator {

    // largest window index whose start is still exact in double arithmetic
    static final long MAX_WINDOWS = 1L << 53;

    private static final int MAX_INDEX_CORRECTION = 4;

    public List<SeriesPoint> aggregate(List<Point> points, TimeRange range, Double duration, Aggregation aggregation) {
        return aggregate(points, range, duration, aggregation, QueryDeadline.unbounded());
    }

    /**
     * @param duration window width in seconds, or {@code null} to reduce the whole range into one
     *     window
     */
    public List<SeriesPoint> aggregate(
            List<Point> points, TimeRange range, Double duration, Aggregation aggregation, QueryDeadline deadline) {
        validateDuration(duration);
        if (aggregation == null) {
            throw MetricsEngineException.invalidArgument("Aggregation is required");
        }
        if (range.isEmpty() || points.isEmpty()) {
            return List.of();
        }
        if (duration != null) {
            validateWindowCount(range, duration, aggregation);
        }
        double width = duration == null ? range.length() : duration;

        TreeMap<Long, BucketReducer> buckets = new TreeMap<>();
        for (Point point : points) {
            double timestamp = point.timestamp();
            if (!range.contains(timestamp)) {
                continue;
            }
            long index = bucketIndex(range.start(), width, timestamp);
            BucketReducer reducer = buckets.get(index);
            if (reducer == null) {
                deadline.check();
                reducer = BucketReducer.forAggregation(aggregation);
                buckets.put(index, reducer);
            }
            reducer.accept(point.value());
        }

        List<SeriesPoint> series = new ArrayList<>(buckets.size());
        for (Map.Entry<Long, BucketReducer> bucket : buckets.entrySet()) {
            series.add(new SeriesPoint(bucketStart(range.start(), width, bucket.getKey()), bucket.getValue().result()));
        }
        return series;
    }

    public static void validateDuration(Double duration) {
        if (duration != null && !(Double.isFinite(duration) && duration > 0.0d)) {
            throw MetricsEngineException.invalidArgument("Window duration must be positive, got " + duration);
        }
    }

    static void validateWindowCount(TimeRange range, double duration, Aggregation aggregation) {
        double resolution = Math.ulp(Math.max(Math.abs(range.start()), Math.abs(range.end())));
        if (range.length() / duration >= MAX_WINDOWS || duration < resolution) {
            throw MetricsEngineException.invalidArgument("Window duration " + duration + " is too fine for "
                    + aggregation.label() + " over [" + range.start() + ", " + range.end() + ")");
        }
    }

    static double bucketStart(double start, double width, long index) {
        return start + index * width;
    }

    // floor((t - start) / width) corrected against the bucket bounds as computed for reporting
    static long bucketIndex(double start, double width, double timestamp) {
        long index = (long) Math.floor((timestamp - start) / width);
        for (int i = 0; i < MAX_INDEX_CORRECTION && index > 0 && bucketStart(start, width, index) > timestamp; i++) {
            index--;
        }
        for (int i = 0; i < MAX_INDEX_CORRECTION && bucketStart(start, width, index + 1) <= timestamp; i++) {
            index++;
        }
        return index;
    }
}
