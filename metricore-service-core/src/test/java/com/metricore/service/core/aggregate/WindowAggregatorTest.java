package com.metricore.service.core.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.metricore.metric.error.ErrorKind;
import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.expression.Aggregation;
import com.metricore.metric.model.Point;
import com.metricore.metric.model.SeriesPoint;
import com.metricore.metric.model.TimeRange;
import com.metricore.service.core.query.QueryDeadline;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class WindowAggregatorTest {

    private final WindowAggregator aggregator = new WindowAggregator();

    @Test
    void averagesPerWindowAlignedToStart() {
        List<Point> points = List.of(Point.of(3, 1), Point.of(4, 3), Point.of(14, 10));

        List<SeriesPoint> series = aggregator.aggregate(points, new TimeRange(3, 23), 10.0, Aggregation.AVERAGE);

        assertThat(series).containsExactly(new SeriesPoint(3, 2), new SeriesPoint(13, 10));
    }

    @Test
    void emptyWindowsAreOmitted() {
        List<Point> points = List.of(Point.of(0, 1), Point.of(35, 1));

        List<SeriesPoint> series = aggregator.aggregate(points, new TimeRange(0, 40), 10.0, Aggregation.COUNT);

        assertThat(series).extracting(SeriesPoint::timestamp).containsExactly(0.0, 30.0);
    }

    @Test
    void countBucketsAddUpToPointCount() {
        Random random = new Random(42);
        List<Point> points = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            points.add(Point.of(random.nextDouble() * 100, random.nextDouble()));
        }
        points.sort((a, b) -> Double.compare(a.timestamp(), b.timestamp()));

        List<SeriesPoint> series = aggregator.aggregate(points, new TimeRange(0, 100), 7.0, Aggregation.COUNT);

        assertThat(series.stream().mapToDouble(SeriesPoint::value).sum()).isEqualTo(500.0);
        assertThat(series).allSatisfy(bucket -> assertThat(bucket.value()).isPositive());
    }

    @Test
    void averageStaysWithinMinAndMax() {
        List<Point> points = List.of(Point.of(0, 0.1), Point.of(1, 0.1), Point.of(2, 0.1), Point.of(5, 0.7), Point.of(6, 0.2));
        TimeRange range = new TimeRange(0, 10);

        List<SeriesPoint> avg = aggregator.aggregate(points, range, 5.0, Aggregation.AVERAGE);
        List<SeriesPoint> min = aggregator.aggregate(points, range, 5.0, Aggregation.MIN);
        List<SeriesPoint> max = aggregator.aggregate(points, range, 5.0, Aggregation.MAX);

        for (int i = 0; i < avg.size(); i++) {
            assertThat(avg.get(i).value()).isBetween(min.get(i).value(), max.get(i).value());
        }
        assertThat(avg.get(0).value()).isEqualTo(0.1);
    }

    @Test
    void sumAndPercentile() {
        List<Point> points = List.of(Point.of(0, 4), Point.of(1, 1), Point.of(2, 3), Point.of(3, 2));
        TimeRange range = new TimeRange(0, 10);

        assertThat(aggregator.aggregate(points, range, 10.0, Aggregation.SUM)).containsExactly(new SeriesPoint(0, 10));
        assertThat(aggregator.aggregate(points, range, 10.0, Aggregation.percentile(50)))
                .containsExactly(new SeriesPoint(0, 2));
        assertThat(aggregator.aggregate(points, range, 10.0, Aggregation.percentile(100)))
                .containsExactly(new SeriesPoint(0, 4));
    }

    @Test
    void missingDurationReducesWholeRange() {
        List<Point> points = List.of(Point.of(1, 2), Point.of(50, 4));

        assertThat(aggregator.aggregate(points, new TimeRange(0, 100), null, Aggregation.AVERAGE))
                .containsExactly(new SeriesPoint(0, 3));
    }

    @Test
    void emptyRangeYieldsEmptySeries() {
        assertThat(aggregator.aggregate(List.of(Point.of(5, 1)), new TimeRange(5, 5), 1.0, Aggregation.COUNT))
                .isEmpty();
    }

    @Test
    void rejectsNonPositiveDuration() {
        TimeRange range = new TimeRange(0, 10);
        assertThatThrownBy(() -> aggregator.aggregate(List.of(), range, 0.0, Aggregation.COUNT))
                .isInstanceOf(MetricsEngineException.class);
        assertThatThrownBy(() -> aggregator.aggregate(List.of(), range, -1.0, Aggregation.COUNT))
                .isInstanceOf(MetricsEngineException.class);
        assertThatThrownBy(() -> aggregator.aggregate(List.of(), range, Double.NaN, Aggregation.COUNT))
                .isInstanceOf(MetricsEngineException.class);
    }

    @Test
    void rejectsDurationsYieldingTooManyWindows() {
        QueryDeadline deadline = QueryDeadline.after(Clock.systemUTC(), Duration.ofSeconds(2));

        assertThatThrownBy(() -> aggregator.aggregate(
                        List.of(Point.of(1.7e9, 1)), new TimeRange(0, 2e9), 1e-10, Aggregation.COUNT, deadline))
                .isInstanceOf(MetricsEngineException.class)
                .hasMessageContaining("too fine for Count")
                .extracting(ex -> ((MetricsEngineException) ex).getKind())
                .isEqualTo(ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void rejectsDurationsBelowTimestampResolution() {
        assertThatThrownBy(() -> aggregator.aggregate(
                        List.of(Point.of(1.7e9, 1)), new TimeRange(1.7e9, 1.7e9 + 1), 1e-9, Aggregation.SUM))
                .isInstanceOf(MetricsEngineException.class)
                .hasMessageContaining("too fine for Sum");
    }

    @Test
    void fractionalWidthsPlacePointsInTheRightWindow() {
        double[] timestamps = {0.3, 0.29999, 0.7, 1.1, 2.9};
        for (double timestamp : timestamps) {
            long index = WindowAggregator.bucketIndex(0.0, 0.1, timestamp);
            assertThat(WindowAggregator.bucketStart(0.0, 0.1, index)).isLessThanOrEqualTo(timestamp);
            assertThat(WindowAggregator.bucketStart(0.0, 0.1, index + 1)).isGreaterThan(timestamp);
        }
        assertThat(WindowAggregator.bucketIndex(1.0, 0.5, 1.0)).isZero();
    }

    @Test
    void expiredDeadlineStopsAggregation() {
        QueryDeadline deadline = QueryDeadline.after(Clock.systemUTC(), Duration.ofMinutes(1));
        deadline.cancel();

        assertThatThrownBy(() -> aggregator.aggregate(
                        List.of(Point.of(1, 1)), new TimeRange(0, 10), 1.0, Aggregation.COUNT, deadline))
                .isInstanceOf(MetricsEngineException.class)
                .hasMessageContaining("time budget");
    }
}
