package com.metricore.service.core.filter;

import static org.assertj.core.api.Assertions.assertThat;

import com.metricore.metric.expression.ArithmeticOperation;
import com.metricore.metric.expression.MetricFunction;
import com.metricore.metric.filter.CompareOperation;
import com.metricore.metric.filter.FilterExpression;
import com.metricore.metric.filter.TransformExpression;
import com.metricore.metric.model.LabeledSeries;
import com.metricore.metric.model.QueryResult;
import com.metricore.metric.model.SeriesPoint;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutputFilterTest {

    private static final FilterExpression ABOVE_07 = FilterExpression.compare(
            CompareOperation.GREATER_THAN, TransformExpression.INPUT_VALUE, TransformExpression.value(0.7));

    private final OutputFilter filter = new OutputFilter();

    @Test
    void keepsPointsMatchingComparison() {
        List<SeriesPoint> points = List.of(new SeriesPoint(0, 0.9), new SeriesPoint(10, 0.6), new SeriesPoint(20, 0.71));

        assertThat(filter.apply(ABOVE_07, points)).containsExactly(new SeriesPoint(0, 0.9), new SeriesPoint(20, 0.71));
    }

    @Test
    void absentFilterPassesEverything() {
        List<SeriesPoint> points = List.of(new SeriesPoint(0, 0.1));

        assertThat(filter.apply(null, points)).isEqualTo(points);
    }

    @Test
    void filtersEveryGroupIndependently() {
        QueryResult grouped = new QueryResult.Grouped(List.of(
                new LabeledSeries("a", List.of(new SeriesPoint(0, 0.9))),
                new LabeledSeries("b", List.of(new SeriesPoint(0, 0.1), new SeriesPoint(10, 0.8)))));

        assertThat(filter.apply(ABOVE_07, grouped))
                .isEqualTo(new QueryResult.Grouped(List.of(
                        new LabeledSeries("a", List.of(new SeriesPoint(0, 0.9))),
                        new LabeledSeries("b", List.of(new SeriesPoint(10, 0.8))))));
    }

    @Test
    void andOrCombinators() {
        FilterExpression below05 = FilterExpression.compare(
                CompareOperation.LESS_THAN, TransformExpression.INPUT_VALUE, TransformExpression.value(0.5));
        FilterExpression outside = new FilterExpression.Or(ABOVE_07, below05);
        FilterExpression never = new FilterExpression.And(ABOVE_07, below05);

        assertThat(filter.test(outside, 0.9)).isTrue();
        assertThat(filter.test(outside, 0.6)).isFalse();
        assertThat(filter.test(outside, 0.1)).isTrue();
        assertThat(filter.test(never, 0.9)).isFalse();
    }

    @Test
    void transformsOverInputValue() {
        TransformExpression squared = new TransformExpression.Arithmetic(
                ArithmeticOperation.MULTIPLY, TransformExpression.INPUT_VALUE, TransformExpression.INPUT_VALUE);
        FilterExpression squareAbove4 = FilterExpression.compare(
                CompareOperation.GREATER_THAN_OR_EQUAL, squared, TransformExpression.value(4));

        assertThat(filter.test(squareAbove4, -2)).isTrue();
        assertThat(filter.test(squareAbove4, 1.5)).isFalse();
    }

    @Test
    void undefinedTransformMakesComparisonFalse() {
        TransformExpression inverse = new TransformExpression.Arithmetic(
                ArithmeticOperation.DIVIDE, TransformExpression.value(1), TransformExpression.INPUT_VALUE);
        FilterExpression notEqual = FilterExpression.compare(
                CompareOperation.NOT_EQUAL, inverse, TransformExpression.value(3));
        TransformExpression log = new TransformExpression.Function(MetricFunction.LOG_E, List.of(TransformExpression.INPUT_VALUE));
        FilterExpression logFilter =
                FilterExpression.compare(CompareOperation.LESS_THAN, log, TransformExpression.value(100));

        assertThat(filter.test(notEqual, 0)).isFalse();
        assertThat(filter.test(notEqual, 1)).isTrue();
        assertThat(filter.test(logFilter, -1)).isFalse();
    }
}
