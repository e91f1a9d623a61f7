package com.metricore.service.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.metricore.metric.error.ErrorKind;
import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.expression.Aggregation;
import com.metricore.metric.expression.ArithmeticOperation;
import com.metricore.metric.expression.Expression;
import com.metricore.metric.expression.MetricFunction;
import com.metricore.metric.expression.MetricQuery;
import com.metricore.metric.model.LabeledSeries;
import com.metricore.metric.model.QueryResult;
import com.metricore.metric.model.SeriesPoint;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {

    private static final Expression.MetricRef USED = Expression.MetricRef.of("used_memory", Aggregation.AVERAGE);
    private static final Expression.MetricRef TOTAL = Expression.MetricRef.of("total_memory", Aggregation.AVERAGE);
    private static final Expression.MetricRef SWITCHES =
            new Expression.MetricRef("context_switches", Aggregation.COUNT, MetricQuery.groupedBy("host"));
    private static final Expression.MetricRef CPU =
            new Expression.MetricRef("cpu_usage", Aggregation.AVERAGE, MetricQuery.groupedBy("host"));

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    @Test
    void divideJoinsOnTimestampAndDropsZeroDenominators() {
        Map<Expression.MetricRef, EvaluatedValue> refs = Map.of(
                USED, single(new SeriesPoint(0, 4), new SeriesPoint(10, 6), new SeriesPoint(20, 1)),
                TOTAL, single(new SeriesPoint(0, 8), new SeriesPoint(10, 0), new SeriesPoint(30, 2)));

        EvaluatedValue result =
                evaluator.evaluate(new Expression.Arithmetic(ArithmeticOperation.DIVIDE, USED, TOTAL), refs);

        assertThat(result).isEqualTo(single(new SeriesPoint(0, 0.5)));
    }

    @Test
    void scalarBroadcastsAcrossGroups() {
        Map<Expression.MetricRef, EvaluatedValue> refs = Map.of(
                SWITCHES,
                grouped(
                        new LabeledSeries("a", List.of(new SeriesPoint(0, 10))),
                        new LabeledSeries("b", List.of(new SeriesPoint(0, 20), new SeriesPoint(10, 30)))));

        EvaluatedValue result = evaluator.evaluate(
                new Expression.Arithmetic(ArithmeticOperation.MULTIPLY, SWITCHES, new Expression.Value(0.5)), refs);

        assertThat(result)
                .isEqualTo(grouped(
                        new LabeledSeries("a", List.of(new SeriesPoint(0, 5))),
                        new LabeledSeries("b", List.of(new SeriesPoint(0, 10), new SeriesPoint(10, 15)))));
    }

    @Test
    void ungroupedSeriesBroadcastsAcrossGroups() {
        Map<Expression.MetricRef, EvaluatedValue> refs = Map.of(
                SWITCHES, grouped(new LabeledSeries("a", List.of(new SeriesPoint(0, 10), new SeriesPoint(10, 12)))),
                TOTAL, single(new SeriesPoint(10, 2)));

        EvaluatedValue result =
                evaluator.evaluate(new Expression.Arithmetic(ArithmeticOperation.SUBTRACT, SWITCHES, TOTAL), refs);

        assertThat(result).isEqualTo(grouped(new LabeledSeries("a", List.of(new SeriesPoint(10, 10)))));
    }

    @Test
    void groupedOperandsWithSameLabelsCombinePerGroup() {
        Map<Expression.MetricRef, EvaluatedValue> refs = Map.of(
                SWITCHES,
                grouped(
                        new LabeledSeries("a", List.of(new SeriesPoint(0, 10))),
                        new LabeledSeries("b", List.of(new SeriesPoint(0, 20)))),
                CPU,
                grouped(
                        new LabeledSeries("b", List.of(new SeriesPoint(0, 2))),
                        new LabeledSeries("a", List.of(new SeriesPoint(0, 5)))));

        EvaluatedValue result =
                evaluator.evaluate(new Expression.Arithmetic(ArithmeticOperation.DIVIDE, SWITCHES, CPU), refs);

        assertThat(result)
                .isEqualTo(grouped(
                        new LabeledSeries("a", List.of(new SeriesPoint(0, 2))),
                        new LabeledSeries("b", List.of(new SeriesPoint(0, 10)))));
    }

    @Test
    void groupedOperandsWithDifferentLabelsAreRejected() {
        Map<Expression.MetricRef, EvaluatedValue> refs = Map.of(
                SWITCHES, grouped(new LabeledSeries("a", List.of(new SeriesPoint(0, 1)))),
                CPU, grouped(new LabeledSeries("b", List.of(new SeriesPoint(0, 1)))));

        assertThatThrownBy(() ->
                        evaluator.evaluate(new Expression.Arithmetic(ArithmeticOperation.ADD, SWITCHES, CPU), refs))
                .isInstanceOf(MetricsEngineException.class)
                .extracting(ex -> ((MetricsEngineException) ex).getKind())
                .isEqualTo(ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void constantOnlyTreeYieldsEmptySeries() {
        EvaluatedValue result = evaluator.evaluate(
                new Expression.Arithmetic(ArithmeticOperation.ADD, new Expression.Value(1), new Expression.Value(2)),
                Map.of());

        assertThat(result.toResult()).isEqualTo(new QueryResult.Ungrouped(List.of()));
    }

    @Test
    void functionsDropOutOfDomainBuckets() {
        Map<Expression.MetricRef, EvaluatedValue> refs =
                Map.of(USED, single(new SeriesPoint(0, 9), new SeriesPoint(10, -4)));

        EvaluatedValue result =
                evaluator.evaluate(new Expression.FunctionCall(MetricFunction.SQRT, List.of(USED)), refs);

        assertThat(result).isEqualTo(single(new SeriesPoint(0, 3)));
    }

    @Test
    void binaryFunctionCombinesSeriesAndConstant() {
        Map<Expression.MetricRef, EvaluatedValue> refs =
                Map.of(USED, single(new SeriesPoint(0, 3), new SeriesPoint(10, 0.5)));

        EvaluatedValue result = evaluator.evaluate(
                new Expression.FunctionCall(MetricFunction.MAX, List.of(USED, new Expression.Value(1))), refs);

        assertThat(result).isEqualTo(single(new SeriesPoint(0, 3), new SeriesPoint(10, 1)));
    }

    @Test
    void functionArityIsChecked() {
        assertThatThrownBy(() -> evaluator.evaluate(
                        new Expression.FunctionCall(MetricFunction.POWER, List.of(new Expression.Value(2))), Map.of()))
                .isInstanceOf(MetricsEngineException.class)
                .hasMessageContaining("Power expects 2");
    }

    private static EvaluatedValue single(SeriesPoint... points) {
        return new EvaluatedValue.Single(List.of(points));
    }

    private static EvaluatedValue grouped(LabeledSeries... groups) {
        return new EvaluatedValue.Grouped(List.of(groups));
    }
}
