package com.metricore.service.core.expression;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.expression.Expression;
import com.metricore.metric.model.LabeledSeries;
import com.metricore.metric.model.SeriesPoint;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Evaluates an expression tree over pre-aggregated metric references.
 *
 * <p>Operands combine by inner join on bucket timestamp. Scalars and ungrouped series broadcast
 * across groups; two grouped operands must carry the same label set. A bucket whose combined value
 * is undefined (division by zero, outside a function's domain) is dropped.
 */
@Component
public class ExpressionEvaluator {

    public EvaluatedValue evaluate(Expression expression, Map<Expression.MetricRef, EvaluatedValue> references) {
        if (expression instanceof Expression.MetricRef ref) {
            EvaluatedValue value = references.get(ref);
            if (value == null) {
                throw new IllegalStateException("Metric reference was not aggregated: " + ref.metric());
            }
            return value;
        } else if (expression instanceof Expression.Value value) {
            double constant = value.constant();
            return new EvaluatedValue.Scalar(Double.isFinite(constant) ? OptionalDouble.of(constant) : OptionalDouble.empty());
        } else if (expression instanceof Expression.Arithmetic arithmetic) {
            List<EvaluatedValue> operands =
                    List.of(evaluate(arithmetic.left(), references), evaluate(arithmetic.right(), references));
            return combine(operands, values -> arithmetic.operation().apply(values[0], values[1]));
        } else if (expression instanceof Expression.FunctionCall call) {
            call.function().checkArity(call.arguments().size());
            List<EvaluatedValue> operands = new ArrayList<>(call.arguments().size());
            for (Expression argument : call.arguments()) {
                operands.add(evaluate(argument, references));
            }
            return combine(operands, values -> call.function().apply(values));
        }
        throw MetricsEngineException.invalidArgument("Unsupported expression " + expression);
    }

    EvaluatedValue combine(List<EvaluatedValue> operands, Function<double[], OptionalDouble> operation) {
        EvaluatedValue.Grouped shape = null;
        boolean anySeries = false;
        for (EvaluatedValue operand : operands) {
            if (operand instanceof EvaluatedValue.Grouped grouped) {
                if (shape == null) {
                    shape = grouped;
                } else if (!new HashSet<>(shape.labels()).equals(new HashSet<>(grouped.labels()))) {
                    throw MetricsEngineException.invalidArgument(
                            "Grouped operands have different groups: " + shape.labels() + " vs " + grouped.labels());
                }
            } else if (operand instanceof EvaluatedValue.Single) {
                anySeries = true;
            }
        }

        if (shape != null) {
            List<LabeledSeries> groups = new ArrayList<>(shape.groups().size());
            for (String label : shape.labels()) {
                List<List<SeriesPoint>> series = new ArrayList<>(operands.size());
                for (EvaluatedValue operand : operands) {
                    series.add(seriesFor(operand, label));
                }
                groups.add(new LabeledSeries(label, join(operands, series, operation)));
            }
            return new EvaluatedValue.Grouped(groups);
        }
        if (anySeries) {
            List<List<SeriesPoint>> series = new ArrayList<>(operands.size());
            for (EvaluatedValue operand : operands) {
                series.add(seriesFor(operand, null));
            }
            return new EvaluatedValue.Single(join(operands, series, operation));
        }

        double[] values = new double[operands.size()];
        for (int i = 0; i < values.length; i++) {
            OptionalDouble value = ((EvaluatedValue.Scalar) operands.get(i)).value();
            if (value.isEmpty()) {
                return new EvaluatedValue.Scalar(OptionalDouble.empty());
            }
            values[i] = value.getAsDouble();
        }
        return new EvaluatedValue.Scalar(operation.apply(values));
    }

    // null for scalar operands
    private static List<SeriesPoint> seriesFor(EvaluatedValue operand, String label) {
        if (operand instanceof EvaluatedValue.Single single) {
            return single.points();
        } else if (operand instanceof EvaluatedValue.Grouped grouped) {
            for (LabeledSeries series : grouped.groups()) {
                if (series.label().equals(label)) {
                    return series.points();
                }
            }
            return List.of();
        }
        return null;
    }

    private static List<SeriesPoint> join(
            List<EvaluatedValue> operands,
            List<List<SeriesPoint>> series,
            Function<double[], OptionalDouble> operation) {
        int arity = operands.size();
        double[] constants = new double[arity];
        List<SeriesPoint> driver = null;
        List<Map<Double, Double>> lookups = new ArrayList<>(arity);
        for (int i = 0; i < arity; i++) {
            List<SeriesPoint> points = series.get(i);
            if (points == null) {
                OptionalDouble constant = ((EvaluatedValue.Scalar) operands.get(i)).value();
                if (constant.isEmpty()) {
                    return List.of();
                }
                constants[i] = constant.getAsDouble();
                lookups.add(null);
            } else {
                if (driver == null) {
                    driver = points;
                }
                lookups.add(byTimestamp(points));
            }
        }

        List<SeriesPoint> joined = new ArrayList<>();
        for (SeriesPoint point : driver) {
            double[] values = new double[arity];
            boolean complete = true;
            for (int i = 0; i < arity && complete; i++) {
                Map<Double, Double> lookup = lookups.get(i);
                if (lookup == null) {
                    values[i] = constants[i];
                } else {
                    Double value = lookup.get(point.timestamp());
                    if (value == null) {
                        complete = false;
                    } else {
                        values[i] = value;
                    }
                }
            }
            if (complete) {
                OptionalDouble result = operation.apply(values);
                if (result.isPresent()) {
                    joined.add(new SeriesPoint(point.timestamp(), result.getAsDouble()));
                }
            }
        }
        return joined;
    }

    private static Map<Double, Double> byTimestamp(List<SeriesPoint> points) {
        Map<Double, Double> lookup = new HashMap<>(points.size() * 2);
        for (SeriesPoint point : points) {
            lookup.put(point.timestamp(), point.value());
        }
        return lookup;
    }
}
