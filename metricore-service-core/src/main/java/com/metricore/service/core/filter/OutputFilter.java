package com.metricore.service.core.filter;

import com.metricore.metric.filter.FilterExpression;
import com.metricore.metric.filter.TransformExpression;
import com.metricore.metric.model.LabeledSeries;
import com.metricore.metric.model.QueryResult;
import com.metricore.metric.model.SeriesPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * Keeps the output points for which a filter predicate holds. A transform that is undefined for a
 * point (division by zero, outside a function's domain) makes the comparison false.
 */
@Component
public class OutputFilter {

    public QueryResult apply(FilterExpression filter, QueryResult result) {
        if (filter == null) {
            return result;
        }
        if (result instanceof QueryResult.Ungrouped ungrouped) {
            return new QueryResult.Ungrouped(apply(filter, ungrouped.points()));
        }
        QueryResult.Grouped grouped = (QueryResult.Grouped) result;
        List<LabeledSeries> groups = new ArrayList<>(grouped.groups().size());
        for (LabeledSeries series : grouped.groups()) {
            groups.add(new LabeledSeries(series.label(), apply(filter, series.points())));
        }
        return new QueryResult.Grouped(groups);
    }

    public List<SeriesPoint> apply(FilterExpression filter, List<SeriesPoint> points) {
        if (filter == null) {
            return points;
        }
        List<SeriesPoint> kept = new ArrayList<>(points.size());
        for (SeriesPoint point : points) {
            if (test(filter, point.value())) {
                kept.add(point);
            }
        }
        return kept;
    }

    public boolean test(FilterExpression filter, double input) {
        if (filter instanceof FilterExpression.Compare compare) {
            OptionalDouble left = evaluate(compare.left(), input);
            OptionalDouble right = evaluate(compare.right(), input);
            return left.isPresent()
                    && right.isPresent()
                    && compare.operation().test(left.getAsDouble(), right.getAsDouble());
        } else if (filter instanceof FilterExpression.And and) {
            return test(and.left(), input) && test(and.right(), input);
        } else if (filter instanceof FilterExpression.Or or) {
            return test(or.left(), input) || test(or.right(), input);
        }
        throw new IllegalStateException("Unhandled filter " + filter);
    }

    public OptionalDouble evaluate(TransformExpression transform, double input) {
        if (transform instanceof TransformExpression.InputValue) {
            return OptionalDouble.of(input);
        } else if (transform instanceof TransformExpression.Value value) {
            return OptionalDouble.of(value.constant());
        } else if (transform instanceof TransformExpression.Arithmetic arithmetic) {
            OptionalDouble left = evaluate(arithmetic.left(), input);
            OptionalDouble right = evaluate(arithmetic.right(), input);
            if (left.isEmpty() || right.isEmpty()) {
                return OptionalDouble.empty();
            }
            return arithmetic.operation().apply(left.getAsDouble(), right.getAsDouble());
        } else if (transform instanceof TransformExpression.Function function) {
            double[] arguments = new double[function.arguments().size()];
            for (int i = 0; i < arguments.length; i++) {
                OptionalDouble argument = evaluate(function.arguments().get(i), input);
                if (argument.isEmpty()) {
                    return OptionalDouble.empty();
                }
                arguments[i] = argument.getAsDouble();
            }
            return function.function().apply(arguments);
        }
        throw new IllegalStateException("Unhandled transform " + transform);
    }
}
