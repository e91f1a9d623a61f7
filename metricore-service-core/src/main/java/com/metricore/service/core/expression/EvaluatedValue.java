package com.metricore.service.core.expression;

import com.metricore.metric.model.LabeledSeries;
import com.metricore.metric.model.QueryResult;
import com.metricore.metric.model.SeriesPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/** Intermediate result of evaluating an expression node. */
public sealed interface EvaluatedValue
        permits EvaluatedValue.Scalar, EvaluatedValue.Single, EvaluatedValue.Grouped {

    /** Constant without timestamps of its own; empty when the constant arithmetic was undefined. */
    record Scalar(OptionalDouble value) implements EvaluatedValue {}

    record Single(List<SeriesPoint> points) implements EvaluatedValue {
        public Single {
            points = List.copyOf(points);
        }
    }

    record Grouped(List<LabeledSeries> groups) implements EvaluatedValue {
        public Grouped {
            groups = List.copyOf(groups);
        }

        public List<String> labels() {
            List<String> labels = new ArrayList<>(groups.size());
            for (LabeledSeries series : groups) {
                labels.add(series.label());
            }
            return labels;
        }
    }

    /** Scalars carry no timestamps, so a constant-only tree answers with an empty series. */
    default QueryResult toResult() {
        if (this instanceof Grouped grouped) {
            return new QueryResult.Grouped(grouped.groups());
        } else if (this instanceof Single single) {
            return new QueryResult.Ungrouped(single.points());
        }
        return QueryResult.empty();
    }
}
