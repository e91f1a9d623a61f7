package com.metricore.metric.filter;

import java.util.Objects;

/** Predicate applied to every output point after aggregation and evaluation. */
public sealed interface FilterExpression
        permits FilterExpression.Compare, FilterExpression.And, FilterExpression.Or {

    static FilterExpression compare(CompareOperation operation, TransformExpression left, TransformExpression right) {
        return new Compare(operation, left, right);
    }

    record Compare(CompareOperation operation, TransformExpression left, TransformExpression right)
            implements FilterExpression {
        public Compare {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record And(FilterExpression left, FilterExpression right) implements FilterExpression {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Or(FilterExpression left, FilterExpression right) implements FilterExpression {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }
}
