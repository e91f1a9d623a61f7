package com.metricore.service.core.aggregate;

import com.metricore.metric.expression.Aggregation;
import java.util.Arrays;

/** Accumulates the values of one window and reduces them to a single number. */
interface BucketReducer {

    void accept(double value);

    double result();

    static BucketReducer forAggregation(Aggregation aggregation) {
        if (aggregation instanceof Aggregation.Average) {
            return new Mean();
        } else if (aggregation instanceof Aggregation.Sum) {
            return new Total();
        } else if (aggregation instanceof Aggregation.Min) {
            return new Extreme(true);
        } else if (aggregation instanceof Aggregation.Max) {
            return new Extreme(false);
        } else if (aggregation instanceof Aggregation.Count) {
            return new Counting();
        } else if (aggregation instanceof Aggregation.Percentile percentile) {
            return new Ranked(percentile.percentile());
        }
        throw new IllegalStateException("Unhandled aggregation " + aggregation);
    }

    /** Mean kept within [min, max] so rounding never lets it escape the observed range. */
    final class Mean implements BucketReducer {
        private double sum;
        private long count;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;

        @Override
        public void accept(double value) {
            sum += value;
            count++;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        @Override
        public double result() {
            double mean = sum / count;
            return Math.max(min, Math.min(max, mean));
        }
    }

    final class Total implements BucketReducer {
        private double sum;

        @Override
        public void accept(double value) {
            sum += value;
        }

        @Override
        public double result() {
            return sum;
        }
    }

    final class Extreme implements BucketReducer {
        private final boolean minimum;
        private double current;

        Extreme(boolean minimum) {
            this.minimum = minimum;
            this.current = minimum ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        }

        @Override
        public void accept(double value) {
            current = minimum ? Math.min(current, value) : Math.max(current, value);
        }

        @Override
        public double result() {
            return current;
        }
    }

    final class Counting implements BucketReducer {
        private long count;

        @Override
        public void accept(double value) {
            count++;
        }

        @Override
        public double result() {
            return count;
        }
    }

    final class Ranked implements BucketReducer {
        private final double percentile;
        private double[] values = new double[16];
        private int count;

        Ranked(double percentile) {
            this.percentile = percentile;
        }

        @Override
        public void accept(double value) {
            if (count == values.length) {
                values = Arrays.copyOf(values, count * 2);
            }
            values[count++] = value;
        }

        @Override
        public double result() {
            return PercentileCalculator.nearestRank(values, count, percentile);
        }
    }
}
