package com.metricore.service.core.aggregate;

import com.metricore.metric.error.MetricsEngineException;
import java.util.Arrays;

/** Nearest-rank percentile over an unsorted sample. */
public final class PercentileCalculator {

    private PercentileCalculator() {}

    /**
     * Returns the value at index {@code ceil(p / 100 * n) - 1} of the ascending sample, clamped to
     * {@code [0, n - 1]}.
     */
    public static double nearestRank(double[] values, int count, double percentile) {
        if (!(percentile >= 0.0d && percentile <= 100.0d)) {
            throw MetricsEngineException.invalidArgument("Percentile must be within [0, 100], got " + percentile);
        }
        if (count <= 0) {
            throw new IllegalArgumentException("Percentile of an empty sample is undefined");
        }
        double[] sorted = Arrays.copyOf(values, count);
        Arrays.sort(sorted);
        int index = (int) Math.ceil(percentile * count / 100.0d) - 1;
        index = Math.max(0, Math.min(count - 1, index));
        return sorted[index];
    }
}
