package com.metricore.service.core.store;

/**
 * Ordering key of a stored point: timestamp first, then the per-metric insertion sequence so equal
 * timestamps keep their insertion order.
 */
record PointKey(double timestamp, long sequence) implements Comparable<PointKey> {

    PointKey {
        timestamp = normalize(timestamp);
    }

    /** Smallest key at {@code timestamp}; usable as an inclusive lower or exclusive upper bound. */
    static PointKey lowerBound(double timestamp) {
        return new PointKey(timestamp, Long.MIN_VALUE);
    }

    @Override
    public int compareTo(PointKey other) {
        int byTime = Double.compare(timestamp, other.timestamp);
        return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
    }

    // Double.compare orders -0.0 before 0.0
    private static double normalize(double timestamp) {
        return timestamp == 0.0d ? 0.0d : timestamp;
    }
}
