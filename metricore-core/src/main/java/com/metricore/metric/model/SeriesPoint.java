package com.metricore.metric.model;

/** One {@code (timestamp, value)} entry of a derived series. */
public record SeriesPoint(double timestamp, double value) {}
