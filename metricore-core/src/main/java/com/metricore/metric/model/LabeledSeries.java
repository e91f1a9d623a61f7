package com.metricore.metric.model;

import java.util.List;

/** Series belonging to one group of a grouped query. */
public record LabeledSeries(String label, List<SeriesPoint> points) {

    public LabeledSeries {
        points = List.copyOf(points);
    }
}
