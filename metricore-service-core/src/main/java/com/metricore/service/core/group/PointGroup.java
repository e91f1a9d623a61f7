package com.metricore.service.core.group;

import com.metricore.metric.model.Point;
import java.util.List;

/** Points sharing one group label; the label is {@code null} for the implicit group of an ungrouped query. */
public record PointGroup(String label, List<Point> points) {

    public PointGroup {
        points = List.copyOf(points);
    }
}
