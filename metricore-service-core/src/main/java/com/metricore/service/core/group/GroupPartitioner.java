package com.metricore.service.core.group;

import com.metricore.metric.model.Point;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Splits scanned points by the value of one tag key, keeping groups in first-seen order. */
@Component
public class GroupPartitioner {

    /** Label of the group collecting points that lack the grouping key. */
    public static final String UNGROUPED_LABEL = "ungrouped";

    public List<PointGroup> partition(List<Point> points, String groupBy) {
        if (groupBy == null) {
            return List.of(new PointGroup(null, points));
        }
        Map<String, List<Point>> groups = new LinkedHashMap<>();
        for (Point point : points) {
            String label = point.tagValue(groupBy).orElse(UNGROUPED_LABEL);
            groups.computeIfAbsent(label, ignored -> new ArrayList<>()).add(point);
        }
        List<PointGroup> result = new ArrayList<>(groups.size());
        groups.forEach((label, members) -> result.add(new PointGroup(label, members)));
        return result;
    }
}
