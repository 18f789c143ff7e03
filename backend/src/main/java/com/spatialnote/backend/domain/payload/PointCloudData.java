package com.spatialnote.backend.domain.payload;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PointCloudData(
        String title,
        String xAxisLabel,
        String yAxisLabel,
        String zAxisLabel,
        String demoType,
        Map<String, Double> parameters,
        int totalPoints,
        List<Point> points
) {
    public PointCloudData {
        title = title != null ? title : "Point Cloud Data";
        xAxisLabel = xAxisLabel != null ? xAxisLabel : "X";
        yAxisLabel = yAxisLabel != null ? yAxisLabel : "Y";
        zAxisLabel = zAxisLabel != null ? zAxisLabel : "Z";
        demoType = demoType != null ? demoType : "custom";
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
        points = points != null ? List.copyOf(points) : List.of();
        if (totalPoints <= 0) totalPoints = points.size();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Point(double x, double y, double z, Double intensity, String color) {
        public Point(double x, double y, double z) {
            this(x, y, z, null, null);
        }
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public boolean hasIntensity() {
        return points.stream().anyMatch(p -> p.intensity() != null);
    }
}
