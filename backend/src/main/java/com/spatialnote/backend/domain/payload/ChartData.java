package com.spatialnote.backend.domain.payload;

import java.util.List;

public record ChartData(
        String title,
        String chartType,   // line | scatter | bar | area
        String xLabel,
        String yLabel,
        List<Double> xData,
        List<Double> yData,
        String color,
        String style
) {
    public ChartData {
        title = title != null ? title : "Chart Data";
        chartType = chartType != null ? chartType : "line";
        xLabel = xLabel != null ? xLabel : "X";
        yLabel = yLabel != null ? yLabel : "Y";
        xData = xData != null ? List.copyOf(xData) : List.of();
        yData = yData != null ? List.copyOf(yData) : List.of();
    }

    public boolean isEmpty() {
        return xData.isEmpty() || yData.isEmpty();
    }
}
