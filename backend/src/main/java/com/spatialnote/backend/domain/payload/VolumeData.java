package com.spatialnote.backend.domain.payload;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Named scalar metrics shown in a volumetric window. */
public record VolumeData(
        String title,
        String category,
        Map<String, Double> metrics,
        String unit,
        Instant timestamp
) {
    public VolumeData {
        title = title != null ? title : "Volume Metrics";
        category = category != null ? category : "performance";
        metrics = metrics != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metrics)) : Map.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }
}
