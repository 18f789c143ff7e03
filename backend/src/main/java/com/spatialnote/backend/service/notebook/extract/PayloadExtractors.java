package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.WindowType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/** Picks the extractor for a window type. */
@Component
public class PayloadExtractors {

    private final Map<WindowType, PayloadExtractor> byType = new EnumMap<>(WindowType.class);

    public PayloadExtractors() {
        PointCloudExtractor pointClouds = new PointCloudExtractor();
        byType.put(WindowType.CHARTS, new ChartExtractor());
        byType.put(WindowType.COLUMN, new DataFrameExtractor());
        byType.put(WindowType.VOLUME, new VolumeExtractor());
        byType.put(WindowType.MODEL_3D, new Model3DExtractor());
        byType.put(WindowType.POINT_CLOUD, pointClouds);
        byType.put(WindowType.SPATIAL, pointClouds);
    }

    public boolean extract(WindowType type, String source, WindowState target) {
        PayloadExtractor extractor = byType.get(type);
        return extractor != null && extractor.extract(source, target);
    }
}
