package com.spatialnote.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Kinds of window a workspace can hold. The label is what gets written into
 * documents, so it must stay stable.
 */
public enum WindowType {
    CHARTS("Charts"),
    SPATIAL("Spatial Editor"),
    COLUMN("DataFrame Viewer"),
    VOLUME("Model Metric Viewer"),
    POINT_CLOUD("Point Cloud Viewer"),
    MODEL_3D("3D Model Viewer");

    private final String label;

    WindowType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<WindowType> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (WindowType t : values()) {
            if (t.label.equals(label)) return Optional.of(t);
        }
        return Optional.empty();
    }

    @JsonCreator
    static WindowType fromJson(String value) {
        return fromLabel(value)
                .or(() -> {
                    try {
                        return Optional.of(WindowType.valueOf(value));
                    } catch (IllegalArgumentException e) {
                        return Optional.empty();
                    }
                })
                .orElseThrow(() -> new IllegalArgumentException("unknown window type: " + value));
    }
}
