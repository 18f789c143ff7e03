package com.spatialnote.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Selects how a window's cell is rendered on export. PLAIN is the default a
 * window starts with; MARKDOWN turns the cell into a markdown cell.
 */
public enum ExportTemplate {
    PLAIN("Plain Text"),
    MATPLOTLIB("Matplotlib Chart"),
    PANDAS("Pandas DataFrame"),
    NUMPY("NumPy Array"),
    PLOTLY("Plotly Interactive"),
    SEABORN("Seaborn Statistical"),
    CUSTOM("Custom Code"),
    MARKDOWN("Markdown Only");

    private final String label;

    ExportTemplate(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<ExportTemplate> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (ExportTemplate t : values()) {
            if (t.label.equals(label)) return Optional.of(t);
        }
        return Optional.empty();
    }

    @JsonCreator
    static ExportTemplate fromJson(String value) {
        return fromLabel(value)
                .or(() -> {
                    try {
                        return Optional.of(ExportTemplate.valueOf(value));
                    } catch (IllegalArgumentException e) {
                        return Optional.empty();
                    }
                })
                .orElseThrow(() -> new IllegalArgumentException("unknown export template: " + value));
    }
}
