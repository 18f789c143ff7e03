package com.spatialnote.backend.domain.workspace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkspaceCategory {
    CUSTOM("Custom"),
    TEMPLATE("Template"),
    DEMO("Demo"),
    DATA_VISUALIZATION("Data Visualization"),
    ANALYSIS("Analysis"),
    MODELING_3D("3D Modeling"),
    DASHBOARD("Dashboard"),
    RESEARCH("Research");

    private final String label;

    WorkspaceCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Unknown values fall back to CUSTOM so an old index never fails to load. */
    @JsonCreator
    public static WorkspaceCategory fromLabel(String value) {
        if (value == null) return CUSTOM;
        for (WorkspaceCategory c : values()) {
            if (c.label.equalsIgnoreCase(value) || c.name().equalsIgnoreCase(value)) return c;
        }
        return CUSTOM;
    }
}
