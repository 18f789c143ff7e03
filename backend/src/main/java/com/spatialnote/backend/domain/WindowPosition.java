package com.spatialnote.backend.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Placement of a window in the shared space. Depth is only set for
 * volumetric windows.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WindowPosition(
        double x,
        double y,
        double z,
        double width,
        double height,
        Double depth
) {
    public static final double DEFAULT_WIDTH = 400;
    public static final double DEFAULT_HEIGHT = 300;

    public WindowPosition(double x, double y, double z, double width, double height) {
        this(x, y, z, width, height, null);
    }

    public static WindowPosition defaults() {
        return new WindowPosition(0, 0, 0, DEFAULT_WIDTH, DEFAULT_HEIGHT, null);
    }
}
