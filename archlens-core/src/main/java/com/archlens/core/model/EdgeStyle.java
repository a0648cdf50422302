package com.archlens.core.model;

/**
 * Display style of an edge.
 *
 * @param thickness stroke width, reflects importance
 * @param lineStyle stroke style
 * @param color stroke color
 * @param animated whether a particle flow animation is shown
 */
public record EdgeStyle(
    double thickness,
    LineStyle lineStyle,
    String color,
    boolean animated
) {
    /**
     * Compact constructor with validation.
     */
    public EdgeStyle {
        if (lineStyle == null) {
            lineStyle = LineStyle.SOLID;
        }
    }
}
