package com.archlens.core.model;

/**
 * Layout rectangle of a cluster.
 *
 * @param x left edge
 * @param y top edge
 * @param width width
 * @param height height
 */
public record Bounds(double x, double y, double width, double height) {
}
