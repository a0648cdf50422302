package com.archlens.core.model;

/**
 * Layout coordinates of a node.
 *
 * @param x horizontal position
 * @param y vertical position
 */
public record Position(double x, double y) {

    public static Position origin() {
        return new Position(0, 0);
    }
}
