/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.dataset;

import java.util.Locale;

/**
 * Line-of-sight axis for projections and the reference axis for cylindrical
 * and spherical quantities.
 */
public enum Direction {
    X(0),
    Y(1),
    Z(2);

    private final int axis;

    Direction(int axis) {
        this.axis = axis;
    }

    /**
     * Parses {@code x}, {@code y} or {@code z}, ignoring case.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static Direction parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Direction cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "x" -> X;
            case "y" -> Y;
            case "z" -> Z;
            default -> throw new IllegalArgumentException("Unknown direction '" + value + "', expected x, y or z");
        };
    }

    /**
     * Index of the line-of-sight axis (0, 1 or 2).
     */
    public int axis() {
        return axis;
    }

    /**
     * Right-handed frame whose third axis is this direction: the box axes that play
     * the role of x, y and z.
     */
    public int[] frame() {
        return new int[]{ (axis + 1) % 3, (axis + 2) % 3, axis };
    }

    /**
     * Box axes spanning the projected image, horizontal first.
     */
    public int[] pixelAxes() {
        return switch (this) {
            case X -> new int[]{ 1, 2 };
            case Y -> new int[]{ 0, 2 };
            case Z -> new int[]{ 0, 1 };
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
