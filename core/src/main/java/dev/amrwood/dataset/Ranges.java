/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.dataset;

/**
 * Spatial window normalized to the box, every bound in {@code [0, 1]}.
 */
public record Ranges(double xmin, double xmax, double ymin, double ymax, double zmin, double zmax) {

    public static final Ranges FULL = new Ranges(0, 1, 0, 1, 0, 1);

    public Ranges {
        check("x", xmin, xmax);
        check("y", ymin, ymax);
        check("z", zmin, zmax);
    }

    private static void check(String axis, double min, double max) {
        if (!(min >= 0 && max <= 1)) {
            throw new IllegalArgumentException("Normalized " + axis + " range [" + min + ", " + max
                    + "] must lie in [0, 1]");
        }
        if (min > max) {
            throw new IllegalArgumentException("Normalized " + axis + " range is inverted: [" + min + ", " + max + "]");
        }
    }

    public double min(int axis) {
        return switch (axis) {
            case 0 -> xmin;
            case 1 -> ymin;
            case 2 -> zmin;
            default -> throw new IndexOutOfBoundsException(axis);
        };
    }

    public double max(int axis) {
        return switch (axis) {
            case 0 -> xmax;
            case 1 -> ymax;
            case 2 -> zmax;
            default -> throw new IndexOutOfBoundsException(axis);
        };
    }

    public boolean isFull() {
        return equals(FULL);
    }

    public double[] toArray() {
        return new double[]{ xmin, xmax, ymin, ymax, zmin, zmax };
    }
}
