/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.dataset;

import dev.amrwood.units.ScaleSet;
import dev.amrwood.units.UnitKind;

/**
 * User-facing spatial window: per-axis bounds relative to a {@link Center},
 * in a length unit of the snapshot's {@link ScaleSet}.
 * <p>
 * With the {@value ScaleSet#STANDARD} unit, bounds and center are fractions of
 * the box. Otherwise they are physical lengths. An absent bound means the box edge.
 * </p>
 */
public final class RangeSpec {

    private static final RangeSpec FULL = new RangeSpec(new Double[6], Center.origin(), ScaleSet.STANDARD);

    private final Double[] bounds;
    private final Center center;
    private final String unit;

    private RangeSpec(Double[] bounds, Center center, String unit) {
        this.bounds = bounds;
        this.center = center;
        this.unit = unit;
    }

    public static RangeSpec full() {
        return FULL;
    }

    /**
     * Creates a window from per-axis bounds, each of which may be null.
     *
     * @throws IllegalArgumentException if a pair of given bounds is inverted
     */
    public static RangeSpec of(Double xmin, Double xmax, Double ymin, Double ymax, Double zmin, Double zmax,
                               Center center, String unit) {
        Double[] bounds = { xmin, xmax, ymin, ymax, zmin, zmax };
        String[] axes = { "x", "y", "z" };
        for (int axis = 0; axis < 3; axis++) {
            Double min = bounds[2 * axis];
            Double max = bounds[2 * axis + 1];
            if (min != null && max != null && min > max) {
                throw new IllegalArgumentException("Inverted " + axes[axis] + " range: [" + min + ", " + max + "]");
            }
        }
        return new RangeSpec(bounds, center == null ? Center.origin() : center,
                unit == null ? ScaleSet.STANDARD : unit);
    }

    public Center center() {
        return center;
    }

    public String unit() {
        return unit;
    }

    /**
     * Returns the given bound, or null when the bound is open.
     *
     * @param index 0..5 for xmin, xmax, ymin, ymax, zmin, zmax
     */
    public Double bound(int index) {
        return bounds[index];
    }

    /**
     * Box-fraction conversion for the given unit: 1 for code units, otherwise
     * {@code boxlen * scale(unit)}.
     */
    public static double conversion(String unit, double boxlen, ScaleSet scale) {
        if (unit == null || ScaleSet.STANDARD.equals(unit)) {
            return 1.0;
        }
        return boxlen * scale.resolve(unit, UnitKind.LENGTH);
    }

    /**
     * Normalizes this window to the box and clamps it to {@code [0, 1]}.
     *
     * @throws IllegalArgumentException if the unit is not a length unit, or the
     *         resulting window is inverted
     */
    public Ranges resolve(double boxlen, ScaleSet scale) {
        double conv = conversion(unit, boxlen, scale);
        double[] result = new double[6];
        for (int axis = 0; axis < 3; axis++) {
            double c = center.normalized(axis, conv);
            Double min = bounds[2 * axis];
            Double max = bounds[2 * axis + 1];
            result[2 * axis] = min == null ? 0.0 : clamp(min / conv + c);
            result[2 * axis + 1] = max == null ? 1.0 : clamp(max / conv + c);
            if (result[2 * axis] > result[2 * axis + 1]) {
                throw new IllegalArgumentException("Range on axis " + axis + " is inverted after centering: ["
                        + result[2 * axis] + ", " + result[2 * axis + 1] + "]");
            }
        }
        return new Ranges(result[0], result[1], result[2], result[3], result[4], result[5]);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
