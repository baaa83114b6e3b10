/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.dataset;

import java.util.Arrays;
import java.util.Locale;

/**
 * Reference point for ranges, positions and regions.
 * <p>
 * Each axis holds either a literal coordinate, expressed in the unit of the
 * operation it is passed to, or the box-centre marker, which always stands
 * for the middle of the box.
 * </p>
 * <pre>{@code
 * Center.of(24.0, 24.0, 24.0)      // literal coordinates
 * Center.boxCentre()               // middle of the box on all axes
 * Center.parse("bc", "0.4", "bc")  // mixed
 * }</pre>
 */
public final class Center {

    private static final Center ORIGIN = new Center(new double[3], new boolean[3]);
    private static final Center BOX_CENTRE = new Center(new double[3], new boolean[]{ true, true, true });

    private final double[] values;
    private final boolean[] boxCentre;

    private Center(double[] values, boolean[] boxCentre) {
        this.values = values;
        this.boxCentre = boxCentre;
    }

    /**
     * The coordinate origin. Ranges and positions are not shifted.
     */
    public static Center origin() {
        return ORIGIN;
    }

    public static Center boxCentre() {
        return BOX_CENTRE;
    }

    public static Center of(double x, double y, double z) {
        return new Center(new double[]{ x, y, z }, new boolean[3]);
    }

    /**
     * Parses three axis entries. Each is a number or one of the box-centre markers
     * {@code bc}, {@code boxcenter}, {@code boxcentre}.
     *
     * @throws IllegalArgumentException if an entry is neither
     */
    public static Center parse(String... entries) {
        if (entries == null || entries.length == 0) {
            throw new IllegalArgumentException("At least one center entry must be specified");
        }
        if (entries.length == 1) {
            entries = new String[]{ entries[0], entries[0], entries[0] };
        }
        if (entries.length != 3) {
            throw new IllegalArgumentException("Center needs 1 or 3 entries, got " + entries.length);
        }
        double[] values = new double[3];
        boolean[] markers = new boolean[3];
        for (int axis = 0; axis < 3; axis++) {
            String entry = entries[axis];
            if (entry == null || entry.isBlank()) {
                throw new IllegalArgumentException("Center entry cannot be null or empty");
            }
            String normalized = entry.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("bc") || normalized.equals("boxcenter") || normalized.equals("boxcentre")) {
                markers[axis] = true;
            }
            else {
                try {
                    values[axis] = Double.parseDouble(normalized);
                }
                catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid center entry '" + entry + "'", e);
                }
            }
        }
        return new Center(values, markers);
    }

    public boolean isBoxCentre(int axis) {
        return boxCentre[axis];
    }

    /**
     * Returns the literal coordinate of an axis, 0 for a box-centre axis.
     */
    public double value(int axis) {
        return values[axis];
    }

    /**
     * Returns the axis position as a fraction of the box.
     *
     * @param conversion factor that turns the literal coordinate into a box fraction
     *        (1 when coordinates are already normalized)
     */
    public double normalized(int axis, double conversion) {
        return boxCentre[axis] ? 0.5 : values[axis] / conversion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Center)) {
            return false;
        }
        Center other = (Center) o;
        return Arrays.equals(values, other.values) && Arrays.equals(boxCentre, other.boxCentre);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Arrays.hashCode(boxCentre);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Center[");
        for (int axis = 0; axis < 3; axis++) {
            if (axis > 0) {
                sb.append(", ");
            }
            sb.append(boxCentre[axis] ? "bc" : Double.toString(values[axis]));
        }
        return sb.append(']').toString();
    }
}
