/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.region;

import dev.amrwood.dataset.Direction;

/**
 * A geometric region tested against row positions, or against the axis-aligned extent of
 * a cell, in code length units.
 */
public sealed interface RegionPredicate
        permits RegionPredicate.Cuboid, RegionPredicate.Sphere, RegionPredicate.Cylinder,
        RegionPredicate.Not, RegionPredicate.Band, RegionPredicate.And {

    boolean test(double x, double y, double z);

    /**
     * Whether the region intersects the box {@code [x0, x1] x [y0, y1] x [z0, z1]}. Boxes that
     * only touch the boundary of a cuboid do not intersect it.
     */
    boolean overlaps(double x0, double x1, double y0, double y1, double z0, double z1);

    default RegionPredicate negate() {
        return new Not(this);
    }

    default RegionPredicate and(RegionPredicate other) {
        return new And(this, other);
    }

    /**
     * Axis-aligned box, bounds inclusive.
     */
    record Cuboid(double xmin, double xmax, double ymin, double ymax, double zmin, double zmax) implements RegionPredicate {

        public Cuboid {
            if (xmin > xmax || ymin > ymax || zmin > zmax) {
                throw new IllegalArgumentException("Cuboid bounds are inverted: [" + xmin + ", " + xmax + "] x ["
                        + ymin + ", " + ymax + "] x [" + zmin + ", " + zmax + "]");
            }
        }

        @Override
        public boolean test(double x, double y, double z) {
            return x >= xmin && x <= xmax && y >= ymin && y <= ymax && z >= zmin && z <= zmax;
        }

        @Override
        public boolean overlaps(double x0, double x1, double y0, double y1, double z0, double z1) {
            return x1 > xmin && x0 < xmax && y1 > ymin && y0 < ymax && z1 > zmin && z0 < zmax;
        }
    }

    /**
     * Closed ball around a center.
     */
    record Sphere(double cx, double cy, double cz, double radius) implements RegionPredicate {

        public Sphere {
            if (radius < 0) {
                throw new IllegalArgumentException("Sphere radius must not be negative: " + radius);
            }
        }

        @Override
        public boolean test(double x, double y, double z) {
            double dx = x - cx;
            double dy = y - cy;
            double dz = z - cz;
            return dx * dx + dy * dy + dz * dz <= radius * radius;
        }

        @Override
        public boolean overlaps(double x0, double x1, double y0, double y1, double z0, double z1) {
            double dx = gap(cx, x0, x1);
            double dy = gap(cy, y0, y1);
            double dz = gap(cz, z0, z1);
            return dx * dx + dy * dy + dz * dz <= radius * radius;
        }
    }

    /**
     * Cylinder along an axis, extending {@code height} to both sides of the center.
     */
    record Cylinder(double cx, double cy, double cz, double radius, double height, Direction axis)
            implements RegionPredicate {

        public Cylinder {
            if (radius < 0 || height < 0) {
                throw new IllegalArgumentException("Cylinder radius and height must not be negative: "
                        + radius + ", " + height);
            }
            if (axis == null) {
                throw new IllegalArgumentException("Cylinder axis cannot be null");
            }
        }

        @Override
        public boolean test(double x, double y, double z) {
            double[] d = { x - cx, y - cy, z - cz };
            int[] frame = axis.frame();
            double a = d[frame[0]];
            double b = d[frame[1]];
            double h = d[frame[2]];
            return a * a + b * b <= radius * radius && Math.abs(h) <= height;
        }

        @Override
        public boolean overlaps(double x0, double x1, double y0, double y1, double z0, double z1) {
            double[] d = { gap(cx, x0, x1), gap(cy, y0, y1), gap(cz, z0, z1) };
            int[] frame = axis.frame();
            double a = d[frame[0]];
            double b = d[frame[1]];
            return a * a + b * b <= radius * radius && d[frame[2]] <= height;
        }
    }

    record Not(RegionPredicate inner) implements RegionPredicate {

        @Override
        public boolean test(double x, double y, double z) {
            return !inner.test(x, y, z);
        }

        @Override
        public boolean overlaps(double x0, double x1, double y0, double y1, double z0, double z1) {
            return !inner.overlaps(x0, x1, y0, y1, z0, z1);
        }
    }

    /**
     * Outside {@code inner} and inside {@code outer}.
     */
    record Band(RegionPredicate inner, RegionPredicate outer) implements RegionPredicate {

        @Override
        public boolean test(double x, double y, double z) {
            return outer.test(x, y, z) && !inner.test(x, y, z);
        }

        @Override
        public boolean overlaps(double x0, double x1, double y0, double y1, double z0, double z1) {
            return outer.overlaps(x0, x1, y0, y1, z0, z1) && !inner.overlaps(x0, x1, y0, y1, z0, z1);
        }
    }

    record And(RegionPredicate first, RegionPredicate second) implements RegionPredicate {

        @Override
        public boolean test(double x, double y, double z) {
            return first.test(x, y, z) && second.test(x, y, z);
        }

        @Override
        public boolean overlaps(double x0, double x1, double y0, double y1, double z0, double z1) {
            return first.overlaps(x0, x1, y0, y1, z0, z1) && second.overlaps(x0, x1, y0, y1, z0, z1);
        }
    }

    /**
     * Distance from a coordinate to the interval {@code [lo, hi]}; 0 inside it.
     */
    private static double gap(double c, double lo, double hi) {
        return Math.max(0.0, Math.max(lo - c, c - hi));
    }
}
