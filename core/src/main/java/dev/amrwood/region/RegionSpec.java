/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.region;

import dev.amrwood.dataset.Center;
import dev.amrwood.dataset.Direction;
import dev.amrwood.dataset.RangeSpec;
import dev.amrwood.units.ScaleSet;

/**
 * A region as a user describes it: a shape, extents relative to a center, and the
 * length unit they are given in.
 *
 * <pre>{@code
 * RegionSpec disk = RegionSpec.builder()
 *         .shape("cylinder")
 *         .radius(10.0)
 *         .height(2.0)
 *         .center(Center.boxCentre())
 *         .rangeUnit("kpc")
 *         .build();
 * }</pre>
 */
public final class RegionSpec {

    private final Shape shape;
    private final Double[] bounds;
    private final double radius;
    private final double height;
    private final Direction direction;
    private final Center center;
    private final String rangeUnit;
    private final boolean inverse;
    private final boolean cell;

    private RegionSpec(Builder builder) {
        this.shape = builder.shape;
        this.bounds = builder.bounds.clone();
        this.radius = builder.radius;
        this.height = builder.height;
        this.direction = builder.direction;
        this.center = builder.center;
        this.rangeUnit = builder.rangeUnit;
        this.inverse = builder.inverse;
        this.cell = builder.cell;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Shape shape() {
        return shape;
    }

    public double radius() {
        return radius;
    }

    public double height() {
        return height;
    }

    public Direction direction() {
        return direction;
    }

    public Center center() {
        return center;
    }

    public String rangeUnit() {
        return rangeUnit;
    }

    public boolean inverse() {
        return inverse;
    }

    /**
     * Whether cells are kept when their extent overlaps the region rather than when their
     * position lies in it. Particles and clumps are always tested at their position.
     */
    public boolean cell() {
        return cell;
    }

    /**
     * Builds the predicate in code length units, complemented when {@link #inverse()} is set.
     */
    public RegionPredicate toPredicate(double boxlen, ScaleSet scale) {
        RegionPredicate predicate = switch (shape) {
            case CUBOID -> cuboid(boxlen, scale);
            case SPHERE, CYLINDER -> round(boxlen, scale, radius);
        };
        return inverse ? predicate.negate() : predicate;
    }

    /**
     * Builds the sphere or cylinder of this region with another radius, in code length units,
     * ignoring {@link #inverse()}.
     */
    RegionPredicate withRadius(double boxlen, ScaleSet scale, double otherRadius) {
        if (shape == Shape.CUBOID) {
            throw new IllegalArgumentException("Shells are defined for spheres and cylinders only");
        }
        return round(boxlen, scale, otherRadius);
    }

    private RegionPredicate cuboid(double boxlen, ScaleSet scale) {
        double conversion = RangeSpec.conversion(rangeUnit, boxlen, scale);
        double[] code = new double[6];
        for (int axis = 0; axis < 3; axis++) {
            double c = center.normalized(axis, conversion);
            Double min = bounds[2 * axis];
            Double max = bounds[2 * axis + 1];
            code[2 * axis] = min == null ? 0.0 : (min / conversion + c) * boxlen;
            code[2 * axis + 1] = max == null ? boxlen : (max / conversion + c) * boxlen;
        }
        return new RegionPredicate.Cuboid(code[0], code[1], code[2], code[3], code[4], code[5]);
    }

    private RegionPredicate round(double boxlen, ScaleSet scale, double r) {
        double conversion = RangeSpec.conversion(rangeUnit, boxlen, scale);
        double cx = center.normalized(0, conversion) * boxlen;
        double cy = center.normalized(1, conversion) * boxlen;
        double cz = center.normalized(2, conversion) * boxlen;
        double codeRadius = r / conversion * boxlen;
        if (shape == Shape.SPHERE) {
            return new RegionPredicate.Sphere(cx, cy, cz, codeRadius);
        }
        return new RegionPredicate.Cylinder(cx, cy, cz, codeRadius, height / conversion * boxlen, direction);
    }

    public static final class Builder {

        private Shape shape = Shape.CUBOID;
        private final Double[] bounds = new Double[6];
        private double radius;
        private double height;
        private Direction direction = Direction.Z;
        private Center center = Center.origin();
        private String rangeUnit;
        private boolean inverse;
        private boolean cell;

        private Builder() {
        }

        public Builder shape(Shape shape) {
            if (shape == null) {
                throw new IllegalArgumentException("Shape cannot be null");
            }
            this.shape = shape;
            return this;
        }

        public Builder shape(String keyword) {
            return shape(Shape.parse(keyword));
        }

        /**
         * Cuboid x extent relative to the center; either bound may be null for the box edge.
         */
        public Builder xrange(Double min, Double max) {
            bounds[0] = min;
            bounds[1] = max;
            return this;
        }

        public Builder yrange(Double min, Double max) {
            bounds[2] = min;
            bounds[3] = max;
            return this;
        }

        public Builder zrange(Double min, Double max) {
            bounds[4] = min;
            bounds[5] = max;
            return this;
        }

        public Builder radius(double radius) {
            this.radius = radius;
            return this;
        }

        /**
         * Half extent of a cylinder along its axis.
         */
        public Builder height(double height) {
            this.height = height;
            return this;
        }

        public Builder direction(Direction direction) {
            if (direction == null) {
                throw new IllegalArgumentException("Direction cannot be null");
            }
            this.direction = direction;
            return this;
        }

        public Builder direction(String direction) {
            return direction(Direction.parse(direction));
        }

        public Builder center(Center center) {
            if (center == null) {
                throw new IllegalArgumentException("Center cannot be null");
            }
            this.center = center;
            return this;
        }

        public Builder rangeUnit(String rangeUnit) {
            this.rangeUnit = rangeUnit;
            return this;
        }

        public Builder inverse(boolean inverse) {
            this.inverse = inverse;
            return this;
        }

        public Builder cell(boolean cell) {
            this.cell = cell;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a sphere or cylinder has no positive radius, a cylinder
         *         has no positive height, or a cuboid range is inverted
         */
        public RegionSpec build() {
            switch (shape) {
                case CUBOID -> {
                    for (int axis = 0; axis < 3; axis++) {
                        Double min = bounds[2 * axis];
                        Double max = bounds[2 * axis + 1];
                        if (min != null && max != null && min > max) {
                            throw new IllegalArgumentException("Range on axis " + axis + " is inverted: ["
                                    + min + ", " + max + "]");
                        }
                    }
                }
                case SPHERE -> requirePositive("Sphere radius", radius);
                case CYLINDER -> {
                    requirePositive("Cylinder radius", radius);
                    requirePositive("Cylinder height", height);
                }
            }
            return new RegionSpec(this);
        }

        private static void requirePositive(String name, double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }
    }
}
