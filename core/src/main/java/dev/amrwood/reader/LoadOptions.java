/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.reader;

import dev.amrwood.dataset.Center;
import dev.amrwood.dataset.RangeSpec;
import dev.amrwood.metadata.SimulationInfo;

/**
 * Options for loading a component: variable selection, level bounds and spatial window.
 *
 * <pre>{@code
 * LoadOptions options = LoadOptions.builder()
 *         .variables(VariableSelection.variables("rho", "p"))
 *         .lmax(8)
 *         .xrange(-10.0, 10.0)
 *         .yrange(-10.0, 10.0)
 *         .zrange(-2.0, 2.0)
 *         .center(Center.boxCentre())
 *         .rangeUnit("kpc")
 *         .build();
 * }</pre>
 */
public final class LoadOptions {

    private static final LoadOptions DEFAULTS = builder().build();

    private final VariableSelection variables;
    private final Integer lmin;
    private final Integer lmax;
    private final RangeSpec ranges;

    private LoadOptions(Builder builder) {
        this.variables = builder.variables;
        this.lmin = builder.lmin;
        this.lmax = builder.lmax;
        this.ranges = RangeSpec.of(builder.bounds[0], builder.bounds[1], builder.bounds[2], builder.bounds[3],
                builder.bounds[4], builder.bounds[5], builder.center, builder.rangeUnit);
    }

    /**
     * All variables, all levels, the whole box.
     */
    public static LoadOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public VariableSelection variables() {
        return variables;
    }

    public RangeSpec ranges() {
        return ranges;
    }

    /**
     * Effective finest level for the given snapshot.
     *
     * @throws IllegalArgumentException if the bound lies outside the snapshot's levels
     */
    public int lmax(SimulationInfo info) {
        int value = lmax != null ? lmax : info.levelmax();
        checkLevel("lmax", value, info);
        return value;
    }

    /**
     * Effective coarsest level for the given snapshot.
     *
     * @throws IllegalArgumentException if the bound lies outside the snapshot's levels or above lmax
     */
    public int lmin(SimulationInfo info) {
        int value = lmin != null ? lmin : info.levelmin();
        checkLevel("lmin", value, info);
        if (value > lmax(info)) {
            throw new IllegalArgumentException("lmin " + value + " is greater than lmax " + lmax(info));
        }
        return value;
    }

    private static void checkLevel(String name, int value, SimulationInfo info) {
        if (value < info.levelmin() || value > info.levelmax()) {
            throw new IllegalArgumentException(name + " " + value + " lies outside the simulation levels ["
                    + info.levelmin() + ", " + info.levelmax() + "]");
        }
    }

    public static final class Builder {

        private VariableSelection variables = VariableSelection.all();
        private Integer lmin;
        private Integer lmax;
        private final Double[] bounds = new Double[6];
        private Center center = Center.origin();
        private String rangeUnit;

        private Builder() {
        }

        public Builder variables(VariableSelection variables) {
            if (variables == null) {
                throw new IllegalArgumentException("Variable selection cannot be null");
            }
            this.variables = variables;
            return this;
        }

        public Builder variables(String... names) {
            return variables(VariableSelection.variables(names));
        }

        public Builder lmin(int lmin) {
            this.lmin = lmin;
            return this;
        }

        public Builder lmax(int lmax) {
            this.lmax = lmax;
            return this;
        }

        /**
         * Sets the x window; either bound may be null to leave it open.
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

        public Builder center(Center center) {
            this.center = center;
            return this;
        }

        /**
         * Length unit of ranges and center; {@code standard} (the default) means fractions of the box.
         */
        public Builder rangeUnit(String rangeUnit) {
            this.rangeUnit = rangeUnit;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a level bound is not positive, lmin exceeds lmax,
         *         or a range is inverted
         */
        public LoadOptions build() {
            if (lmin != null && lmin < 1 || lmax != null && lmax < 1) {
                throw new IllegalArgumentException("Level bounds must be positive");
            }
            if (lmin != null && lmax != null && lmin > lmax) {
                throw new IllegalArgumentException("lmin " + lmin + " is greater than lmax " + lmax);
            }
            return new LoadOptions(this);
        }
    }
}
