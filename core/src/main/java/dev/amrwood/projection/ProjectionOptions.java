/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.projection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import dev.amrwood.dataset.Center;
import dev.amrwood.dataset.Direction;
import dev.amrwood.dataset.RangeSpec;

/**
 * What to project and onto which grid.
 *
 * <pre>{@code
 * ProjectionOptions options = ProjectionOptions.builder()
 *         .variables("sd", "T")
 *         .units("Msol_pc2", "K")
 *         .direction("z")
 *         .res(256)
 *         .xrange(-10.0, 10.0)
 *         .yrange(-10.0, 10.0)
 *         .zrange(-2.0, 2.0)
 *         .center(Center.boxCentre())
 *         .rangeUnit("kpc")
 *         .build();
 * }</pre>
 */
public final class ProjectionOptions {

    /** Surface density: projected mass per pixel area. */
    public static final String SURFACE_DENSITY = "sd";

    private final List<String> variables;
    private final List<String> units;
    private final Integer res;
    private final Double pxsize;
    private final String pxsizeUnit;
    private final Direction direction;
    private final RangeSpec ranges;
    private final Integer lmax;
    private final ProjectionMode mode;
    private final Weighting weighting;
    private final boolean[] mask;
    private final Set<ParticleFamily> families;

    private ProjectionOptions(Builder builder) {
        this.variables = List.copyOf(builder.variables);
        this.units = expandUnits(builder.units, variables.size());
        this.res = builder.res;
        this.pxsize = builder.pxsize;
        this.pxsizeUnit = builder.pxsizeUnit;
        this.direction = builder.direction;
        this.ranges = RangeSpec.of(builder.bounds[0], builder.bounds[1], builder.bounds[2], builder.bounds[3],
                builder.bounds[4], builder.bounds[5], builder.center, builder.rangeUnit);
        this.lmax = builder.lmax;
        this.mode = builder.mode;
        this.weighting = builder.weighting;
        this.mask = builder.mask;
        this.families = Collections.unmodifiableSet(EnumSet.copyOf(builder.families));
    }

    private static List<String> expandUnits(List<String> units, int count) {
        if (units.isEmpty()) {
            return Collections.nCopies(count, null);
        }
        if (units.size() == 1) {
            return Collections.nCopies(count, units.get(0));
        }
        return Collections.unmodifiableList(new ArrayList<>(units));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> variables() {
        return variables;
    }

    /**
     * One unit per variable; null entries mean code units.
     */
    public List<String> units() {
        return units;
    }

    /**
     * Pixels across the full box, or null when a pixel size or the default applies.
     */
    public Integer res() {
        return res;
    }

    public Double pxsize() {
        return pxsize;
    }

    public String pxsizeUnit() {
        return pxsizeUnit;
    }

    public Direction direction() {
        return direction;
    }

    public RangeSpec ranges() {
        return ranges;
    }

    /**
     * Level whose cell size sets the default resolution, or null for the dataset's lmax.
     */
    public Integer lmax() {
        return lmax;
    }

    /**
     * The requested mode, or null for the default of the dataset kind.
     */
    public ProjectionMode mode() {
        return mode;
    }

    public Weighting weighting() {
        return weighting;
    }

    public boolean[] mask() {
        return mask;
    }

    public Set<ParticleFamily> families() {
        return families;
    }

    public static final class Builder {

        private final List<String> variables = new ArrayList<>();
        private List<String> units = List.of();
        private Integer res;
        private Double pxsize;
        private String pxsizeUnit;
        private Direction direction = Direction.Z;
        private final Double[] bounds = new Double[6];
        private Center center = Center.origin();
        private String rangeUnit;
        private Integer lmax;
        private ProjectionMode mode;
        private Weighting weighting = Weighting.MASS;
        private boolean[] mask;
        private Set<ParticleFamily> families = EnumSet.of(ParticleFamily.STARS);

        private Builder() {
        }

        public Builder variables(String... names) {
            if (names == null) {
                throw new IllegalArgumentException("Variable names cannot be null");
            }
            for (String name : names) {
                if (name == null || name.isEmpty()) {
                    throw new IllegalArgumentException("Variable name cannot be null or empty");
                }
                variables.add(name);
            }
            return this;
        }

        public Builder units(String... units) {
            this.units = units == null ? List.of() : Arrays.asList(units);
            return this;
        }

        public Builder res(int res) {
            this.res = res;
            return this;
        }

        /**
         * Sets the pixel size instead of the resolution; the grid gets as many pixels as
         * fit across the box.
         */
        public Builder pxsize(double pxsize, String unit) {
            this.pxsize = pxsize;
            this.pxsizeUnit = unit;
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

        public Builder lmax(int lmax) {
            this.lmax = lmax;
            return this;
        }

        public Builder mode(ProjectionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder mode(String mode) {
            return mode(ProjectionMode.parse(mode));
        }

        public Builder weighting(Weighting weighting) {
            if (weighting == null) {
                throw new IllegalArgumentException("Weighting cannot be null");
            }
            this.weighting = weighting;
            return this;
        }

        public Builder weighting(String weighting) {
            return weighting(Weighting.parse(weighting));
        }

        public Builder mask(boolean[] mask) {
            this.mask = mask;
            return this;
        }

        public Builder families(ParticleFamily... families) {
            if (families == null || families.length == 0) {
                throw new IllegalArgumentException("At least one particle family must be specified");
            }
            this.families = EnumSet.copyOf(Arrays.asList(families));
            return this;
        }

        public Builder families(String... names) {
            if (names == null || names.length == 0) {
                throw new IllegalArgumentException("At least one particle family must be specified");
            }
            ParticleFamily[] parsed = new ParticleFamily[names.length];
            for (int i = 0; i < names.length; i++) {
                parsed[i] = ParticleFamily.parse(names[i]);
            }
            return families(parsed);
        }

        /**
         * @throws IllegalArgumentException if no variable is given, the unit count does not match,
         *         the resolution or pixel size is not positive, both are given, or a range is inverted
         */
        public ProjectionOptions build() {
            if (variables.isEmpty()) {
                throw new IllegalArgumentException("At least one variable must be specified");
            }
            if (new HashSet<>(variables).size() != variables.size()) {
                throw new IllegalArgumentException("Variables must not repeat, got " + variables);
            }
            if (units.size() > 1 && units.size() != variables.size()) {
                throw new IllegalArgumentException("Got " + units.size() + " units for " + variables.size()
                        + " variables; give one unit or one per variable");
            }
            if (res != null && res <= 0) {
                throw new IllegalArgumentException("Resolution must be positive, got " + res);
            }
            if (pxsize != null && !(pxsize > 0)) {
                throw new IllegalArgumentException("Pixel size must be positive, got " + pxsize);
            }
            if (res != null && pxsize != null) {
                throw new IllegalArgumentException("Give either a resolution or a pixel size, not both");
            }
            if (lmax != null && lmax < 1) {
                throw new IllegalArgumentException("lmax must be positive, got " + lmax);
            }
            return new ProjectionOptions(this);
        }
    }
}
