/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.variables;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import dev.amrwood.dataset.Center;
import dev.amrwood.dataset.Dataset;
import dev.amrwood.dataset.Direction;

/**
 * The variables to compute, their units and the rows and frame to compute them over.
 *
 * <pre>{@code
 * GetvarRequest request = GetvarRequest.builder()
 *         .variables("mass", "vr_cylinder")
 *         .units("Msol", "km_s")
 *         .center(Center.boxCentre())
 *         .build();
 * }</pre>
 */
public final class GetvarRequest {

    private final List<String> variables;
    private final List<String> units;
    private final boolean[] mask;
    private final Dataset subset;
    private final Center center;
    private final String centerUnit;
    private final Double referenceTime;
    private final Direction direction;

    private GetvarRequest(Builder builder) {
        this.variables = List.copyOf(builder.variables);
        this.units = expandUnits(builder.units, variables.size());
        this.mask = builder.mask;
        this.subset = builder.subset;
        this.center = builder.center;
        this.centerUnit = builder.centerUnit;
        this.referenceTime = builder.referenceTime;
        this.direction = builder.direction;
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
     * The row mask, or null to use every row.
     */
    public boolean[] mask() {
        return mask;
    }

    /**
     * The dataset to compute over instead of the one passed to {@link Getvar}, or null.
     */
    public Dataset subset() {
        return subset;
    }

    public Center center() {
        return center;
    }

    public String centerUnit() {
        return centerUnit;
    }

    /**
     * Time that particle ages are measured from, in code units; null means the snapshot time.
     */
    public Double referenceTime() {
        return referenceTime;
    }

    public Direction direction() {
        return direction;
    }

    public static final class Builder {

        private final List<String> variables = new ArrayList<>();
        private List<String> units = List.of();
        private boolean[] mask;
        private Dataset subset;
        private Center center = Center.origin();
        private String centerUnit;
        private Double referenceTime;
        private Direction direction = Direction.Z;

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

        /**
         * Units for the variables: either one for all of them or one per variable.
         */
        public Builder units(String... units) {
            this.units = units == null ? List.of() : Arrays.asList(units);
            return this;
        }

        public Builder mask(boolean[] mask) {
            this.mask = mask;
            return this;
        }

        /**
         * Accepts a mask given as an untyped object, as it may come from generic callers.
         *
         * @throws IllegalArgumentException if the object is not a {@code boolean[]}
         */
        public Builder maskFromObject(Object mask) {
            if (mask == null) {
                this.mask = null;
                return this;
            }
            if (!(mask instanceof boolean[] flags)) {
                throw new IllegalArgumentException("Mask must be a boolean array, got "
                        + mask.getClass().getSimpleName());
            }
            this.mask = flags;
            return this;
        }

        public Builder subset(Dataset subset) {
            this.subset = subset;
            return this;
        }

        public Builder center(Center center) {
            if (center == null) {
                throw new IllegalArgumentException("Center cannot be null");
            }
            this.center = center;
            return this;
        }

        /**
         * Length unit of the center; {@code standard} (the default) means fractions of the box.
         */
        public Builder centerUnit(String centerUnit) {
            this.centerUnit = centerUnit;
            return this;
        }

        public Builder referenceTime(double referenceTime) {
            this.referenceTime = referenceTime;
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

        /**
         * @throws IllegalArgumentException if no variable is given or the number of units
         *         is neither 0, 1 nor the number of variables
         */
        public GetvarRequest build() {
            if (variables.isEmpty()) {
                throw new IllegalArgumentException("At least one variable must be specified");
            }
            Set<String> seen = new HashSet<>();
            for (String name : variables) {
                if (!seen.add(name)) {
                    throw new IllegalArgumentException("Variable '" + name + "' is requested more than once");
                }
            }
            if (units.size() > 1 && units.size() != variables.size()) {
                throw new IllegalArgumentException("Got " + units.size() + " units for " + variables.size()
                        + " variables; give one unit or one per variable");
            }
            return new GetvarRequest(this);
        }
    }
}
