/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.units;

/**
 * Physical dimension of a {@link Unit}.
 */
public enum UnitKind {
    LENGTH,
    VOLUME,
    DENSITY,
    COLUMN_DENSITY,
    TIME,
    MASS,
    VELOCITY,
    NUMBER_DENSITY,
    ENERGY,
    TEMPERATURE,
    PRESSURE,
    ENTROPY,
    ANGULAR_MOMENTUM,
    MAGNETIC_FIELD,
    LUMINOSITY,
    COOLING_RATE,
    FLUX,
    ACCELERATION,
    SPECIFIC_ENERGY,
    FORCE,
    DIMENSIONLESS,
    ANGLE
}
