/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.units;

import java.util.Arrays;
import java.util.List;

/**
 * The older fixed 32-field scale record.
 * <p>
 * Fields are stored positionally in the order given by {@link #LAYOUT}.
 * Conversion to and from {@link ScaleSet} is a pure field remap.
 * </p>
 */
public final class LegacyScaleSet {

    /** Field order of the legacy record. */
    public static final List<Unit> LAYOUT = List.of(
            Unit.MPC, Unit.KPC, Unit.PARSEC, Unit.MILLIPARSEC, Unit.LIGHT_YEAR, Unit.ASTRONOMICAL_UNIT,
            Unit.KILOMETER, Unit.METER, Unit.CENTIMETER, Unit.MILLIMETER, Unit.MICROMETER,
            Unit.MSOL_PC3, Unit.G_CM3, Unit.MSOL_PC2, Unit.G_CM2,
            Unit.GYR, Unit.MYR, Unit.YEAR, Unit.SECOND, Unit.MILLISECOND,
            Unit.MSOL_MASS, Unit.MEARTH_MASS, Unit.MJUPITER_MASS, Unit.GRAM,
            Unit.KM_S, Unit.M_S, Unit.CM_S,
            Unit.NH, Unit.ERG, Unit.G_CMS2, Unit.T_MU, Unit.BARYE);

    private final double[] fields;

    private LegacyScaleSet(double[] fields) {
        this.fields = fields;
    }

    /**
     * Creates a legacy record from its fields in {@link #LAYOUT} order.
     */
    public static LegacyScaleSet of(double... fields) {
        if (fields.length != LAYOUT.size()) {
            throw new IllegalArgumentException("Legacy scale record has " + LAYOUT.size()
                    + " fields, got " + fields.length);
        }
        return new LegacyScaleSet(fields.clone());
    }

    public double get(Unit unit) {
        int index = LAYOUT.indexOf(unit);
        if (index < 0) {
            throw new UnknownUnitException(unit.symbol(), "Unit '" + unit.symbol() + "' is not part of the legacy layout");
        }
        return fields[index];
    }

    public ScaleSet toScaleSet() {
        return ScaleSet.fromLegacy(this);
    }

    public double[] toArray() {
        return fields.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LegacyScaleSet)) {
            return false;
        }
        return Arrays.equals(fields, ((LegacyScaleSet) o).fields);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(fields);
    }
}
