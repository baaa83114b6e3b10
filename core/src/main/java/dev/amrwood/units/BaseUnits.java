/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.units;

/**
 * The four code-to-cgs conversion factors a RAMSES snapshot declares.
 *
 * @param unitL length unit [cm]
 * @param unitD density unit [g/cm^3]
 * @param unitT time unit [s]
 * @param unitM mass unit [g], normally {@code unitD * unitL^3}
 */
public record BaseUnits(double unitL, double unitD, double unitT, double unitM) {

    public BaseUnits {
        if (!(unitL > 0) || !(unitD > 0) || !(unitT > 0) || !(unitM > 0)) {
            throw new IllegalArgumentException("Base units must be positive: l=" + unitL
                    + ", d=" + unitD + ", t=" + unitT + ", m=" + unitM);
        }
    }

    /**
     * Base units with the mass unit derived from length and density.
     */
    public static BaseUnits of(double unitL, double unitD, double unitT) {
        return new BaseUnits(unitL, unitD, unitT, unitD * unitL * unitL * unitL);
    }

    /** Velocity unit [cm/s]. */
    public double unitV() {
        return unitL / unitT;
    }
}
