/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.units;

/**
 * Physical constants in cgs units (IAU, CODATA 2018 and the RAMSES cooling module).
 */
public final class PhysicalConstants {

    /** Astronomical unit [cm]. */
    public static final double AU = 1.495978707e13;
    /** Parsec [cm]. */
    public static final double PC = 3.08567758128e18;
    public static final double KPC = PC * 1e3;
    public static final double MPC = PC * 1e6;
    /** Light year [cm]. */
    public static final double LY = 9.4607304725808e17;

    /** Solar mass [g]. */
    public static final double MSOL = 1.9891e33;
    /** Solar radius [cm]. */
    public static final double RSOL = 6.96e10;
    /** Solar luminosity [erg/s]. */
    public static final double LSOL = 3.828e33;
    public static final double MEARTH = 5.9722e27;
    public static final double MJUPITER = 1.89813e30;

    public static final double ME = 9.1093837015e-28;
    public static final double MP = 1.67262192369e-24;
    public static final double MN = 1.67492749804e-24;
    /** Hydrogen atom mass as used by RAMSES [g]. */
    public static final double MH = 1.66e-24;
    /** Atomic mass unit [g]. */
    public static final double AMU = 1.66053906660e-24;
    public static final double NA = 6.02214076e23;

    /** Speed of light [cm/s]. */
    public static final double C = 2.99792458e10;
    /** Planck constant [erg s]. */
    public static final double H = 6.62607015e-27;
    public static final double HBAR = H / (2 * Math.PI);
    /** Gravitational constant [cm^3 g^-1 s^-2]. */
    public static final double G = 6.67430e-8;
    /** Boltzmann constant [erg/K]. */
    public static final double KB = 1.380649e-16;

    public static final double SIGMA_SB = 5.670374419e-5;
    public static final double SIGMA_T = 6.6524587321e-25;
    public static final double ALPHA_FS = 7.2973525693e-3;
    public static final double R_GAS = 8.314462618e7;

    /** Electron volt [erg]. */
    public static final double EV = 1.602176634e-12;
    public static final double KEV = EV * 1e3;
    public static final double MEV = EV * 1e6;

    /** Julian year [s]. */
    public static final double YR = 3.15576e7;
    public static final double MYR = YR * 1e6;
    public static final double GYR = YR * 1e9;
    public static final double DAY = 86400.0;

    /** Hydrogen mass fraction used by RAMSES. */
    public static final double X_FRACTION = 0.76;
    /** Mean molecular weight corresponding to {@link #X_FRACTION}. */
    public static final double MU = 1.0 / X_FRACTION;

    private PhysicalConstants() {
        // Constants holder
    }
}
