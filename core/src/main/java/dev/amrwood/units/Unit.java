/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.units;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

import static dev.amrwood.units.PhysicalConstants.AU;
import static dev.amrwood.units.PhysicalConstants.EV;
import static dev.amrwood.units.PhysicalConstants.KB;
import static dev.amrwood.units.PhysicalConstants.LSOL;
import static dev.amrwood.units.PhysicalConstants.LY;
import static dev.amrwood.units.PhysicalConstants.MEARTH;
import static dev.amrwood.units.PhysicalConstants.MH;
import static dev.amrwood.units.PhysicalConstants.MJUPITER;
import static dev.amrwood.units.PhysicalConstants.MSOL;
import static dev.amrwood.units.PhysicalConstants.MU;
import static dev.amrwood.units.PhysicalConstants.PC;
import static dev.amrwood.units.PhysicalConstants.X_FRACTION;
import static dev.amrwood.units.PhysicalConstants.YR;

/**
 * Named physical units a code-unit value can be converted to.
 * <p>
 * Each unit knows how to derive its conversion factor from the snapshot's
 * {@link BaseUnits}: multiplying a code-unit value by the factor yields the
 * value in that unit.
 * </p>
 */
public enum Unit {

    // ==================== Length ====================

    MPC("Mpc", UnitKind.LENGTH, b -> b.unitL() / PC / 1e6),
    KPC("kpc", UnitKind.LENGTH, b -> b.unitL() / PC / 1e3),
    PARSEC("pc", UnitKind.LENGTH, b -> b.unitL() / PC),
    MILLIPARSEC("mpc", UnitKind.LENGTH, b -> b.unitL() / PC * 1e3),
    LIGHT_YEAR("ly", UnitKind.LENGTH, b -> b.unitL() / LY),
    ASTRONOMICAL_UNIT("Au", UnitKind.LENGTH, b -> b.unitL() / AU),
    KILOMETER("km", UnitKind.LENGTH, b -> b.unitL() / 1e5),
    METER("m", UnitKind.LENGTH, b -> b.unitL() / 1e2),
    CENTIMETER("cm", UnitKind.LENGTH, BaseUnits::unitL),
    MILLIMETER("mm", UnitKind.LENGTH, b -> b.unitL() * 10.0),
    MICROMETER("μm", UnitKind.LENGTH, b -> b.unitL() * 1e4, "um"),

    // ==================== Volume ====================

    MPC3("Mpc3", UnitKind.VOLUME, b -> cube(b.unitL() / PC / 1e6)),
    KPC3("kpc3", UnitKind.VOLUME, b -> cube(b.unitL() / PC / 1e3)),
    PARSEC3("pc3", UnitKind.VOLUME, b -> cube(b.unitL() / PC)),
    MILLIPARSEC3("mpc3", UnitKind.VOLUME, b -> cube(b.unitL() / PC * 1e3)),
    LIGHT_YEAR3("ly3", UnitKind.VOLUME, b -> cube(b.unitL() / LY)),
    ASTRONOMICAL_UNIT3("Au3", UnitKind.VOLUME, b -> cube(b.unitL() / AU)),
    KILOMETER3("km3", UnitKind.VOLUME, b -> cube(b.unitL() / 1e5)),
    METER3("m3", UnitKind.VOLUME, b -> cube(b.unitL() / 1e2)),
    CENTIMETER3("cm3", UnitKind.VOLUME, b -> cube(b.unitL())),
    MILLIMETER3("mm3", UnitKind.VOLUME, b -> cube(b.unitL() * 10.0)),
    MICROMETER3("μm3", UnitKind.VOLUME, b -> cube(b.unitL() * 1e4), "um3"),

    // ==================== Density ====================

    MSOL_PC3("Msol_pc3", UnitKind.DENSITY, b -> b.unitD() * cube(PC) / MSOL, "Msun_pc3"),
    G_CM3("g_cm3", UnitKind.DENSITY, BaseUnits::unitD),
    MSOL_PC2("Msol_pc2", UnitKind.COLUMN_DENSITY, b -> b.unitD() * b.unitL() * PC * PC / MSOL, "Msun_pc2"),
    G_CM2("g_cm2", UnitKind.COLUMN_DENSITY, b -> b.unitD() * b.unitL()),
    ATOMS_CM2("atoms_cm2", UnitKind.COLUMN_DENSITY, b -> b.unitD() * b.unitL() / MH, "NH_cm2"),

    // ==================== Time ====================

    GYR("Gyr", UnitKind.TIME, b -> b.unitT() / YR / 1e9),
    MYR("Myr", UnitKind.TIME, b -> b.unitT() / YR / 1e6),
    YEAR("yr", UnitKind.TIME, b -> b.unitT() / YR),
    SECOND("s", UnitKind.TIME, BaseUnits::unitT),
    MILLISECOND("ms", UnitKind.TIME, b -> b.unitT() * 1e3),

    // ==================== Mass ====================

    MSOL_MASS("Msol", UnitKind.MASS, b -> b.unitD() * cube(b.unitL()) / MSOL, "Msun"),
    MEARTH_MASS("Mearth", UnitKind.MASS, b -> b.unitD() * cube(b.unitL()) / MEARTH),
    MJUPITER_MASS("Mjupiter", UnitKind.MASS, b -> b.unitD() * cube(b.unitL()) / MJUPITER),
    GRAM("g", UnitKind.MASS, b -> b.unitD() * cube(b.unitL())),

    // ==================== Velocity ====================

    KM_S("km_s", UnitKind.VELOCITY, b -> b.unitV() / 1e5),
    M_S("m_s", UnitKind.VELOCITY, b -> b.unitV() / 1e2),
    CM_S("cm_s", UnitKind.VELOCITY, BaseUnits::unitV),

    // ==================== Number density ====================

    NH("nH", UnitKind.NUMBER_DENSITY, b -> X_FRACTION / MH * b.unitD(), "n_e"),
    PER_CM3("cm_3", UnitKind.NUMBER_DENSITY, b -> 1.0 / cube(b.unitL())),
    PER_PC3("pc_3", UnitKind.NUMBER_DENSITY, b -> 1.0 / cube(b.unitL()) / cube(PC)),

    // ==================== Energy ====================

    ERG("erg", UnitKind.ENERGY, b -> b.unitM() * square(b.unitV())),
    ELECTRON_VOLT("eV", UnitKind.ENERGY, b -> b.unitM() * square(b.unitV()) / EV),
    KILO_ELECTRON_VOLT("keV", UnitKind.ENERGY, b -> b.unitM() * square(b.unitV()) / EV / 1e3),
    MEGA_ELECTRON_VOLT("MeV", UnitKind.ENERGY, b -> b.unitM() * square(b.unitV()) / EV / 1e6),

    // ==================== Temperature ====================

    T_MU("T_mu", UnitKind.TEMPERATURE, b -> MH / KB * square(b.unitV()), "K_mu"),
    KELVIN("K", UnitKind.TEMPERATURE, b -> MH / KB * square(b.unitV()) * MU, "T"),

    // ==================== Pressure ====================

    BARYE("Ba", UnitKind.PRESSURE, b -> b.unitM() / b.unitL() / square(b.unitT()), "g_cm_s2"),
    G_CMS2("g_cms2", UnitKind.PRESSURE, b -> b.unitM() / (b.unitL() * square(b.unitT()))),
    P_KB("p_kB", UnitKind.PRESSURE, b -> b.unitM() / b.unitL() / square(b.unitT()) / KB, "K_cm3"),

    // ==================== Entropy ====================

    ERG_G_K("erg_g_K", UnitKind.ENTROPY, Unit::specificEntropy),
    KEV_CM2("keV_cm2", UnitKind.ENTROPY, b -> specificEntropy(b) * b.unitD() * square(b.unitL()) / EV * 1000.0),
    ERG_K("erg_K", UnitKind.ENTROPY, b -> specificEntropy(b) * b.unitD() * cube(b.unitL())),
    J_K("J_K", UnitKind.ENTROPY, b -> specificEntropy(b) * b.unitD() * cube(b.unitL()) / 1e7),
    ERG_CM3_K("erg_cm3_K", UnitKind.ENTROPY, b -> specificEntropy(b) * b.unitD()),
    J_M3_K("J_m3_K", UnitKind.ENTROPY, b -> specificEntropy(b) * b.unitD() * 1e1),

    // ==================== Angular momentum ====================

    G_CM2_S("g_cm2_s", UnitKind.ANGULAR_MOMENTUM, b -> b.unitM() * square(b.unitL()) / b.unitT()),
    J_S("J_s", UnitKind.ANGULAR_MOMENTUM, b -> b.unitM() * square(b.unitL()) / b.unitT() * 1e-7, "kg_m2_s"),
    MSOL_KM_S_KPC("Msol_km_s_kpc", UnitKind.ANGULAR_MOMENTUM,
            b -> b.unitM() / MSOL * b.unitV() / 1e5 * b.unitL() / PC / 1e3, "Msun_km_s_kpc"),

    // ==================== Magnetic field ====================

    GAUSS("Gauss", UnitKind.MAGNETIC_FIELD, Unit::gauss),
    MICRO_GAUSS("muG", UnitKind.MAGNETIC_FIELD, b -> gauss(b) * 1e6, "microG", "μG"),
    TESLA("Tesla", UnitKind.MAGNETIC_FIELD, b -> gauss(b) * 1e-4),

    // ==================== Luminosity, cooling and flux ====================

    ERG_S("erg_s", UnitKind.LUMINOSITY, b -> b.unitM() * square(b.unitV()) / b.unitT()),
    LSOL_LUMINOSITY("Lsol", UnitKind.LUMINOSITY, b -> b.unitM() * square(b.unitV()) / b.unitT() / LSOL, "Lsun"),
    ERG_G_S("erg_g_s", UnitKind.COOLING_RATE, b -> square(b.unitV()) / b.unitT()),
    ERG_CM3_S("erg_cm3_s", UnitKind.COOLING_RATE, b -> b.unitM() / (b.unitL() * cube(b.unitT()))),
    ERG_CM2_S("erg_cm2_s", UnitKind.FLUX, b -> b.unitD() * cube(b.unitV())),
    JANSKY("Jy", UnitKind.FLUX, b -> b.unitD() * cube(b.unitV()) / 1e-23),
    MILLI_JANSKY("mJy", UnitKind.FLUX, b -> b.unitD() * cube(b.unitV()) / 1e-23 * 1e3),
    MICRO_JANSKY("microJy", UnitKind.FLUX, b -> b.unitD() * cube(b.unitV()) / 1e-23 * 1e6),

    // ==================== Acceleration and specific energy ====================

    CM_S2("cm_s2", UnitKind.ACCELERATION, b -> b.unitL() / square(b.unitT())),
    M_S2("m_s2", UnitKind.ACCELERATION, b -> b.unitL() / square(b.unitT()) / 1e2),
    KM_S2("km_s2", UnitKind.ACCELERATION, b -> b.unitL() / square(b.unitT()) / 1e5),
    PC_MYR2("pc_Myr2", UnitKind.ACCELERATION, b -> b.unitL() / square(b.unitT()) / PC * square(YR * 1e6)),
    ERG_G("erg_g", UnitKind.SPECIFIC_ENERGY, b -> square(b.unitV())),
    J_KG("J_kg", UnitKind.SPECIFIC_ENERGY, b -> square(b.unitV()) / 1e4),
    KM2_S2("km2_s2", UnitKind.SPECIFIC_ENERGY, b -> square(b.unitV()) / 1e10),
    DYNE("dyne", UnitKind.FORCE, b -> b.unitM() * b.unitL() / square(b.unitT())),

    // ==================== Dimensionless ====================

    DIMENSIONLESS("dimensionless", UnitKind.DIMENSIONLESS, b -> 1.0),
    RADIAN("rad", UnitKind.ANGLE, b -> 1.0),
    DEGREE("deg", UnitKind.ANGLE, b -> 180.0 / Math.PI);

    private static final Map<String, Unit> BY_SYMBOL;

    static {
        Map<String, Unit> bySymbol = new HashMap<>();
        for (Unit unit : values()) {
            bySymbol.put(unit.symbol, unit);
            for (String alias : unit.aliases) {
                bySymbol.put(alias, unit);
            }
        }
        BY_SYMBOL = Collections.unmodifiableMap(bySymbol);
    }

    private final String symbol;
    private final UnitKind kind;
    private final ToDoubleFunction<BaseUnits> derivation;
    private final List<String> aliases;

    Unit(String symbol, UnitKind kind, ToDoubleFunction<BaseUnits> derivation, String... aliases) {
        this.symbol = symbol;
        this.kind = kind;
        this.derivation = derivation;
        this.aliases = List.of(aliases);
    }

    public String symbol() {
        return symbol;
    }

    public UnitKind kind() {
        return kind;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Computes the code-to-unit factor for the given base units.
     */
    public double factor(BaseUnits baseUnits) {
        return derivation.applyAsDouble(baseUnits);
    }

    /**
     * Looks up a unit by its symbol or one of its aliases.
     */
    public static Optional<Unit> forSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    private static double square(double value) {
        return value * value;
    }

    private static double cube(double value) {
        return value * value * value;
    }

    private static double specificEntropy(BaseUnits b) {
        return b.unitM() * square(b.unitV()) / (b.unitD() * cube(b.unitL())) / KB;
    }

    private static double gauss(BaseUnits b) {
        return Math.sqrt(4 * Math.PI * b.unitM() / (b.unitL() * square(b.unitT())));
    }
}
