/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.units;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Conversion factors from code units to named physical units.
 * <p>
 * A scale set is derived from the four {@link BaseUnits} of a snapshot and
 * the {@link PhysicalConstants}. It is immutable and freely shareable.
 * </p>
 * <pre>{@code
 * ScaleSet scale = ScaleSet.create(BaseUnits.of(unitL, unitD, unitT));
 * double massInMsol = massInCodeUnits * scale.resolve("Msol");
 * }</pre>
 */
public final class ScaleSet {

    /** Symbol standing for "no conversion". */
    public static final String STANDARD = "standard";

    private final BaseUnits baseUnits;
    private final Map<Unit, Double> factors;

    private ScaleSet(BaseUnits baseUnits, Map<Unit, Double> factors) {
        this.baseUnits = baseUnits;
        this.factors = Collections.unmodifiableMap(factors);
    }

    /**
     * Derives every {@link Unit} factor from the given base units.
     */
    public static ScaleSet create(BaseUnits baseUnits) {
        Map<Unit, Double> factors = new EnumMap<>(Unit.class);
        for (Unit unit : Unit.values()) {
            factors.put(unit, unit.factor(baseUnits));
        }
        return new ScaleSet(baseUnits, factors);
    }

    public static ScaleSet create(double unitL, double unitD, double unitT, double unitM) {
        return create(new BaseUnits(unitL, unitD, unitT, unitM));
    }

    /**
     * Builds a scale set carrying only the fields of a legacy record.
     * Units outside the legacy layout are unavailable on the result.
     */
    public static ScaleSet fromLegacy(LegacyScaleSet legacy) {
        Map<Unit, Double> factors = new EnumMap<>(Unit.class);
        for (Unit unit : LegacyScaleSet.LAYOUT) {
            factors.put(unit, legacy.get(unit));
        }
        return new ScaleSet(null, factors);
    }

    /**
     * Remaps this scale set onto the legacy 32-field layout.
     */
    public LegacyScaleSet toLegacy() {
        double[] values = new double[LegacyScaleSet.LAYOUT.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = get(LegacyScaleSet.LAYOUT.get(i));
        }
        return LegacyScaleSet.of(values);
    }

    /**
     * Resolves a unit symbol to its factor.
     * <p>
     * {@code null} and {@value #STANDARD} resolve to 1 (code units).
     * </p>
     *
     * @throws UnknownUnitException if the symbol is not a known unit or is
     *         not carried by this scale set
     */
    public double resolve(String symbol) {
        if (symbol == null || STANDARD.equals(symbol)) {
            return 1.0;
        }
        Unit unit = Unit.forSymbol(symbol).orElseThrow(() -> new UnknownUnitException(symbol));
        Double factor = factors.get(unit);
        if (factor == null) {
            throw new UnknownUnitException(symbol, "Unit '" + symbol + "' is not available in this scale set");
        }
        return factor;
    }

    /**
     * Resolves a unit symbol and checks that it has the expected dimension.
     */
    public double resolve(String symbol, UnitKind expectedKind) {
        if (symbol == null || STANDARD.equals(symbol)) {
            return 1.0;
        }
        Unit unit = Unit.forSymbol(symbol).orElseThrow(() -> new UnknownUnitException(symbol));
        if (unit.kind() != expectedKind) {
            throw new IllegalArgumentException("Unit '" + symbol + "' is a " + unit.kind()
                    + " unit, expected " + expectedKind);
        }
        return resolve(symbol);
    }

    public double get(Unit unit) {
        Double factor = factors.get(unit);
        if (factor == null) {
            throw new UnknownUnitException(unit.symbol(), "Unit '" + unit.symbol() + "' is not available in this scale set");
        }
        return factor;
    }

    public boolean isAvailable(Unit unit) {
        return factors.containsKey(unit);
    }

    public Set<Unit> units() {
        return factors.keySet();
    }

    /**
     * The base units this set was derived from, or null for a set built from a legacy record.
     */
    public BaseUnits baseUnits() {
        return baseUnits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScaleSet)) {
            return false;
        }
        return factors.equals(((ScaleSet) o).factors);
    }

    @Override
    public int hashCode() {
        return factors.hashCode();
    }

    @Override
    public String toString() {
        return "ScaleSet" + factors;
    }
}
