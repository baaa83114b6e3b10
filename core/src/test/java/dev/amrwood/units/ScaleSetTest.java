/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.units;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for unit factors and their lookup.
 */
public class ScaleSetTest {

    private static final BaseUnits KPC_UNITS = BaseUnits.of(3.085677581e21, 6.767e-23, 4.70e14);

    // ==================== Factor Tests ====================

    @Test
    void testLengthFactors() {
        ScaleSet scale = ScaleSet.create(KPC_UNITS);

        assertThat(scale.resolve("kpc")).isCloseTo(1.0, within(1e-9));
        assertThat(scale.resolve("pc")).isCloseTo(1000.0, within(1e-6));
        assertThat(scale.resolve("Mpc")).isCloseTo(1e-3, within(1e-12));
        assertThat(scale.resolve("cm")).isEqualTo(3.085677581e21);
    }

    @Test
    void testDerivedFactorsFollowBaseUnits() {
        ScaleSet scale = ScaleSet.create(KPC_UNITS);
        double unitM = 6.767e-23 * Math.pow(3.085677581e21, 3);
        double unitV = 3.085677581e21 / 4.70e14;

        assertThat(scale.resolve("g")).isCloseTo(unitM, within(unitM * 1e-12));
        assertThat(scale.resolve("Msol")).isCloseTo(unitM / PhysicalConstants.MSOL, within(unitM / PhysicalConstants.MSOL * 1e-12));
        assertThat(scale.resolve("km_s")).isCloseTo(unitV / 1e5, within(unitV * 1e-17));
        assertThat(scale.resolve("erg")).isCloseTo(unitM * unitV * unitV, within(unitM * unitV * unitV * 1e-12));
    }

    @Test
    void testFactorsScaleLinearlyWithLengthUnit() {
        ScaleSet single = ScaleSet.create(KPC_UNITS);
        ScaleSet doubled = ScaleSet.create(BaseUnits.of(2 * 3.085677581e21, 6.767e-23, 4.70e14));

        assertThat(doubled.resolve("kpc")).isCloseTo(2 * single.resolve("kpc"), within(1e-9));
        assertThat(doubled.resolve("g_cm2")).isCloseTo(2 * single.resolve("g_cm2"), within(single.resolve("g_cm2") * 1e-12));
        assertThat(doubled.resolve("Msol")).isCloseTo(8 * single.resolve("Msol"), within(single.resolve("Msol") * 1e-11));
    }

    @Test
    void testStandardMeansCodeUnits() {
        ScaleSet scale = ScaleSet.create(KPC_UNITS);

        assertThat(scale.resolve(null)).isEqualTo(1.0);
        assertThat(scale.resolve(ScaleSet.STANDARD)).isEqualTo(1.0);
        assertThat(scale.resolve("dimensionless")).isEqualTo(1.0);
    }

    @Test
    void testAliasesResolveToTheSameUnit() {
        ScaleSet scale = ScaleSet.create(KPC_UNITS);

        assertThat(scale.resolve("Msun")).isEqualTo(scale.resolve("Msol"));
        assertThat(scale.resolve("Msun_pc2")).isEqualTo(scale.resolve("Msol_pc2"));
    }

    // ==================== Lookup Error Tests ====================

    @Test
    void testUnknownUnit() {
        ScaleSet scale = ScaleSet.create(KPC_UNITS);

        assertThatThrownBy(() -> scale.resolve("furlong"))
                .isInstanceOf(UnknownUnitException.class)
                .hasMessageContaining("furlong");
    }

    @Test
    void testUnitOfWrongKind() {
        ScaleSet scale = ScaleSet.create(KPC_UNITS);

        assertThatThrownBy(() -> scale.resolve("Msol", UnitKind.LENGTH))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected");
        assertThat(scale.resolve("kpc", UnitKind.LENGTH)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void testBaseUnitsMustBePositive() {
        assertThatThrownBy(() -> BaseUnits.of(0.0, 1.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }

    // ==================== Legacy Layout Tests ====================

    @Test
    void testLegacyRoundTripKeepsLayoutFields() {
        ScaleSet scale = ScaleSet.create(KPC_UNITS);

        LegacyScaleSet legacy = scale.toLegacy();
        ScaleSet restored = legacy.toScaleSet();

        for (Unit unit : LegacyScaleSet.LAYOUT) {
            assertThat(restored.get(unit)).isEqualTo(scale.get(unit));
        }
        assertThat(restored.toLegacy()).isEqualTo(legacy);
        assertThat(restored.baseUnits()).isNull();
    }

    @Test
    void testLegacyScaleSetLacksNewerUnits() {
        ScaleSet restored = ScaleSet.create(KPC_UNITS).toLegacy().toScaleSet();

        assertThat(restored.isAvailable(Unit.KELVIN)).isFalse();
        assertThatThrownBy(() -> restored.resolve("K"))
                .isInstanceOf(UnknownUnitException.class)
                .hasMessageContaining("not available");
    }

    @Test
    void testLegacyRecordNeedsAllFields() {
        assertThatThrownBy(() -> LegacyScaleSet.of(1.0, 2.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 fields");
    }
}
