/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.stats;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.amrwood.dataset.HydroDataset;
import dev.amrwood.dataset.ParticleDataset;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.reader.Amrwood;
import dev.amrwood.testing.SnapshotWriter;
import dev.amrwood.variables.Getvar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class MassStatisticsTest {

    @TempDir
    Path tempDir;

    private Amrwood amrwood;
    private HydroDataset gas;
    private ParticleDataset particles;

    @BeforeEach
    void setUp() throws IOException {
        amrwood = Amrwood.create(2);
        SimulationInfo info = amrwood.getInfo(SnapshotWriter.in(tempDir).write(), SnapshotWriter.OUTPUT);
        gas = amrwood.readHydro(info);
        particles = amrwood.readParticles(info);
    }

    @AfterEach
    void tearDown() {
        amrwood.close();
    }

    // ==================== Totals Tests ====================

    @Test
    void testGasMass() {
        double code = MassStatistics.msum(gas);

        assertThat(code).isCloseTo(SnapshotWriter.gasMass(2), within(1e-9 * code));
        assertThat(MassStatistics.msum(gas, "Msol", null)).isCloseTo(code * gas.scale().resolve("Msol"),
                within(1e-9 * code * gas.scale().resolve("Msol")));
    }

    @Test
    void testMaskedMass() {
        boolean[] mask = new boolean[particles.rowCount()];
        mask[1] = true;
        mask[3] = true;

        assertThat(MassStatistics.msum(particles)).isCloseTo(1e-2, within(1e-15));
        assertThat(MassStatistics.msum(particles, null, mask)).isCloseTo(5e-3, within(1e-15));
    }

    @Test
    void testEmptySelectionHasNoMass() {
        assertThat(MassStatistics.msum(gas, "Msol", new boolean[gas.rowCount()])).isZero();
    }

    // ==================== Average Tests ====================

    @Test
    void testCenterOfMass() {
        double[] center = MassStatistics.centerOfMass(particles, null, null);

        assertThat(center[0]).isCloseTo(42.5, within(1e-9));
        assertThat(center[1]).isCloseTo(50.5, within(1e-9));
        assertThat(center[2]).isCloseTo(52.5, within(1e-9));
    }

    @Test
    void testBulkVelocity() {
        double[] velocity = MassStatistics.bulkVelocity(particles, null, null);

        assertThat(velocity[0]).isCloseTo(-0.3, within(1e-12));
        assertThat(velocity[1]).isCloseTo(0.2, within(1e-12));
        assertThat(velocity[2]).isCloseTo(0.3, within(1e-12));
    }

    @Test
    void testAverageMassWeighted() {
        double[] rho = gas.table().doubles("rho");
        double[] mass = new double[rho.length];
        double[] volume = Getvar.getvar(gas, "volume");
        double weighted = 0;
        double total = 0;
        for (int row = 0; row < rho.length; row++) {
            mass[row] = rho[row] * volume[row];
            weighted += rho[row] * mass[row];
            total += mass[row];
        }

        assertThat(MassStatistics.averageMassWeighted(gas, "rho", null, null))
                .isCloseTo(weighted / total, within(1e-9));
    }

    @Test
    void testAverageOfMassHonorsTheUnit() {
        double msol = particles.scale().resolve("Msol");

        // sum(m^2) / sum(m) = 3e-5 / 1e-2
        assertThat(MassStatistics.averageMassWeighted(particles, "mass", null, null)).isCloseTo(3e-3, within(1e-15));
        assertThat(MassStatistics.averageMassWeighted(particles, "mass", "Msol", null))
                .isCloseTo(3e-3 * msol, within(1e-9 * 3e-3 * msol));
        assertThat(MassStatistics.weightedStatistics(particles, "mass", "Msol", null).mean())
                .isCloseTo(3e-3 * msol, within(1e-9 * 3e-3 * msol));
        assertThat(MassStatistics.weightedStatistics(particles, "mass", "Msol", null).max())
                .isCloseTo(4e-3 * msol, within(1e-9 * 4e-3 * msol));
    }

    @Test
    void testAverageOverEmptySelection() {
        assertThatThrownBy(() -> MassStatistics.centerOfMass(gas, "kpc", new boolean[gas.rowCount()]))
                .isInstanceOf(EmptySelectionException.class)
                .hasMessageContaining("Cannot average x, y, z over 0 rows");
    }

    @Test
    void testAverageOfMasslessRows() {
        boolean[] mask = new boolean[particles.rowCount()];
        mask[2] = true;

        assertThatThrownBy(() -> MassStatistics.averageMassWeighted(particles, "vx", null, mask))
                .isInstanceOf(EmptySelectionException.class);
    }

    // ==================== Weighted Statistics Tests ====================

    @Test
    void testEqualWeights() {
        WeightedStatistics statistics = MassStatistics.weightedStatistics(new double[]{ 4, 1, 3, 2 }, null);

        assertThat(statistics.mean()).isEqualTo(2.5);
        assertThat(statistics.median()).isEqualTo(2.0);
        assertThat(statistics.std()).isCloseTo(Math.sqrt(1.25), within(1e-12));
        assertThat(statistics.skewness()).isCloseTo(0.0, within(1e-12));
        assertThat(statistics.kurtosis()).isCloseTo(-1.36, within(1e-12));
        assertThat(statistics.min()).isEqualTo(1.0);
        assertThat(statistics.max()).isEqualTo(4.0);
        assertThat(statistics.count()).isEqualTo(4);
    }

    @Test
    void testWeightsShiftMeanAndMedian() {
        WeightedStatistics statistics = MassStatistics.weightedStatistics(new double[]{ 1, 10 }, new double[]{ 3, 1 });

        assertThat(statistics.mean()).isEqualTo(3.25);
        assertThat(statistics.median()).isEqualTo(1.0);
        assertThat(statistics.skewness()).isPositive();
    }

    @Test
    void testConstantValuesHaveNoShape() {
        WeightedStatistics statistics = MassStatistics.weightedStatistics(new double[]{ 7, 7, 7 }, null);

        assertThat(statistics.std()).isZero();
        assertThat(statistics.skewness()).isZero();
        assertThat(statistics.kurtosis()).isZero();
    }

    @Test
    void testStatisticsOfDatasetVariable() {
        WeightedStatistics statistics = MassStatistics.weightedStatistics(gas, "level", null, null);

        assertThat(statistics.count()).isEqualTo(SnapshotWriter.LEAF_CELLS);
        assertThat(statistics.min()).isEqualTo(1.0);
        assertThat(statistics.max()).isEqualTo(2.0);
        assertThat(statistics.mean()).isBetween(1.0, 2.0);
    }

    @Test
    void testStatisticsValidation() {
        assertThatThrownBy(() -> MassStatistics.weightedStatistics(new double[]{ 1, 2 }, new double[]{ 1 }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Got 1 weights for 2 values");
        assertThatThrownBy(() -> MassStatistics.weightedStatistics(new double[0], null))
                .isInstanceOf(EmptySelectionException.class);
        assertThatThrownBy(() -> MassStatistics.weightedStatistics(new double[]{ 1, 2 }, new double[]{ 0, 0 }))
                .isInstanceOf(EmptySelectionException.class);
    }
}
