/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.region;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.amrwood.dataset.Center;
import dev.amrwood.dataset.Direction;
import dev.amrwood.dataset.HydroDataset;
import dev.amrwood.dataset.ParticleDataset;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.reader.Amrwood;
import dev.amrwood.testing.SnapshotWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RegionSelectorTest {

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

    // ==================== Cuboid Tests ====================

    @Test
    void testCuboidInBoxFractions() {
        HydroDataset lower = RegionSelector.subregion(gas, RegionSpec.builder().xrange(0.0, 0.5).build());

        long expected = SnapshotWriter.leafCells().stream()
                .filter(cell -> cell[1] * SnapshotWriter.BOXLEN / (1 << cell[0]) <= 50.0)
                .count();
        assertThat(lower.rowCount()).isEqualTo((int) expected);
        assertThat(lower.lmax()).isEqualTo(gas.lmax());
        assertThat(lower.info()).isSameAs(gas.info());
    }

    @Test
    void testCuboidAroundCenterInPhysicalUnits() {
        ParticleDataset selected = RegionSelector.subregion(particles, RegionSpec.builder()
                .center(Center.boxCentre())
                .xrange(-30.0, 30.0)
                .yrange(-30.0, 30.0)
                .rangeUnit("kpc")
                .build());

        assertThat(selected.table().longs("id")).containsExactly(2, 4, 5);
    }

    @Test
    void testOpenBoundsReachTheBoxEdge() {
        ParticleDataset upper = RegionSelector.subregion(particles, RegionSpec.builder().zrange(0.5, null).build());

        assertThat(upper.table().longs("id")).containsExactly(2, 3, 5);
    }

    // ==================== Sphere and Cylinder Tests ====================

    @Test
    void testSphere() {
        RegionSpec small = RegionSpec.builder().shape("sphere").center(Center.boxCentre()).radius(0.3).build();
        RegionSpec large = RegionSpec.builder().shape(Shape.SPHERE).center(Center.boxCentre())
                .radius(50.0).rangeUnit("kpc").build();

        assertThat(RegionSelector.subregion(particles, small).table().longs("id")).containsExactly(2);
        assertThat(RegionSelector.subregion(particles, large).table().longs("id")).containsExactly(2, 5);
    }

    @Test
    void testCylinderHeightIsMeasuredFromTheCenter() {
        RegionSpec.Builder cylinder = RegionSpec.builder()
                .shape(Shape.CYLINDER)
                .center(Center.boxCentre())
                .radius(0.3);

        assertThat(RegionSelector.subregion(particles, cylinder.height(0.5).build()).table().longs("id"))
                .containsExactly(2, 5);
        assertThat(RegionSelector.subregion(particles, cylinder.height(0.4).build()).table().longs("id"))
                .containsExactly(2);
    }

    @Test
    void testCylinderAlongX() {
        RegionSpec spec = RegionSpec.builder()
                .shape(Shape.CYLINDER)
                .center(Center.boxCentre())
                .direction(Direction.X)
                .radius(0.4)
                .height(0.5)
                .build();

        assertThat(RegionSelector.subregion(particles, spec).table().longs("id")).containsExactly(1, 2);
    }

    // ==================== Cell Extent Tests ====================

    @Test
    void testCuboidKeepsOverlappingCellsInCellMode() {
        RegionSpec.Builder cuboid = RegionSpec.builder().xrange(0.0, 0.3);

        HydroDataset byPosition = RegionSelector.subregion(gas, cuboid.build());
        HydroDataset byExtent = RegionSelector.subregion(gas, cuboid.cell(true).build());

        // a cell spans [(cx - 1) * dx, cx * dx]
        long overlapping = SnapshotWriter.leafCells().stream()
                .filter(cell -> (cell[1] - 1) * SnapshotWriter.BOXLEN / (1 << cell[0]) < 30.0)
                .count();
        assertThat(byPosition.rowCount()).isEqualTo(4);
        assertThat(byExtent.rowCount()).isEqualTo((int) overlapping).isEqualTo(11);
    }

    @Test
    void testSphereTouchingCellCornersInCellMode() {
        RegionSpec.Builder sphere = RegionSpec.builder().shape(Shape.SPHERE).center(Center.boxCentre()).radius(0.1);

        HydroDataset byPosition = RegionSelector.subregion(gas, sphere.build());
        HydroDataset byExtent = RegionSelector.subregion(gas, sphere.cell(true).build());

        // every level-1 cell and one cell of each level-2 grid have a corner at the box centre
        assertThat(byPosition.rowCount()).isEqualTo(1);
        assertThat(byExtent.rowCount()).isEqualTo(8);
        assertThat(byExtent.table().ints("level")).containsOnly(1, 2);
    }

    @Test
    void testCellModeInverseAndIdempotence() {
        RegionSpec.Builder cuboid = RegionSpec.builder().xrange(0.0, 0.3).yrange(0.1, 0.6).cell(true);

        HydroDataset inside = RegionSelector.subregion(gas, cuboid.build());
        HydroDataset outside = RegionSelector.subregion(gas, cuboid.inverse(true).build());
        HydroDataset twice = RegionSelector.subregion(inside, cuboid.inverse(false).build());

        assertThat(inside.rowCount()).isPositive();
        assertThat(outside.rowCount()).isPositive();
        assertThat(inside.rowCount() + outside.rowCount()).isEqualTo(gas.rowCount());
        assertThat(twice.table().doubles("rho")).containsExactly(inside.table().doubles("rho"));
    }

    @Test
    void testCellModeTestsParticlesAtTheirPosition() {
        RegionSpec.Builder sphere = RegionSpec.builder().shape(Shape.SPHERE).center(Center.boxCentre()).radius(0.3);

        assertThat(RegionSelector.subregion(particles, sphere.cell(true).build()).table().longs("id"))
                .containsExactly(RegionSelector.subregion(particles, sphere.cell(false).build()).table().longs("id"));
    }

    // ==================== Inverse and Shell Tests ====================

    @Test
    void testInversePartitionsRows() {
        RegionSpec.Builder sphere = RegionSpec.builder().shape(Shape.SPHERE).center(Center.boxCentre()).radius(0.3);

        HydroDataset inside = RegionSelector.subregion(gas, sphere.build());
        HydroDataset outside = RegionSelector.subregion(gas, sphere.inverse(true).build());

        assertThat(inside.rowCount()).isPositive();
        assertThat(outside.rowCount()).isPositive();
        assertThat(inside.rowCount() + outside.rowCount()).isEqualTo(gas.rowCount());

        Set<String> keys = new HashSet<>();
        for (HydroDataset part : new HydroDataset[]{ inside, outside }) {
            int[] level = part.table().ints("level");
            int[] cx = part.table().ints("cx");
            int[] cy = part.table().ints("cy");
            int[] cz = part.table().ints("cz");
            for (int row = 0; row < part.rowCount(); row++) {
                keys.add(level[row] + "/" + cx[row] + "/" + cy[row] + "/" + cz[row]);
            }
        }
        assertThat(keys).hasSize(gas.rowCount());
    }

    @Test
    void testSelectionIsIdempotent() {
        RegionSpec spec = RegionSpec.builder().xrange(0.2, 0.8).yrange(0.0, 0.6).build();

        HydroDataset once = RegionSelector.subregion(gas, spec);
        HydroDataset twice = RegionSelector.subregion(once, spec);

        assertThat(twice.rowCount()).isEqualTo(once.rowCount());
        assertThat(twice.table().doubles("rho")).containsExactly(once.table().doubles("rho"));
    }

    @Test
    void testShell() {
        RegionSpec sphere = RegionSpec.builder().shape(Shape.SPHERE).center(Center.boxCentre()).radius(1.0).build();
        RegionSpec inverse = RegionSpec.builder().shape(Shape.SPHERE).center(Center.boxCentre()).radius(1.0)
                .inverse(true).build();

        assertThat(RegionSelector.shellregion(particles, sphere, 0.3, 0.5).table().longs("id")).containsExactly(5);
        assertThat(RegionSelector.shellregion(particles, inverse, 0.3, 0.5).table().longs("id"))
                .containsExactly(1, 2, 3, 4);
    }

    @Test
    void testShellRadii() {
        RegionSpec sphere = RegionSpec.builder().shape(Shape.SPHERE).radius(1.0).build();

        assertThatThrownBy(() -> RegionSelector.shellregion(gas, sphere, 0.5, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("0 <= inner < outer");
        assertThatThrownBy(() -> RegionSelector.shellregion(gas, sphere, -0.1, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RegionSelector.shellregion(gas, RegionSpec.builder().build(), 0.1, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("spheres and cylinders");
    }

    // ==================== Validation Tests ====================

    @Test
    void testSpecValidation() {
        assertThatThrownBy(() -> RegionSpec.builder().shape(Shape.SPHERE).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sphere radius must be positive");
        assertThatThrownBy(() -> RegionSpec.builder().shape(Shape.CYLINDER).radius(0.1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cylinder height must be positive");
        assertThatThrownBy(() -> RegionSpec.builder().xrange(0.6, 0.4).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inverted");
        assertThatThrownBy(() -> RegionSpec.builder().shape("cone"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown shape 'cone'");
    }

    @Test
    void testRangeUnitMustBeALength() {
        RegionSpec spec = RegionSpec.builder().xrange(0.0, 10.0).rangeUnit("Msol").build();

        assertThatThrownBy(() -> RegionSelector.subregion(gas, spec))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected LENGTH");
    }
}
