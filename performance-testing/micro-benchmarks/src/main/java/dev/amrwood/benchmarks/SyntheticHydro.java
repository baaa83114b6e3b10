/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.benchmarks;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

import dev.amrwood.dataset.HydroDataset;
import dev.amrwood.dataset.Ranges;
import dev.amrwood.metadata.Component;
import dev.amrwood.metadata.ComponentDescriptor;
import dev.amrwood.metadata.GridInfo;
import dev.amrwood.metadata.ParticleHeader;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.row.Column;
import dev.amrwood.row.RowTable;
import dev.amrwood.row.ShardRange;
import dev.amrwood.units.BaseUnits;
import dev.amrwood.units.ScaleSet;

/**
 * Builds in-memory hydro datasets of a fully refined level, without touching disk.
 */
final class SyntheticHydro {

    private static final List<String> VARIABLES = List.of("rho", "vx", "vy", "vz", "p");

    private SyntheticHydro() {
    }

    static HydroDataset uniform(int level, long seed) {
        int cellsPerAxis = 1 << level;
        int rows = cellsPerAxis * cellsPerAxis * cellsPerAxis;
        SplittableRandom random = new SplittableRandom(seed);

        double[][] values = new double[VARIABLES.size()][rows];
        int[] levels = new int[rows];
        int[] cx = new int[rows];
        int[] cy = new int[rows];
        int[] cz = new int[rows];
        int[] cpu = new int[rows];
        int row = 0;
        for (int i = 1; i <= cellsPerAxis; i++) {
            for (int j = 1; j <= cellsPerAxis; j++) {
                for (int k = 1; k <= cellsPerAxis; k++) {
                    values[0][row] = 0.1 + random.nextDouble();
                    values[1][row] = random.nextDouble() - 0.5;
                    values[2][row] = random.nextDouble() - 0.5;
                    values[3][row] = random.nextDouble() - 0.5;
                    values[4][row] = 0.01 + random.nextDouble();
                    levels[row] = level;
                    cx[row] = i;
                    cy[row] = j;
                    cz[row] = k;
                    cpu[row] = 1;
                    row++;
                }
            }
        }

        List<Column> columns = List.of(
                new Column.DoubleColumn("rho", values[0]),
                new Column.DoubleColumn("vx", values[1]),
                new Column.DoubleColumn("vy", values[2]),
                new Column.DoubleColumn("vz", values[3]),
                new Column.DoubleColumn("p", values[4]),
                new Column.IntColumn("level", levels),
                new Column.IntColumn("cx", cx),
                new Column.IntColumn("cy", cy),
                new Column.IntColumn("cz", cz),
                new Column.IntColumn("cpu", cpu));
        RowTable table = new RowTable(columns, List.of(new ShardRange(1, 0, rows)));

        SimulationInfo info = info(level);
        return new HydroDataset(table, info, info.scale(), VARIABLES, level, level, Ranges.FULL);
    }

    private static SimulationInfo info(int level) {
        BaseUnits units = BaseUnits.of(3.085677581e21, 6.77e-23, 4.70e14);
        return new SimulationInfo(1, Path.of("synthetic"), Path.of("synthetic", "output_00001"), 1, 3, level, level,
                1 << (3 * level), 0, 48.0, 0.0, 1.0, 70.0, 0.3, 0.7, 0.0, 0.045, units, "hilbert", List.of(),
                new GridInfo(1, 1, 1, level, 1 << (3 * level), 0, 1 << (3 * level)), 5.0 / 3.0,
                new ComponentDescriptor(Component.HYDRO, 0, false, List.of(), VARIABLES),
                ComponentDescriptor.absent(Component.GRAVITY), ComponentDescriptor.absent(Component.PARTICLES),
                ComponentDescriptor.absent(Component.CLUMPS), ParticleHeader.NONE, Map.of(),
                EnumSet.of(Component.AMR, Component.HYDRO), ScaleSet.create(units));
    }
}
