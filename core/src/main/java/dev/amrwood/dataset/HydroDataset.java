/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.dataset;

import java.util.List;

import dev.amrwood.metadata.Component;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.row.RowTable;
import dev.amrwood.units.ScaleSet;

/**
 * Leaf cells of the hydro component. Rows carry {@code level, cx, cy, cz, cpu}
 * next to the loaded variables.
 */
public record HydroDataset(
        RowTable table,
        SimulationInfo info,
        ScaleSet scale,
        List<String> variables,
        int lmin,
        int lmax,
        Ranges ranges) implements Dataset {

    public HydroDataset {
        variables = List.copyOf(variables);
    }

    @Override
    public Component component() {
        return Component.HYDRO;
    }

    @Override
    public HydroDataset withTable(RowTable table) {
        return new HydroDataset(table, info, scale, variables, lmin, lmax, ranges);
    }
}
