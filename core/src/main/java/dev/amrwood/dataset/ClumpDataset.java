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
 * Clump catalogue rows, one column per header token of the clump tables.
 */
public record ClumpDataset(
        RowTable table,
        SimulationInfo info,
        ScaleSet scale,
        List<String> variables,
        Ranges ranges) implements Dataset {

    public ClumpDataset {
        variables = List.copyOf(variables);
    }

    @Override
    public Component component() {
        return Component.CLUMPS;
    }

    @Override
    public int lmin() {
        return info.levelmin();
    }

    @Override
    public int lmax() {
        return info.levelmax();
    }

    @Override
    public ClumpDataset withTable(RowTable table) {
        return new ClumpDataset(table, info, scale, variables, ranges);
    }
}
