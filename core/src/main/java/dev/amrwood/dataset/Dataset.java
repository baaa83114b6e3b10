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
 * Loaded rows of one component together with the metadata needed to interpret them.
 * <p>
 * Datasets are immutable. Region selection returns a dataset of the same variant
 * in which only the row table is replaced.
 * </p>
 */
public sealed interface Dataset permits HydroDataset, GravityDataset, ParticleDataset, ClumpDataset {

    Component component();

    RowTable table();

    SimulationInfo info();

    ScaleSet scale();

    /**
     * Names of the stored variables that were loaded.
     */
    List<String> variables();

    int lmin();

    int lmax();

    /**
     * The normalized spatial window the rows were loaded from.
     */
    Ranges ranges();

    /**
     * Returns a copy of this dataset with a different row table.
     */
    Dataset withTable(RowTable table);

    default int rowCount() {
        return table().rowCount();
    }

    default boolean isCellBased() {
        return component().isCellBased();
    }
}
