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
 * Particles. Rows carry {@code level, x, y, z, id, cpu} (positions in code length
 * units) and, for layout version 1, {@code family} and {@code tag}.
 */
public record ParticleDataset(
        RowTable table,
        SimulationInfo info,
        ScaleSet scale,
        List<String> variables,
        int lmin,
        int lmax,
        Ranges ranges) implements Dataset {

    public ParticleDataset {
        variables = List.copyOf(variables);
    }

    @Override
    public Component component() {
        return Component.PARTICLES;
    }

    /**
     * The particle file layout version (0 or 1).
     */
    public int version() {
        return info.particleDescriptor().version();
    }

    @Override
    public ParticleDataset withTable(RowTable table) {
        return new ParticleDataset(table, info, scale, variables, lmin, lmax, ranges);
    }
}
