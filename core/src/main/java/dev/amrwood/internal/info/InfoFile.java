/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.info;

import java.util.List;

/**
 * Parsed content of an {@code info_XXXXX.txt} file.
 */
public record InfoFile(
        int ncpu,
        int ndim,
        int levelmin,
        int levelmax,
        int ngridmax,
        int nstepCoarse,
        double boxlen,
        double time,
        double aexp,
        double h0,
        double omegaM,
        double omegaL,
        double omegaK,
        double omegaB,
        double unitL,
        double unitD,
        double unitT,
        String ordering,
        List<Double> boundKeys) {

    public InfoFile {
        boundKeys = List.copyOf(boundKeys);
    }
}
