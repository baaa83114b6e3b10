/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.metadata;

/**
 * Coarse grid layout from the AMR file header.
 */
public record GridInfo(
        int nx,
        int ny,
        int nz,
        int nlevelmax,
        int ngridmax,
        int nboundary,
        int ngridCurrent) {

    public static final GridInfo NONE = new GridInfo(1, 1, 1, 0, 0, 0, 0);
}
