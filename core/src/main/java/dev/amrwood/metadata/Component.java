/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.metadata;

/**
 * Physics components a RAMSES snapshot may contain.
 */
public enum Component {
    AMR("amr"),
    HYDRO("hydro"),
    GRAVITY("gravity"),
    PARTICLES("particles"),
    CLUMPS("clumps"),
    RT("rt"),
    SINKS("sinks");

    private final String label;

    Component(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Whether the component's rows are AMR cells.
     */
    public boolean isCellBased() {
        return this == HYDRO || this == GRAVITY || this == RT;
    }
}
