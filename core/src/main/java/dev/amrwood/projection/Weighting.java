/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.projection;

import java.util.Locale;

public enum Weighting {
    MASS("mass"),
    VOLUME("volume");

    private final String variable;

    Weighting(String variable) {
        this.variable = variable;
    }

    /**
     * The getvar key that supplies the weights.
     */
    public String variable() {
        return variable;
    }

    public static Weighting parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Weighting cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "mass" -> MASS;
            case "volume" -> VOLUME;
            default -> throw new IllegalArgumentException("Unknown weighting '" + value + "', expected mass or volume");
        };
    }
}
