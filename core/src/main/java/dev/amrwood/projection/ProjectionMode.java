/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.projection;

import java.util.Locale;

/**
 * How the contributions that fall into one pixel are combined.
 */
public enum ProjectionMode {
    /** Raw values are added; conserves extensive quantities. */
    SUM,
    /** Area-weighted average of the contributions. */
    MEAN,
    /** Average weighted by the {@link Weighting} quantity. */
    WEIGHTED,
    /** Largest contribution. */
    MAX;

    /**
     * @throws IllegalArgumentException for an unknown mode
     */
    public static ProjectionMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Mode cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sum" -> SUM;
            case "mean" -> MEAN;
            case "weighted", "standard" -> WEIGHTED;
            case "max" -> MAX;
            default -> throw new IllegalArgumentException("Unknown projection mode '" + value
                    + "', expected sum, mean, weighted or max");
        };
    }
}
