/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.region;

import java.util.Locale;

public enum Shape {
    CUBOID,
    SPHERE,
    CYLINDER;

    /**
     * @throws IllegalArgumentException if the keyword is not {@code cuboid}, {@code sphere} or {@code cylinder}
     */
    public static Shape parse(String keyword) {
        if (keyword == null) {
            throw new IllegalArgumentException("Shape cannot be null");
        }
        return switch (keyword.trim().toLowerCase(Locale.ROOT)) {
            case "cuboid" -> CUBOID;
            case "sphere" -> SPHERE;
            case "cylinder" -> CYLINDER;
            default -> throw new IllegalArgumentException("Unknown shape '" + keyword
                    + "', expected cuboid, sphere or cylinder");
        };
    }
}
