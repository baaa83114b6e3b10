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
 * Particle families as encoded in the {@code family} column of layout version 1.
 * <p>
 * Layout version 0 files carry no family; there stars are the particles with a
 * non-zero birth time and dark matter the rest.
 * </p>
 */
public enum ParticleFamily {
    ALL(0, "all"),
    DM(1, "dm", "dark_matter"),
    STARS(2, "stars", "star"),
    CLOUD(3, "cloud"),
    DEBRIS(4, "debris"),
    OTHER(5, "other"),
    UNDEFINED(127, "undefined"),
    GAS_TRACER(0, "gas_tracer"),
    DM_TRACER(-1, "dm_tracer"),
    STAR_TRACER(-2, "star_tracer"),
    CLOUD_TRACER(-3, "cloud_tracer"),
    DEBRIS_TRACER(-4, "debris_tracer"),
    OTHER_TRACER(-5, "other_tracer");

    private final int code;
    private final String[] names;

    ParticleFamily(int code, String... names) {
        this.code = code;
        this.names = names;
    }

    /**
     * The value of the family column, meaningless for {@link #ALL}.
     */
    public int code() {
        return code;
    }

    /**
     * @throws IllegalArgumentException for an unknown family name
     */
    public static ParticleFamily parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Particle family cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ParticleFamily family : values()) {
            for (String name : family.names) {
                if (name.equals(normalized)) {
                    return family;
                }
            }
        }
        throw new IllegalArgumentException("Unknown particle family '" + value + "'");
    }

    /**
     * Whether a particle belongs to this family.
     *
     * @param version the particle layout version
     * @param family the family column value, ignored for layout version 0
     * @param birth the birth time, used for layout version 0
     */
    boolean matches(int version, int family, double birth) {
        if (this == ALL) {
            return true;
        }
        if (version == 0) {
            return switch (this) {
                case STARS -> birth != 0;
                case DM -> birth == 0;
                default -> false;
            };
        }
        return family == code;
    }
}
