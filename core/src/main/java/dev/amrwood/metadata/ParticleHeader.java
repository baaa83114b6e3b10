/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.metadata;

/**
 * Particle counts from the snapshot's header file.
 * <p>
 * Layout version 0 headers only carry the totals; version 1 headers carry
 * one count per particle family.
 * </p>
 */
public record ParticleHeader(
        int version,
        long total,
        long dm,
        long stars,
        long sinks,
        long cloud,
        long debris,
        long other,
        long undefined,
        long otherTracer1,
        long debrisTracer,
        long cloudTracer,
        long starTracer,
        long otherTracer2,
        long gasTracer) {

    public static final ParticleHeader NONE = new ParticleHeader(-1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public boolean isPresent() {
        return version >= 0;
    }
}
