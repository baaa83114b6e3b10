/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.reader;

import dev.amrwood.dataset.Ranges;

/**
 * Per-level integer index windows of a normalized spatial range.
 * <p>
 * At level {@code l} a bound {@code b} maps to the 1-based index
 * {@code floor(b * 2^l) + 1}; both ends of the window are inclusive.
 * </p>
 */
public final class CellFilter {

    private final int lmin;
    private final int lmax;
    // [level][axis * 2 + (0 = min, 1 = max)]
    private final long[][] windows;

    public CellFilter(Ranges ranges, int lmin, int lmax) {
        this.lmin = lmin;
        this.lmax = lmax;
        this.windows = new long[lmax + 1][6];
        for (int level = 1; level <= lmax; level++) {
            double cells = Math.pow(2, level);
            for (int axis = 0; axis < 3; axis++) {
                windows[level][2 * axis] = (long) Math.floor(ranges.min(axis) * cells) + 1;
                windows[level][2 * axis + 1] = (long) Math.floor(ranges.max(axis) * cells) + 1;
            }
        }
    }

    public int lmin() {
        return lmin;
    }

    public int lmax() {
        return lmax;
    }

    /**
     * Whether a leaf at the given level is kept by the level bounds.
     */
    public boolean acceptsLevel(int level) {
        return level >= lmin && level <= lmax;
    }

    public boolean accepts(int level, long cx, long cy, long cz) {
        long[] w = windows[level];
        return cx >= w[0] && cx <= w[1]
                && cy >= w[2] && cy <= w[3]
                && cz >= w[4] && cz <= w[5];
    }
}
