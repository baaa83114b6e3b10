/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.row;

/**
 * The rows of a table that came from one shard.
 *
 * @param shard the 1-based shard number
 * @param start first row index (inclusive)
 * @param end last row index (exclusive)
 */
public record ShardRange(int shard, int start, int end) {

    public int size() {
        return end - start;
    }
}
