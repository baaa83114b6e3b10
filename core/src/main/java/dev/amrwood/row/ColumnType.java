/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.row;

/**
 * Storage type of a {@link Column}.
 */
public enum ColumnType {
    DOUBLE,
    INT,
    LONG,
    BYTE
}
