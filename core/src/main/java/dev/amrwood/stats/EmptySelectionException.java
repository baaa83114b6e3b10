/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.stats;

/**
 * Thrown when an average is requested over no rows or over rows of zero total weight.
 */
public class EmptySelectionException extends IllegalStateException {

    public EmptySelectionException(String message) {
        super(message);
    }
}
