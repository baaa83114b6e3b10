/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.metadata;

/**
 * One entry of a component descriptor file.
 *
 * @param index 1-based position of the variable in the shard files
 * @param name name as written in the descriptor
 * @param type type as written in the descriptor, or null for version 0 descriptors
 */
public record VariableDescriptor(int index, String name, String type) {

    @Override
    public String toString() {
        return index + ": " + name + (type != null ? " (" + type + ")" : "");
    }
}
