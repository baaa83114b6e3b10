/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.metadata;

import java.util.List;

/**
 * Describes the variables stored for one component.
 *
 * @param component the component
 * @param version layout version of the descriptor (0 when no descriptor file exists)
 * @param hasDescriptorFile whether a descriptor file was found
 * @param fileVariables entries of the descriptor file in file order
 * @param variables column names used for the loaded variables, in file order
 */
public record ComponentDescriptor(
        Component component,
        int version,
        boolean hasDescriptorFile,
        List<VariableDescriptor> fileVariables,
        List<String> variables) {

    public ComponentDescriptor {
        fileVariables = List.copyOf(fileVariables);
        variables = List.copyOf(variables);
    }

    public static ComponentDescriptor absent(Component component) {
        return new ComponentDescriptor(component, 0, false, List.of(), List.of());
    }

    public int variableCount() {
        return variables.size();
    }

    /**
     * Returns the 0-based file position of a variable, or -1.
     */
    public int indexOf(String variable) {
        return variables.indexOf(variable);
    }
}
