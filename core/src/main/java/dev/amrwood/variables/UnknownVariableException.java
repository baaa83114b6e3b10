/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.variables;

import dev.amrwood.metadata.Component;

/**
 * Thrown when a variable key is neither stored in a dataset nor derivable for its component.
 */
public class UnknownVariableException extends IllegalArgumentException {

    private final String variable;
    private final Component component;

    public UnknownVariableException(String variable, Component component, String message) {
        super(message);
        this.variable = variable;
        this.component = component;
    }

    public String getVariable() {
        return variable;
    }

    public Component getComponent() {
        return component;
    }
}
