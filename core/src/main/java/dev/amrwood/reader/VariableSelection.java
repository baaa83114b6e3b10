/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.reader;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Specifies which stored variables to load from a component.
 *
 * <p>Skipping variables avoids copying their records out of the shard files.
 * Bookkeeping columns (levels, indices, positions, shard ids) are always loaded.</p>
 *
 * <pre>{@code
 * VariableSelection.all()
 * VariableSelection.variables("rho", "p")
 * }</pre>
 */
public final class VariableSelection {

    private static final VariableSelection ALL = new VariableSelection(null);

    private final Set<String> names;

    private VariableSelection(Set<String> names) {
        this.names = names;
    }

    /**
     * Returns a selection that includes all stored variables.
     */
    public static VariableSelection all() {
        return ALL;
    }

    /**
     * Returns a selection that includes only the specified variables.
     *
     * @throws IllegalArgumentException if no variable names are provided
     */
    public static VariableSelection variables(String... names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("At least one variable name must be specified");
        }
        Set<String> nameSet = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Variable name cannot be null or empty");
            }
            nameSet.add(name);
        }
        return new VariableSelection(Collections.unmodifiableSet(nameSet));
    }

    public boolean selectsAll() {
        return names == null;
    }

    /**
     * Returns the selected names, or null if all variables are selected.
     */
    public Set<String> getNames() {
        return names;
    }

    /**
     * Resolves this selection against the stored variables of a component, keeping file order.
     *
     * @throws IllegalArgumentException if a selected name is not stored
     */
    List<String> resolve(String component, List<String> available) {
        if (selectsAll()) {
            return available;
        }
        for (String name : names) {
            if (!available.contains(name)) {
                throw new IllegalArgumentException("Unknown " + component + " variable '" + name
                        + "', available: " + available);
            }
        }
        return available.stream().filter(names::contains).toList();
    }

    @Override
    public String toString() {
        return selectsAll() ? "VariableSelection[all]" : "VariableSelection" + names;
    }
}
