/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.variables;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values computed by {@link Getvar}, one row-aligned array per requested variable,
 * in request order.
 */
public final class VariableResult {

    private final Map<String, double[]> values;
    private final Map<String, String> units;
    private final int rowCount;

    VariableResult(Map<String, double[]> values, Map<String, String> units, int rowCount) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.units = Collections.unmodifiableMap(new LinkedHashMap<>(units));
        this.rowCount = rowCount;
    }

    /**
     * Returns the values of a requested variable.
     *
     * @throws IllegalArgumentException if the variable was not requested
     */
    public double[] get(String name) {
        double[] result = values.get(name);
        if (result == null) {
            throw new IllegalArgumentException("Variable '" + name + "' was not requested, available: "
                    + values.keySet());
        }
        return result;
    }

    /**
     * Returns the only variable of a single-variable result.
     */
    public double[] single() {
        if (values.size() != 1) {
            throw new IllegalStateException("Result holds " + values.size() + " variables");
        }
        return values.values().iterator().next();
    }

    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    /**
     * Unit symbol a variable was converted to; {@code standard} for code units.
     */
    public String unit(String name) {
        get(name);
        return units.get(name);
    }

    public int rowCount() {
        return rowCount;
    }

    public Map<String, double[]> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "VariableResult{variables=" + values.keySet() + ", rows=" + rowCount + "}";
    }
}
