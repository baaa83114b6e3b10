/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.variables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import dev.amrwood.dataset.Dataset;
import dev.amrwood.dataset.RangeSpec;
import dev.amrwood.metadata.Component;
import dev.amrwood.row.RowTable;
import dev.amrwood.units.ScaleSet;

/**
 * Computes stored and derived quantities of a dataset in the requested units.
 *
 * <pre>{@code
 * double[] mass = Getvar.getvar(gas, "mass", "Msol");
 *
 * VariableResult result = Getvar.getvar(gas, GetvarRequest.builder()
 *         .variables("r_cylinder", "vϕ_cylinder")
 *         .units("kpc", "km_s")
 *         .center(Center.boxCentre())
 *         .build());
 * }</pre>
 *
 * All keys, units and the mask are checked before anything is computed.
 */
public final class Getvar {

    private static final System.Logger LOG = System.getLogger(Getvar.class.getName());

    private Getvar() {
    }

    /**
     * Returns one variable in code units.
     */
    public static double[] getvar(Dataset dataset, String variable) {
        return getvar(dataset, variable, null);
    }

    /**
     * Returns one variable converted to the given unit.
     */
    public static double[] getvar(Dataset dataset, String variable, String unit) {
        GetvarRequest.Builder builder = GetvarRequest.builder().variables(variable);
        if (unit != null) {
            builder.units(unit);
        }
        return getvar(dataset, builder.build()).get(variable);
    }

    /**
     * @throws UnknownVariableException if a key is neither stored nor derivable
     * @throws dev.amrwood.units.UnknownUnitException if a unit is not known
     * @throws IllegalArgumentException if the mask length differs from the row count, the subset
     *         is of another component, or a needed column was not loaded
     */
    public static VariableResult getvar(Dataset dataset, GetvarRequest request) {
        Dataset source = request.subset() != null ? request.subset() : dataset;
        if (source.component() != dataset.component()) {
            throw new IllegalArgumentException("Subset holds " + source.component().label() + " rows, expected "
                    + dataset.component().label());
        }
        Component component = source.component();
        RowTable table = source.table();
        ScaleSet scale = source.scale();

        List<String> variables = request.variables();
        double[] factors = new double[variables.size()];
        for (int i = 0; i < variables.size(); i++) {
            String name = variables.get(i);
            Optional<DerivedVariable> derived = DerivedVariable.find(name, component);
            if (derived.isPresent()) {
                for (String column : derived.get().requiredColumns(component)) {
                    if (!table.hasColumn(column)) {
                        throw new IllegalArgumentException("Variable '" + name + "' needs the " + component.label()
                                + " column '" + column + "', which was not loaded");
                    }
                }
            }
            else if (!table.hasColumn(name)) {
                throw new UnknownVariableException(name, component, "Unknown " + component.label() + " variable '"
                        + name + "', available: " + describe(source));
            }
            int power = derived.map(DerivedVariable::unitPower).orElse(1);
            factors[i] = Math.pow(scale.resolve(request.units().get(i)), power);
        }

        boolean[] mask = request.mask();
        if (mask != null) {
            if (mask.length != table.rowCount()) {
                throw new IllegalArgumentException("Mask has " + mask.length + " entries for "
                        + table.rowCount() + " rows");
            }
            table = table.filter(mask);
        }

        double boxlen = source.info().boxlen();
        double conversion = RangeSpec.conversion(request.centerUnit(), boxlen, scale);
        double[] centerNorm = new double[3];
        for (int axis = 0; axis < 3; axis++) {
            centerNorm[axis] = request.center().normalized(axis, conversion);
        }
        double referenceTime = request.referenceTime() != null ? request.referenceTime() : source.info().time();

        VariableContext context = new VariableContext(source, table, centerNorm, request.direction(), referenceTime);
        Map<String, double[]> values = new LinkedHashMap<>();
        Map<String, String> units = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            String name = variables.get(i);
            double[] code = context.get(name);
            double[] converted = new double[code.length];
            for (int row = 0; row < code.length; row++) {
                converted[row] = code[row] * factors[i];
            }
            values.put(name, converted);
            String unit = request.units().get(i);
            units.put(name, unit == null ? ScaleSet.STANDARD : unit);
        }
        LOG.log(System.Logger.Level.DEBUG, "Computed {0} over {1} {2} rows", variables, table.rowCount(),
                component.label());
        return new VariableResult(values, units, table.rowCount());
    }

    /**
     * Sorted keys derivable for a component.
     */
    public static List<String> describe(Component component) {
        return new ArrayList<>(DerivedVariable.keys(component));
    }

    /**
     * Sorted keys available on a dataset: its loaded columns and the derivable keys
     * whose columns are all loaded.
     */
    public static List<String> describe(Dataset dataset) {
        Component component = dataset.component();
        RowTable table = dataset.table();
        Set<String> keys = new TreeSet<>(table.columnNames());
        for (String key : DerivedVariable.keys(component)) {
            DerivedVariable variable = DerivedVariable.find(key, component).orElseThrow();
            if (variable.requiredColumns(component).stream().allMatch(table::hasColumn)) {
                keys.add(key);
            }
        }
        return new ArrayList<>(keys);
    }
}
