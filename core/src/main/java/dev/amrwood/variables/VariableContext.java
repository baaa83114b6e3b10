/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.variables;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import dev.amrwood.dataset.Dataset;
import dev.amrwood.dataset.Direction;
import dev.amrwood.metadata.Component;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.row.RowTable;
import dev.amrwood.units.BaseUnits;
import dev.amrwood.units.PhysicalConstants;

/**
 * Rows and frame a getvar call computes over. Values are in code units and cached
 * per key, so derived quantities that depend on each other are computed once.
 */
final class VariableContext {

    private static final String[] AXIS_NAMES = { "x", "y", "z" };

    private final Component component;
    private final RowTable table;
    private final SimulationInfo info;
    private final double[] centerNorm;
    private final int[] frame;
    private final double referenceTime;
    private final Map<String, double[]> cache = new HashMap<>();

    VariableContext(Dataset dataset, RowTable table, double[] centerNorm, Direction direction, double referenceTime) {
        this.component = dataset.component();
        this.table = table;
        this.info = dataset.info();
        this.centerNorm = centerNorm;
        this.frame = direction.frame();
        this.referenceTime = referenceTime;
    }

    Component component() {
        return component;
    }

    int rows() {
        return table.rowCount();
    }

    double boxlen() {
        return info.boxlen();
    }

    double gamma() {
        return info.gamma();
    }

    BaseUnits baseUnits() {
        return info.baseUnits();
    }

    double referenceTime() {
        return referenceTime;
    }

    /**
     * Gravitational constant in code units.
     */
    double gravitationalConstant() {
        BaseUnits units = info.baseUnits();
        return PhysicalConstants.G * units.unitD() * units.unitT() * units.unitT();
    }

    /**
     * Returns a derived quantity registered for this component, or else the stored column.
     */
    double[] get(String key) {
        double[] cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        Optional<DerivedVariable> derived = DerivedVariable.find(key, component);
        double[] values = derived.isPresent() ? derived.get().compute(this) : column(key);
        cache.put(key, values);
        return values;
    }

    /**
     * Returns a stored column widened to doubles, copied once per context.
     */
    double[] column(String name) {
        if (!table.hasColumn(name)) {
            throw new IllegalArgumentException("Column '" + name + "' was not loaded for " + component.label()
                    + ", available: " + table.columnNames());
        }
        return cache.computeIfAbsent("@column:" + name, key -> table.doubles(name));
    }

    /**
     * Box axis playing the role of x (0), y (1) or z (2) in the rotated frame.
     */
    int boxAxis(int frameAxis) {
        return frame[frameAxis];
    }

    /**
     * Centered position along a frame axis, in code length units.
     */
    double[] position(int frameAxis) {
        int axis = boxAxis(frameAxis);
        String key = "@position" + axis;
        double[] cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        double shift = info.boxlen() * centerNorm[axis];
        double[] result = new double[rows()];
        if (component.isCellBased()) {
            double[] index = column("c" + AXIS_NAMES[axis]);
            double[] size = get("cellsize");
            for (int i = 0; i < result.length; i++) {
                result[i] = index[i] * size[i] - shift;
            }
        }
        else {
            double[] stored = column(component == Component.CLUMPS ? "peak_" + AXIS_NAMES[axis] : AXIS_NAMES[axis]);
            for (int i = 0; i < result.length; i++) {
                result[i] = stored[i] - shift;
            }
        }
        cache.put(key, result);
        return result;
    }

    /**
     * Grid index along a frame axis, shifted by the center expressed at each row's level.
     */
    double[] centeredIndex(int frameAxis) {
        int axis = boxAxis(frameAxis);
        double[] index = column("c" + AXIS_NAMES[axis]);
        double[] level = column("level");
        double[] result = new double[rows()];
        for (int i = 0; i < result.length; i++) {
            result[i] = index[i] - Math.pow(2, level[i]) * centerNorm[axis];
        }
        return result;
    }

    double[] velocity(int frameAxis) {
        return column("v" + AXIS_NAMES[boxAxis(frameAxis)]);
    }

    double[] acceleration(int frameAxis) {
        return column("a" + AXIS_NAMES[boxAxis(frameAxis)]);
    }
}
