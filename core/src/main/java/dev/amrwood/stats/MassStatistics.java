/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.stats;

import java.util.Arrays;
import java.util.Comparator;

import dev.amrwood.dataset.Dataset;
import dev.amrwood.variables.Getvar;
import dev.amrwood.variables.GetvarRequest;
import dev.amrwood.variables.VariableResult;

/**
 * Mass totals and mass-weighted averages of a dataset.
 * <p>
 * Every method takes an optional mask; null selects all rows. Averages over an
 * empty selection raise {@link EmptySelectionException} instead of returning NaN.
 * </p>
 */
public final class MassStatistics {

    private MassStatistics() {
    }

    public static double msum(Dataset dataset) {
        return msum(dataset, null, null);
    }

    /**
     * Total mass of the selected rows; 0 for an empty selection.
     */
    public static double msum(Dataset dataset, String unit, boolean[] mask) {
        return sum(compute(dataset, "mass", unit, mask));
    }

    /**
     * Mass-weighted mean position {@code [x, y, z]}, measured from the box origin.
     */
    public static double[] centerOfMass(Dataset dataset, String unit, boolean[] mask) {
        return weightedMeans(dataset, unit, mask, "x", "y", "z");
    }

    /**
     * Mass-weighted mean velocity {@code [vx, vy, vz]}.
     */
    public static double[] bulkVelocity(Dataset dataset, String unit, boolean[] mask) {
        return weightedMeans(dataset, unit, mask, "vx", "vy", "vz");
    }

    /**
     * Mass-weighted mean of any stored or derived variable.
     */
    public static double averageMassWeighted(Dataset dataset, String variable, String unit, boolean[] mask) {
        return weightedMeans(dataset, unit, mask, variable)[0];
    }

    private static double[] weightedMeans(Dataset dataset, String unit, boolean[] mask, String... variables) {
        MassWeighted selection = massWeighted(dataset, unit, mask, variables);
        double[] mass = selection.mass();
        double totalMass = sum(mass);
        if (mass.length == 0 || totalMass == 0) {
            throw new EmptySelectionException("Cannot average " + String.join(", ", variables) + " over "
                    + mass.length + " rows with total mass " + totalMass);
        }
        VariableResult result = selection.result();
        double[] means = new double[variables.length];
        for (int k = 0; k < variables.length; k++) {
            double[] values = result.get(variables[k]);
            double weighted = 0;
            for (int i = 0; i < values.length; i++) {
                weighted += values[i] * mass[i];
            }
            means[k] = weighted / totalMass;
        }
        return means;
    }

    /**
     * Weighted mean, median, spread and shape of a set of values.
     *
     * @param weights one weight per value, or null for equal weights
     * @throws EmptySelectionException if there are no values or the weights sum to 0
     */
    public static WeightedStatistics weightedStatistics(double[] values, double[] weights) {
        if (weights != null && weights.length != values.length) {
            throw new IllegalArgumentException("Got " + weights.length + " weights for " + values.length + " values");
        }
        int n = values.length;
        double[] w = weights != null ? weights : filled(n);
        double totalWeight = sum(w);
        if (n == 0 || totalWeight == 0) {
            throw new EmptySelectionException("Cannot compute statistics over " + n + " values with total weight "
                    + totalWeight);
        }

        double mean = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            mean += values[i] * w[i];
            min = Math.min(min, values[i]);
            max = Math.max(max, values[i]);
        }
        mean /= totalWeight;

        double m2 = 0;
        double m3 = 0;
        double m4 = 0;
        for (int i = 0; i < n; i++) {
            double d = values[i] - mean;
            double d2 = d * d;
            m2 += w[i] * d2;
            m3 += w[i] * d2 * d;
            m4 += w[i] * d2 * d2;
        }
        m2 /= totalWeight;
        m3 /= totalWeight;
        m4 /= totalWeight;
        double std = Math.sqrt(m2);
        double skewness = m2 > 0 ? m3 / Math.pow(m2, 1.5) : 0.0;
        double kurtosis = m2 > 0 ? m4 / (m2 * m2) - 3.0 : 0.0;

        return new WeightedStatistics(mean, median(values, w, totalWeight), std, skewness, kurtosis, min, max, n);
    }

    public static WeightedStatistics weightedStatistics(Dataset dataset, String variable, String unit, boolean[] mask) {
        MassWeighted selection = massWeighted(dataset, unit, mask, variable);
        return weightedStatistics(selection.result().get(variable), selection.mass());
    }

    /**
     * Computes the variables in the given unit together with the mass used as weight. Weighted
     * means do not depend on the unit of the weights, so a requested {@code mass} doubles as weight.
     */
    private static MassWeighted massWeighted(Dataset dataset, String unit, boolean[] mask, String... variables) {
        boolean massRequested = Arrays.asList(variables).contains("mass");
        String[] names = massRequested ? variables.clone() : Arrays.copyOf(variables, variables.length + 1);
        String[] units = new String[names.length];
        Arrays.fill(units, unit);
        if (!massRequested) {
            names[variables.length] = "mass";
            units[variables.length] = null;
        }
        VariableResult result = Getvar.getvar(dataset, GetvarRequest.builder()
                .variables(names)
                .units(units)
                .mask(mask)
                .build());
        return new MassWeighted(result, result.get("mass"));
    }

    private record MassWeighted(VariableResult result, double[] mass) {
    }

    private static double median(double[] values, double[] weights, double totalWeight) {
        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));
        double half = totalWeight / 2;
        double cumulative = 0;
        for (Integer i : order) {
            cumulative += weights[i];
            if (cumulative >= half) {
                return values[i];
            }
        }
        return values[order[order.length - 1]];
    }

    private static double[] compute(Dataset dataset, String variable, String unit, boolean[] mask) {
        GetvarRequest.Builder request = GetvarRequest.builder().variables(variable).mask(mask);
        if (unit != null) {
            request.units(unit);
        }
        return Getvar.getvar(dataset, request.build()).get(variable);
    }

    private static double[] filled(int n) {
        double[] ones = new double[n];
        Arrays.fill(ones, 1.0);
        return ones;
    }

    private static double sum(double[] values) {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total;
    }
}
