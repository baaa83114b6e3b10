/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.projection;

import java.util.Arrays;

/**
 * Partial sums of one run of rows, for every projected variable.
 * <p>
 * The denominator holds the covered pixel area for {@code MEAN} and {@code MAX} and the
 * accumulated weight for {@code WEIGHTED}.
 * </p>
 */
final class PixelGrid {

    private final int width;
    private final int height;
    private final ProjectionMode[] modes;
    private final ProjectionMode denominatorMode;
    private final double[][] numerators;
    private final double[] denominator;

    PixelGrid(int width, int height, ProjectionMode[] modes, ProjectionMode denominatorMode) {
        this.width = width;
        this.height = height;
        this.modes = modes;
        this.denominatorMode = denominatorMode;
        this.numerators = new double[modes.length][width * height];
        for (int k = 0; k < modes.length; k++) {
            if (modes[k] == ProjectionMode.MAX) {
                Arrays.fill(numerators[k], Double.NEGATIVE_INFINITY);
            }
        }
        this.denominator = new double[width * height];
    }

    /**
     * Adds one row's contribution to pixel {@code (i, j)}.
     *
     * @param values the row's value of every variable
     * @param weight the row's weight, used by {@code WEIGHTED}
     * @param rowFraction share of the row that falls into the pixel
     * @param pixelFraction share of the pixel that the row covers
     */
    void deposit(int i, int j, double[] values, double weight, double rowFraction, double pixelFraction) {
        int p = i * height + j;
        for (int k = 0; k < modes.length; k++) {
            double v = values[k];
            switch (modes[k]) {
                case SUM -> numerators[k][p] += v * rowFraction;
                case MEAN -> numerators[k][p] += v * pixelFraction;
                case WEIGHTED -> numerators[k][p] += v * weight * rowFraction;
                case MAX -> numerators[k][p] = Math.max(numerators[k][p], v);
            }
        }
        denominator[p] += denominatorMode == ProjectionMode.WEIGHTED ? weight * rowFraction : pixelFraction;
    }

    /**
     * Adds another run's partial sums into this one.
     */
    void merge(PixelGrid other) {
        for (int k = 0; k < modes.length; k++) {
            double[] target = numerators[k];
            double[] source = other.numerators[k];
            if (modes[k] == ProjectionMode.MAX) {
                for (int p = 0; p < target.length; p++) {
                    target[p] = Math.max(target[p], source[p]);
                }
            }
            else {
                for (int p = 0; p < target.length; p++) {
                    target[p] += source[p];
                }
            }
        }
        for (int p = 0; p < denominator.length; p++) {
            denominator[p] += other.denominator[p];
        }
    }

    /**
     * Final map of variable {@code k}; pixels without contributions are 0.
     */
    double[][] map(int k, double scale) {
        double[][] map = new double[width][height];
        double[] numerator = numerators[k];
        for (int i = 0; i < width; i++) {
            for (int j = 0; j < height; j++) {
                int p = i * height + j;
                double value = switch (modes[k]) {
                    case SUM -> numerator[p];
                    case MEAN, WEIGHTED -> denominator[p] > 0 ? numerator[p] / denominator[p] : 0.0;
                    case MAX -> denominator[p] > 0 ? numerator[p] : 0.0;
                };
                map[i][j] = value * scale;
            }
        }
        return map;
    }
}
