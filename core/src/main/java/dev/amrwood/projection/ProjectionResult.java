/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.projection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.amrwood.dataset.Direction;

/**
 * Projected maps, one per variable, indexed {@code [i][j]} with {@code i} along the
 * horizontal and {@code j} along the vertical pixel axis of the direction.
 */
public final class ProjectionResult {

    private final Map<String, double[][]> maps;
    private final Map<String, String> units;
    private final Direction direction;
    private final ProjectionMode mode;
    private final Weighting weighting;
    private final int resolution;
    private final double pixsize;
    private final double[] extent;
    private final double boxlen;
    private final int lmin;
    private final int lmax;

    ProjectionResult(Map<String, double[][]> maps, Map<String, String> units, Direction direction, ProjectionMode mode,
                     Weighting weighting, int resolution, double pixsize, double[] extent, double boxlen, int lmin, int lmax) {
        this.maps = Collections.unmodifiableMap(new LinkedHashMap<>(maps));
        this.units = Collections.unmodifiableMap(new LinkedHashMap<>(units));
        this.direction = direction;
        this.mode = mode;
        this.weighting = weighting;
        this.resolution = resolution;
        this.pixsize = pixsize;
        this.extent = extent.clone();
        this.boxlen = boxlen;
        this.lmin = lmin;
        this.lmax = lmax;
    }

    /**
     * Returns a copy of the map of a variable.
     *
     * @throws IllegalArgumentException if the variable was not projected
     */
    public double[][] map(String variable) {
        double[][] map = stored(variable);
        double[][] copy = new double[map.length][];
        for (int i = 0; i < map.length; i++) {
            copy[i] = map[i].clone();
        }
        return copy;
    }

    private double[][] stored(String variable) {
        double[][] map = maps.get(variable);
        if (map == null) {
            throw new IllegalArgumentException("Variable '" + variable + "' was not projected, available: "
                    + maps.keySet());
        }
        return map;
    }

    public List<String> variables() {
        return List.copyOf(maps.keySet());
    }

    public String unit(String variable) {
        stored(variable);
        return units.get(variable);
    }

    /**
     * Sum over all pixels of a map.
     */
    public double total(String variable) {
        double total = 0;
        for (double[] column : stored(variable)) {
            for (double value : column) {
                total += value;
            }
        }
        return total;
    }

    public int width() {
        return extentPixels(0);
    }

    public int height() {
        return extentPixels(2);
    }

    private int extentPixels(int offset) {
        return (int) Math.round((extent[offset + 1] - extent[offset]) / pixsize);
    }

    public Direction direction() {
        return direction;
    }

    public ProjectionMode mode() {
        return mode;
    }

    public Weighting weighting() {
        return weighting;
    }

    /**
     * Pixels across the full box.
     */
    public int resolution() {
        return resolution;
    }

    /**
     * Pixel edge length in code length units.
     */
    public double pixsize() {
        return pixsize;
    }

    /**
     * {@code [hmin, hmax, vmin, vmax]} of the grid in code length units.
     */
    public double[] extent() {
        return extent.clone();
    }

    /**
     * The extent as fractions of the box.
     */
    public double[] extentNormalized() {
        double[] normalized = extent.clone();
        for (int i = 0; i < normalized.length; i++) {
            normalized[i] /= boxlen;
        }
        return normalized;
    }

    public int lmin() {
        return lmin;
    }

    public int lmax() {
        return lmax;
    }

    @Override
    public String toString() {
        return "ProjectionResult{variables=" + maps.keySet() + ", direction=" + direction.label() + ", mode=" + mode
                + ", " + width() + "x" + height() + " pixels, res=" + resolution + "}";
    }
}
