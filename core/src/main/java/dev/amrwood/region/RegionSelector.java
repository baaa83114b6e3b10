/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.region;

import dev.amrwood.dataset.Dataset;
import dev.amrwood.variables.Getvar;
import dev.amrwood.variables.GetvarRequest;
import dev.amrwood.variables.VariableResult;

/**
 * Keeps the rows of a dataset whose position lies in a region.
 * <p>
 * Cells are tested at {@code index * cellsize}, particles at their stored position and
 * clumps at their peak. In cell mode a cell is kept when its extent
 * {@code [(index - 1) * cellsize, index * cellsize]} on every axis overlaps the region,
 * the same extent the projection deposits. The result is a dataset of the same variant that shares the
 * metadata, variables, level bounds and ranges of its input.
 * </p>
 */
public final class RegionSelector {

    private static final System.Logger LOG = System.getLogger(RegionSelector.class.getName());

    private RegionSelector() {
    }

    public static <D extends Dataset> D subregion(D dataset, RegionPredicate predicate) {
        return subregion(dataset, predicate, false);
    }

    @SuppressWarnings("unchecked")
    public static <D extends Dataset> D subregion(D dataset, RegionPredicate predicate, boolean cell) {
        boolean[] keep = test(dataset, predicate, cell);
        D result = (D) dataset.withTable(dataset.table().filter(keep));
        LOG.log(System.Logger.Level.DEBUG, "Region {0} kept {1} of {2} {3} rows", predicate, result.rowCount(),
                dataset.rowCount(), dataset.component().label());
        return result;
    }

    public static <D extends Dataset> D subregion(D dataset, RegionSpec spec) {
        return subregion(dataset, spec.toPredicate(dataset.info().boxlen(), dataset.scale()), spec.cell());
    }

    /**
     * Keeps the rows between two concentric spheres or cylinders of the region's shape,
     * or the rows outside that shell when the region is inverse.
     *
     * @param innerRadius radius of the excluded core, in the region's range unit
     * @param outerRadius radius of the shell, in the region's range unit
     * @throws IllegalArgumentException for cuboids, or if {@code innerRadius >= outerRadius}
     *         or {@code innerRadius < 0}
     */
    public static <D extends Dataset> D shellregion(D dataset, RegionSpec spec, double innerRadius, double outerRadius) {
        if (innerRadius < 0 || innerRadius >= outerRadius) {
            throw new IllegalArgumentException("Shell radii must satisfy 0 <= inner < outer, got "
                    + innerRadius + " and " + outerRadius);
        }
        double boxlen = dataset.info().boxlen();
        RegionPredicate shell = new RegionPredicate.Band(
                spec.withRadius(boxlen, dataset.scale(), innerRadius),
                spec.withRadius(boxlen, dataset.scale(), outerRadius));
        return subregion(dataset, spec.inverse() ? shell.negate() : shell, spec.cell());
    }

    /**
     * Evaluates the predicate on the position of every row of the dataset.
     */
    public static boolean[] test(Dataset dataset, RegionPredicate predicate) {
        return test(dataset, predicate, false);
    }

    /**
     * Evaluates the predicate on every row, on the extent of cells when {@code cell} is set
     * and the dataset holds cells.
     */
    public static boolean[] test(Dataset dataset, RegionPredicate predicate, boolean cell) {
        boolean extent = cell && dataset.isCellBased();
        GetvarRequest.Builder request = GetvarRequest.builder();
        if (extent) {
            request.variables("x", "y", "z", "cellsize");
        }
        else {
            request.variables("x", "y", "z");
        }
        VariableResult positions = Getvar.getvar(dataset, request.build());
        double[] x = positions.get("x");
        double[] y = positions.get("y");
        double[] z = positions.get("z");
        double[] size = extent ? positions.get("cellsize") : null;
        boolean[] keep = new boolean[x.length];
        for (int i = 0; i < keep.length; i++) {
            keep[i] = extent
                    ? predicate.overlaps(x[i] - size[i], x[i], y[i] - size[i], y[i], z[i] - size[i], z[i])
                    : predicate.test(x[i], y[i], z[i]);
        }
        return keep;
    }
}
