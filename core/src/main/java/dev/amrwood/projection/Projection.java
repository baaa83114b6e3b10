/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.projection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import dev.amrwood.dataset.Dataset;
import dev.amrwood.dataset.ParticleDataset;
import dev.amrwood.dataset.Ranges;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.row.RowTable;
import dev.amrwood.units.ScaleSet;
import dev.amrwood.units.UnitKind;
import dev.amrwood.variables.Getvar;

/**
 * Rasterizes the rows of a dataset onto a uniform grid perpendicular to a direction.
 * <p>
 * Cells deposit their face, {@code [(c - 1) * dx, c * dx]} on both pixel axes, into
 * every pixel it overlaps, split by overlap area; particles and clumps deposit into the
 * pixel that contains them. Rows are split into chunks of {@value #CHUNK_ROWS}, and the
 * chunks into at most {@value #MAX_PARTIALS} contiguous runs. Each run deposits into its
 * own partial grid, and the partial grids are reduced in run order. The split depends on
 * the row count only, so every executor yields the same result.
 * </p>
 *
 * <pre>{@code
 * ProjectionResult map = Projection.project(gas, ProjectionOptions.builder()
 *         .variables("sd")
 *         .units("Msol_pc2")
 *         .res(512)
 *         .build(), amrwood.executor());
 * }</pre>
 */
public final class Projection {

    private static final System.Logger LOG = System.getLogger(Projection.class.getName());

    static final int CHUNK_ROWS = 1 << 16;

    static final int MAX_PARTIALS = 8;

    private static final int MAX_LEVEL_RESOLUTION = 30;

    private Projection() {
    }

    /**
     * Projects on the calling thread.
     */
    public static ProjectionResult project(Dataset dataset, ProjectionOptions options) {
        return project(dataset, options, Runnable::run);
    }

    /**
     * Projects with one task per partial grid on the given executor.
     *
     * @throws IllegalArgumentException if a variable, unit or family is unknown, the mask length
     *         differs from the row count, volume weighting is used on point data, or the range
     *         is inverted
     */
    public static ProjectionResult project(Dataset dataset, ProjectionOptions options, Executor executor) {
        return project(dataset, options, executor, CHUNK_ROWS);
    }

    static ProjectionResult project(Dataset dataset, ProjectionOptions options, Executor executor, int chunkRows) {
        ProjectionEvent event = new ProjectionEvent();
        event.begin();

        double boxlen = dataset.info().boxlen();
        ScaleSet scale = dataset.scale();
        RowTable table = dataset.table();
        int rows = table.rowCount();

        ProjectionMode mode = options.mode() != null
                ? options.mode()
                : dataset.isCellBased() ? ProjectionMode.WEIGHTED : ProjectionMode.SUM;
        if (mode == ProjectionMode.WEIGHTED && options.weighting() == Weighting.VOLUME && !dataset.isCellBased()) {
            throw new IllegalArgumentException("Volume weighting needs cells, got " + dataset.component().label());
        }
        boolean[] mask = options.mask();
        if (mask != null && mask.length != rows) {
            throw new IllegalArgumentException("Mask has " + mask.length + " entries for " + rows + " rows");
        }

        int lmax = options.lmax() != null ? options.lmax() : dataset.lmax();
        SimulationInfo info = dataset.info();
        if (lmax < info.levelmin() || lmax > info.levelmax()) {
            throw new IllegalArgumentException("lmax " + lmax + " is outside the simulation's levels ["
                    + info.levelmin() + ", " + info.levelmax() + "]");
        }
        int res = resolution(options, lmax, boxlen, scale);
        double pixsize = boxlen / res;
        Ranges ranges = options.ranges().resolve(boxlen, scale);

        int[] pixelAxes = options.direction().pixelAxes();
        int h = pixelAxes[0];
        int v = pixelAxes[1];
        int los = options.direction().axis();
        int i0 = (int) Math.floor(ranges.min(h) * res);
        int i1 = Math.max(i0 + 1, (int) Math.ceil(ranges.max(h) * res));
        int j0 = (int) Math.floor(ranges.min(v) * res);
        int j1 = Math.max(j0 + 1, (int) Math.ceil(ranges.max(v) * res));
        Window window = new Window(i0, i1, j0, j1, pixsize, h, v, los, ranges, boxlen);

        List<String> variables = options.variables();
        int nvar = variables.size();
        double[][] values = new double[nvar][];
        double[] outputScale = new double[nvar];
        ProjectionMode[] modes = new ProjectionMode[nvar];
        Map<String, String> units = new LinkedHashMap<>();
        for (int k = 0; k < nvar; k++) {
            String name = variables.get(k);
            String unit = options.units().get(k);
            units.put(name, unit == null ? ScaleSet.STANDARD : unit);
            if (ProjectionOptions.SURFACE_DENSITY.equals(name)) {
                values[k] = Getvar.getvar(dataset, "mass");
                modes[k] = ProjectionMode.SUM;
                outputScale[k] = scale.resolve(unit) / (pixsize * pixsize);
            }
            else {
                values[k] = Getvar.getvar(dataset, name, unit);
                modes[k] = mode;
                outputScale[k] = 1.0;
            }
        }
        double[] weights = mode == ProjectionMode.WEIGHTED
                ? Getvar.getvar(dataset, options.weighting().variable())
                : null;
        boolean[] selected = select(dataset, options, mask);

        Deposit deposit = dataset.isCellBased()
                ? new CellDeposit(table.ints("level"), table.ints("cx"), table.ints("cy"), table.ints("cz"))
                : new PointDeposit(Getvar.getvar(dataset, "x"), Getvar.getvar(dataset, "y"), Getvar.getvar(dataset, "z"));

        int chunks = Math.max(1, (rows + chunkRows - 1) / chunkRows);
        int partials = Math.min(chunks, MAX_PARTIALS);
        @SuppressWarnings("unchecked")
        CompletableFuture<PixelGrid>[] futures = new CompletableFuture[partials];
        for (int p = 0; p < partials; p++) {
            int start = (int) Math.min(rows, (long) chunks * p / partials * chunkRows);
            int end = (int) Math.min(rows, (long) chunks * (p + 1) / partials * chunkRows);
            futures[p] = CompletableFuture.supplyAsync(() -> {
                PixelGrid grid = new PixelGrid(i1 - i0, j1 - j0, modes, mode);
                double[] row = new double[nvar];
                for (int r = start; r < end; r++) {
                    if (!selected[r]) {
                        continue;
                    }
                    for (int k = 0; k < nvar; k++) {
                        row[k] = values[k][r];
                    }
                    deposit.row(r, window, grid, row, weights == null ? 0.0 : weights[r]);
                }
                return grid;
            }, executor);
        }

        PixelGrid total;
        try {
            total = futures[0].join();
            for (int p = 1; p < partials; p++) {
                total.merge(futures[p].join());
            }
        }
        catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }

        Map<String, double[][]> maps = new LinkedHashMap<>();
        for (int k = 0; k < nvar; k++) {
            maps.put(variables.get(k), total.map(k, outputScale[k]));
        }
        double[] extent = { i0 * pixsize, i1 * pixsize, j0 * pixsize, j1 * pixsize };

        event.component = dataset.component().label();
        event.rows = rows;
        event.pixels = (long) (i1 - i0) * (j1 - j0);
        event.variables = nvar;
        event.chunks = chunks;
        event.partials = partials;
        event.commit();

        LOG.log(System.Logger.Level.INFO, "Projected {0} {1} rows along {2} onto {3}x{4} pixels (res {5}, mode {6})",
                rows, dataset.component().label(), options.direction().label(), i1 - i0, j1 - j0, res, mode);
        return new ProjectionResult(maps, units, options.direction(), mode, options.weighting(), res, pixsize, extent,
                boxlen, dataset.lmin(), lmax);
    }

    private static int resolution(ProjectionOptions options, int lmax, double boxlen, ScaleSet scale) {
        if (options.pxsize() != null) {
            double codeSize = options.pxsize() / scale.resolve(options.pxsizeUnit(), UnitKind.LENGTH);
            return Math.max(1, (int) Math.round(boxlen / codeSize));
        }
        if (options.res() != null) {
            return options.res();
        }
        if (lmax > MAX_LEVEL_RESOLUTION) {
            throw new IllegalArgumentException("Resolution 2^" + lmax + " is too large, give res or pxsize");
        }
        return 1 << lmax;
    }

    /**
     * Rows that pass the mask and, for particles, the family filter.
     */
    private static boolean[] select(Dataset dataset, ProjectionOptions options, boolean[] mask) {
        int rows = dataset.rowCount();
        boolean[] selected = new boolean[rows];
        for (int r = 0; r < rows; r++) {
            selected[r] = mask == null || mask[r];
        }
        Set<ParticleFamily> families = options.families();
        if (!(dataset instanceof ParticleDataset particles) || families.contains(ParticleFamily.ALL)) {
            return selected;
        }
        int version = particles.version();
        RowTable table = particles.table();
        double[] family = version > 0 ? table.doubles("family") : null;
        double[] birth = table.hasColumn("birth") ? table.doubles("birth") : null;
        if (version == 0 && birth == null) {
            throw new IllegalArgumentException("Selecting particle families needs the 'birth' column");
        }
        for (int r = 0; r < rows; r++) {
            if (!selected[r]) {
                continue;
            }
            boolean match = false;
            for (ParticleFamily candidate : families) {
                if (candidate.matches(version, family == null ? 0 : (int) family[r], birth == null ? 0 : birth[r])) {
                    match = true;
                    break;
                }
            }
            selected[r] = match;
        }
        return selected;
    }

    /**
     * Pixel index window and axes of a projection.
     */
    private record Window(int i0, int i1, int j0, int j1, double pixsize, int h, int v, int los, Ranges ranges,
                          double boxlen) {
    }

    private interface Deposit {
        void row(int r, Window window, PixelGrid grid, double[] values, double weight);
    }

    private record CellDeposit(int[] level, int[] cx, int[] cy, int[] cz) implements Deposit {

        @Override
        public void row(int r, Window w, PixelGrid grid, double[] values, double weight) {
            int[] index = { cx[r], cy[r], cz[r] };
            int cells = 1 << level[r];
            int losIndex = index[w.los()];
            if (losIndex < (int) Math.floor(w.ranges().min(w.los()) * cells) + 1
                    || losIndex > (int) Math.floor(w.ranges().max(w.los()) * cells) + 1) {
                return;
            }
            double dx = w.boxlen() / cells;
            double px = w.pixsize();
            double h0 = (index[w.h()] - 1) * dx;
            double h1 = index[w.h()] * dx;
            double v0 = (index[w.v()] - 1) * dx;
            double v1 = index[w.v()] * dx;
            int ia = Math.max(w.i0(), (int) Math.floor(h0 / px));
            int ib = Math.min(w.i1(), (int) Math.ceil(h1 / px));
            int ja = Math.max(w.j0(), (int) Math.floor(v0 / px));
            int jb = Math.min(w.j1(), (int) Math.ceil(v1 / px));
            double cellArea = dx * dx;
            double pixelArea = px * px;
            for (int i = ia; i < ib; i++) {
                double overlapH = Math.min(h1, (i + 1) * px) - Math.max(h0, i * px);
                if (overlapH <= 0) {
                    continue;
                }
                for (int j = ja; j < jb; j++) {
                    double overlapV = Math.min(v1, (j + 1) * px) - Math.max(v0, j * px);
                    if (overlapV <= 0) {
                        continue;
                    }
                    double area = overlapH * overlapV;
                    grid.deposit(i - w.i0(), j - w.j0(), values, weight, area / cellArea, area / pixelArea);
                }
            }
        }
    }

    private record PointDeposit(double[] x, double[] y, double[] z) implements Deposit {

        @Override
        public void row(int r, Window w, PixelGrid grid, double[] values, double weight) {
            double[] position = { x[r], y[r], z[r] };
            double depth = position[w.los()];
            if (depth < w.ranges().min(w.los()) * w.boxlen() || depth > w.ranges().max(w.los()) * w.boxlen()) {
                return;
            }
            int i = (int) Math.floor(position[w.h()] / w.pixsize());
            int j = (int) Math.floor(position[w.v()] / w.pixsize());
            if (i < w.i0() || i >= w.i1() || j < w.j0() || j >= w.j1()) {
                return;
            }
            grid.deposit(i - w.i0(), j - w.j0(), values, weight, 1.0, 1.0);
        }
    }
}
