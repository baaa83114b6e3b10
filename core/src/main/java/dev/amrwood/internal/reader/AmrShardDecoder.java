/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.reader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import dev.amrwood.metadata.Component;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.row.ColumnType;
import dev.amrwood.row.RowTable;

/**
 * Decodes the leaf cells of one shard by walking its AMR octree file together
 * with the matching hydro or gravity file, level by level.
 * <p>
 * Only the grids of the shard's own domain are materialized; the grids of other
 * domains and of boundary regions are skipped record by record. Unrequested
 * variables are never copied out of the mapping.
 * </p>
 */
public final class AmrShardDecoder {

    private static final System.Logger LOG = System.getLogger(AmrShardDecoder.class.getName());

    private static final int TWOTONDIM = 8;
    private static final int AMR_HEADER_RECORDS = 21;

    private final SnapshotFiles files;
    private final SimulationInfo info;
    private final Component component;
    private final List<String> variables;
    private final int[] fileIndices;
    private final CellFilter filter;

    /**
     * @param variables names of the output variable columns
     * @param fileIndices 0-based position of each output variable in the component file
     */
    public AmrShardDecoder(SnapshotFiles files, SimulationInfo info, Component component,
                           List<String> variables, int[] fileIndices, CellFilter filter) {
        if (!component.isCellBased()) {
            throw new IllegalArgumentException("Component " + component + " is not cell based");
        }
        if (variables.size() != fileIndices.length) {
            throw new IllegalArgumentException("Expected one file index per variable");
        }
        this.files = files;
        this.info = info;
        this.component = component;
        this.variables = List.copyOf(variables);
        this.fileIndices = fileIndices.clone();
        this.filter = filter;
    }

    /**
     * Names of the bookkeeping columns every cell table carries after its variables.
     */
    public static List<String> bookkeepingColumns() {
        return List.of("level", "cx", "cy", "cz", "cpu");
    }

    public RowTable decode(int icpu) throws IOException {
        ShardDecodeEvent event = new ShardDecodeEvent();
        event.begin();

        FortranRecordReader amr = ShardMapping.open(files.amr(icpu), Component.AMR);
        FortranRecordReader data = ShardMapping.open(componentFile(icpu), component);

        int ncpu = info.ncpu();
        int nlevelmax = readAmrHeader(amr);
        int nboundary = info.grid().nboundary();
        int ndomains = ncpu + nboundary;

        // ngrid[level-1][domain-1], file layout is column-major (domain fastest)
        int[][] ngrid = new int[nlevelmax][ndomains];
        int[] numbl = amr.readInts(ncpu * nlevelmax);
        for (int level = 0; level < nlevelmax; level++) {
            for (int domain = 0; domain < ncpu; domain++) {
                ngrid[level][domain] = numbl[domain + ncpu * level];
            }
        }
        amr.skipRecord();
        if (nboundary > 0) {
            amr.skipRecords(2);
            int[] ngridbound = amr.readInts(nboundary * nlevelmax);
            for (int level = 0; level < nlevelmax; level++) {
                for (int b = 0; b < nboundary; b++) {
                    ngrid[level][ncpu + b] = ngridbound[b + nboundary * level];
                }
            }
        }
        amr.skipRecords(6);

        int nvarFile = readComponentHeader(data);
        for (int index : fileIndices) {
            if (index < 0 || index >= nvarFile) {
                throw new IOException("Variable index " + (index + 1) + " exceeds the " + nvarFile
                        + " variables stored in " + data.source());
            }
        }
        int[] outputColumnOfFileVar = new int[nvarFile];
        Arrays.fill(outputColumnOfFileVar, -1);
        for (int i = 0; i < fileIndices.length; i++) {
            outputColumnOfFileVar[fileIndices[i]] = i;
        }

        RowAccumulator rows = new RowAccumulator();
        int[] varColumns = new int[variables.size()];
        for (int i = 0; i < variables.size(); i++) {
            varColumns[i] = rows.define(variables.get(i), ColumnType.DOUBLE);
        }
        int levelColumn = rows.define("level", ColumnType.INT);
        int cxColumn = rows.define("cx", ColumnType.INT);
        int cyColumn = rows.define("cy", ColumnType.INT);
        int czColumn = rows.define("cz", ColumnType.INT);
        int cpuColumn = rows.define("cpu", ColumnType.INT);

        double[] xbound = {
                Math.floor(info.grid().nx() / 2.0),
                Math.floor(info.grid().ny() / 2.0),
                Math.floor(info.grid().nz() / 2.0) };
        int lmax = Math.min(filter.lmax(), nlevelmax);
        long scanned = 0;

        for (int level = 1; level <= lmax; level++) {
            double[][] xc = cellOffsets(level);
            double cells = Math.pow(2, level);
            int ngrida = ngrid[level - 1][icpu - 1];

            double[][] xg = new double[3][];
            int[][] son = new int[TWOTONDIM][];
            double[][][] values = new double[TWOTONDIM][fileIndices.length][];

            for (int domain = 1; domain <= ndomains; domain++) {
                int n = ngrid[level - 1][domain - 1];
                boolean own = domain == icpu;
                if (n > 0) {
                    // grid index, next, prev
                    amr.skipRecords(3);
                    for (int dim = 0; dim < 3; dim++) {
                        if (own) {
                            xg[dim] = amr.readDoubles(n);
                        }
                        else {
                            amr.skipRecord();
                        }
                    }
                    // father + neighbours
                    amr.skipRecords(1 + 2 * 3);
                    for (int ind = 0; ind < TWOTONDIM; ind++) {
                        if (own) {
                            son[ind] = amr.readInts(n);
                        }
                        else {
                            amr.skipRecord();
                        }
                    }
                    // cpu map + refinement map
                    amr.skipRecords(2 * TWOTONDIM);
                }

                // ilevel, ncache
                data.skipRecords(2);
                if (n > 0) {
                    for (int ind = 0; ind < TWOTONDIM; ind++) {
                        for (int ivar = 0; ivar < nvarFile; ivar++) {
                            int column = outputColumnOfFileVar[ivar];
                            if (own && column >= 0) {
                                values[ind][column] = data.readDoubles(n);
                            }
                            else {
                                data.skipRecord();
                            }
                        }
                    }
                }
            }

            if (ngrida == 0 || !filter.acceptsLevel(level)) {
                continue;
            }
            for (int ind = 0; ind < TWOTONDIM; ind++) {
                for (int i = 0; i < ngrida; i++) {
                    boolean leaf = !(son[ind][i] > 0 && level < lmax);
                    if (!leaf) {
                        continue;
                    }
                    scanned++;
                    long cx = (long) Math.floor((xg[0][i] + xc[ind][0] - xbound[0]) * cells) + 1;
                    long cy = (long) Math.floor((xg[1][i] + xc[ind][1] - xbound[1]) * cells) + 1;
                    long cz = (long) Math.floor((xg[2][i] + xc[ind][2] - xbound[2]) * cells) + 1;
                    if (!filter.accepts(level, cx, cy, cz)) {
                        continue;
                    }
                    int row = rows.addRow();
                    for (int v = 0; v < varColumns.length; v++) {
                        rows.setDouble(varColumns[v], row, values[ind][v][i]);
                    }
                    rows.setInt(levelColumn, row, level);
                    rows.setInt(cxColumn, row, (int) cx);
                    rows.setInt(cyColumn, row, (int) cy);
                    rows.setInt(czColumn, row, (int) cz);
                    rows.setInt(cpuColumn, row, icpu);
                }
            }
        }

        event.shard = icpu;
        event.component = component.label();
        event.rowsScanned = scanned;
        event.rowsKept = rows.size();
        event.commit();

        LOG.log(System.Logger.Level.DEBUG, "Decoded {0} shard {1}: {2} of {3} leaf cells kept",
                component.label(), icpu, rows.size(), scanned);
        return rows.toTable(icpu);
    }

    private Path componentFile(int icpu) {
        return switch (component) {
            case HYDRO -> files.hydro(icpu);
            case GRAVITY -> files.gravity(icpu);
            default -> files.rt(icpu);
        };
    }

    private int readAmrHeader(FortranRecordReader amr) throws IOException {
        int ncpu = amr.readInt();
        int ndim = amr.readInt();
        amr.skipRecord();
        int nlevelmax = amr.readInt();
        if (ncpu != info.ncpu() || ndim != 3) {
            throw new IOException("Header of " + amr.source() + " (ncpu=" + ncpu + ", ndim=" + ndim
                    + ") disagrees with the info file (ncpu=" + info.ncpu() + ", ndim=3)");
        }
        if (nlevelmax < 1) {
            throw new IOException("Invalid nlevelmax " + nlevelmax + " in " + amr.source());
        }
        amr.skipRecords(AMR_HEADER_RECORDS - 4);
        return nlevelmax;
    }

    private int readComponentHeader(FortranRecordReader data) throws IOException {
        int ncpu = data.readInt();
        int nvar = data.readInt();
        if (ncpu != info.ncpu()) {
            throw new IOException("Header of " + data.source() + " (ncpu=" + ncpu
                    + ") disagrees with the info file (ncpu=" + info.ncpu() + ")");
        }
        // hydro: ndim, nlevelmax, nboundary, gamma; gravity: nlevelmax, nboundary
        data.skipRecords(component == Component.GRAVITY ? 2 : 4);
        return nvar;
    }

    /**
     * Offsets of the eight children from the grid centre, in units of the coarse cell.
     */
    static double[][] cellOffsets(int level) {
        double dx = Math.pow(0.5, level);
        double[][] xc = new double[TWOTONDIM][3];
        for (int ind = 0; ind < TWOTONDIM; ind++) {
            int iz = ind / 4;
            int iy = (ind - 4 * iz) / 2;
            int ix = ind - 2 * iy - 4 * iz;
            xc[ind][0] = (ix - 0.5) * dx;
            xc[ind][1] = (iy - 0.5) * dx;
            xc[ind][2] = (iz - 0.5) * dx;
        }
        return xc;
    }
}
