/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.reader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import dev.amrwood.dataset.Ranges;
import dev.amrwood.metadata.Component;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.row.ColumnType;
import dev.amrwood.row.RowTable;

/**
 * Decodes the particles of one shard.
 * <p>
 * Record layout after the header: {@code x, y, z, vx, vy, vz, mass} (float64),
 * {@code identity} (int32, or int64 in long-id builds), {@code level} (int32),
 * {@code family, tag} (int8, layout version 1 only),
 * {@code birth} (float64, only when the shard holds stars), then one float64 record
 * per extra variable. Positions are filtered before any other column is copied.
 * </p>
 */
public final class ParticleShardDecoder {

    private static final System.Logger LOG = System.getLogger(ParticleShardDecoder.class.getName());

    private static final List<String> MOTION = List.of("vx", "vy", "vz", "mass");

    private final SnapshotFiles files;
    private final SimulationInfo info;
    private final List<String> variables;
    private final Ranges ranges;
    private final int version;

    public ParticleShardDecoder(SnapshotFiles files, SimulationInfo info, List<String> variables, Ranges ranges) {
        this.files = files;
        this.info = info;
        this.variables = List.copyOf(variables);
        this.ranges = ranges;
        this.version = info.particleDescriptor().version();
    }

    /**
     * Names of the bookkeeping columns of a particle table with the given layout version.
     */
    public static List<String> bookkeepingColumns(int version) {
        List<String> names = new ArrayList<>(List.of("level", "x", "y", "z", "id", "cpu"));
        if (version > 0) {
            names.add("family");
            names.add("tag");
        }
        return names;
    }

    /**
     * Variables that are stored as float64 records, in file order.
     */
    private List<String> floatVariables() {
        List<String> all = new ArrayList<>(info.particleDescriptor().variables());
        all.remove("family");
        all.remove("tag");
        return all;
    }

    public RowTable decode(int icpu) throws IOException {
        ShardDecodeEvent event = new ShardDecodeEvent();
        event.begin();

        FortranRecordReader part = ShardMapping.open(files.particles(icpu), Component.PARTICLES);
        int ncpu = part.readInt();
        int ndim = part.readInt();
        int npart = part.readInt();
        if (ncpu != info.ncpu() || ndim != 3) {
            throw new IOException("Header of " + part.source() + " (ncpu=" + ncpu + ", ndim=" + ndim
                    + ") disagrees with the info file (ncpu=" + info.ncpu() + ", ndim=3)");
        }
        if (npart < 0) {
            throw new IOException("Negative particle count " + npart + " in " + part.source());
        }
        // localseed
        part.skipRecord();
        int nstar = part.readInt();
        // mstar_tot, mstar_lost, nsink
        part.skipRecords(3);

        RowAccumulator rows = new RowAccumulator();
        List<String> floats = floatVariables();
        int[] varColumns = new int[floats.size()];
        Arrays.fill(varColumns, -1);
        for (String name : variables) {
            int position = floats.indexOf(name);
            if (position >= 0) {
                varColumns[position] = rows.define(name, ColumnType.DOUBLE);
            }
        }
        int levelColumn = rows.define("level", ColumnType.INT);
        int xColumn = rows.define("x", ColumnType.DOUBLE);
        int yColumn = rows.define("y", ColumnType.DOUBLE);
        int zColumn = rows.define("z", ColumnType.DOUBLE);
        int idColumn = rows.define("id", ColumnType.LONG);
        int cpuColumn = rows.define("cpu", ColumnType.INT);
        int familyColumn = version > 0 ? rows.define("family", ColumnType.BYTE) : -1;
        int tagColumn = version > 0 ? rows.define("tag", ColumnType.BYTE) : -1;

        if (npart == 0) {
            return finish(event, icpu, rows, 0);
        }

        double boxlen = info.boxlen();
        double[] x = part.readDoubles(npart);
        double[] y = part.readDoubles(npart);
        double[] z = part.readDoubles(npart);
        int[] selected = new int[npart];
        int count = 0;
        for (int i = 0; i < npart; i++) {
            if (x[i] >= ranges.xmin() * boxlen && x[i] <= ranges.xmax() * boxlen
                    && y[i] >= ranges.ymin() * boxlen && y[i] <= ranges.ymax() * boxlen
                    && z[i] >= ranges.zmin() * boxlen && z[i] <= ranges.zmax() * boxlen) {
                selected[count++] = i;
            }
        }
        if (count == 0) {
            return finish(event, icpu, rows, npart);
        }
        int[] rowOf = new int[count];
        for (int k = 0; k < count; k++) {
            rowOf[k] = rows.addRow();
            int i = selected[k];
            rows.setDouble(xColumn, rowOf[k], x[i]);
            rows.setDouble(yColumn, rowOf[k], y[i]);
            rows.setDouble(zColumn, rowOf[k], z[i]);
            rows.setInt(cpuColumn, rowOf[k], icpu);
        }

        for (String name : MOTION) {
            int index = floats.indexOf(name);
            readFloatColumn(part, npart, index >= 0 ? varColumns[index] : -1, rows, selected, rowOf, count);
        }
        long[] identity = part.readIntegers(npart);
        int[] level = part.readInts(npart);
        for (int k = 0; k < count; k++) {
            rows.setLong(idColumn, rowOf[k], identity[selected[k]]);
            rows.setInt(levelColumn, rowOf[k], level[selected[k]]);
        }
        if (version > 0) {
            byte[] family = part.readBytes(npart);
            byte[] tag = part.readBytes(npart);
            for (int k = 0; k < count; k++) {
                rows.setByte(familyColumn, rowOf[k], family[selected[k]]);
                rows.setByte(tagColumn, rowOf[k], tag[selected[k]]);
            }
        }
        int birth = floats.indexOf("birth");
        if (birth >= 0 && nstar > 0) {
            readFloatColumn(part, npart, varColumns[birth], rows, selected, rowOf, count);
        }
        for (int v = birth + 1; birth >= 0 && v < floats.size(); v++) {
            if (!part.hasRemaining()) {
                LOG.log(System.Logger.Level.DEBUG, "{0} holds no record for ''{1}'', keeping zeros",
                        part.source(), floats.get(v));
                break;
            }
            readFloatColumn(part, npart, varColumns[v], rows, selected, rowOf, count);
        }
        return finish(event, icpu, rows, npart);
    }

    private static void readFloatColumn(FortranRecordReader part, int npart, int column, RowAccumulator rows,
                                        int[] selected, int[] rowOf, int count) throws IOException {
        if (column < 0) {
            part.skipRecord();
            return;
        }
        double[] values = part.readDoubles(npart);
        for (int k = 0; k < count; k++) {
            rows.setDouble(column, rowOf[k], values[selected[k]]);
        }
    }

    private RowTable finish(ShardDecodeEvent event, int icpu, RowAccumulator rows, long scanned) {
        event.shard = icpu;
        event.component = Component.PARTICLES.label();
        event.rowsScanned = scanned;
        event.rowsKept = rows.size();
        event.commit();

        LOG.log(System.Logger.Level.DEBUG, "Decoded particle shard {0}: {1} of {2} particles kept",
                icpu, rows.size(), scanned);
        return rows.toTable(icpu);
    }
}
