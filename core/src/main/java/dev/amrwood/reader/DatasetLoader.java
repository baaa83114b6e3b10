/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import dev.amrwood.dataset.ClumpDataset;
import dev.amrwood.dataset.GravityDataset;
import dev.amrwood.dataset.HydroDataset;
import dev.amrwood.dataset.ParticleDataset;
import dev.amrwood.dataset.Ranges;
import dev.amrwood.internal.reader.AmrShardDecoder;
import dev.amrwood.internal.reader.CellFilter;
import dev.amrwood.internal.reader.ClumpTableReader;
import dev.amrwood.internal.reader.ParticleShardDecoder;
import dev.amrwood.internal.reader.SnapshotFiles;
import dev.amrwood.metadata.Component;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.row.RowTable;

/**
 * Loads the rows of one component by decoding every shard on the context executor.
 * <p>
 * Each shard is decoded by its own task into its own table; the tables are
 * concatenated in shard order, so the result does not depend on the thread count.
 * </p>
 */
final class DatasetLoader {

    private static final System.Logger LOG = System.getLogger(DatasetLoader.class.getName());

    private static final List<String> CLUMP_POSITIONS = List.of("peak_x", "peak_y", "peak_z");

    @FunctionalInterface
    interface ShardTask {
        RowTable decode(int shard) throws IOException;
    }

    private final AmrwoodContext context;

    DatasetLoader(AmrwoodContext context) {
        this.context = context;
    }

    HydroDataset readHydro(SimulationInfo info, LoadOptions options) throws IOException {
        CellLoad load = prepareCells(info, Component.HYDRO, options);
        RowTable table = decodeAll(info, Component.HYDRO, load.decoder()::decode);
        return new HydroDataset(table, info, info.scale(), load.variables(), load.filter().lmin(), load.filter().lmax(),
                load.ranges());
    }

    GravityDataset readGravity(SimulationInfo info, LoadOptions options) throws IOException {
        CellLoad load = prepareCells(info, Component.GRAVITY, options);
        RowTable table = decodeAll(info, Component.GRAVITY, load.decoder()::decode);
        return new GravityDataset(table, info, info.scale(), load.variables(), load.filter().lmin(), load.filter().lmax(),
                load.ranges());
    }

    ParticleDataset readParticles(SimulationInfo info, LoadOptions options) throws IOException {
        requireComponent(info, Component.PARTICLES);
        int lmax = options.lmax(info);
        int lmin = options.lmin(info);
        List<String> variables = options.variables().resolve("particle", info.variables(Component.PARTICLES));
        Ranges ranges = options.ranges().resolve(info.boxlen(), info.scale());

        SnapshotFiles files = SnapshotFiles.of(info.baseDirectory(), info.output());
        ParticleShardDecoder decoder = new ParticleShardDecoder(files, info, variables, ranges);
        RowTable table = decodeAll(info, Component.PARTICLES, decoder::decode);
        return new ParticleDataset(table, info, info.scale(), variables, lmin, lmax, ranges);
    }

    ClumpDataset readClumps(SimulationInfo info, LoadOptions options) throws IOException {
        requireComponent(info, Component.CLUMPS);
        List<String> columns = info.variables(Component.CLUMPS);
        List<String> selected = options.variables().resolve("clump", columns);
        Set<String> withPositions = new LinkedHashSet<>(selected);
        withPositions.addAll(CLUMP_POSITIONS);
        List<String> variables = columns.stream().filter(withPositions::contains).toList();
        Ranges ranges = options.ranges().resolve(info.boxlen(), info.scale());

        SnapshotFiles files = SnapshotFiles.of(info.baseDirectory(), info.output());
        ClumpTableReader reader = new ClumpTableReader(files, columns, variables, ranges, info.boxlen());
        RowTable table = decodeAll(info, Component.CLUMPS, reader::decode);
        return new ClumpDataset(table, info, info.scale(), variables, ranges);
    }

    private record CellLoad(List<String> variables, CellFilter filter, Ranges ranges, AmrShardDecoder decoder) {
    }

    private CellLoad prepareCells(SimulationInfo info, Component component, LoadOptions options)
            throws MissingDataException {
        requireComponent(info, component);
        requireComponent(info, Component.AMR);
        int lmax = options.lmax(info);
        int lmin = options.lmin(info);
        List<String> stored = info.variables(component);
        List<String> variables = options.variables().resolve(component.label(), stored);
        int[] fileIndices = new int[variables.size()];
        for (int i = 0; i < fileIndices.length; i++) {
            fileIndices[i] = stored.indexOf(variables.get(i));
        }
        Ranges ranges = options.ranges().resolve(info.boxlen(), info.scale());
        CellFilter filter = new CellFilter(ranges, lmin, lmax);
        SnapshotFiles files = SnapshotFiles.of(info.baseDirectory(), info.output());
        AmrShardDecoder decoder = new AmrShardDecoder(files, info, component, variables, fileIndices, filter);
        return new CellLoad(variables, filter, ranges, decoder);
    }

    private static void requireComponent(SimulationInfo info, Component component) throws MissingDataException {
        if (!info.has(component)) {
            throw new MissingDataException("Snapshot " + info.snapshotDirectory() + " has no "
                    + component.label() + " data");
        }
    }

    private RowTable decodeAll(SimulationInfo info, Component component, ShardTask task) throws IOException {
        int ncpu = info.ncpu();
        @SuppressWarnings("unchecked")
        CompletableFuture<RowTable>[] futures = new CompletableFuture[ncpu];
        for (int i = 0; i < ncpu; i++) {
            final int shard = i + 1;
            futures[i] = CompletableFuture.supplyAsync(() -> {
                try {
                    return task.decode(shard);
                }
                catch (IOException e) {
                    throw new UncheckedIOException("Failed to decode " + component.label() + " shard " + shard, e);
                }
            }, context.executor());
        }

        try {
            CompletableFuture.allOf(futures).join();
        }
        catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }

        List<RowTable> tables = new ArrayList<>(ncpu);
        for (CompletableFuture<RowTable> future : futures) {
            tables.add(future.join());
        }
        RowTable table = RowTable.concat(tables);
        LOG.log(System.Logger.Level.INFO, "Loaded {0} {1} rows from {2} shards", table.rowCount(),
                component.label(), ncpu);
        return table;
    }
}
