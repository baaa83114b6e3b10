/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.reader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

import dev.amrwood.dataset.ClumpDataset;
import dev.amrwood.dataset.GravityDataset;
import dev.amrwood.dataset.HydroDataset;
import dev.amrwood.dataset.ParticleDataset;
import dev.amrwood.internal.info.SimulationInfoResolver;
import dev.amrwood.metadata.SimulationInfo;

/**
 * Entry point for reading RAMSES snapshots with a shared thread pool.
 *
 * <pre>{@code
 * try (Amrwood amrwood = Amrwood.create()) {
 *     SimulationInfo info = amrwood.getInfo(Path.of("/data/sim"), 300);
 *     HydroDataset gas = amrwood.readHydro(info, LoadOptions.builder().lmax(8).build());
 *     // ...
 * }
 * }</pre>
 */
public class Amrwood implements AutoCloseable {

    private final AmrwoodContext context;
    private final DatasetLoader loader;

    private Amrwood(AmrwoodContext context) {
        this.context = context;
        this.loader = new DatasetLoader(context);
    }

    /**
     * Create a new Amrwood instance with a thread pool sized by {@code amrwood.threads}
     * or to available processors.
     */
    public static Amrwood create() {
        return new Amrwood(AmrwoodContext.create());
    }

    /**
     * Create a new Amrwood instance with a thread pool of the specified size.
     */
    public static Amrwood create(int threads) {
        return new Amrwood(AmrwoodContext.create(threads));
    }

    /**
     * Resolve the metadata of snapshot {@code output} below {@code baseDirectory}.
     *
     * @throws MissingDataException if the directory, snapshot or info file does not exist
     * @throws IOException if a metadata file is malformed
     */
    public SimulationInfo getInfo(Path baseDirectory, int output) throws IOException {
        return SimulationInfoResolver.resolve(baseDirectory, output);
    }

    public HydroDataset readHydro(SimulationInfo info) throws IOException {
        return readHydro(info, LoadOptions.defaults());
    }

    /**
     * Load the hydro leaf cells selected by the options.
     *
     * @throws MissingDataException if the snapshot has no hydro or AMR files
     * @throws IllegalArgumentException if level bounds, variables or ranges are invalid
     * @throws IOException if a shard is truncated or malformed
     */
    public HydroDataset readHydro(SimulationInfo info, LoadOptions options) throws IOException {
        return loader.readHydro(info, options);
    }

    public GravityDataset readGravity(SimulationInfo info) throws IOException {
        return readGravity(info, LoadOptions.defaults());
    }

    /**
     * Load the gravity leaf cells selected by the options.
     */
    public GravityDataset readGravity(SimulationInfo info, LoadOptions options) throws IOException {
        return loader.readGravity(info, options);
    }

    public ParticleDataset readParticles(SimulationInfo info) throws IOException {
        return readParticles(info, LoadOptions.defaults());
    }

    /**
     * Load the particles inside the spatial window of the options.
     */
    public ParticleDataset readParticles(SimulationInfo info, LoadOptions options) throws IOException {
        return loader.readParticles(info, options);
    }

    public ClumpDataset readClumps(SimulationInfo info) throws IOException {
        return readClumps(info, LoadOptions.defaults());
    }

    /**
     * Load the clumps whose peak lies inside the spatial window of the options.
     */
    public ClumpDataset readClumps(SimulationInfo info, LoadOptions options) throws IOException {
        return loader.readClumps(info, options);
    }

    /**
     * Get the executor service used by this instance.
     */
    public ExecutorService executor() {
        return context.executor();
    }

    @Override
    public void close() {
        context.close();
    }
}
