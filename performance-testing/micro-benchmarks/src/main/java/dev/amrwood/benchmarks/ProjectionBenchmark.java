/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.benchmarks;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.amrwood.dataset.HydroDataset;
import dev.amrwood.projection.Projection;
import dev.amrwood.projection.ProjectionOptions;

/**
 * Surface density projection of a uniform grid, on the calling thread and on a pool.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms1g", "-Xmx1g" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class ProjectionBenchmark {

    @Param({ "6" })
    private int level;

    @Param({ "64", "256" })
    private int res;

    private HydroDataset gas;
    private ProjectionOptions options;
    private ExecutorService executor;

    @Setup(Level.Trial)
    public void setup() {
        gas = SyntheticHydro.uniform(level, 42L);
        options = ProjectionOptions.builder()
                .variables("sd", "rho")
                .units("Msol_pc2", "g_cm3")
                .res(res)
                .build();
        executor = Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors());
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        executor.shutdownNow();
    }

    @Benchmark
    public void projectSequential(Blackhole blackhole) {
        blackhole.consume(Projection.project(gas, options));
    }

    @Benchmark
    public void projectParallel(Blackhole blackhole) {
        blackhole.consume(Projection.project(gas, options, executor));
    }
}
