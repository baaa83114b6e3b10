/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.benchmarks;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.amrwood.dataset.Center;
import dev.amrwood.dataset.HydroDataset;
import dev.amrwood.variables.Getvar;
import dev.amrwood.variables.GetvarRequest;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms1g", "-Xmx1g" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class GetvarBenchmark {

    @Param({ "5", "6" })
    private int level;

    private HydroDataset gas;
    private GetvarRequest kinematics;

    @Setup
    public void setup() {
        gas = SyntheticHydro.uniform(level, 7L);
        kinematics = GetvarRequest.builder()
                .variables("r_cylinder", "vr_cylinder", "vϕ_cylinder", "l")
                .units("kpc", "km_s", "km_s", "Msol_km_s_kpc")
                .center(Center.boxCentre())
                .build();
    }

    @Benchmark
    public void storedVariable(Blackhole blackhole) {
        blackhole.consume(Getvar.getvar(gas, "rho", "g_cm3"));
    }

    @Benchmark
    public void mass(Blackhole blackhole) {
        blackhole.consume(Getvar.getvar(gas, "mass", "Msol"));
    }

    @Benchmark
    public void cylindricalKinematics(Blackhole blackhole) {
        blackhole.consume(Getvar.getvar(gas, kinematics));
    }
}
