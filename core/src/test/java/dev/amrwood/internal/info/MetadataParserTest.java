/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.info;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.amrwood.metadata.ComponentDescriptor;
import dev.amrwood.metadata.ParticleHeader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the text metadata parsers.
 */
public class MetadataParserTest {

    @TempDir
    Path tempDir;

    private static List<String> infoLines(int ncpu, String ordering) {
        List<String> lines = new ArrayList<>(List.of(
                "ncpu        =          " + ncpu,
                "ndim        =          3",
                "levelmin    =          7",
                "levelmax    =         12",
                "ngridmax    =     500000",
                "nstep_coarse=        317",
                "",
                "boxlen      =  0.100000000000000E+03",
                "time        =  0.330855641315456D+00",
                "aexp        =  0.100000000000000E+01",
                "H0          =  0.100000000000000E+01",
                "omega_m     =  0.100000000000000E+01",
                "omega_l     =  0.000000000000000E+00",
                "omega_k     =  0.000000000000000E+00",
                "omega_b     =  0.000000000000000E+00",
                "unit_l      =  0.308567758128200E+22",
                "unit_d      =  0.677025430198932E-22",
                "unit_t      =  0.470430312423675E+15",
                "",
                "ordering type=" + ordering,
                "   DOMAIN   ind_min                 ind_max"));
        for (int i = 1; i <= ncpu; i++) {
            lines.add("       " + i + "   " + (i - 1) + ".000000000000000E+00   " + i + ".000000000000000E+00");
        }
        return lines;
    }

    // ==================== Info File Tests ====================

    @Test
    void testParsesValuesByLinePosition() throws IOException {
        InfoFile info = InfoFileParser.parse(Path.of("info_00300.txt"), infoLines(4, "hilbert"));

        assertThat(info.ncpu()).isEqualTo(4);
        assertThat(info.levelmin()).isEqualTo(7);
        assertThat(info.levelmax()).isEqualTo(12);
        assertThat(info.nstepCoarse()).isEqualTo(317);
        assertThat(info.boxlen()).isEqualTo(100.0);
        assertThat(info.time()).isEqualTo(0.330855641315456);
        assertThat(info.unitT()).isEqualTo(0.470430312423675E+15);
        assertThat(info.boundKeys()).containsExactly(0.0, 1.0, 2.0, 3.0, 4.0);
    }

    @Test
    void testDomainTableOptionalWithoutHilbertOrdering() throws IOException {
        List<String> lines = infoLines(2, "planar").subList(0, 21);

        InfoFile info = InfoFileParser.parse(Path.of("info_00001.txt"), lines);

        assertThat(info.ordering()).isEqualTo("planar");
        assertThat(info.boundKeys()).isEmpty();
    }

    @Test
    void testTruncatedDomainTable() {
        List<String> lines = infoLines(4, "hilbert").subList(0, 23);

        assertThatThrownBy(() -> InfoFileParser.parse(Path.of("info_00300.txt"), lines))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("fewer than 4 domains");
    }

    @Test
    void testRejectsNonIntegerValue() {
        List<String> lines = infoLines(2, "hilbert");
        lines.set(0, "ncpu        =          two");

        assertThatThrownBy(() -> InfoFileParser.parse(Path.of("info_00300.txt"), lines))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not an integer");
    }

    @Test
    void testRejectsTwoDimensionalSnapshots() {
        List<String> lines = infoLines(2, "hilbert");
        lines.set(1, "ndim        =          2");

        assertThatThrownBy(() -> InfoFileParser.parse(Path.of("info_00300.txt"), lines))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("ndim=2");
    }

    // ==================== Namelist Tests ====================

    @Test
    void testNamelistGroups() {
        Map<String, Map<String, String>> namelist = NamelistParser.parse(List.of(
                "&RUN_PARAMS",
                "hydro=.true.",
                "! a comment",
                "/",
                "&OUTPUT_PARAMS",
                "foutput = 10",
                "/"));

        assertThat(namelist).containsOnlyKeys("RUN_PARAMS", "OUTPUT_PARAMS");
        assertThat(namelist.get("RUN_PARAMS")).containsOnly(Map.entry("hydro", ".true."));
        assertThat(namelist.get("OUTPUT_PARAMS")).containsEntry("foutput", "10");
    }

    @Test
    void testFileWithoutRunParamsIsNotANamelist() {
        assertThat(NamelistParser.parse(List.of("&AMR_PARAMS", "levelmin=7", "/"))).isEmpty();
    }

    @Test
    void testMissingNamelistFile() throws IOException {
        assertThat(NamelistParser.parse(tempDir.resolve("namelist.txt"))).isEmpty();
    }

    // ==================== Descriptor Tests ====================

    @Test
    void testHydroDescriptorVersionZero() throws IOException {
        Path descriptor = tempDir.resolve("hydro_file_descriptor.txt");
        Files.write(descriptor, List.of(
                "nvar =  6",
                "variable #  1: density",
                "variable #  2: velocity_x",
                "variable #  3: velocity_y",
                "variable #  4: velocity_z",
                "variable #  5: thermal_pressure",
                "variable #  6: passive_scalar_1"));

        ComponentDescriptor hydro = DescriptorParser.hydro(descriptor, 6);

        assertThat(hydro.version()).isZero();
        assertThat(hydro.fileVariables()).hasSize(6);
        assertThat(hydro.fileVariables().get(4).name()).isEqualTo("thermal_pressure");
        assertThat(hydro.variables()).containsExactly("rho", "vx", "vy", "vz", "p", "var6");
    }

    @Test
    void testHydroDescriptorListsFewerVariablesThanDeclared() throws IOException {
        Path descriptor = tempDir.resolve("hydro_file_descriptor.txt");
        Files.write(descriptor, List.of("nvar =  3", "variable #  1: density"));

        assertThatThrownBy(() -> DescriptorParser.hydro(descriptor, 3))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("declares 3 variables");
    }

    @Test
    void testParticleDescriptorWithMetallicityAddsExtras() throws IOException {
        Path descriptor = tempDir.resolve("part_file_descriptor.txt");
        Files.write(descriptor, List.of(
                "# version:  1",
                "# ivar, variable_name, variable_type",
                "  1, position_x, d",
                "  7, mass, d",
                " 12, birth_time, d",
                " 13, metallicity, d",
                " 14, initial_mass, d"));

        ComponentDescriptor particles = DescriptorParser.particles(descriptor);

        assertThat(particles.version()).isEqualTo(1);
        assertThat(particles.variables()).endsWith("birth", "metals", "initial_mass");
    }

    @Test
    void testParticleHeaderFamilyCounts() throws IOException {
        Path header = tempDir.resolve("header_00001.txt");
        Files.write(header, List.of(
                "# Family     Count",
                "other_tracer1          0",
                "debris_tracer          0",
                "cloud_tracer           0",
                "star_tracer            7",
                "other_tracer2          0",
                "gas_tracer            11",
                "DM                  1000",
                "star                 250",
                "cloud                  0",
                "debris                 0",
                "other                  0",
                "undefined              0"));

        ParticleHeader counts = DescriptorParser.particleHeader(header);

        assertThat(counts.version()).isEqualTo(1);
        assertThat(counts.dm()).isEqualTo(1000);
        assertThat(counts.stars()).isEqualTo(250);
        assertThat(counts.starTracer()).isEqualTo(7);
        assertThat(counts.gasTracer()).isEqualTo(11);
        assertThat(counts.total()).isEqualTo(1268);
    }

    @Test
    void testMissingParticleHeader() throws IOException {
        assertThat(DescriptorParser.particleHeader(tempDir.resolve("header_00001.txt")))
                .isEqualTo(ParticleHeader.NONE);
    }
}
