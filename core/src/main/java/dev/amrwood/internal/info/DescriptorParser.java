/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.info;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import dev.amrwood.metadata.Component;
import dev.amrwood.metadata.ComponentDescriptor;
import dev.amrwood.metadata.ParticleHeader;
import dev.amrwood.metadata.VariableDescriptor;

/**
 * Parsers for the text descriptor and header files that describe the binary shards.
 */
public final class DescriptorParser {

    private static final System.Logger LOG = System.getLogger(DescriptorParser.class.getName());

    public static final List<String> HYDRO_BASE_VARIABLES = List.of("rho", "vx", "vy", "vz", "p");
    public static final List<String> GRAVITY_VARIABLES = List.of("epot", "ax", "ay", "az");

    private static final List<String> PARTICLE_VARIABLES_V0 = List.of("vx", "vy", "vz", "mass", "birth");
    private static final List<String> PARTICLE_VARIABLES_V1 = List.of("vx", "vy", "vz", "mass", "family", "tag", "birth");

    // descriptor names covered by the fixed part of the particle layout
    private static final Set<String> PARTICLE_LAYOUT_NAMES = Set.of(
            "position_x", "position_y", "position_z", "velocity_x", "velocity_y", "velocity_z",
            "mass", "identity", "levelp", "birth_time", "metallicity", "family", "tag");

    private DescriptorParser() {
    }

    /**
     * Variable column names of a hydro file holding {@code nvarh} variables.
     */
    public static List<String> hydroVariables(int nvarh) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < nvarh; i++) {
            names.add(i < HYDRO_BASE_VARIABLES.size() ? HYDRO_BASE_VARIABLES.get(i) : "var" + (i + 1));
        }
        return names;
    }

    /**
     * Reads the hydro descriptor file if present.
     *
     * @param nvarh number of variables in the hydro shards, 0 if there are none
     */
    public static ComponentDescriptor hydro(Path descriptor, int nvarh) throws IOException {
        List<String> variables = hydroVariables(nvarh);
        if (!Files.isRegularFile(descriptor)) {
            return new ComponentDescriptor(Component.HYDRO, 0, false, List.of(), variables);
        }
        List<String> lines = Files.readAllLines(descriptor, StandardCharsets.US_ASCII);
        if (lines.isEmpty()) {
            return new ComponentDescriptor(Component.HYDRO, 0, false, List.of(), variables);
        }
        String first = lines.get(0);
        List<VariableDescriptor> entries = new ArrayList<>();
        int version;
        if (first.contains("nvar")) {
            version = 0;
            int count = parseInt(afterLast(first, '='), descriptor, 1);
            for (int i = 1; i <= count; i++) {
                if (i >= lines.size()) {
                    throw new IOException(descriptor + " declares " + count + " variables but lists " + (i - 1));
                }
                entries.add(new VariableDescriptor(i, afterLast(lines.get(i), ':'), null));
            }
        }
        else if (first.contains("version")) {
            version = parseInt(afterLast(first, ':'), descriptor, 1);
            if (version == 1) {
                entries.addAll(csvEntries(lines, descriptor));
            }
            else {
                LOG.log(System.Logger.Level.WARNING, "Unsupported hydro descriptor version {0} in {1}",
                        version, descriptor);
            }
        }
        else {
            throw new IOException("Unrecognized hydro descriptor format in " + descriptor + ": '" + first + "'");
        }
        if (variables.isEmpty()) {
            for (VariableDescriptor entry : entries) {
                variables.add(entry.name());
            }
        }
        return new ComponentDescriptor(Component.HYDRO, version, true, entries, variables);
    }

    public static ComponentDescriptor gravity() {
        return new ComponentDescriptor(Component.GRAVITY, 0, false, List.of(), GRAVITY_VARIABLES);
    }

    /**
     * Reads the particle descriptor file if present and derives the particle variable list.
     */
    public static ComponentDescriptor particles(Path descriptor) throws IOException {
        if (!Files.isRegularFile(descriptor)) {
            return new ComponentDescriptor(Component.PARTICLES, 0, false, List.of(), PARTICLE_VARIABLES_V0);
        }
        List<String> lines = Files.readAllLines(descriptor, StandardCharsets.US_ASCII);
        if (lines.isEmpty() || !lines.get(0).contains(":")) {
            throw new IOException("Particle descriptor " + descriptor + " has no version line");
        }
        int version = parseInt(afterLast(lines.get(0), ':'), descriptor, 1);
        if (version != 1) {
            LOG.log(System.Logger.Level.WARNING, "Unsupported particle descriptor version {0} in {1}",
                    version, descriptor);
            return new ComponentDescriptor(Component.PARTICLES, version, true, List.of(),
                    version <= 0 ? PARTICLE_VARIABLES_V0 : PARTICLE_VARIABLES_V1);
        }
        List<VariableDescriptor> entries = csvEntries(lines, descriptor);
        List<String> variables = new ArrayList<>(PARTICLE_VARIABLES_V1);
        boolean metallicity = entries.stream().anyMatch(e -> e.name().equals("metallicity"));
        if (metallicity) {
            variables.add("metals");
            for (VariableDescriptor entry : entries) {
                if (!PARTICLE_LAYOUT_NAMES.contains(entry.name())) {
                    variables.add(entry.name());
                }
            }
        }
        return new ComponentDescriptor(Component.PARTICLES, version, true, entries, variables);
    }

    /**
     * Reads the particle header file. Returns {@link ParticleHeader#NONE} if the file does not exist.
     */
    public static ParticleHeader particleHeader(Path header) throws IOException {
        if (!Files.isRegularFile(header)) {
            return ParticleHeader.NONE;
        }
        List<String> lines = Files.readAllLines(header, StandardCharsets.US_ASCII);
        if (lines.isEmpty()) {
            throw new IOException("Particle header " + header + " is empty");
        }
        String first = lines.get(0);
        if (first.contains("Total")) {
            long total = parseCount(lines, 1, header, false);
            long dm = parseCount(lines, 3, header, false);
            long stars = parseCount(lines, 5, header, false);
            long sinks = parseCount(lines, 7, header, false);
            return new ParticleHeader(0, total, dm, stars, sinks, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
        }
        if (first.contains("Family")) {
            long[] counts = new long[12];
            for (int i = 0; i < counts.length; i++) {
                counts[i] = parseCount(lines, i + 1, header, true);
            }
            long total = 0;
            for (long count : counts) {
                total += count;
            }
            // other_tracer1, debris_tracer, cloud_tracer, star_tracer, other_tracer2, gas_tracer,
            // DM, star, cloud, debris, other, undefined
            return new ParticleHeader(1, total, counts[6], counts[7], 0, counts[8], counts[9], counts[10],
                    counts[11], counts[0], counts[1], counts[2], counts[3], counts[4], counts[5]);
        }
        LOG.log(System.Logger.Level.WARNING, "Unrecognized particle header format in {0}", header);
        return new ParticleHeader(-1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    private static long parseCount(List<String> lines, int index, Path file, boolean named) throws IOException {
        if (index >= lines.size()) {
            throw new IOException(file + " ends before line " + (index + 1));
        }
        String[] tokens = lines.get(index).trim().split("\\s+");
        String value = named ? tokens[tokens.length - 1] : tokens[0];
        try {
            return Long.parseLong(value);
        }
        catch (NumberFormatException e) {
            throw new IOException("Line " + (index + 1) + " of " + file + ": '" + value + "' is not a count", e);
        }
    }

    private static List<VariableDescriptor> csvEntries(List<String> lines, Path file) throws IOException {
        List<VariableDescriptor> entries = new ArrayList<>();
        // line 1: version, line 2: column header
        for (int i = 2; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            String[] fields = line.split(",");
            if (fields.length < 3) {
                throw new IOException("Line " + (i + 1) + " of " + file + " is not 'ivar, name, type': '" + line + "'");
            }
            int index = parseInt(fields[0].trim(), file, i + 1);
            entries.add(new VariableDescriptor(index, fields[1].trim(), fields[2].trim()));
        }
        return entries;
    }

    private static String afterLast(String line, char separator) {
        return line.substring(line.lastIndexOf(separator) + 1).trim();
    }

    private static int parseInt(String value, Path file, int lineNumber) throws IOException {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IOException("Line " + lineNumber + " of " + file + ": '" + value + "' is not an integer", e);
        }
    }
}
