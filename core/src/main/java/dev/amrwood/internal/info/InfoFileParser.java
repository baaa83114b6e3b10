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
import java.util.Locale;

/**
 * Parser for the {@code key = value} info file of a snapshot.
 * <p>
 * Values are taken by line position; the key text is not interpreted. From line 22
 * on, the domain table lists the Hilbert key range of every shard.
 * </p>
 */
public final class InfoFileParser {

    private static final int DOMAIN_TABLE_FIRST_LINE = 22;

    private final Path path;
    private final List<String> lines;

    private InfoFileParser(Path path, List<String> lines) {
        this.path = path;
        this.lines = lines;
    }

    public static InfoFile parse(Path path) throws IOException {
        return new InfoFileParser(path, Files.readAllLines(path, StandardCharsets.US_ASCII)).parse();
    }

    static InfoFile parse(Path path, List<String> lines) throws IOException {
        return new InfoFileParser(path, lines).parse();
    }

    private InfoFile parse() throws IOException {
        int ncpu = intAt(1);
        int ndim = intAt(2);
        if (ndim != 3) {
            throw new IOException("Only 3D snapshots are supported, " + path + " declares ndim=" + ndim);
        }
        if (ncpu < 1) {
            throw new IOException("Invalid ncpu " + ncpu + " in " + path);
        }
        int levelmin = intAt(3);
        int levelmax = intAt(4);
        if (levelmin < 1 || levelmax < levelmin) {
            throw new IOException("Invalid level bounds [" + levelmin + ", " + levelmax + "] in " + path);
        }
        String ordering = valueAt(20).toLowerCase(Locale.ROOT);

        return new InfoFile(
                ncpu,
                ndim,
                levelmin,
                levelmax,
                intAt(5),
                intAt(6),
                doubleAt(8),
                doubleAt(9),
                doubleAt(10),
                doubleAt(11),
                doubleAt(12),
                doubleAt(13),
                doubleAt(14),
                doubleAt(15),
                doubleAt(16),
                doubleAt(17),
                doubleAt(18),
                ordering,
                boundKeys(ncpu, ordering.contains("hilbert")));
    }

    private List<Double> boundKeys(int ncpu, boolean required) throws IOException {
        if (lines.size() < DOMAIN_TABLE_FIRST_LINE - 1 + ncpu) {
            if (required) {
                throw new IOException("Domain table of " + path + " lists fewer than " + ncpu + " domains");
            }
            return List.of();
        }
        List<Double> keys = new ArrayList<>(ncpu + 1);
        keys.add(parseDouble(field(DOMAIN_TABLE_FIRST_LINE, 1), DOMAIN_TABLE_FIRST_LINE));
        for (int i = 1; i <= ncpu; i++) {
            int lineNumber = DOMAIN_TABLE_FIRST_LINE - 1 + i;
            keys.add(parseDouble(field(lineNumber, 2), lineNumber));
        }
        return keys;
    }

    private String field(int lineNumber, int index) throws IOException {
        String[] tokens = lines.get(lineNumber - 1).trim().split("\\s+");
        if (tokens.length <= index) {
            throw new IOException("Line " + lineNumber + " of " + path + " has no field " + (index + 1));
        }
        return tokens[index];
    }

    private String valueAt(int lineNumber) throws IOException {
        if (lines.size() < lineNumber) {
            throw new IOException("Info file " + path + " ends before line " + lineNumber);
        }
        String line = lines.get(lineNumber - 1);
        int separator = line.lastIndexOf('=');
        if (separator < 0) {
            throw new IOException("Line " + lineNumber + " of " + path + " is not a key = value pair: '" + line + "'");
        }
        return line.substring(separator + 1).trim();
    }

    private int intAt(int lineNumber) throws IOException {
        String value = valueAt(lineNumber);
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new IOException("Line " + lineNumber + " of " + path + ": '" + value + "' is not an integer", e);
        }
    }

    private double doubleAt(int lineNumber) throws IOException {
        return parseDouble(valueAt(lineNumber), lineNumber);
    }

    private double parseDouble(String value, int lineNumber) throws IOException {
        try {
            // Fortran may write double precision exponents with a D
            return Double.parseDouble(value.replace('D', 'E').replace('d', 'e'));
        }
        catch (NumberFormatException e) {
            throw new IOException("Line " + lineNumber + " of " + path + ": '" + value + "' is not a number", e);
        }
    }
}
