/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.reader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import dev.amrwood.dataset.Ranges;
import dev.amrwood.metadata.Component;
import dev.amrwood.reader.MissingDataException;
import dev.amrwood.row.ColumnType;
import dev.amrwood.row.RowTable;

/**
 * Reads the whitespace-separated clump tables written by the clump finder.
 * <p>
 * The first line of each table holds the column names. Rows are kept when their
 * peak position lies inside the spatial window.
 * </p>
 */
public final class ClumpTableReader {

    private static final System.Logger LOG = System.getLogger(ClumpTableReader.class.getName());

    private final SnapshotFiles files;
    private final List<String> columns;
    private final List<String> variables;
    private final Ranges ranges;
    private final double boxlen;

    /**
     * @param columns the header tokens of the tables
     * @param variables the columns to keep
     */
    public ClumpTableReader(SnapshotFiles files, List<String> columns, List<String> variables,
                            Ranges ranges, double boxlen) {
        for (String required : List.of("peak_x", "peak_y", "peak_z")) {
            if (!columns.contains(required)) {
                throw new IllegalArgumentException("Clump table has no '" + required + "' column: " + columns);
            }
        }
        this.files = files;
        this.columns = List.copyOf(columns);
        this.variables = List.copyOf(variables);
        this.ranges = ranges;
        this.boxlen = boxlen;
    }

    /**
     * Returns the header tokens of a clump table.
     */
    public static List<String> readHeader(Path path) throws IOException {
        List<String> lines = readLines(path);
        if (lines.isEmpty() || lines.get(0).isBlank()) {
            throw new IOException("Clump table " + path + " has no header line");
        }
        return List.of(lines.get(0).trim().split("\\s+"));
    }

    private static List<String> readLines(Path path) throws IOException {
        try {
            return Files.readAllLines(path, StandardCharsets.US_ASCII);
        }
        catch (NoSuchFileException e) {
            throw new MissingDataException("Missing clumps file: " + path, e);
        }
    }

    public RowTable decode(int icpu) throws IOException {
        ShardDecodeEvent event = new ShardDecodeEvent();
        event.begin();

        Path path = files.clumps(icpu);
        List<String> lines = readLines(path);

        RowAccumulator rows = new RowAccumulator();
        int[] target = new int[columns.size()];
        Arrays.fill(target, -1);
        for (String name : variables) {
            target[columns.indexOf(name)] = rows.define(name, ColumnType.DOUBLE);
        }
        int px = columns.indexOf("peak_x");
        int py = columns.indexOf("peak_y");
        int pz = columns.indexOf("peak_z");

        long scanned = 0;
        double[] values = new double[columns.size()];
        for (int lineNumber = 1; lineNumber < lines.size(); lineNumber++) {
            String line = lines.get(lineNumber).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] tokens = line.split("\\s+");
            if (tokens.length != columns.size()) {
                throw new IOException("Line " + (lineNumber + 1) + " of " + path.getFileName() + " has "
                        + tokens.length + " fields, header has " + columns.size());
            }
            for (int i = 0; i < tokens.length; i++) {
                try {
                    values[i] = Double.parseDouble(tokens[i]);
                }
                catch (NumberFormatException e) {
                    throw new IOException("Invalid number '" + tokens[i] + "' on line " + (lineNumber + 1)
                            + " of " + path.getFileName(), e);
                }
            }
            scanned++;
            if (!inside(values[px], 0) || !inside(values[py], 1) || !inside(values[pz], 2)) {
                continue;
            }
            int row = rows.addRow();
            for (int i = 0; i < target.length; i++) {
                if (target[i] >= 0) {
                    rows.setDouble(target[i], row, values[i]);
                }
            }
        }

        event.shard = icpu;
        event.component = Component.CLUMPS.label();
        event.rowsScanned = scanned;
        event.rowsKept = rows.size();
        event.commit();

        LOG.log(System.Logger.Level.DEBUG, "Read clump table {0}: {1} of {2} clumps kept",
                path.getFileName(), rows.size(), scanned);
        return rows.toTable(icpu);
    }

    private boolean inside(double position, int axis) {
        return position >= ranges.min(axis) * boxlen && position <= ranges.max(axis) * boxlen;
    }
}
