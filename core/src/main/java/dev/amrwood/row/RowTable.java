/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.amrwood.row.Column.ByteColumn;
import dev.amrwood.row.Column.DoubleColumn;
import dev.amrwood.row.Column.IntColumn;
import dev.amrwood.row.Column.LongColumn;

/**
 * Immutable columnar table of cells, particles or clumps.
 * <p>
 * All columns have the same length. Row order carries no meaning; tables built
 * by the loader list the rows of each shard contiguously, in shard order.
 * </p>
 */
public final class RowTable {

    private final Map<String, Column> columns;
    private final List<ShardRange> shards;
    private final int rowCount;

    public RowTable(List<Column> columns, List<ShardRange> shards) {
        Map<String, Column> byName = new LinkedHashMap<>();
        int count = columns.isEmpty() ? 0 : columns.get(0).size();
        for (Column column : columns) {
            if (column.size() != count) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                        + " rows, expected " + count);
            }
            if (byName.put(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column '" + column.name() + "'");
            }
        }
        this.columns = Collections.unmodifiableMap(byName);
        this.shards = List.copyOf(shards);
        this.rowCount = count;
    }

    /**
     * Creates a table without rows with the given column layout.
     */
    public static RowTable empty(List<String> names, List<ColumnType> types) {
        List<Column> columns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            columns.add(emptyColumn(names.get(i), types.get(i)));
        }
        return new RowTable(columns, List.of());
    }

    /**
     * Concatenates tables with identical column layout, in list order.
     */
    public static RowTable concat(List<RowTable> tables) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("At least one table must be specified");
        }
        if (tables.size() == 1) {
            return tables.get(0);
        }
        RowTable first = tables.get(0);
        int total = 0;
        for (RowTable table : tables) {
            if (!table.columns.keySet().equals(first.columns.keySet())) {
                throw new IllegalArgumentException("Cannot concatenate tables with columns " + first.columnNames()
                        + " and " + table.columnNames());
            }
            total += table.rowCount;
        }

        List<Column> merged = new ArrayList<>();
        for (Column column : first.columns.values()) {
            merged.add(concatColumn(column, tables, total));
        }

        List<ShardRange> ranges = new ArrayList<>();
        int offset = 0;
        for (RowTable table : tables) {
            for (ShardRange range : table.shards) {
                ranges.add(new ShardRange(range.shard(), range.start() + offset, range.end() + offset));
            }
            offset += table.rowCount;
        }
        return new RowTable(merged, ranges);
    }

    private static Column concatColumn(Column column, List<RowTable> tables, int total) {
        String name = column.name();
        int offset = 0;
        switch (column.type()) {
            case DOUBLE -> {
                double[] values = new double[total];
                for (RowTable table : tables) {
                    double[] part = ((DoubleColumn) table.column(name)).array();
                    System.arraycopy(part, 0, values, offset, part.length);
                    offset += part.length;
                }
                return new DoubleColumn(name, values);
            }
            case INT -> {
                int[] values = new int[total];
                for (RowTable table : tables) {
                    int[] part = ((IntColumn) table.column(name)).array();
                    System.arraycopy(part, 0, values, offset, part.length);
                    offset += part.length;
                }
                return new IntColumn(name, values);
            }
            case LONG -> {
                long[] values = new long[total];
                for (RowTable table : tables) {
                    long[] part = ((LongColumn) table.column(name)).array();
                    System.arraycopy(part, 0, values, offset, part.length);
                    offset += part.length;
                }
                return new LongColumn(name, values);
            }
            default -> {
                byte[] values = new byte[total];
                for (RowTable table : tables) {
                    byte[] part = ((ByteColumn) table.column(name)).array();
                    System.arraycopy(part, 0, values, offset, part.length);
                    offset += part.length;
                }
                return new ByteColumn(name, values);
            }
        }
    }

    private static Column emptyColumn(String name, ColumnType type) {
        return switch (type) {
            case DOUBLE -> new DoubleColumn(name, new double[0]);
            case INT -> new IntColumn(name, new int[0]);
            case LONG -> new LongColumn(name, new long[0]);
            case BYTE -> new ByteColumn(name, new byte[0]);
        };
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    public List<Column> columns() {
        return List.copyOf(columns.values());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Returns the column with the given name.
     *
     * @throws IllegalArgumentException if the table has no such column
     */
    public Column column(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Column '" + name + "' not found, available: " + columns.keySet());
        }
        return column;
    }

    /**
     * Returns a copy of the values of a column widened to doubles.
     */
    public double[] doubles(String name) {
        return column(name).toDoubles();
    }

    /**
     * Returns a copy of the values of an integer column.
     */
    public int[] ints(String name) {
        Column column = column(name);
        if (column instanceof IntColumn intColumn) {
            return intColumn.values();
        }
        throw new IllegalArgumentException("Column '" + name + "' is not an integer column");
    }

    /**
     * Returns a copy of the values of an integer column widened to longs.
     */
    public long[] longs(String name) {
        Column column = column(name);
        if (column instanceof LongColumn longColumn) {
            return longColumn.values();
        }
        if (column instanceof IntColumn intColumn) {
            long[] result = new long[intColumn.size()];
            for (int i = 0; i < result.length; i++) {
                result[i] = intColumn.get(i);
            }
            return result;
        }
        throw new IllegalArgumentException("Column '" + name + "' is not an integer column");
    }

    public List<ShardRange> shards() {
        return shards;
    }

    /**
     * Returns a table with the rows whose flag is set.
     */
    public RowTable filter(boolean[] keep) {
        if (keep.length != rowCount) {
            throw new IllegalArgumentException("Filter has " + keep.length + " entries but table has "
                    + rowCount + " rows");
        }
        int kept = 0;
        for (boolean flag : keep) {
            if (flag) {
                kept++;
            }
        }
        List<Column> filtered = new ArrayList<>(columns.size());
        for (Column column : columns.values()) {
            filtered.add(column.filter(keep, kept));
        }

        List<ShardRange> ranges = new ArrayList<>(shards.size());
        int start = 0;
        for (ShardRange range : shards) {
            int count = 0;
            for (int i = range.start(); i < range.end(); i++) {
                if (keep[i]) {
                    count++;
                }
            }
            ranges.add(new ShardRange(range.shard(), start, start + count));
            start += count;
        }
        return new RowTable(filtered, ranges);
    }

    @Override
    public String toString() {
        return "RowTable[rows=" + rowCount + ", columns=" + columns.keySet() + "]";
    }
}
