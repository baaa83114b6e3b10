/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.reader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import dev.amrwood.row.Column;
import dev.amrwood.row.ColumnType;
import dev.amrwood.row.RowTable;
import dev.amrwood.row.ShardRange;

/**
 * Growable column buffers filled by one shard decoder.
 * <p>
 * Not thread-safe. Each decode task owns its accumulator.
 * </p>
 */
final class RowAccumulator {

    private static final int INITIAL_CAPACITY = 1024;

    private final List<String> names = new ArrayList<>();
    private final List<ColumnType> types = new ArrayList<>();
    private final List<Object> arrays = new ArrayList<>();
    private int capacity = INITIAL_CAPACITY;
    private int size;

    /**
     * Adds a column and returns its index.
     */
    int define(String name, ColumnType type) {
        names.add(name);
        types.add(type);
        arrays.add(switch (type) {
            case DOUBLE -> new double[capacity];
            case INT -> new int[capacity];
            case LONG -> new long[capacity];
            case BYTE -> new byte[capacity];
        });
        return names.size() - 1;
    }

    /**
     * Appends a row with all columns zeroed and returns its index.
     */
    int addRow() {
        if (size == capacity) {
            grow(capacity * 2);
        }
        return size++;
    }

    int size() {
        return size;
    }

    void setDouble(int column, int row, double value) {
        ((double[]) arrays.get(column))[row] = value;
    }

    void setInt(int column, int row, int value) {
        ((int[]) arrays.get(column))[row] = value;
    }

    void setLong(int column, int row, long value) {
        ((long[]) arrays.get(column))[row] = value;
    }

    void setByte(int column, int row, byte value) {
        ((byte[]) arrays.get(column))[row] = value;
    }

    private void grow(int newCapacity) {
        for (int i = 0; i < arrays.size(); i++) {
            Object array = arrays.get(i);
            arrays.set(i, switch (types.get(i)) {
                case DOUBLE -> Arrays.copyOf((double[]) array, newCapacity);
                case INT -> Arrays.copyOf((int[]) array, newCapacity);
                case LONG -> Arrays.copyOf((long[]) array, newCapacity);
                case BYTE -> Arrays.copyOf((byte[]) array, newCapacity);
            });
        }
        capacity = newCapacity;
    }

    /**
     * Trims the buffers into a table whose rows all come from the given shard.
     */
    RowTable toTable(int shard) {
        List<Column> columns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            Object array = arrays.get(i);
            columns.add(switch (types.get(i)) {
                case DOUBLE -> new Column.DoubleColumn(names.get(i), Arrays.copyOf((double[]) array, size));
                case INT -> new Column.IntColumn(names.get(i), Arrays.copyOf((int[]) array, size));
                case LONG -> new Column.LongColumn(names.get(i), Arrays.copyOf((long[]) array, size));
                case BYTE -> new Column.ByteColumn(names.get(i), Arrays.copyOf((byte[]) array, size));
            });
        }
        return new RowTable(columns, List.of(new ShardRange(shard, 0, size)));
    }
}
