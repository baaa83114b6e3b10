/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.row;

/**
 * One typed column of a {@link RowTable}.
 * <p>
 * A column takes ownership of the array it is created with. Its {@code values()}
 * accessor hands out copies, so a table cannot be changed through its columns.
 * </p>
 */
public sealed interface Column {

    String name();

    int size();

    ColumnType type();

    /**
     * Returns the value at the given row widened to a double.
     */
    double getDouble(int index);

    /**
     * Returns a new column holding the rows whose flag is set.
     */
    Column filter(boolean[] keep, int keptCount);

    /**
     * Returns all values widened to doubles.
     */
    default double[] toDoubles() {
        double[] result = new double[size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = getDouble(i);
        }
        return result;
    }

    record DoubleColumn(String name, double[] values) implements Column {
        public double get(int index) {
            return values[index];
        }

        @Override
        public double[] values() {
            return values.clone();
        }

        double[] array() {
            return values;
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public ColumnType type() {
            return ColumnType.DOUBLE;
        }

        @Override
        public double getDouble(int index) {
            return values[index];
        }

        @Override
        public double[] toDoubles() {
            return values.clone();
        }

        @Override
        public DoubleColumn filter(boolean[] keep, int keptCount) {
            double[] result = new double[keptCount];
            int j = 0;
            for (int i = 0; i < values.length; i++) {
                if (keep[i]) {
                    result[j++] = values[i];
                }
            }
            return new DoubleColumn(name, result);
        }
    }

    record IntColumn(String name, int[] values) implements Column {
        public int get(int index) {
            return values[index];
        }

        @Override
        public int[] values() {
            return values.clone();
        }

        int[] array() {
            return values;
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public ColumnType type() {
            return ColumnType.INT;
        }

        @Override
        public double getDouble(int index) {
            return values[index];
        }

        @Override
        public IntColumn filter(boolean[] keep, int keptCount) {
            int[] result = new int[keptCount];
            int j = 0;
            for (int i = 0; i < values.length; i++) {
                if (keep[i]) {
                    result[j++] = values[i];
                }
            }
            return new IntColumn(name, result);
        }
    }

    record LongColumn(String name, long[] values) implements Column {
        public long get(int index) {
            return values[index];
        }

        @Override
        public long[] values() {
            return values.clone();
        }

        long[] array() {
            return values;
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public ColumnType type() {
            return ColumnType.LONG;
        }

        @Override
        public double getDouble(int index) {
            return values[index];
        }

        @Override
        public LongColumn filter(boolean[] keep, int keptCount) {
            long[] result = new long[keptCount];
            int j = 0;
            for (int i = 0; i < values.length; i++) {
                if (keep[i]) {
                    result[j++] = values[i];
                }
            }
            return new LongColumn(name, result);
        }
    }

    record ByteColumn(String name, byte[] values) implements Column {
        public byte get(int index) {
            return values[index];
        }

        @Override
        public byte[] values() {
            return values.clone();
        }

        byte[] array() {
            return values;
        }

        @Override
        public int size() {
            return values.length;
        }

        @Override
        public ColumnType type() {
            return ColumnType.BYTE;
        }

        @Override
        public double getDouble(int index) {
            return values[index];
        }

        @Override
        public ByteColumn filter(boolean[] keep, int keptCount) {
            byte[] result = new byte[keptCount];
            int j = 0;
            for (int i = 0; i < values.length; i++) {
                if (keep[i]) {
                    result[j++] = values[i];
                }
            }
            return new ByteColumn(name, result);
        }
    }
}
