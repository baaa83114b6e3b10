/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.reader;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Reader for Fortran unformatted sequential files using direct ByteBuffer access.
 * <p>
 * Every record is framed by a 4-byte length marker before and after its payload.
 * The byte order is detected from the first marker, which RAMSES always writes
 * for a single 4-byte integer.
 * </p>
 */
public class FortranRecordReader {

    private static final int MARKER_SIZE = 4;

    private final ByteBuffer buffer;
    private final String source;

    /**
     * Creates a reader over the whole buffer.
     *
     * @param buffer the file content, positioned at the first record
     * @param source a name for the data used in error messages
     */
    public FortranRecordReader(ByteBuffer buffer, String source) {
        this.buffer = buffer.slice().order(detectOrder(buffer));
        this.source = source;
    }

    private static ByteOrder detectOrder(ByteBuffer buffer) {
        if (buffer.remaining() < MARKER_SIZE) {
            return ByteOrder.LITTLE_ENDIAN;
        }
        int littleEndian = buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN).getInt(buffer.position());
        if (littleEndian >= 0 && littleEndian <= buffer.remaining()) {
            return ByteOrder.LITTLE_ENDIAN;
        }
        return ByteOrder.BIG_ENDIAN;
    }

    public String source() {
        return source;
    }

    public ByteOrder order() {
        return buffer.order();
    }

    /**
     * Returns the current byte offset.
     */
    public int position() {
        return buffer.position();
    }

    public boolean hasRemaining() {
        return buffer.hasRemaining();
    }

    /**
     * Skip one record.
     */
    public void skipRecord() throws IOException {
        int length = beginRecord();
        buffer.position(buffer.position() + length);
        endRecord(length);
    }

    /**
     * Skip several records.
     */
    public void skipRecords(int count) throws IOException {
        for (int i = 0; i < count; i++) {
            skipRecord();
        }
    }

    /**
     * Read a record holding a single 4-byte integer (or several, returning the first).
     */
    public int readInt() throws IOException {
        int length = beginRecord();
        requirePayload(length, Integer.BYTES, "int");
        int value = buffer.getInt();
        buffer.position(buffer.position() + length - Integer.BYTES);
        endRecord(length);
        return value;
    }

    /**
     * Read a record of 4-byte integers.
     */
    public int[] readInts() throws IOException {
        int length = beginRecord();
        requireMultiple(length, Integer.BYTES, "int");
        int[] values = new int[length / Integer.BYTES];
        buffer.asIntBuffer().get(values);
        buffer.position(buffer.position() + length);
        endRecord(length);
        return values;
    }

    /**
     * Read a record of 4-byte integers, checking its element count.
     */
    public int[] readInts(int expectedCount) throws IOException {
        int[] values = readInts();
        requireCount(values.length, expectedCount, "int");
        return values;
    }

    /**
     * Read a record holding a single 8-byte float (or several, returning the first).
     */
    public double readDouble() throws IOException {
        int length = beginRecord();
        requirePayload(length, Double.BYTES, "double");
        double value = buffer.getDouble();
        buffer.position(buffer.position() + length - Double.BYTES);
        endRecord(length);
        return value;
    }

    /**
     * Read a record of 8-byte floats.
     */
    public double[] readDoubles() throws IOException {
        int length = beginRecord();
        requireMultiple(length, Double.BYTES, "double");
        double[] values = new double[length / Double.BYTES];
        buffer.asDoubleBuffer().get(values);
        buffer.position(buffer.position() + length);
        endRecord(length);
        return values;
    }

    /**
     * Read a record of 8-byte floats, checking its element count.
     */
    public double[] readDoubles(int expectedCount) throws IOException {
        double[] values = readDoubles();
        requireCount(values.length, expectedCount, "double");
        return values;
    }

    /**
     * Read a record of single bytes, checking its element count.
     */
    public byte[] readBytes(int expectedCount) throws IOException {
        int length = beginRecord();
        requireCount(length, expectedCount, "byte");
        byte[] values = new byte[length];
        buffer.get(values);
        endRecord(length);
        return values;
    }

    /**
     * Read a record of integers that may have been written as 4 or 8 bytes each.
     */
    public long[] readIntegers(int expectedCount) throws IOException {
        int length = beginRecord();
        long[] values = new long[expectedCount];
        if (expectedCount > 0 && length == expectedCount * Long.BYTES) {
            buffer.asLongBuffer().get(values);
        }
        else if (length == expectedCount * Integer.BYTES) {
            for (int i = 0; i < expectedCount; i++) {
                values[i] = buffer.getInt(buffer.position() + i * Integer.BYTES);
            }
        }
        else {
            throw new IOException("Record of " + length + " bytes in " + source + " at offset "
                    + (buffer.position() - MARKER_SIZE) + " does not hold " + expectedCount + " integers");
        }
        buffer.position(buffer.position() + length);
        endRecord(length);
        return values;
    }

    private int beginRecord() throws IOException {
        if (buffer.remaining() < MARKER_SIZE) {
            throw new EOFException("Unexpected EOF while reading record marker in " + source
                    + " at offset " + buffer.position());
        }
        int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining() - MARKER_SIZE) {
            throw new EOFException("Record of " + length + " bytes exceeds remaining data in " + source
                    + " at offset " + (buffer.position() - MARKER_SIZE));
        }
        return length;
    }

    private void endRecord(int length) throws IOException {
        int trailing = buffer.getInt();
        if (trailing != length) {
            throw new IOException("Corrupt record in " + source + " at offset "
                    + (buffer.position() - MARKER_SIZE - length - MARKER_SIZE)
                    + ": leading marker " + length + ", trailing marker " + trailing);
        }
    }

    private void requirePayload(int length, int size, String type) throws IOException {
        if (length < size) {
            throw new IOException("Record of " + length + " bytes in " + source + " is too short for one " + type);
        }
    }

    private void requireMultiple(int length, int size, String type) throws IOException {
        if (length % size != 0) {
            throw new IOException("Record of " + length + " bytes in " + source + " is not a " + type + " array");
        }
    }

    private void requireCount(int actual, int expected, String type) throws IOException {
        if (actual != expected) {
            throw new IOException("Expected " + expected + " " + type + " values in " + source
                    + " but record holds " + actual);
        }
    }
}
