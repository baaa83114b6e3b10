/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.testing;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes Fortran unformatted sequential records: every payload is framed by its byte
 * length as a 4-byte marker before and after.
 */
public final class FortranRecordWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteOrder order;

    public FortranRecordWriter() {
        this(ByteOrder.LITTLE_ENDIAN);
    }

    public FortranRecordWriter(ByteOrder order) {
        this.order = order;
    }

    public FortranRecordWriter ints(int... values) {
        ByteBuffer payload = allocate(values.length * Integer.BYTES);
        for (int value : values) {
            payload.putInt(value);
        }
        return record(payload);
    }

    public FortranRecordWriter longs(long... values) {
        ByteBuffer payload = allocate(values.length * Long.BYTES);
        for (long value : values) {
            payload.putLong(value);
        }
        return record(payload);
    }

    public FortranRecordWriter doubles(double... values) {
        ByteBuffer payload = allocate(values.length * Double.BYTES);
        for (double value : values) {
            payload.putDouble(value);
        }
        return record(payload);
    }

    public FortranRecordWriter bytes(byte... values) {
        return record(allocate(values.length).put(values));
    }

    /**
     * Appends raw bytes without framing, for building damaged files.
     */
    public FortranRecordWriter raw(byte... data) {
        out.writeBytes(data);
        return this;
    }

    /**
     * Appends a single 4-byte integer without framing.
     */
    public FortranRecordWriter rawInt(int value) {
        return raw(allocate(Integer.BYTES).putInt(value).array());
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }

    public ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toByteArray());
    }

    public void writeTo(Path path) throws IOException {
        Files.write(path, toByteArray());
    }

    private ByteBuffer allocate(int size) {
        return ByteBuffer.allocate(size).order(order);
    }

    private FortranRecordWriter record(ByteBuffer payload) {
        byte[] marker = allocate(Integer.BYTES).putInt(payload.capacity()).array();
        out.writeBytes(marker);
        out.writeBytes(payload.array());
        out.writeBytes(marker);
        return this;
    }
}
