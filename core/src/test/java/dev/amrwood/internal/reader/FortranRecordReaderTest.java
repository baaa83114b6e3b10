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
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import dev.amrwood.testing.FortranRecordWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for reading Fortran unformatted records.
 */
public class FortranRecordReaderTest {

    @Test
    void testReadsRecordsInOrder() throws IOException {
        FortranRecordReader reader = new FortranRecordReader(new FortranRecordWriter()
                .ints(8)
                .ints(1, 2, 3)
                .doubles(0.5, -1.25)
                .bytes((byte) 1, (byte) -2)
                .toByteBuffer(), "test");

        assertThat(reader.readInt()).isEqualTo(8);
        assertThat(reader.readInts(3)).containsExactly(1, 2, 3);
        assertThat(reader.readDoubles(2)).containsExactly(0.5, -1.25);
        assertThat(reader.readBytes(2)).containsExactly((byte) 1, (byte) -2);
        assertThat(reader.hasRemaining()).isFalse();
    }

    @Test
    void testDetectsBigEndianFiles() throws IOException {
        FortranRecordReader reader = new FortranRecordReader(new FortranRecordWriter(ByteOrder.BIG_ENDIAN)
                .ints(3)
                .doubles(2.5)
                .toByteBuffer(), "test");

        assertThat(reader.order()).isEqualTo(ByteOrder.BIG_ENDIAN);
        assertThat(reader.readInt()).isEqualTo(3);
        assertThat(reader.readDouble()).isEqualTo(2.5);
    }

    @Test
    void testSkipsRecords() throws IOException {
        FortranRecordReader reader = new FortranRecordReader(new FortranRecordWriter()
                .ints(1)
                .doubles(new double[100])
                .ints(new int[0])
                .ints(42)
                .toByteBuffer(), "test");

        reader.skipRecords(3);

        assertThat(reader.readInt()).isEqualTo(42);
    }

    @Test
    void testReadsIntegersOfEitherWidth() throws IOException {
        FortranRecordWriter writer = new FortranRecordWriter().ints(7, 9);
        writer.rawInt(16).raw(longBytes(11L, 13L)).rawInt(16);
        FortranRecordReader reader = new FortranRecordReader(writer.toByteBuffer(), "test");

        assertThat(reader.readIntegers(2)).containsExactly(7L, 9L);
        assertThat(reader.readIntegers(2)).containsExactly(11L, 13L);
    }

    // ==================== Corruption Tests ====================

    @Test
    void testTruncatedRecordRaisesEof() {
        byte[] complete = new FortranRecordWriter().ints(1).doubles(1.0, 2.0, 3.0).toByteArray();
        byte[] truncated = Arrays.copyOf(complete, complete.length - 10);
        FortranRecordReader reader = new FortranRecordReader(ByteBuffer.wrap(truncated), "truncated.out");

        assertThatThrownBy(() -> {
            reader.readInt();
            reader.readDoubles(3);
        })
                .isInstanceOf(EOFException.class)
                .hasMessageContaining("truncated.out");
    }

    @Test
    void testReadingPastTheEndRaisesEof() throws IOException {
        FortranRecordReader reader = new FortranRecordReader(new FortranRecordWriter().ints(1).toByteBuffer(), "test");
        reader.readInt();

        assertThatThrownBy(reader::readInt)
                .isInstanceOf(EOFException.class)
                .hasMessageContaining("Unexpected EOF");
    }

    @Test
    void testMismatchedTrailingMarker() {
        FortranRecordWriter writer = new FortranRecordWriter().ints(1);
        writer.rawInt(8).raw(new byte[8]).rawInt(12);
        FortranRecordReader reader = new FortranRecordReader(writer.toByteBuffer(), "corrupt.out");

        assertThatThrownBy(() -> {
            reader.readInt();
            reader.readDoubles();
        })
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Corrupt record")
                .hasMessageContaining("trailing marker 12");
    }

    @Test
    void testUnexpectedElementCount() {
        FortranRecordReader reader = new FortranRecordReader(new FortranRecordWriter()
                .doubles(1.0, 2.0)
                .toByteBuffer(), "test");

        assertThatThrownBy(() -> reader.readDoubles(3))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Expected 3 double values");
    }

    @Test
    void testRecordTooShortForDouble() {
        FortranRecordReader reader = new FortranRecordReader(new FortranRecordWriter().ints(1).toByteBuffer(), "test");

        assertThatThrownBy(reader::readDouble)
                .isInstanceOf(IOException.class)
                .hasMessageContaining("too short for one double");
    }

    private static byte[] longBytes(long... values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (long value : values) {
            buffer.putLong(value);
        }
        return buffer.array();
    }
}
