/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.reader;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import dev.amrwood.metadata.Component;
import dev.amrwood.reader.MissingDataException;

/**
 * Maps shard files into memory.
 * <p>
 * The file channel is closed immediately after mapping; the MappedByteBuffer
 * remains valid and is released when garbage collected.
 * </p>
 */
public final class ShardMapping {

    private ShardMapping() {
    }

    /**
     * Map an entire shard file read-only and wrap it in a record reader.
     *
     * @throws MissingDataException if the file does not exist
     */
    public static FortranRecordReader open(Path path, Component component) throws IOException {
        return new FortranRecordReader(map(path, component), path.getFileName().toString());
    }

    public static MappedByteBuffer map(Path path, Component component) throws IOException {
        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        }
        catch (NoSuchFileException e) {
            throw new MissingDataException("Missing " + component.label() + " file: " + path, e);
        }
        try {
            long fileSize = channel.size();

            ShardMappingEvent event = new ShardMappingEvent();
            event.begin();

            MappedByteBuffer mapping = channel.map(FileChannel.MapMode.READ_ONLY, 0, fileSize);

            event.path = path.toString();
            event.size = fileSize;
            event.component = component.label();
            event.commit();

            return mapping;
        }
        finally {
            channel.close();
        }
    }
}
