/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.reader;

import java.nio.file.Path;

/**
 * File naming scheme of a RAMSES snapshot directory.
 * <p>
 * Output and shard numbers are zero padded to five digits, shards are 1-based:
 * {@code output_00042/hydro_00042.out00003}.
 * </p>
 */
public record SnapshotFiles(Path directory, int output) {

    public static SnapshotFiles of(Path baseDirectory, int output) {
        return new SnapshotFiles(baseDirectory.resolve("output_" + pad(output)), output);
    }

    public Path info() {
        return file("info_" + pad(output) + ".txt");
    }

    public Path header() {
        return file("header_" + pad(output) + ".txt");
    }

    public Path hydroDescriptor() {
        return file("hydro_file_descriptor.txt");
    }

    public Path particleDescriptor() {
        return file("part_file_descriptor.txt");
    }

    public Path namelist() {
        return file("namelist.txt");
    }

    public Path sinks() {
        return file("sink_" + pad(output) + ".csv");
    }

    public Path amr(int shard) {
        return shardFile("amr", ".out", shard);
    }

    public Path hydro(int shard) {
        return shardFile("hydro", ".out", shard);
    }

    public Path gravity(int shard) {
        return shardFile("grav", ".out", shard);
    }

    public Path particles(int shard) {
        return shardFile("part", ".out", shard);
    }

    public Path rt(int shard) {
        return shardFile("rt", ".out", shard);
    }

    public Path clumps(int shard) {
        return shardFile("clump", ".txt", shard);
    }

    private Path shardFile(String prefix, String extension, int shard) {
        return file(prefix + "_" + pad(output) + extension + pad(shard));
    }

    private Path file(String name) {
        return directory.resolve(name);
    }

    static String pad(int number) {
        return String.format("%05d", number);
    }
}
