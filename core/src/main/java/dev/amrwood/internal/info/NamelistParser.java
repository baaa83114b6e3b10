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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for the run namelist copied next to the snapshot.
 * <p>
 * {@code &GROUP} lines open a block, {@code key=value} lines inside it are collected.
 * Files that contain no {@code &RUN_PARAMS} block are not namelists and yield an empty map.
 * </p>
 */
public final class NamelistParser {

    private NamelistParser() {
    }

    public static Map<String, Map<String, String>> parse(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            return Map.of();
        }
        return parse(Files.readAllLines(path, StandardCharsets.ISO_8859_1));
    }

    static Map<String, Map<String, String>> parse(List<String> lines) {
        if (lines.stream().noneMatch(line -> line.contains("&RUN_PARAMS"))) {
            return Map.of();
        }
        Map<String, Map<String, String>> groups = new LinkedHashMap<>();
        Map<String, String> current = null;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.startsWith("&")) {
                String name = line.substring(1).trim();
                current = new LinkedHashMap<>();
                groups.put(name, current);
                continue;
            }
            if (line.equals("/")) {
                current = null;
                continue;
            }
            int separator = line.indexOf('=');
            if (current != null && separator > 0 && !line.startsWith("!")) {
                current.put(line.substring(0, separator).trim(), line.substring(separator + 1).trim());
            }
        }
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        groups.forEach((name, entries) -> result.put(name, Collections.unmodifiableMap(entries)));
        return Collections.unmodifiableMap(result);
    }
}
