/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.reader;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted when a shard file is memory-mapped.
 * <p>
 * Memory-mapped I/O loads data through page faults rather than explicit
 * read() calls, so it is not captured by the standard {@code jdk.FileRead} event.
 * </p>
 */
@Name("dev.amrwood.ShardMapping")
@Label("Shard Mapping")
@Category({"Amrwood", "I/O"})
@Description("Memory-mapping of a simulation shard file")
public class ShardMappingEvent extends Event {

    @Label("File Path")
    @Description("Path to the file being mapped")
    public String path;

    @Label("Size")
    @Description("Size of the mapped region (bytes)")
    public long size;

    @Label("Component")
    @Description("Physics component the file belongs to")
    public String component;
}
