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
 * JFR event covering the decoding of one shard.
 */
@Name("dev.amrwood.ShardDecode")
@Label("Shard Decode")
@Category({"Amrwood", "Decoding"})
@Description("Decoding and filtering of one simulation shard")
public class ShardDecodeEvent extends Event {

    @Label("Shard")
    @Description("1-based shard number")
    public int shard;

    @Label("Component")
    @Description("Physics component being decoded")
    public String component;

    @Label("Rows Scanned")
    @Description("Number of candidate rows inspected")
    public long rowsScanned;

    @Label("Rows Kept")
    @Description("Number of rows that passed the level and spatial filters")
    public long rowsKept;
}
