/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.projection;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event covering one projection.
 */
@Name("dev.amrwood.Projection")
@Label("Projection")
@Category({"Amrwood", "Projection"})
@Description("Deposition of dataset rows onto a pixel grid")
public class ProjectionEvent extends Event {

    @Label("Component")
    public String component;

    @Label("Rows")
    @Description("Number of rows deposited")
    public long rows;

    @Label("Pixels")
    @Description("Number of pixels per map")
    public long pixels;

    @Label("Variables")
    public int variables;

    @Label("Chunks")
    @Description("Number of row chunks")
    public int chunks;

    @Label("Partials")
    @Description("Number of partial grids reduced into the result")
    public int partials;
}
