/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.units;

/**
 * Thrown when a unit symbol is not known to a {@link ScaleSet}.
 */
public class UnknownUnitException extends IllegalArgumentException {

    private final String symbol;

    public UnknownUnitException(String symbol) {
        super("Unknown unit: '" + symbol + "'");
        this.symbol = symbol;
    }

    public UnknownUnitException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
