/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.stats;

/**
 * Weighted summary of a set of values. Skewness and kurtosis are 0 when the values do
 * not vary; kurtosis is the excess kurtosis.
 */
public record WeightedStatistics(
        double mean,
        double median,
        double std,
        double skewness,
        double kurtosis,
        double min,
        double max,
        int count) {
}
