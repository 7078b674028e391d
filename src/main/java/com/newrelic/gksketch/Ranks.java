// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

// Conversion between quantiles and 1-based ranks.
//
// For count = 4:
//   quantile     rank
//   [0, 1/4]     1
//   (1/4, 2/4]   2
//   (2/4, 3/4]   3
//   (3/4, 1]     4
public final class Ranks {
    private Ranks() {
    }

    public static long quantileToRank(final double quantile, final long count) {
        if (Double.isNaN(quantile) || quantile < 0 || quantile > 1) {
            throw new IllegalArgumentException("Quantile " + quantile + " out of range of 0 and 1");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("Count must be positive, got " + count);
        }
        return Math.max((long) Math.ceil(quantile * count), 1);
    }

    public static double rankToQuantile(final long rank, final long count) {
        if (rank <= 0 || rank > count) {
            throw new IllegalArgumentException("Rank " + rank + " out of range of 1 and " + count);
        }
        return rank == 1 ? 0 : (double) rank / count;
    }
}
