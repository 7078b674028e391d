// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Exact quantiles by sorting all values. Reference answers for sketch tests.
public class ExactQuantiles<T extends Comparable<? super T>> {
    private final List<T> sorted;

    public ExactQuantiles(final Iterable<? extends T> values) {
        sorted = new ArrayList<>();
        for (final T value : values) {
            sorted.add(value);
        }
        Collections.sort(sorted);
    }

    public long getCount() {
        return sorted.size();
    }

    public T quantile(final double phi) {
        return sorted.get((int) Ranks.quantileToRank(phi, sorted.size()) - 1);
    }

    // Lowest 1-based rank held by "value", or the rank it would take if inserted.
    public long getMinRank(final T value) {
        int low = 0;
        int high = sorted.size();
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (sorted.get(mid).compareTo(value) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low + 1;
    }

    // Highest 1-based rank held by "value". Equals getMinRank() - 1 when value is absent.
    public long getMaxRank(final T value) {
        int low = 0;
        int high = sorted.size();
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (sorted.get(mid).compareTo(value) <= 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    // Distance from targetRank to the closest rank "value" holds. 0 when value holds targetRank.
    public long getRankError(final T value, final long targetRank) {
        final long minRank = getMinRank(value);
        final long maxRank = getMaxRank(value);
        if (maxRank < minRank) {
            throw new AssertionError("Value " + value + " was never inserted");
        }
        if (targetRank < minRank) {
            return minRank - targetRank;
        }
        if (targetRank > maxRank) {
            return targetRank - maxRank;
        }
        return 0;
    }
}
