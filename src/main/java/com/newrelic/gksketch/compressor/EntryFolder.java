// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch.compressor;

import com.newrelic.gksketch.EntryArray;

// Builds an entry array from entries pushed in ascending value order, folding each pending entry into the
// one that follows it whenever the combined entry stays within maxGapDelta.
// The first pushed entry (the min) is always kept as is.
class EntryFolder<T extends Comparable<? super T>> {
    private final long maxGapDelta;
    private final EntryArray<T> output;

    private boolean hasPending;
    private T pendingValue;
    private long pendingG;
    private long pendingDelta;

    EntryFolder(final long maxGapDelta, final int expectedSize) {
        this.maxGapDelta = maxGapDelta;
        this.output = new EntryArray<>(expectedSize);
    }

    void push(final T value, final long g, final long delta) {
        if (hasPending) {
            long newG = g;
            if (pendingG + g + delta <= maxGapDelta) {
                newG += pendingG; // Pending entry absorbed by the new one
            } else {
                output.add(pendingValue, pendingG, pendingDelta);
            }
            setPending(value, newG, delta);
        } else if (output.isEmpty()) {
            output.add(value, g, delta);
        } else {
            setPending(value, g, delta);
        }
    }

    EntryArray<T> finish() {
        if (hasPending) {
            output.add(pendingValue, pendingG, pendingDelta);
            hasPending = false;
            pendingValue = null;
        }
        return output;
    }

    private void setPending(final T value, final long g, final long delta) {
        hasPending = true;
        pendingValue = value;
        pendingG = g;
        pendingDelta = delta;
    }
}
