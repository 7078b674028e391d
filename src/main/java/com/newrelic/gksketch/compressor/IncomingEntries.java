// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch.compressor;

import com.newrelic.gksketch.EntryArray;

// Read cursor over one side of a merge.
class IncomingEntries<T extends Comparable<? super T>> {
    private final EntryArray<T> entries;
    private int cursor;
    private boolean started;

    IncomingEntries(final EntryArray<T> entries) {
        this.entries = entries;
    }

    boolean hasNext() {
        return cursor < entries.size();
    }

    // True once at least one entry has been taken, and some are left.
    boolean isInterleaving() {
        return started && hasNext();
    }

    T peekValue() {
        return entries.getValue(cursor);
    }

    // Returns index of the next entry and moves past it.
    int pop() {
        started = true;
        return cursor++;
    }

    EntryArray<T> getEntries() {
        return entries;
    }

    // Extra rank uncertainty for an entry from the other side placed before the next entry of this side.
    // Values of this side below that entry number at least rmin(previous) and at most rmax(next) - 1,
    // so the entry's rank may be off by up to next.g + next.delta - 1.
    long getAdditionalDelta() {
        if (!isInterleaving()) {
            return 0;
        }
        return entries.getG(cursor) + entries.getDelta(cursor) - 1;
    }
}
