// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch.compressor;

import com.newrelic.gksketch.EntryArray;

// Strategy for maintaining the entries of a GK summary: where inserts go, when and how adjacent entries
// are folded together, and how two entry arrays are combined.
//
// Implementations are stateless and shared by all sketches. Every method keeps this invariant on its output,
// where n is the count passed in:
//     g + delta <= getMaxGapDelta(n, epsilon) for every entry,
//     first entry is (min, 1, 0) and last entry has delta 0.
public interface SummaryCompressor {

    // Inserts one value. "count" already includes the new value.
    <T extends Comparable<? super T>> void insert(final EntryArray<T> entries, final T value, final long count, final double epsilon);

    // Returns true when the sketch should be compressed after an insert.
    boolean needsCompression(final int numOfEntries, final long insertsSinceCompression, final double epsilon);

    // Returns the compressed entries. May return the input array, modified or not. Compressing the result again
    // with the same count and epsilon returns it unchanged.
    <T extends Comparable<? super T>> EntryArray<T> compress(final EntryArray<T> entries, final long count, final double epsilon);

    // Returns a new array representing countA + countB observations, at epsilon max(epsilonA, epsilonB).
    // Does not modify either input.
    <T extends Comparable<? super T>> EntryArray<T> merge(final EntryArray<T> a, final long countA, final double epsilonA,
                                                          final EntryArray<T> b, final long countB, final double epsilonB);

    // Upper bound of g + delta of any entry, floor(2 * epsilon * count).
    static long getMaxGapDelta(final long count, final double epsilon) {
        return (long) Math.floor(2 * epsilon * count);
    }
}
