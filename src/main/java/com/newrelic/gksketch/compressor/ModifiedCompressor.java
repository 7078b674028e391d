// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch.compressor;

import com.newrelic.gksketch.EntryArray;

// Compaction by a local rule: two adjacent entries are folded whenever the result fits the bound.
//
// Inserts first try to grow g of an existing neighbor instead of adding an entry, so the array tends to stay
// small without any compress. An explicit compress is triggered only when the number of entries exceeds
// 5 * ceil(1 / epsilon).
public class ModifiedCompressor implements SummaryCompressor {
    public static final ModifiedCompressor INSTANCE = new ModifiedCompressor();

    protected ModifiedCompressor() {
    }

    public static long getMaxNumOfEntries(final double epsilon) {
        return 5 * (long) Math.ceil(1 / epsilon);
    }

    @Override
    public <T extends Comparable<? super T>> void insert(final EntryArray<T> entries, final T value, final long count, final double epsilon) {
        if (entries.isEmpty()) {
            entries.add(value, 1, 0);
            return;
        }

        final long maxGapDelta = SummaryCompressor.getMaxGapDelta(count, epsilon);
        final int size = entries.size();
        final int position = entries.upperBound(value);

        if (position == 0) {
            // New min. The old min may be absorbed into the entry after it, with the new value taking its place.
            if (size > 1 && entries.getG(1) + entries.getDelta(1) + 1 <= maxGapDelta) {
                entries.setG(1, entries.getG(1) + 1);
                entries.setValue(0, value);
            } else {
                entries.insert(0, value, 1, 0);
            }
            return;
        }

        if (position == size) {
            // New max, or a repeat of it. The max entry moves to the new value when it has room.
            // A single entry is also the min and must stay.
            final int lastIndex = size - 1;
            if (size >= 2 && entries.getG(lastIndex) + 1 <= maxGapDelta) {
                entries.setG(lastIndex, entries.getG(lastIndex) + 1);
                entries.setValue(lastIndex, value);
            } else {
                entries.add(value, 1, 0);
            }
            return;
        }

        final long rightG = entries.getG(position);
        final long rightDelta = entries.getDelta(position);
        if (rightG + rightDelta + 1 <= maxGapDelta) {
            entries.setG(position, rightG + 1); // Absorbed by the next larger entry
        } else {
            entries.insert(position, value, 1, rightG + rightDelta - 1);
        }
    }

    @Override
    public boolean needsCompression(final int numOfEntries, final long insertsSinceCompression, final double epsilon) {
        return numOfEntries > getMaxNumOfEntries(epsilon);
    }

    // Right to left, each entry is folded into the closest surviving entry on its right when the sum fits.
    // The min and the max are never removed.
    @Override
    public <T extends Comparable<? super T>> EntryArray<T> compress(final EntryArray<T> entries, final long count, final double epsilon) {
        final int size = entries.size();
        if (size < 3) {
            return entries;
        }

        final long maxGapDelta = SummaryCompressor.getMaxGapDelta(count, epsilon);
        final long[] gs = new long[size];
        for (int i = 0; i < size; i++) {
            gs[i] = entries.getG(i);
        }

        final boolean[] removed = new boolean[size];
        int numRemoved = 0;
        int current = size - 1;
        for (int i = size - 2; i >= 1; i--) {
            if (gs[i] + gs[current] + entries.getDelta(current) <= maxGapDelta) {
                gs[current] += gs[i];
                removed[i] = true;
                numRemoved++;
            } else {
                current = i;
            }
        }

        if (numRemoved == 0) {
            return entries;
        }
        final EntryArray<T> output = new EntryArray<>(size - numRemoved);
        for (int i = 0; i < size; i++) {
            if (!removed[i]) {
                output.add(entries.getValue(i), gs[i], entries.getDelta(i));
            }
        }
        return output;
    }

    // Interleaves both sides by value, ties taking "b" first. An entry placed inside the range of the other side
    // gets the extra delta given by the next unconsumed entry of the other side. Entries are folded on the fly
    // under the merged bound.
    @Override
    public <T extends Comparable<? super T>> EntryArray<T> merge(final EntryArray<T> a, final long countA, final double epsilonA,
                                                                 final EntryArray<T> b, final long countB, final double epsilonB) {
        final IncomingEntries<T> left = new IncomingEntries<>(a);
        final IncomingEntries<T> right = new IncomingEntries<>(b);
        final long maxGapDelta = SummaryCompressor.getMaxGapDelta(countA + countB, Math.max(epsilonA, epsilonB));
        final EntryFolder<T> folder = new EntryFolder<>(maxGapDelta, a.size() + b.size());

        while (left.hasNext() && right.hasNext()) {
            if (left.peekValue().compareTo(right.peekValue()) < 0) {
                final long extra = right.getAdditionalDelta();
                final int index = left.pop();
                folder.push(a.getValue(index), a.getG(index), a.getDelta(index) + extra);
            } else {
                final long extra = left.getAdditionalDelta();
                final int index = right.pop();
                folder.push(b.getValue(index), b.getG(index), b.getDelta(index) + extra);
            }
        }
        pushRemaining(left, folder);
        pushRemaining(right, folder);

        return folder.finish();
    }

    private static <T extends Comparable<? super T>> void pushRemaining(final IncomingEntries<T> source, final EntryFolder<T> folder) {
        final EntryArray<T> entries = source.getEntries();
        while (source.hasNext()) {
            final int index = source.pop();
            folder.push(entries.getValue(index), entries.getG(index), entries.getDelta(index));
        }
    }
}
