// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch.compressor;

import com.newrelic.gksketch.EntryArray;

// The compaction of the original Greenwald-Khanna paper.
//
// Entries are grouped into bands by their delta. Younger entries (larger delta) are in lower bands.
// Compress folds an entry, together with all consecutive lower band entries to its left, into its right
// neighbor, provided the right neighbor is in the same or a higher band and the result stays within bound.
// Compress is triggered once every ceil(1 / (2 * epsilon)) inserts.
public class ClassicCompressor implements SummaryCompressor {
    public static final ClassicCompressor INSTANCE = new ClassicCompressor();

    protected ClassicCompressor() {
    }

    // Returns band of "delta" under max gap delta "p". Band 0 holds only delta == p.
    // Band a > 0 holds deltas in (p - 2^a - (p mod 2^a), p - 2^(a-1) - (p mod 2^(a-1))].
    // delta == 0 gets the highest band, floor(log2(p)) + 1, or 0 when p is 0.
    public static int getBand(final long delta, final long p) {
        if (delta < 0 || delta > p) {
            throw new IllegalStateException("Delta " + delta + " out of range of 0 and " + p);
        }
        if (delta == 0) {
            return p == 0 ? 0 : 64 - Long.numberOfLeadingZeros(p);
        }
        int band = 0;
        while (true) {
            final long power = 1L << band;
            if (delta > p - power - (p % power)) {
                return band;
            }
            band++;
        }
    }

    @Override
    public <T extends Comparable<? super T>> void insert(final EntryArray<T> entries, final T value, final long count, final double epsilon) {
        if (entries.isEmpty() || value.compareTo(entries.getValue(0)) < 0) {
            entries.insert(0, value, 1, 0); // New min
            return;
        }
        final int lastIndex = entries.size() - 1;
        if (value.compareTo(entries.getValue(lastIndex)) >= 0) {
            entries.add(value, 1, 0); // New max
            return;
        }
        final long maxGapDelta = SummaryCompressor.getMaxGapDelta(count, epsilon);
        entries.insert(entries.upperBound(value), value, 1, Math.max(maxGapDelta - 1, 0));
    }

    @Override
    public boolean needsCompression(final int numOfEntries, final long insertsSinceCompression, final double epsilon) {
        return insertsSinceCompression >= getCompressionPeriod(epsilon);
    }

    public static long getCompressionPeriod(final double epsilon) {
        return (long) Math.ceil(1 / (2 * epsilon));
    }

    @Override
    public <T extends Comparable<? super T>> EntryArray<T> compress(final EntryArray<T> entries, final long count, final double epsilon) {
        final int size = entries.size();
        if (size < 3) {
            return entries;
        }

        final long maxGapDelta = SummaryCompressor.getMaxGapDelta(count, epsilon);
        final int[] bands = new int[size];
        final long[] gs = new long[size];
        for (int i = 0; i < size; i++) {
            bands[i] = getBand(entries.getDelta(i), maxGapDelta);
            gs[i] = entries.getG(i);
        }

        // Scan right to left. Entry 0 (the min) and the last entry (the max) are never removed.
        // Removed entries are only marked here. "next" is the closest surviving entry to the right of i.
        final boolean[] removed = new boolean[size];
        int numRemoved = 0;
        int next = size - 1;
        int i = size - 2;
        while (i >= 1) {
            if (bands[i] > bands[next]) {
                next = i;
                i--;
                continue;
            }

            // Collect the descendants of i: consecutive entries on the left in strictly lower bands.
            int first = i;
            long gSum = gs[i];
            while (first > 1 && bands[first - 1] < bands[i]) {
                first--;
                gSum += gs[first];
            }

            final long newG = gSum + gs[next];
            if (newG + entries.getDelta(next) >= maxGapDelta) {
                next = i;
                i--;
                continue;
            }

            gs[next] = newG;
            for (int j = first; j <= i; j++) {
                removed[j] = true;
            }
            numRemoved += i - first + 1;
            i = first - 1;
        }

        if (numRemoved == 0) {
            return entries;
        }
        final EntryArray<T> output = new EntryArray<>(size - numRemoved);
        for (int j = 0; j < size; j++) {
            if (!removed[j]) {
                output.add(entries.getValue(j), gs[j], entries.getDelta(j));
            }
        }
        return output;
    }

    // Interleaves both sides by value, ties taking "b" first. While the other side is being interleaved,
    // an entry's delta grows by the other side's max gap delta minus 1, which covers next.g + next.delta - 1
    // of the other side's next entry. The result is then compressed.
    @Override
    public <T extends Comparable<? super T>> EntryArray<T> merge(final EntryArray<T> a, final long countA, final double epsilonA,
                                                                 final EntryArray<T> b, final long countB, final double epsilonB) {
        final IncomingEntries<T> left = new IncomingEntries<>(a);
        final IncomingEntries<T> right = new IncomingEntries<>(b);
        final long maxGapDeltaA = SummaryCompressor.getMaxGapDelta(countA, epsilonA);
        final long maxGapDeltaB = SummaryCompressor.getMaxGapDelta(countB, epsilonB);

        final EntryArray<T> output = new EntryArray<>(a.size() + b.size());
        while (left.hasNext() && right.hasNext()) {
            if (left.peekValue().compareTo(right.peekValue()) < 0) {
                final long extra = right.isInterleaving() ? Math.max(maxGapDeltaB - 1, 0) : 0;
                final int index = left.pop();
                output.add(a.getValue(index), a.getG(index), a.getDelta(index) + extra);
            } else {
                final long extra = left.isInterleaving() ? Math.max(maxGapDeltaA - 1, 0) : 0;
                final int index = right.pop();
                output.add(b.getValue(index), b.getG(index), b.getDelta(index) + extra);
            }
        }
        copyRemaining(left, output);
        copyRemaining(right, output);

        return compress(output, countA + countB, Math.max(epsilonA, epsilonB));
    }

    private static <T extends Comparable<? super T>> void copyRemaining(final IncomingEntries<T> source, final EntryArray<T> output) {
        final EntryArray<T> entries = source.getEntries();
        while (source.hasNext()) {
            final int index = source.pop();
            output.add(entries.getValue(index), entries.getG(index), entries.getDelta(index));
        }
    }
}
