// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

import com.newrelic.gksketch.compressor.CompressorOption;
import com.newrelic.gksketch.compressor.SummaryCompressor;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.NoSuchElementException;

// A Greenwald-Khanna quantile summary. Answers any quantile query with a rank error of at most epsilon * count,
// keeping a number of entries sublinear in count.
//
// Entry i covers the values between entry i-1 and itself. Its rank lies in [rmin(i), rmin(i) + delta(i)],
// where rmin(i) is the sum of g over entries 0 to i. The compressor keeps g + delta within floor(2 * epsilon * count)
// for every entry, which bounds the query error.
//
// Not thread safe. Use ConcurrentGkSketch for shared access.
public class GkSketch<T extends Comparable<? super T>> implements QuantileSketch<T> {
    public static final double DEFAULT_EPSILON = 0.01; // 1% rank error
    public static final CompressorOption DEFAULT_COMPRESSOR = CompressorOption.MODIFIED;

    private final Class<T> valueType;
    private final CompressorOption compressorOption;
    private final SummaryCompressor compressor;

    private EntryArray<T> entries;
    private double epsilon;
    private long count;
    private long insertsSinceCompression;

    public static GkSketch<Double> ofDoubles() {
        return ofDoubles(DEFAULT_EPSILON);
    }

    public static GkSketch<Double> ofDoubles(final double epsilon) {
        return new GkSketch<>(Double.class, epsilon, DEFAULT_COMPRESSOR);
    }

    public static GkSketch<Long> ofLongs(final double epsilon) {
        return new GkSketch<>(Long.class, epsilon, DEFAULT_COMPRESSOR);
    }

    public static GkSketch<Integer> ofIntegers(final double epsilon) {
        return new GkSketch<>(Integer.class, epsilon, DEFAULT_COMPRESSOR);
    }

    public GkSketch(final Class<T> valueType) {
        this(valueType, DEFAULT_EPSILON, DEFAULT_COMPRESSOR);
    }

    public GkSketch(final Class<T> valueType, final double epsilon) {
        this(valueType, epsilon, DEFAULT_COMPRESSOR);
    }

    public GkSketch(final Class<T> valueType, final double epsilon, final CompressorOption compressorOption) {
        this(valueType, epsilon, compressorOption, new EntryArray<>(), 0);
    }

    // For merge and deepCopy. Caller must ensure that entries and count are consistent.
    private GkSketch(final Class<T> valueType,
                     final double epsilon,
                     final CompressorOption compressorOption,
                     final EntryArray<T> entries,
                     final long count) {
        if (valueType == null) {
            throw new IllegalArgumentException("valueType must not be null");
        }
        if (compressorOption == null) {
            throw new IllegalArgumentException("compressorOption must not be null");
        }
        checkEpsilon(epsilon);
        this.valueType = valueType;
        this.compressorOption = compressorOption;
        this.compressor = compressorOption.getCompressor();
        this.epsilon = epsilon;
        this.entries = entries;
        this.count = count;
    }

    public static void checkEpsilon(final double epsilon) {
        if (!(epsilon > 0 && epsilon < 1)) { // Also rejects NaN
            throw new IllegalArgumentException("epsilon " + epsilon + " out of range of 0 and 1 (exclusive)");
        }
    }

    @Override
    public GkSketch<T> deepCopy() {
        final GkSketch<T> copy = new GkSketch<>(valueType, epsilon, compressorOption, entries.deepCopy(), count);
        copy.insertsSinceCompression = insertsSinceCompression;
        return copy;
    }

    @Override
    public void insert(final T value) {
        checkValue(value);

        count++;
        compressor.insert(entries, value, count, epsilon);
        insertsSinceCompression++;

        if (compressor.needsCompression(entries.size(), insertsSinceCompression, epsilon)) {
            compress();
        }
    }

    private void checkValue(final T value) {
        if (value == null) {
            throw new InvalidValueException("Null value not allowed");
        }
        if (!valueType.isInstance(value)) {
            throw new InvalidValueException("Value type " + value.getClass().getName() + " does not match " + valueType.getName());
        }
        if (value instanceof Double && ((Double) value).isNaN() || value instanceof Float && ((Float) value).isNaN()) {
            throw new InvalidValueException("NaN value not allowed");
        }
    }

    // Compress in place. A second call without intervening inserts is a no-op.
    public void compress() {
        entries = compressor.compress(entries, count, epsilon);
        insertsSinceCompression = 0;
    }

    @Override
    public GkSketch<T> merge(final QuantileSketch<T> other) {
        if (other instanceof ConcurrentGkSketch) {
            return merge(((ConcurrentGkSketch<T>) other).sketch);
        }
        if (!(other instanceof GkSketch)) {
            throw new IncompatibleMergeException("GkSketch cannot merge with " + other.getClass().getName());
        }
        final GkSketch<T> merged = merge(this, (GkSketch<T>) other);
        entries = merged.entries;
        epsilon = merged.epsilon;
        count = merged.count;
        insertsSinceCompression = merged.insertsSinceCompression;
        return this;
    }

    // Merge 2 sketches into a new sketch. Does not modify a or b.
    // The result covers a.getCount() + b.getCount() observations at epsilon max(a.getEpsilon(), b.getEpsilon()).
    public static <T extends Comparable<? super T>> GkSketch<T> merge(final GkSketch<T> a, final GkSketch<T> b) {
        if (!a.valueType.equals(b.valueType)) {
            throw new IncompatibleMergeException("GkSketch merge not allowed between value types "
                    + a.valueType.getName() + " and " + b.valueType.getName());
        }
        if (a.compressorOption != b.compressorOption) {
            throw new IncompatibleMergeException("GkSketch merge not allowed between compressors "
                    + a.compressorOption + " and " + b.compressorOption);
        }

        final double epsilon = Math.max(a.epsilon, b.epsilon);
        final long count = a.count + b.count;
        final EntryArray<T> entries = a.compressor.merge(a.entries, a.count, a.epsilon, b.entries, b.count, b.epsilon);

        final GkSketch<T> result = new GkSketch<>(a.valueType, epsilon, a.compressorOption, entries, count);
        if (result.compressor.needsCompression(entries.size(), 0, epsilon)) {
            result.compress();
        }
        return result;
    }

    public Class<T> getValueType() {
        return valueType;
    }

    public CompressorOption getCompressorOption() {
        return compressorOption;
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    public EntryArray<T> getEntries() {
        return entries;
    }

    public long getInsertsSinceCompression() {
        return insertsSinceCompression;
    }

    @Override
    public long getCount() {
        return count;
    }

    @Override
    public double getEpsilon() {
        return epsilon;
    }

    @Override
    public T getMin() {
        if (entries.isEmpty()) {
            throw new EmptySketchException("No min on an empty sketch");
        }
        return entries.getValue(0);
    }

    @Override
    public T getMax() {
        if (entries.isEmpty()) {
            throw new EmptySketchException("No max on an empty sketch");
        }
        return entries.getValue(entries.size() - 1);
    }

    @Override
    public int getNumOfEntries() {
        return entries.size();
    }

    @NotNull
    @Override
    public Iterator<Entry<T>> iterator() {
        return new Iterator<Entry<T>>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return index < entries.size();
            }

            @Override
            public Entry<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return entries.get(index++);
            }
        };
    }

    @SuppressFBWarnings(value = "FE_FLOATING_POINT_EQUALITY")
    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof GkSketch)) {
            return false;
        }
        final GkSketch<?> other = (GkSketch<?>) obj;

        // insertsSinceCompression is bookkeeping only. Not used in equals().
        return count == other.count
                && epsilon == other.epsilon
                && valueType.equals(other.valueType)
                && compressorOption == other.compressorOption
                && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        int result = 1;
        result = 31 * result + Long.hashCode(count);
        result = 31 * result + Double.hashCode(epsilon);
        result = 31 * result + valueType.hashCode();
        result = 31 * result + compressorOption.hashCode();
        result = 31 * result + entries.hashCode();
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append("valueType=" + valueType.getSimpleName());
        builder.append(", compressor=" + compressorOption);
        builder.append(", epsilon=" + epsilon);
        builder.append(", count=" + count);
        builder.append(", numOfEntries=" + entries.size());
        builder.append("\n");

        builder.append("value,rmin,rmax,g,delta\n");
        long minRank = 0;
        for (int i = 0; i < entries.size(); i++) {
            final long g = entries.getG(i);
            final long delta = entries.getDelta(i);
            minRank += g;
            builder.append(entries.getValue(i) + "," + minRank + "," + (minRank + delta) + "," + g + "," + delta + "\n");
        }
        return builder.toString();
    }
}
