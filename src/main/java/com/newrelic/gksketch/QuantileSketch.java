// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

public interface QuantileSketch<T extends Comparable<? super T>> extends Iterable<QuantileSketch.Entry<T>> {

    // Insert a single observation. Null and NaN are rejected with InvalidValueException
    // and leave the sketch unchanged.
    void insert(final T value);

    default void insertAll(final Iterable<? extends T> values) {
        for (final T value : values) {
            insert(value);
        }
    }

    // Merge two sketches. Merge result goes into "this". Always returns "this".
    // An implementation should not modify "other".
    QuantileSketch<T> merge(final QuantileSketch<T> other);

    // Returns a deep copy of the sketch.
    QuantileSketch<T> deepCopy();

    // Returns number of observations absorbed, across inserts and merges.
    long getCount();

    // Returns the maximal rank error, as a fraction of getCount(), of any quantile answer.
    double getEpsilon();

    // Returns the smallest inserted value. Throws EmptySketchException if sketch is empty.
    T getMin();

    // Returns the largest inserted value. Throws EmptySketchException if sketch is empty.
    T getMax();

    // Returns number of entries currently kept. Memory use is proportional to this number.
    int getNumOfEntries();

    // Entry class. The interface provides an iterator on sketch entries.
    // - An implementation must return entries sorted by value from low to high.
    // - The first entry holds the min with g == 1 and delta == 0.
    // - The last entry holds the max with delta == 0.
    // - Sum of g over all entries equals getCount().
    final class Entry<T> {
        private final T value;
        private final long g;     // Lower bound of the rank gap to the previous entry
        private final long delta; // Extra uncertainty of this entry's rank

        public Entry(final T value, final long g, final long delta) {
            this.value = value;
            this.g = g;
            this.delta = delta;
        }

        public T getValue() {
            return value;
        }

        public long getG() {
            return g;
        }

        public long getDelta() {
            return delta;
        }

        @Override
        public boolean equals(final Object obj) {
            if (!(obj instanceof Entry)) {
                return false;
            }
            final Entry<?> other = (Entry<?>) obj;
            return g == other.g && delta == other.delta && Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            int result = Objects.hashCode(value);
            result = 31 * result + Long.hashCode(g);
            result = 31 * result + Long.hashCode(delta);
            return result;
        }

        @Override
        public String toString() {
            return "{value=" + value + ", g=" + g + ", delta=" + delta + "}";
        }
    }

    // A quantile answer, with the worst case rank error of the chosen entry as a fraction of count.
    final class Estimate<T> {
        private final T value;
        private final double rankError;

        public Estimate(final T value, final double rankError) {
            this.value = value;
            this.rankError = rankError;
        }

        public T getValue() {
            return value;
        }

        public double getRankError() {
            return rankError;
        }

        @Override
        public String toString() {
            return "{value=" + value + ", rankError=" + rankError + "}";
        }
    }

    // Returns a value whose rank is within getEpsilon() * getCount() of the rank of quantile phi.
    //
    // phi must be in [0, 1]. quantile(0) returns the min and quantile(1) the max, exactly.
    // Throws EmptySketchException when the sketch is empty.
    default T quantile(final double phi) {
        return getQuantileEstimate(phi).getValue();
    }

    default Estimate<T> getQuantileEstimate(final double phi) {
        return getQuantileEstimate(this, phi);
    }

    // Answers several quantiles. Output order matches input order.
    default List<T> quantiles(final double... phis) {
        final List<T> output = new ArrayList<>(phis.length);
        for (final double phi : phis) {
            output.add(quantile(phi));
        }
        return output;
    }

    // Default query rule. It only reads the entries, so it is shared by all compaction strategies.
    //
    // Every entry's rank is known to lie in [rmin, rmax]. If the entry is picked as the answer,
    // the worst case rank error is the distance from the target rank to the far end of that range.
    // The entry with the smallest worst case error wins; the first one on ties.
    static <T extends Comparable<? super T>> Estimate<T> getQuantileEstimate(final QuantileSketch<T> sketch, final double phi) {
        final long count = sketch.getCount();
        final long targetRank = Ranks.quantileToRank(phi, Math.max(count, 1));

        if (count == 0) {
            throw new EmptySketchException("Cannot query quantile " + phi + " on an empty sketch");
        }

        T bestValue = null;
        long bestError = Long.MAX_VALUE;
        long minRank = 0;

        final Iterator<Entry<T>> iterator = sketch.iterator();
        while (iterator.hasNext()) {
            final Entry<T> entry = iterator.next();
            minRank += entry.getG();
            final long maxRank = minRank + entry.getDelta();
            final long midRank = (minRank + maxRank) / 2;

            final long maxRankError = targetRank > midRank ? targetRank - minRank : maxRank - targetRank;
            if (maxRankError < bestError) {
                bestError = maxRankError;
                bestValue = entry.getValue();
            }
        }

        if (minRank != count) {
            throw new IllegalStateException("Sum of g " + minRank + " does not match count " + count);
        }

        return new Estimate<>(bestValue, (double) bestError / count);
    }
}
