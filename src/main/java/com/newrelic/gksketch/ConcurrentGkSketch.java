// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.List;

// A concurrency wrapper for QuantileSketch. Methods are defined as "synchronized" for multi-thread access.
// NOTES:
// 1. For entry iteration, caller must explicitly use "synchronized" on the whole iterator block.
//    Example:
//   ConcurrentGkSketch<Double> sketch;
//   synchronized(sketch) {
//       final Iterator<QuantileSketch.Entry<Double>> iterator = sketch.iterator();
//       while (iterator.hasNext())
//           QuantileSketch.Entry<Double> entry = iterator.next();
//   }
// 2. When calling merge(), caller must ensure that "other" is also protected from concurrent modification.
//
public class ConcurrentGkSketch<T extends Comparable<? super T>> implements QuantileSketch<T> {
    protected final QuantileSketch<T> sketch;

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2")
    public ConcurrentGkSketch(final QuantileSketch<T> sketch) {
        this.sketch = sketch;
    }

    @Override
    public synchronized QuantileSketch<T> deepCopy() {
        return new ConcurrentGkSketch<>(sketch.deepCopy());
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    public QuantileSketch<T> getSketch() {
        return sketch;
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof ConcurrentGkSketch)) {
            return false;
        }
        return sketch.equals(((ConcurrentGkSketch<?>) obj).sketch);
    }

    @Override
    public int hashCode() {
        return sketch.hashCode(); // Hash code collision between "this" and "this.sketch" is acceptable.
    }

    @Override
    public String toString() {
        return sketch.toString();
    }

    @Override
    public synchronized void insert(final T value) {
        sketch.insert(value);
    }

    @Override
    public synchronized void insertAll(final Iterable<? extends T> values) {
        sketch.insertAll(values);
    }

    // Caller must ensure that "other" is also protected from concurrent modification.
    // Returns "this".
    @Override
    public synchronized QuantileSketch<T> merge(final QuantileSketch<T> other) {
        sketch.merge((other instanceof ConcurrentGkSketch) ? ((ConcurrentGkSketch<T>) other).sketch : other);
        return this;
    }

    @Override
    public synchronized long getCount() {
        return sketch.getCount();
    }

    @Override
    public synchronized double getEpsilon() {
        return sketch.getEpsilon();
    }

    @Override
    public synchronized T getMin() {
        return sketch.getMin();
    }

    @Override
    public synchronized T getMax() {
        return sketch.getMax();
    }

    @Override
    public synchronized int getNumOfEntries() {
        return sketch.getNumOfEntries();
    }

    @Override
    public synchronized Estimate<T> getQuantileEstimate(final double phi) {
        return sketch.getQuantileEstimate(phi);
    }

    @Override
    public synchronized List<T> quantiles(final double... phis) {
        return sketch.quantiles(phis);
    }

    // The whole iterator block must be protected by "synchronized". See comment at beginning of this class.
    // The "iterator()" method is also defined as "synchronized" for extra safety.
    @NotNull
    @Override
    public synchronized Iterator<Entry<T>> iterator() {
        return sketch.iterator();
    }
}
