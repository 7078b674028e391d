// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

import java.util.Arrays;
import java.util.Objects;

// A growable array of (value, g, delta) entries, kept in three parallel arrays.
// Callers maintain the sort order. The array itself only provides positional access and a binary search.
public class EntryArray<T extends Comparable<? super T>> {
    public static final int DEFAULT_INITIAL_CAPACITY = 16;

    private Object[] values;
    private long[] gs;
    private long[] deltas;
    private int size;

    public EntryArray() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    public EntryArray(final int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Negative initialCapacity " + initialCapacity);
        }
        values = new Object[initialCapacity];
        gs = new long[initialCapacity];
        deltas = new long[initialCapacity];
    }

    public EntryArray<T> deepCopy() {
        final EntryArray<T> copy = new EntryArray<>(size);
        System.arraycopy(values, 0, copy.values, 0, size);
        System.arraycopy(gs, 0, copy.gs, 0, size);
        System.arraycopy(deltas, 0, copy.deltas, 0, size);
        copy.size = size;
        return copy;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public T getValue(final int index) {
        checkIndex(index);
        return valueAt(index);
    }

    public long getG(final int index) {
        checkIndex(index);
        return gs[index];
    }

    public long getDelta(final int index) {
        checkIndex(index);
        return deltas[index];
    }

    public void setValue(final int index, final T value) {
        checkIndex(index);
        values[index] = value;
    }

    public void setG(final int index, final long g) {
        checkIndex(index);
        gs[index] = g;
    }

    public QuantileSketch.Entry<T> get(final int index) {
        return new QuantileSketch.Entry<>(getValue(index), gs[index], deltas[index]);
    }

    // Append at the end. Caller guarantees value >= all existing values.
    public void add(final T value, final long g, final long delta) {
        ensureCapacity(size + 1);
        values[size] = value;
        gs[size] = g;
        deltas[size] = delta;
        size++;
    }

    // Insert before position "index". index == size() appends.
    public void insert(final int index, final T value, final long g, final long delta) {
        if (index < 0 || index > size) {
            throw new IndexOutOfBoundsException("Insert index " + index + " out of range of 0 and " + size);
        }
        ensureCapacity(size + 1);
        final int tail = size - index;
        if (tail > 0) {
            System.arraycopy(values, index, values, index + 1, tail);
            System.arraycopy(gs, index, gs, index + 1, tail);
            System.arraycopy(deltas, index, deltas, index + 1, tail);
        }
        values[index] = value;
        gs[index] = g;
        deltas[index] = delta;
        size++;
    }

    // Returns index of the first entry whose value is strictly greater than "value",
    // or size() when there is none.
    public int upperBound(final T value) {
        int low = 0;
        int high = size;
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (getValue(mid).compareTo(value) > 0) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    private void ensureCapacity(final int minCapacity) {
        if (minCapacity <= values.length) {
            return;
        }
        final int newCapacity = Math.max(minCapacity, values.length + (values.length >> 1) + 1);
        values = Arrays.copyOf(values, newCapacity);
        gs = Arrays.copyOf(gs, newCapacity);
        deltas = Arrays.copyOf(deltas, newCapacity);
    }

    @SuppressWarnings("unchecked")
    private T valueAt(final int index) {
        return (T) values[index];
    }

    private void checkIndex(final int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range of 0 and " + (size - 1));
        }
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof EntryArray)) {
            return false;
        }
        final EntryArray<?> other = (EntryArray<?>) obj;
        if (size != other.size) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (gs[i] != other.gs[i] || deltas[i] != other.deltas[i] || !Objects.equals(values[i], other.values[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(size);
        for (int i = 0; i < size; i++) {
            result = 31 * result + Objects.hashCode(values[i]);
            result = 31 * result + Long.hashCode(gs[i]);
            result = 31 * result + Long.hashCode(deltas[i]);
        }
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append("size=" + size);
        if (size > 0) {
            builder.append(", array={");
            for (int i = 0; i < size; i++) {
                builder.append("(" + values[i] + "," + gs[i] + "," + deltas[i] + "),");
            }
            builder.append("}");
        }
        return builder.toString();
    }
}
