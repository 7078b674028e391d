// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

// Builds one sketch per input shard on a thread pool, then reduces them to a single sketch.
//
// Each task owns its sketch, so the sketches need no locking. The caller owns the pool; it is never shut down here.
public final class SketchAggregator {
    private static final Logger logger = LoggerFactory.getLogger(SketchAggregator.class);

    public enum Reduction {
        SEQUENTIAL, // Left fold: ((s0 + s1) + s2) + ...
        TREE        // Balanced pairwise merges, log2(numOfShards) levels deep
    }

    private SketchAggregator() {
    }

    // Inserts every shard into its own sketch from "sketchMaker", in parallel on "executor", and returns
    // the reduction of all sketches. Any exception thrown by a task is rethrown here.
    public static <T extends Comparable<? super T>> QuantileSketch<T> build(final ExecutorService executor,
                                                                           final List<? extends Iterable<? extends T>> shards,
                                                                           final Supplier<? extends QuantileSketch<T>> sketchMaker,
                                                                           final Reduction reduction) {
        if (shards.isEmpty()) {
            throw new IllegalArgumentException("No shards to aggregate");
        }

        final List<Future<QuantileSketch<T>>> futures = new ArrayList<>(shards.size());
        for (int i = 0; i < shards.size(); i++) {
            final int shardIndex = i;
            final Iterable<? extends T> shard = shards.get(i);
            futures.add(executor.submit(() -> {
                final QuantileSketch<T> sketch = sketchMaker.get();
                sketch.insertAll(shard);
                if (logger.isDebugEnabled()) {
                    logger.debug("Shard {} done: count={}, entries={}", shardIndex, sketch.getCount(), sketch.getNumOfEntries());
                }
                return sketch;
            }));
        }

        final List<QuantileSketch<T>> sketches = new ArrayList<>(futures.size());
        try {
            for (final Future<QuantileSketch<T>> future : futures) {
                sketches.add(getResult(future));
            }
        } finally {
            for (final Future<QuantileSketch<T>> future : futures) {
                future.cancel(true); // No-op on completed tasks
            }
        }

        return reduce(sketches, reduction);
    }

    private static <S> S getResult(final Future<S> future) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for shard sketch", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Shard sketch failed", cause);
        }
    }

    // Merges all sketches, left to right, into a new sketch. Does not modify the inputs.
    public static <T extends Comparable<? super T>> QuantileSketch<T> mergeSequentially(final List<? extends QuantileSketch<T>> sketches) {
        return reduce(copyAll(sketches), Reduction.SEQUENTIAL);
    }

    // Merges all sketches by balanced pairwise merges into a new sketch. Does not modify the inputs.
    public static <T extends Comparable<? super T>> QuantileSketch<T> mergeAsTree(final List<? extends QuantileSketch<T>> sketches) {
        return reduce(copyAll(sketches), Reduction.TREE);
    }

    private static <T extends Comparable<? super T>> List<QuantileSketch<T>> copyAll(final List<? extends QuantileSketch<T>> sketches) {
        final List<QuantileSketch<T>> copies = new ArrayList<>(sketches.size());
        for (final QuantileSketch<T> sketch : sketches) {
            copies.add(sketch.deepCopy());
        }
        return copies;
    }

    // Reduces sketches in place. Sketches in the list are consumed.
    private static <T extends Comparable<? super T>> QuantileSketch<T> reduce(final List<QuantileSketch<T>> sketches, final Reduction reduction) {
        if (sketches.isEmpty()) {
            throw new IllegalArgumentException("No sketches to merge");
        }

        final QuantileSketch<T> result;
        switch (reduction) {
            case SEQUENTIAL:
                result = sketches.get(0);
                for (int i = 1; i < sketches.size(); i++) {
                    result.merge(sketches.get(i));
                }
                break;
            case TREE:
                result = mergeRange(sketches, 0, sketches.size());
                break;
            default:
                throw new IllegalArgumentException("Unknown reduction " + reduction);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("{} reduction of {} sketches: count={}, entries={}",
                    reduction, sketches.size(), result.getCount(), result.getNumOfEntries());
        }
        return result;
    }

    // Merges sketches in [from, to).
    private static <T extends Comparable<? super T>> QuantileSketch<T> mergeRange(final List<QuantileSketch<T>> sketches, final int from, final int to) {
        if (to - from == 1) {
            return sketches.get(from);
        }
        final int mid = (from + to) >>> 1;
        final QuantileSketch<T> left = mergeRange(sketches, from, mid);
        final QuantileSketch<T> right = mergeRange(sketches, mid, to);
        return left.merge(right);
    }
}
