// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

import com.newrelic.gksketch.QuantileSketch.Entry;
import com.newrelic.gksketch.compressor.CompressorOption;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.newrelic.gksketch.GkSketchTest.verifyInvariants;
import static com.newrelic.gksketch.GkSketchTest.verifyQuantiles;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

@RunWith(Parameterized.class)
public class ConcurrentGkSketchTest {
    @Parameterized.Parameters(name = "compressor {0}")
    public static Collection<Object[]> data() {
        final Collection<Object[]> collection = new ArrayList<>();
        for (final CompressorOption option : CompressorOption.values()) {
            collection.add(new Object[]{option});
        }
        return collection;
    }

    @Parameterized.Parameter()
    public CompressorOption option;

    private ConcurrentGkSketch<Long> newSketch(final double epsilon) {
        return new ConcurrentGkSketch<>(new GkSketch<>(Long.class, epsilon, option));
    }

    @Test
    public void testEqualAndHashAndDeepCopy() {
        final ConcurrentGkSketch<Long> s1 = newSketch(0.1);
        final ConcurrentGkSketch<Long> s2 = newSketch(0.1);
        final ConcurrentGkSketch<Long> s3 = newSketch(0.2);

        assertEquals(s1.deepCopy(), s1);
        assertThat(s1.deepCopy(), instanceOf(ConcurrentGkSketch.class));

        assertNotEquals(s1, s3);

        assertEquals(s1, s2);
        assertEquals(s1.hashCode(), s2.hashCode());

        s1.insert(11L);
        assertNotEquals(s1, s2);
        assertNotEquals(s1.hashCode(), s2.hashCode());

        assertEquals(s1.deepCopy(), s1);

        s2.insert(11L);
        assertEquals(s1, s2);
        assertEquals(s1.hashCode(), s2.hashCode());

        s1.insert(-22L);
        assertNotEquals(s1, s2);

        assertEquals(s1.deepCopy(), s1);

        s2.insert(-22L);
        assertEquals(s1, s2);
        assertEquals(s1.hashCode(), s2.hashCode());
    }

    @Test
    public void happyPath() throws Exception {
        final int numThreads = 3;
        final long valuesPerThread = 10000;
        final long expectedCount = valuesPerThread * numThreads;
        final double epsilon = 0.01;

        final ConcurrentGkSketch<Long> sketch = newSketch(epsilon);

        final ExecutorService threadPool = Executors.newFixedThreadPool(numThreads);
        for (int t = 0; t < numThreads; t++) {
            threadPool.execute(() -> {
                for (long value = 0; value < valuesPerThread; value++) {
                    sketch.insert(value);
                }
            });
        }
        threadPool.shutdown();
        assertTrue(threadPool.awaitTermination(1, TimeUnit.MINUTES));

        assertEquals(expectedCount, sketch.getCount());
        assertEquals(0, (long) sketch.getMin());
        assertEquals(valuesPerThread - 1, (long) sketch.getMax());
        assertEquals(epsilon, sketch.getEpsilon(), 0);

        final List<Long> all = new ArrayList<>();
        for (int t = 0; t < numThreads; t++) {
            for (long value = 0; value < valuesPerThread; value++) {
                all.add(value);
            }
        }
        verifyQuantiles(sketch, new ExactQuantiles<>(all));
        verifyInvariants((GkSketch<Long>) sketch.getSketch(), true);

        synchronized (sketch) {
            long sum = 0;
            final Iterator<Entry<Long>> iterator = sketch.iterator();
            while (iterator.hasNext()) {
                sum += iterator.next().getG();
            }
            assertEquals(expectedCount, sum);
        }
    }

    @Test
    public void testConcurrentMerge() throws Exception {
        final ConcurrentGkSketch<Long> target = newSketch(0.05);
        final int numThreads = 4;

        final ExecutorService threadPool = Executors.newFixedThreadPool(numThreads);
        for (int t = 0; t < numThreads; t++) {
            final long base = t * 1000L;
            threadPool.execute(() -> {
                final GkSketch<Long> local = new GkSketch<>(Long.class, 0.05, option);
                for (long value = 0; value < 1000; value++) {
                    local.insert(base + value);
                }
                target.merge(local);
            });
        }
        threadPool.shutdown();
        assertTrue(threadPool.awaitTermination(1, TimeUnit.MINUTES));

        assertEquals(4000, target.getCount());
        assertEquals(0, (long) target.getMin());
        assertEquals(3999, (long) target.getMax());
        final long median = target.quantile(0.5);
        assertTrue("median " + median, Math.abs(median - 1999) <= 200);
    }

    @Test
    public void testMergeUnwrapsOther() {
        final ConcurrentGkSketch<Long> a = newSketch(0.1);
        final ConcurrentGkSketch<Long> b = newSketch(0.1);
        a.insert(1L);
        b.insert(2L);

        assertSame(a, a.merge(b));
        assertEquals(2, a.getCount());
        assertEquals(1, b.getCount());
        assertEquals(2L, (long) a.quantile(1));
        assertEquals(2, a.getNumOfEntries());
        assertEquals(2, a.quantiles(0, 1).size());
        assertEquals(0, a.getQuantileEstimate(0).getRankError(), 0);
    }
}
