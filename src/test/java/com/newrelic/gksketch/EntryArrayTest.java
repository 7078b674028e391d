// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the GkSketch project.

package com.newrelic.gksketch;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.fail;

public class EntryArrayTest {
    private static EntryArray<Double> makeArray(final double... values) {
        final EntryArray<Double> array = new EntryArray<>(0); // Zero capacity to exercise growth
        for (int i = 0; i < values.length; i++) {
            array.add(values[i], i + 1, i);
        }
        return array;
    }

    private static void assertValues(final EntryArray<Double> array, final double... expected) {
        assertEquals(expected.length, array.size());
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], array.getValue(i), 0);
        }
    }

    @Test
    public void testAddAndGet() {
        final EntryArray<Double> array = makeArray(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        assertEquals(10, array.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(i + 1, array.getValue(i), 0);
            assertEquals(i + 1, array.getG(i));
            assertEquals(i, array.getDelta(i));
            assertEquals(new QuantileSketch.Entry<>((double) (i + 1), i + 1, i), array.get(i));
        }
    }

    @Test
    public void testSetters() {
        final EntryArray<Double> array = makeArray(1, 2, 3);
        array.setValue(1, 2.5);
        array.setG(1, 7);
        assertEquals(new QuantileSketch.Entry<>(2.5, 7, 1), array.get(1));
    }

    @Test
    public void testInsert() {
        final EntryArray<Double> array = makeArray(2, 4);
        array.insert(0, 1.0, 1, 0);
        array.insert(2, 3.0, 1, 0);
        array.insert(4, 5.0, 1, 0);
        assertValues(array, 1, 2, 3, 4, 5);

        try {
            array.insert(6, 6.0, 1, 0);
            fail("Should have thrown");
        } catch (IndexOutOfBoundsException e) {
            // Expected
        }
    }

    @Test
    public void testUpperBound() {
        final EntryArray<Double> array = makeArray(1, 3, 3, 3, 5);
        assertEquals(0, array.upperBound(0.0));
        assertEquals(1, array.upperBound(1.0));
        assertEquals(1, array.upperBound(2.0));
        assertEquals(4, array.upperBound(3.0)); // After all equal values
        assertEquals(5, array.upperBound(5.0));
        assertEquals(5, array.upperBound(9.0));

        assertEquals(0, new EntryArray<Double>().upperBound(1.0));
    }

    @Test
    public void testIndexCheck() {
        final EntryArray<Double> array = makeArray(1, 2);
        for (final int index : new int[]{-1, 2}) {
            try {
                array.getValue(index);
                fail("Should have thrown");
            } catch (IndexOutOfBoundsException e) {
                // Expected
            }
        }
        try {
            new EntryArray<Double>(-1);
            fail("Should have thrown");
        } catch (IllegalArgumentException e) {
            // Expected
        }
    }

    @Test
    public void testEqualAndHashAndDeepCopy() {
        final EntryArray<Double> a1 = makeArray(1, 2, 3);
        final EntryArray<Double> a2 = makeArray(1, 2, 3);
        assertEquals(a1, a2);
        assertEquals(a1.hashCode(), a2.hashCode());

        final EntryArray<Double> copy = a1.deepCopy();
        assertEquals(a1, copy);

        copy.setG(0, 99);
        assertNotEquals(a1, copy);
        assertEquals(1, a1.getG(0));

        a2.setValue(2, 3.5);
        assertNotEquals(a1, a2);

        // Spare capacity does not matter.
        final EntryArray<Double> big = new EntryArray<>(100);
        big.add(1.0, 1, 0);
        final EntryArray<Double> small = new EntryArray<>(1);
        small.add(1.0, 1, 0);
        assertEquals(big, small);
        assertEquals(big.hashCode(), small.hashCode());
    }

    @Test
    public void testToString() {
        assertEquals("size=0", new EntryArray<Double>().toString());
        assertEquals("size=2, array={(1.0,1,0),(2.0,2,1),}", makeArray(1, 2).toString());
    }
}
