/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Canopy.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.canopy.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class IntArrayListTest {

    @Test
    public void testAddAndGrow() {
        var list = new IntArrayList(2);
        for (int i = 0; i < 100; i++) {
            list.addInt(i * 3);
        }
        assertEquals(100, list.size());
        assertEquals(0, list.getInt(0));
        assertEquals(297, list.getInt(99));
        assertTrue(list.containsInt(42));
        assertFalse(list.containsInt(43));
        assertEquals(14, list.indexOfInt(42));
        assertEquals(-1, list.indexOfInt(43));
    }

    @Test
    public void testRemoveAtSwapBack() {
        var list = IntArrayList.of(10, 20, 30, 40);
        assertEquals(20, list.removeAtSwapBack(1));
        assertArrayEquals(new int[] { 10, 40, 30 }, list.toArray());

        assertEquals(30, list.removeAtSwapBack(2));
        assertArrayEquals(new int[] { 10, 40 }, list.toArray());
    }

    @Test
    public void testStackOperations() {
        var list = new IntArrayList();
        assertTrue(list.isEmpty());
        list.addInt(1);
        list.addInt(2);
        assertEquals(2, list.removeLast());
        assertEquals(1, list.removeLast());
        assertTrue(list.isEmpty());
    }

    @Test
    public void testSetAndEquality() {
        var a = IntArrayList.of(1, 2, 3);
        var b = new IntArrayList();
        b.addAll(a);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        assertEquals(2, b.setInt(1, 7));
        assertNotEquals(a, b);
        assertEquals(7, b.getInt(1));

        b.clear();
        assertEquals(0, b.size());
    }

    @Test
    public void testBoundsChecked() {
        var list = IntArrayList.of(1);
        assertThrows(IndexOutOfBoundsException.class, () -> list.getInt(1));
    }
}
