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
package com.hellblazer.canopy.geometry;

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BoxTest {

    private static final float EPSILON = 1e-5f;

    @Test
    public void testCenterAndExtents() {
        var box = new Box(0, 2, 4, 2, 6, 10);
        assertEquals(new Point3f(1, 4, 7), box.center());
        assertEquals(2f, box.extentX());
        assertEquals(4f, box.extentY());
        assertEquals(6f, box.extentZ());
        assertEquals(48f, box.volume());
        assertEquals(box, Box.centeredAt(new Point3f(1, 4, 7), 1, 2, 3));
    }

    @Test
    public void testContainmentIsClosed() {
        var outer = new Box(0, 0, 0, 10, 10, 10);
        assertTrue(outer.contains(outer));
        assertTrue(outer.contains(new Box(0, 0, 0, 5, 5, 5)));
        assertFalse(outer.contains(new Box(-1, 0, 0, 5, 5, 5)));
        assertTrue(outer.containsPoint(10, 10, 10));
        assertFalse(outer.containsPoint(10.01f, 5, 5));
    }

    @Test
    public void testEmptyBox() {
        var empty = new Box(1, 1, 1, 0, 0, 0);
        var box = new Box(0, 0, 0, 1, 1, 1);
        assertTrue(empty.isEmpty());
        assertEquals(0f, empty.volume());
        assertFalse(box.contains(empty));
        assertFalse(box.overlaps(empty));
        assertFalse(empty.overlaps(box));
    }

    @Test
    public void testOverlapTouchingFaces() {
        var a = new Box(0, 0, 0, 1, 1, 1);
        var b = new Box(1, 0, 0, 2, 1, 1);
        assertTrue(a.overlaps(b));
        assertEquals(0f, a.overlapVolume(b));
        assertFalse(a.overlaps(new Box(1.5f, 0, 0, 2, 1, 1)));
    }

    @Test
    public void testOverlapVolume() {
        var a = new Box(0, 0, 0, 2, 2, 2);
        var b = new Box(1, 1, 1, 3, 3, 3);
        assertEquals(1f, a.overlapVolume(b), EPSILON);
        assertEquals(new Box(0, 0, 0, 3, 3, 3), a.union(b));
    }

    @Test
    public void testDistances() {
        var box = new Box(0, 0, 0, 2, 2, 2);
        assertEquals(0f, box.minDistanceSquared(1, 1, 1));
        assertEquals(9f, box.minDistanceSquared(5, 1, 1), EPSILON);
        assertEquals((float) Math.sqrt(3), box.maxDistance(1, 1, 1), EPSILON);
        assertEquals(3f, box.centerDistanceSquared(new Box(1, 1, 1, 3, 3, 3)), EPSILON);
    }
}
