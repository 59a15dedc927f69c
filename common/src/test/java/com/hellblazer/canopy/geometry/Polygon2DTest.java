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

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class Polygon2DTest {

    @Test
    public void testSquare() {
        var square = new Polygon2D(0, 0, 10, 0, 10, 10, 0, 10);
        assertEquals(4, square.vertexCount());
        assertTrue(square.containsPoint(5, 5));
        assertFalse(square.containsPoint(11, 5));
        assertFalse(square.containsPoint(5, -1));
        assertEquals(0f, square.getMinU());
        assertEquals(10f, square.getMaxV());
    }

    @Test
    public void testConcave() {
        // An L shape
        var shape = new Polygon2D(0, 0, 10, 0, 10, 2, 2, 2, 2, 10, 0, 10);
        assertTrue(shape.containsPoint(1, 9));
        assertTrue(shape.containsPoint(9, 1));
        assertFalse(shape.containsPoint(6, 6));
    }

    @Test
    public void testDegenerate() {
        assertThrows(IllegalArgumentException.class, () -> new Polygon2D(0, 0, 1));
        var segment = new Polygon2D(0, 0, 10, 10);
        assertFalse(segment.containsPoint(5, 5));
        assertFalse(segment.boundsOverlap(0, 0, 10, 10));
    }

    @Test
    public void testBoundsOverlap() {
        var square = new Polygon2D(0, 0, 10, 0, 10, 10, 0, 10);
        assertTrue(square.boundsOverlap(9, 9, 20, 20));
        assertTrue(square.boundsOverlap(10, 10, 20, 20));
        assertFalse(square.boundsOverlap(11, 0, 20, 5));
    }

    @Test
    public void testRotateTranslate() {
        var square = new Polygon2D(0, 0, 10, 0, 10, 10, 0, 10);
        var rotated = square.rotateTranslate((float) (Math.PI / 2), 0, 0);
        assertTrue(rotated.containsPoint(-5, 5));
        assertFalse(rotated.containsPoint(5, 5));

        var moved = square.transform(1, 0, 100, 0, 1, 0);
        assertTrue(moved.containsPoint(105, 5));
        assertFalse(moved.containsPoint(5, 5));
    }
}
