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
import javax.vecmath.Vector3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class Ray3DTest {

    private static final float EPSILON = 1e-4f;

    @Test
    public void testRayClampsToMaxDistance() {
        var ray = new Ray3D(new Point3f(1, 1, 1), new Vector3f(0, 0, 3), 4);
        assertEquals(new Vector3f(0, 0, 1), ray.direction());
        assertEquals(new Point3f(1, 1, 5), ray.toSegment(10).b());
        assertEquals(new Point3f(1, 1, 3), ray.getPointAt(2));
        assertFalse(ray.isUnbounded());
        assertTrue(new Ray3D(new Point3f(), new Vector3f()).isDegenerate());
        assertThrows(IllegalArgumentException.class,
                     () -> new Ray3D(new Point3f(), new Vector3f(1, 0, 0), Float.NaN));

        var segment = new LineSegment3D(new Point3f(0, 0, 0), new Point3f(10, 0, 0));
        assertEquals(0.5f, segment.closestParameter(5, 3, 0), EPSILON);
        assertEquals(0f, segment.closestParameter(-5, 3, 0));
        assertEquals(9f, segment.distanceSquaredTo(5, 3, 0), EPSILON);
        assertEquals(10f, segment.length(), EPSILON);
    }
}
