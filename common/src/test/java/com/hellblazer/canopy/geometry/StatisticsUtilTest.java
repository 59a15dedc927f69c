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

import javax.vecmath.Vector3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class StatisticsUtilTest {

    private static final float EPSILON = 1e-3f;

    @Test
    public void testPointsOnDiagonal() {
        float[] xs = { -3, -1, 0, 2, 5 };
        float[] ys = { -3, -1, 0, 2, 5 };
        float[] zs = { 0, 0, 0, 0, 0 };
        Vector3f axis = StatisticsUtil.principalAxis(xs, ys, zs, xs.length, 0, 0, 0);
        float component = (float) Math.sqrt(0.5);
        assertEquals(component, Math.abs(axis.x), EPSILON);
        assertEquals(component, Math.abs(axis.y), EPSILON);
        assertEquals(0f, axis.z, EPSILON);
        assertEquals(1f, axis.length(), EPSILON);
    }

    @Test
    public void testElongatedCloud() {
        float[] xs = { 0, 0.1f, -0.1f, 0, 0.05f };
        float[] ys = { 0, 0.1f, -0.1f, 0.05f, 0 };
        float[] zs = { -10, -5, 0, 5, 10 };
        Vector3f axis = StatisticsUtil.principalAxis(xs, ys, zs, xs.length, 0, 0, 0);
        assertTrue(Math.abs(axis.z) > 0.99f, "axis " + axis);
    }

    @Test
    public void testNoPreferredDirection() {
        float[] coordinates = { 1, 1, 1 };
        Vector3f axis = StatisticsUtil.principalAxis(coordinates, coordinates, coordinates, 3, 1, 1, 1);
        assertEquals(new Vector3f(1, 0, 0), axis);
    }
}
