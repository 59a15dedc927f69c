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
public class ShapeIntersectionTest {

    private static final float EPSILON = 1e-4f;

    @Test
    public void testSegmentThroughBox() {
        var box = new Box(0, 0, 0, 1, 1, 1);
        var points = ShapeIntersection.segmentBoxIntersections(
        new LineSegment3D(new Point3f(-5, 0.5f, 0.5f), new Point3f(5, 0.5f, 0.5f)), box);
        assertEquals(2, points.length);
        assertEquals(0f, points[0].x, EPSILON);
        assertEquals(1f, points[1].x, EPSILON);
    }

    @Test
    public void testSegmentLeavingBox() {
        var box = new Box(0, 0, 0, 1, 1, 1);
        var points = ShapeIntersection.segmentBoxIntersections(
        new LineSegment3D(new Point3f(0.5f, 0.5f, 0.5f), new Point3f(5, 0.5f, 0.5f)), box);
        assertEquals(1, points.length);
        assertEquals(1f, points[0].x, EPSILON);
    }

    @Test
    public void testSegmentInsideBoxCrossesNothing() {
        var box = new Box(0, 0, 0, 1, 1, 1);
        assertEquals(0, ShapeIntersection.segmentBoxIntersections(
        new LineSegment3D(new Point3f(0.2f, 0.5f, 0.5f), new Point3f(0.8f, 0.5f, 0.5f)), box).length);
        assertEquals(0, ShapeIntersection.segmentBoxIntersections(
        new LineSegment3D(new Point3f(-5, 3, 0.5f), new Point3f(5, 3, 0.5f)), box).length);
    }

    @Test
    public void testSegmentThroughSphere() {
        var sphere = new Sphere(0, 0, 0, 1);
        var points = ShapeIntersection.segmentSphereIntersections(
        new LineSegment3D(new Point3f(-5, 0, 0), new Point3f(5, 0, 0)), sphere);
        assertEquals(2, points.length);
        assertEquals(-1f, points[0].x, EPSILON);
        assertEquals(1f, points[1].x, EPSILON);
    }

    @Test
    public void testSegmentTangentToSphere() {
        var sphere = new Sphere(0, 0, 0, 1);
        var points = ShapeIntersection.segmentSphereIntersections(
        new LineSegment3D(new Point3f(-5, 1, 0), new Point3f(5, 1, 0)), sphere);
        assertEquals(1, points.length);
        assertEquals(0f, points[0].x, EPSILON);
    }

    @Test
    public void testSegmentShortOfSphere() {
        var sphere = new Sphere(0, 0, 0, 1);
        assertEquals(0, ShapeIntersection.segmentSphereIntersections(
        new LineSegment3D(new Point3f(-5, 0, 0), new Point3f(-2, 0, 0)), sphere).length);
    }

    @Test
    public void testSlab() {
        var box = new Box(0, 0, 0, 1, 1, 1);
        float[] t = ShapeIntersection.slab(-1, 0.5f, 0.5f, 1, 0, 0, box);
        assertNotNull(t);
        assertEquals(1f, t[0], EPSILON);
        assertEquals(2f, t[1], EPSILON);
        assertNull(ShapeIntersection.slab(-1, 2, 0.5f, 1, 0, 0, box));
    }
}
