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

import javax.vecmath.Point3f;

/**
 * A capsule: every point within the radius of the segment between the two endpoints. Used as the swept volume of a
 * sphere cast.
 *
 * @author hal.hildebrand
 */
public record Capsule(Point3f a, Point3f b, float radius) {

    public Capsule {
        a = new Point3f(a);
        b = new Point3f(b);
    }

    @Override
    public Point3f a() {
        return new Point3f(a);
    }

    @Override
    public Point3f b() {
        return new Point3f(b);
    }

    /**
     * The capsule swept by a sphere of the radius moving along the ray for the distance
     */
    public static Capsule sweep(Ray3D ray, float radius, float distance) {
        return new Capsule(ray.origin(), ray.getPointAt(Math.min(distance, ray.maxDistance())), radius);
    }

    public Box bounds() {
        return new Box(Math.min(a.x, b.x) - radius, Math.min(a.y, b.y) - radius, Math.min(a.z, b.z) - radius,
                       Math.max(a.x, b.x) + radius, Math.max(a.y, b.y) + radius, Math.max(a.z, b.z) + radius);
    }

    public boolean containsPoint(float x, float y, float z) {
        return radius >= 0f && segment().distanceSquaredTo(x, y, z) <= radius * radius;
    }

    public boolean isEmpty() {
        return radius < 0f;
    }

    public LineSegment3D segment() {
        return new LineSegment3D(a, b);
    }
}
