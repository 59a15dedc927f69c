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
import javax.vecmath.Vector3f;

/**
 * A ray with a normalized direction and a maximum distance. A zero direction yields a degenerate ray that hits
 * nothing.
 *
 * @author hal.hildebrand
 */
public record Ray3D(Point3f origin, Vector3f direction, float maxDistance) {

    public static final float UNBOUNDED = Float.POSITIVE_INFINITY;

    public Ray3D {
        if (Float.isNaN(maxDistance)) {
            throw new IllegalArgumentException("Ray max distance is NaN");
        }
        origin = new Point3f(origin);
        direction = new Vector3f(direction);
        if (direction.lengthSquared() > 0f) {
            direction.normalize();
        }
    }

    @Override
    public Point3f origin() {
        return new Point3f(origin);
    }

    @Override
    public Vector3f direction() {
        return new Vector3f(direction);
    }

    /**
     * Create an unbounded ray
     */
    public Ray3D(Point3f origin, Vector3f direction) {
        this(origin, direction, UNBOUNDED);
    }

    /**
     * Create a ray from origin to target point, limited to the target
     */
    public static Ray3D fromPoints(Point3f origin, Point3f target) {
        Vector3f direction = new Vector3f(target.x - origin.x, target.y - origin.y, target.z - origin.z);
        return new Ray3D(origin, direction, direction.length());
    }

    /**
     * Get a point along the ray at parameter t
     *
     * @param t the parameter (t >= 0 for points along the ray from origin)
     * @return the point at origin + t * direction
     */
    public Point3f getPointAt(float t) {
        return new Point3f(origin.x + t * direction.x, origin.y + t * direction.y, origin.z + t * direction.z);
    }

    public boolean isDegenerate() {
        return direction.lengthSquared() == 0f || maxDistance <= 0f;
    }

    public boolean isUnbounded() {
        return maxDistance == UNBOUNDED;
    }

    /**
     * The segment from the origin to the point at the given distance, clamped to this ray's max distance
     */
    public LineSegment3D toSegment(float distance) {
        return new LineSegment3D(origin, getPointAt(Math.min(distance, maxDistance)));
    }
}
