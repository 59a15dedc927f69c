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
 * A closed line segment between two points
 *
 * @author hal.hildebrand
 */
public record LineSegment3D(Point3f a, Point3f b) {

    public LineSegment3D {
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

    public Point3f closestPointTo(float px, float py, float pz) {
        return pointAt(closestParameter(px, py, pz));
    }

    public Point3f closestPointTo(Point3f point) {
        return closestPointTo(point.x, point.y, point.z);
    }

    /**
     * Parameter in [0, 1] of the point on this segment closest to the given point
     */
    public float closestParameter(float px, float py, float pz) {
        float vx = b.x - a.x, vy = b.y - a.y, vz = b.z - a.z;
        float lengthSq = vx * vx + vy * vy + vz * vz;
        if (lengthSq < 1e-12f) {
            return 0f;
        }
        float t = ((px - a.x) * vx + (py - a.y) * vy + (pz - a.z) * vz) / lengthSq;
        return Math.max(0f, Math.min(1f, t));
    }

    public Vector3f delta() {
        return new Vector3f(b.x - a.x, b.y - a.y, b.z - a.z);
    }

    public float distanceSquaredTo(float px, float py, float pz) {
        float t = closestParameter(px, py, pz);
        float dx = a.x + (b.x - a.x) * t - px;
        float dy = a.y + (b.y - a.y) * t - py;
        float dz = a.z + (b.z - a.z) * t - pz;
        return dx * dx + dy * dy + dz * dz;
    }

    public float length() {
        return a.distance(b);
    }

    public Point3f pointAt(float t) {
        Point3f result = new Point3f();
        result.interpolate(a, b, t);
        return result;
    }
}
