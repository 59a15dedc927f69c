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
 * Exact intersection points between segments and bounding shapes. A segment crosses a closed surface at most twice;
 * the points are answered in order along the segment.
 *
 * @author hal.hildebrand
 */
public final class ShapeIntersection {

    private static final Point3f[] NONE = new Point3f[0];

    private ShapeIntersection() {
    }

    /**
     * Points where the segment crosses the surface of the box
     */
    public static Point3f[] segmentBoxIntersections(LineSegment3D segment, Box box) {
        if (box.isEmpty()) {
            return NONE;
        }
        var a = segment.a();
        var b = segment.b();
        float dx = b.x - a.x, dy = b.y - a.y, dz = b.z - a.z;
        if (dx == 0f && dy == 0f && dz == 0f) {
            return NONE;
        }
        float[] t = slab(a.x, a.y, a.z, dx, dy, dz, box);
        if (t == null) {
            return NONE;
        }
        boolean entry = t[0] >= 0f && t[0] <= 1f;
        boolean exit = t[1] >= 0f && t[1] <= 1f && t[1] > t[0];
        if (entry && exit) {
            return new Point3f[] { segment.pointAt(t[0]), segment.pointAt(t[1]) };
        } else if (entry) {
            return new Point3f[] { segment.pointAt(t[0]) };
        } else if (exit) {
            return new Point3f[] { segment.pointAt(t[1]) };
        }
        return NONE;
    }

    /**
     * Points where the segment crosses the surface of the sphere
     */
    public static Point3f[] segmentSphereIntersections(LineSegment3D segment, Sphere sphere) {
        if (sphere.isEmpty()) {
            return NONE;
        }
        var a = segment.a();
        var b = segment.b();
        float dx = b.x - a.x, dy = b.y - a.y, dz = b.z - a.z;
        float fx = a.x - sphere.x(), fy = a.y - sphere.y(), fz = a.z - sphere.z();

        float qa = dx * dx + dy * dy + dz * dz;
        if (qa == 0f) {
            return NONE;
        }
        float qb = 2f * (fx * dx + fy * dy + fz * dz);
        float qc = fx * fx + fy * fy + fz * fz - sphere.radiusSquared();
        float discriminant = qb * qb - 4f * qa * qc;
        if (discriminant < 0f) {
            return NONE;
        }
        float root = (float) Math.sqrt(discriminant);
        float t0 = (-qb - root) / (2f * qa);
        float t1 = (-qb + root) / (2f * qa);
        boolean first = t0 >= 0f && t0 <= 1f;
        boolean second = t1 >= 0f && t1 <= 1f && t1 > t0;
        if (first && second) {
            return new Point3f[] { segment.pointAt(t0), segment.pointAt(t1) };
        } else if (first) {
            return new Point3f[] { segment.pointAt(t0) };
        } else if (second) {
            return new Point3f[] { segment.pointAt(t1) };
        }
        return NONE;
    }

    /**
     * Compute ray-box slab intersection parameters for the parametric line origin + t * direction.
     *
     * @return Array of [tNear, tFar] or null if the line misses the box
     */
    public static float[] slab(float ox, float oy, float oz, float dx, float dy, float dz, Box box) {
        float tMin = Float.NEGATIVE_INFINITY;
        float tMax = Float.POSITIVE_INFINITY;

        // X axis
        if (dx != 0f) {
            float t1 = (box.minX() - ox) / dx;
            float t2 = (box.maxX() - ox) / dx;
            tMin = Math.max(tMin, Math.min(t1, t2));
            tMax = Math.min(tMax, Math.max(t1, t2));
        } else if (ox < box.minX() || ox > box.maxX()) {
            return null; // Parallel to X axis and outside bounds
        }

        // Y axis
        if (dy != 0f) {
            float t1 = (box.minY() - oy) / dy;
            float t2 = (box.maxY() - oy) / dy;
            tMin = Math.max(tMin, Math.min(t1, t2));
            tMax = Math.min(tMax, Math.max(t1, t2));
        } else if (oy < box.minY() || oy > box.maxY()) {
            return null;
        }

        // Z axis
        if (dz != 0f) {
            float t1 = (box.minZ() - oz) / dz;
            float t2 = (box.maxZ() - oz) / dz;
            tMin = Math.max(tMin, Math.min(t1, t2));
            tMax = Math.min(tMax, Math.max(t1, t2));
        } else if (oz < box.minZ() || oz > box.maxZ()) {
            return null;
        }

        if (tMin > tMax) {
            return null;
        }
        return new float[] { tMin, tMax };
    }
}
