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

/**
 * Containment and overlap predicates between the bounding and query shapes. Containment is closed: touching
 * boundaries count as contained and as overlapping. Empty shapes contain and overlap nothing.
 *
 * @author hal.hildebrand
 */
public final class ShapeOverlap {

    private static final int SEGMENT_SEARCH_ITERATIONS = 48;
    private static final float GOLDEN = 0.618034f;

    private ShapeOverlap() {
    }

    public static boolean boxContainsSphere(Box box, Sphere sphere) {
        if (box.isEmpty() || sphere.isEmpty()) {
            return false;
        }
        float r = sphere.radius();
        return sphere.x() - r >= box.minX() && sphere.x() + r <= box.maxX() && sphere.y() - r >= box.minY()
        && sphere.y() + r <= box.maxY() && sphere.z() - r >= box.minZ() && sphere.z() + r <= box.maxZ();
    }

    public static boolean boxOverlapsSphere(Box box, Sphere sphere) {
        if (box.isEmpty() || sphere.isEmpty()) {
            return false;
        }
        return box.minDistanceSquared(sphere.x(), sphere.y(), sphere.z()) <= sphere.radiusSquared();
    }

    public static boolean capsuleContainsBox(Capsule capsule, Box box) {
        if (capsule.isEmpty() || box.isEmpty()) {
            return false;
        }
        for (int i = 0; i < 8; i++) {
            float x = (i & 1) == 0 ? box.minX() : box.maxX();
            float y = (i & 2) == 0 ? box.minY() : box.maxY();
            float z = (i & 4) == 0 ? box.minZ() : box.maxZ();
            if (!capsule.containsPoint(x, y, z)) {
                return false;
            }
        }
        return true;
    }

    public static boolean capsuleContainsSphere(Capsule capsule, Sphere sphere) {
        if (capsule.isEmpty() || sphere.isEmpty()) {
            return false;
        }
        float d = (float) Math.sqrt(capsule.segment().distanceSquaredTo(sphere.x(), sphere.y(), sphere.z()));
        return d + sphere.radius() <= capsule.radius();
    }

    public static boolean capsuleOverlapsBox(Capsule capsule, Box box) {
        if (capsule.isEmpty() || box.isEmpty()) {
            return false;
        }
        return segmentBoxDistanceSquared(capsule.segment(), box) <= capsule.radius() * capsule.radius();
    }

    public static boolean capsuleOverlapsSphere(Capsule capsule, Sphere sphere) {
        if (capsule.isEmpty() || sphere.isEmpty()) {
            return false;
        }
        float r = capsule.radius() + sphere.radius();
        return capsule.segment().distanceSquaredTo(sphere.x(), sphere.y(), sphere.z()) <= r * r;
    }

    /**
     * Squared distance between the closest points of the segment and the box
     */
    public static float segmentBoxDistanceSquared(LineSegment3D segment, Box box) {
        if (segmentOverlapsBox(segment, box)) {
            return 0f;
        }
        // The distance to a convex set along a line is convex, so a golden section search converges on the minimum
        float lo = 0f, hi = 1f;
        float t1 = hi - GOLDEN * (hi - lo);
        float t2 = lo + GOLDEN * (hi - lo);
        float f1 = distanceSquaredAt(segment, box, t1);
        float f2 = distanceSquaredAt(segment, box, t2);
        for (int i = 0; i < SEGMENT_SEARCH_ITERATIONS; i++) {
            if (f1 <= f2) {
                hi = t2;
                t2 = t1;
                f2 = f1;
                t1 = hi - GOLDEN * (hi - lo);
                f1 = distanceSquaredAt(segment, box, t1);
            } else {
                lo = t1;
                t1 = t2;
                f1 = f2;
                t2 = lo + GOLDEN * (hi - lo);
                f2 = distanceSquaredAt(segment, box, t2);
            }
        }
        return Math.min(Math.min(f1, f2),
                        Math.min(distanceSquaredAt(segment, box, 0f), distanceSquaredAt(segment, box, 1f)));
    }

    public static boolean segmentOverlapsBox(LineSegment3D segment, Box box) {
        if (box.isEmpty()) {
            return false;
        }
        var a = segment.a();
        var b = segment.b();
        float[] t = ShapeIntersection.slab(a.x, a.y, a.z, b.x - a.x, b.y - a.y, b.z - a.z, box);
        return t != null && t[1] >= 0f && t[0] <= 1f;
    }

    public static boolean segmentOverlapsSphere(LineSegment3D segment, Sphere sphere) {
        if (sphere.isEmpty()) {
            return false;
        }
        return segment.distanceSquaredTo(sphere.x(), sphere.y(), sphere.z()) <= sphere.radiusSquared();
    }

    public static boolean sphereContainsBox(Sphere sphere, Box box) {
        if (sphere.isEmpty() || box.isEmpty()) {
            return false;
        }
        float dx = Math.max(Math.abs(sphere.x() - box.minX()), Math.abs(sphere.x() - box.maxX()));
        float dy = Math.max(Math.abs(sphere.y() - box.minY()), Math.abs(sphere.y() - box.maxY()));
        float dz = Math.max(Math.abs(sphere.z() - box.minZ()), Math.abs(sphere.z() - box.maxZ()));
        return dx * dx + dy * dy + dz * dz <= sphere.radiusSquared();
    }

    private static float distanceSquaredAt(LineSegment3D segment, Box box, float t) {
        var a = segment.a();
        var b = segment.b();
        return box.minDistanceSquared(a.x + (b.x - a.x) * t, a.y + (b.y - a.y) * t, a.z + (b.z - a.z) * t);
    }
}
