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
 * Represents a 3D plane using the equation ax + by + cz + d = 0 with a unit normal (a, b, c). Points with a
 * non-negative signed distance lie on the inside, the side the normal points to.
 *
 * @author hal.hildebrand
 */
public record Plane3D(float a, float b, float c, float d) {

    /**
     * Create a plane from three points, with the normal given by the right hand rule (p2 - p1) x (p3 - p1)
     *
     * @throws IllegalArgumentException if the points are collinear
     */
    public static Plane3D fromThreePoints(Point3f p1, Point3f p2, Point3f p3) {
        Vector3f v1 = new Vector3f(p2.x - p1.x, p2.y - p1.y, p2.z - p1.z);
        Vector3f v2 = new Vector3f(p3.x - p1.x, p3.y - p1.y, p3.z - p1.z);

        Vector3f normal = new Vector3f();
        normal.cross(v1, v2);

        if (normal.length() < 1e-6f) {
            throw new IllegalArgumentException("Points are collinear, cannot define a unique plane");
        }
        return fromPointAndNormal(p1, normal);
    }

    /**
     * Create a plane from a point and a normal vector (will be normalized)
     *
     * @throws IllegalArgumentException if the normal is zero
     */
    public static Plane3D fromPointAndNormal(Point3f point, Vector3f normal) {
        if (normal.length() < 1e-6f) {
            throw new IllegalArgumentException("Normal vector cannot be zero");
        }

        Vector3f n = new Vector3f(normal);
        n.normalize();

        // d = -(ax + by + cz)
        float d = -(n.x * point.x + n.y * point.y + n.z * point.z);
        return new Plane3D(n.x, n.y, n.z, d);
    }

    public float signedDistance(float x, float y, float z) {
        return a * x + b * y + c * z + d;
    }

    /**
     * Signed distance from the point, positive on the side the normal points to
     */
    public float distanceToPoint(Point3f point) {
        return signedDistance(point.x, point.y, point.z);
    }

    public Vector3f getNormal() {
        return new Vector3f(a, b, c);
    }

    /**
     * Signed distance of the box corner farthest along the normal
     */
    public float maxSignedDistance(Box box) {
        float x = (a >= 0) ? box.maxX() : box.minX();
        float y = (b >= 0) ? box.maxY() : box.minY();
        float z = (c >= 0) ? box.maxZ() : box.minZ();
        return signedDistance(x, y, z);
    }

    /**
     * Signed distance of the box corner farthest against the normal
     */
    public float minSignedDistance(Box box) {
        float x = (a >= 0) ? box.minX() : box.maxX();
        float y = (b >= 0) ? box.minY() : box.maxY();
        float z = (c >= 0) ? box.minZ() : box.maxZ();
        return signedDistance(x, y, z);
    }

    /**
     * The same plane facing the other way
     */
    public Plane3D flip() {
        return new Plane3D(-a, -b, -c, -d);
    }
}
