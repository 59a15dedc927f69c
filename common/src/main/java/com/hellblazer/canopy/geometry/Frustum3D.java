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
import java.util.Arrays;

/**
 * A convex volume bounded by a set of planes whose normals point inward, typically the six planes of a camera
 * frustum. Any number of planes is allowed; with none the frustum is all of space.
 *
 * @author hal.hildebrand
 */
public class Frustum3D {

    private final Plane3D[] planes;

    public Frustum3D(Plane3D... planes) {
        this.planes = planes.clone();
    }

    /**
     * Create an orthographic frustum. The left, right, bottom and top offsets are measured from the camera position
     * along the camera's right and up axes.
     *
     * @throws IllegalArgumentException if the boundaries are inverted or the distances invalid
     */
    public static Frustum3D createOrthographic(Point3f cameraPosition, Point3f lookAt, Vector3f up, float left,
                                               float right, float bottom, float top, float nearDistance,
                                               float farDistance) {
        if (right <= left || top <= bottom) {
            throw new IllegalArgumentException("Frustum boundaries are inverted");
        }
        validateDistances(nearDistance, farDistance);
        var basis = cameraBasis(cameraPosition, lookAt, up);
        Vector3f forward = basis[0], rightAxis = basis[1], upAxis = basis[2];

        return new Frustum3D(Plane3D.fromPointAndNormal(offset(cameraPosition, forward, nearDistance), forward),
                             Plane3D.fromPointAndNormal(offset(cameraPosition, forward, farDistance), negate(forward)),
                             Plane3D.fromPointAndNormal(offset(cameraPosition, rightAxis, left), rightAxis),
                             Plane3D.fromPointAndNormal(offset(cameraPosition, rightAxis, right), negate(rightAxis)),
                             Plane3D.fromPointAndNormal(offset(cameraPosition, upAxis, top), negate(upAxis)),
                             Plane3D.fromPointAndNormal(offset(cameraPosition, upAxis, bottom), upAxis));
    }

    /**
     * Create a perspective frustum
     *
     * @param fovy vertical field of view in radians
     * @throws IllegalArgumentException if the distances, field of view or aspect ratio are invalid
     */
    public static Frustum3D createPerspective(Point3f cameraPosition, Point3f lookAt, Vector3f up, float fovy,
                                              float aspectRatio, float nearDistance, float farDistance) {
        validateDistances(nearDistance, farDistance);
        if (fovy <= 0 || fovy >= Math.PI) {
            throw new IllegalArgumentException("Field of view must be between 0 and PI radians");
        }
        if (aspectRatio <= 0) {
            throw new IllegalArgumentException("Aspect ratio must be positive");
        }
        var basis = cameraBasis(cameraPosition, lookAt, up);
        Vector3f forward = basis[0], rightAxis = basis[1], upAxis = basis[2];

        float halfHeight = nearDistance * (float) Math.tan(fovy / 2.0f);
        float halfWidth = halfHeight * aspectRatio;

        // Edge directions from the camera through the near rectangle's sides
        Vector3f toLeft = combine(forward, nearDistance, rightAxis, -halfWidth);
        Vector3f toRight = combine(forward, nearDistance, rightAxis, halfWidth);
        Vector3f toTop = combine(forward, nearDistance, upAxis, halfHeight);
        Vector3f toBottom = combine(forward, nearDistance, upAxis, -halfHeight);

        return new Frustum3D(Plane3D.fromPointAndNormal(offset(cameraPosition, forward, nearDistance), forward),
                             Plane3D.fromPointAndNormal(offset(cameraPosition, forward, farDistance), negate(forward)),
                             Plane3D.fromPointAndNormal(cameraPosition, cross(toLeft, upAxis)),
                             Plane3D.fromPointAndNormal(cameraPosition, cross(upAxis, toRight)),
                             Plane3D.fromPointAndNormal(cameraPosition, cross(toTop, rightAxis)),
                             Plane3D.fromPointAndNormal(cameraPosition, cross(rightAxis, toBottom)));
    }

    private static Vector3f[] cameraBasis(Point3f cameraPosition, Point3f lookAt, Vector3f up) {
        Vector3f forward = new Vector3f(lookAt.x - cameraPosition.x, lookAt.y - cameraPosition.y,
                                        lookAt.z - cameraPosition.z);
        if (forward.lengthSquared() == 0f) {
            throw new IllegalArgumentException("Camera position and look at point coincide");
        }
        forward.normalize();

        Vector3f upNorm = new Vector3f(up);
        upNorm.normalize();

        Vector3f right = new Vector3f();
        right.cross(forward, upNorm);
        if (right.lengthSquared() < 1e-12f) {
            throw new IllegalArgumentException("Up vector is parallel to the view direction");
        }
        right.normalize();

        // Recalculate up to ensure orthogonality
        Vector3f actualUp = new Vector3f();
        actualUp.cross(right, forward);
        actualUp.normalize();
        return new Vector3f[] { forward, right, actualUp };
    }

    private static Vector3f combine(Vector3f u, float s, Vector3f v, float t) {
        return new Vector3f(u.x * s + v.x * t, u.y * s + v.y * t, u.z * s + v.z * t);
    }

    private static Vector3f cross(Vector3f u, Vector3f v) {
        Vector3f result = new Vector3f();
        result.cross(u, v);
        return result;
    }

    private static Vector3f negate(Vector3f v) {
        return new Vector3f(-v.x, -v.y, -v.z);
    }

    private static Point3f offset(Point3f p, Vector3f axis, float distance) {
        return new Point3f(p.x + axis.x * distance, p.y + axis.y * distance, p.z + axis.z * distance);
    }

    private static void validateDistances(float nearDistance, float farDistance) {
        if (nearDistance <= 0 || farDistance <= 0) {
            throw new IllegalArgumentException("Near and far distances must be positive");
        }
        if (farDistance <= nearDistance) {
            throw new IllegalArgumentException("Far distance must be greater than near distance");
        }
    }

    /**
     * Test if a box is completely inside the frustum
     */
    public boolean containsBox(Box box) {
        if (box.isEmpty()) {
            return false;
        }
        for (Plane3D plane : planes) {
            if (plane.minSignedDistance(box) < 0f) {
                return false;
            }
        }
        return true;
    }

    public boolean containsPoint(float x, float y, float z) {
        for (Plane3D plane : planes) {
            if (plane.signedDistance(x, y, z) < 0f) {
                return false;
            }
        }
        return true;
    }

    public boolean containsPoint(Point3f point) {
        return containsPoint(point.x, point.y, point.z);
    }

    public boolean containsSphere(Sphere sphere) {
        if (sphere.isEmpty()) {
            return false;
        }
        for (Plane3D plane : planes) {
            if (plane.signedDistance(sphere.x(), sphere.y(), sphere.z()) < sphere.radius()) {
                return false;
            }
        }
        return true;
    }

    public Plane3D[] getPlanes() {
        return planes.clone();
    }

    /**
     * Conservative overlap test: false only when the box lies wholly outside some plane
     */
    public boolean intersectsBox(Box box) {
        if (box.isEmpty()) {
            return false;
        }
        for (Plane3D plane : planes) {
            if (plane.maxSignedDistance(box) < 0f) {
                return false;
            }
        }
        return true;
    }

    /**
     * Conservative overlap test: false only when the sphere lies wholly outside some plane
     */
    public boolean intersectsSphere(Sphere sphere) {
        if (sphere.isEmpty()) {
            return false;
        }
        for (Plane3D plane : planes) {
            if (plane.signedDistance(sphere.x(), sphere.y(), sphere.z()) < -sphere.radius()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Frustum3D" + Arrays.toString(planes);
    }
}
