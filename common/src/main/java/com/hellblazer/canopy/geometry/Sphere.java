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
import javax.vecmath.Tuple3f;

/**
 * A bounding sphere. A negative radius denotes the empty sphere.
 *
 * @author hal.hildebrand
 */
public record Sphere(float x, float y, float z, float radius) {

    public static Sphere of(Tuple3f center, float radius) {
        return new Sphere(center.x, center.y, center.z, radius);
    }

    /**
     * The sphere circumscribing the box
     */
    public static Sphere enclosing(Box box) {
        float hx = box.extentX() * 0.5f;
        float hy = box.extentY() * 0.5f;
        float hz = box.extentZ() * 0.5f;
        return new Sphere(box.centerX(), box.centerY(), box.centerZ(), (float) Math.sqrt(hx * hx + hy * hy + hz * hz));
    }

    public Point3f center() {
        return new Point3f(x, y, z);
    }

    public float centerDistanceSquared(Sphere other) {
        return distanceSquared(other.x, other.y, other.z);
    }

    public boolean contains(Sphere other) {
        if (radius < 0f || other.radius < 0f) {
            return false;
        }
        float d = (float) Math.sqrt(distanceSquared(other.x, other.y, other.z));
        return d + other.radius <= radius;
    }

    public boolean containsPoint(float px, float py, float pz) {
        return radius >= 0f && distanceSquared(px, py, pz) <= radius * radius;
    }

    public boolean containsPoint(Tuple3f p) {
        return containsPoint(p.x, p.y, p.z);
    }

    public float distanceSquared(float px, float py, float pz) {
        float dx = x - px;
        float dy = y - py;
        float dz = z - pz;
        return dx * dx + dy * dy + dz * dz;
    }

    /**
     * The smallest sphere enclosing both this sphere and the other
     */
    public Sphere enclose(Sphere other) {
        if (other.radius < 0f) {
            return this;
        }
        if (radius < 0f) {
            return other;
        }
        float d = (float) Math.sqrt(distanceSquared(other.x, other.y, other.z));
        if (d + other.radius <= radius) {
            return this;
        }
        if (d + radius <= other.radius) {
            return other;
        }
        float r = (radius + other.radius + d) * 0.5f;
        // d > 0 here, otherwise one sphere would contain the other
        float t = (r - radius) / d;
        return new Sphere(x + (other.x - x) * t, y + (other.y - y) * t, z + (other.z - z) * t, r);
    }

    /**
     * Same center, radius grown by the amount
     */
    public Sphere inflate(float amount) {
        return new Sphere(x, y, z, radius + amount);
    }

    public boolean isEmpty() {
        return radius < 0f;
    }

    /**
     * Distance from the point to the farthest point of this sphere
     */
    public float maxDistance(float px, float py, float pz) {
        return (float) Math.sqrt(distanceSquared(px, py, pz)) + radius;
    }

    /**
     * Squared distance from the point to the closest point of this sphere; zero when the point is inside
     */
    public float minDistanceSquared(float px, float py, float pz) {
        float d = (float) Math.sqrt(distanceSquared(px, py, pz)) - radius;
        return d <= 0f ? 0f : d * d;
    }

    public boolean overlaps(Sphere other) {
        if (radius < 0f || other.radius < 0f) {
            return false;
        }
        float r = radius + other.radius;
        return distanceSquared(other.x, other.y, other.z) <= r * r;
    }

    public float radiusSquared() {
        return radius * radius;
    }

    /**
     * The axis-aligned box circumscribing this sphere
     */
    public Box toBox() {
        return new Box(x - radius, y - radius, z - radius, x + radius, y + radius, z + radius);
    }
}
