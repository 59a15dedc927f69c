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
 * An axis-aligned bounding box. A box whose min exceeds its max on any axis is empty: it contains nothing and overlaps
 * nothing.
 *
 * @author hal.hildebrand
 */
public record Box(float minX, float minY, float minZ, float maxX, float maxY, float maxZ) {

    public static Box of(Tuple3f min, Tuple3f max) {
        return new Box(min.x, min.y, min.z, max.x, max.y, max.z);
    }

    /**
     * Box centered on the point with the given half extent on every axis
     */
    public static Box centeredAt(Tuple3f center, float halfExtent) {
        return new Box(center.x - halfExtent, center.y - halfExtent, center.z - halfExtent, center.x + halfExtent,
                       center.y + halfExtent, center.z + halfExtent);
    }

    /**
     * Box centered on the point with the given per axis half extents
     */
    public static Box centeredAt(Tuple3f center, float hx, float hy, float hz) {
        return new Box(center.x - hx, center.y - hy, center.z - hz, center.x + hx, center.y + hy, center.z + hz);
    }

    public Point3f center() {
        return new Point3f(centerX(), centerY(), centerZ());
    }

    public float centerX() {
        return (minX + maxX) * 0.5f;
    }

    public float centerY() {
        return (minY + maxY) * 0.5f;
    }

    public float centerZ() {
        return (minZ + maxZ) * 0.5f;
    }

    /**
     * Squared distance between the centers of this box and another
     */
    public float centerDistanceSquared(Box other) {
        float dx = centerX() - other.centerX();
        float dy = centerY() - other.centerY();
        float dz = centerZ() - other.centerZ();
        return dx * dx + dy * dy + dz * dz;
    }

    public float centerDistanceSquared(float x, float y, float z) {
        float dx = centerX() - x;
        float dy = centerY() - y;
        float dz = centerZ() - z;
        return dx * dx + dy * dy + dz * dz;
    }

    public boolean contains(Box other) {
        return !other.isEmpty() && other.minX >= minX && other.maxX <= maxX && other.minY >= minY && other.maxY <= maxY
        && other.minZ >= minZ && other.maxZ <= maxZ;
    }

    public boolean containsPoint(float x, float y, float z) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY && z >= minZ && z <= maxZ;
    }

    public boolean containsPoint(Tuple3f p) {
        return containsPoint(p.x, p.y, p.z);
    }

    public float extentX() {
        return maxX - minX;
    }

    public float extentY() {
        return maxY - minY;
    }

    public float extentZ() {
        return maxZ - minZ;
    }

    public boolean isEmpty() {
        return minX > maxX || minY > maxY || minZ > maxZ;
    }

    /**
     * Length of the vector holding, per axis, the largest distance from the point to either face of this box. This is
     * the distance from the point to the farthest corner.
     */
    public float maxDistance(float x, float y, float z) {
        float dx = Math.max(Math.abs(x - minX), Math.abs(x - maxX));
        float dy = Math.max(Math.abs(y - minY), Math.abs(y - maxY));
        float dz = Math.max(Math.abs(z - minZ), Math.abs(z - maxZ));
        return (float) Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Squared distance from the point to the closest point of this box; zero when the point is inside
     */
    public float minDistanceSquared(float x, float y, float z) {
        float dx = Math.max(0f, Math.max(minX - x, x - maxX));
        float dy = Math.max(0f, Math.max(minY - y, y - maxY));
        float dz = Math.max(0f, Math.max(minZ - z, z - maxZ));
        return dx * dx + dy * dy + dz * dz;
    }

    public boolean overlaps(Box other) {
        return !isEmpty() && !other.isEmpty() && minX <= other.maxX && maxX >= other.minX && minY <= other.maxY
        && maxY >= other.minY && minZ <= other.maxZ && maxZ >= other.minZ;
    }

    /**
     * Volume of the intersection of this box and another, zero when disjoint
     */
    public float overlapVolume(Box other) {
        float ox = Math.min(maxX, other.maxX) - Math.max(minX, other.minX);
        float oy = Math.min(maxY, other.maxY) - Math.max(minY, other.minY);
        float oz = Math.min(maxZ, other.maxZ) - Math.max(minZ, other.minZ);
        if (ox <= 0f || oy <= 0f || oz <= 0f) {
            return 0f;
        }
        return ox * oy * oz;
    }

    public Box union(Box other) {
        return new Box(Math.min(minX, other.minX), Math.min(minY, other.minY), Math.min(minZ, other.minZ),
                       Math.max(maxX, other.maxX), Math.max(maxY, other.maxY), Math.max(maxZ, other.maxZ));
    }

    public float volume() {
        if (isEmpty()) {
            return 0f;
        }
        return extentX() * extentY() * extentZ();
    }
}
