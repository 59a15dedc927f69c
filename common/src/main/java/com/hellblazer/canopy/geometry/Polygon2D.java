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

import java.util.Arrays;

/**
 * A simple polygon in the plane, given by its vertices in order. Polygons with fewer than three vertices enclose
 * nothing.
 *
 * @author hal.hildebrand
 */
public final class Polygon2D {

    private final float[] us;
    private final float[] vs;
    private final float   minU, minV, maxU, maxV;

    /**
     * @param coordinates interleaved vertex coordinates u0, v0, u1, v1, ...
     */
    public Polygon2D(float... coordinates) {
        if (coordinates.length % 2 != 0) {
            throw new IllegalArgumentException("Odd number of polygon coordinates: " + coordinates.length);
        }
        int n = coordinates.length / 2;
        us = new float[n];
        vs = new float[n];
        float lu = Float.POSITIVE_INFINITY, lv = Float.POSITIVE_INFINITY;
        float hu = Float.NEGATIVE_INFINITY, hv = Float.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            us[i] = coordinates[2 * i];
            vs[i] = coordinates[2 * i + 1];
            lu = Math.min(lu, us[i]);
            lv = Math.min(lv, vs[i]);
            hu = Math.max(hu, us[i]);
            hv = Math.max(hv, vs[i]);
        }
        minU = lu;
        minV = lv;
        maxU = hu;
        maxV = hv;
    }

    /**
     * Crossing number test. Points on the boundary may fall either way.
     */
    public boolean containsPoint(float u, float v) {
        int n = us.length;
        if (n < 3 || u < minU || u > maxU || v < minV || v > maxV) {
            return false;
        }
        boolean inside = false;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            if ((vs[i] > v) != (vs[j] > v)) {
                float crossing = us[j] + (v - vs[j]) * (us[i] - us[j]) / (vs[i] - vs[j]);
                if (u < crossing) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }

    public float getMaxU() {
        return maxU;
    }

    public float getMaxV() {
        return maxV;
    }

    public float getMinU() {
        return minU;
    }

    public float getMinV() {
        return minV;
    }

    /**
     * True when the rectangle overlaps this polygon's bounding rectangle
     */
    public boolean boundsOverlap(float lowU, float lowV, float highU, float highV) {
        return us.length >= 3 && lowU <= maxU && highU >= minU && lowV <= maxV && highV >= minV;
    }

    /**
     * The polygon mapped through the affine transform (u, v) -> (m00 u + m01 v + m02, m10 u + m11 v + m12)
     */
    public Polygon2D transform(float m00, float m01, float m02, float m10, float m11, float m12) {
        float[] coordinates = new float[us.length * 2];
        for (int i = 0; i < us.length; i++) {
            coordinates[2 * i] = m00 * us[i] + m01 * vs[i] + m02;
            coordinates[2 * i + 1] = m10 * us[i] + m11 * vs[i] + m12;
        }
        return new Polygon2D(coordinates);
    }

    /**
     * Rotate by the angle about the origin, then translate
     */
    public Polygon2D rotateTranslate(float radians, float du, float dv) {
        float cos = (float) Math.cos(radians);
        float sin = (float) Math.sin(radians);
        return transform(cos, -sin, du, sin, cos, dv);
    }

    public int vertexCount() {
        return us.length;
    }

    @Override
    public String toString() {
        return "Polygon2D[u=" + Arrays.toString(us) + ", v=" + Arrays.toString(vs) + "]";
    }
}
