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

import javax.vecmath.Vector3f;

/**
 * Least squares fitting over point sets
 *
 * @author hal.hildebrand
 */
public final class StatisticsUtil {

    private static final int POWER_ITERATIONS = 32;

    private StatisticsUtil() {
    }

    /**
     * The direction of the least squares line through the anchor point: the line minimizing the summed squared
     * perpendicular distances of the points. This is the principal eigenvector of the scatter matrix about the anchor.
     * Answers the x axis when the points give no preferred direction.
     *
     * @param xs     point x coordinates
     * @param ys     point y coordinates
     * @param zs     point z coordinates
     * @param count  number of points to use
     * @param anchorX anchor x, with anchorY and anchorZ the point the line passes through
     * @return unit direction of the line
     */
    public static Vector3f principalAxis(float[] xs, float[] ys, float[] zs, int count, float anchorX, float anchorY,
                                         float anchorZ) {
        double sxx = 0, sxy = 0, sxz = 0, syy = 0, syz = 0, szz = 0;
        for (int i = 0; i < count; i++) {
            double dx = xs[i] - anchorX;
            double dy = ys[i] - anchorY;
            double dz = zs[i] - anchorZ;
            sxx += dx * dx;
            sxy += dx * dy;
            sxz += dx * dz;
            syy += dy * dy;
            syz += dy * dz;
            szz += dz * dz;
        }

        // Start from the scatter column of largest magnitude
        double[][] columns = { { sxx, sxy, sxz }, { sxy, syy, syz }, { sxz, syz, szz } };
        double[] v = columns[0];
        double best = norm(columns[0]);
        for (int i = 1; i < 3; i++) {
            double n = norm(columns[i]);
            if (n > best) {
                best = n;
                v = columns[i];
            }
        }
        if (best < 1e-12) {
            return new Vector3f(1f, 0f, 0f);
        }
        double vx = v[0] / best, vy = v[1] / best, vz = v[2] / best;
        for (int i = 0; i < POWER_ITERATIONS; i++) {
            double nx = sxx * vx + sxy * vy + sxz * vz;
            double ny = sxy * vx + syy * vy + syz * vz;
            double nz = sxz * vx + syz * vy + szz * vz;
            double length = Math.sqrt(nx * nx + ny * ny + nz * nz);
            if (length < 1e-12) {
                break;
            }
            vx = nx / length;
            vy = ny / length;
            vz = nz / length;
        }
        return new Vector3f((float) vx, (float) vy, (float) vz);
    }

    private static double norm(double[] v) {
        return Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
    }
}
