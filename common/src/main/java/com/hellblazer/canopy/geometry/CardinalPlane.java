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

import javax.vecmath.Tuple3f;

/**
 * The axis aligned planes onto which 3D positions are projected for two dimensional queries. The first coordinate of
 * the projection is u, the second v.
 *
 * @author hal.hildebrand
 */
public enum CardinalPlane {
    XY {
        @Override
        public float u(float x, float y, float z) {
            return x;
        }

        @Override
        public float v(float x, float y, float z) {
            return y;
        }
    },
    XZ {
        @Override
        public float u(float x, float y, float z) {
            return x;
        }

        @Override
        public float v(float x, float y, float z) {
            return z;
        }
    },
    YZ {
        @Override
        public float u(float x, float y, float z) {
            return y;
        }

        @Override
        public float v(float x, float y, float z) {
            return z;
        }
    };

    public abstract float u(float x, float y, float z);

    public float u(Tuple3f p) {
        return u(p.x, p.y, p.z);
    }

    public abstract float v(float x, float y, float z);

    public float v(Tuple3f p) {
        return v(p.x, p.y, p.z);
    }
}
