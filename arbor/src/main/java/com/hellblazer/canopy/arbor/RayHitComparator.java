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
package com.hellblazer.canopy.arbor;

import java.util.Comparator;

/**
 * Orders ray hits by ascending distance of the first hit from the ray origin. Distances are compared in buckets of the
 * epsilon width, so hits closer together than the epsilon may appear in either order; within a bucket the discovery
 * order is kept. An epsilon of zero compares exactly.
 *
 * @author hal.hildebrand
 */
public class RayHitComparator<T> implements Comparator<IntersectionHit<T>> {

    private final float epsilon;

    public RayHitComparator(float epsilon) {
        if (!(epsilon >= 0f)) {
            throw new IllegalArgumentException("Epsilon must not be negative");
        }
        this.epsilon = epsilon;
    }

    @Override
    public int compare(IntersectionHit<T> a, IntersectionHit<T> b) {
        if (epsilon == 0f) {
            return Float.compare(a.distance(), b.distance());
        }
        return Long.compare(bucket(a.distance()), bucket(b.distance()));
    }

    public float getEpsilon() {
        return epsilon;
    }

    private long bucket(float distance) {
        return (long) Math.floor(distance / (double) epsilon);
    }
}
