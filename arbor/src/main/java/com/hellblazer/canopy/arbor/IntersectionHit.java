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

import javax.vecmath.Point3f;
import java.util.Arrays;
import java.util.List;

/**
 * An item hit by a ray together with the points where the ray crosses its bounding surface, in order along the ray.
 *
 * @param item      the item hit
 * @param hitPoints one or two surface crossings
 * @param distance  distance from the ray origin to the first crossing
 * @param <T>       the item type
 * @author hal.hildebrand
 */
public record IntersectionHit<T>(T item, List<Point3f> hitPoints, float distance) {

    static <T> IntersectionHit<T> of(T item, Point3f origin, Point3f[] points) {
        return new IntersectionHit<>(item, Arrays.asList(points), origin.distance(points[0]));
    }

    public Point3f firstHit() {
        return hitPoints.get(0);
    }
}
