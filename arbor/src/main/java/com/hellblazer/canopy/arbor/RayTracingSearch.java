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

import com.hellblazer.canopy.arbor.entity.Bounded;
import com.hellblazer.canopy.arbor.entity.EntityID;
import com.hellblazer.canopy.common.IntArrayList;
import com.hellblazer.canopy.geometry.LineSegment3D;
import com.hellblazer.canopy.geometry.Ray3D;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ray traversal of the tree. The ray is clipped to a segment, subtrees whose bounds the segment misses are pruned, and
 * every item whose bounding surface the segment crosses is reported with its crossing points.
 *
 * @author hal.hildebrand
 */
final class RayTracingSearch<ID extends EntityID, T extends Bounded<ID, V>, V> {

    // Pushes an unbounded ray's segment end past the tree's farthest corner
    private static final float REACH_MARGIN = 1f;

    private final AbstractStarTree<ID, T, V> tree;

    RayTracingSearch(AbstractStarTree<ID, T, V> tree) {
        this.tree = tree;
    }

    List<IntersectionHit<T>> raycast(Ray3D ray, float maxDistance, Comparator<? super IntersectionHit<T>> comparator) {
        var hits = new ArrayList<IntersectionHit<T>>();
        float distance = Math.min(maxDistance, ray.maxDistance());
        if (tree.isEmpty() || ray.isDegenerate() || !(distance > 0f)) {
            return hits;
        }
        if (Float.isInfinite(distance)) {
            Point3f origin = ray.origin();
            distance = tree.boundingBox(tree.nodes.bounds(AbstractStarTree.ROOT))
                           .maxDistance(origin.x, origin.y, origin.z) + REACH_MARGIN;
        }
        LineSegment3D segment = ray.toSegment(distance);

        var nodes = tree.nodes;
        var children = tree.childrenBuffer;
        var stack = new IntArrayList();
        stack.addInt(AbstractStarTree.ROOT);
        while (!stack.isEmpty()) {
            int node = stack.removeLast();
            if (!tree.segmentOverlaps(nodes.bounds(node), segment)) {
                continue;
            }
            if (nodes.isLeaf(node)) {
                int list = nodes.children(node);
                for (int i = 0; i < children.size(list); i++) {
                    T item = tree.item(children.get(list, i));
                    Point3f[] points = tree.intersections(item.getBounds(), segment);
                    if (points.length > 0) {
                        hits.add(IntersectionHit.of(item, ray.origin(), points));
                    }
                }
            } else {
                stack.addInt(nodes.right(node));
                stack.addInt(nodes.left(node));
            }
        }
        hits.sort(comparator);
        return hits;
    }
}
