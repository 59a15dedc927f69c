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

import java.util.PriorityQueue;

/**
 * Best first nearest neighbor search. Nodes are expanded in order of the distance from the query point to their
 * bounds; the search ends once the nearest remaining node is no closer than the best item center found.
 *
 * @author hal.hildebrand
 */
final class NearestNeighborSearch<ID extends EntityID, T extends Bounded<ID, V>, V> {

    private final AbstractStarTree<ID, T, V> tree;

    NearestNeighborSearch(AbstractStarTree<ID, T, V> tree) {
        this.tree = tree;
    }

    /**
     * @return the slot of the item whose bounds center is nearest the point, or -1 when the tree is empty
     */
    int nearest(float x, float y, float z) {
        if (tree.isEmpty()) {
            return -1;
        }
        var nodes = tree.nodes;
        var children = tree.childrenBuffer;
        var queue = new PriorityQueue<NodeDistance>();
        queue.add(new NodeDistance(AbstractStarTree.ROOT, 0f));

        int best = -1;
        float bestDistance = Float.POSITIVE_INFINITY;
        while (!queue.isEmpty()) {
            NodeDistance next = queue.poll();
            if (next.distance >= bestDistance) {
                break;
            }
            int node = next.node;
            if (nodes.isLeaf(node)) {
                int list = nodes.children(node);
                for (int i = 0; i < children.size(list); i++) {
                    int slot = children.get(list, i);
                    float d = tree.centerDistanceSquared(tree.itemBounds(slot), x, y, z);
                    if (d < bestDistance) {
                        bestDistance = d;
                        best = slot;
                    }
                }
            } else {
                enqueue(queue, nodes.left(node), x, y, z, bestDistance);
                enqueue(queue, nodes.right(node), x, y, z, bestDistance);
            }
        }
        return best;
    }

    private void enqueue(PriorityQueue<NodeDistance> queue, int node, float x, float y, float z, float bestDistance) {
        float d = tree.minDistanceSquared(tree.nodes.bounds(node), x, y, z);
        if (d < bestDistance) {
            queue.add(new NodeDistance(node, d));
        }
    }

    private record NodeDistance(int node, float distance) implements Comparable<NodeDistance> {
        @Override
        public int compareTo(NodeDistance o) {
            return Float.compare(distance, o.distance);
        }
    }
}
