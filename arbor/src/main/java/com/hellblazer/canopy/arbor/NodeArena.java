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

import java.util.Arrays;

/**
 * Flat storage of tree nodes addressed by index. A node is a leaf when it owns a children list (children >= 0), and
 * internal otherwise, in which case left and right name its two child nodes. The active nodes always occupy the
 * prefix [0, activeCount); the tail of the arrays is the free region and is consumed before the arrays grow. Releasing
 * a node moves the last active node into the vacated slot, and the caller patches references to the moved node.
 *
 * @param <V> the bounding volume type
 * @author hal.hildebrand
 */
final class NodeArena<V> {

    static final int NONE = -1;

    private int[]    left;
    private int[]    right;
    private int[]    parent;
    private int[]    children;
    private Object[] bounds;
    private int      active;

    NodeArena(int capacity) {
        int size = Math.max(4, capacity);
        left = new int[size];
        right = new int[size];
        parent = new int[size];
        children = new int[size];
        bounds = new Object[size];
    }

    int activeCount() {
        return active;
    }

    /**
     * Allocate the next free slot
     *
     * @return index of the new node
     */
    int allocate(int parentIndex, int leftIndex, int rightIndex, int childrenIndex, V volume) {
        if (active == left.length) {
            grow();
        }
        int index = active++;
        parent[index] = parentIndex;
        left[index] = leftIndex;
        right[index] = rightIndex;
        children[index] = childrenIndex;
        bounds[index] = volume;
        return index;
    }

    @SuppressWarnings("unchecked")
    V bounds(int index) {
        return (V) bounds[index];
    }

    int capacity() {
        return left.length;
    }

    int children(int index) {
        return children[index];
    }

    void clear() {
        Arrays.fill(bounds, 0, active, null);
        active = 0;
    }

    /**
     * Overwrite the node at the destination with the contents of the source
     */
    void copy(int source, int destination) {
        parent[destination] = parent[source];
        left[destination] = left[source];
        right[destination] = right[source];
        children[destination] = children[source];
        bounds[destination] = bounds[source];
    }

    boolean isLeaf(int index) {
        return children[index] >= 0;
    }

    int left(int index) {
        return left[index];
    }

    int parent(int index) {
        return parent[index];
    }

    /**
     * Drop the last active node
     */
    void truncate() {
        assert active > 0 : "Truncating empty arena";
        bounds[--active] = null;
    }

    int right(int index) {
        return right[index];
    }

    void setBounds(int index, V volume) {
        bounds[index] = volume;
    }

    void setChildren(int index, int childrenIndex) {
        children[index] = childrenIndex;
    }

    void setLeft(int index, int nodeIndex) {
        left[index] = nodeIndex;
    }

    void setParent(int index, int nodeIndex) {
        parent[index] = nodeIndex;
    }

    void setRight(int index, int nodeIndex) {
        right[index] = nodeIndex;
    }

    /**
     * The other child of this node's parent
     */
    int sibling(int index) {
        int p = parent[index];
        assert p != NONE : "Root has no sibling";
        return left[p] == index ? right[p] : left[p];
    }

    private void grow() {
        int size = left.length + (left.length >> 1) + 1;
        left = Arrays.copyOf(left, size);
        right = Arrays.copyOf(right, size);
        parent = Arrays.copyOf(parent, size);
        children = Arrays.copyOf(children, size);
        bounds = Arrays.copyOf(bounds, size);
    }
}
