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

/**
 * Read only snapshot of a node
 *
 * @param index      node index
 * @param parent     parent index, -1 for the root
 * @param left       left child index, -1 for a leaf
 * @param right      right child index, -1 for a leaf
 * @param children   children list index, -1 for an internal node
 * @param itemCount  number of items held directly (leaves only)
 * @param bounds     cached bounding volume
 * @param <V>        the bounding volume type
 * @author hal.hildebrand
 */
public record NodeView<V>(int index, int parent, int left, int right, int children, int itemCount, V bounds) {

    public boolean isLeaf() {
        return children >= 0;
    }

    public boolean isRoot() {
        return parent < 0;
    }
}
