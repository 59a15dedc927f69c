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

import com.hellblazer.canopy.common.IntArrayList;

import java.util.Arrays;
import java.util.Random;

/**
 * The set of node indices currently acting as leaves, with constant time insertion, removal and uniform sampling.
 *
 * @author hal.hildebrand
 */
final class LeafSet {

    private final IntArrayList members = new IntArrayList();
    private       int[]        position;

    LeafSet(int capacity) {
        position = new int[Math.max(4, capacity)];
        Arrays.fill(position, -1);
    }

    void add(int node) {
        ensure(node);
        assert position[node] < 0 : "Leaf " + node + " already present";
        position[node] = members.size();
        members.addInt(node);
    }

    void clear() {
        for (int i = 0; i < members.size(); i++) {
            position[members.getInt(i)] = -1;
        }
        members.clear();
    }

    boolean contains(int node) {
        return node < position.length && position[node] >= 0;
    }

    void remove(int node) {
        int at = position[node];
        assert at >= 0 : "Leaf " + node + " not present";
        members.removeAtSwapBack(at);
        if (at < members.size()) {
            position[members.getInt(at)] = at;
        }
        position[node] = -1;
    }

    /**
     * The node formerly known as from is now at index to
     */
    void replace(int from, int to) {
        int at = position[from];
        assert at >= 0 : "Leaf " + from + " not present";
        ensure(to);
        assert position[to] < 0 : "Leaf " + to + " already present";
        members.setInt(at, to);
        position[from] = -1;
        position[to] = at;
    }

    int sample(Random random) {
        return members.getInt(random.nextInt(members.size()));
    }

    int size() {
        return members.size();
    }

    int[] toArray() {
        return members.toArray();
    }

    private void ensure(int node) {
        if (node >= position.length) {
            int old = position.length;
            position = Arrays.copyOf(position, Math.max(node + 1, old + (old >> 1) + 1));
            Arrays.fill(position, old, position.length, -1);
        }
    }
}
