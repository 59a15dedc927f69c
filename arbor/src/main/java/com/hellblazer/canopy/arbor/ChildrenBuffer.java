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

/**
 * Fixed capacity, unordered lists of item slots, one per leaf, packed into a single flat array. List i occupies
 * [i * capacity, (i + 1) * capacity). Released lists go on a free list and are reused before the store grows.
 *
 * @author hal.hildebrand
 */
final class ChildrenBuffer {

    private final int          capacity;
    private final IntArrayList free = new IntArrayList();
    private       int[]        data;
    private       int[]        sizes;
    private       int          high;

    ChildrenBuffer(int capacity, int initialLists) {
        this.capacity = capacity;
        int lists = Math.max(2, initialLists);
        data = new int[lists * capacity];
        sizes = new int[lists];
    }

    /**
     * Append the slot to the list
     */
    void add(int list, int slot) {
        int size = sizes[list];
        assert size < capacity : "Children list " + list + " is full";
        data[list * capacity + size] = slot;
        sizes[list] = size + 1;
    }

    /**
     * Number of lists in use
     */
    int activeCount() {
        return high - free.size();
    }

    /**
     * Obtain an empty list, reusing a released one when available
     */
    int allocate() {
        int list;
        if (!free.isEmpty()) {
            list = free.removeLast();
        } else {
            if (high == sizes.length) {
                int lists = sizes.length + (sizes.length >> 1) + 1;
                sizes = Arrays.copyOf(sizes, lists);
                data = Arrays.copyOf(data, lists * capacity);
            }
            list = high++;
        }
        sizes[list] = 0;
        return list;
    }

    int capacity() {
        return capacity;
    }

    void clear() {
        free.clear();
        high = 0;
    }

    /**
     * Copy the list's slots into the destination, answering the count copied
     */
    int copyTo(int list, int[] destination, int offset) {
        int size = sizes[list];
        System.arraycopy(data, list * capacity, destination, offset, size);
        return size;
    }

    int get(int list, int position) {
        assert position < sizes[list] : "Position " + position + " beyond size of list " + list;
        return data[list * capacity + position];
    }

    int indexOf(int list, int slot) {
        int base = list * capacity;
        for (int i = 0; i < sizes[list]; i++) {
            if (data[base + i] == slot) {
                return i;
            }
        }
        return -1;
    }

    boolean isFree(int list) {
        return list >= high || free.containsInt(list);
    }

    void release(int list) {
        assert !free.containsInt(list) : "List " + list + " released twice";
        sizes[list] = 0;
        free.addInt(list);
    }

    /**
     * Remove the slot at the position by moving the last slot of the list into it
     */
    int removeAtSwapBack(int list, int position) {
        int base = list * capacity;
        int last = --sizes[list];
        int removed = data[base + position];
        data[base + position] = data[base + last];
        return removed;
    }

    void set(int list, int position, int slot) {
        data[list * capacity + position] = slot;
    }

    int size(int list) {
        return sizes[list];
    }
}
