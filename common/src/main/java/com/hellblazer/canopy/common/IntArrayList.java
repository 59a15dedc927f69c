// Protocol Buffers - Google's data interchange format
// Copyright 2008 Google Inc.  All rights reserved.
// https://developers.google.com/protocol-buffers/
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are
// met:
//
//     * Redistributions of source code must retain the above copyright
// notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above
// copyright notice, this list of conditions and the following disclaimer
// in the documentation and/or other materials provided with the
// distribution.
//     * Neither the name of Google Inc. nor the names of its
// contributors may be used to endorse or promote products derived from
// this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
// "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
// LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
// A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
// OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
// SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
// LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
// DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
// THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
// OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.hellblazer.canopy.common;

import java.util.Arrays;
import java.util.RandomAccess;

/**
 * Unboxed growable list of ints. Chopped down and specialized for arena free lists and index sets, where element order
 * is usually irrelevant and removal is by swapping the last element into the vacated position.
 */
public final class IntArrayList implements RandomAccess {

    private static final int DEFAULT_CAPACITY = 10;

    /** The backing store for the list. */
    private int[] array;
    private int   size;

    public IntArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public IntArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Negative capacity: " + initialCapacity);
        }
        array = new int[Math.max(1, initialCapacity)];
    }

    private IntArrayList(int[] other, int size) {
        array = other;
        this.size = size;
    }

    public static IntArrayList of(int... elements) {
        return new IntArrayList(Arrays.copyOf(elements, Math.max(1, elements.length)), elements.length);
    }

    public void addInt(int element) {
        if (size == array.length) {
            // Resize to 1.5x the size
            int length = ((size * 3) / 2) + 1;
            array = Arrays.copyOf(array, length);
        }
        array[size++] = element;
    }

    public boolean addAll(IntArrayList list) {
        if (list.size == 0) {
            return false;
        }

        int overflow = Integer.MAX_VALUE - size;
        if (overflow < list.size) {
            // We can't actually represent a list this large.
            throw new OutOfMemoryError();
        }

        int newSize = size + list.size;
        if (newSize > array.length) {
            array = Arrays.copyOf(array, newSize);
        }

        System.arraycopy(list.array, 0, array, size, list.size);
        size = newSize;
        return true;
    }

    public void clear() {
        size = 0;
    }

    public boolean containsInt(int element) {
        return indexOfInt(element) != -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final IntArrayList other)) {
            return false;
        }
        if (size != other.size) {
            return false;
        }

        final int[] arr = other.array;
        for (int i = 0; i < size; i++) {
            if (array[i] != arr[i]) {
                return false;
            }
        }

        return true;
    }

    public int getInt(int index) {
        ensureIndexInRange(index);
        return array[index];
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = (31 * result) + array[i];
        }
        return result;
    }

    public int indexOfInt(int element) {
        for (int i = 0; i < size; i++) {
            if (array[i] == element) {
                return i;
            }
        }
        return -1;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Remove and answer the last element
     */
    public int removeLast() {
        if (size == 0) {
            throw new IndexOutOfBoundsException("List is empty");
        }
        return array[--size];
    }

    /**
     * Remove the element at the index by moving the last element into its position. Answers the removed element.
     */
    public int removeAtSwapBack(int index) {
        ensureIndexInRange(index);
        int value = array[index];
        array[index] = array[--size];
        return value;
    }

    public int setInt(int index, int element) {
        ensureIndexInRange(index);
        int previousValue = array[index];
        array[index] = element;
        return previousValue;
    }

    public int size() {
        return size;
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    private void ensureIndexInRange(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException(makeOutOfBoundsExceptionMessage(index));
        }
    }

    private String makeOutOfBoundsExceptionMessage(int index) {
        return "Index:" + index + ", Size:" + size;
    }
}
