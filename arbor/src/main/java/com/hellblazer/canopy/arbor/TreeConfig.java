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

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

/**
 * Configuration for a star tree: leaf fan out, initial arena sizing, optimizer randomness and the pool used for
 * batched work.
 *
 * @author hal.hildebrand
 */
public class TreeConfig {

    /**
     * Capacity of the fixed inline children list of a leaf, which bounds the configurable fan out
     */
    public static final int MAX_CHILDREN_CEILING = 30;
    public static final int DEFAULT_MAX_CHILDREN = 16;

    private int             initialCapacity      = 64;
    private int             maxChildren          = DEFAULT_MAX_CHILDREN;
    private Long            randomSeed           = null;
    private ExecutorService executor             = ForkJoinPool.commonPool();
    private int             parallelThreshold    = 1024;
    private float           rayEpsilon           = 1e-4f;
    private boolean         consistencyChecking  = false;

    public static TreeConfig defaultConfig() {
        return new TreeConfig();
    }

    /**
     * Configuration whose optimizer sampling is reproducible from the seed
     */
    public static TreeConfig deterministic(long seed) {
        return new TreeConfig().withRandomSeed(seed);
    }

    /**
     * Pool used by batched queries and the parallel phase of batched updates
     */
    public ExecutorService getExecutor() {
        return executor;
    }

    /**
     * Number of items the arenas are sized for up front
     */
    public int getInitialCapacity() {
        return initialCapacity;
    }

    /**
     * Maximum number of items held by a leaf
     */
    public int getMaxChildren() {
        return maxChildren;
    }

    /**
     * Minimum batch size before batched updates run their per item phase in parallel
     */
    public int getParallelThreshold() {
        return parallelThreshold;
    }

    /**
     * Seed for the optimizer's sampling, null for a time based seed
     */
    public Long getRandomSeed() {
        return randomSeed;
    }

    /**
     * Tolerance used by the default raycast comparator when ordering hit distances
     */
    public float getRayEpsilon() {
        return rayEpsilon;
    }

    /**
     * Whether every mutation is followed by a full structural consistency check
     */
    public boolean isConsistencyChecking() {
        return consistencyChecking;
    }

    public TreeConfig withConsistencyChecking(boolean check) {
        this.consistencyChecking = check;
        return this;
    }

    public TreeConfig withExecutor(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        return this;
    }

    public TreeConfig withInitialCapacity(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Initial capacity must not be negative");
        }
        this.initialCapacity = capacity;
        return this;
    }

    public TreeConfig withMaxChildren(int maxChildren) {
        if (maxChildren < 2 || maxChildren > MAX_CHILDREN_CEILING) {
            throw new IllegalArgumentException(
            "Max children must be between 2 and " + MAX_CHILDREN_CEILING + ", got: " + maxChildren);
        }
        this.maxChildren = maxChildren;
        return this;
    }

    public TreeConfig withParallelThreshold(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("Parallel threshold must be positive");
        }
        this.parallelThreshold = threshold;
        return this;
    }

    public TreeConfig withRandomSeed(long seed) {
        this.randomSeed = seed;
        return this;
    }

    public TreeConfig withRayEpsilon(float epsilon) {
        if (!(epsilon >= 0f)) {
            throw new IllegalArgumentException("Ray epsilon must not be negative");
        }
        this.rayEpsilon = epsilon;
        return this;
    }

    @Override
    public String toString() {
        return "TreeConfig[maxChildren=" + maxChildren + ", initialCapacity=" + initialCapacity + ", seed="
        + randomSeed + ", parallelThreshold=" + parallelThreshold + "]";
    }
}
