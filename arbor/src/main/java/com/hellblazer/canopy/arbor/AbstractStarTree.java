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
import com.hellblazer.canopy.geometry.Box;
import com.hellblazer.canopy.geometry.Capsule;
import com.hellblazer.canopy.geometry.CardinalPlane;
import com.hellblazer.canopy.geometry.Frustum3D;
import com.hellblazer.canopy.geometry.LineSegment3D;
import com.hellblazer.canopy.geometry.Polygon2D;
import com.hellblazer.canopy.geometry.Ray3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Dynamic binary bounding volume hierarchy over bounded items, shared by the box and ball variants.
 * <p>
 * Nodes live in a {@link NodeArena} and are linked by index. The root is always node 0; an empty tree is a single leaf
 * with an empty children list. Every internal node has exactly two children and a cached bound covering them, every
 * leaf holds between 1 and {@link #getMaxChildren()} items in a {@link ChildrenBuffer} list, and the item slot to leaf
 * index agrees with the leaves' lists at the end of every mutation.
 * <p>
 * Each item occupies a dense integer slot; the identity map resolves an identity to its slot, and the slot to leaf
 * index resolves the slot to the leaf holding it, so update and removal never descend the tree.
 * <p>
 * Mutations are not synchronized and must be externally sequenced. Queries only read and may run concurrently with
 * each other, which the batched query forms exploit. Inserting a present identity, and removing or updating an absent
 * one, are no-ops. Any operation on a disposed tree throws {@link IllegalStateException}.
 *
 * @param <ID> the identity type
 * @param <T>  the item type
 * @param <V>  the bounding volume type
 * @author hal.hildebrand
 */
public abstract class AbstractStarTree<ID extends EntityID, T extends Bounded<ID, V>, V> implements AutoCloseable {

    public static final  int    DEFAULT_LEAF_SWAPS        = 32;
    public static final  int    DEFAULT_GRANDCHILD_TRICKS = 16;
    static final         int    ROOT                      = 0;
    static final         int    NONE                      = NodeArena.NONE;
    // Fewer nodes than this cannot have a node with a grandparent and an uncle
    private static final int    GRANDCHILD_MIN_NODES      = 7;
    private static final Logger log                       = LoggerFactory.getLogger(AbstractStarTree.class);

    protected final TreeConfig       config;
    protected final int              maxChildren;
    final           BatchQueryExecutor batch;
    private final   Random           random;
    private final   Map<ID, Integer> slotsById;
    NodeArena<V>    nodes;
    ChildrenBuffer  childrenBuffer;
    LeafSet         leaves;
    private Object[]     items;
    private int[]        leafOfSlot;
    private IntArrayList freeSlots;
    private int          slotHigh;
    private boolean      created;
    // Leaves awaiting structural repair during a batched removal
    private BitSet       pending;

    protected AbstractStarTree(TreeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.maxChildren = config.getMaxChildren();
        int capacity = Math.max(4, config.getInitialCapacity());
        int nodeCapacity = 2 * (capacity / Math.max(1, maxChildren / 2)) + 4;
        nodes = new NodeArena<>(nodeCapacity);
        childrenBuffer = new ChildrenBuffer(maxChildren, nodeCapacity / 2 + 1);
        leaves = new LeafSet(nodeCapacity);
        items = new Object[capacity];
        leafOfSlot = new int[capacity];
        freeSlots = new IntArrayList();
        slotsById = new HashMap<>(capacity * 4 / 3 + 1);
        random = config.getRandomSeed() == null ? new Random() : new Random(config.getRandomSeed());
        batch = new BatchQueryExecutor(config.getExecutor());
        created = true;
        initializeRoot();
    }

    // ------------------------------------------------------------------------------------------------------------
    // Introspection

    /**
     * Verify every structural invariant of the tree
     *
     * @throws IllegalStateException naming the first violated invariant
     */
    public void checkConsistency() {
        checkCreated();
        int active = nodes.activeCount();
        if (active == 0 || nodes.parent(ROOT) != NONE) {
            throw new IllegalStateException("Root must be node 0 without a parent");
        }
        int leafCount = 0;
        int itemCount = 0;
        int visited = 0;
        var stack = new IntArrayList();
        stack.addInt(ROOT);
        while (!stack.isEmpty()) {
            int node = stack.removeLast();
            visited++;
            if (visited > active) {
                throw new IllegalStateException("Cycle in node links, visited more than " + active + " nodes");
            }
            if (nodes.isLeaf(node)) {
                leafCount++;
                if (!leaves.contains(node)) {
                    throw new IllegalStateException("Leaf " + node + " missing from the leaf set");
                }
                int list = nodes.children(node);
                if (childrenBuffer.isFree(list)) {
                    throw new IllegalStateException("Leaf " + node + " owns released children list " + list);
                }
                int count = childrenBuffer.size(list);
                if (count > maxChildren) {
                    throw new IllegalStateException("Leaf " + node + " holds " + count + " items");
                }
                if (count == 0 && node != ROOT) {
                    throw new IllegalStateException("Non root leaf " + node + " is empty");
                }
                V bounds = nodes.bounds(node);
                for (int i = 0; i < count; i++) {
                    int slot = childrenBuffer.get(list, i);
                    T item = item(slot);
                    if (item == null) {
                        throw new IllegalStateException("Leaf " + node + " references free slot " + slot);
                    }
                    if (leafOfSlot[slot] != node) {
                        throw new IllegalStateException(
                        item.getId().toDebugString() + " is in leaf " + node + " but indexed to leaf "
                        + leafOfSlot[slot]);
                    }
                    Integer indexed = slotsById.get(item.getId());
                    if (indexed == null || indexed != slot) {
                        throw new IllegalStateException(item.getId().toDebugString() + " is not indexed to slot " + slot);
                    }
                    if (!covers(bounds, item.getBounds())) {
                        throw new IllegalStateException(
                        "Leaf " + node + " bounds " + bounds + " do not cover " + item.getId().toDebugString());
                    }
                }
                itemCount += count;
            } else {
                if (leaves.contains(node)) {
                    throw new IllegalStateException("Internal node " + node + " is in the leaf set");
                }
                int l = nodes.left(node);
                int r = nodes.right(node);
                if (l < 0 || r < 0 || l >= active || r >= active || l == r) {
                    throw new IllegalStateException(
                    "Internal node " + node + " must have two distinct children, has " + l + ", " + r);
                }
                for (int child : new int[] { l, r }) {
                    if (nodes.parent(child) != node) {
                        throw new IllegalStateException(
                        "Child " + child + " of " + node + " names parent " + nodes.parent(child));
                    }
                    if (!covers(nodes.bounds(node), nodes.bounds(child))) {
                        throw new IllegalStateException("Node " + node + " bounds do not cover child " + child);
                    }
                    stack.addInt(child);
                }
            }
        }
        if (visited != active) {
            throw new IllegalStateException("Reached " + visited + " of " + active + " active nodes");
        }
        if (leafCount != leaves.size()) {
            throw new IllegalStateException("Leaf set holds " + leaves.size() + " nodes, tree has " + leafCount);
        }
        if (itemCount != slotsById.size()) {
            throw new IllegalStateException("Leaves hold " + itemCount + " items, index has " + slotsById.size());
        }
        if (childrenBuffer.activeCount() != leafCount) {
            throw new IllegalStateException(
            childrenBuffer.activeCount() + " children lists in use for " + leafCount + " leaves");
        }
    }

    public boolean contains(ID id) {
        checkCreated();
        return slotsById.containsKey(id);
    }

    /**
     * Length of the longest root to leaf path, counted in edges
     */
    public int depth() {
        checkCreated();
        int deepest = 0;
        var stack = new IntArrayList();
        var depths = new IntArrayList();
        stack.addInt(ROOT);
        depths.addInt(0);
        while (!stack.isEmpty()) {
            int node = stack.removeLast();
            int depth = depths.removeLast();
            deepest = Math.max(deepest, depth);
            if (!nodes.isLeaf(node)) {
                stack.addInt(nodes.left(node));
                depths.addInt(depth + 1);
                stack.addInt(nodes.right(node));
                depths.addInt(depth + 1);
            }
        }
        return deepest;
    }

    public Optional<T> get(ID id) {
        checkCreated();
        Integer slot = slotsById.get(id);
        return slot == null ? Optional.empty() : Optional.of(item(slot));
    }

    public int getMaxChildren() {
        return maxChildren;
    }

    /**
     * Direct node lookup
     *
     * @throws IndexOutOfBoundsException unless 0 <= index < {@link #nodeCount()}
     */
    public NodeView<V> getNode(int index) {
        checkCreated();
        Objects.checkIndex(index, nodes.activeCount());
        int list = nodes.children(index);
        return new NodeView<>(index, nodes.parent(index), nodes.left(index), nodes.right(index), list,
                              list >= 0 ? childrenBuffer.size(list) : 0, nodes.bounds(index));
    }

    /**
     * Bounds of the whole tree; the empty volume when the tree is empty
     */
    public V getRootBounds() {
        checkCreated();
        return nodes.bounds(ROOT);
    }

    public boolean isCreated() {
        return created;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int leafCount() {
        checkCreated();
        return leaves.size();
    }

    public int nodeCount() {
        checkCreated();
        return nodes.activeCount();
    }

    public int size() {
        checkCreated();
        return slotsById.size();
    }

    /**
     * Snapshot of every indexed item
     */
    public List<T> values() {
        checkCreated();
        var result = new ArrayList<T>(slotsById.size());
        for (int slot : slotsById.values()) {
            result.add(item(slot));
        }
        return result;
    }

    // ------------------------------------------------------------------------------------------------------------
    // Mutation

    /**
     * Remove every item, keeping the allocated storage
     */
    public void clear() {
        checkCreated();
        nodes.clear();
        childrenBuffer.clear();
        leaves.clear();
        Arrays.fill(items, 0, slotHigh, null);
        freeSlots.clear();
        slotHigh = 0;
        slotsById.clear();
        initializeRoot();
    }

    @Override
    public void close() {
        dispose();
    }

    /**
     * Release all backing storage. Calling again has no effect.
     */
    public void dispose() {
        if (!created) {
            return;
        }
        created = false;
        int count = slotsById.size();
        slotsById.clear();
        nodes = null;
        childrenBuffer = null;
        leaves = null;
        items = null;
        leafOfSlot = null;
        freeSlots = null;
        log.debug("Disposed {} holding {} items", getClass().getSimpleName(), count);
    }

    /**
     * Insert the item. A no-op when its identity is already present.
     *
     * @return true if the item was inserted
     */
    public boolean insert(T item) {
        checkCreated();
        Objects.requireNonNull(item, "item");
        if (slotsById.containsKey(item.getId())) {
            return false;
        }
        int slot = allocateSlot(item);
        V bounds = item.getBounds();

        int node = chooseLeaf(bounds);
        int list = nodes.children(node);
        if (childrenBuffer.size(list) < maxChildren) {
            childrenBuffer.add(list, slot);
            leafOfSlot[slot] = node;
            nodes.setBounds(node, appended(list, nodes.bounds(node), bounds));
            propagateUp(node);
        } else {
            split(node, slot);
        }
        afterMutation();
        return true;
    }

    /**
     * Run the default number of optimization attempts
     */
    public void optimize() {
        optimize(DEFAULT_LEAF_SWAPS, DEFAULT_GRANDCHILD_TRICKS);
    }

    /**
     * Randomized local improvement. Each leaf swap attempt samples two leaves and, when their bounds overlap,
     * redistributes items between them; each grandchild trick samples a node and re-pairs it with its uncle's
     * children when that lowers the summed cost of the two affected parents. The item set is never changed.
     *
     * @param leafSwaps        number of leaf swap attempts
     * @param grandchildTricks number of rotation attempts
     */
    public void optimize(int leafSwaps, int grandchildTricks) {
        checkCreated();
        int swaps = 0;
        int rotations = 0;
        if (nodes.activeCount() > 1) {
            if (leaves.size() > 1) {
                for (int i = 0; i < leafSwaps; i++) {
                    int a = leaves.sample(random);
                    int b = leaves.sample(random);
                    if (a != b && leafSwap(a, b)) {
                        swaps++;
                    }
                }
            }
            if (nodes.activeCount() >= GRANDCHILD_MIN_NODES) {
                for (int i = 0; i < grandchildTricks; i++) {
                    if (grandchildTrick(random.nextInt(nodes.activeCount()))) {
                        rotations++;
                    }
                }
            }
        }
        log.debug("Optimized {} items: {} leaf pairs improved, {} rotations", slotsById.size(), swaps, rotations);
        afterMutation();
    }

    /**
     * Remove the item by its identity. A no-op when absent.
     *
     * @return true if the item was removed
     */
    public boolean remove(T item) {
        return removeById(item.getId());
    }

    /**
     * Remove the items. The per item detachment runs in parallel for large batches; the structural repair of the
     * touched leaves follows serially.
     *
     * @return the number of items removed
     */
    public int removeAll(Collection<? extends T> removals) {
        checkCreated();
        Map<Integer, IntArrayList> byLeaf = new HashMap<>();
        int removed = 0;
        for (T item : removals) {
            Integer slot = slotsById.remove(item.getId());
            if (slot != null) {
                byLeaf.computeIfAbsent(leafOfSlot[slot], k -> new IntArrayList()).addInt(slot);
                removed++;
            }
        }
        if (removed == 0) {
            return 0;
        }

        List<Integer> touched = new ArrayList<>(byLeaf.keySet());
        Consumer<Integer> detachAll = leaf -> {
            IntArrayList slots = byLeaf.get(leaf);
            for (int i = 0; i < slots.size(); i++) {
                detach(leaf, slots.getInt(i));
            }
        };
        if (removed >= config.getParallelThreshold()) {
            batch.forEachChunk(touched, chunkSize(touched.size()), detachAll);
        } else {
            touched.forEach(detachAll);
        }
        for (IntArrayList slots : byLeaf.values()) {
            for (int i = 0; i < slots.size(); i++) {
                releaseSlot(slots.getInt(i));
            }
        }

        pending = new BitSet(nodes.activeCount());
        try {
            touched.forEach(pending::set);
            for (int leaf = pending.nextSetBit(0); leaf >= 0; leaf = pending.nextSetBit(0)) {
                pending.clear(leaf);
                rebalance(leaf);
            }
        } finally {
            pending = null;
        }
        afterMutation();
        return removed;
    }

    /**
     * Remove the item with the identity. A no-op when absent.
     *
     * @return true if the item was removed
     */
    public boolean removeById(ID id) {
        checkCreated();
        Integer slot = slotsById.remove(id);
        if (slot == null) {
            return false;
        }
        int leaf = leafOfSlot[slot];
        detach(leaf, slot);
        releaseSlot(slot);
        rebalance(leaf);
        afterMutation();
        return true;
    }

    /**
     * Replace the stored item with this version, extending the owning leaf's bounds to cover its new bounds. Never
     * shrinks bounds nor changes the tree's shape. A no-op when the identity is absent.
     *
     * @return true if the item was present
     */
    public boolean update(T item) {
        checkCreated();
        Integer slot = slotsById.get(item.getId());
        if (slot == null) {
            return false;
        }
        items[slot] = item;
        int leaf = leafOfSlot[slot];
        V current = nodes.bounds(leaf);
        V grown = grow(current, item.getBounds());
        if (!grown.equals(current)) {
            nodes.setBounds(leaf, grown);
            propagateUp(leaf);
        }
        afterMutation();
        return true;
    }

    /**
     * Update the items in two phases: first every leaf bound is extended independently, in parallel for large batches,
     * then bounds are propagated upward from every leaf that grew. Absent identities are skipped.
     *
     * @return the number of items updated
     */
    public int updateAll(Collection<? extends T> updates) {
        checkCreated();
        Map<Integer, List<V>> byLeaf = new HashMap<>();
        int updated = 0;
        for (T item : updates) {
            Integer slot = slotsById.get(item.getId());
            if (slot != null) {
                items[slot] = item;
                byLeaf.computeIfAbsent(leafOfSlot[slot], k -> new ArrayList<>()).add(item.getBounds());
                updated++;
            }
        }

        List<Integer> touched = new ArrayList<>(byLeaf.keySet());
        boolean[] grew = new boolean[touched.size()];
        List<Integer> positions = IntStream.range(0, touched.size()).boxed().collect(Collectors.toList());
        Consumer<Integer> extend = i -> {
            int leaf = touched.get(i);
            V current = nodes.bounds(leaf);
            V grown = current;
            for (V bounds : byLeaf.get(leaf)) {
                grown = grow(grown, bounds);
            }
            if (!grown.equals(current)) {
                nodes.setBounds(leaf, grown);
                grew[i] = true;
            }
        };
        if (updated >= config.getParallelThreshold()) {
            batch.forEachChunk(positions, chunkSize(positions.size()), extend);
        } else {
            positions.forEach(extend);
        }

        for (int i = 0; i < grew.length; i++) {
            if (grew[i]) {
                propagateUp(touched.get(i));
            }
        }
        afterMutation();
        return updated;
    }

    // ------------------------------------------------------------------------------------------------------------
    // Queries

    /**
     * Items whose bounds lie within the region
     */
    public List<T> getContainedIn(Box region) {
        return search(containedIn(region));
    }

    /**
     * Batched {@link #getContainedIn(Box)}, one task per region
     *
     * @return future completing with the union of the results
     */
    public CompletableFuture<Set<T>> getContainedIn(List<Box> regions) {
        checkCreated();
        return batch.union(regions, region -> getContainedIn(region));
    }

    /**
     * Items whose bounds lie within the sphere
     */
    public List<T> getContainedInRadius(Point3f center, float radius) {
        return search(containedInRadius(center, radius));
    }

    /**
     * Batched {@link #getContainedInRadius(Point3f, float)}, one task per center
     *
     * @return future completing with the union of the results
     */
    public CompletableFuture<Set<T>> getContainedInRadii(List<Point3f> centers, float[] radii) {
        checkCreated();
        checkRadii(centers, radii);
        return batch.union(indices(centers.size()), i -> getContainedInRadius(centers.get(i), radii[i]));
    }

    /**
     * Items whose bounds center, projected onto the plane, lies inside the polygon. The polygon is expected in the
     * plane's coordinates.
     */
    public List<T> getInPolygon(Polygon2D polygon, CardinalPlane plane) {
        return search(inPolygon(polygon, plane));
    }

    /**
     * Items whose bounds intersect the region
     */
    public List<T> getOverlapping(Box region) {
        return search(overlapping(region));
    }

    /**
     * Batched {@link #getOverlapping(Box)}, one task per region
     *
     * @return future completing with the union of the results
     */
    public CompletableFuture<Set<T>> getOverlapping(List<Box> regions) {
        checkCreated();
        return batch.union(regions, region -> getOverlapping(region));
    }

    /**
     * Items whose bounds intersect the sphere
     */
    public List<T> getOverlappingRadius(Point3f center, float radius) {
        return search(overlappingRadius(center, radius));
    }

    /**
     * Batched {@link #getOverlappingRadius(Point3f, float)}, one task per center
     *
     * @return future completing with the union of the results
     */
    public CompletableFuture<Set<T>> getOverlappingRadii(List<Point3f> centers, float[] radii) {
        checkCreated();
        checkRadii(centers, radii);
        return batch.union(indices(centers.size()), i -> getOverlappingRadius(centers.get(i), radii[i]));
    }

    /**
     * Conservative frustum culling: items not wholly outside any of the frustum's planes
     */
    public List<T> frustumQuery(Frustum3D frustum) {
        return search(inFrustum(frustum));
    }

    /**
     * The item whose bounds center is nearest the point; empty only for an empty tree
     */
    public Optional<T> nearestNeighbor(Point3f point) {
        checkCreated();
        int slot = new NearestNeighborSearch<>(this).nearest(point.x, point.y, point.z);
        return slot < 0 ? Optional.empty() : Optional.of(item(slot));
    }

    /**
     * Batched {@link #nearestNeighbor(Point3f)}, one task per point
     *
     * @return future completing with the nearest item for each point, in point order; an empty list for an empty tree
     */
    public CompletableFuture<List<T>> nearestNeighbors(List<Point3f> points) {
        checkCreated();
        if (isEmpty()) {
            return CompletableFuture.completedFuture(new ArrayList<>());
        }
        return batch.map(points, point -> nearestNeighbor(point).orElse(null));
    }

    /**
     * Items hit by the ray within its own max distance, nearest first
     */
    public List<IntersectionHit<T>> raycast(Ray3D ray) {
        return raycast(ray, ray.maxDistance());
    }

    /**
     * Items hit by the ray within the distance, nearest first
     */
    public List<IntersectionHit<T>> raycast(Ray3D ray, float maxDistance) {
        return raycast(ray, maxDistance, new RayHitComparator<>(config.getRayEpsilon()));
    }

    /**
     * Items whose bounding surface the ray crosses within the distance, ordered by the comparator
     */
    public List<IntersectionHit<T>> raycast(Ray3D ray, float maxDistance,
                                            Comparator<? super IntersectionHit<T>> comparator) {
        checkCreated();
        return new RayTracingSearch<>(this).raycast(ray, maxDistance, comparator);
    }

    /**
     * Batched {@link #raycast(Ray3D, float)}, one task per ray
     *
     * @return future completing with the sorted hits of each ray, in ray order
     */
    public CompletableFuture<List<List<IntersectionHit<T>>>> raycastAll(List<Ray3D> rays, float maxDistance) {
        checkCreated();
        return batch.map(rays, ray -> raycast(ray, maxDistance));
    }

    /**
     * Items whose bounds satisfy the region test
     */
    public List<T> search(RegionTest<V> region) {
        checkCreated();
        var result = new ArrayList<T>();
        traverse(region, result::add);
        return result;
    }

    /**
     * Items overlapping the capsule swept by a moving sphere, in no particular order
     */
    public List<T> shapeCast(Capsule capsule) {
        return search(overlappingCapsule(capsule));
    }

    @Override
    public String toString() {
        if (!created) {
            return getClass().getSimpleName() + "[disposed]";
        }
        return getClass().getSimpleName() + "[items=" + slotsById.size() + ", nodes=" + nodes.activeCount()
        + ", leaves=" + leaves.size() + ", maxChildren=" + maxChildren + "]";
    }

    // ------------------------------------------------------------------------------------------------------------
    // Variant hooks

    /**
     * Bounds after the item bounds were appended to the list, which already holds the new slot
     */
    protected abstract V appended(int list, V current, V added);

    protected abstract Box boundingBox(V bounds);

    protected abstract float centerDistanceSquared(V a, V b);

    protected abstract float centerDistanceSquared(V bounds, float x, float y, float z);

    protected abstract RegionTest<V> containedIn(Box region);

    protected abstract RegionTest<V> containedInRadius(Point3f center, float radius);

    /**
     * Cost minimized by the grandchild trick
     */
    protected abstract float cost(V bounds);

    /**
     * Whether the outer bounds cover the inner, allowing for rounding
     */
    protected abstract boolean covers(V outer, V inner);

    protected abstract V emptyBounds();

    /**
     * Distance metric ranking an item within its leaf for leaf swaps: how far the item reaches from the leaf's center
     */
    protected abstract float extent(V leafBounds, V itemBounds);

    /**
     * Tight bounds of the list's items
     */
    protected abstract V fit(int list);

    /**
     * Leaf bounds extended to cover the item bounds, or the same instance when already covered
     */
    protected abstract V grow(V leafBounds, V itemBounds);

    protected abstract RegionTest<V> inFrustum(Frustum3D frustum);

    protected abstract Point3f[] intersections(V bounds, LineSegment3D segment);

    protected abstract float minDistanceSquared(V bounds, float x, float y, float z);

    protected abstract boolean overlaps(V a, V b);

    protected abstract RegionTest<V> overlapping(Box region);

    protected abstract RegionTest<V> overlappingCapsule(Capsule capsule);

    protected abstract RegionTest<V> overlappingRadius(Point3f center, float radius);

    /**
     * Reorder the slots of an overflowing leaf into two groups
     *
     * @param slots      the item slots, reordered in place
     * @param count      number of slots
     * @param nodeBounds bounds of the overflowing leaf
     * @return size of the first group, between 1 and count - 1
     */
    protected abstract int partition(int[] slots, int count, V nodeBounds);

    protected abstract boolean segmentOverlaps(V bounds, LineSegment3D segment);

    /**
     * Whether a leaf should take the item from an overlapping leaf
     */
    protected abstract boolean shouldSteal(V thief, V victim, V item);

    protected final int childCount(int list) {
        return childrenBuffer.size(list);
    }

    protected final V childBounds(int list, int position) {
        return itemBounds(childrenBuffer.get(list, position));
    }

    protected final V itemBounds(int slot) {
        return item(slot).getBounds();
    }

    // ------------------------------------------------------------------------------------------------------------
    // Internals

    @SuppressWarnings("unchecked")
    T item(int slot) {
        return (T) items[slot];
    }

    /**
     * Collect matches for the region. Children wholly inside the region are collected without per item tests.
     */
    void traverse(RegionTest<V> region, Consumer<T> sink) {
        if (slotsById.isEmpty()) {
            return;
        }
        var stack = new IntArrayList();
        stack.addInt(ROOT);
        while (!stack.isEmpty()) {
            int node = stack.removeLast();
            if (nodes.isLeaf(node)) {
                int list = nodes.children(node);
                for (int i = 0; i < childrenBuffer.size(list); i++) {
                    int slot = childrenBuffer.get(list, i);
                    T item = item(slot);
                    if (region.matches(item.getBounds())) {
                        sink.accept(item);
                    }
                }
                continue;
            }
            classifyChild(nodes.left(node), region, stack, sink);
            classifyChild(nodes.right(node), region, stack, sink);
        }
    }

    private void afterMutation() {
        if (config.isConsistencyChecking()) {
            checkConsistency();
        }
    }

    private int allocateSlot(T item) {
        int slot;
        if (!freeSlots.isEmpty()) {
            slot = freeSlots.removeLast();
        } else {
            if (slotHigh == items.length) {
                int size = items.length + (items.length >> 1) + 1;
                items = Arrays.copyOf(items, size);
                leafOfSlot = Arrays.copyOf(leafOfSlot, size);
            }
            slot = slotHigh++;
        }
        items[slot] = item;
        slotsById.put(item.getId(), slot);
        return slot;
    }

    /**
     * Point every slot of the list at the leaf
     */
    private void assign(int list, int leaf) {
        for (int i = 0; i < childrenBuffer.size(list); i++) {
            leafOfSlot[childrenBuffer.get(list, i)] = leaf;
        }
    }

    private void checkCreated() {
        if (!created) {
            throw new IllegalStateException(getClass().getSimpleName() + " has been disposed");
        }
    }

    private void checkRadii(List<Point3f> centers, float[] radii) {
        if (centers.size() != radii.length) {
            throw new IllegalArgumentException(centers.size() + " centers but " + radii.length + " radii");
        }
    }

    /**
     * Descend from the root to a leaf, at each internal node taking the child whose center is nearer the item's
     */
    private int chooseLeaf(V bounds) {
        int node = ROOT;
        while (!nodes.isLeaf(node)) {
            int l = nodes.left(node);
            int r = nodes.right(node);
            node = centerDistanceSquared(nodes.bounds(l), bounds) <= centerDistanceSquared(nodes.bounds(r), bounds) ? l
                                                                                                                    : r;
        }
        return node;
    }

    private int chunkSize(int work) {
        int workers = Math.max(1, Runtime.getRuntime().availableProcessors());
        return Math.max(1, work / (workers * 4));
    }

    private void classifyChild(int child, RegionTest<V> region, IntArrayList stack, Consumer<T> sink) {
        switch (region.classify(nodes.bounds(child))) {
            case INSIDE -> collectSubtree(child, sink);
            case INTERSECTS -> stack.addInt(child);
            case OUTSIDE -> {
            }
        }
    }

    /**
     * The leaf is empty and its sibling internal: the sibling takes over the parent's slot
     */
    private void collapse(int parent, int leaf, int sibling) {
        childrenBuffer.release(nodes.children(leaf));
        leaves.remove(leaf);

        int l = nodes.left(sibling);
        int r = nodes.right(sibling);
        nodes.setLeft(parent, l);
        nodes.setRight(parent, r);
        nodes.setBounds(parent, nodes.bounds(sibling));
        nodes.setParent(l, parent);
        nodes.setParent(r, parent);

        log.trace("Collapsed empty leaf {}, sibling {} promoted into {}", leaf, sibling, parent);
        parent = releaseNodes(leaf, sibling, parent);
        propagateUp(parent);
    }

    private void collectSubtree(int root, Consumer<T> sink) {
        var stack = new IntArrayList();
        stack.addInt(root);
        while (!stack.isEmpty()) {
            int node = stack.removeLast();
            if (nodes.isLeaf(node)) {
                int list = nodes.children(node);
                for (int i = 0; i < childrenBuffer.size(list); i++) {
                    sink.accept(item(childrenBuffer.get(list, i)));
                }
            } else {
                stack.addInt(nodes.left(node));
                stack.addInt(nodes.right(node));
            }
        }
    }

    private void detach(int leaf, int slot) {
        int list = nodes.children(leaf);
        int position = childrenBuffer.indexOf(list, slot);
        assert position >= 0 : "Slot " + slot + " not in leaf " + leaf;
        childrenBuffer.removeAtSwapBack(list, position);
    }

    /**
     * Try re-pairing the node with one of its uncle's children, or, when the uncle is a leaf, with the uncle itself
     */
    private boolean grandchildTrick(int node) {
        int p0 = nodes.parent(node);
        if (p0 <= ROOT) {
            return false;
        }
        int g = nodes.parent(p0);
        int s0 = nodes.sibling(node);
        int p1 = nodes.sibling(p0);
        V nodeBounds = nodes.bounds(node);
        float current = cost(nodes.bounds(p0)) + cost(nodes.bounds(p1));

        if (!nodes.isLeaf(p1)) {
            int s1 = nodes.left(p1);
            int s2 = nodes.right(p1);

            V near = union(nodeBounds, nodes.bounds(s1));
            V far = union(nodes.bounds(s0), nodes.bounds(s2));
            if (cost(near) + cost(far) < current) {
                rotate(node, s1, p0, s0, s2, p1, near, far);
                return true;
            }
            near = union(nodeBounds, nodes.bounds(s2));
            far = union(nodes.bounds(s0), nodes.bounds(s1));
            if (cost(near) + cost(far) < current) {
                rotate(node, s2, p0, s0, s1, p1, near, far);
                return true;
            }
            return false;
        }

        // The uncle is a leaf: hang it beside the node and lift the sibling
        V merged = union(nodeBounds, nodes.bounds(p1));
        if (cost(nodes.bounds(s0)) + cost(merged) < current) {
            nodes.setLeft(p0, node);
            nodes.setRight(p0, p1);
            nodes.setBounds(p0, merged);
            nodes.setParent(p1, p0);
            nodes.setLeft(g, p0);
            nodes.setRight(g, s0);
            nodes.setParent(s0, g);
            log.trace("Rotated node {} beside leaf uncle {}", node, p1);
            propagateUp(p0);
            return true;
        }
        return false;
    }

    /**
     * Nodes are pruned by their bounding box projected onto the plane; items match by their projected center
     */
    private RegionTest<V> inPolygon(Polygon2D polygon, CardinalPlane plane) {
        return RegionTest.of(nodeBounds -> {
            Box box = boundingBox(nodeBounds);
            float u0 = plane.u(box.minX(), box.minY(), box.minZ());
            float v0 = plane.v(box.minX(), box.minY(), box.minZ());
            float u1 = plane.u(box.maxX(), box.maxY(), box.maxZ());
            float v1 = plane.v(box.maxX(), box.maxY(), box.maxZ());
            return polygon.boundsOverlap(u0, v0, u1, v1) ? Containment.INTERSECTS : Containment.OUTSIDE;
        }, itemBounds -> {
            Box box = boundingBox(itemBounds);
            float cx = box.centerX();
            float cy = box.centerY();
            float cz = box.centerZ();
            return polygon.containsPoint(plane.u(cx, cy, cz), plane.v(cx, cy, cz));
        });
    }

    private List<Integer> indices(int count) {
        return IntStream.range(0, count).boxed().collect(Collectors.toList());
    }

    private void initializeRoot() {
        int root = nodes.allocate(NONE, NONE, NONE, childrenBuffer.allocate(), emptyBounds());
        assert root == ROOT;
        leaves.add(ROOT);
    }

    /**
     * Sample two leaves' items and move and exchange them so each leaf's items reach less far from its center
     */
    private boolean leafSwap(int a, int b) {
        refit(a);
        refit(b);
        boolean improved = false;
        if (overlaps(nodes.bounds(a), nodes.bounds(b))) {
            improved = steal(a, b);
            refit(a);
            refit(b);
            improved |= swapItems(a, b);
            refit(a);
            refit(b);
        }
        propagateUp(a);
        propagateUp(b);
        return improved;
    }

    /**
     * The sibling leaves fit in one: the parent becomes a leaf holding both lists' items
     */
    private void merge(int parent, int leaf, int sibling) {
        int keep = nodes.children(leaf);
        int other = nodes.children(sibling);
        for (int i = 0; i < childrenBuffer.size(other); i++) {
            childrenBuffer.add(keep, childrenBuffer.get(other, i));
        }
        childrenBuffer.release(other);
        leaves.remove(leaf);
        leaves.remove(sibling);

        nodes.setChildren(parent, keep);
        nodes.setLeft(parent, NONE);
        nodes.setRight(parent, NONE);
        boolean empty = childrenBuffer.size(keep) == 0;
        nodes.setBounds(parent, empty ? emptyBounds() : fit(keep));
        leaves.add(parent);
        assign(keep, parent);

        log.trace("Merged leaves {} and {} into {}", leaf, sibling, parent);
        parent = releaseNodes(leaf, sibling, parent);
        if (empty) {
            // Both leaves emptied by a batched removal
            rebalance(parent);
        } else {
            propagateUp(parent);
        }
    }

    /**
     * Recompute ancestor bounds as the union of their children, stopping at the first unchanged ancestor
     */
    private void propagateUp(int node) {
        int p = nodes.parent(node);
        while (p != NONE) {
            V combined = union(nodes.bounds(nodes.left(p)), nodes.bounds(nodes.right(p)));
            if (combined.equals(nodes.bounds(p))) {
                break;
            }
            nodes.setBounds(p, combined);
            p = nodes.parent(p);
        }
    }

    /**
     * Structural repair of a leaf that lost items: merge with a leaf sibling that fits, collapse when empty beside an
     * internal sibling, otherwise refit in place
     */
    private void rebalance(int leaf) {
        int list = nodes.children(leaf);
        int count = childrenBuffer.size(list);
        int parent = nodes.parent(leaf);
        if (parent == NONE) {
            nodes.setBounds(leaf, count == 0 ? emptyBounds() : fit(list));
            return;
        }
        int sibling = nodes.sibling(leaf);
        if (nodes.isLeaf(sibling) && count + childrenBuffer.size(nodes.children(sibling)) <= maxChildren) {
            merge(parent, leaf, sibling);
        } else if (count == 0) {
            collapse(parent, leaf, sibling);
        } else {
            nodes.setBounds(leaf, fit(list));
            propagateUp(leaf);
        }
    }

    private void refit(int leaf) {
        int list = nodes.children(leaf);
        if (childrenBuffer.size(list) > 0) {
            nodes.setBounds(leaf, fit(list));
        }
    }

    /**
     * Release two nodes, larger index first so the second index stays valid
     *
     * @return the index the held node now occupies
     */
    private int releaseNodes(int a, int b, int held) {
        int moved = removeNode(Math.max(a, b));
        if (moved == held) {
            held = Math.max(a, b);
        }
        moved = removeNode(Math.min(a, b));
        if (moved == held) {
            held = Math.min(a, b);
        }
        return held;
    }

    private void releaseSlot(int slot) {
        items[slot] = null;
        leafOfSlot[slot] = NONE;
        freeSlots.addInt(slot);
    }

    /**
     * Free the node by moving the last active node into its slot and patching the moved node's parent, children,
     * leaf set entry and item index
     *
     * @return the former index of the moved node, or NONE when the freed node was last
     */
    private int removeNode(int index) {
        int last = nodes.activeCount() - 1;
        assert index > ROOT && index <= last : "Cannot free node " + index + " of " + (last + 1);
        if (pending != null) {
            pending.clear(index);
        }
        if (index == last) {
            nodes.truncate();
            return NONE;
        }
        nodes.copy(last, index);
        int p = nodes.parent(index);
        if (nodes.left(p) == last) {
            nodes.setLeft(p, index);
        } else if (nodes.right(p) == last) {
            nodes.setRight(p, index);
        }
        if (nodes.isLeaf(index)) {
            leaves.replace(last, index);
            assign(nodes.children(index), index);
        } else {
            nodes.setParent(nodes.left(index), index);
            nodes.setParent(nodes.right(index), index);
        }
        if (pending != null && pending.get(last)) {
            pending.clear(last);
            pending.set(index);
        }
        nodes.truncate();
        log.trace("Compacted node {} into {}", last, index);
        return last;
    }

    /**
     * Make p0 the parent of the node and its new partner, and p1 the parent of the node's old sibling and the
     * remaining child
     */
    private void rotate(int node, int partner, int p0, int s0, int other, int p1, V p0Bounds, V p1Bounds) {
        nodes.setLeft(p0, node);
        nodes.setRight(p0, partner);
        nodes.setBounds(p0, p0Bounds);
        nodes.setParent(partner, p0);

        nodes.setLeft(p1, s0);
        nodes.setRight(p1, other);
        nodes.setBounds(p1, p1Bounds);
        nodes.setParent(s0, p1);

        log.trace("Rotated node {} to pair with {}", node, partner);
        propagateUp(p0);
    }

    private void sortByDistance(float[] distances, int[] positions) {
        for (int i = 1; i < distances.length; i++) {
            float d = distances[i];
            int p = positions[i];
            int j = i - 1;
            while (j >= 0 && distances[j] > d) {
                distances[j + 1] = distances[j];
                positions[j + 1] = positions[j];
                j--;
            }
            distances[j + 1] = d;
            positions[j + 1] = p;
        }
    }

    /**
     * Split a full leaf receiving one more slot. The leaf becomes internal over two new leaves.
     */
    private void split(int leaf, int slot) {
        int list = nodes.children(leaf);
        int count = childrenBuffer.size(list);
        int[] group = new int[count + 1];
        childrenBuffer.copyTo(list, group, 0);
        group[count] = slot;

        int half = partition(group, count + 1, nodes.bounds(leaf));
        assert half > 0 && half <= count : "Degenerate split of " + (count + 1) + " at " + half;

        childrenBuffer.release(list);
        int leftList = childrenBuffer.allocate();
        for (int i = 0; i < half; i++) {
            childrenBuffer.add(leftList, group[i]);
        }
        int rightList = childrenBuffer.allocate();
        for (int i = half; i <= count; i++) {
            childrenBuffer.add(rightList, group[i]);
        }
        V leftBounds = fit(leftList);
        V rightBounds = fit(rightList);

        int leftNode = nodes.allocate(leaf, NONE, NONE, leftList, leftBounds);
        int rightNode = nodes.allocate(leaf, NONE, NONE, rightList, rightBounds);
        assign(leftList, leftNode);
        assign(rightList, rightNode);
        leaves.remove(leaf);
        leaves.add(leftNode);
        leaves.add(rightNode);

        nodes.setChildren(leaf, NONE);
        nodes.setLeft(leaf, leftNode);
        nodes.setRight(leaf, rightNode);
        nodes.setBounds(leaf, union(leftBounds, rightBounds));
        log.trace("Split leaf {} into {} ({}) and {} ({})", leaf, leftNode, half, rightNode, count + 1 - half);
        propagateUp(leaf);
    }

    /**
     * Move items from the victim to the thief while the thief has room and the victim keeps more than two
     */
    private boolean steal(int thief, int victim) {
        int thiefList = nodes.children(thief);
        int victimList = nodes.children(victim);
        V thiefBounds = nodes.bounds(thief);
        V victimBounds = nodes.bounds(victim);
        boolean stole = false;
        int i = 0;
        while (childrenBuffer.size(thiefList) < maxChildren && childrenBuffer.size(victimList) > 2
        && i < childrenBuffer.size(victimList)) {
            int slot = childrenBuffer.get(victimList, i);
            if (shouldSteal(thiefBounds, victimBounds, itemBounds(slot))) {
                childrenBuffer.removeAtSwapBack(victimList, i);
                childrenBuffer.add(thiefList, slot);
                leafOfSlot[slot] = thief;
                stole = true;
            } else {
                i++;
            }
        }
        return stole;
    }

    /**
     * Exchange items between the leaves, farthest reaching first, while an exchange lowers the summed extents
     */
    private boolean swapItems(int a, int b) {
        int listA = nodes.children(a);
        int listB = nodes.children(b);
        int countA = childrenBuffer.size(listA);
        int countB = childrenBuffer.size(listB);
        if (countA < 2 || countB < 2) {
            return false;
        }
        V boundsA = nodes.bounds(a);
        V boundsB = nodes.bounds(b);

        float[] distA = new float[countA];
        int[] posA = new int[countA];
        for (int i = 0; i < countA; i++) {
            distA[i] = extent(boundsA, childBounds(listA, i));
            posA[i] = i;
        }
        float[] distB = new float[countB];
        int[] posB = new int[countB];
        for (int i = 0; i < countB; i++) {
            distB[i] = extent(boundsB, childBounds(listB, i));
            posB[i] = i;
        }
        sortByDistance(distA, posA);
        sortByDistance(distB, posB);

        boolean swappedAny = false;
        for (int i = countA - 1; i >= 0; i--) {
            int slotA = childrenBuffer.get(listA, posA[i]);
            V itemA = itemBounds(slotA);
            boolean swapped = false;
            for (int j = countB - 1; j >= 0; j--) {
                int slotB = childrenBuffer.get(listB, posB[j]);
                V itemB = itemBounds(slotB);
                float swapA = extent(boundsA, itemB);
                float swapB = extent(boundsB, itemA);
                if (swapA + swapB < distA[i] + distB[j]) {
                    childrenBuffer.set(listA, posA[i], slotB);
                    childrenBuffer.set(listB, posB[j], slotA);
                    leafOfSlot[slotB] = a;
                    leafOfSlot[slotA] = b;
                    distA[i] = swapA;
                    distB[j] = swapB;
                    sortByDistance(distA, posA);
                    sortByDistance(distB, posB);
                    swapped = true;
                    swappedAny = true;
                    break;
                }
            }
            if (!swapped) {
                break;
            }
        }
        return swappedAny;
    }

    /**
     * Bounds covering both
     */
    protected abstract V union(V a, V b);
}
