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
import com.hellblazer.canopy.geometry.Box;
import com.hellblazer.canopy.geometry.Capsule;
import com.hellblazer.canopy.geometry.Frustum3D;
import com.hellblazer.canopy.geometry.LineSegment3D;
import com.hellblazer.canopy.geometry.ShapeIntersection;
import com.hellblazer.canopy.geometry.ShapeOverlap;
import com.hellblazer.canopy.geometry.Sphere;

import javax.vecmath.Point3f;

/**
 * Bounding volume hierarchy over axis-aligned boxes. Overflowing leaves are split with Guttman's quadratic algorithm,
 * and the optimizer's rotations minimize volume.
 *
 * @param <ID> the identity type
 * @param <T>  the item type
 * @author hal.hildebrand
 */
public class BoxTree<ID extends EntityID, T extends Bounded<ID, Box>> extends AbstractStarTree<ID, T, Box> {

    static final Box EMPTY = new Box(Float.POSITIVE_INFINITY, Float.POSITIVE_INFINITY, Float.POSITIVE_INFINITY,
                                     Float.NEGATIVE_INFINITY, Float.NEGATIVE_INFINITY, Float.NEGATIVE_INFINITY);

    public BoxTree() {
        this(TreeConfig.defaultConfig());
    }

    public BoxTree(int capacity) {
        this(TreeConfig.defaultConfig().withInitialCapacity(capacity));
    }

    public BoxTree(int capacity, int maxChildren) {
        this(TreeConfig.defaultConfig().withInitialCapacity(capacity).withMaxChildren(maxChildren));
    }

    public BoxTree(TreeConfig config) {
        super(config);
    }

    @Override
    protected Box appended(int list, Box current, Box added) {
        return current.union(added);
    }

    @Override
    protected Box boundingBox(Box bounds) {
        return bounds;
    }

    @Override
    protected float centerDistanceSquared(Box a, Box b) {
        return a.centerDistanceSquared(b);
    }

    @Override
    protected float centerDistanceSquared(Box bounds, float x, float y, float z) {
        return bounds.centerDistanceSquared(x, y, z);
    }

    @Override
    protected RegionTest<Box> containedIn(Box region) {
        return RegionTest.of(node -> classify(region, node), region::contains);
    }

    @Override
    protected RegionTest<Box> containedInRadius(Point3f center, float radius) {
        var sphere = Sphere.of(center, radius);
        return RegionTest.of(node -> classify(sphere, node), item -> ShapeOverlap.sphereContainsBox(sphere, item));
    }

    @Override
    protected float cost(Box bounds) {
        return bounds.volume();
    }

    @Override
    protected boolean covers(Box outer, Box inner) {
        return inner.isEmpty() || outer.contains(inner);
    }

    @Override
    protected Box emptyBounds() {
        return EMPTY;
    }

    @Override
    protected float extent(Box leafBounds, Box itemBounds) {
        return itemBounds.maxDistance(leafBounds.centerX(), leafBounds.centerY(), leafBounds.centerZ());
    }

    @Override
    protected Box fit(int list) {
        Box fitted = EMPTY;
        for (int i = 0; i < childCount(list); i++) {
            fitted = fitted.union(childBounds(list, i));
        }
        return fitted;
    }

    @Override
    protected Box grow(Box leafBounds, Box itemBounds) {
        return covers(leafBounds, itemBounds) ? leafBounds : leafBounds.union(itemBounds);
    }

    @Override
    protected RegionTest<Box> inFrustum(Frustum3D frustum) {
        return RegionTest.of(node -> {
            if (frustum.containsBox(node)) {
                return Containment.INSIDE;
            }
            return frustum.intersectsBox(node) ? Containment.INTERSECTS : Containment.OUTSIDE;
        }, frustum::intersectsBox);
    }

    @Override
    protected Point3f[] intersections(Box bounds, LineSegment3D segment) {
        return ShapeIntersection.segmentBoxIntersections(segment, bounds);
    }

    @Override
    protected float minDistanceSquared(Box bounds, float x, float y, float z) {
        return bounds.minDistanceSquared(x, y, z);
    }

    @Override
    protected boolean overlaps(Box a, Box b) {
        return a.overlaps(b);
    }

    @Override
    protected RegionTest<Box> overlapping(Box region) {
        return RegionTest.of(node -> classify(region, node), region::overlaps);
    }

    @Override
    protected RegionTest<Box> overlappingCapsule(Capsule capsule) {
        return RegionTest.of(node -> {
            if (ShapeOverlap.capsuleContainsBox(capsule, node)) {
                return Containment.INSIDE;
            }
            return ShapeOverlap.capsuleOverlapsBox(capsule, node) ? Containment.INTERSECTS : Containment.OUTSIDE;
        }, item -> ShapeOverlap.capsuleOverlapsBox(capsule, item));
    }

    @Override
    protected RegionTest<Box> overlappingRadius(Point3f center, float radius) {
        var sphere = Sphere.of(center, radius);
        return RegionTest.of(node -> classify(sphere, node), item -> ShapeOverlap.boxOverlapsSphere(item, sphere));
    }

    /**
     * Guttman's quadratic split. The seeds are the pair wasting the most volume when combined; each remaining item goes
     * to the group whose volume it increases less, taking first the item with the strongest preference. A group that
     * could only reach a third of the items by taking every remaining one takes them all.
     */
    @Override
    protected int partition(int[] slots, int count, Box nodeBounds) {
        Box[] bounds = new Box[count];
        for (int i = 0; i < count; i++) {
            bounds[i] = itemBounds(slots[i]);
        }

        int seedA = 0;
        int seedB = 1;
        float worst = Float.NEGATIVE_INFINITY;
        for (int i = 0; i < count; i++) {
            float volumeA = bounds[i].volume();
            for (int j = i + 1; j < count; j++) {
                float waste = bounds[i].union(bounds[j]).volume() - volumeA - bounds[j].volume()
                + bounds[i].overlapVolume(bounds[j]);
                if (waste > worst) {
                    worst = waste;
                    seedA = i;
                    seedB = j;
                }
            }
        }

        int minFill = Math.max(1, count / 3);
        boolean[] assigned = new boolean[count];
        boolean[] inA = new boolean[count];
        assigned[seedA] = true;
        assigned[seedB] = true;
        inA[seedA] = true;
        Box groupA = bounds[seedA];
        Box groupB = bounds[seedB];
        int countA = 1;
        int countB = 1;
        int remaining = count - 2;

        while (remaining > 0) {
            if (countA + remaining <= minFill || countB + remaining <= minFill) {
                boolean toA = countA + remaining <= minFill;
                for (int i = 0; i < count; i++) {
                    if (!assigned[i]) {
                        assigned[i] = true;
                        inA[i] = toA;
                    }
                }
                if (toA) {
                    countA += remaining;
                } else {
                    countB += remaining;
                }
                break;
            }

            int next = -1;
            float strongest = Float.NEGATIVE_INFINITY;
            for (int i = 0; i < count; i++) {
                if (!assigned[i]) {
                    float preference = Math.abs(increase(groupA, bounds[i]) - increase(groupB, bounds[i]));
                    if (preference > strongest) {
                        strongest = preference;
                        next = i;
                    }
                }
            }
            assigned[next] = true;
            remaining--;
            if (increase(groupA, bounds[next]) < increase(groupB, bounds[next])) {
                inA[next] = true;
                groupA = groupA.union(bounds[next]);
                countA++;
            } else {
                groupB = groupB.union(bounds[next]);
                countB++;
            }
        }

        int[] original = slots.clone();
        int a = 0;
        int b = countA;
        for (int i = 0; i < count; i++) {
            if (inA[i]) {
                slots[a++] = original[i];
            } else {
                slots[b++] = original[i];
            }
        }
        return countA;
    }

    @Override
    protected boolean segmentOverlaps(Box bounds, LineSegment3D segment) {
        return ShapeOverlap.segmentOverlapsBox(segment, bounds);
    }

    /**
     * The thief takes an item its bounds already cover whose center is nearer the thief's center
     */
    @Override
    protected boolean shouldSteal(Box thief, Box victim, Box item) {
        if (!thief.contains(item)) {
            return false;
        }
        float cx = item.centerX();
        float cy = item.centerY();
        float cz = item.centerZ();
        return thief.centerDistanceSquared(cx, cy, cz) < victim.centerDistanceSquared(cx, cy, cz);
    }

    @Override
    protected Box union(Box a, Box b) {
        return a.union(b);
    }

    private Containment classify(Box region, Box node) {
        if (region.contains(node)) {
            return Containment.INSIDE;
        }
        return region.overlaps(node) ? Containment.INTERSECTS : Containment.OUTSIDE;
    }

    private Containment classify(Sphere sphere, Box node) {
        if (ShapeOverlap.sphereContainsBox(sphere, node)) {
            return Containment.INSIDE;
        }
        return ShapeOverlap.boxOverlapsSphere(node, sphere) ? Containment.INTERSECTS : Containment.OUTSIDE;
    }

    /**
     * Volume the group wastes by taking the item
     */
    private float increase(Box group, Box item) {
        return group.union(item).volume() - group.volume() - item.volume() + group.overlapVolume(item);
    }
}
