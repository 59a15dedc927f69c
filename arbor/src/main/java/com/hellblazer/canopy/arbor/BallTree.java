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
import com.hellblazer.canopy.geometry.StatisticsUtil;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

/**
 * Bounding volume hierarchy over spheres. Leaf spheres are centered on the centroid of their items; overflowing leaves
 * are split at the median of the item centers projected onto their principal axis. Computed spheres are grown by a
 * small relative slack so that float rounding never leaves an item poking out of its node.
 *
 * @param <ID> the identity type
 * @param <T>  the item type
 * @author hal.hildebrand
 */
public class BallTree<ID extends EntityID, T extends Bounded<ID, Sphere>> extends AbstractStarTree<ID, T, Sphere> {

    static final         Sphere EMPTY          = new Sphere(0f, 0f, 0f, -1f);
    private static final float  RELATIVE_SLACK = 1e-6f;

    public BallTree() {
        this(TreeConfig.defaultConfig());
    }

    public BallTree(int capacity) {
        this(TreeConfig.defaultConfig().withInitialCapacity(capacity));
    }

    public BallTree(int capacity, int maxChildren) {
        this(TreeConfig.defaultConfig().withInitialCapacity(capacity).withMaxChildren(maxChildren));
    }

    public BallTree(TreeConfig config) {
        super(config);
    }

    private static float slack(Sphere sphere) {
        float magnitude = Math.max(Math.abs(sphere.x()), Math.max(Math.abs(sphere.y()), Math.abs(sphere.z())));
        return RELATIVE_SLACK * (1f + Math.max(0f, sphere.radius()) + magnitude);
    }

    private static Sphere slackened(Sphere sphere) {
        return sphere.inflate(slack(sphere));
    }

    /**
     * Running centroid: the previous center weighted by the earlier item count, plus the new item's center
     */
    @Override
    protected Sphere appended(int list, Sphere current, Sphere added) {
        int count = childCount(list);
        if (count == 1 || current.isEmpty()) {
            return added;
        }
        float cx = (current.x() * (count - 1) + added.x()) / count;
        float cy = (current.y() * (count - 1) + added.y()) / count;
        float cz = (current.z() * (count - 1) + added.z()) / count;
        return enclosingAbout(list, cx, cy, cz);
    }

    @Override
    protected Box boundingBox(Sphere bounds) {
        return bounds.toBox();
    }

    @Override
    protected float centerDistanceSquared(Sphere a, Sphere b) {
        return a.centerDistanceSquared(b);
    }

    @Override
    protected float centerDistanceSquared(Sphere bounds, float x, float y, float z) {
        return bounds.distanceSquared(x, y, z);
    }

    @Override
    protected RegionTest<Sphere> containedIn(Box region) {
        return RegionTest.of(node -> classify(region, node), item -> ShapeOverlap.boxContainsSphere(region, item));
    }

    @Override
    protected RegionTest<Sphere> containedInRadius(Point3f center, float radius) {
        var query = Sphere.of(center, radius);
        return RegionTest.of(node -> classify(query, node), query::contains);
    }

    @Override
    protected float cost(Sphere bounds) {
        return bounds.radiusSquared();
    }

    @Override
    protected boolean covers(Sphere outer, Sphere inner) {
        if (inner.isEmpty()) {
            return true;
        }
        if (outer.isEmpty()) {
            return false;
        }
        float d = (float) Math.sqrt(outer.centerDistanceSquared(inner));
        return d + inner.radius() <= outer.radius() + slack(outer);
    }

    @Override
    protected Sphere emptyBounds() {
        return EMPTY;
    }

    /**
     * Squared distance from the leaf center to the far side of the item
     */
    @Override
    protected float extent(Sphere leafBounds, Sphere itemBounds) {
        float reach = itemBounds.maxDistance(leafBounds.x(), leafBounds.y(), leafBounds.z());
        return reach * reach;
    }

    @Override
    protected Sphere fit(int list) {
        int count = childCount(list);
        if (count == 0) {
            return EMPTY;
        }
        float cx = 0f;
        float cy = 0f;
        float cz = 0f;
        for (int i = 0; i < count; i++) {
            Sphere child = childBounds(list, i);
            cx += child.x();
            cy += child.y();
            cz += child.z();
        }
        return enclosingAbout(list, cx / count, cy / count, cz / count);
    }

    /**
     * Keeps the center, growing the radius to reach the far side of the item
     */
    @Override
    protected Sphere grow(Sphere leafBounds, Sphere itemBounds) {
        if (itemBounds.isEmpty()) {
            return leafBounds;
        }
        if (leafBounds.isEmpty()) {
            return itemBounds;
        }
        // Exact containment: a leaf wholly inside a query region reports its items untested
        if (leafBounds.contains(itemBounds)) {
            return leafBounds;
        }
        float reach = itemBounds.maxDistance(leafBounds.x(), leafBounds.y(), leafBounds.z());
        return slackened(new Sphere(leafBounds.x(), leafBounds.y(), leafBounds.z(), reach));
    }

    @Override
    protected RegionTest<Sphere> inFrustum(Frustum3D frustum) {
        return RegionTest.of(node -> {
            if (frustum.containsSphere(node)) {
                return Containment.INSIDE;
            }
            return frustum.intersectsSphere(node) ? Containment.INTERSECTS : Containment.OUTSIDE;
        }, frustum::intersectsSphere);
    }

    @Override
    protected Point3f[] intersections(Sphere bounds, LineSegment3D segment) {
        return ShapeIntersection.segmentSphereIntersections(segment, bounds);
    }

    @Override
    protected float minDistanceSquared(Sphere bounds, float x, float y, float z) {
        return bounds.minDistanceSquared(x, y, z);
    }

    @Override
    protected boolean overlaps(Sphere a, Sphere b) {
        return a.overlaps(b);
    }

    @Override
    protected RegionTest<Sphere> overlapping(Box region) {
        return RegionTest.of(node -> classify(region, node), item -> ShapeOverlap.boxOverlapsSphere(region, item));
    }

    @Override
    protected RegionTest<Sphere> overlappingCapsule(Capsule capsule) {
        return RegionTest.of(node -> {
            if (ShapeOverlap.capsuleContainsSphere(capsule, node)) {
                return Containment.INSIDE;
            }
            return ShapeOverlap.capsuleOverlapsSphere(capsule, node) ? Containment.INTERSECTS : Containment.OUTSIDE;
        }, item -> ShapeOverlap.capsuleOverlapsSphere(capsule, item));
    }

    @Override
    protected RegionTest<Sphere> overlappingRadius(Point3f center, float radius) {
        var query = Sphere.of(center, radius);
        return RegionTest.of(node -> classify(query, node), query::overlaps);
    }

    /**
     * Sort the item centers by their projection onto the principal axis through the node center and cut at the median
     */
    @Override
    protected int partition(int[] slots, int count, Sphere nodeBounds) {
        float[] xs = new float[count];
        float[] ys = new float[count];
        float[] zs = new float[count];
        for (int i = 0; i < count; i++) {
            Sphere s = itemBounds(slots[i]);
            xs[i] = s.x();
            ys[i] = s.y();
            zs[i] = s.z();
        }
        Vector3f axis = StatisticsUtil.principalAxis(xs, ys, zs, count, nodeBounds.x(), nodeBounds.y(),
                                                     nodeBounds.z());
        float[] projections = new float[count];
        for (int i = 0; i < count; i++) {
            projections[i] = (xs[i] - nodeBounds.x()) * axis.x + (ys[i] - nodeBounds.y()) * axis.y
            + (zs[i] - nodeBounds.z()) * axis.z;
        }
        for (int i = 1; i < count; i++) {
            float p = projections[i];
            int slot = slots[i];
            int j = i - 1;
            while (j >= 0 && projections[j] > p) {
                projections[j + 1] = projections[j];
                slots[j + 1] = slots[j];
                j--;
            }
            projections[j + 1] = p;
            slots[j + 1] = slot;
        }
        return count / 2;
    }

    @Override
    protected boolean segmentOverlaps(Sphere bounds, LineSegment3D segment) {
        return ShapeOverlap.segmentOverlapsSphere(segment, bounds);
    }

    /**
     * The thief takes an item whose center lies within the victim's sphere and nearer the thief's center
     */
    @Override
    protected boolean shouldSteal(Sphere thief, Sphere victim, Sphere item) {
        float toThief = thief.distanceSquared(item.x(), item.y(), item.z());
        float toVictim = victim.distanceSquared(item.x(), item.y(), item.z());
        return toThief < victim.radiusSquared() && toThief < toVictim;
    }

    /**
     * Minimal sphere enclosing both
     */
    @Override
    protected Sphere union(Sphere a, Sphere b) {
        Sphere enclosing = a.enclose(b);
        if (enclosing == a || enclosing == b) {
            return enclosing;
        }
        return slackened(enclosing);
    }

    private Containment classify(Box region, Sphere node) {
        if (ShapeOverlap.boxContainsSphere(region, node)) {
            return Containment.INSIDE;
        }
        return ShapeOverlap.boxOverlapsSphere(region, node) ? Containment.INTERSECTS : Containment.OUTSIDE;
    }

    private Containment classify(Sphere query, Sphere node) {
        if (query.contains(node)) {
            return Containment.INSIDE;
        }
        return query.overlaps(node) ? Containment.INTERSECTS : Containment.OUTSIDE;
    }

    /**
     * Smallest sphere about the center reaching the far side of every item in the list
     */
    private Sphere enclosingAbout(int list, float cx, float cy, float cz) {
        float radius = 0f;
        for (int i = 0; i < childCount(list); i++) {
            radius = Math.max(radius, childBounds(list, i).maxDistance(cx, cy, cz));
        }
        return slackened(new Sphere(cx, cy, cz, radius));
    }
}
