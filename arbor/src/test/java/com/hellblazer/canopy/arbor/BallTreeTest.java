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

import com.hellblazer.canopy.arbor.entity.BoundedEntity;
import com.hellblazer.canopy.arbor.entity.LongEntityID;
import com.hellblazer.canopy.geometry.Box;
import com.hellblazer.canopy.geometry.Capsule;
import com.hellblazer.canopy.geometry.Frustum3D;
import com.hellblazer.canopy.geometry.LineSegment3D;
import com.hellblazer.canopy.geometry.Ray3D;
import com.hellblazer.canopy.geometry.ShapeIntersection;
import com.hellblazer.canopy.geometry.ShapeOverlap;
import com.hellblazer.canopy.geometry.Sphere;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BallTreeTest extends StarTreeContract<Sphere> {

    @Test
    public void testRangeOverSpheresInARow() {
        var tree = new BallTree<LongEntityID, BoundedEntity<LongEntityID, Sphere, Void>>(
        TreeConfig.deterministic(20).withMaxChildren(4));
        for (int i = 0; i < 20; i++) {
            tree.insert(BoundedEntity.of(LongEntityID.of(i), new Sphere(i, 0, 0, 0.5f)));
        }
        tree.checkConsistency();

        Set<Long> expected = LongStream.rangeClosed(0, 10).boxed().collect(Collectors.toSet());
        assertEquals(expected, ids(tree.getOverlapping(new Box(0, -1, -1, 10, 1, 1))));
        assertEquals(LongStream.rangeClosed(1, 9).boxed().collect(Collectors.toSet()),
                     ids(tree.getContainedIn(new Box(0, -1, -1, 10, 1, 1))));

        tree.optimize();
        tree.checkConsistency();
        assertEquals(expected, ids(tree.getOverlapping(new Box(0, -1, -1, 10, 1, 1))));
    }

    @Test
    public void testLeafSphereCentersOnItems() {
        var tree = new BallTree<LongEntityID, BoundedEntity<LongEntityID, Sphere, Void>>(
        TreeConfig.deterministic(4).withMaxChildren(8));
        tree.insert(BoundedEntity.of(LongEntityID.of(0), new Sphere(-4, 0, 0, 1)));
        assertEquals(new Sphere(-4, 0, 0, 1), tree.getRootBounds());

        tree.insert(BoundedEntity.of(LongEntityID.of(1), new Sphere(4, 0, 0, 1)));
        var root = tree.getRootBounds();
        assertEquals(0f, root.x(), 1e-5f);
        assertEquals(5f, root.radius(), 1e-4f);
        assertTrue(root.radius() >= 5f);

        tree.removeById(LongEntityID.of(0));
        assertEquals(4f, tree.getRootBounds().x(), 1e-5f);
        assertEquals(1f, tree.getRootBounds().radius(), 1e-4f);

        tree.removeById(LongEntityID.of(1));
        assertTrue(tree.getRootBounds().isEmpty());
    }

    @Test
    public void testSplitAlongPrincipalAxis() {
        var tree = new BallTree<LongEntityID, BoundedEntity<LongEntityID, Sphere, Void>>(
        TreeConfig.deterministic(6).withMaxChildren(6));
        // Points spread along the z axis
        for (int i = 0; i < 7; i++) {
            tree.insert(BoundedEntity.of(LongEntityID.of(i), new Sphere(0.01f * (i % 2), 0, i * 10, 0.5f)));
        }
        assertEquals(3, tree.nodeCount());
        var left = tree.getNode(tree.getNode(0).left()).bounds();
        var right = tree.getNode(tree.getNode(0).right()).bounds();
        assertTrue(Math.abs(left.z() - right.z()) > 25, left + " vs " + right);
        assertEquals(3, Math.min(tree.getNode(1).itemCount(), tree.getNode(2).itemCount()));
    }

    @Test
    public void testUpdateJustOutsideLeafKeepsContainmentExact() {
        var tree = new BallTree<LongEntityID, BoundedEntity<LongEntityID, Sphere, Void>>(
        TreeConfig.deterministic(2).withMaxChildren(2).withConsistencyChecking(true));
        var spheres = new ArrayList<Sphere>();
        for (int i = 0; i < 3; i++) {
            spheres.add(new Sphere(i * 10, 0, 0, 1));
            tree.insert(BoundedEntity.of(LongEntityID.of(i), spheres.get(i)));
        }
        Sphere leaf = null;
        for (int i = 0; i < tree.nodeCount(); i++) {
            var node = tree.getNode(i);
            if (node.isLeaf() && node.bounds().containsPoint(0, 0, 0)) {
                leaf = node.bounds();
            }
        }
        assertNotNull(leaf);

        // Grow item 0 a few float steps past the leaf surface
        float radius = 1f;
        while (leaf.contains(new Sphere(0, 0, 0, radius))) {
            radius = Math.nextUp(radius);
        }
        radius = Math.nextUp(radius);
        spheres.set(0, new Sphere(0, 0, 0, radius));
        assertTrue(tree.update(BoundedEntity.of(LongEntityID.of(0), spheres.get(0))));

        var expected = new HashSet<Long>();
        for (int i = 0; i < spheres.size(); i++) {
            if (leaf.contains(spheres.get(i))) {
                expected.add((long) i);
            }
        }
        assertFalse(expected.contains(0L));
        assertEquals(expected, ids(tree.getContainedInRadius(leaf.center(), leaf.radius())));
    }

    @Test
    public void testRaycastCrossesSurfaces() {
        var tree = new BallTree<LongEntityID, BoundedEntity<LongEntityID, Sphere, Void>>(
        TreeConfig.deterministic(9).withMaxChildren(3));
        for (int i = 0; i < 8; i++) {
            tree.insert(BoundedEntity.of(LongEntityID.of(i), new Sphere(0, i * 4, 0, 1)));
        }
        var hits = tree.raycast(new Ray3D(new Point3f(0, -10, 0), new Vector3f(0, 1, 0)), 100f);
        assertEquals(8, hits.size());
        for (int i = 0; i < 8; i++) {
            assertEquals(i, hits.get(i).item().getId().getValue());
            assertEquals(i * 4 - 1 + 10, hits.get(i).distance(), 1e-3f);
        }

        // Starting inside item 0 only its far surface is crossed
        var inside = tree.raycast(new Ray3D(new Point3f(0, 0, 0), new Vector3f(0, 1, 0)), 2f);
        assertEquals(1, inside.size());
        assertEquals(1, inside.get(0).hitPoints().size());
        assertEquals(1f, inside.get(0).distance(), 1e-4f);
    }

    @Override
    protected Point3f center(Sphere bounds) {
        return bounds.center();
    }

    @Override
    protected boolean containedIn(Box region, Sphere bounds) {
        return ShapeOverlap.boxContainsSphere(region, bounds);
    }

    @Override
    protected boolean containedInRadius(Sphere sphere, Sphere bounds) {
        return sphere.contains(bounds);
    }

    @Override
    protected Point3f[] crossings(Sphere bounds, LineSegment3D segment) {
        return ShapeIntersection.segmentSphereIntersections(segment, bounds);
    }

    @Override
    protected boolean inFrustum(Frustum3D frustum, Sphere bounds) {
        return frustum.intersectsSphere(bounds);
    }

    @Override
    protected AbstractStarTree<LongEntityID, BoundedEntity<LongEntityID, Sphere, Void>, Sphere> newTree(
    TreeConfig config) {
        return new BallTree<>(config);
    }

    @Override
    protected boolean overlaps(Box region, Sphere bounds) {
        return ShapeOverlap.boxOverlapsSphere(region, bounds);
    }

    @Override
    protected boolean overlapsCapsule(Capsule capsule, Sphere bounds) {
        return ShapeOverlap.capsuleOverlapsSphere(capsule, bounds);
    }

    @Override
    protected boolean overlapsRadius(Sphere sphere, Sphere bounds) {
        return sphere.overlaps(bounds);
    }

    @Override
    protected Sphere volumeAt(float x, float y, float z, float halfSize) {
        return new Sphere(x, y, z, halfSize);
    }
}
