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
import com.hellblazer.canopy.arbor.entity.EntityIDGenerator;
import com.hellblazer.canopy.arbor.entity.LongEntityID;
import com.hellblazer.canopy.arbor.entity.SequentialLongIDGenerator;
import com.hellblazer.canopy.arbor.entity.UUIDEntityID;
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
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BoxTreeTest extends StarTreeContract<Box> {

    @Test
    public void testConvenienceConstructors() {
        try (var tree = new BoxTree<LongEntityID, BoundedEntity<LongEntityID, Box, Void>>(64, 6)) {
            assertEquals(6, tree.getMaxChildren());
            assertTrue(tree.isEmpty());
        }
        try (var tree = new BoxTree<LongEntityID, BoundedEntity<LongEntityID, Box, Void>>(64)) {
            assertEquals(TreeConfig.DEFAULT_MAX_CHILDREN, tree.getMaxChildren());
        }
        assertThrows(IllegalArgumentException.class,
                     () -> new BoxTree<LongEntityID, BoundedEntity<LongEntityID, Box, Void>>(64, 31));
        assertThrows(IllegalArgumentException.class,
                     () -> new BoxTree<LongEntityID, BoundedEntity<LongEntityID, Box, Void>>(-1));
    }

    @Test
    public void testGeneratedIdentities() {
        EntityIDGenerator<LongEntityID> generator = new SequentialLongIDGenerator(1000);
        var tree = new BoxTree<LongEntityID, BoundedEntity<LongEntityID, Box, String>>(
        TreeConfig.deterministic(5).withMaxChildren(4).withConsistencyChecking(true));
        var inserted = new ArrayList<BoundedEntity<LongEntityID, Box, String>>();
        for (int i = 0; i < 12; i++) {
            var item = new BoundedEntity<>(generator.generateID(), new Box(i, 0, 0, i + 0.5f, 1, 1), "box-" + i);
            inserted.add(item);
            assertTrue(tree.insert(item));
        }
        assertEquals(12, tree.size());
        var fifth = inserted.get(5);
        assertEquals(1005L, fifth.getId().getValue());
        assertEquals("box-5", tree.get(fifth.getId()).orElseThrow().getPayload());
        assertTrue(tree.removeById(fifth.getId()));
        assertFalse(tree.contains(fifth.getId()));

        generator.reset();
        // A regenerated identity replaces nothing: the first id is still held by its item
        var duplicate = new BoundedEntity<>(generator.generateID(), new Box(50, 50, 50, 51, 51, 51), "dup");
        assertFalse(tree.insert(duplicate));
        assertEquals("box-0", tree.get(duplicate.getId()).orElseThrow().getPayload());
        assertEquals(11, tree.size());
    }

    @Test
    public void testUuidIdentities() {
        var tree = new BoxTree<UUIDEntityID, BoundedEntity<UUIDEntityID, Box, Void>>(
        TreeConfig.deterministic(6).withMaxChildren(3).withConsistencyChecking(true));
        var items = new ArrayList<BoundedEntity<UUIDEntityID, Box, Void>>();
        for (int i = 0; i < 10; i++) {
            var item = BoundedEntity.of(UUIDEntityID.random(), new Box(0, i, 0, 1, i + 0.5f, 1));
            items.add(item);
            tree.insert(item);
        }
        var moved = items.get(3).withBounds(new Box(0, 40, 0, 1, 41, 1));
        assertTrue(tree.update(moved));
        assertEquals(Set.of(moved), new HashSet<>(tree.getOverlapping(new Box(-1, 30, -1, 2, 50, 2))));
        assertEquals(10, tree.getContainedIn(new Box(-1, -1, -1, 2, 50, 2)).size());
        assertTrue(tree.removeById(moved.getId()));
        assertTrue(tree.getOverlapping(new Box(-1, 30, -1, 2, 50, 2)).isEmpty());
    }

    @Test
    public void testRangeOverUnitBoxesInARow() {
        var tree = new BoxTree<LongEntityID, BoundedEntity<LongEntityID, Box, Void>>(
        TreeConfig.deterministic(20).withMaxChildren(4));
        for (int i = 0; i < 20; i++) {
            tree.insert(BoundedEntity.of(LongEntityID.of(i), new Box(i, 0, 0, i + 1, 1, 1)));
        }
        tree.checkConsistency();
        assertTrue(tree.depth() >= 2);

        var result = ids(tree.getOverlapping(new Box(0, -1, -1, 10, 1, 1)));
        Set<Long> expected = LongStream.rangeClosed(0, 10).boxed().collect(Collectors.toSet());
        assertEquals(expected, result);

        tree.optimize();
        assertEquals(expected, ids(tree.getOverlapping(new Box(0, -1, -1, 10, 1, 1))));
        assertEquals(LongStream.range(0, 10).boxed().collect(Collectors.toSet()),
                     ids(tree.getContainedIn(new Box(0, -1, -1, 10, 1, 1))));
    }

    @Test
    public void testSplitSeparatesClusters() {
        var tree = new BoxTree<LongEntityID, BoundedEntity<LongEntityID, Box, Void>>(
        TreeConfig.deterministic(1).withMaxChildren(8));
        var random = new Random(1);
        for (int i = 0; i < 9; i++) {
            float offset = i % 2 == 0 ? 0 : 1000;
            var p = new Point3f(offset + random.nextFloat(), random.nextFloat(), random.nextFloat());
            tree.insert(BoundedEntity.of(LongEntityID.of(i), Box.centeredAt(p, 0.1f)));
        }
        assertEquals(3, tree.nodeCount());
        for (int child = 1; child <= 2; child++) {
            var node = tree.getNode(child);
            assertTrue(node.isLeaf());
            // Each leaf holds one cluster only
            assertTrue(node.bounds().extentX() < 10, node.bounds().toString());
        }
    }

    @Test
    public void testUpdateGrowsLeafBounds() {
        var tree = new BoxTree<LongEntityID, BoundedEntity<LongEntityID, Box, Void>>(
        TreeConfig.deterministic(2).withMaxChildren(4));
        for (int i = 0; i < 16; i++) {
            tree.insert(BoundedEntity.of(LongEntityID.of(i), Box.centeredAt(new Point3f(i * 2, 0, 0), 0.5f)));
        }
        var moved = BoundedEntity.of(LongEntityID.of(3), Box.centeredAt(new Point3f(200, 200, 200), 0.5f));
        assertTrue(tree.update(moved));
        tree.checkConsistency();
        assertTrue(tree.getRootBounds().contains(moved.getBounds()));
        assertEquals(Set.of(3L), ids(tree.getContainedIn(new Box(190, 190, 190, 210, 210, 210))));
        assertEquals(Set.of(3L), ids(tree.getOverlappingRadius(new Point3f(200, 200, 200), 1)));
    }

    @Test
    public void testRaycastHitsRowInOrder() {
        var tree = new BoxTree<LongEntityID, BoundedEntity<LongEntityID, Box, Void>>(
        TreeConfig.deterministic(3).withMaxChildren(3));
        for (int i = 0; i < 10; i++) {
            tree.insert(BoundedEntity.of(LongEntityID.of(i), Box.centeredAt(new Point3f(i * 5, 0, 0), 1)));
        }
        var hits = tree.raycast(alongX(), 100f);
        assertEquals(10, hits.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(i, hits.get(i).item().getId().getValue());
            assertEquals(2, hits.get(i).hitPoints().size());
            assertEquals(i * 5 - 1 + 10, hits.get(i).distance(), 1e-3f);
        }
        var reversed = tree.raycast(alongX(), 100f, (a, b) -> Float.compare(b.distance(), a.distance()));
        assertEquals(9L, reversed.get(0).item().getId().getValue());

        var set = new HashSet<Long>();
        tree.raycast(alongX(), 22f).forEach(h -> set.add(h.item().getId().getValue()));
        assertEquals(Set.of(0L, 1L, 2L), set);
    }

    @Override
    protected Point3f center(Box bounds) {
        return bounds.center();
    }

    @Override
    protected boolean containedIn(Box region, Box bounds) {
        return region.contains(bounds);
    }

    @Override
    protected boolean containedInRadius(Sphere sphere, Box bounds) {
        return ShapeOverlap.sphereContainsBox(sphere, bounds);
    }

    @Override
    protected Point3f[] crossings(Box bounds, LineSegment3D segment) {
        return ShapeIntersection.segmentBoxIntersections(segment, bounds);
    }

    @Override
    protected boolean inFrustum(Frustum3D frustum, Box bounds) {
        return frustum.intersectsBox(bounds);
    }

    @Override
    protected AbstractStarTree<LongEntityID, BoundedEntity<LongEntityID, Box, Void>, Box> newTree(TreeConfig config) {
        return new BoxTree<>(config);
    }

    @Override
    protected boolean overlaps(Box region, Box bounds) {
        return region.overlaps(bounds);
    }

    @Override
    protected boolean overlapsCapsule(Capsule capsule, Box bounds) {
        return ShapeOverlap.capsuleOverlapsBox(capsule, bounds);
    }

    @Override
    protected boolean overlapsRadius(Sphere sphere, Box bounds) {
        return ShapeOverlap.boxOverlapsSphere(bounds, sphere);
    }

    @Override
    protected Box volumeAt(float x, float y, float z, float halfSize) {
        return Box.centeredAt(new Point3f(x, y, z), halfSize);
    }

    private static Ray3D alongX() {
        return new Ray3D(new Point3f(-10, 0, 0), new Vector3f(1, 0, 0));
    }
}
