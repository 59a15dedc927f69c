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
package com.hellblazer.canopy.arbor.entity;

import com.hellblazer.canopy.geometry.Box;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BoundedEntityTest {

    @Test
    public void testEqualityFollowsIdentity() {
        var original = new BoundedEntity<>(LongEntityID.of(7), new Box(0, 0, 0, 1, 1, 1), "payload");
        var moved = original.withBounds(new Box(5, 5, 5, 6, 6, 6));

        assertEquals(original, moved);
        assertEquals(original.hashCode(), moved.hashCode());
        assertEquals("payload", moved.getPayload());
        assertEquals(new Box(5, 5, 5, 6, 6, 6), moved.getBounds());
        assertNotEquals(original, BoundedEntity.of(LongEntityID.of(8), new Box(0, 0, 0, 1, 1, 1)));

        var set = new HashSet<BoundedEntity<LongEntityID, Box, String>>();
        set.add(original);
        assertFalse(set.add(moved));
    }

    @Test
    public void testRequiresIdAndBounds() {
        assertThrows(NullPointerException.class, () -> BoundedEntity.of(null, new Box(0, 0, 0, 1, 1, 1)));
        assertThrows(NullPointerException.class, () -> BoundedEntity.of(LongEntityID.of(1), null));
    }

    @Test
    public void testSequentialGenerator() {
        var generator = new SequentialLongIDGenerator(100);
        assertEquals(100, generator.peek());
        assertEquals(LongEntityID.of(100), generator.generateID());
        assertEquals(LongEntityID.of(101), generator.generateID());
        generator.reset();
        assertEquals(LongEntityID.of(100), generator.generateID());
        assertTrue(LongEntityID.of(1).compareTo(LongEntityID.of(2)) < 0);
        assertEquals("Item[5]", LongEntityID.of(5).toDebugString());
    }

    @Test
    public void testUUIDIdentity() {
        var uuid = UUID.randomUUID();
        assertEquals(new UUIDEntityID(uuid), new UUIDEntityID(uuid));
        assertNotEquals(UUIDEntityID.random(), UUIDEntityID.random());
        assertEquals(uuid, new UUIDEntityID(uuid).getValue());
        assertTrue(new UUIDEntityID(uuid).toDebugString().startsWith("Item["));
    }
}
