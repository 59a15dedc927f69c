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

import java.util.Objects;

/**
 * A bounded item carrying an arbitrary payload. Equality and hashing follow the identity only, so a moved item (same
 * id, new bounds) is equal to its previous version.
 *
 * @param <ID> the identity type
 * @param <V>  the bounding volume type
 * @param <P>  the payload type
 * @author hal.hildebrand
 */
public final class BoundedEntity<ID extends EntityID, V, P> implements Bounded<ID, V> {
    private final ID id;
    private final V  bounds;
    private final P  payload;

    public BoundedEntity(ID id, V bounds, P payload) {
        this.id = Objects.requireNonNull(id, "id");
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        this.payload = payload;
    }

    public static <ID extends EntityID, V> BoundedEntity<ID, V, Void> of(ID id, V bounds) {
        return new BoundedEntity<>(id, bounds, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof BoundedEntity<?, ?, ?> that && id.equals(that.id);
    }

    @Override
    public V getBounds() {
        return bounds;
    }

    @Override
    public ID getId() {
        return id;
    }

    public P getPayload() {
        return payload;
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id.toDebugString() + bounds;
    }

    /**
     * The same item moved to new bounds
     */
    public BoundedEntity<ID, V, P> withBounds(V newBounds) {
        return new BoundedEntity<>(id, newBounds, payload);
    }
}
