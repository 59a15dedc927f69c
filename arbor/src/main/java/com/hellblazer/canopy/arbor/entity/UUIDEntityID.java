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
import java.util.UUID;

/**
 * UUID-based entity identifier, for items whose identity originates outside the process.
 *
 * @author hal.hildebrand
 */
public final class UUIDEntityID implements EntityID {
    private final UUID id;

    public UUIDEntityID(UUID id) {
        this.id = Objects.requireNonNull(id, "UUID cannot be null");
    }

    public static UUIDEntityID random() {
        return new UUIDEntityID(UUID.randomUUID());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof UUIDEntityID that && id.equals(that.id);
    }

    public UUID getValue() {
        return id;
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toDebugString() {
        return "Item[" + id.toString().substring(0, 8) + "]";
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
