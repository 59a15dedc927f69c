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

/**
 * The capability an item must offer to be indexed: a stable identity and a bounding volume. The index keys items by
 * identity alone and never looks at anything else about them. Implementations must keep {@link #getId()} constant
 * for the lifetime of the item, and their equality must agree with identity equality.
 *
 * @param <ID> the identity type
 * @param <V>  the bounding volume type
 * @author hal.hildebrand
 */
public interface Bounded<ID extends EntityID, V> {

    V getBounds();

    ID getId();
}
