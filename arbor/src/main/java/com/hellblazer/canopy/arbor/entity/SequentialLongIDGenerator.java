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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counter handing out ascending {@link LongEntityID}s
 *
 * @author hal.hildebrand
 */
public class SequentialLongIDGenerator implements EntityIDGenerator<LongEntityID> {
    private final long       start;
    private final AtomicLong counter;

    public SequentialLongIDGenerator() {
        this(0L);
    }

    public SequentialLongIDGenerator(long start) {
        this.start = start;
        this.counter = new AtomicLong(start);
    }

    @Override
    public LongEntityID generateID() {
        return new LongEntityID(counter.getAndIncrement());
    }

    /**
     * The value the next generated id will carry
     */
    public long peek() {
        return counter.get();
    }

    @Override
    public void reset() {
        counter.set(start);
    }
}
