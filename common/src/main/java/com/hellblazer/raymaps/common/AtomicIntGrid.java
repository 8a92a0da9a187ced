/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Raymaps.
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
package com.hellblazer.raymaps.common;

import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * Fixed size grid of integer counters. Updates to a single cell are atomic, updates to different cells never contend
 * on a shared lock.
 */
public final class AtomicIntGrid {

    private final GridDimensions     dimensions;
    private final AtomicIntegerArray cells;

    /**
     * Creates a zero filled grid.
     *
     * @param dimensions Grid dimensions
     */
    public AtomicIntGrid(GridDimensions dimensions) {
        if (dimensions == null) {
            throw new IllegalArgumentException("Dimensions cannot be null");
        }
        this.dimensions = dimensions;
        this.cells = new AtomicIntegerArray(dimensions.cellCount());
    }

    public GridDimensions dimensions() {
        return dimensions;
    }

    /**
     * Atomically adds one to a cell.
     *
     * @return the updated value
     */
    public int increment(int x, int y) {
        return cells.incrementAndGet(dimensions.index(x, y));
    }

    /**
     * Atomically adds a delta to a cell.
     *
     * @return the updated value
     */
    public int add(int x, int y, int delta) {
        return cells.addAndGet(dimensions.index(x, y), delta);
    }

    public int get(int x, int y) {
        return cells.get(dimensions.index(x, y));
    }

    public void set(int x, int y, int value) {
        cells.set(dimensions.index(x, y), value);
    }
}
