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

import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Fixed size grid of double running sums. Each cell stores the raw long bits of its value; additions are applied with
 * a compare-and-set loop on the single cell.
 */
public final class AtomicDoubleGrid {

    private final GridDimensions  dimensions;
    private final AtomicLongArray cells;

    /**
     * Creates a grid with every cell at 0.0.
     *
     * @param dimensions Grid dimensions
     */
    public AtomicDoubleGrid(GridDimensions dimensions) {
        if (dimensions == null) {
            throw new IllegalArgumentException("Dimensions cannot be null");
        }
        this.dimensions = dimensions;
        // 0L is the bit pattern of +0.0
        this.cells = new AtomicLongArray(dimensions.cellCount());
    }

    public GridDimensions dimensions() {
        return dimensions;
    }

    /**
     * Atomically adds a value to a cell.
     *
     * @return the updated value
     */
    public double add(int x, int y, double delta) {
        return addAt(dimensions.index(x, y), delta);
    }

    public double get(int x, int y) {
        return Double.longBitsToDouble(cells.get(dimensions.index(x, y)));
    }

    public void set(int x, int y, double value) {
        cells.set(dimensions.index(x, y), Double.doubleToRawLongBits(value));
    }

    /**
     * Divides a cell by a count. Intended for the averaging pass, after all writers have finished.
     */
    public void divide(int x, int y, int divisor) {
        var index = dimensions.index(x, y);
        cells.set(index, Double.doubleToRawLongBits(Double.longBitsToDouble(cells.get(index)) / divisor));
    }

    double addAt(int index, double delta) {
        while (true) {
            long current = cells.get(index);
            double next = Double.longBitsToDouble(current) + delta;
            if (cells.compareAndSet(index, current, Double.doubleToRawLongBits(next))) {
                return next;
            }
        }
    }
}
