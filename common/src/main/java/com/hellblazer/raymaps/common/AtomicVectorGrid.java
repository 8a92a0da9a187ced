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

import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Fixed size grid of 3D vector sums.
 *
 * <p>Components are stored interleaved (x, y, z per cell) as raw double bits. Each component is accumulated with its
 * own compare-and-set loop, so concurrent additions to the same cell never lose a contribution. A reader racing a writer
 * may observe a partially applied vector; complete sums are only guaranteed once all writers are done.
 */
public final class AtomicVectorGrid {

    private static final int COMPONENTS = 3;

    private final GridDimensions  dimensions;
    private final AtomicLongArray cells;

    /**
     * Creates a grid with every cell at the zero vector.
     *
     * @param dimensions Grid dimensions
     */
    public AtomicVectorGrid(GridDimensions dimensions) {
        if (dimensions == null) {
            throw new IllegalArgumentException("Dimensions cannot be null");
        }
        this.dimensions = dimensions;
        this.cells = new AtomicLongArray(dimensions.cellCount() * COMPONENTS);
    }

    public GridDimensions dimensions() {
        return dimensions;
    }

    /**
     * Atomically adds a vector to a cell, component by component.
     */
    public void add(int x, int y, Tuple3d delta) {
        var base = dimensions.index(x, y) * COMPONENTS;
        addComponent(base, delta.x);
        addComponent(base + 1, delta.y);
        addComponent(base + 2, delta.z);
    }

    /**
     * @return a new vector holding the value of the cell
     */
    public Vector3d get(int x, int y) {
        var result = new Vector3d();
        get(x, y, result);
        return result;
    }

    /**
     * Copies the value of a cell into the supplied tuple.
     */
    public void get(int x, int y, Tuple3d result) {
        var base = dimensions.index(x, y) * COMPONENTS;
        result.set(component(base), component(base + 1), component(base + 2));
    }

    public void set(int x, int y, Tuple3d value) {
        var base = dimensions.index(x, y) * COMPONENTS;
        cells.set(base, Double.doubleToRawLongBits(value.x));
        cells.set(base + 1, Double.doubleToRawLongBits(value.y));
        cells.set(base + 2, Double.doubleToRawLongBits(value.z));
    }

    /**
     * Divides every component of a cell by a count. Intended for the averaging pass, after all writers have finished.
     */
    public void divide(int x, int y, int divisor) {
        var base = dimensions.index(x, y) * COMPONENTS;
        for (int i = base; i < base + COMPONENTS; i++) {
            cells.set(i, Double.doubleToRawLongBits(component(i) / divisor));
        }
    }

    private double component(int index) {
        return Double.longBitsToDouble(cells.get(index));
    }

    private void addComponent(int index, double delta) {
        while (true) {
            long current = cells.get(index);
            long next = Double.doubleToRawLongBits(Double.longBitsToDouble(current) + delta);
            if (cells.compareAndSet(index, current, next)) {
                return;
            }
        }
    }
}
