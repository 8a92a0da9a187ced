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
package com.hellblazer.raymaps.render.map;

import com.hellblazer.raymaps.common.AtomicIntGrid;
import com.hellblazer.raymaps.common.GridDimensions;
import com.hellblazer.raymaps.render.color.ScalarColorLaw;

/**
 * Number of rays registered per pixel. Counts are the divisor of the averaged maps and are never averaged
 * themselves.
 */
public final class RayCountMap extends AccumulationMap {

    /** Probe result for coordinates outside the grid. */
    public static final int OUTSIDE_GRID = -1;

    private final ScalarColorLaw colorLaw;

    private volatile AtomicIntGrid counts;

    /**
     * Creates a ray count map rendered with the linear hue gradient.
     *
     * @param name Display name
     */
    public RayCountMap(String name) {
        this(name, ScalarColorLaw.LINEAR);
    }

    /**
     * @param name     Display name
     * @param colorLaw Color law scaled by the min/max count
     */
    public RayCountMap(String name, ScalarColorLaw colorLaw) {
        super(name, AccumulatorKind.COUNT, true, null);
        if (colorLaw == null) {
            throw new IllegalArgumentException("Color law cannot be null");
        }
        this.colorLaw = colorLaw;
    }

    /**
     * Atomically counts one ray at a pixel.
     *
     * @throws IllegalStateException     if the grid is detached
     * @throws IndexOutOfBoundsException if the pixel is outside the grid
     */
    public void increment(int x, int y) {
        grid().increment(x, y);
    }

    /**
     * @return the count at a pixel, 0 while the grid is detached
     * @throws IndexOutOfBoundsException if the grid is attached and the pixel is outside it
     */
    public int getCountAt(int x, int y) {
        var grid = counts;
        return grid == null ? 0 : grid.get(x, y);
    }

    /**
     * @return the raw count, or {@link #OUTSIDE_GRID} for coordinates outside the grid
     */
    @Override
    public double getValueAtCoordinates(int x, int y) {
        if (!getDimensions().contains(x, y)) {
            return OUTSIDE_GRID;
        }
        return getCountAt(x, y);
    }

    @Override
    public boolean isAllocated() {
        return counts != null;
    }

    @Override
    protected void allocate(GridDimensions dimensions) {
        counts = new AtomicIntGrid(dimensions);
    }

    @Override
    protected void release() {
        counts = null;
    }

    @Override
    protected void divideCell(int x, int y, int count) {
        throw new UnsupportedOperationException("Ray counts are never averaged");
    }

    @Override
    protected MapBounds computeBounds() {
        return scanBounds(ALL_CELLS, this::getCountAt);
    }

    @Override
    protected int colorAt(int x, int y) {
        var bounds = getBounds();
        return colorLaw.color(bounds.min(), bounds.max(), getCountAt(x, y));
    }

    private AtomicIntGrid grid() {
        var grid = counts;
        if (grid == null) {
            throw new IllegalStateException("Map '" + getName() + "' is detached; initialize it before accumulating");
        }
        return grid;
    }
}
