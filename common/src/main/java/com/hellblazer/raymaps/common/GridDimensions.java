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

/**
 * Dimensions of a per-pixel grid. A grid of {@link #EMPTY} dimensions has not been sized yet.
 *
 * @param width  Grid width in cells
 * @param height Grid height in cells
 */
public record GridDimensions(int width, int height) {

    /** Unsized grid. */
    public static final GridDimensions EMPTY = new GridDimensions(0, 0);

    /**
     * Validates the dimension invariants.
     */
    public GridDimensions {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Grid dimensions must be non-negative: " + width + "x" + height);
        }
    }

    /**
     * Creates dimensions for a render resolution. Both values must be positive.
     *
     * @param width  Frame width in pixels
     * @param height Frame height in pixels
     * @return GridDimensions for the resolution
     */
    public static GridDimensions of(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Render resolution must be positive: " + width + "x" + height);
        }
        return new GridDimensions(width, height);
    }

    /**
     * @return true if the grid holds no cells
     */
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * @return Number of cells (width * height)
     */
    public int cellCount() {
        return width * height;
    }

    /**
     * Determines whether the coordinates address a cell of this grid.
     *
     * @param x Cell X coordinate
     * @param y Cell Y coordinate
     * @return true if {@code 0 <= x < width} and {@code 0 <= y < height}
     */
    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Row-major linear index of a cell.
     *
     * @param x Cell X coordinate
     * @param y Cell Y coordinate
     * @return Linear index of the cell
     * @throws IndexOutOfBoundsException if the coordinates are outside the grid
     */
    public int index(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException(
            "Cell coordinates out of bounds: (" + x + "," + y + ") for " + width + "x" + height + " grid");
        }
        return y * width + x;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
