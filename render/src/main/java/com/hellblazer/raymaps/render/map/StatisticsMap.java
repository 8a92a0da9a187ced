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

import com.hellblazer.raymaps.common.GridDimensions;

import java.awt.image.BufferedImage;

/**
 * A per-pixel diagnostic map as seen by the display and probe layer.
 *
 * <p>Rendering and probing are read operations once a render pass has completed. They must not overlap
 * {@link #initialize(int, int)} or {@link #reset()}.
 */
public interface StatisticsMap {

    /**
     * @return display name of the map
     */
    String getName();

    /**
     * @return current grid dimensions, {@link GridDimensions#EMPTY} if never sized
     */
    GridDimensions getDimensions();

    /**
     * (Re)allocates the backing grid at the current dimensions, discarding its contents.
     */
    default void initialize() {
        initialize(0, 0);
    }

    /**
     * Adopts the given dimensions unless both are zero, then (re)allocates the backing grid, discarding its contents.
     *
     * @param width  Grid width; 0 with a zero height keeps the current size
     * @param height Grid height; 0 with a zero width keeps the current size
     */
    void initialize(int width, int height);

    /**
     * Averages the accumulated sums if that has not happened yet this pass, computes the value bounds and renders a
     * fresh bitmap through the map's color law.
     *
     * @throws AccumulationException.UnsizedGridException if the map has never been given a resolution
     */
    void renderMap();

    /**
     * @return the rendered bitmap, rendering it on first call
     */
    BufferedImage getBitmap();

    /**
     * Probe for interactive readout. The meaning of the value is specific to each map; out-of-grid coordinates yield
     * a sentinel instead of failing.
     *
     * @param x Pixel X coordinate
     * @param y Pixel Y coordinate
     * @return value at the pixel
     */
    double getValueAtCoordinates(int x, int y);

    /**
     * Detaches the backing grid and drops the rendered bitmap. The map must be initialized again before it
     * accumulates.
     */
    void reset();
}
