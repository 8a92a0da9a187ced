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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Base of the accumulation maps: owns the grid lifecycle, the one-time averaging pass, bound discovery and bitmap
 * rendering. Each variant supplies its storage, its division strategy and its color law.
 *
 * <p>Key behaviors:
 * <ul>
 *   <li>Averaging divides each cell by the primary ray count of the same cell and skips cells that received no
 *   primary ray. It runs at most once between two initializations.</li>
 *   <li>Bound discovery scans the grid, seeded from the accumulator type's identities. Types without identities
 *   cannot scan and are rejected at construction.</li>
 *   <li>Storage is allocated lazily by writers through {@link #ensureAllocated(GridDimensions)}; exactly one
 *   allocation wins when several writers race.</li>
 * </ul>
 *
 * <p>Accumulation targets individual cells and never locks. Lifecycle operations, averaging and rendering
 * synchronize, and must only run between render passes.
 *
 * @see StatisticsMap
 */
public abstract sealed class AccumulationMap implements StatisticsMap permits RayCountMap, DepthMap, NormalMap {

    private static final Logger log = LoggerFactory.getLogger(AccumulationMap.class);

    /**
     * Selects the cells taking part in a scan.
     */
    @FunctionalInterface
    protected interface CellFilter {
        boolean test(int x, int y);
    }

    /**
     * Reads the scalar value of a cell.
     */
    @FunctionalInterface
    protected interface CellReader {
        double read(int x, int y);
    }

    protected static final CellFilter ALL_CELLS = (x, y) -> true;

    private final String          name;
    private final AccumulatorKind kind;
    private final boolean         scansBounds;
    private final RayCountMap     divisor;

    private volatile GridDimensions dimensions = GridDimensions.EMPTY;
    private volatile boolean        averaged;
    private volatile MapBounds      bounds;
    private volatile BufferedImage  bitmap;

    /**
     * @param name        Display name
     * @param kind        Accumulator value type
     * @param scansBounds Whether rendering needs min/max bounds of the grid
     * @param divisor     Primary ray counts used for averaging, or null for maps that are never averaged
     * @throws AccumulationException.UnsupportedAccumulatorException if bounds are needed but the type has no
     *                                                               identities
     */
    protected AccumulationMap(String name, AccumulatorKind kind, boolean scansBounds, RayCountMap divisor) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Map name cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Accumulator kind cannot be null");
        }
        if (scansBounds && !kind.hasIdentities()) {
            throw new AccumulationException.UnsupportedAccumulatorException(kind, name);
        }
        this.name = name;
        this.kind = kind;
        this.scansBounds = scansBounds;
        this.divisor = divisor;
    }

    @Override
    public String getName() {
        return name;
    }

    public AccumulatorKind getKind() {
        return kind;
    }

    @Override
    public GridDimensions getDimensions() {
        return dimensions;
    }

    /**
     * @return bounds of the last render, or null if the map has not been rendered since its last initialization or
     * does not scan bounds
     */
    public MapBounds getBounds() {
        return bounds;
    }

    @Override
    public void initialize(int width, int height) {
        synchronized (lock()) {
            var target = width != 0 || height != 0 ? new GridDimensions(width, height) : getDimensions();
            dimensions = target;
            allocate(target);
            clearAveraged();
            bounds = null;
            bitmap = null;
        }
        log.debug("Initialized {} map at {}", name, getDimensions());
    }

    /**
     * Allocates the backing grid at the given dimensions if it is detached. Called by writers on every registration.
     *
     * @param active Render resolution to allocate at
     */
    public void ensureAllocated(GridDimensions active) {
        if (isAllocated()) {
            return;
        }
        synchronized (lock()) {
            if (!isAllocated()) {
                initialize(active.width(), active.height());
            }
        }
    }

    @Override
    public synchronized void renderMap() {
        var size = getDimensions();
        if (size.isEmpty()) {
            throw new AccumulationException.UnsizedGridException(
            "Map '" + name + "' has no dimensions; initialize it with the render resolution first");
        }
        if (!isAllocated()) {
            initialize();
        }

        long start = System.nanoTime();
        average();
        if (scansBounds) {
            bounds = computeBounds();
        }

        var image = new BufferedImage(size.width(), size.height(), BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < size.width(); x++) {
            for (int y = 0; y < size.height(); y++) {
                image.setRGB(x, y, colorAt(x, y));
            }
        }
        bitmap = image;

        if (log.isDebugEnabled()) {
            log.debug("Rendered {} map {} in {} us, bounds {}", name, size, (System.nanoTime() - start) / 1000, bounds);
        }
    }

    @Override
    public synchronized BufferedImage getBitmap() {
        if (bitmap == null) {
            renderMap();
        }
        return bitmap;
    }

    @Override
    public void reset() {
        synchronized (lock()) {
            release();
            bounds = null;
            bitmap = null;
        }
    }

    /**
     * @return true if the accumulated sums have been divided by the primary ray counts
     */
    public boolean isAveraged() {
        return averaged;
    }

    /**
     * Divides every cell with a nonzero primary ray count by that count. Does nothing if the map was already averaged
     * or is never averaged.
     */
    protected final void average() {
        if (divisor == null) {
            return;
        }
        synchronized (lock()) {
            if (isAveraged()) {
                return;
            }
            var size = getDimensions();
            if (divisor.isAllocated()) {
                if (!size.equals(divisor.getDimensions())) {
                    throw new IllegalStateException(
                    "Map '" + name + "' is " + size + " but its ray counts are " + divisor.getDimensions());
                }
                int averagedCells = 0;
                for (int x = 0; x < size.width(); x++) {
                    for (int y = 0; y < size.height(); y++) {
                        int count = divisor.getCountAt(x, y);
                        if (count != 0) {
                            divideCell(x, y, count);
                            averagedCells++;
                        }
                    }
                }
                log.trace("Averaged {} of {} cells of {} map", averagedCells, size.cellCount(), name);
            }
            markAveraged();
        }
    }

    /**
     * Scans the selected cells for their smallest and largest value, seeded from the accumulator identities. If no
     * cell is selected the result {@link MapBounds#isEmpty() is empty}.
     */
    protected final MapBounds scanBounds(CellFilter filter, CellReader reader) {
        double min = kind.maximalIdentity();
        double max = kind.minimalIdentity();
        var size = getDimensions();
        for (int x = 0; x < size.width(); x++) {
            for (int y = 0; y < size.height(); y++) {
                if (!filter.test(x, y)) {
                    continue;
                }
                double value = reader.read(x, y);
                if (value > max) {
                    max = value;
                }
                if (value < min) {
                    min = value;
                }
            }
        }
        return new MapBounds(min, max);
    }

    /**
     * @return the primary ray counts this map is averaged by, or null
     */
    protected final RayCountMap divisor() {
        return divisor;
    }

    /**
     * Monitor guarding allocation and averaging. Maps sharing storage must share the monitor.
     */
    protected Object lock() {
        return this;
    }

    protected void markAveraged() {
        averaged = true;
    }

    protected void clearAveraged() {
        averaged = false;
    }

    /**
     * @return true if the backing grid is attached
     */
    public abstract boolean isAllocated();

    /**
     * Replaces the backing grid with an empty one of the given dimensions.
     */
    protected abstract void allocate(GridDimensions dimensions);

    /**
     * Detaches the backing grid.
     */
    protected abstract void release();

    /**
     * Division strategy: divides the accumulated value of a cell by its primary ray count.
     *
     * @param count Nonzero primary ray count of the cell
     */
    protected abstract void divideCell(int x, int y, int count);

    /**
     * Bound discovery, called after averaging when the map scans bounds. May adjust cells before the final scan.
     */
    protected abstract MapBounds computeBounds();

    /**
     * Color law applied to a cell after averaging and bound discovery.
     *
     * @return packed {@code 0xRRGGBB} color
     */
    protected abstract int colorAt(int x, int y);
}
