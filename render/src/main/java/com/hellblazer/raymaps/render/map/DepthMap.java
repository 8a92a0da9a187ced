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

import com.hellblazer.raymaps.common.AtomicDoubleGrid;
import com.hellblazer.raymaps.common.AtomicIntGrid;
import com.hellblazer.raymaps.common.GridDimensions;
import com.hellblazer.raymaps.render.color.ScalarColorLaw;

/**
 * Average distance from the ray origin to the first hit of the primary rays of each pixel.
 *
 * <p>A primary ray that hits nothing contributes the unresolved placeholder instead of a distance and is counted as a
 * miss. A pixel is unresolved when every one of its primary rays missed. After averaging, pixels without a known depth are moved to the maximum of the map according to the {@link UnresolvedDepthPolicy},
 * and the bounds are scanned again over the substituted grid. Rendering uses the reversed logarithmic law, near
 * pixels red and far pixels blue.
 */
public final class DepthMap extends AccumulationMap {

    private final double                unresolvedDepth;
    private final UnresolvedDepthPolicy policy;
    private final int                   emptyCellColor;
    private final ScalarColorLaw        colorLaw;

    private volatile AtomicDoubleGrid sums;
    private volatile AtomicIntGrid    misses;

    /**
     * @param name            Display name
     * @param primaryRays     Primary ray counts, the divisor of the averaging pass
     * @param unresolvedDepth Placeholder distance registered for primary rays without a hit
     * @param policy          Rendering of pixels without a known depth
     * @param emptyCellColor  Packed RGB of pixels without primary rays under {@link UnresolvedDepthPolicy#SEPARATE}
     */
    public DepthMap(String name, RayCountMap primaryRays, double unresolvedDepth, UnresolvedDepthPolicy policy,
                    int emptyCellColor) {
        super(name, AccumulatorKind.SUM, true, primaryRays);
        if (primaryRays == null) {
            throw new IllegalArgumentException("Primary ray counts cannot be null");
        }
        if (!(unresolvedDepth > 0) || Double.isInfinite(unresolvedDepth)) {
            throw new IllegalArgumentException("Unresolved depth must be positive and finite: " + unresolvedDepth);
        }
        if (policy == null) {
            throw new IllegalArgumentException("Unresolved depth policy cannot be null");
        }
        this.unresolvedDepth = unresolvedDepth;
        this.policy = policy;
        this.emptyCellColor = emptyCellColor;
        this.colorLaw = ScalarColorLaw.LOGARITHMIC_REVERSED;
    }

    /**
     * Atomically adds the hit distance of one primary ray to a pixel.
     */
    public void add(int x, int y, double depth) {
        sumGrid().add(x, y, depth);
    }

    /**
     * Atomically records a primary ray of a pixel that hit nothing. The ray contributes the unresolved placeholder to
     * the sum.
     */
    public void addMiss(int x, int y) {
        var grid = sumGrid();
        var missGrid = misses;
        if (missGrid == null) {
            throw new IllegalStateException("Map '" + getName() + "' is detached; initialize it before accumulating");
        }
        grid.add(x, y, unresolvedDepth);
        missGrid.increment(x, y);
    }

    /**
     * @return the number of primary rays of a pixel that hit nothing; 0 while the grid is detached
     */
    public int getMissesAt(int x, int y) {
        var grid = misses;
        return grid == null ? 0 : grid.get(x, y);
    }

    /**
     * @return the stored value of a pixel: the running sum before averaging, the average afterwards; 0 while the grid
     * is detached
     */
    public double getDepthAt(int x, int y) {
        var grid = sums;
        return grid == null ? 0.0 : grid.get(x, y);
    }

    public double getUnresolvedDepth() {
        return unresolvedDepth;
    }

    public UnresolvedDepthPolicy getPolicy() {
        return policy;
    }

    /**
     * Meaningful only after {@link #renderMap()}: before the first render of a pass the grid holds running sums, not
     * averages, and no maximum is known yet.
     *
     * @return the averaged distance; {@code +Infinity} once the value has reached the maximum of the last render; NaN
     * outside the grid or while the grid is detached
     */
    @Override
    public double getValueAtCoordinates(int x, int y) {
        var grid = sums;
        if (grid == null || !getDimensions().contains(x, y)) {
            return Double.NaN;
        }
        double value = grid.get(x, y);
        var bounds = getBounds();
        if (bounds != null && value >= bounds.max()) {
            return Double.POSITIVE_INFINITY;
        }
        return value;
    }

    @Override
    public boolean isAllocated() {
        return sums != null && misses != null;
    }

    @Override
    protected void allocate(GridDimensions dimensions) {
        sums = new AtomicDoubleGrid(dimensions);
        misses = new AtomicIntGrid(dimensions);
    }

    @Override
    protected void release() {
        sums = null;
        misses = null;
    }

    @Override
    protected void divideCell(int x, int y, int count) {
        sums.divide(x, y, count);
    }

    @Override
    protected MapBounds computeBounds() {
        var grid = sums;
        CellReader depth = grid::get;
        var missGrid = misses;
        CellFilter unresolved = (x, y) -> {
            int rays = divisor().getCountAt(x, y);
            return rays != 0 && missGrid.get(x, y) == rays;
        };
        return switch (policy) {
            case MERGED -> {
                var first = scanBounds(ALL_CELLS, depth);
                substitute(grid, (x, y) -> !occupied(x, y) || unresolved.test(x, y), first.max());
                yield scanBounds(ALL_CELLS, depth);
            }
            case SEPARATE -> {
                var first = scanBounds((x, y) -> occupied(x, y) && !unresolved.test(x, y), depth);
                if (!first.isEmpty()) {
                    substitute(grid, unresolved, first.max());
                }
                var bounds = scanBounds(this::occupied, depth);
                yield bounds.isEmpty() ? new MapBounds(0.0, 0.0) : bounds;
            }
        };
    }

    @Override
    protected int colorAt(int x, int y) {
        if (policy == UnresolvedDepthPolicy.SEPARATE && !occupied(x, y)) {
            return emptyCellColor;
        }
        var bounds = getBounds();
        return colorLaw.color(bounds.min(), bounds.max(), sums.get(x, y));
    }

    private AtomicDoubleGrid sumGrid() {
        var grid = sums;
        if (grid == null) {
            throw new IllegalStateException("Map '" + getName() + "' is detached; initialize it before accumulating");
        }
        return grid;
    }

    private boolean occupied(int x, int y) {
        return divisor().getCountAt(x, y) != 0;
    }

    private void substitute(AtomicDoubleGrid grid, CellFilter filter, double value) {
        var size = getDimensions();
        for (int x = 0; x < size.width(); x++) {
            for (int y = 0; y < size.height(); y++) {
                if (filter.test(x, y)) {
                    grid.set(x, y, value);
                }
            }
        }
    }
}
