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

/**
 * Read-only view of a {@link NormalAccumulator}. Several views over one accumulator share its grids, its dimensions
 * and its averaged flag; initializing or resetting any view affects all of them.
 *
 * <p>Vectors have no order, so the map skips bound discovery and its color laws use a fixed range.
 *
 * @see NormalView
 */
public final class NormalMap extends AccumulationMap {

    private final NormalAccumulator accumulator;
    private final NormalView        view;

    /**
     * @param name        Display name
     * @param view        Projection rendered by this map
     * @param accumulator Shared normal and hit coordinate sums
     * @param primaryRays Primary ray counts, the divisor of the averaging pass
     */
    public NormalMap(String name, NormalView view, NormalAccumulator accumulator, RayCountMap primaryRays) {
        super(name, AccumulatorKind.VECTOR, false, primaryRays);
        if (view == null) {
            throw new IllegalArgumentException("View cannot be null");
        }
        if (accumulator == null) {
            throw new IllegalArgumentException("Accumulator cannot be null");
        }
        if (primaryRays == null) {
            throw new IllegalArgumentException("Primary ray counts cannot be null");
        }
        this.view = view;
        this.accumulator = accumulator;
    }

    public NormalView getView() {
        return view;
    }

    public NormalAccumulator getAccumulator() {
        return accumulator;
    }

    @Override
    public GridDimensions getDimensions() {
        return accumulator.getDimensions();
    }

    /**
     * Meaningful only after a view of the shared accumulator has been rendered: until then the grids hold running sums
     * of the normals and hit coordinates, not their averages.
     *
     * @return the angle in degrees between the averaged normal and the direction from the averaged hit back to the
     * ray origin; NaN for a zero-length vector, outside the grid or while detached
     */
    @Override
    public double getValueAtCoordinates(int x, int y) {
        if (!accumulator.isAllocated() || !getDimensions().contains(x, y)) {
            return Double.NaN;
        }
        return NormalView.angleDegrees(accumulator.getNormalAt(x, y), accumulator.getIntersectionAt(x, y),
                                       accumulator.getRayOrigin());
    }

    @Override
    public boolean isAllocated() {
        return accumulator.isAllocated();
    }

    @Override
    public boolean isAveraged() {
        return accumulator.isAveraged();
    }

    @Override
    protected Object lock() {
        return accumulator;
    }

    @Override
    protected void markAveraged() {
        accumulator.markAveraged();
    }

    @Override
    protected void clearAveraged() {
        accumulator.clearAveraged();
    }

    @Override
    protected void allocate(GridDimensions dimensions) {
        accumulator.allocate(dimensions);
    }

    @Override
    protected void release() {
        accumulator.release();
    }

    @Override
    protected void divideCell(int x, int y, int count) {
        accumulator.divide(x, y, count);
    }

    @Override
    protected MapBounds computeBounds() {
        // fixed range color laws
        return null;
    }

    @Override
    protected int colorAt(int x, int y) {
        return view.color(accumulator.getNormalAt(x, y), accumulator.getIntersectionAt(x, y),
                          accumulator.getRayOrigin());
    }
}
