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

import com.hellblazer.raymaps.common.AtomicVectorGrid;
import com.hellblazer.raymaps.common.GridDimensions;

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Surface normal and hit coordinate sums of the primary rays, shared by every {@link NormalMap} view.
 *
 * <p>The accumulator is the single owner of the two grids, of their averaged flag and of the ray origin; views only
 * read. It is also the monitor the views synchronize on for allocation and averaging, so the sums are divided exactly
 * once no matter which view renders first.
 */
public final class NormalAccumulator {

    private final AtomicReference<Point3d> rayOrigin = new AtomicReference<>();

    private volatile GridDimensions   dimensions = GridDimensions.EMPTY;
    private volatile AtomicVectorGrid normals;
    private volatile AtomicVectorGrid intersections;
    private volatile boolean          averaged;

    /**
     * Atomically adds the first hit of one primary ray to a pixel.
     *
     * @param coordWorld World coordinate of the hit
     * @param normal     Surface normal at the hit
     */
    public void add(int x, int y, Tuple3d coordWorld, Tuple3d normal) {
        var normalGrid = normals;
        var intersectionGrid = intersections;
        if (normalGrid == null || intersectionGrid == null) {
            throw new IllegalStateException("Normal accumulator is detached; initialize it before accumulating");
        }
        intersectionGrid.add(x, y, coordWorld);
        normalGrid.add(x, y, normal);
    }

    /**
     * Remembers the origin of the rays of this pass. Only the first origin reported after allocation is kept.
     */
    public void captureOrigin(Tuple3d origin) {
        if (rayOrigin.get() == null) {
            rayOrigin.compareAndSet(null, new Point3d(origin));
        }
    }

    /**
     * @return a copy of the captured ray origin, the coordinate origin if none was captured this pass
     */
    public Point3d getRayOrigin() {
        var origin = rayOrigin.get();
        return origin == null ? new Point3d() : new Point3d(origin);
    }

    /**
     * @return the normal sum (average, after averaging) of a pixel; the zero vector while detached
     */
    public Vector3d getNormalAt(int x, int y) {
        var grid = normals;
        return grid == null ? new Vector3d() : grid.get(x, y);
    }

    /**
     * @return the hit coordinate sum (average, after averaging) of a pixel; the zero vector while detached
     */
    public Vector3d getIntersectionAt(int x, int y) {
        var grid = intersections;
        return grid == null ? new Vector3d() : grid.get(x, y);
    }

    public GridDimensions getDimensions() {
        return dimensions;
    }

    public boolean isAllocated() {
        return normals != null && intersections != null;
    }

    public boolean isAveraged() {
        return averaged;
    }

    synchronized void allocate(GridDimensions size) {
        dimensions = size;
        normals = new AtomicVectorGrid(size);
        intersections = new AtomicVectorGrid(size);
        rayOrigin.set(null);
        averaged = false;
    }

    synchronized void release() {
        normals = null;
        intersections = null;
        rayOrigin.set(null);
    }

    void divide(int x, int y, int count) {
        normals.divide(x, y, count);
        intersections.divide(x, y, count);
    }

    void markAveraged() {
        averaged = true;
    }

    void clearAveraged() {
        averaged = false;
    }
}
