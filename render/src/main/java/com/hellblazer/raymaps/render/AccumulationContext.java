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
package com.hellblazer.raymaps.render;

import com.hellblazer.raymaps.common.GridDimensions;
import com.hellblazer.raymaps.render.map.AccumulationException;
import com.hellblazer.raymaps.render.map.AccumulationMap;
import com.hellblazer.raymaps.render.map.DepthMap;
import com.hellblazer.raymaps.render.map.NormalAccumulator;
import com.hellblazer.raymaps.render.map.NormalMap;
import com.hellblazer.raymaps.render.map.NormalView;
import com.hellblazer.raymaps.render.map.RayCountMap;
import com.hellblazer.raymaps.render.map.StatisticsMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.awt.image.BufferedImage;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-pixel ray statistics of a render.
 *
 * <p>The host creates one context and hands it to every render worker. Workers call
 * {@link #register(int, int, int, Point3d, Hit)} once per traced ray; the display layer reads the maps after the
 * pass. Between passes the host calls {@link #reset()}, and {@link #setNewDimensions(int, int)} whenever the output
 * resolution changes.
 *
 * <p>Key features:
 * <ul>
 *   <li>Registration is lock-free apart from the lazy allocation of a detached grid</li>
 *   <li>Writes to the same pixel from concurrent workers are atomic, writes to different pixels never contend</li>
 *   <li>All maps share the active resolution</li>
 *   <li>The normal views share a single accumulator, written once per ray</li>
 * </ul>
 *
 * <p>Averaging, rendering, {@link #reset()} and {@link #setNewDimensions(int, int)} must not overlap a pass that
 * is still registering rays.
 */
public class AccumulationContext {

    private static final Logger log = LoggerFactory.getLogger(AccumulationContext.class);

    private final AccumulationConfig config;
    private final RayCountMap        primaryRaysMap;
    private final RayCountMap        allRaysMap;
    private final DepthMap           depthMap;
    private final NormalAccumulator  normalAccumulator;
    private final NormalMap          normalMapRelative;
    private final NormalMap          normalMapAbsolute;
    private final NormalMap          normalMapAngle;

    private final Map<MapKind, AccumulationMap> maps;
    private final AtomicInteger                 registering = new AtomicInteger();

    private volatile GridDimensions dimensions;

    /**
     * Creates a context with the default configuration.
     */
    public AccumulationContext() {
        this(AccumulationConfig.defaultConfig());
    }

    /**
     * @param config Accumulation configuration
     */
    public AccumulationContext(AccumulationConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.config = config;

        primaryRaysMap = new RayCountMap(MapKind.PRIMARY_RAYS.getDisplayName());
        allRaysMap = new RayCountMap(MapKind.ALL_RAYS.getDisplayName());
        depthMap = new DepthMap(MapKind.DEPTH.getDisplayName(), primaryRaysMap, config.getUnresolvedDepth(),
                                config.getDepthPolicy(), config.getEmptyCellColor());
        normalAccumulator = new NormalAccumulator();
        normalMapRelative = new NormalMap(MapKind.NORMALS_RELATIVE.getDisplayName(), NormalView.RELATIVE,
                                          normalAccumulator, primaryRaysMap);
        normalMapAbsolute = new NormalMap(MapKind.NORMALS_ABSOLUTE.getDisplayName(), NormalView.ABSOLUTE,
                                          normalAccumulator, primaryRaysMap);
        normalMapAngle = new NormalMap(MapKind.NORMALS_ANGLE.getDisplayName(), NormalView.ANGLE, normalAccumulator,
                                       primaryRaysMap);

        var all = new EnumMap<MapKind, AccumulationMap>(MapKind.class);
        all.put(MapKind.PRIMARY_RAYS, primaryRaysMap);
        all.put(MapKind.ALL_RAYS, allRaysMap);
        all.put(MapKind.DEPTH, depthMap);
        all.put(MapKind.NORMALS_RELATIVE, normalMapRelative);
        all.put(MapKind.NORMALS_ABSOLUTE, normalMapAbsolute);
        all.put(MapKind.NORMALS_ANGLE, normalMapAngle);
        maps = Collections.unmodifiableMap(all);

        dimensions = new GridDimensions(config.getInitialWidth(), config.getInitialHeight());
        log.debug("Created accumulation context: {}", config);
    }

    /**
     * Registers one traced ray.
     *
     * @param x         Pixel X coordinate the ray belongs to
     * @param y         Pixel Y coordinate the ray belongs to
     * @param level     Recursion level, 0 for primary rays
     * @param rayOrigin Origin of the ray
     * @param hit       First intersection, or null if the ray hit nothing
     * @throws AccumulationException.UnsizedGridException if no render resolution was ever set
     * @throws IndexOutOfBoundsException                  if the pixel is outside the active resolution
     */
    public void register(int x, int y, int level, Point3d rayOrigin, Hit hit) {
        if (level < 0) {
            throw new IllegalArgumentException("Recursion level cannot be negative: " + level);
        }
        if (rayOrigin == null) {
            throw new IllegalArgumentException("Ray origin cannot be null");
        }
        var active = dimensions;
        if (active.isEmpty()) {
            throw new AccumulationException.UnsizedGridException(
            "No render resolution set; call setNewDimensions before registering rays");
        }
        if (!active.contains(x, y)) {
            throw new IndexOutOfBoundsException("Pixel (" + x + "," + y + ") outside render resolution " + active);
        }

        for (var map : maps.values()) {
            map.ensureAllocated(active);
        }

        registering.incrementAndGet();
        try {
            if (level == 0) {
                // secondary rays start on surfaces, only primaries carry the camera position
                normalAccumulator.captureOrigin(rayOrigin);
                primaryRaysMap.increment(x, y);
                if (hit == null) {
                    depthMap.addMiss(x, y);
                } else {
                    depthMap.add(x, y, hit.distanceFrom(rayOrigin));
                    normalAccumulator.add(x, y, hit.coordWorld(), hit.normal());
                }
            }
            allRaysMap.increment(x, y);
        } finally {
            registering.decrementAndGet();
        }
    }

    /**
     * Diagnostic only; never use it to synchronize with workers.
     *
     * @return true if some worker is inside {@link #register(int, int, int, Point3d, Hit)}
     */
    public boolean isInMiddleOfRegistering() {
        return registering.get() > 0;
    }

    /**
     * Sets the render resolution and reallocates every map at it, discarding accumulated state.
     *
     * @param width  Frame width in pixels
     * @param height Frame height in pixels
     */
    public void setNewDimensions(int width, int height) {
        dimensions = GridDimensions.of(width, height);
        for (var map : maps.values()) {
            map.initialize(width, height);
        }
        log.debug("Accumulation maps resized to {}", dimensions);
    }

    /**
     * Discards all accumulated state before a new render pass. The grids are detached and reallocated lazily at the
     * active resolution by the first registration.
     */
    public void reset() {
        for (var map : maps.values()) {
            map.reset();
        }
        log.debug("Accumulation maps reset at {}", dimensions);
    }

    /**
     * Renders every map of the completed pass.
     *
     * @return bitmaps by map
     */
    public Map<MapKind, BufferedImage> renderAll() {
        var bitmaps = new EnumMap<MapKind, BufferedImage>(MapKind.class);
        for (var entry : maps.entrySet()) {
            bitmaps.put(entry.getKey(), entry.getValue().getBitmap());
        }
        return bitmaps;
    }

    public StatisticsMap getMap(MapKind kind) {
        return maps.get(kind);
    }

    public Collection<? extends StatisticsMap> getMaps() {
        return maps.values();
    }

    public GridDimensions getDimensions() {
        return dimensions;
    }

    public AccumulationConfig getConfig() {
        return config;
    }

    public RayCountMap getPrimaryRaysMap() {
        return primaryRaysMap;
    }

    public RayCountMap getAllRaysMap() {
        return allRaysMap;
    }

    public DepthMap getDepthMap() {
        return depthMap;
    }

    public NormalMap getNormalMapRelative() {
        return normalMapRelative;
    }

    public NormalMap getNormalMapAbsolute() {
        return normalMapAbsolute;
    }

    public NormalMap getNormalMapAngle() {
        return normalMapAngle;
    }

    public NormalAccumulator getNormalAccumulator() {
        return normalAccumulator;
    }
}
