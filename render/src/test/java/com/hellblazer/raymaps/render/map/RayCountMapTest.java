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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RayCountMap lifecycle, probing and rendering.
 */
class RayCountMapTest {

    private RayCountMap map;

    @BeforeEach
    void setUp() {
        map = new RayCountMap("rays");
    }

    @Test
    void testUnsizedMap() {
        assertEquals(GridDimensions.EMPTY, map.getDimensions());
        assertFalse(map.isAllocated());
        assertThrows(AccumulationException.UnsizedGridException.class, map::renderMap);
    }

    @Test
    void testIncrementRequiresAllocation() {
        var ex = assertThrows(IllegalStateException.class, () -> map.increment(0, 0));
        assertTrue(ex.getMessage().contains("rays"));
    }

    @Test
    void testInitializeAndCount() {
        map.initialize(3, 2);
        assertEquals(new GridDimensions(3, 2), map.getDimensions());
        assertTrue(map.isAllocated());

        map.increment(2, 1);
        map.increment(2, 1);
        map.increment(0, 0);
        assertEquals(2, map.getCountAt(2, 1));
        assertEquals(1, map.getCountAt(0, 0));
        assertEquals(0, map.getCountAt(1, 0));
        assertEquals(2.0, map.getValueAtCoordinates(2, 1));
    }

    @Test
    void testOutOfGridProbeReturnsSentinel() {
        map.initialize(2, 2);
        assertEquals(-1.0, map.getValueAtCoordinates(-1, 0));
        assertEquals(-1.0, map.getValueAtCoordinates(2, 0));
        assertEquals(-1.0, map.getValueAtCoordinates(0, 2));
        assertEquals(-1.0, map.getValueAtCoordinates(100, 100));
        assertEquals(RayCountMap.OUTSIDE_GRID, (int) map.getValueAtCoordinates(0, -5));
    }

    @Test
    void testInitializeDiscardsContents() {
        map.initialize(2, 2);
        map.increment(1, 1);
        map.initialize(2, 2);
        assertEquals(0, map.getCountAt(1, 1));

        // zero dimensions keep the current size
        map.increment(1, 1);
        map.initialize();
        assertEquals(new GridDimensions(2, 2), map.getDimensions());
        assertEquals(0, map.getCountAt(1, 1));
    }

    @Test
    void testResetDetachesGrid() {
        map.initialize(2, 2);
        map.increment(0, 0);
        map.reset();

        assertFalse(map.isAllocated());
        assertEquals(new GridDimensions(2, 2), map.getDimensions());
        assertEquals(0, map.getCountAt(0, 0));
        assertThrows(IllegalStateException.class, () -> map.increment(0, 0));

        map.ensureAllocated(new GridDimensions(2, 2));
        assertTrue(map.isAllocated());
        map.increment(0, 0);
        assertEquals(1, map.getCountAt(0, 0));
    }

    @Test
    void testEnsureAllocatedKeepsExistingGrid() {
        map.initialize(2, 2);
        map.increment(1, 0);
        map.ensureAllocated(new GridDimensions(2, 2));
        assertEquals(1, map.getCountAt(1, 0));
    }

    @Test
    void testLinearRendering() {
        map.initialize(3, 1);
        map.increment(1, 0);
        map.increment(2, 0);
        map.increment(2, 0);

        var bitmap = map.getBitmap();
        assertEquals(3, bitmap.getWidth());
        assertEquals(1, bitmap.getHeight());
        assertEquals(0x0000FF, bitmap.getRGB(0, 0) & 0xFFFFFF, "min count is blue");
        assertEquals(0x00FF00, bitmap.getRGB(1, 0) & 0xFFFFFF, "mid count is green");
        assertEquals(0xFF0000, bitmap.getRGB(2, 0) & 0xFFFFFF, "max count is red");

        assertEquals(new MapBounds(0, 2), map.getBounds());
        assertFalse(map.isAveraged(), "Counts are never averaged");
        assertEquals(2, map.getCountAt(2, 0));
    }

    @Test
    void testUniformGridRendersBlue() {
        map.initialize(2, 2);
        var bitmap = map.getBitmap();
        for (var x = 0; x < 2; x++) {
            for (var y = 0; y < 2; y++) {
                assertEquals(0x0000FF, bitmap.getRGB(x, y) & 0xFFFFFF);
            }
        }
    }

    @Test
    void testBitmapIsCachedUntilReset() {
        map.initialize(2, 2);
        var first = map.getBitmap();
        assertSame(first, map.getBitmap());

        map.reset();
        var second = map.getBitmap();
        assertNotSame(first, second);
        assertTrue(map.isAllocated(), "Rendering a detached map reallocates it");
    }
}
