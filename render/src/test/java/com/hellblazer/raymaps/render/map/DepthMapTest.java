package com.hellblazer.raymaps.render.map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DepthMap averaging, bound discovery and the unresolved depth policies.
 *
 * @author hal.hildebrand
 */
public class DepthMapTest {

    private static final double EPSILON     = 1e-9;
    private static final double UNRESOLVED  = 10000.0;
    private static final int    EMPTY_COLOR = 0x202020;
    private static final int    RED         = 0xFF0000;
    private static final int    BLUE        = 0x0000FF;

    private RayCountMap primary;

    private DepthMap createMap(UnresolvedDepthPolicy policy) {
        return createMap(UNRESOLVED, policy);
    }

    private void primaryRay(DepthMap depth, int x, int y, double distance) {
        primary.increment(x, y);
        depth.add(x, y, distance);
    }

    private void primaryMiss(DepthMap depth, int x, int y) {
        primary.increment(x, y);
        depth.addMiss(x, y);
    }

    private DepthMap createMap(double unresolvedDepth, UnresolvedDepthPolicy policy) {
        primary = new RayCountMap("primary");
        var depth = new DepthMap("depth", primary, unresolvedDepth, policy, EMPTY_COLOR);
        primary.initialize(2, 2);
        depth.initialize(2, 2);
        return depth;
    }

    private static int rgb(DepthMap map, int x, int y) {
        return map.getBitmap().getRGB(x, y) & 0xFFFFFF;
    }

    @Test
    void testConstructorValidation() {
        var counts = new RayCountMap("primary");
        assertThrows(IllegalArgumentException.class,
                     () -> new DepthMap("depth", null, UNRESOLVED, UnresolvedDepthPolicy.MERGED, 0));
        assertThrows(IllegalArgumentException.class,
                     () -> new DepthMap("depth", counts, 0, UnresolvedDepthPolicy.MERGED, 0));
        assertThrows(IllegalArgumentException.class,
                     () -> new DepthMap("depth", counts, Double.POSITIVE_INFINITY, UnresolvedDepthPolicy.MERGED, 0));
        assertThrows(IllegalArgumentException.class,
                     () -> new DepthMap("depth", counts, Double.NaN, UnresolvedDepthPolicy.MERGED, 0));
        assertThrows(IllegalArgumentException.class, () -> new DepthMap("depth", counts, UNRESOLVED, null, 0));
        assertThrows(IllegalArgumentException.class,
                     () -> new DepthMap(" ", counts, UNRESOLVED, UnresolvedDepthPolicy.MERGED, 0));
    }

    @Test
    void testMissesAddPlaceholder() {
        var depth = createMap(UnresolvedDepthPolicy.MERGED);
        primaryMiss(depth, 1, 1);
        primaryMiss(depth, 1, 1);
        primaryRay(depth, 1, 1, 5);
        assertEquals(2 * UNRESOLVED + 5, depth.getDepthAt(1, 1), EPSILON);
        assertEquals(2, depth.getMissesAt(1, 1));
        assertEquals(0, depth.getMissesAt(0, 0));
    }

    @Test
    void testHitsBeyondPlaceholderKeepTheirDepth() {
        var depth = createMap(100, UnresolvedDepthPolicy.MERGED);
        primaryRay(depth, 0, 0, 150);
        primaryRay(depth, 1, 0, 300);

        depth.renderMap();
        assertEquals(150.0, depth.getDepthAt(0, 0), EPSILON);
        assertEquals(300.0, depth.getDepthAt(1, 0), EPSILON);
        assertEquals(new MapBounds(150.0, 300.0), depth.getBounds());
        assertEquals(150.0, depth.getValueAtCoordinates(0, 0), EPSILON);
        assertEquals(RED, rgb(depth, 0, 0));
        assertEquals(BLUE, rgb(depth, 1, 0));
    }

    @Test
    void testSeparateHitBeyondPlaceholderIsResolved() {
        var depth = createMap(100, UnresolvedDepthPolicy.SEPARATE);
        primaryRay(depth, 0, 0, 50);
        primaryRay(depth, 1, 0, 300);
        primaryMiss(depth, 1, 1);

        depth.renderMap();
        assertEquals(new MapBounds(50.0, 300.0), depth.getBounds());
        assertEquals(300.0, depth.getDepthAt(1, 0), EPSILON);
        assertEquals(300.0, depth.getDepthAt(1, 1), EPSILON, "Miss takes the farthest resolved depth");
    }

    @Test
    void testPixelWithSomeHitsIsResolved() {
        var depth = createMap(100, UnresolvedDepthPolicy.SEPARATE);
        primaryRay(depth, 0, 0, 10);
        primaryRay(depth, 1, 0, 50);
        primaryMiss(depth, 1, 0);

        depth.renderMap();
        assertEquals(75.0, depth.getDepthAt(1, 0), EPSILON);
        assertEquals(new MapBounds(10.0, 75.0), depth.getBounds());
    }

    @Test
    void testMissesDetectedWithInexactPlaceholder() {
        // three additions of 0.1 do not average back to exactly 0.1
        var depth = createMap(0.1, UnresolvedDepthPolicy.SEPARATE);
        primaryRay(depth, 0, 0, 0.05);
        primaryRay(depth, 0, 0, 0.05);
        primaryMiss(depth, 1, 0);
        primaryMiss(depth, 1, 0);
        primaryMiss(depth, 1, 0);

        depth.renderMap();
        assertEquals(new MapBounds(0.05, 0.05), depth.getBounds());
        assertEquals(0.05, depth.getDepthAt(1, 0), EPSILON);
    }

    @Test
    void testDetachedMap() {
        var depth = new DepthMap("depth", new RayCountMap("primary"), UNRESOLVED, UnresolvedDepthPolicy.MERGED, 0);
        assertFalse(depth.isAllocated());
        assertEquals(0.0, depth.getDepthAt(0, 0));
        assertTrue(Double.isNaN(depth.getValueAtCoordinates(0, 0)));
        assertThrows(IllegalStateException.class, () -> depth.add(0, 0, 1.0));
        assertThrows(IllegalStateException.class, () -> depth.addMiss(0, 0));
        assertEquals(0, depth.getMissesAt(0, 0));
    }

    @Test
    void testSinglePixelAverage() {
        var depth = createMap(UnresolvedDepthPolicy.MERGED);
        primaryRay(depth, 0, 0, 1);
        primaryRay(depth, 0, 0, 2);
        primaryRay(depth, 0, 0, 3);
        assertEquals(6.0, depth.getDepthAt(0, 0), EPSILON, "Sums before rendering");

        depth.renderMap();
        assertTrue(depth.isAveraged());
        assertEquals(2.0, depth.getDepthAt(0, 0), EPSILON);

        // empty cells take the maximum, so the whole grid is uniform
        assertEquals(new MapBounds(2.0, 2.0), depth.getBounds());
        assertEquals(2.0, depth.getDepthAt(1, 1), EPSILON);
        assertEquals(Double.POSITIVE_INFINITY, depth.getValueAtCoordinates(0, 0));
        assertEquals(RED, rgb(depth, 0, 0));
    }

    @Test
    void testProbeReadsSumsUntilRendered() {
        var depth = createMap(UnresolvedDepthPolicy.MERGED);
        primaryRay(depth, 0, 0, 4);
        primaryRay(depth, 0, 0, 8);
        primaryRay(depth, 1, 0, 20);
        assertEquals(12.0, depth.getValueAtCoordinates(0, 0), EPSILON);

        depth.renderMap();
        assertEquals(6.0, depth.getValueAtCoordinates(0, 0), EPSILON);
        assertEquals(Double.POSITIVE_INFINITY, depth.getValueAtCoordinates(1, 0));
    }

    @Test
    void testAveragingIsIdempotent() {
        var depth = createMap(UnresolvedDepthPolicy.MERGED);
        primaryRay(depth, 1, 0, 4);
        primaryRay(depth, 1, 0, 8);

        depth.renderMap();
        depth.renderMap();
        depth.renderMap();
        assertEquals(6.0, depth.getDepthAt(1, 0), EPSILON);
    }

    @Test
    void testInitializeClearsAveragedFlag() {
        var depth = createMap(UnresolvedDepthPolicy.MERGED);
        primaryRay(depth, 0, 0, 4);
        depth.renderMap();
        assertTrue(depth.isAveraged());

        primary.initialize(2, 2);
        depth.initialize(2, 2);
        assertFalse(depth.isAveraged());
        assertNull(depth.getBounds());
        assertEquals(0.0, depth.getDepthAt(0, 0));
    }

    @Test
    void testMergedSubstitutesEmptyCellsWithMaximum() {
        var depth = createMap(UnresolvedDepthPolicy.MERGED);
        primaryRay(depth, 0, 0, 1);
        primaryRay(depth, 0, 0, 2);
        primaryRay(depth, 0, 0, 3);
        primaryRay(depth, 1, 1, 10);

        depth.renderMap();
        assertEquals(new MapBounds(2.0, 10.0), depth.getBounds());
        assertEquals(2.0, depth.getValueAtCoordinates(0, 0), EPSILON);
        assertEquals(10.0, depth.getDepthAt(1, 0), EPSILON);
        assertEquals(Double.POSITIVE_INFINITY, depth.getValueAtCoordinates(1, 0));
        assertEquals(Double.POSITIVE_INFINITY, depth.getValueAtCoordinates(1, 1));

        assertEquals(RED, rgb(depth, 0, 0), "Nearest pixel is red");
        assertEquals(BLUE, rgb(depth, 1, 1), "Farthest pixel is blue");
        assertEquals(BLUE, rgb(depth, 0, 1), "Empty pixel renders as the farthest");
    }

    @Test
    void testMergedMissesDominateRange() {
        var depth = createMap(UnresolvedDepthPolicy.MERGED);
        primaryRay(depth, 0, 0, 2);
        primaryRay(depth, 1, 1, 10);
        primaryMiss(depth, 1, 0);

        depth.renderMap();
        assertEquals(new MapBounds(2.0, UNRESOLVED), depth.getBounds());
        assertEquals(10.0, depth.getValueAtCoordinates(1, 1), EPSILON);
        assertEquals(UNRESOLVED, depth.getDepthAt(0, 1), EPSILON);
    }

    @Test
    void testSeparateKeepsResolvedRange() {
        var depth = createMap(UnresolvedDepthPolicy.SEPARATE);
        primaryRay(depth, 0, 0, 2);
        primaryRay(depth, 1, 1, 10);
        primaryMiss(depth, 1, 0);

        depth.renderMap();
        assertEquals(new MapBounds(2.0, 10.0), depth.getBounds());
        assertEquals(10.0, depth.getDepthAt(1, 0), EPSILON, "Miss takes the farthest resolved depth");
        assertEquals(Double.POSITIVE_INFINITY, depth.getValueAtCoordinates(1, 0));
        assertEquals(0.0, depth.getDepthAt(0, 1), "Empty cell is left untouched");

        assertEquals(RED, rgb(depth, 0, 0));
        assertEquals(BLUE, rgb(depth, 1, 0));
        assertEquals(BLUE, rgb(depth, 1, 1));
        assertEquals(EMPTY_COLOR, rgb(depth, 0, 1));
    }

    @Test
    void testSeparateWithoutPrimaryRays() {
        var depth = createMap(UnresolvedDepthPolicy.SEPARATE);
        depth.renderMap();
        assertEquals(new MapBounds(0.0, 0.0), depth.getBounds());
        for (var x = 0; x < 2; x++) {
            for (var y = 0; y < 2; y++) {
                assertEquals(EMPTY_COLOR, rgb(depth, x, y));
            }
        }
    }

    @Test
    void testSeparateOnlyMisses() {
        var depth = createMap(UnresolvedDepthPolicy.SEPARATE);
        primaryMiss(depth, 0, 0);
        primaryMiss(depth, 1, 0);

        depth.renderMap();
        assertEquals(new MapBounds(UNRESOLVED, UNRESOLVED), depth.getBounds());
        assertEquals(UNRESOLVED, depth.getDepthAt(0, 0), EPSILON);
        assertEquals(EMPTY_COLOR, rgb(depth, 1, 1));
    }

    @Test
    void testOutOfGridProbe() {
        var depth = createMap(UnresolvedDepthPolicy.MERGED);
        assertTrue(Double.isNaN(depth.getValueAtCoordinates(-1, 0)));
        assertTrue(Double.isNaN(depth.getValueAtCoordinates(2, 1)));
    }

    @Test
    void testMismatchedRayCountsRejected() {
        primary = new RayCountMap("primary");
        var depth = new DepthMap("depth", primary, UNRESOLVED, UnresolvedDepthPolicy.MERGED, 0);
        primary.initialize(3, 3);
        depth.initialize(2, 2);
        assertThrows(IllegalStateException.class, depth::renderMap);
    }
}
