package com.hellblazer.raymaps.render.map;

/**
 * How the depth map renders pixels whose depth is unknown: pixels whose primary rays all missed (holding the
 * unresolved placeholder) and pixels that received no primary ray at all.
 */
public enum UnresolvedDepthPolicy {
    /**
     * Bounds are scanned over the whole grid, then both kinds of pixel are set to the maximum and rendered with the
     * farthest-distance color.
     */
    MERGED,
    /**
     * Bounds are scanned over resolved pixels only. Missed pixels take the farthest resolved color; pixels without
     * primary rays are rendered with the configured empty-cell color.
     */
    SEPARATE
}
