package com.hellblazer.raymaps.render;

import com.hellblazer.raymaps.render.map.UnresolvedDepthPolicy;

/**
 * Configuration parameters for an {@link AccumulationContext}.
 */
public class AccumulationConfig {

    /** Depth registered for a primary ray that hits nothing. */
    public static final double DEFAULT_UNRESOLVED_DEPTH = 10000.0;

    private final double                unresolvedDepth;
    private final UnresolvedDepthPolicy depthPolicy;
    private final int                   emptyCellColor;
    private final int                   initialWidth;
    private final int                   initialHeight;

    public static class Builder {
        private double                unresolvedDepth = DEFAULT_UNRESOLVED_DEPTH;
        private UnresolvedDepthPolicy depthPolicy     = UnresolvedDepthPolicy.MERGED;
        private int                   emptyCellColor  = 0x000000;
        private int                   initialWidth    = 0;
        private int                   initialHeight   = 0;

        public Builder withUnresolvedDepth(double unresolvedDepth) {
            this.unresolvedDepth = unresolvedDepth;
            return this;
        }

        public Builder withDepthPolicy(UnresolvedDepthPolicy depthPolicy) {
            this.depthPolicy = depthPolicy;
            return this;
        }

        public Builder withEmptyCellColor(int emptyCellColor) {
            this.emptyCellColor = emptyCellColor;
            return this;
        }

        /**
         * Render resolution to accumulate at before the first {@link AccumulationContext#setNewDimensions(int, int)}.
         */
        public Builder withInitialResolution(int width, int height) {
            this.initialWidth = width;
            this.initialHeight = height;
            return this;
        }

        public AccumulationConfig build() {
            if (!(unresolvedDepth > 0) || Double.isInfinite(unresolvedDepth)) {
                throw new IllegalArgumentException("Unresolved depth must be positive and finite: " + unresolvedDepth);
            }
            if (depthPolicy == null) {
                throw new IllegalArgumentException("Depth policy cannot be null");
            }
            if (emptyCellColor < 0 || emptyCellColor > 0xFFFFFF) {
                throw new IllegalArgumentException(String.format("Empty cell color must be 0xRRGGBB: 0x%X",
                                                                 emptyCellColor));
            }
            if (initialWidth < 0 || initialHeight < 0 || (initialWidth == 0) != (initialHeight == 0)) {
                throw new IllegalArgumentException(
                "Initial resolution must be both zero or both positive: " + initialWidth + "x" + initialHeight);
            }
            return new AccumulationConfig(unresolvedDepth, depthPolicy, emptyCellColor, initialWidth, initialHeight);
        }
    }

    private AccumulationConfig(double unresolvedDepth, UnresolvedDepthPolicy depthPolicy, int emptyCellColor,
                               int initialWidth, int initialHeight) {
        this.unresolvedDepth = unresolvedDepth;
        this.depthPolicy = depthPolicy;
        this.emptyCellColor = emptyCellColor;
        this.initialWidth = initialWidth;
        this.initialHeight = initialHeight;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AccumulationConfig defaultConfig() {
        return new Builder().build();
    }

    // Getters
    public double getUnresolvedDepth() { return unresolvedDepth; }
    public UnresolvedDepthPolicy getDepthPolicy() { return depthPolicy; }
    public int getEmptyCellColor() { return emptyCellColor; }
    public int getInitialWidth() { return initialWidth; }
    public int getInitialHeight() { return initialHeight; }

    @Override
    public String toString() {
        return String.format("AccumulationConfig{unresolvedDepth=%s, depthPolicy=%s, emptyCellColor=0x%06X, %dx%d}",
                             unresolvedDepth, depthPolicy, emptyCellColor, initialWidth, initialHeight);
    }
}
