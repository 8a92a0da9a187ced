package com.hellblazer.raymaps.render.map;

/**
 * The closed set of accumulator value types. Each type declares the identity values that seed a min/max scan: the
 * scan starts with {@code min = maximalIdentity} and {@code max = minimalIdentity}.
 */
public enum AccumulatorKind {
    /** Integer ray counters. */
    COUNT(Integer.MIN_VALUE, Integer.MAX_VALUE),
    /** Double running sums. */
    SUM(-Double.MAX_VALUE, Double.MAX_VALUE),
    /** 3D vector sums; vectors have no total order, so there are no identities. */
    VECTOR(Double.NaN, Double.NaN);

    private final double minimalIdentity;
    private final double maximalIdentity;

    AccumulatorKind(double minimalIdentity, double maximalIdentity) {
        this.minimalIdentity = minimalIdentity;
        this.maximalIdentity = maximalIdentity;
    }

    /**
     * @return true if values of this type can be ordered for bound discovery
     */
    public boolean hasIdentities() {
        return !Double.isNaN(minimalIdentity) && !Double.isNaN(maximalIdentity);
    }

    /**
     * @return the smallest representable value
     * @throws AccumulationException.UnsupportedAccumulatorException if the type is not ordered
     */
    public double minimalIdentity() {
        if (!hasIdentities()) {
            throw new AccumulationException.UnsupportedAccumulatorException(this, name());
        }
        return minimalIdentity;
    }

    /**
     * @return the largest representable value
     * @throws AccumulationException.UnsupportedAccumulatorException if the type is not ordered
     */
    public double maximalIdentity() {
        if (!hasIdentities()) {
            throw new AccumulationException.UnsupportedAccumulatorException(this, name());
        }
        return maximalIdentity;
    }
}
