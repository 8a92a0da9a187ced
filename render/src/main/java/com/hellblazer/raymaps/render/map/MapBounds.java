package com.hellblazer.raymaps.render.map;

/**
 * Value range of a scalar map, used to scale its color law.
 *
 * @param min Smallest value found by the scan
 * @param max Largest value found by the scan
 */
public record MapBounds(double min, double max) {

    /**
     * @return true if the scan saw no cell, leaving the seeds in place ({@code min > max})
     */
    public boolean isEmpty() {
        return min > max;
    }
}
