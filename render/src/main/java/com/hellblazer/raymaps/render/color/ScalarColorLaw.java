package com.hellblazer.raymaps.render.color;

/**
 * Maps a scalar value within a range to a packed RGB color.
 */
@FunctionalInterface
public interface ScalarColorLaw {

    /** Blue at the minimum through red at the maximum. */
    ScalarColorLaw LINEAR = ColorLaws::linear;

    /** Red at the minimum through blue at the maximum, logarithmic. */
    ScalarColorLaw LOGARITHMIC_REVERSED = ColorLaws::logarithmicReversed;

    /**
     * @param min   Lower bound of the map
     * @param max   Upper bound of the map
     * @param value Cell value
     * @return packed {@code 0xRRGGBB} color
     */
    int color(double min, double max, double value);
}
