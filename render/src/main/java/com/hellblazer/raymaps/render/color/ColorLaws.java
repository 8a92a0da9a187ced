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
package com.hellblazer.raymaps.render.color;

import javax.vecmath.Tuple3d;
import java.awt.Color;

/**
 * Color laws for the diagnostic maps. All colors are packed {@code 0xRRGGBB} integers, as consumed by
 * {@link java.awt.image.BufferedImage#setRGB(int, int, int)}.
 *
 * <p>Hue gradients run over 240 degrees of the HSV wheel, dark blue through turquoise, green, yellow and orange to
 * red. The range stops at blue so that the two ends never meet again in purple.
 */
public final class ColorLaws {

    /** Hue span of the gradients, in degrees. */
    public static final double HUE_RANGE = 240.0;

    /** Color used where a value cannot be expressed, e.g. an undefined angle. */
    public static final int UNDEFINED_COLOR = 0x010101;

    private ColorLaws() {
    }

    /**
     * Converts an HSV color to packed RGB.
     *
     * @param hue        Hue in degrees; wraps around 360
     * @param saturation Saturation in [0, 1]
     * @param value      Value in [0, 1]
     * @return packed RGB
     */
    public static int hsvToRgb(double hue, double saturation, double value) {
        return Color.HSBtoRGB((float) (hue / 360.0), (float) saturation, (float) value) & 0xFFFFFF;
    }

    /**
     * Hue of the linear law: blue (240) at {@code min}, red (0) at {@code max}. A degenerate range yields blue.
     */
    public static double linearHue(double min, double max, double value) {
        double colorValue = (value - min) / (max - min) * HUE_RANGE;
        if (!Double.isFinite(colorValue)) {
            colorValue = 0;
        }
        return HUE_RANGE - colorValue;
    }

    /**
     * Linear gradient from dark blue (close to {@code min}) to red (close to {@code max}).
     */
    public static int linear(double min, double max, double value) {
        return hsvToRgb(linearHue(min, max, value), 1, 1);
    }

    /**
     * Hue of the reversed logarithmic law, {@code 240 * log_(max - min + 1)(value - min + 1)}: red (0) at {@code min},
     * blue (240) at {@code max}. A non-finite result yields red.
     */
    public static double logarithmicReversedHue(double min, double max, double value) {
        double colorValue = Math.log(value - min + 1) / Math.log(max - min + 1) * HUE_RANGE;
        if (!Double.isFinite(colorValue)) {
            colorValue = 0;
        }
        return colorValue;
    }

    /**
     * Logarithmic gradient from red (close to {@code min}) to dark blue (close to {@code max}).
     */
    public static int logarithmicReversed(double min, double max, double value) {
        return hsvToRgb(logarithmicReversedHue(min, max, value), 1, 1);
    }

    /**
     * Encodes a direction in the color channels. Each component in [-1, 1] maps to {@code (int) ((c + 1) * 127.5)};
     * blue is inverted ({@code 255 - ...}) so that a surface facing the viewer does not saturate every channel.
     * Channel values are truncated, not rounded: (0, 0, 1) encodes as (127, 127, 0) and the zero vector as
     * (127, 127, 128).
     *
     * @param direction Direction, normally of unit length
     * @return packed RGB
     */
    public static int encodeDirection(Tuple3d direction) {
        int red = channel(direction.x);
        int green = channel(direction.y);
        int blue = 255 - channel(direction.z);
        return rgb(red, green, blue);
    }

    /**
     * Hue gradient over an angle: 0 degrees is blue, 90 degrees and beyond red. NaN angles map to
     * {@link #UNDEFINED_COLOR}.
     *
     * @param angleDegrees Angle in degrees
     * @return packed RGB
     */
    public static int angle(double angleDegrees) {
        double colorValue = angleDegrees / 90 * HUE_RANGE;
        if (Double.isNaN(colorValue)) {
            return UNDEFINED_COLOR;
        }
        return hsvToRgb(HUE_RANGE - colorValue, 1, 1);
    }

    /**
     * Packs clamped channel values.
     */
    public static int rgb(int red, int green, int blue) {
        return clamp(red) << 16 | clamp(green) << 8 | clamp(blue);
    }

    private static int channel(double component) {
        return (int) ((component + 1) * 127.5);
    }

    private static int clamp(int channel) {
        return Math.max(0, Math.min(255, channel));
    }
}
