/*
 * Copyright (c) 2026, Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.raymaps.geometry;

import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

/**
 * Vector helpers for the diagnostic maps.
 *
 * <p>{@link Vector3d#normalize()} divides by the length unconditionally and {@link Vector3d#angle(Vector3d)} clamps
 * its cosine, so neither reports a degenerate input. These variants keep zero vectors visible to the caller.
 *
 * @author hal.hildebrand
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * @return true if all components are exactly zero
     */
    public static boolean isZero(Tuple3d v) {
        return v.x == 0.0 && v.y == 0.0 && v.z == 0.0;
    }

    /**
     * Normalizes the vector in place unless it is the zero vector, which is left untouched.
     *
     * @param v Vector to normalize
     * @return the same vector, for chaining
     */
    public static Vector3d normalizeIfNonZero(Vector3d v) {
        if (!isZero(v)) {
            v.normalize();
        }
        return v;
    }

    /**
     * Angle between two vectors in degrees, {@code acos(a.b / (|a||b|))}.
     *
     * @return the angle in [0, 180], or NaN if either vector has zero length
     */
    public static double angleDegrees(Vector3d a, Vector3d b) {
        double cos = a.dot(b) / (a.length() * b.length());
        if (Double.isNaN(cos)) {
            return Double.NaN;
        }
        // Rounding can push the cosine of parallel vectors just past 1
        cos = Math.max(-1.0, Math.min(1.0, cos));
        return Math.toDegrees(Math.acos(cos));
    }
}
