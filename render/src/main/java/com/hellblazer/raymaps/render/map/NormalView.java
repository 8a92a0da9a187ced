package com.hellblazer.raymaps.render.map;

import com.hellblazer.raymaps.geometry.Vectors;
import com.hellblazer.raymaps.render.color.ColorLaws;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Projections of the averaged normal and hit coordinate of a pixel to a color.
 */
public enum NormalView {
    /**
     * Direction of the averaged surface normal.
     */
    ABSOLUTE {
        @Override
        public int color(Vector3d normal, Vector3d intersection, Point3d rayOrigin) {
            return ColorLaws.encodeDirection(Vectors.normalizeIfNonZero(new Vector3d(normal)));
        }
    },
    /**
     * Direction of {@code origin - intersection - normal}, the normal seen from the ray origin.
     */
    RELATIVE {
        @Override
        public int color(Vector3d normal, Vector3d intersection, Point3d rayOrigin) {
            var relative = new Vector3d(rayOrigin);
            relative.sub(intersection);
            relative.sub(normal);
            return ColorLaws.encodeDirection(Vectors.normalizeIfNonZero(relative));
        }
    },
    /**
     * Angle between the normal and the direction back to the ray origin as a hue gradient.
     */
    ANGLE {
        @Override
        public int color(Vector3d normal, Vector3d intersection, Point3d rayOrigin) {
            return ColorLaws.angle(angleDegrees(normal, intersection, rayOrigin));
        }
    };

    /**
     * Angle in degrees between the normal and {@code origin - intersection}.
     *
     * @return the angle, NaN if either vector has zero length
     */
    public static double angleDegrees(Vector3d normal, Vector3d intersection, Point3d rayOrigin) {
        var toOrigin = new Vector3d(rayOrigin);
        toOrigin.sub(intersection);
        return Vectors.angleDegrees(normal, toOrigin);
    }

    /**
     * @param normal       Averaged surface normal
     * @param intersection Averaged world coordinate of the hits
     * @param rayOrigin    Origin of the rays
     * @return packed {@code 0xRRGGBB} color
     */
    public abstract int color(Vector3d normal, Vector3d intersection, Point3d rayOrigin);
}
