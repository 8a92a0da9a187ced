package com.hellblazer.raymaps.render;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * First intersection of a traced ray, as reported by the renderer.
 *
 * @param coordWorld World coordinate of the intersection
 * @param normal     Surface normal at the intersection
 */
public record Hit(Point3d coordWorld, Vector3d normal) {

    /**
     * Copies the tuples, which are mutable.
     */
    public Hit {
        if (coordWorld == null || normal == null) {
            throw new IllegalArgumentException("Hit coordinate and normal cannot be null");
        }
        coordWorld = new Point3d(coordWorld);
        normal = new Vector3d(normal);
    }

    /**
     * @return distance from a ray origin to the intersection
     */
    public double distanceFrom(Point3d rayOrigin) {
        return rayOrigin.distance(coordWorld);
    }
}
