package com.hellblazer.raymaps.render;

/**
 * The maps held by an {@link AccumulationContext}.
 */
public enum MapKind {
    PRIMARY_RAYS("Primary Rays"),
    ALL_RAYS("All Rays"),
    DEPTH("Depth"),
    NORMALS_RELATIVE("Normals (Relative)"),
    NORMALS_ABSOLUTE("Normals (Absolute)"),
    NORMALS_ANGLE("Normals (Angle)");

    private final String displayName;

    MapKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
