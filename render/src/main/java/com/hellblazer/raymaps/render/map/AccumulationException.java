/*
 * Copyright (c) 2026 Hal Hildebrand. All rights reserved.
 * This file is part of Raymaps, licensed under the GNU Affero General Public License v3.0 (AGPL-3.0).
 * See LICENSE file for details.
 */

package com.hellblazer.raymaps.render.map;

/**
 * Sealed exception hierarchy for ray statistics accumulation.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link UnsupportedAccumulatorException} - a map requires bound discovery over an accumulator type that has no
 * minimal/maximal identity values; raised when the map is constructed</li>
 * <li>{@link UnsizedGridException} - an operation needs a grid but no render resolution has been set</li>
 * </ul>
 * Invalid arguments are reported with {@link IllegalArgumentException}, out-of-grid writes with
 * {@link IndexOutOfBoundsException}.
 */
public sealed class AccumulationException extends RuntimeException
    permits AccumulationException.UnsupportedAccumulatorException, AccumulationException.UnsizedGridException {

    /**
     * Constructs a new accumulation exception with the specified detail message.
     *
     * @param message the detail message
     */
    public AccumulationException(String message) {
        super(message);
    }

    /**
     * Accumulator type cannot support bound discovery.
     */
    public static final class UnsupportedAccumulatorException extends AccumulationException {

        private final AccumulatorKind kind;

        /**
         * @param kind    the accumulator type lacking identity values
         * @param mapName name of the map being constructed
         */
        public UnsupportedAccumulatorException(AccumulatorKind kind, String mapName) {
            super(String.format("Unsupported accumulator type %s for map '%s': no minimal/maximal identity for bound "
                                + "discovery", kind, mapName));
            this.kind = kind;
        }

        public AccumulatorKind getKind() {
            return kind;
        }
    }

    /**
     * No render resolution is known for the grid.
     */
    public static final class UnsizedGridException extends AccumulationException {

        /**
         * Constructs a new unsized grid exception with the specified detail message.
         *
         * @param message the detail message
         */
        public UnsizedGridException(String message) {
            super(message);
        }
    }
}
