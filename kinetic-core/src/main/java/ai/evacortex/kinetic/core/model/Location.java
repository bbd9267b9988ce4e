/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One of the eight compass points a hand can occupy. Declaration order runs clockwise
 * from north in 45° steps; the geometry tables rely on that order.
 */
public enum Location {
    N, NE, E, SE, S, SW, W, NW;

    private static final Map<String, Location> BY_WIRE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Location::wireName, Function.identity()));

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Cardinal points are the hand positions of the diamond grid. */
    public boolean isCardinal() {
        return ordinal() % 2 == 0;
    }

    public static Location fromWire(String value) {
        Location loc = value == null ? null : BY_WIRE.get(value.trim().toLowerCase(Locale.ROOT));
        if (loc == null) {
            throw new IllegalArgumentException("Unknown location: " + value);
        }
        return loc;
    }
}
