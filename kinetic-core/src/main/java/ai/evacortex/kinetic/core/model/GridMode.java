/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

import java.util.List;
import java.util.Locale;

public enum GridMode {
    DIAMOND(List.of(Location.N, Location.E, Location.S, Location.W)),
    BOX(List.of(Location.NE, Location.SE, Location.SW, Location.NW));

    private final List<Location> handPositions;

    GridMode(List<Location> handPositions) {
        this.handPositions = handPositions;
    }

    /** Hand positions of this grid, clockwise. */
    public List<Location> handPositions() {
        return handPositions;
    }

    public boolean contains(Location loc) {
        return handPositions.contains(loc);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GridMode of(Location loc) {
        return loc.isCardinal() ? DIAMOND : BOX;
    }

    public static GridMode fromWire(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown grid mode: " + value, e);
        }
    }
}
