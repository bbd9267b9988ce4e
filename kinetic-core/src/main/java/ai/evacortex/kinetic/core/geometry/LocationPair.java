/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.geometry;

import ai.evacortex.kinetic.core.model.Location;

/**
 * Ordered (start, end) key for lookup tables.
 */
public record LocationPair(Location start, Location end) {

    public static LocationPair of(Location start, Location end) {
        return new LocationPair(start, end);
    }

    public LocationPair reversed() {
        return new LocationPair(end, start);
    }
}
