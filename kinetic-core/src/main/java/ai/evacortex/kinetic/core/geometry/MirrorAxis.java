/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.geometry;

import java.util.Locale;

/**
 * Axis of reflection. VERTICAL exchanges east and west, HORIZONTAL exchanges north and south.
 */
public enum MirrorAxis {
    VERTICAL, HORIZONTAL;

    public static MirrorAxis fromWire(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown mirror axis: " + value, e);
        }
    }
}
