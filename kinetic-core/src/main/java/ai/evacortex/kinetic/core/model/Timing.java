/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

import java.util.Locale;

public enum Timing {
    SPLIT, TOG, QUARTER, NONE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Timing fromWire(String value) {
        return value == null ? NONE : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
