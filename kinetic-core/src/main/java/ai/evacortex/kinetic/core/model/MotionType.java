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

public enum MotionType {
    PRO, ANTI, STATIC, DASH, FLOAT;

    /** Shift motions move the hand to an adjacent position. */
    public boolean isShift() {
        return this == PRO || this == ANTI || this == FLOAT;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MotionType fromWire(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown motion type: " + value, e);
        }
    }
}
