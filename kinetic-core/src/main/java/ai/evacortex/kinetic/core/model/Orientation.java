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

/**
 * Prop orientation. IN and OUT are radial, CLOCK and COUNTER are nonradial.
 */
public enum Orientation {
    IN, OUT, CLOCK, COUNTER;

    public boolean isRadial() {
        return this == IN || this == OUT;
    }

    /** The other member of the same category. */
    public Orientation switched() {
        return switch (this) {
            case IN -> OUT;
            case OUT -> IN;
            case CLOCK -> COUNTER;
            case COUNTER -> CLOCK;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Orientation fromWire(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown orientation: " + value, e);
        }
    }
}
