/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

import ai.evacortex.kinetic.core.exceptions.InvalidMotionException;

/**
 * Number of prop revolutions in a motion, in half-turn steps from 0 to 3, or the
 * float sentinel {@code "fl"} carried by float motions.
 */
public record Turns(double value, boolean floating) {

    public static final double MAX = 3.0;
    public static final String FLOAT_SENTINEL = "fl";

    public static final Turns ZERO = new Turns(0.0, false);
    public static final Turns FLOAT = new Turns(0.0, true);

    public Turns {
        if (!floating) {
            if (Double.isNaN(value) || value < 0) {
                throw new InvalidMotionException("turns must be non-negative, got " + value);
            }
            if (value * 2 != Math.rint(value * 2)) {
                throw new InvalidMotionException("turns must be a multiple of 0.5, got " + value);
            }
            if (value > MAX) {
                throw new InvalidMotionException("turns must not exceed " + MAX + ", got " + value);
            }
        } else if (value != 0.0) {
            throw new InvalidMotionException("float turns carry no numeric value");
        }
    }

    public static Turns of(double value) {
        return value == 0.0 ? ZERO : new Turns(value, false);
    }

    public static Turns parse(String text) {
        if (text == null) {
            throw new InvalidMotionException("turns must not be null");
        }
        String trimmed = text.trim();
        if (FLOAT_SENTINEL.equalsIgnoreCase(trimmed)) {
            return FLOAT;
        }
        try {
            return of(Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            throw new InvalidMotionException("unparseable turns '" + text + "'", e);
        }
    }

    public boolean isZero() {
        return !floating && value == 0.0;
    }

    public boolean isWhole() {
        return !floating && value == Math.rint(value);
    }

    public boolean isHalf() {
        return !floating && !isWhole();
    }

    /** Whole-turn count; only meaningful when {@link #isWhole()}. */
    public int whole() {
        return (int) value;
    }

    /** Renders {@code 0}, {@code 0.5}, {@code 1} ... or {@code fl}. */
    @Override
    public String toString() {
        if (floating) return FLOAT_SENTINEL;
        return isWhole() ? Integer.toString(whole()) : Double.toString(value);
    }
}
