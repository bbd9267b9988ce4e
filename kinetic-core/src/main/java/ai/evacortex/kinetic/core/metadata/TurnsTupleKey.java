/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.metadata;

import ai.evacortex.kinetic.core.model.MotionAttributes;
import ai.evacortex.kinetic.core.model.RotationDirection;

import java.util.Objects;

/**
 * Fourth-level key of the override store, e.g. {@code "(s, 1, 0.5)"} or {@code "(0, fl)"}.
 * The optional prefix is {@code s} when both props rotate the same way and {@code o} when they
 * rotate opposite ways; it is omitted when either prop does not rotate.
 */
public record TurnsTupleKey(String value) {

    public TurnsTupleKey {
        Objects.requireNonNull(value, "value");
    }

    public static TurnsTupleKey of(MotionAttributes blue, MotionAttributes red) {
        StringBuilder sb = new StringBuilder("(");
        String prefix = directionPrefix(blue.propRotDir(), red.propRotDir());
        if (prefix != null) {
            sb.append(prefix).append(", ");
        }
        sb.append(blue.turns()).append(", ").append(red.turns()).append(')');
        return new TurnsTupleKey(sb.toString());
    }

    private static String directionPrefix(RotationDirection blue, RotationDirection red) {
        if (!blue.isRotating() || !red.isRotating()) return null;
        return blue == red ? "s" : "o";
    }

    @Override
    public String toString() {
        return value;
    }
}
