/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

public enum RotationDirection {
    CW("cw"),
    CCW("ccw"),
    NONE("no_rot");

    private final String wireName;

    RotationDirection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isRotating() {
        return this != NONE;
    }

    public RotationDirection opposite() {
        return switch (this) {
            case CW -> CCW;
            case CCW -> CW;
            case NONE -> NONE;
        };
    }

    public static RotationDirection fromWire(String value) {
        for (RotationDirection dir : values()) {
            if (dir.wireName.equalsIgnoreCase(value)) return dir;
        }
        throw new IllegalArgumentException("Unknown rotation direction: " + value);
    }
}
