/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

/**
 * Static six-way partition of the alphabet by the kinds of motion a letter is made of.
 */
public enum LetterType {
    TYPE1("Dual-Shift"),
    TYPE2("Shift"),
    TYPE3("Cross-Shift"),
    TYPE4("Dash"),
    TYPE5("Dual-Dash"),
    TYPE6("Static");

    private final String description;

    LetterType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
