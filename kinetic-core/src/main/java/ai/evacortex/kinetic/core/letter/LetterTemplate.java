/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.letter;

import ai.evacortex.kinetic.core.model.*;

import java.util.Objects;

/**
 * One canonical record of how a letter is performed.
 */
public record LetterTemplate(Letter letter,
                             Position startPos,
                             Position endPos,
                             Timing timing,
                             Direction direction,
                             MotionAttributes blue,
                             MotionAttributes red) {

    public LetterTemplate {
        Objects.requireNonNull(letter, "letter");
        Objects.requireNonNull(startPos, "startPos");
        Objects.requireNonNull(endPos, "endPos");
        Objects.requireNonNull(blue, "blue");
        Objects.requireNonNull(red, "red");
    }

    public MotionAttributes motion(Color color) {
        return color == Color.BLUE ? blue : red;
    }
}
