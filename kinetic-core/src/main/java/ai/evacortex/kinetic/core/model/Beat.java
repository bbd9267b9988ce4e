/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

import java.util.Objects;

/**
 * One synchronized transition of both colored points. {@code letter} and {@code letterType}
 * are {@code null} when the beat has not been, or could not be, classified.
 */
public record Beat(int beatNumber,
                   Letter letter,
                   LetterType letterType,
                   Position startPos,
                   Position endPos,
                   Timing timing,
                   Direction direction,
                   MotionAttributes blue,
                   MotionAttributes red) {

    public Beat {
        Objects.requireNonNull(startPos, "startPos");
        Objects.requireNonNull(endPos, "endPos");
        Objects.requireNonNull(blue, "blue");
        Objects.requireNonNull(red, "red");
        timing = timing == null ? Timing.NONE : timing;
        direction = direction == null ? Direction.NONE : direction;
        if (letter != null && letterType == null) {
            letterType = letter.type();
        }
    }

    public MotionAttributes motion(Color color) {
        return color == Color.BLUE ? blue : red;
    }

    public Beat withBeatNumber(int number) {
        return new Beat(number, letter, letterType, startPos, endPos, timing, direction, blue, red);
    }

    public Beat withLetter(Letter newLetter) {
        return new Beat(beatNumber, newLetter, newLetter == null ? null : newLetter.type(),
                startPos, endPos, timing, direction, blue, red);
    }

    public Beat withMotion(Color color, MotionAttributes motion) {
        return color == Color.BLUE
                ? new Beat(beatNumber, letter, letterType, startPos, endPos, timing, direction, motion, red)
                : new Beat(beatNumber, letter, letterType, startPos, endPos, timing, direction, blue, motion);
    }
}
