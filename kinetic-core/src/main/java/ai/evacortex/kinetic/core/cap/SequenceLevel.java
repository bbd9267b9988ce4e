/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.cap;

import ai.evacortex.kinetic.core.model.Beat;
import ai.evacortex.kinetic.core.model.Color;
import ai.evacortex.kinetic.core.model.MotionAttributes;
import ai.evacortex.kinetic.core.model.Orientation;
import ai.evacortex.kinetic.core.model.Sequence;

import java.util.ArrayList;
import java.util.List;

/**
 * Difficulty of a sequence. A non-radial orientation anywhere makes it ADVANCED; otherwise
 * any numeric turns make it INTERMEDIATE. Float turns count as no turns.
 */
public enum SequenceLevel {
    BASIC(1), INTERMEDIATE(2), ADVANCED(3);

    private final int number;

    SequenceLevel(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public static SequenceLevel of(Sequence sequence) {
        List<Beat> beats = new ArrayList<>(sequence.length() + 1);
        if (sequence.startPositionBeat() != null) beats.add(sequence.startPositionBeat());
        beats.addAll(sequence.beats());

        SequenceLevel level = BASIC;
        for (Beat beat : beats) {
            for (Color color : Color.values()) {
                MotionAttributes motion = beat.motion(color);
                if (isNonRadial(motion.startOri()) || isNonRadial(motion.endOri())) {
                    return ADVANCED;
                }
                if (!motion.turns().floating() && !motion.turns().isZero()) {
                    level = INTERMEDIATE;
                }
            }
        }
        return level;
    }

    private static boolean isNonRadial(Orientation ori) {
        return ori != null && !ori.isRadial();
    }
}
