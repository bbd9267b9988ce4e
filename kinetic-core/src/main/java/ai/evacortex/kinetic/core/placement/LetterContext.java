/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.placement;

import ai.evacortex.kinetic.core.metadata.OverrideScope;
import ai.evacortex.kinetic.core.model.Beat;
import ai.evacortex.kinetic.core.model.Direction;
import ai.evacortex.kinetic.core.model.Letter;
import ai.evacortex.kinetic.core.model.LetterType;

/**
 * What the resolver needs to know about the beat an arrow belongs to: its letter, if
 * classified, the relation between the two hands, and the override scope.
 */
public record LetterContext(Letter letter, Direction direction, OverrideScope scope) {

    public static final LetterContext NONE = new LetterContext(null, Direction.NONE, null);

    public LetterContext {
        direction = direction == null ? Direction.NONE : direction;
    }

    public static LetterContext of(Beat beat) {
        return new LetterContext(beat.letter(), beat.direction(), OverrideScope.forBeat(beat));
    }

    public boolean is(Letter... candidates) {
        for (Letter candidate : candidates) {
            if (candidate == letter) return true;
        }
        return false;
    }

    /** Dash paired with a shift whose anchor steers the dash's own. */
    public boolean isShiftComposed() {
        return letter != null && letter.type() == LetterType.TYPE3;
    }
}
