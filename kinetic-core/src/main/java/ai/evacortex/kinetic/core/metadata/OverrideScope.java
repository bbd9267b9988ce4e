/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.metadata;

import ai.evacortex.kinetic.core.model.*;

import java.util.Objects;

/**
 * Address of one leaf object in the override store:
 * {@code [grid][orientation category][letter][turns tuple]}.
 */
public record OverrideScope(GridMode grid, OrientationCategory category, Letter letter, TurnsTupleKey turns) {

    public OverrideScope {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(letter, "letter");
        Objects.requireNonNull(turns, "turns");
    }

    /**
     * Scope of a classified beat, or {@code null} when the beat has no letter or either
     * motion lacks a start orientation.
     */
    public static OverrideScope forBeat(Beat beat) {
        if (beat.letter() == null || beat.blue().startOri() == null || beat.red().startOri() == null) {
            return null;
        }
        return new OverrideScope(
                GridMode.of(beat.blue().startLoc()),
                OrientationCategory.of(beat.blue().startOri(), beat.red().startOri()),
                beat.letter(),
                TurnsTupleKey.of(beat.blue(), beat.red()));
    }
}
