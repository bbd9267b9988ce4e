/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.cap;

import ai.evacortex.kinetic.core.geometry.GeometryTables;
import ai.evacortex.kinetic.core.model.Position;
import ai.evacortex.kinetic.core.model.RotationDirection;
import ai.evacortex.kinetic.core.model.Sequence;

/**
 * How a partial sequence's end relates to its start, which decides how much of a full
 * cycle it covers when rotated: SAME closes on its own, HALVED after doubling, QUARTERED
 * after four repetitions.
 */
public enum CapEligibility {
    SAME, HALVED, QUARTERED, NONE;

    public static CapEligibility of(Sequence partial) {
        if (partial.length() == 0) return NONE;
        Position start = partial.initialPosition();
        Position end = partial.last().endPos();
        if (start == end) return SAME;
        if (GeometryTables.rotatePosition(start, RotationDirection.CW, 2) == end) return HALVED;
        if (GeometryTables.rotatePosition(start, RotationDirection.CW, 1) == end
                || GeometryTables.rotatePosition(start, RotationDirection.CCW, 1) == end) {
            return QUARTERED;
        }
        return NONE;
    }
}
