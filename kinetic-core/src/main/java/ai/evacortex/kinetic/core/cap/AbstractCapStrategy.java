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
import ai.evacortex.kinetic.core.model.Location;
import ai.evacortex.kinetic.core.model.MotionAttributes;
import ai.evacortex.kinetic.core.model.RotationDirection;

abstract class AbstractCapStrategy implements CapStrategy {

    private final CapVariant variant;

    protected AbstractCapStrategy(CapVariant variant) {
        this.variant = variant;
    }

    @Override
    public CapVariant variant() {
        return variant;
    }

    /** Source beat {@code i - L/2}: the second half replays the first in order. */
    protected static int halfOffset(int nextIndex, int targetLength) {
        if (targetLength < 2) return 0;
        return replayOffset(nextIndex, targetLength / 2);
    }

    /** Source beat {@code i - step}, as a 0-based index. */
    protected static int replayOffset(int nextIndex, int step) {
        return nextIndex - step - 1;
    }

    @Override
    public Draft transform(Beat source, Beat previous) {
        boolean swapped = variant.isSwapped();
        MotionAttributes blueSource = swapped ? source.red() : source.blue();
        MotionAttributes redSource = swapped ? source.blue() : source.red();
        return new Draft(source.letter(), source.timing(), source.direction(),
                transformMotion(blueSource, previous.blue()),
                transformMotion(redSource, previous.red()));
    }

    protected abstract MotionAttributes transformMotion(MotionAttributes source, MotionAttributes previous);

    /**
     * The source's motion type and turns, started where {@code previous} ended. The end
     * orientation is left for the orientation calculator.
     */
    protected static MotionAttributes continueFrom(MotionAttributes source, MotionAttributes previous,
                                                   Location endLoc, RotationDirection propRotDir,
                                                   RotationDirection prefloatPropRotDir) {
        return new MotionAttributes(source.motionType(), previous.endLoc(), endLoc, previous.endOri(), null,
                source.turns(), propRotDir, source.prefloatMotionType(), prefloatPropRotDir);
    }
}
