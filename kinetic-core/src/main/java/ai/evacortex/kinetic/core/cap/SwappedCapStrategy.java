/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.cap;

import ai.evacortex.kinetic.core.model.MotionAttributes;

/**
 * Second half replays the first with the hands' roles exchanged.
 */
final class SwappedCapStrategy extends AbstractCapStrategy {

    SwappedCapStrategy() {
        super(CapVariant.STRICT_SWAPPED);
    }

    @Override
    public int indexMap(int nextIndex, int targetLength) {
        return halfOffset(nextIndex, targetLength);
    }

    @Override
    protected MotionAttributes transformMotion(MotionAttributes source, MotionAttributes previous) {
        return continueFrom(source, previous, source.endLoc(), source.propRotDir(), source.prefloatPropRotDir());
    }
}
