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
import ai.evacortex.kinetic.core.model.HandPath;
import ai.evacortex.kinetic.core.model.Location;
import ai.evacortex.kinetic.core.model.MotionAttributes;

/**
 * Second half repeats each first-half hand path from wherever the hand now is, which
 * rotates the whole first half about the center when it ends a half turn from its start.
 * A partial ending a quarter turn away is replayed three more times instead.
 */
final class RotatedCapStrategy extends AbstractCapStrategy {

    RotatedCapStrategy(boolean swapped) {
        super(swapped ? CapVariant.ROTATED_SWAPPED : CapVariant.STRICT_ROTATED);
    }

    @Override
    public int indexMap(int nextIndex, int targetLength) {
        return halfOffset(nextIndex, targetLength);
    }

    @Override
    public int indexMap(int nextIndex, int targetLength, CapEligibility eligibility) {
        if (eligibility == CapEligibility.QUARTERED && targetLength >= 4) {
            return replayOffset(nextIndex, targetLength / 4);
        }
        return indexMap(nextIndex, targetLength);
    }

    @Override
    protected MotionAttributes transformMotion(MotionAttributes source, MotionAttributes previous) {
        HandPath path = GeometryTables.handPath(source.startLoc(), source.endLoc());
        Location end = GeometryTables.advance(previous.endLoc(), path);
        return continueFrom(source, previous, end, source.propRotDir(), source.prefloatPropRotDir());
    }
}
