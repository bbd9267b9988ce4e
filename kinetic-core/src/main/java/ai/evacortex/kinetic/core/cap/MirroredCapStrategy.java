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
import ai.evacortex.kinetic.core.geometry.MirrorAxis;
import ai.evacortex.kinetic.core.model.Location;
import ai.evacortex.kinetic.core.model.MotionAttributes;
import ai.evacortex.kinetic.core.model.RotationDirection;

import java.util.Objects;

/**
 * Second half reflects the first across {@code axis}, beat by beat in the original order.
 * Reflection reverses every rotation. The result closes on its initial position when that
 * position lies on the axis, as alpha1 does for VERTICAL.
 */
final class MirroredCapStrategy extends AbstractCapStrategy {

    private final MirrorAxis axis;

    MirroredCapStrategy(boolean swapped, MirrorAxis axis) {
        super(swapped ? CapVariant.MIRRORED_SWAPPED : CapVariant.STRICT_MIRRORED);
        this.axis = Objects.requireNonNull(axis, "axis");
    }

    @Override
    public int indexMap(int nextIndex, int targetLength) {
        return halfOffset(nextIndex, targetLength);
    }

    @Override
    protected MotionAttributes transformMotion(MotionAttributes source, MotionAttributes previous) {
        Location end = GeometryTables.mirror(source.endLoc(), axis);
        RotationDirection prefloat = source.prefloatPropRotDir() == null ? null : source.prefloatPropRotDir().opposite();
        return continueFrom(source, previous, end, source.propRotDir().opposite(), prefloat);
    }
}
