/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.cap;

import ai.evacortex.kinetic.core.geometry.MirrorAxis;

public final class CapStrategies {

    private CapStrategies() {}

    /**
     * @param axis reflection axis; ignored by non-mirrored variants
     */
    public static CapStrategy forVariant(CapVariant variant, MirrorAxis axis) {
        return switch (variant) {
            case STRICT_ROTATED -> new RotatedCapStrategy(false);
            case ROTATED_SWAPPED -> new RotatedCapStrategy(true);
            case STRICT_MIRRORED -> new MirroredCapStrategy(false, axis);
            case MIRRORED_SWAPPED -> new MirroredCapStrategy(true, axis);
            case STRICT_SWAPPED -> new SwappedCapStrategy();
        };
    }
}
