/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.cap;

/**
 * CAP variants in the order the verifier tries them.
 */
public enum CapVariant {
    STRICT_ROTATED(false, false),
    STRICT_MIRRORED(true, false),
    STRICT_SWAPPED(false, true),
    MIRRORED_SWAPPED(true, true),
    ROTATED_SWAPPED(false, true);

    private final boolean mirrored;
    private final boolean swapped;

    CapVariant(boolean mirrored, boolean swapped) {
        this.mirrored = mirrored;
        this.swapped = swapped;
    }

    public boolean isMirrored() {
        return mirrored;
    }

    public boolean isSwapped() {
        return swapped;
    }
}
