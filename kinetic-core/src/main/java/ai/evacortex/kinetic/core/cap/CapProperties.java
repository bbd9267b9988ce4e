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

/**
 * What the verifier found. At most one variant flag is set. {@code matchedVariant} and
 * {@code mirrorAxis} are {@code null} when nothing matched or the match was not mirrored.
 */
public record CapProperties(boolean isStrictRotated,
                            boolean isStrictMirrored,
                            boolean isStrictSwapped,
                            boolean isMirroredSwapped,
                            boolean isRotatedSwapped,
                            boolean endsAtStartPos,
                            boolean canBeCap,
                            CapVariant matchedVariant,
                            MirrorAxis mirrorAxis,
                            String word,
                            SequenceLevel level) {

    static CapProperties of(CapVariant matched, MirrorAxis axis, boolean endsAtStartPos,
                            boolean canBeCap, String word, SequenceLevel level) {
        return new CapProperties(
                matched == CapVariant.STRICT_ROTATED,
                matched == CapVariant.STRICT_MIRRORED,
                matched == CapVariant.STRICT_SWAPPED,
                matched == CapVariant.MIRRORED_SWAPPED,
                matched == CapVariant.ROTATED_SWAPPED,
                endsAtStartPos, canBeCap, matched, axis, word, level);
    }

    public boolean isCap() {
        return matchedVariant != null;
    }
}
