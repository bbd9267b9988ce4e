/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.cap;

import ai.evacortex.kinetic.core.model.*;

/**
 * One CAP variant, expressed as the two hooks the generator's loop needs.
 */
public interface CapStrategy {

    /** Raw fields of a new beat, before positions and end orientations are filled in. */
    record Draft(Letter letter, Timing timing, Direction direction, MotionAttributes blue, MotionAttributes red) {}

    CapVariant variant();

    /**
     * Picks the beat a new beat is derived from.
     *
     * @param nextIndex    1-based number of the beat being generated
     * @param targetLength final number of beats
     * @return 0-based index into the beats generated so far
     */
    int indexMap(int nextIndex, int targetLength);

    /**
     * Variant of {@link #indexMap(int, int)} that may pick its step from the shape of the
     * partial sequence. Defaults to the plain map.
     */
    default int indexMap(int nextIndex, int targetLength, CapEligibility eligibility) {
        return indexMap(nextIndex, targetLength);
    }

    /**
     * Derives the new beat's motions from {@code source}. Each motion starts where the same
     * color ended in {@code previous}; {@code previous} must carry end orientations.
     */
    Draft transform(Beat source, Beat previous);
}
