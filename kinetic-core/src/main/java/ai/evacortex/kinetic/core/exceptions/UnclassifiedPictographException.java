/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.exceptions;

/**
 * No letter template matched a beat. Recoverable: callers leave the letter blank.
 */
public class UnclassifiedPictographException extends RuntimeException {
    public UnclassifiedPictographException(String message) {
        super("Unclassified pictograph: " + message);
    }
}
