/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.exceptions;

public class InvalidMotionException extends RuntimeException {
    public InvalidMotionException(String message) {
        super("Invalid motion: " + message);
    }

    public InvalidMotionException(String message, Throwable cause) {
        super("Invalid motion: " + message, cause);
    }
}
