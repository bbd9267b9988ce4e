/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.exceptions;

public class OverrideStoreCorruptException extends RuntimeException {
    public OverrideStoreCorruptException(String message) {
        super("Override store corrupt: " + message);
    }

    public OverrideStoreCorruptException(String message, Throwable cause) {
        super("Override store corrupt: " + message, cause);
    }
}
