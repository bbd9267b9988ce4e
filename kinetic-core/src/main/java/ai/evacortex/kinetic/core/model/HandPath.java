/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

/**
 * Direction the hand itself travels between its start and end location.
 */
public enum HandPath {
    CW_HANDPATH, CCW_HANDPATH, DASH, STATIC
}
