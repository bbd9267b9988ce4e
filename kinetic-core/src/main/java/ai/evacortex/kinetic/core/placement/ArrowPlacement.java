/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.placement;

import ai.evacortex.kinetic.core.model.Location;

/**
 * Render anchor of an arrow plus the pixel offset applied on top of it.
 */
public record ArrowPlacement(Location location, double dx, double dy) {
}
