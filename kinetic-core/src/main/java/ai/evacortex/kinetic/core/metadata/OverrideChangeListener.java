/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.metadata;

@FunctionalInterface
public interface OverrideChangeListener {

    /** Called while the store's write lock is still held; must not write back to the store. */
    void onOverrideChanged(OverrideScope scope, String key);
}
