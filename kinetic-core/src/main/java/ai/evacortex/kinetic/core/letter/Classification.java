/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.letter;

import ai.evacortex.kinetic.core.model.Letter;
import ai.evacortex.kinetic.core.model.LetterType;

public record Classification(Letter letter, LetterType letterType) {

    public static Classification of(Letter letter) {
        return new Classification(letter, letter.type());
    }
}
