/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static ai.evacortex.kinetic.core.model.LetterType.*;

public enum Letter {
    A("A", TYPE1), B("B", TYPE1), C("C", TYPE1), D("D", TYPE1), E("E", TYPE1), F("F", TYPE1),
    G("G", TYPE1), H("H", TYPE1), I("I", TYPE1), J("J", TYPE1), K("K", TYPE1), L("L", TYPE1),
    M("M", TYPE1), N("N", TYPE1), O("O", TYPE1), P("P", TYPE1), Q("Q", TYPE1), R("R", TYPE1),
    S("S", TYPE1), T("T", TYPE1), U("U", TYPE1), V("V", TYPE1),

    W("W", TYPE2), X("X", TYPE2), Y("Y", TYPE2), Z("Z", TYPE2),
    SIGMA("Σ", TYPE2), DELTA("Δ", TYPE2), THETA("θ", TYPE2), OMEGA("Ω", TYPE2),

    W_DASH("W-", TYPE3), X_DASH("X-", TYPE3), Y_DASH("Y-", TYPE3), Z_DASH("Z-", TYPE3),
    SIGMA_DASH("Σ-", TYPE3), DELTA_DASH("Δ-", TYPE3), THETA_DASH("θ-", TYPE3), OMEGA_DASH("Ω-", TYPE3),

    PHI("Φ", TYPE4), PSI("Ψ", TYPE4), LAMBDA("Λ", TYPE4),

    PHI_DASH("Φ-", TYPE5), PSI_DASH("Ψ-", TYPE5), LAMBDA_DASH("Λ-", TYPE5),

    ALPHA("α", TYPE6), BETA("β", TYPE6), GAMMA("Γ", TYPE6);

    private static final Map<String, Letter> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Letter::symbol, Function.identity()));

    private final String symbol;
    private final LetterType type;

    Letter(String symbol, LetterType type) {
        this.symbol = symbol;
        this.type = type;
    }

    public String symbol() {
        return symbol;
    }

    public LetterType type() {
        return type;
    }

    public static Letter fromSymbol(String symbol) {
        Letter letter = symbol == null ? null : BY_SYMBOL.get(symbol.trim());
        if (letter == null) {
            throw new IllegalArgumentException("Unknown letter: " + symbol);
        }
        return letter;
    }
}
