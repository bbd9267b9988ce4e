/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered beats plus an optional start-position pseudo-beat (beat number 0).
 */
public record Sequence(Beat startPositionBeat, List<Beat> beats) {

    public Sequence {
        beats = List.copyOf(Objects.requireNonNull(beats, "beats"));
        int previous = startPositionBeat != null ? startPositionBeat.beatNumber() : Integer.MIN_VALUE;
        for (Beat beat : beats) {
            if (beat.beatNumber() <= previous) {
                throw new IllegalArgumentException("Beat numbers must increase: "
                        + beat.beatNumber() + " after " + previous);
            }
            previous = beat.beatNumber();
        }
    }

    public static Sequence of(List<Beat> beats) {
        return new Sequence(null, beats);
    }

    public int length() {
        return beats.size();
    }

    public Beat beat(int index) {
        return beats.get(index);
    }

    public Beat last() {
        return beats.isEmpty() ? startPositionBeat : beats.get(beats.size() - 1);
    }

    /** Position the performer starts from. */
    public Position initialPosition() {
        if (startPositionBeat != null) return startPositionBeat.endPos();
        if (beats.isEmpty()) {
            throw new IllegalStateException("Empty sequence has no initial position");
        }
        return beats.get(0).startPos();
    }

    /** Concatenated letter symbols; unclassified beats contribute nothing. */
    public String word() {
        StringBuilder sb = new StringBuilder();
        for (Beat beat : beats) {
            if (beat.letter() != null) sb.append(beat.letter().symbol());
        }
        return sb.toString();
    }
}
