/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.cap;

import ai.evacortex.kinetic.core.exceptions.InvalidLocationException;
import ai.evacortex.kinetic.core.exceptions.InvalidMotionException;
import ai.evacortex.kinetic.core.geometry.MirrorAxis;
import ai.evacortex.kinetic.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Decides which CAP variant, if any, produced a sequence: for each variant in
 * {@link CapVariant} order it regenerates the second half from the first and compares the
 * result structurally, stopping at the first match. Orientations are not compared.
 */
public class CapVerifier {

    private static final Logger log = LoggerFactory.getLogger(CapVerifier.class);

    private final CapGenerator generator;

    public CapVerifier(CapGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    public CapProperties classifyCap(Sequence sequence) {
        int length = sequence.length();
        boolean endsAtStart = false;
        boolean canBeCap = false;
        if (length > 0) {
            Position start = sequence.initialPosition();
            Position end = sequence.last().endPos();
            endsAtStart = start == end;
            canBeCap = start.family() == end.family();
        }

        CapVariant matched = null;
        MirrorAxis matchedAxis = null;
        if (length >= 2 && length % 2 == 0) {
            Sequence firstHalf = new Sequence(sequence.startPositionBeat(), sequence.beats().subList(0, length / 2));
            for (CapVariant variant : CapVariant.values()) {
                if (variant.isMirrored()) {
                    for (MirrorAxis axis : MirrorAxis.values()) {
                        if (reproduces(firstHalf, sequence, variant, axis)) {
                            matchedAxis = axis;
                            break;
                        }
                    }
                    if (matchedAxis != null) {
                        matched = variant;
                        break;
                    }
                } else if (reproduces(firstHalf, sequence, variant, MirrorAxis.VERTICAL)) {
                    matched = variant;
                    break;
                }
            }
        }
        return CapProperties.of(matched, matchedAxis, endsAtStart, canBeCap, sequence.word(),
                SequenceLevel.of(sequence));
    }

    private boolean reproduces(Sequence firstHalf, Sequence actual, CapVariant variant, MirrorAxis axis) {
        Sequence regenerated;
        try {
            regenerated = generator.generate(firstHalf, actual.length(), variant, axis);
        } catch (InvalidLocationException | InvalidMotionException | IllegalStateException e) {
            log.debug("{} cannot be regenerated: {}", variant, e.getMessage());
            return false;
        }
        List<Beat> expected = regenerated.beats();
        for (int i = firstHalf.length(); i < actual.length(); i++) {
            if (!sameStructure(expected.get(i), actual.beat(i))) {
                return false;
            }
        }
        return true;
    }

    static boolean sameStructure(Beat expected, Beat actual) {
        if (expected.startPos() != actual.startPos() || expected.endPos() != actual.endPos()) {
            return false;
        }
        if (expected.letter() != null && actual.letter() != null && expected.letter() != actual.letter()) {
            return false;
        }
        return sameMotion(expected.blue(), actual.blue()) && sameMotion(expected.red(), actual.red());
    }

    private static boolean sameMotion(MotionAttributes a, MotionAttributes b) {
        return a.motionType() == b.motionType()
                && a.propRotDir() == b.propRotDir()
                && a.startLoc() == b.startLoc()
                && a.endLoc() == b.endLoc()
                && a.turns().equals(b.turns());
    }
}
