/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.cap;

import ai.evacortex.kinetic.core.geometry.GeometryTables;
import ai.evacortex.kinetic.core.geometry.MirrorAxis;
import ai.evacortex.kinetic.core.model.*;
import ai.evacortex.kinetic.core.orientation.OrientationCalculator;
import ai.evacortex.kinetic.core.orientation.PrefloatResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Completes a partial sequence to a target length by deriving each new beat from an
 * earlier one through a {@link CapStrategy}. New beats start where the previous beat ended,
 * get their end position from the new end locations and their end orientations from the
 * {@link OrientationCalculator}.
 */
public class CapGenerator {

    private static final Logger log = LoggerFactory.getLogger(CapGenerator.class);

    private final PrefloatResolver prefloatResolver;
    private final MirrorAxis defaultAxis;

    public CapGenerator(PrefloatResolver prefloatResolver, MirrorAxis defaultAxis) {
        this.prefloatResolver = Objects.requireNonNull(prefloatResolver, "prefloatResolver");
        this.defaultAxis = Objects.requireNonNull(defaultAxis, "defaultAxis");
    }

    public Sequence generate(Sequence partial, int targetLength, CapVariant variant) {
        return generate(partial, targetLength, variant, defaultAxis);
    }

    public Sequence generate(Sequence partial, int targetLength, CapVariant variant, MirrorAxis axis) {
        return generate(partial, targetLength, CapStrategies.forVariant(variant, axis));
    }

    /**
     * @throws IllegalArgumentException unless {@code 1 <= partial.length() < targetLength}
     * @throws IllegalStateException    if the strategy maps a beat to a source that does not exist yet
     */
    public Sequence generate(Sequence partial, int targetLength, CapStrategy strategy) {
        int n = partial.length();
        if (n < 1 || n >= targetLength) {
            throw new IllegalArgumentException("Partial sequence of " + n
                    + " beats cannot be completed to " + targetLength);
        }
        CapEligibility eligibility = CapEligibility.of(partial);
        log.debug("Generating {} CAP {} -> {} beats ({})", strategy.variant(), n, targetLength, eligibility);

        List<Beat> beats = new ArrayList<>(targetLength);
        beats.addAll(partial.beats());
        Beat previous = withEndOrientations(beats.get(n - 1));

        for (int next = n + 1; next <= targetLength; next++) {
            int sourceIndex = strategy.indexMap(next, targetLength, eligibility);
            if (sourceIndex < 0 || sourceIndex >= beats.size()) {
                throw new IllegalStateException(strategy.variant() + " mapped beat " + next + " of "
                        + targetLength + " to index " + sourceIndex + " outside 0.." + (beats.size() - 1));
            }
            CapStrategy.Draft draft = strategy.transform(beats.get(sourceIndex), previous);
            Beat beat = new Beat(previous.beatNumber() + 1, draft.letter(), null,
                    previous.endPos(),
                    GeometryTables.combine(draft.blue().endLoc(), draft.red().endLoc()),
                    draft.timing(), draft.direction(),
                    dropInconsistentPrefloat(draft.blue(), Color.BLUE, next),
                    dropInconsistentPrefloat(draft.red(), Color.RED, next));
            beat = withEndOrientations(beat);
            beats.add(beat);
            previous = beat;
        }

        Beat start = partial.startPositionBeat() == null ? null : partial.startPositionBeat().withBeatNumber(0);
        return new Sequence(start, beats);
    }

    public CapEligibility eligibility(Sequence partial) {
        return CapEligibility.of(partial);
    }

    private Beat withEndOrientations(Beat beat) {
        Beat result = beat;
        for (Color color : Color.values()) {
            MotionAttributes motion = result.motion(color);
            if (motion.endOri() == null) {
                Orientation end = OrientationCalculator.calculateEndOrientation(result, color, prefloatResolver);
                result = result.withMotion(color, motion.withEndOri(end));
            }
        }
        return result;
    }

    private static MotionAttributes dropInconsistentPrefloat(MotionAttributes motion, Color color, int beatNumber) {
        if (PrefloatResolver.isConsistentPrefloat(motion)) {
            return motion;
        }
        log.debug("Dropping inconsistent prefloat ({}, {}) on {} motion of beat {}",
                motion.prefloatMotionType(), motion.prefloatPropRotDir(), color.wireName(), beatNumber);
        return motion.withoutPrefloat();
    }
}
