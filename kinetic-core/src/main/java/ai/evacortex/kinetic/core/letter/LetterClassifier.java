/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.letter;

import ai.evacortex.kinetic.core.exceptions.UnclassifiedPictographException;
import ai.evacortex.kinetic.core.model.*;
import ai.evacortex.kinetic.core.orientation.ConcreteMotion;
import ai.evacortex.kinetic.core.orientation.PrefloatResolver;

import java.util.Objects;
import java.util.Optional;

/**
 * Assigns a letter to a beat by exact structural match against the reference dataset:
 * same start and end position and, per color, the same motion type and locations. Shift
 * motions must also rotate their prop the same way. Float motions are compared through
 * their resolved prefloat motion.
 */
public class LetterClassifier {

    private final ReferenceDataset dataset;
    private final PrefloatResolver prefloatResolver;

    public LetterClassifier(ReferenceDataset dataset, PrefloatResolver prefloatResolver) {
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.prefloatResolver = Objects.requireNonNull(prefloatResolver, "prefloatResolver");
    }

    /**
     * @throws UnclassifiedPictographException if no template matches
     */
    public Classification classify(Beat beat) {
        return tryClassify(beat).orElseThrow(() -> new UnclassifiedPictographException(
                beat.startPos().wireName() + " -> " + beat.endPos().wireName()
                        + " (blue " + describe(beat.blue()) + ", red " + describe(beat.red()) + ")"));
    }

    public Optional<Classification> tryClassify(Beat beat) {
        ConcreteMotion blue = prefloatResolver.resolve(beat, Color.BLUE);
        ConcreteMotion red = prefloatResolver.resolve(beat, Color.RED);
        for (LetterTemplate template : dataset.candidates(beat.startPos(), beat.endPos())) {
            if (matches(template.blue(), blue) && matches(template.red(), red)) {
                return Optional.of(Classification.of(template.letter()));
            }
        }
        return Optional.empty();
    }

    /** Classifies and stamps the letter onto the beat; unmatched beats come back with no letter. */
    public Beat assignLetter(Beat beat) {
        return beat.withLetter(tryClassify(beat).map(Classification::letter).orElse(null));
    }

    private static boolean matches(MotionAttributes template, ConcreteMotion motion) {
        MotionType raw = motion.source().motionType();
        if (template.motionType() != raw && template.motionType() != motion.motionType()) {
            return false;
        }
        if (template.startLoc() != motion.startLoc() || template.endLoc() != motion.endLoc()) {
            return false;
        }
        if (template.motionType() == MotionType.PRO || template.motionType() == MotionType.ANTI) {
            return template.propRotDir() == motion.propRotDir();
        }
        return true;
    }

    private static String describe(MotionAttributes m) {
        return m.motionType().wireName() + " " + m.startLoc().wireName() + "->" + m.endLoc().wireName()
                + " " + m.propRotDir().wireName();
    }
}
