/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.cap;

import ai.evacortex.kinetic.core.TestBeats;
import ai.evacortex.kinetic.core.geometry.MirrorAxis;
import ai.evacortex.kinetic.core.model.*;
import ai.evacortex.kinetic.core.orientation.PrefloatResolver;
import org.junit.jupiter.api.Test;

import java.util.List;

import static ai.evacortex.kinetic.core.model.Location.*;
import static org.junit.jupiter.api.Assertions.*;

class CapVerifierTest {

    private final CapGenerator generator = new CapGenerator(PrefloatResolver.withoutOverrides(), MirrorAxis.VERTICAL);
    private final CapVerifier verifier = new CapVerifier(generator);

    @Test
    void generatedRotatedCapIsRecognised() {
        Sequence cap = generator.generate(TestBeats.halvedPartial(), 4, CapVariant.STRICT_ROTATED);
        CapProperties props = verifier.classifyCap(cap);

        assertTrue(props.isStrictRotated());
        assertTrue(props.endsAtStartPos());
        assertTrue(props.canBeCap());
        assertTrue(props.isCap());
        assertEquals(CapVariant.STRICT_ROTATED, props.matchedVariant());
        assertNull(props.mirrorAxis());
        assertEquals("AAAA", props.word());
        assertFalse(props.isStrictMirrored() || props.isStrictSwapped()
                || props.isMirroredSwapped() || props.isRotatedSwapped());
    }

    @Test
    void longerRotatedCapIsRecognised() {
        Sequence cap = generator.generate(TestBeats.fourBeatPartial(), 8, CapVariant.STRICT_ROTATED);
        CapProperties props = verifier.classifyCap(cap);
        assertTrue(props.isStrictRotated());
        assertTrue(props.endsAtStartPos());
    }

    @Test
    void generatedMirroredCapIsRecognisedWithItsAxis() {
        Sequence cap = generator.generate(TestBeats.halvedPartial(), 4, CapVariant.STRICT_MIRRORED, MirrorAxis.VERTICAL);
        CapProperties props = verifier.classifyCap(cap);

        assertTrue(props.isStrictMirrored());
        assertFalse(props.isStrictRotated());
        assertEquals(MirrorAxis.VERTICAL, props.mirrorAxis());
    }

    @Test
    void generatedSwappedCapIsRecognised() {
        Beat c = TestBeats.beat(1, Letter.C, TestBeats.anti(S, W, RotationDirection.CCW),
                TestBeats.pro(N, E, RotationDirection.CW));
        Sequence cap = generator.generate(Sequence.of(List.of(c)), 2, CapVariant.STRICT_SWAPPED);
        CapProperties props = verifier.classifyCap(cap);

        assertTrue(props.isStrictSwapped());
        assertEquals(CapVariant.STRICT_SWAPPED, props.matchedVariant());
        assertFalse(props.endsAtStartPos());
        assertTrue(props.canBeCap());
    }

    @Test
    void closedMirroredCapEndsAtStart() {
        Sequence cap = generator.generate(CapGeneratorTest.closedPartial(), 4, CapVariant.STRICT_MIRRORED, MirrorAxis.VERTICAL);
        CapProperties props = verifier.classifyCap(cap);

        assertTrue(props.isStrictMirrored());
        assertTrue(props.endsAtStartPos());
        assertEquals(MirrorAxis.VERTICAL, props.mirrorAxis());
    }

    @Test
    void quarteredRotatedCapIsRecognised() {
        Sequence partial = Sequence.of(List.of(TestBeats.halvedPartial().beat(0)));
        CapProperties props = verifier.classifyCap(generator.generate(partial, 4, CapVariant.STRICT_ROTATED));

        assertTrue(props.isStrictRotated());
        assertTrue(props.endsAtStartPos());
    }

    @Test
    void rotatedSwappedCapIsRecognised() {
        Beat c = TestBeats.beat(1, Letter.C, TestBeats.anti(S, W, RotationDirection.CCW),
                TestBeats.pro(N, E, RotationDirection.CW));
        Sequence cap = generator.generate(Sequence.of(List.of(c)), 2, CapVariant.ROTATED_SWAPPED);
        CapProperties props = verifier.classifyCap(cap);

        assertTrue(props.isRotatedSwapped());
        assertEquals(CapVariant.ROTATED_SWAPPED, props.matchedVariant());
        assertFalse(props.isStrictRotated() || props.isStrictMirrored() || props.isStrictSwapped()
                || props.isMirroredSwapped());
        assertNull(props.mirrorAxis());
    }

    @Test
    void mirroredSwappedCapIsRecognisedWithItsAxis() {
        Sequence cap = generator.generate(CapGeneratorTest.asymmetricClosedPartial(), 4,
                CapVariant.MIRRORED_SWAPPED, MirrorAxis.VERTICAL);
        CapProperties props = verifier.classifyCap(cap);

        assertTrue(props.isMirroredSwapped());
        assertEquals(CapVariant.MIRRORED_SWAPPED, props.matchedVariant());
        assertEquals(MirrorAxis.VERTICAL, props.mirrorAxis());
        assertFalse(props.isStrictRotated() || props.isStrictMirrored() || props.isStrictSwapped()
                || props.isRotatedSwapped());
        assertFalse(props.endsAtStartPos(), "swapping the hands moves alpha1 to alpha5");
    }

    @Test
    void plainSequenceIsNotACap() {
        CapProperties props = verifier.classifyCap(TestBeats.fourBeatPartial());

        assertFalse(props.isCap());
        assertNull(props.matchedVariant());
        assertFalse(props.endsAtStartPos());
        assertTrue(props.canBeCap(), "alpha1 and alpha5 share a family");
    }

    @Test
    void oddLengthMatchesNoVariant() {
        Sequence cap = generator.generate(TestBeats.halvedPartial(), 4, CapVariant.STRICT_ROTATED);
        Sequence odd = Sequence.of(cap.beats().subList(0, 3));
        CapProperties props = verifier.classifyCap(odd);

        assertFalse(props.isStrictRotated());
        assertFalse(props.isStrictMirrored());
        assertFalse(props.isStrictSwapped());
        assertFalse(props.isMirroredSwapped());
        assertFalse(props.isRotatedSwapped());
        assertFalse(props.isCap());
    }

    @Test
    void differentFamiliesCannotCap() {
        Beat w = TestBeats.beat(1, Letter.W, TestBeats.pro(S, W, RotationDirection.CW), TestBeats.staticAt(S));
        CapProperties props = verifier.classifyCap(Sequence.of(List.of(w)));
        assertFalse(props.canBeCap());
        assertFalse(props.endsAtStartPos());
        assertEquals("W", props.word());
    }

    @Test
    void emptySequenceHasNoFlags() {
        CapProperties props = verifier.classifyCap(Sequence.of(List.of()));
        assertFalse(props.isCap());
        assertFalse(props.canBeCap());
        assertEquals("", props.word());
    }

    @Test
    void structureIgnoresOrientationAndMissingLetters() {
        Beat beat = TestBeats.halvedPartial().beat(0);
        Beat otherOri = beat.withMotion(Color.BLUE, beat.blue().withStartOri(Orientation.OUT).withEndOri(Orientation.OUT));
        assertTrue(CapVerifier.sameStructure(beat, otherOri));
        assertTrue(CapVerifier.sameStructure(beat, beat.withLetter(null)));
        assertFalse(CapVerifier.sameStructure(beat, beat.withLetter(Letter.B)));
        assertFalse(CapVerifier.sameStructure(beat,
                beat.withMotion(Color.RED, beat.red().withPropRotDir(RotationDirection.CCW))));
    }
}
