/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.metadata;

import ai.evacortex.kinetic.core.TestBeats;
import ai.evacortex.kinetic.core.model.*;
import org.junit.jupiter.api.Test;

import static ai.evacortex.kinetic.core.model.Location.*;
import static org.junit.jupiter.api.Assertions.*;

class TurnsTupleKeyTest {

    @Test
    void prefixReflectsRelativeRotation() {
        assertEquals("(s, 1, 0.5)", TurnsTupleKey.of(
                TestBeats.motion(MotionType.PRO, S, W, 1, RotationDirection.CW, Orientation.IN),
                TestBeats.motion(MotionType.ANTI, N, E, 0.5, RotationDirection.CW, Orientation.IN)).value());
        assertEquals("(o, 0, 2)", TurnsTupleKey.of(
                TestBeats.motion(MotionType.PRO, S, W, 0, RotationDirection.CW, Orientation.IN),
                TestBeats.motion(MotionType.PRO, N, E, 2, RotationDirection.CCW, Orientation.IN)).value());
    }

    @Test
    void prefixOmittedWhenEitherPropIsStill() {
        assertEquals("(0, fl)", TurnsTupleKey.of(TestBeats.staticAt(S), TestBeats.floatMotion(N, E)).value());
        assertEquals("(1.5, 0)", TurnsTupleKey.of(
                TestBeats.motion(MotionType.DASH, S, N, 1.5, RotationDirection.CCW, Orientation.OUT),
                TestBeats.staticAt(N)).toString());
    }

    @Test
    void scopeRequiresLetterAndOrientations() {
        Beat classified = TestBeats.beat(1, Letter.A, TestBeats.pro(S, W, RotationDirection.CW),
                TestBeats.pro(N, E, RotationDirection.CW));
        OverrideScope scope = OverrideScope.forBeat(classified);
        assertNotNull(scope);
        assertEquals(GridMode.DIAMOND, scope.grid());
        assertEquals(OrientationCategory.FROM_LAYER1, scope.category());

        assertNull(OverrideScope.forBeat(classified.withLetter(null)));
        assertNull(OverrideScope.forBeat(classified.withMotion(Color.RED,
                classified.red().withStartOri(null))));
    }
}
