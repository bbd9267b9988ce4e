/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.orientation;

import ai.evacortex.kinetic.core.TestBeats;
import ai.evacortex.kinetic.core.metadata.OverrideKeys;
import ai.evacortex.kinetic.core.metadata.OverrideScope;
import ai.evacortex.kinetic.core.metadata.PrefloatOverrideStore;
import ai.evacortex.kinetic.core.model.*;
import org.junit.jupiter.api.Test;

import static ai.evacortex.kinetic.core.model.Location.*;
import static org.junit.jupiter.api.Assertions.*;

class PrefloatResolverTest {

    @Test
    void nonFloatResolvesToItself() {
        Beat beat = TestBeats.beat(1, Letter.A, TestBeats.pro(S, W, RotationDirection.CW),
                TestBeats.pro(N, E, RotationDirection.CW));
        ConcreteMotion motion = PrefloatResolver.withoutOverrides().resolve(beat, Color.BLUE);
        assertEquals(MotionType.PRO, motion.motionType());
        assertEquals(RotationDirection.CW, motion.propRotDir());
        assertTrue(motion.isResolved());
    }

    @Test
    void floatFollowsPartnerAndInvertsOnOpposite() {
        MotionAttributes partner = TestBeats.anti(N, E, RotationDirection.CCW);
        Beat same = TestBeats.beat(1, Letter.A, Direction.SAME, TestBeats.floatMotion(S, W), partner);
        Beat opp = TestBeats.beat(1, Letter.A, Direction.OPP, TestBeats.floatMotion(S, W), partner);

        ConcreteMotion fromSame = PrefloatResolver.withoutOverrides().resolve(same, Color.BLUE);
        assertEquals(MotionType.ANTI, fromSame.motionType());
        assertEquals(RotationDirection.CCW, fromSame.propRotDir());

        ConcreteMotion fromOpp = PrefloatResolver.withoutOverrides().resolve(opp, Color.BLUE);
        assertEquals(RotationDirection.CW, fromOpp.propRotDir());
    }

    @Test
    void ownPrefloatWinsOverStoreAndPartner() {
        PrefloatOverrideStore store = PrefloatOverrideStore.inMemory();
        MotionAttributes own = TestBeats.floatMotion(S, W).withPrefloat(MotionType.PRO, RotationDirection.CW);
        Beat beat = TestBeats.beat(1, Letter.A, own, TestBeats.anti(N, E, RotationDirection.CCW));
        store.putText(OverrideScope.forBeat(beat), OverrideKeys.prefloatMotionType(Color.BLUE), "anti");

        ConcreteMotion motion = new PrefloatResolver(store).resolve(beat, Color.BLUE);
        assertEquals(MotionType.PRO, motion.motionType());
        assertEquals(RotationDirection.CW, motion.propRotDir());
    }

    @Test
    void storeWinsOverPartner() {
        PrefloatOverrideStore store = PrefloatOverrideStore.inMemory();
        Beat beat = TestBeats.beat(1, Letter.A, TestBeats.floatMotion(S, W), TestBeats.pro(N, E, RotationDirection.CW));
        OverrideScope scope = OverrideScope.forBeat(beat);
        store.putText(scope, OverrideKeys.prefloatMotionType(Color.BLUE), "anti");
        store.putText(scope, OverrideKeys.prefloatPropRotDir(Color.BLUE), "ccw");

        ConcreteMotion motion = new PrefloatResolver(store).resolve(beat, Color.BLUE);
        assertEquals(MotionType.ANTI, motion.motionType());
        assertEquals(RotationDirection.CCW, motion.propRotDir());
    }

    @Test
    void floatWithoutAnySourceStaysUnresolved() {
        Beat beat = TestBeats.beat(1, Letter.W, TestBeats.floatMotion(S, W), TestBeats.staticAt(S));
        assertFalse(PrefloatResolver.withoutOverrides().resolve(beat, Color.BLUE).isResolved());
    }

    @Test
    void consistencyOfRecordedPrefloat() {
        MotionAttributes base = TestBeats.floatMotion(S, W);
        assertTrue(PrefloatResolver.isConsistentPrefloat(base));
        assertTrue(PrefloatResolver.isConsistentPrefloat(base.withPrefloat(MotionType.ANTI, RotationDirection.CCW)));
        assertFalse(PrefloatResolver.isConsistentPrefloat(base.withPrefloat(MotionType.FLOAT, RotationDirection.CW)));
        assertFalse(PrefloatResolver.isConsistentPrefloat(base.withPrefloat(MotionType.PRO, RotationDirection.NONE)));
        assertFalse(PrefloatResolver.isConsistentPrefloat(base.withPrefloat(MotionType.PRO, null)));
    }
}
