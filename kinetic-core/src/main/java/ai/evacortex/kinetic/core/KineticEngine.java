/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core;

import ai.evacortex.kinetic.core.cap.CapProperties;
import ai.evacortex.kinetic.core.cap.CapVariant;
import ai.evacortex.kinetic.core.exceptions.*;
import ai.evacortex.kinetic.core.geometry.MirrorAxis;
import ai.evacortex.kinetic.core.letter.Classification;
import ai.evacortex.kinetic.core.metadata.PrefloatOverrideStore;
import ai.evacortex.kinetic.core.model.*;
import ai.evacortex.kinetic.core.orientation.ConcreteMotion;
import ai.evacortex.kinetic.core.placement.ArrowPlacement;

/**
 * {@code KineticEngine} is the entry point to the beat notation core. It derives
 * orientations and arrow placements from raw motion parameters, classifies beats into
 * letters of the alphabet, and generates and verifies Continuous Auto-completion Pattern
 * (CAP) sequences.
 *
 * <p>All derivations are pure functions of their arguments and of the engine's
 * {@link PrefloatOverrideStore}. The store is the only mutable state; it is changed solely
 * through the explicit override actions on this interface and persists every change
 * before readers can observe it.</p>
 *
 * <p>Implementations must be safe for concurrent use: derivations may run on any thread
 * while override actions are serialized by the store.</p>
 *
 * @see Beat
 * @see Sequence
 * @see CapVariant
 */
public interface KineticEngine {

    /**
     * Computes the end orientation of one motion of a beat. Float motions are first
     * resolved into the concrete motion they stand for.
     *
     * @param beat  the beat holding the motion
     * @param color which hand's motion
     * @return the orientation the prop ends in
     * @throws InvalidMotionException   if turns are invalid, a half turn has no rotation
     *                                  direction, or a float cannot be resolved
     * @throws InvalidLocationException if a float motion's locations are on different grids
     */
    Orientation calculateEndOrientation(Beat beat, Color color);

    /**
     * Resolves a motion into its effective motion type and prop rotation direction.
     * Non-float motions resolve to themselves.
     */
    ConcreteMotion resolveEffectiveMotion(Beat beat, Color color);

    /**
     * Finds the location an arrow is drawn at, which is not necessarily its start or end.
     *
     * @param beat  the beat holding the motion
     * @param color which hand's arrow
     * @return the render anchor
     */
    Location resolveArrowLocation(Beat beat, Color color);

    /**
     * Anchor plus the offset applied on top of it.
     */
    ArrowPlacement resolveArrowPlacement(Beat beat, Color color);

    /**
     * Classifies a beat against the reference dataset.
     *
     * @throws UnclassifiedPictographException if no letter matches; callers may continue
     *                                         with a blank letter
     */
    Classification classify(Beat beat);

    /**
     * Replaces one motion of a beat, then recomputes its positions, letter and end
     * orientations. The letter is cleared when the edited beat matches none.
     *
     * @param beat   the beat being edited
     * @param color  which hand's motion is replaced
     * @param edited the new motion; its end orientation is ignored
     * @return the updated beat
     */
    Beat applyEdit(Beat beat, Color color, MotionAttributes edited);

    /**
     * Completes {@code partial} to {@code targetLength} beats. Mirrored variants reflect
     * across the configured default axis.
     *
     * @throws IllegalArgumentException unless {@code 1 <= partial.length() < targetLength}
     * @throws IllegalStateException    if the variant's index map leaves the generated range
     */
    Sequence generateCap(Sequence partial, int targetLength, CapVariant variant);

    Sequence generateCap(Sequence partial, int targetLength, CapVariant variant, MirrorAxis axis);

    /**
     * Reports which CAP variant produced a sequence, whether it ends where it started and
     * whether it ends in the same position family it started in.
     */
    CapProperties classifyCap(Sequence sequence);

    /**
     * Records what a float motion was before it became a float, under the beat's scope.
     *
     * @throws IllegalArgumentException if the beat has no letter or the values are not a
     *                                  pro/anti type with a real rotation direction
     */
    void recordPrefloat(Beat beat, Color color, MotionType motionType, RotationDirection propRotDir);

    /**
     * Pins a shift arrow to a location under the beat's scope.
     */
    void pinArrowLocation(Beat beat, Color color, Location location);

    /**
     * Flips the rotation-angle override flag for one arrow.
     *
     * @return the flag's new state
     */
    boolean toggleRotationOverride(Beat beat, Color color);

    PrefloatOverrideStore overrides();
}
