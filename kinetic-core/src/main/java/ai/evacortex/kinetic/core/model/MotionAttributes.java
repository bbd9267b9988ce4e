/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

import java.util.Objects;

/**
 * Raw parameters of one colored motion within a beat. {@code endOri} is derived and may be
 * {@code null} until the orientation calculator has run. The two prefloat fields record
 * what a float motion was before it became a float and are {@code null} when absent.
 */
public record MotionAttributes(MotionType motionType,
                               Location startLoc,
                               Location endLoc,
                               Orientation startOri,
                               Orientation endOri,
                               Turns turns,
                               RotationDirection propRotDir,
                               MotionType prefloatMotionType,
                               RotationDirection prefloatPropRotDir) {

    public MotionAttributes {
        Objects.requireNonNull(motionType, "motionType");
        Objects.requireNonNull(startLoc, "startLoc");
        Objects.requireNonNull(endLoc, "endLoc");
        Objects.requireNonNull(turns, "turns");
        Objects.requireNonNull(propRotDir, "propRotDir");
    }

    public static MotionAttributes of(MotionType motionType, Location startLoc, Location endLoc,
                                      Orientation startOri, Turns turns, RotationDirection propRotDir) {
        return new MotionAttributes(motionType, startLoc, endLoc, startOri, null, turns, propRotDir, null, null);
    }

    public boolean hasPrefloat() {
        return prefloatMotionType != null || prefloatPropRotDir != null;
    }

    public MotionAttributes withEndOri(Orientation ori) {
        return new MotionAttributes(motionType, startLoc, endLoc, startOri, ori, turns, propRotDir,
                prefloatMotionType, prefloatPropRotDir);
    }

    public MotionAttributes withStartOri(Orientation ori) {
        return new MotionAttributes(motionType, startLoc, endLoc, ori, endOri, turns, propRotDir,
                prefloatMotionType, prefloatPropRotDir);
    }

    public MotionAttributes withPropRotDir(RotationDirection dir) {
        return new MotionAttributes(motionType, startLoc, endLoc, startOri, endOri, turns, dir,
                prefloatMotionType, prefloatPropRotDir);
    }

    public MotionAttributes withPrefloat(MotionType type, RotationDirection dir) {
        return new MotionAttributes(motionType, startLoc, endLoc, startOri, endOri, turns, propRotDir, type, dir);
    }

    public MotionAttributes withoutPrefloat() {
        return withPrefloat(null, null);
    }
}
