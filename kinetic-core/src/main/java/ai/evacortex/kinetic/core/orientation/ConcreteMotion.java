/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.orientation;

import ai.evacortex.kinetic.core.model.*;

import java.util.Objects;

/**
 * A motion after float resolution: the raw attributes plus the effective motion type and
 * prop rotation direction every downstream calculator should use. A motion whose effective
 * type is still {@link MotionType#FLOAT} could not be resolved.
 */
public record ConcreteMotion(MotionAttributes source, MotionType motionType, RotationDirection propRotDir) {

    public ConcreteMotion {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(motionType, "motionType");
        Objects.requireNonNull(propRotDir, "propRotDir");
    }

    public static ConcreteMotion of(MotionAttributes attrs) {
        return new ConcreteMotion(attrs, attrs.motionType(), attrs.propRotDir());
    }

    public boolean isResolved() {
        return motionType != MotionType.FLOAT;
    }

    public Location startLoc() {
        return source.startLoc();
    }

    public Location endLoc() {
        return source.endLoc();
    }

    public Orientation startOri() {
        return source.startOri();
    }

    public Turns turns() {
        return source.turns();
    }
}
