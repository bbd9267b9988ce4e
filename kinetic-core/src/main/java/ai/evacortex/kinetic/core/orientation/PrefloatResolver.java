/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.orientation;

import ai.evacortex.kinetic.core.metadata.OverrideKeys;
import ai.evacortex.kinetic.core.metadata.OverrideScope;
import ai.evacortex.kinetic.core.metadata.PrefloatOverrideStore;
import ai.evacortex.kinetic.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * First phase of float handling: turns a {@link MotionType#FLOAT} motion into the concrete
 * motion it stands for. Sources, in order: the motion's own recorded prefloat fields, the
 * override store entry for the beat's scope, then the partner shift motion (same type,
 * same rotation, inverted when the beat's hands move in opposite directions).
 * Non-float motions resolve to themselves.
 */
public final class PrefloatResolver {

    private static final Logger log = LoggerFactory.getLogger(PrefloatResolver.class);

    private static final PrefloatResolver WITHOUT_OVERRIDES = new PrefloatResolver();

    private final PrefloatOverrideStore store;

    public PrefloatResolver(PrefloatOverrideStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    private PrefloatResolver() {
        this.store = null;
    }

    /** Resolver that only consults the motion itself and its partner. */
    public static PrefloatResolver withoutOverrides() {
        return WITHOUT_OVERRIDES;
    }

    /** Backing store, or {@code null} for {@link #withoutOverrides()}. */
    public PrefloatOverrideStore store() {
        return store;
    }

    public ConcreteMotion resolve(Beat beat, Color color) {
        return resolve(beat.motion(color), beat.motion(color.other()), beat.direction(), color,
                OverrideScope.forBeat(beat));
    }

    public ConcreteMotion resolve(MotionAttributes motion, MotionAttributes partner, Direction direction,
                                  Color color, OverrideScope scope) {
        if (motion.motionType() != MotionType.FLOAT) {
            return ConcreteMotion.of(motion);
        }

        MotionType type = isShiftType(motion.prefloatMotionType()) ? motion.prefloatMotionType() : null;
        RotationDirection dir = motion.prefloatPropRotDir() != null && motion.prefloatPropRotDir().isRotating()
                ? motion.prefloatPropRotDir() : null;

        if (type == null) {
            type = storedType(scope, color);
        }
        if (dir == null) {
            dir = storedDirection(scope, color);
        }

        if (partner != null && isShiftType(partner.motionType())) {
            if (type == null) {
                type = partner.motionType();
            }
            if (dir == null && partner.propRotDir().isRotating()) {
                dir = direction == Direction.OPP ? partner.propRotDir().opposite() : partner.propRotDir();
            }
        }

        return new ConcreteMotion(motion,
                type != null ? type : MotionType.FLOAT,
                dir != null ? dir : motion.propRotDir());
    }

    /**
     * Prefloat metadata is consistent when absent altogether, or when both fields are present
     * with a pro/anti type and a real rotation direction.
     */
    public static boolean isConsistentPrefloat(MotionAttributes motion) {
        MotionType type = motion.prefloatMotionType();
        RotationDirection dir = motion.prefloatPropRotDir();
        if (type == null && dir == null) return true;
        if (type == null || dir == null) return false;
        return isShiftType(type) && dir.isRotating();
    }

    private MotionType storedType(OverrideScope scope, Color color) {
        if (store == null) return null;
        String raw = store.getText(scope, OverrideKeys.prefloatMotionType(color)).orElse(null);
        if (raw == null) return null;
        try {
            MotionType type = MotionType.fromWire(raw);
            return isShiftType(type) ? type : null;
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring stored prefloat motion type '{}' for {} under {}", raw, color, scope);
            return null;
        }
    }

    private RotationDirection storedDirection(OverrideScope scope, Color color) {
        if (store == null) return null;
        String raw = store.getText(scope, OverrideKeys.prefloatPropRotDir(color)).orElse(null);
        if (raw == null) return null;
        try {
            RotationDirection dir = RotationDirection.fromWire(raw);
            return dir.isRotating() ? dir : null;
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring stored prefloat rotation '{}' for {} under {}", raw, color, scope);
            return null;
        }
    }

    private static boolean isShiftType(MotionType type) {
        return type == MotionType.PRO || type == MotionType.ANTI;
    }
}
