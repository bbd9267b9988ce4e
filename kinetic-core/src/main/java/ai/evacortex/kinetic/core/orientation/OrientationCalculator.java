/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.orientation;

import ai.evacortex.kinetic.core.exceptions.InvalidMotionException;
import ai.evacortex.kinetic.core.geometry.GeometryTables;
import ai.evacortex.kinetic.core.model.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static ai.evacortex.kinetic.core.model.Orientation.*;
import static ai.evacortex.kinetic.core.model.RotationDirection.CCW;
import static ai.evacortex.kinetic.core.model.RotationDirection.CW;

/**
 * Derives a prop's end orientation from its motion.
 *
 * <p>Whole turns keep the orientation within its category: pro and static preserve it on
 * even turns, pro flips it on odd turns, anti and dash do the reverse. Half turns cross
 * between radial and nonradial, the member being picked by rotation direction and by
 * whether the turn count is 0.5 or 1.5 modulo 2. Float motions with the {@code fl} sentinel
 * follow their hand path instead.</p>
 */
public final class OrientationCalculator {

    private record HalfTurnKey(Orientation start, RotationDirection dir) {}

    private record FloatKey(Orientation start, HandPath path) {}

    /** Value pair: result when {@code turns % 2 == 0.5}, result when {@code turns % 2 == 1.5}. */
    private static final Map<HalfTurnKey, Orientation[]> PRO_HALF_TURNS;
    private static final Map<HalfTurnKey, Orientation[]> ANTI_HALF_TURNS;
    private static final Map<FloatKey, Orientation> FLOAT_TURNS;

    static {
        Map<HalfTurnKey, Orientation[]> pro = new HashMap<>();
        pro.put(new HalfTurnKey(IN, CW), new Orientation[]{COUNTER, CLOCK});
        pro.put(new HalfTurnKey(IN, CCW), new Orientation[]{CLOCK, COUNTER});
        pro.put(new HalfTurnKey(OUT, CW), new Orientation[]{CLOCK, COUNTER});
        pro.put(new HalfTurnKey(OUT, CCW), new Orientation[]{COUNTER, CLOCK});
        pro.put(new HalfTurnKey(CLOCK, CW), new Orientation[]{IN, OUT});
        pro.put(new HalfTurnKey(CLOCK, CCW), new Orientation[]{OUT, IN});
        pro.put(new HalfTurnKey(COUNTER, CW), new Orientation[]{OUT, IN});
        pro.put(new HalfTurnKey(COUNTER, CCW), new Orientation[]{IN, OUT});
        PRO_HALF_TURNS = Collections.unmodifiableMap(pro);

        Map<HalfTurnKey, Orientation[]> anti = new HashMap<>();
        anti.put(new HalfTurnKey(IN, CW), new Orientation[]{CLOCK, COUNTER});
        anti.put(new HalfTurnKey(IN, CCW), new Orientation[]{COUNTER, CLOCK});
        anti.put(new HalfTurnKey(OUT, CW), new Orientation[]{COUNTER, CLOCK});
        anti.put(new HalfTurnKey(OUT, CCW), new Orientation[]{CLOCK, COUNTER});
        anti.put(new HalfTurnKey(CLOCK, CW), new Orientation[]{OUT, IN});
        anti.put(new HalfTurnKey(CLOCK, CCW), new Orientation[]{IN, OUT});
        anti.put(new HalfTurnKey(COUNTER, CW), new Orientation[]{IN, OUT});
        anti.put(new HalfTurnKey(COUNTER, CCW), new Orientation[]{OUT, IN});
        ANTI_HALF_TURNS = Collections.unmodifiableMap(anti);

        Map<FloatKey, Orientation> floats = new HashMap<>();
        floats.put(new FloatKey(IN, HandPath.CW_HANDPATH), CLOCK);
        floats.put(new FloatKey(IN, HandPath.CCW_HANDPATH), COUNTER);
        floats.put(new FloatKey(OUT, HandPath.CW_HANDPATH), COUNTER);
        floats.put(new FloatKey(OUT, HandPath.CCW_HANDPATH), CLOCK);
        floats.put(new FloatKey(CLOCK, HandPath.CW_HANDPATH), OUT);
        floats.put(new FloatKey(CLOCK, HandPath.CCW_HANDPATH), IN);
        floats.put(new FloatKey(COUNTER, HandPath.CW_HANDPATH), IN);
        floats.put(new FloatKey(COUNTER, HandPath.CCW_HANDPATH), OUT);
        FLOAT_TURNS = Collections.unmodifiableMap(floats);
    }

    private OrientationCalculator() {}

    /**
     * End orientation of a motion whose float status, if any, is settled by its own prefloat
     * fields. Use {@link #calculateEndOrientation(Beat, Color, PrefloatResolver)} when the
     * override store or the partner motion should take part.
     */
    public static Orientation calculateEndOrientation(MotionAttributes attrs) {
        return calculateEndOrientation(PrefloatResolver.withoutOverrides()
                .resolve(attrs, null, Direction.NONE, Color.BLUE, null));
    }

    public static Orientation calculateEndOrientation(Beat beat, Color color, PrefloatResolver resolver) {
        return calculateEndOrientation(resolver.resolve(beat, color));
    }

    public static Orientation calculateEndOrientation(ConcreteMotion motion) {
        Orientation start = motion.startOri();
        if (start == null) {
            throw new InvalidMotionException("start orientation is required");
        }
        Turns turns = motion.turns();

        if (turns.floating()) {
            if (motion.source().motionType() != MotionType.FLOAT) {
                throw new InvalidMotionException("'" + Turns.FLOAT_SENTINEL + "' turns on a "
                        + motion.source().motionType().wireName() + " motion");
            }
            HandPath path = GeometryTables.handPath(motion.startLoc(), motion.endLoc());
            Orientation end = FLOAT_TURNS.get(new FloatKey(start, path));
            if (end == null) {
                throw new InvalidMotionException("float motion must shift, got hand path " + path);
            }
            return end;
        }

        MotionType type = motion.motionType();
        if (type == MotionType.FLOAT) {
            throw new InvalidMotionException("float motion with " + turns + " turns has no resolvable prefloat");
        }

        if (turns.isWhole()) {
            boolean even = turns.whole() % 2 == 0;
            return switch (type) {
                case PRO -> even ? start : start.switched();
                case ANTI, DASH -> even ? start.switched() : start;
                case STATIC -> start;
                case FLOAT -> throw new IllegalStateException("unreachable");
            };
        }

        RotationDirection dir = motion.propRotDir();
        if (!dir.isRotating()) {
            throw new InvalidMotionException("half turn (" + turns + ") requires a prop rotation direction");
        }
        Map<HalfTurnKey, Orientation[]> table = switch (type) {
            case PRO, STATIC -> PRO_HALF_TURNS;
            case ANTI, DASH -> ANTI_HALF_TURNS;
            case FLOAT -> throw new IllegalStateException("unreachable");
        };
        Orientation[] candidates = table.get(new HalfTurnKey(start, dir));
        return turns.value() % 2 == 0.5 ? candidates[0] : candidates[1];
    }
}
