/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core;

import ai.evacortex.kinetic.core.geometry.GeometryTables;
import ai.evacortex.kinetic.core.letter.ReferenceDataset;
import ai.evacortex.kinetic.core.model.*;
import ai.evacortex.kinetic.core.orientation.OrientationCalculator;

import java.util.List;

import static ai.evacortex.kinetic.core.model.Location.*;

public final class TestBeats {

    public static final String DATASET_RESOURCE = "/reference-dataset.json";

    private TestBeats() {}

    public static ReferenceDataset dataset() {
        return ReferenceDataset.fromClasspath(DATASET_RESOURCE);
    }

    public static MotionAttributes motion(MotionType type, Location start, Location end, double turns,
                                          RotationDirection dir, Orientation startOri) {
        return MotionAttributes.of(type, start, end, startOri, Turns.of(turns), dir);
    }

    public static MotionAttributes pro(Location start, Location end, RotationDirection dir) {
        return motion(MotionType.PRO, start, end, 0, dir, Orientation.IN);
    }

    public static MotionAttributes anti(Location start, Location end, RotationDirection dir) {
        return motion(MotionType.ANTI, start, end, 0, dir, Orientation.IN);
    }

    public static MotionAttributes staticAt(Location loc) {
        return motion(MotionType.STATIC, loc, loc, 0, RotationDirection.NONE, Orientation.IN);
    }

    public static MotionAttributes dash(Location start, Location end, double turns, RotationDirection dir) {
        return motion(MotionType.DASH, start, end, turns, dir, Orientation.IN);
    }

    public static MotionAttributes floatMotion(Location start, Location end) {
        return MotionAttributes.of(MotionType.FLOAT, start, end, Orientation.IN, Turns.FLOAT, RotationDirection.NONE);
    }

    /** Beat with positions derived from the locations and end orientations filled in. */
    public static Beat beat(int number, Letter letter, Direction direction, MotionAttributes blue, MotionAttributes red) {
        Beat raw = new Beat(number, letter, null,
                GeometryTables.combine(blue.startLoc(), red.startLoc()),
                GeometryTables.combine(blue.endLoc(), red.endLoc()),
                Timing.SPLIT, direction, blue, red);
        if (blue.motionType() == MotionType.FLOAT || red.motionType() == MotionType.FLOAT) {
            return raw;
        }
        return raw.withMotion(Color.BLUE, blue.withEndOri(OrientationCalculator.calculateEndOrientation(blue)))
                .withMotion(Color.RED, red.withEndOri(OrientationCalculator.calculateEndOrientation(red)));
    }

    public static Beat beat(int number, Letter letter, MotionAttributes blue, MotionAttributes red) {
        return beat(number, letter, Direction.SAME, blue, red);
    }

    /** Two A beats: alpha1 -> alpha3 -> alpha5, ending a half turn from the start. */
    public static Sequence halvedPartial() {
        return Sequence.of(List.of(
                beat(1, Letter.A, pro(S, W, RotationDirection.CW), pro(N, E, RotationDirection.CW)),
                beat(2, Letter.A, pro(W, N, RotationDirection.CW), pro(E, S, RotationDirection.CW))));
    }

    /** halvedPartial followed by two static alpha beats. */
    public static Sequence fourBeatPartial() {
        return Sequence.of(List.of(
                beat(1, Letter.A, pro(S, W, RotationDirection.CW), pro(N, E, RotationDirection.CW)),
                beat(2, Letter.A, pro(W, N, RotationDirection.CW), pro(E, S, RotationDirection.CW)),
                beat(3, Letter.ALPHA, staticAt(N), staticAt(S)),
                beat(4, Letter.ALPHA, staticAt(N), staticAt(S))));
    }
}
