/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.placement;

import ai.evacortex.kinetic.core.geometry.GeometryTables;
import ai.evacortex.kinetic.core.model.*;

import java.util.List;

import static ai.evacortex.kinetic.core.placement.DirectionalTuples.Transform.*;

/**
 * Rotates a base (x, y) adjustment into the quadrant an arrow is anchored in. Each motion
 * family has its own list of four transforms, indexed by quadrant.
 */
final class DirectionalTuples {

    enum Transform {
        IDENTITY, ROT_90, ROT_180, ROT_270, SWAP, SWAP_NEGATE, FLIP_X, FLIP_Y;

        double[] apply(double x, double y) {
            return switch (this) {
                case IDENTITY -> new double[]{x, y};
                case ROT_90 -> new double[]{-y, x};
                case ROT_180 -> new double[]{-x, -y};
                case ROT_270 -> new double[]{y, -x};
                case SWAP -> new double[]{y, x};
                case SWAP_NEGATE -> new double[]{-y, -x};
                case FLIP_X -> new double[]{-x, y};
                case FLIP_Y -> new double[]{x, -y};
            };
        }
    }

    private static final List<Transform> SHIFT_CW = List.of(IDENTITY, ROT_90, ROT_180, ROT_270);
    private static final List<Transform> SHIFT_CCW = List.of(SWAP_NEGATE, FLIP_Y, SWAP, FLIP_X);

    private static final List<Transform> DIAMOND_CW = List.of(FLIP_Y, SWAP, FLIP_X, SWAP_NEGATE);
    private static final List<Transform> DIAMOND_CCW = List.of(ROT_180, ROT_270, IDENTITY, ROT_90);
    private static final List<Transform> DASH_BOX_CW = List.of(ROT_90, ROT_180, ROT_270, IDENTITY);
    private static final List<Transform> DASH_BOX_CCW = List.of(FLIP_X, SWAP_NEGATE, FLIP_Y, SWAP);
    private static final List<Transform> DASH_NO_ROT = List.of(IDENTITY, ROT_90, ROT_180, ROT_270);
    private static final List<Transform> STATIC_NO_ROT = List.of(IDENTITY, ROT_180, ROT_90, ROT_270);

    private DirectionalTuples() {}

    /**
     * Quadrant of an anchor within its ring of four: cardinals N, E, S, W and diagonals
     * NE, SE, SW, NW each map to 0..3 clockwise.
     */
    static int quadrant(Location anchor) {
        return anchor.ordinal() / 2;
    }

    static double[] rotateIntoQuadrant(MotionAttributes motion, MotionType effectiveType,
                                       RotationDirection effectiveDir, GridMode grid,
                                       Location anchor, double x, double y) {
        List<Transform> tuples = tuplesFor(motion, effectiveType, effectiveDir, grid);
        return tuples.get(quadrant(anchor)).apply(x, y);
    }

    /** Offset of length {@code push} pointing along the anchor quadrant's x axis. */
    static double[] separation(Location anchor, double push) {
        return SHIFT_CW.get(quadrant(anchor)).apply(push, 0.0);
    }

    static List<Transform> tuplesFor(MotionAttributes motion, MotionType type, RotationDirection dir, GridMode grid) {
        return switch (type) {
            case PRO -> dir == RotationDirection.CCW ? SHIFT_CCW : SHIFT_CW;
            case ANTI -> dir == RotationDirection.CCW ? SHIFT_CW : SHIFT_CCW;
            case FLOAT -> GeometryTables.handPath(motion.startLoc(), motion.endLoc()) == HandPath.CCW_HANDPATH
                    ? SHIFT_CCW : SHIFT_CW;
            case DASH -> switch (dir) {
                case CW -> grid == GridMode.DIAMOND ? DIAMOND_CW : DASH_BOX_CW;
                case CCW -> grid == GridMode.DIAMOND ? DIAMOND_CCW : DASH_BOX_CCW;
                case NONE -> DASH_NO_ROT;
            };
            case STATIC -> switch (dir) {
                case CW -> grid == GridMode.DIAMOND ? DIAMOND_CW : SHIFT_CW;
                case CCW -> grid == GridMode.DIAMOND ? DIAMOND_CCW : SHIFT_CCW;
                case NONE -> STATIC_NO_ROT;
            };
        };
    }
}
