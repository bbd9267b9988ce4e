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
import ai.evacortex.kinetic.core.metadata.OverrideKeys;
import ai.evacortex.kinetic.core.metadata.PrefloatOverrideStore;
import ai.evacortex.kinetic.core.model.*;
import ai.evacortex.kinetic.core.orientation.ConcreteMotion;
import ai.evacortex.kinetic.core.orientation.PrefloatResolver;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static ai.evacortex.kinetic.core.model.Letter.*;

/**
 * Resolves where an arrow is drawn. Static arrows sit on their start location, dash arrows
 * come from {@link DashLocationTables}, and shift arrows sit between their start and end
 * unless the override store pins them elsewhere.
 *
 * <p>Results depend only on the arguments and the override store contents, so identical
 * inputs against an unchanged store always produce the same placement.</p>
 */
public class ArrowLocationResolver {

    private static final Logger log = LoggerFactory.getLogger(ArrowLocationResolver.class);

    private final PrefloatResolver prefloatResolver;
    private final DefaultPlacements defaults;

    public ArrowLocationResolver(PrefloatResolver prefloatResolver, DefaultPlacements defaults) {
        this.prefloatResolver = Objects.requireNonNull(prefloatResolver, "prefloatResolver");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public Location resolveLocation(Beat beat, Color color) {
        MotionAttributes motion = beat.motion(color);
        return resolveLocation(motion, beat.motion(color.other()), color, LetterContext.of(beat),
                GridMode.of(motion.startLoc()));
    }

    public Location resolveLocation(MotionAttributes motion, MotionAttributes partner, Color color,
                                    LetterContext context, GridMode grid) {
        return switch (motion.motionType()) {
            case STATIC -> motion.startLoc();
            case DASH -> dashLocation(motion, partner, color, context, grid);
            case PRO, ANTI, FLOAT -> shiftLocation(motion, context);
        };
    }

    public ArrowPlacement resolvePlacement(Beat beat, Color color) {
        MotionAttributes motion = beat.motion(color);
        return resolvePlacement(motion, beat.motion(color.other()), color, LetterContext.of(beat),
                GridMode.of(motion.startLoc()));
    }

    /**
     * Anchor plus offset. A stored {@code <color>_adjustment} is used as is; otherwise the
     * default adjustment is rotated into the anchor's quadrant. Arrows sharing an anchor
     * with their partner are pushed apart by color.
     */
    public ArrowPlacement resolvePlacement(MotionAttributes motion, MotionAttributes partner, Color color,
                                           LetterContext context, GridMode grid) {
        Location anchor = resolveLocation(motion, partner, color, context, grid);

        double[] offset = storedAdjustment(context, color);
        if (offset == null) {
            ConcreteMotion concrete = prefloatResolver.resolve(motion, partner, context.direction(), color,
                    context.scope());
            double[] base = defaults.offset(grid, motion.motionType(), motion.turns());
            offset = DirectionalTuples.rotateIntoQuadrant(motion, concrete.motionType(), concrete.propRotDir(),
                    grid, anchor, base[0], base[1]);
        }

        if (partner != null && defaults.separation() > 0) {
            Location partnerAnchor = resolveLocation(partner, motion, color.other(), context, grid);
            if (partnerAnchor == anchor) {
                double push = color == Color.BLUE ? -defaults.separation() : defaults.separation();
                double[] apart = DirectionalTuples.separation(anchor, push);
                offset = new double[]{offset[0] + apart[0], offset[1] + apart[1]};
            }
        }
        return new ArrowPlacement(anchor, offset[0], offset[1]);
    }

    private Location dashLocation(MotionAttributes motion, MotionAttributes partner, Color color,
                                  LetterContext context, GridMode grid) {
        Location start = motion.startLoc();
        Location end = motion.endLoc();
        boolean zeroTurns = motion.turns().isZero();
        Location result;

        if (context.is(PHI_DASH, PSI_DASH)) {
            boolean partnerZeroTurns = partner == null || partner.turns().isZero();
            if (zeroTurns && partnerZeroTurns) {
                result = DashLocationTables.doubleDash(color, start, end);
            } else if (zeroTurns) {
                Location partnerAnchor = DashLocationTables.nonZeroTurns(partner.propRotDir(), partner.startLoc());
                result = partnerAnchor == null ? null : GeometryTables.opposite(partnerAnchor);
            } else {
                result = DashLocationTables.nonZeroTurns(motion.propRotDir(), start);
            }
        } else if (zeroTurns && partner != null && context.is(LAMBDA, LAMBDA_DASH)) {
            result = DashLocationTables.lambdaZeroTurns(start, end, partner.endLoc());
        } else if (zeroTurns && partner != null && context.isShiftComposed()) {
            Location partnerShift = GeometryTables.shiftLocation(partner.startLoc(), partner.endLoc());
            result = DashLocationTables.shiftComposed(grid, start, partnerShift);
        } else if (zeroTurns) {
            result = DashLocationTables.defaultZeroTurns(start, end);
        } else {
            result = DashLocationTables.nonZeroTurns(motion.propRotDir(), start);
        }

        if (result == null) {
            log.debug("No dash anchor for {} {}->{} ({}), using start location", color, start, end, context.letter());
            return start;
        }
        return result;
    }

    private Location shiftLocation(MotionAttributes motion, LetterContext context) {
        PrefloatOverrideStore store = prefloatResolver.store();
        if (store != null && context.scope() != null) {
            String pinned = store.getText(context.scope(),
                    OverrideKeys.locationOverride(motion.startLoc(), motion.endLoc())).orElse(null);
            if (pinned != null) {
                try {
                    return Location.fromWire(pinned);
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring location override '{}' under {}", pinned, context.scope());
                }
            }
        }
        return GeometryTables.shiftLocation(motion.startLoc(), motion.endLoc());
    }

    private double[] storedAdjustment(LetterContext context, Color color) {
        PrefloatOverrideStore store = prefloatResolver.store();
        if (store == null || context.scope() == null) return null;
        JsonNode node = store.get(context.scope(), OverrideKeys.adjustment(color)).orElse(null);
        if (node == null || !node.isArray() || node.size() != 2) return null;
        return new double[]{node.get(0).asDouble(), node.get(1).asDouble()};
    }
}
