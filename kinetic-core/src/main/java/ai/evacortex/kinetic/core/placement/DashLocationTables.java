/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.placement;

import ai.evacortex.kinetic.core.geometry.LocationPair;
import ai.evacortex.kinetic.core.model.Color;
import ai.evacortex.kinetic.core.model.GridMode;
import ai.evacortex.kinetic.core.model.Location;
import ai.evacortex.kinetic.core.model.RotationDirection;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

import static ai.evacortex.kinetic.core.model.Location.*;

/**
 * Anchor tables for dash arrows. Every lookup returns {@code null} on a miss; the resolver
 * then falls back to the start location.
 */
final class DashLocationTables {

    /** Key of the lambda table: the dash's own (start, end) plus the partner's end. */
    private record LambdaKey(LocationPair pair, Location partnerEnd) {}

    private static final Map<Color, Map<LocationPair, Location>> DOUBLE_DASH;
    private static final Map<LambdaKey, Location> LAMBDA_ZERO_TURNS;
    private static final Map<LocationPair, Location> DEFAULT_ZERO_TURNS;
    private static final Map<RotationDirection, Map<Location, Location>> NON_ZERO_TURNS;
    /** Keyed by (start, partner shift location). */
    private static final Map<GridMode, Map<LocationPair, Location>> SHIFT_COMPOSED;

    static {
        Map<Color, Map<LocationPair, Location>> doubleDash = new EnumMap<>(Color.class);
        doubleDash.put(Color.RED, pairs(
                N, S, E, E, W, N, S, N, E, W, E, N,
                NW, SE, NE, NE, SW, SE, SW, NE, SE, SE, NW, NE));
        doubleDash.put(Color.BLUE, pairs(
                N, S, W, E, W, S, S, N, W, W, E, S,
                NW, SE, SW, NE, SW, NW, SW, NE, NW, SE, NW, SW));
        DOUBLE_DASH = Collections.unmodifiableMap(doubleDash);

        Map<LambdaKey, Location> lambda = new HashMap<>();
        lambda(lambda, N, S, W, E);
        lambda(lambda, E, W, S, N);
        lambda(lambda, N, S, E, W);
        lambda(lambda, W, E, S, N);
        lambda(lambda, S, N, W, E);
        lambda(lambda, E, W, N, S);
        lambda(lambda, S, N, E, W);
        lambda(lambda, W, E, N, S);
        lambda(lambda, NE, SW, NW, SE);
        lambda(lambda, NW, SE, NE, SW);
        lambda(lambda, SW, NE, SE, NW);
        lambda(lambda, SE, NW, SW, NE);
        lambda(lambda, NE, SW, SE, NW);
        lambda(lambda, NW, SE, SW, NE);
        lambda(lambda, SW, NE, NW, SE);
        lambda(lambda, SE, NW, NE, SW);
        LAMBDA_ZERO_TURNS = Collections.unmodifiableMap(lambda);

        DEFAULT_ZERO_TURNS = pairs(
                N, S, E, E, W, S, S, N, W, W, E, N,
                NE, SW, SE, NW, SE, NE, SW, NE, NW, SE, NW, SW);

        Map<RotationDirection, Map<Location, Location>> nonZero = new EnumMap<>(RotationDirection.class);
        nonZero.put(RotationDirection.CW, singles(N, E, E, S, S, W, W, N, NE, SE, SE, SW, SW, NW, NW, NE));
        nonZero.put(RotationDirection.CCW, singles(N, W, E, N, S, E, W, S, NE, NW, SE, NE, SW, SE, NW, SW));
        NON_ZERO_TURNS = Collections.unmodifiableMap(nonZero);

        Map<GridMode, Map<LocationPair, Location>> composed = new EnumMap<>(GridMode.class);
        composed.put(GridMode.DIAMOND, pairs(
                N, NW, E, N, NE, W, N, SE, W, N, SW, E,
                E, NW, S, E, NE, S, E, SE, N, E, SW, N,
                S, NW, E, S, NE, W, S, SE, W, S, SW, E,
                W, NW, S, W, NE, S, W, SE, N, W, SW, N));
        composed.put(GridMode.BOX, pairs(
                NE, N, SE, NE, E, NW, NE, S, NW, NE, W, SE,
                SE, N, SW, SE, E, SW, SE, S, NE, SE, W, NE,
                SW, N, SE, SW, E, NW, SW, S, NW, SW, W, SE,
                NW, N, SW, NW, E, SW, NW, S, NE, NW, W, NE));
        SHIFT_COMPOSED = Collections.unmodifiableMap(composed);
    }

    private DashLocationTables() {}

    /** Φ- and Ψ-: both dashes at zero turns. */
    static Location doubleDash(Color color, Location start, Location end) {
        return DOUBLE_DASH.get(color).get(LocationPair.of(start, end));
    }

    static Location lambdaZeroTurns(Location start, Location end, Location partnerEnd) {
        return LAMBDA_ZERO_TURNS.get(new LambdaKey(LocationPair.of(start, end), partnerEnd));
    }

    static Location defaultZeroTurns(Location start, Location end) {
        return DEFAULT_ZERO_TURNS.get(LocationPair.of(start, end));
    }

    static Location nonZeroTurns(RotationDirection dir, Location start) {
        Map<Location, Location> table = NON_ZERO_TURNS.get(dir);
        return table == null ? null : table.get(start);
    }

    static Location shiftComposed(GridMode grid, Location start, Location partnerShift) {
        return SHIFT_COMPOSED.get(grid).get(LocationPair.of(start, partnerShift));
    }

    /** Triples of (start, end, result). */
    private static Map<LocationPair, Location> pairs(Location... triples) {
        Map<LocationPair, Location> map = new HashMap<>();
        for (int i = 0; i < triples.length; i += 3) {
            map.put(LocationPair.of(triples[i], triples[i + 1]), triples[i + 2]);
        }
        return Collections.unmodifiableMap(map);
    }

    /** Pairs of (start, result). */
    private static Map<Location, Location> singles(Location... pairs) {
        Map<Location, Location> map = new EnumMap<>(Location.class);
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

    private static void lambda(Map<LambdaKey, Location> map, Location start, Location end,
                               Location partnerEnd, Location result) {
        map.put(new LambdaKey(LocationPair.of(start, end), partnerEnd), result);
    }
}
