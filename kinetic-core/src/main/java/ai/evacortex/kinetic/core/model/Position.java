/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static ai.evacortex.kinetic.core.model.Location.*;

/**
 * Canonical name of a (blue, red) hand location pair, used as a beat's start and end
 * position. Alpha positions hold the hands opposite, beta together, gamma at right angles.
 */
public enum Position {
    ALPHA1(S, N), ALPHA2(SW, NE), ALPHA3(W, E), ALPHA4(NW, SE),
    ALPHA5(N, S), ALPHA6(NE, SW), ALPHA7(E, W), ALPHA8(SE, NW),

    BETA1(N, N), BETA2(NE, NE), BETA3(E, E), BETA4(SE, SE),
    BETA5(S, S), BETA6(SW, SW), BETA7(W, W), BETA8(NW, NW),

    GAMMA1(W, N), GAMMA2(NW, NE), GAMMA3(N, E), GAMMA4(NE, SE),
    GAMMA5(E, S), GAMMA6(SE, SW), GAMMA7(S, W), GAMMA8(SW, NW),
    GAMMA9(E, N), GAMMA10(SE, NE), GAMMA11(S, E), GAMMA12(SW, SE),
    GAMMA13(W, S), GAMMA14(NW, SW), GAMMA15(N, W), GAMMA16(NE, NW);

    private static final Map<Long, Position> BY_LOCATIONS;

    static {
        Map<Long, Position> byLocations = new HashMap<>();
        for (Position p : values()) {
            byLocations.put(pairKey(p.blue, p.red), p);
        }
        BY_LOCATIONS = Collections.unmodifiableMap(byLocations);
    }

    private final Location blue;
    private final Location red;

    Position(Location blue, Location red) {
        this.blue = blue;
        this.red = red;
    }

    public Location blue() {
        return blue;
    }

    public Location red() {
        return red;
    }

    public PositionFamily family() {
        String name = name();
        if (name.startsWith("ALPHA")) return PositionFamily.ALPHA;
        if (name.startsWith("BETA")) return PositionFamily.BETA;
        return PositionFamily.GAMMA;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the position for the pair, or {@code null} when the pair has none. */
    public static Position lookup(Location blue, Location red) {
        return BY_LOCATIONS.get(pairKey(blue, red));
    }

    public static Position fromWire(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown position: " + value, e);
        }
    }

    private static long pairKey(Location blue, Location red) {
        return ((long) blue.ordinal() << 8) | red.ordinal();
    }
}
