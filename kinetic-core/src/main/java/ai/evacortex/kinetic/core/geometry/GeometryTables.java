/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.geometry;

import ai.evacortex.kinetic.core.exceptions.InvalidLocationException;
import ai.evacortex.kinetic.core.model.*;

import java.util.*;

/**
 * Static compass lookups shared by every calculator: 45° rotation, per-grid hand-position
 * rotation, reflection, hand-path classification and location-pair to position naming.
 * All tables are built once and are immutable.
 */
public final class GeometryTables {

    private static final Location[] RING = Location.values();

    private static final Map<Location, Location> CW_STEP;
    private static final Map<Location, Location> CCW_STEP;
    private static final Map<Location, Location> OPPOSITE;
    private static final Map<MirrorAxis, Map<Location, Location>> MIRROR;
    private static final Map<GridMode, Map<RotationDirection, Map<Location, Location>>> GRID_ROTATION;
    private static final Map<LocationPair, HandPath> HAND_PATHS;
    private static final Map<LocationPair, Location> SHIFT_LOCATIONS;

    static {
        EnumMap<Location, Location> cw = new EnumMap<>(Location.class);
        EnumMap<Location, Location> ccw = new EnumMap<>(Location.class);
        EnumMap<Location, Location> opposite = new EnumMap<>(Location.class);
        EnumMap<Location, Location> vertical = new EnumMap<>(Location.class);
        EnumMap<Location, Location> horizontal = new EnumMap<>(Location.class);
        for (Location loc : RING) {
            int i = loc.ordinal();
            cw.put(loc, RING[(i + 1) % 8]);
            ccw.put(loc, RING[(i + 7) % 8]);
            opposite.put(loc, RING[(i + 4) % 8]);
            vertical.put(loc, RING[(8 - i) % 8]);
            horizontal.put(loc, RING[(12 - i) % 8]);
        }
        CW_STEP = Collections.unmodifiableMap(cw);
        CCW_STEP = Collections.unmodifiableMap(ccw);
        OPPOSITE = Collections.unmodifiableMap(opposite);

        EnumMap<MirrorAxis, Map<Location, Location>> mirror = new EnumMap<>(MirrorAxis.class);
        mirror.put(MirrorAxis.VERTICAL, Collections.unmodifiableMap(vertical));
        mirror.put(MirrorAxis.HORIZONTAL, Collections.unmodifiableMap(horizontal));
        MIRROR = Collections.unmodifiableMap(mirror);

        EnumMap<GridMode, Map<RotationDirection, Map<Location, Location>>> grid = new EnumMap<>(GridMode.class);
        for (GridMode mode : GridMode.values()) {
            List<Location> ring = mode.handPositions();
            EnumMap<Location, Location> gridCw = new EnumMap<>(Location.class);
            EnumMap<Location, Location> gridCcw = new EnumMap<>(Location.class);
            for (int i = 0; i < ring.size(); i++) {
                gridCw.put(ring.get(i), ring.get((i + 1) % ring.size()));
                gridCcw.put(ring.get(i), ring.get((i + ring.size() - 1) % ring.size()));
            }
            EnumMap<RotationDirection, Map<Location, Location>> byDir = new EnumMap<>(RotationDirection.class);
            byDir.put(RotationDirection.CW, Collections.unmodifiableMap(gridCw));
            byDir.put(RotationDirection.CCW, Collections.unmodifiableMap(gridCcw));
            grid.put(mode, Collections.unmodifiableMap(byDir));
        }
        GRID_ROTATION = Collections.unmodifiableMap(grid);

        Map<LocationPair, HandPath> paths = new HashMap<>();
        Map<LocationPair, Location> shifts = new HashMap<>();
        for (GridMode mode : GridMode.values()) {
            for (Location start : mode.handPositions()) {
                Location cwEnd = grid.get(mode).get(RotationDirection.CW).get(start);
                paths.put(LocationPair.of(start, cwEnd), HandPath.CW_HANDPATH);
                paths.put(LocationPair.of(cwEnd, start), HandPath.CCW_HANDPATH);
                paths.put(LocationPair.of(start, opposite.get(start)), HandPath.DASH);
                paths.put(LocationPair.of(start, start), HandPath.STATIC);

                Location between = cw.get(start);
                shifts.put(LocationPair.of(start, cwEnd), between);
                shifts.put(LocationPair.of(cwEnd, start), between);
            }
        }
        HAND_PATHS = Collections.unmodifiableMap(paths);
        SHIFT_LOCATIONS = Collections.unmodifiableMap(shifts);
    }

    private GeometryTables() {}

    /** One 45° step around the compass. NONE leaves the location unchanged. */
    public static Location rotate(Location loc, RotationDirection direction) {
        return switch (direction) {
            case CW -> CW_STEP.get(loc);
            case CCW -> CCW_STEP.get(loc);
            case NONE -> loc;
        };
    }

    /**
     * One hand-position step within the grid's ring of four.
     *
     * @throws InvalidLocationException if {@code loc} is not a hand position of {@code grid}
     */
    public static Location rotate(Location loc, RotationDirection direction, GridMode grid) {
        if (!grid.contains(loc)) {
            throw new InvalidLocationException(loc + " is not a " + grid.wireName() + " hand position");
        }
        if (direction == RotationDirection.NONE) return loc;
        return GRID_ROTATION.get(grid).get(direction).get(loc);
    }

    public static Location mirror(Location loc, MirrorAxis axis) {
        return MIRROR.get(axis).get(loc);
    }

    public static Location opposite(Location loc) {
        return OPPOSITE.get(loc);
    }

    /**
     * Canonical position of a (blue, red) pair.
     *
     * @throws InvalidLocationException if the pair mixes diamond and box positions
     */
    public static Position combine(Location blue, Location red) {
        Position position = Position.lookup(blue, red);
        if (position == null) {
            throw new InvalidLocationException("no position for (" + blue + ", " + red + ")");
        }
        return position;
    }

    /**
     * Direction the hand travels from {@code start} to {@code end}.
     *
     * @throws InvalidLocationException if the two locations are on different grids
     */
    public static HandPath handPath(Location start, Location end) {
        HandPath path = HAND_PATHS.get(LocationPair.of(start, end));
        if (path == null) {
            throw new InvalidLocationException("no hand path from " + start + " to " + end);
        }
        return path;
    }

    /** Moves a hand position along a hand path: one grid step, a dash across, or nowhere. */
    public static Location advance(Location loc, HandPath path) {
        return switch (path) {
            case CW_HANDPATH -> rotate(loc, RotationDirection.CW, GridMode.of(loc));
            case CCW_HANDPATH -> rotate(loc, RotationDirection.CCW, GridMode.of(loc));
            case DASH -> opposite(loc);
            case STATIC -> loc;
        };
    }

    /** Compass point between two adjacent hand positions; {@code start} when they are not adjacent. */
    public static Location shiftLocation(Location start, Location end) {
        return SHIFT_LOCATIONS.getOrDefault(LocationPair.of(start, end), start);
    }

    /** Rotates both hands of a position by the given number of 90° steps. */
    public static Position rotatePosition(Position position, RotationDirection direction, int quarterTurns) {
        Location blue = position.blue();
        Location red = position.red();
        for (int i = 0; i < quarterTurns * 2; i++) {
            blue = rotate(blue, direction);
            red = rotate(red, direction);
        }
        return combine(blue, red);
    }

    public static Position mirrorPosition(Position position, MirrorAxis axis) {
        return combine(mirror(position.blue(), axis), mirror(position.red(), axis));
    }

    public static Position swapPosition(Position position) {
        return combine(position.red(), position.blue());
    }
}
