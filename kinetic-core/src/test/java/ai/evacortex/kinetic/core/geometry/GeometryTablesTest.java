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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static ai.evacortex.kinetic.core.model.Location.*;
import static org.junit.jupiter.api.Assertions.*;

class GeometryTablesTest {

    @Nested
    class Rotation {

        @ParameterizedTest
        @EnumSource(Location.class)
        void cwThenCcwIsIdentity(Location loc) {
            Location there = GeometryTables.rotate(loc, RotationDirection.CW);
            assertEquals(loc, GeometryTables.rotate(there, RotationDirection.CCW));
        }

        @ParameterizedTest
        @EnumSource(Location.class)
        void gridRotationRoundTrips(Location loc) {
            GridMode grid = GridMode.of(loc);
            Location there = GeometryTables.rotate(loc, RotationDirection.CW, grid);
            assertTrue(grid.contains(there));
            assertEquals(loc, GeometryTables.rotate(there, RotationDirection.CCW, grid));
        }

        @Test
        void eightStepsCloseTheCircle() {
            Location loc = N;
            for (int i = 0; i < 8; i++) {
                loc = GeometryTables.rotate(loc, RotationDirection.CW);
            }
            assertEquals(N, loc);
            assertEquals(NE, GeometryTables.rotate(N, RotationDirection.CW));
            assertEquals(NW, GeometryTables.rotate(N, RotationDirection.CCW));
        }

        @Test
        @DisplayName("Diagonal location is rejected by the diamond grid")
        void rejectsLocationOutsideGrid() {
            assertThrows(InvalidLocationException.class,
                    () -> GeometryTables.rotate(NE, RotationDirection.CW, GridMode.DIAMOND));
            assertEquals(E, GeometryTables.rotate(N, RotationDirection.CW, GridMode.DIAMOND));
            assertEquals(NW, GeometryTables.rotate(NE, RotationDirection.CCW, GridMode.BOX));
        }
    }

    @Test
    void mirrorSwapsAcrossAxis() {
        assertEquals(W, GeometryTables.mirror(E, MirrorAxis.VERTICAL));
        assertEquals(NW, GeometryTables.mirror(NE, MirrorAxis.VERTICAL));
        assertEquals(N, GeometryTables.mirror(N, MirrorAxis.VERTICAL));
        assertEquals(S, GeometryTables.mirror(N, MirrorAxis.HORIZONTAL));
        assertEquals(SE, GeometryTables.mirror(NE, MirrorAxis.HORIZONTAL));
        assertEquals(E, GeometryTables.mirror(E, MirrorAxis.HORIZONTAL));
        for (Location loc : Location.values()) {
            for (MirrorAxis axis : MirrorAxis.values()) {
                assertEquals(loc, GeometryTables.mirror(GeometryTables.mirror(loc, axis), axis));
            }
        }
    }

    @Test
    void combineNamesPositions() {
        assertEquals(Position.ALPHA1, GeometryTables.combine(S, N));
        assertEquals(Position.BETA3, GeometryTables.combine(E, E));
        assertEquals(Position.GAMMA1, GeometryTables.combine(W, N));
        assertEquals(Position.GAMMA16, GeometryTables.combine(NE, NW));
        assertThrows(InvalidLocationException.class, () -> GeometryTables.combine(N, NE));
    }

    @Test
    void everyPositionRoundTripsThroughCombine() {
        for (Position p : Position.values()) {
            assertEquals(p, GeometryTables.combine(p.blue(), p.red()));
        }
    }

    @Test
    void positionTransforms() {
        assertEquals(Position.ALPHA7, GeometryTables.mirrorPosition(Position.ALPHA3, MirrorAxis.VERTICAL));
        assertEquals(Position.GAMMA9, GeometryTables.mirrorPosition(Position.GAMMA1, MirrorAxis.VERTICAL));
        assertEquals(Position.ALPHA5, GeometryTables.mirrorPosition(Position.ALPHA1, MirrorAxis.HORIZONTAL));
        assertEquals(Position.ALPHA5, GeometryTables.rotatePosition(Position.ALPHA1, RotationDirection.CW, 2));
        assertEquals(Position.ALPHA3, GeometryTables.rotatePosition(Position.ALPHA1, RotationDirection.CW, 1));
        assertEquals(Position.ALPHA5, GeometryTables.swapPosition(Position.ALPHA1));
        assertEquals(Position.GAMMA15, GeometryTables.swapPosition(Position.GAMMA1));
    }

    @Test
    void handPathsAndShiftLocations() {
        assertEquals(HandPath.CW_HANDPATH, GeometryTables.handPath(S, W));
        assertEquals(HandPath.CCW_HANDPATH, GeometryTables.handPath(W, S));
        assertEquals(HandPath.DASH, GeometryTables.handPath(N, S));
        assertEquals(HandPath.STATIC, GeometryTables.handPath(NE, NE));
        assertThrows(InvalidLocationException.class, () -> GeometryTables.handPath(N, NE));

        assertEquals(NE, GeometryTables.shiftLocation(N, E));
        assertEquals(NE, GeometryTables.shiftLocation(E, N));
        assertEquals(E, GeometryTables.shiftLocation(NE, SE));
        assertEquals(N, GeometryTables.shiftLocation(N, S), "non-adjacent falls back to start");

        assertEquals(E, GeometryTables.advance(N, HandPath.CW_HANDPATH));
        assertEquals(W, GeometryTables.advance(N, HandPath.CCW_HANDPATH));
        assertEquals(S, GeometryTables.advance(N, HandPath.DASH));
        assertEquals(N, GeometryTables.advance(N, HandPath.STATIC));
    }
}
