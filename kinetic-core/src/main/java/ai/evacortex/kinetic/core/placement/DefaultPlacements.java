/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.placement;

import ai.evacortex.kinetic.core.model.GridMode;
import ai.evacortex.kinetic.core.model.MotionType;
import ai.evacortex.kinetic.core.model.Turns;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Base arrow adjustments by grid, motion type and turns, read from a JSON table shaped
 * {@code {"separation": s, "<grid>": {"<motion type>": {"<turns>" | "default": [x, y]}}}}.
 */
public final class DefaultPlacements {

    public static final String RESOURCE = "/default-placements.json";

    private static final double[] ZERO = {0.0, 0.0};

    private final JsonNode table;

    private DefaultPlacements(JsonNode table) {
        this.table = table;
    }

    public static DefaultPlacements fromClasspath() {
        try (InputStream in = DefaultPlacements.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return new DefaultPlacements(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public static DefaultPlacements empty() {
        return new DefaultPlacements(new ObjectMapper().createObjectNode());
    }

    /** Offset separating two arrows that share an anchor. */
    public double separation() {
        return table.path("separation").asDouble(0.0);
    }

    public double[] offset(GridMode grid, MotionType type, Turns turns) {
        JsonNode byType = table.path(grid.wireName()).path(type.wireName());
        JsonNode value = byType.path(turns.toString());
        if (!value.isArray()) {
            value = byType.path("default");
        }
        if (!value.isArray() || value.size() != 2) {
            return ZERO.clone();
        }
        return new double[]{value.get(0).asDouble(), value.get(1).asDouble()};
    }
}
