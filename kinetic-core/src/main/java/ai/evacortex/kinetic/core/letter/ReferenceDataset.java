/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.letter;

import ai.evacortex.kinetic.core.model.*;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Canonical letter templates, indexed once by (start position, end position) so
 * classification only scans the few templates that can possibly match.
 *
 * <p>JSON shape: {@code {"A": [{"start_pos", "end_pos", "timing", "direction",
 * "blue_attributes": {...}, "red_attributes": {...}}]}}, attribute objects using the
 * field names of {@link MotionAttributes} in snake case.</p>
 */
public final class ReferenceDataset {

    private record PositionPair(Position start, Position end) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TemplateJson(@JsonProperty("start_pos") String startPos,
                        @JsonProperty("end_pos") String endPos,
                        @JsonProperty("timing") String timing,
                        @JsonProperty("direction") String direction,
                        @JsonProperty("blue_attributes") AttributesJson blue,
                        @JsonProperty("red_attributes") AttributesJson red) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AttributesJson(@JsonProperty("motion_type") String motionType,
                          @JsonProperty("start_loc") String startLoc,
                          @JsonProperty("end_loc") String endLoc,
                          @JsonProperty("start_ori") String startOri,
                          @JsonProperty("end_ori") String endOri,
                          @JsonProperty("turns") Object turns,
                          @JsonProperty("prop_rot_dir") String propRotDir) {

        MotionAttributes toAttributes() {
            return new MotionAttributes(
                    MotionType.fromWire(motionType),
                    Location.fromWire(startLoc),
                    Location.fromWire(endLoc),
                    startOri == null ? null : Orientation.fromWire(startOri),
                    endOri == null ? null : Orientation.fromWire(endOri),
                    turns == null ? Turns.ZERO : Turns.parse(String.valueOf(turns)),
                    propRotDir == null ? RotationDirection.NONE : RotationDirection.fromWire(propRotDir),
                    null, null);
        }
    }

    private final List<LetterTemplate> templates;
    private final Map<PositionPair, List<LetterTemplate>> byPositions;

    private ReferenceDataset(List<LetterTemplate> templates) {
        this.templates = List.copyOf(templates);
        Map<PositionPair, List<LetterTemplate>> index = new HashMap<>();
        for (LetterTemplate t : this.templates) {
            index.computeIfAbsent(new PositionPair(t.startPos(), t.endPos()), k -> new ArrayList<>()).add(t);
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        this.byPositions = Collections.unmodifiableMap(index);
    }

    public static ReferenceDataset of(List<LetterTemplate> templates) {
        return new ReferenceDataset(templates);
    }

    public static ReferenceDataset load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load reference dataset " + path, e);
        }
    }

    public static ReferenceDataset fromClasspath(String resource) {
        try (InputStream in = ReferenceDataset.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load reference dataset " + resource, e);
        }
    }

    public static ReferenceDataset load(InputStream in) throws IOException {
        TypeReference<LinkedHashMap<String, List<TemplateJson>>> typeRef = new TypeReference<>() {};
        Map<String, List<TemplateJson>> raw = new ObjectMapper().readValue(in, typeRef);
        List<LetterTemplate> templates = new ArrayList<>();
        for (Map.Entry<String, List<TemplateJson>> entry : raw.entrySet()) {
            Letter letter = Letter.fromSymbol(entry.getKey());
            for (TemplateJson json : entry.getValue()) {
                templates.add(new LetterTemplate(letter,
                        Position.fromWire(json.startPos()),
                        Position.fromWire(json.endPos()),
                        Timing.fromWire(json.timing()),
                        Direction.fromWire(json.direction()),
                        json.blue().toAttributes(),
                        json.red().toAttributes()));
            }
        }
        return new ReferenceDataset(templates);
    }

    /** Templates starting and ending at the given positions, in dataset order. */
    public List<LetterTemplate> candidates(Position start, Position end) {
        return byPositions.getOrDefault(new PositionPair(start, end), List.of());
    }

    public List<LetterTemplate> templates() {
        return templates;
    }

    public int size() {
        return templates.size();
    }
}
