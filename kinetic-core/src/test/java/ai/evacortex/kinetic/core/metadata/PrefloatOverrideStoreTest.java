/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.metadata;

import ai.evacortex.kinetic.core.config.EngineConfig;
import ai.evacortex.kinetic.core.geometry.MirrorAxis;
import ai.evacortex.kinetic.core.model.*;
import ai.evacortex.kinetic.core.storage.HashingUtil;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrefloatOverrideStoreTest {

    private static final OverrideScope SCOPE = new OverrideScope(GridMode.DIAMOND,
            OrientationCategory.FROM_LAYER1, Letter.A, new TurnsTupleKey("(s, 0, 0)"));
    private static final OverrideScope OTHER_SCOPE = new OverrideScope(GridMode.BOX,
            OrientationCategory.FROM_LAYER2, Letter.B, new TurnsTupleKey("(o, 1, 0.5)"));

    @TempDir
    Path tempDir;

    private PrefloatOverrideStore open(Path file) {
        return PrefloatOverrideStore.loadOrCreate(
                new EngineConfig(file, 16, true, Duration.ofSeconds(5), MirrorAxis.VERTICAL));
    }

    @Test
    void missingFileStartsEmpty() {
        PrefloatOverrideStore store = open(tempDir.resolve("overrides.json"));
        assertTrue(store.isEmpty());
        assertTrue(store.entries(SCOPE).isEmpty());
        assertTrue(store.entries(null).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("overrides.json")), "no write before the first change");
    }

    @Test
    void writesSurviveReload() {
        Path file = tempDir.resolve("overrides.json");
        PrefloatOverrideStore store = open(file);
        store.putText(SCOPE, OverrideKeys.prefloatMotionType(Color.BLUE), "pro");
        store.put(OTHER_SCOPE, OverrideKeys.adjustment(Color.RED), IntNode.valueOf(7));

        PrefloatOverrideStore reopened = open(file);
        assertEquals("pro", reopened.getText(SCOPE, OverrideKeys.prefloatMotionType(Color.BLUE)).orElseThrow());
        assertEquals(7, reopened.get(OTHER_SCOPE, OverrideKeys.adjustment(Color.RED)).orElseThrow().asInt());
        assertEquals("pro", reopened.snapshot().path("diamond").path("from_layer1").path("A")
                .path("(s, 0, 0)").path("blue_prefloat_motion_type").asText());
    }

    @Test
    void persistenceKeepsBackupAndChecksum() throws IOException {
        Path file = tempDir.resolve("overrides.json");
        PrefloatOverrideStore store = open(file);
        store.putText(SCOPE, "k", "v1");
        assertFalse(Files.exists(tempDir.resolve("overrides.json.bak")));

        store.putText(SCOPE, "k", "v2");
        assertTrue(Files.exists(tempDir.resolve("overrides.json.bak")));
        assertTrue(Files.exists(tempDir.resolve("overrides.json.bak.xxh")));

        byte[] bytes = Files.readAllBytes(file);
        String checksum = Files.readString(tempDir.resolve("overrides.json.xxh"), StandardCharsets.UTF_8);
        assertTrue(HashingUtil.matches(bytes, checksum));
        assertFalse(Files.exists(tempDir.resolve("overrides.json.tmp")));
    }

    @Test
    void toggleFlipsFlag() {
        PrefloatOverrideStore store = open(tempDir.resolve("overrides.json"));
        String key = OverrideKeys.rotAngleOverride(Color.BLUE);

        assertFalse(store.isEnabled(SCOPE, key));
        assertTrue(store.toggle(SCOPE, key));
        assertTrue(store.isEnabled(SCOPE, key));
        assertFalse(store.toggle(SCOPE, key));
        assertFalse(store.isEnabled(SCOPE, key));
        assertTrue(store.isEmpty(), "empty scopes are pruned");
    }

    @Test
    void removeReportsWhetherEntryExisted() {
        PrefloatOverrideStore store = PrefloatOverrideStore.inMemory();
        store.putText(SCOPE, "k", "v");
        assertTrue(store.remove(SCOPE, "k"));
        assertFalse(store.remove(SCOPE, "k"));
        assertNull(store.file());
    }

    @Test
    void putAllWritesEveryEntry() {
        PrefloatOverrideStore store = PrefloatOverrideStore.inMemory();
        store.putAll(SCOPE, Map.of(
                OverrideKeys.prefloatMotionType(Color.RED), TextNode.valueOf("anti"),
                OverrideKeys.prefloatPropRotDir(Color.RED), TextNode.valueOf("ccw")));
        assertEquals(2, store.entries(SCOPE).size());
    }

    @Test
    void cachedReadsSeeLaterWrites() {
        PrefloatOverrideStore store = PrefloatOverrideStore.inMemory();
        assertTrue(store.getText(SCOPE, "k").isEmpty());
        store.putText(SCOPE, "k", "v");
        assertEquals("v", store.getText(SCOPE, "k").orElseThrow());
        store.putText(SCOPE, "k", "w");
        assertEquals("w", store.getText(SCOPE, "k").orElseThrow());
    }

    @Test
    void everyWriteAdvancesTheGeneration() {
        PrefloatOverrideStore store = PrefloatOverrideStore.inMemory();
        long start = store.generation();
        store.entries(SCOPE);
        store.entries(OTHER_SCOPE);
        assertEquals(start, store.generation(), "reads leave the generation alone");

        store.putText(SCOPE, "k", "v");
        store.toggle(OTHER_SCOPE, "flag");
        assertEquals(start + 2, store.generation());
        assertEquals("v", store.getText(SCOPE, "k").orElseThrow());
        assertTrue(store.isEnabled(OTHER_SCOPE, "flag"));
    }

    @Test
    void entriesAreReadOnlyCopies() {
        PrefloatOverrideStore store = PrefloatOverrideStore.inMemory();
        store.putText(SCOPE, "k", "v");
        Map<String, ?> entries = store.entries(SCOPE);
        assertThrows(UnsupportedOperationException.class, () -> entries.clear());
    }

    @Test
    void listenersAreNotifiedPerKey() {
        PrefloatOverrideStore store = PrefloatOverrideStore.inMemory();
        List<String> seen = new ArrayList<>();
        OverrideChangeListener listener = (scope, key) -> seen.add(scope.letter().symbol() + ":" + key);
        store.addListener(listener);

        store.putText(SCOPE, "k", "v");
        store.toggle(OTHER_SCOPE, "flag");
        assertEquals(List.of("A:k", "B:flag"), seen);

        store.removeListener(listener);
        store.putText(SCOPE, "k2", "v");
        assertEquals(2, seen.size());
    }

    @Test
    void corruptJsonReinitializesEmpty() throws IOException {
        Path file = tempDir.resolve("overrides.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

        PrefloatOverrideStore store = open(file);
        assertTrue(store.isEmpty());
        store.putText(SCOPE, "k", "v");
        assertEquals("v", open(file).getText(SCOPE, "k").orElseThrow());
    }

    @Test
    void wrongShapeReinitializesEmpty() throws IOException {
        Path file = tempDir.resolve("overrides.json");
        Files.writeString(file, "{\"diamond\": {\"from_layer1\": 5}}", StandardCharsets.UTF_8);
        assertTrue(open(file).isEmpty());
    }

    @Test
    void checksumMismatchFallsBackToBackup() throws IOException {
        Path file = tempDir.resolve("overrides.json");
        PrefloatOverrideStore store = open(file);
        store.putText(SCOPE, "k", "first");
        store.putText(SCOPE, "k", "second");

        Files.writeString(file, "{\"diamond\": {}}", StandardCharsets.UTF_8);

        PrefloatOverrideStore recovered = open(file);
        assertEquals("first", recovered.getText(SCOPE, "k").orElseThrow());
    }

    @Test
    void checksumCanBeDisabled() throws IOException {
        Path file = tempDir.resolve("overrides.json");
        open(file).putText(SCOPE, "k", "v");
        Files.writeString(tempDir.resolve("overrides.json.xxh"), "0000000000000000", StandardCharsets.UTF_8);

        PrefloatOverrideStore unchecked = PrefloatOverrideStore.loadOrCreate(
                new EngineConfig(file, 16, false, Duration.ofSeconds(5), MirrorAxis.VERTICAL));
        assertEquals("v", unchecked.getText(SCOPE, "k").orElseThrow());
    }
}
