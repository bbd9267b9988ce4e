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
import ai.evacortex.kinetic.core.exceptions.OverrideStoreCorruptException;
import ai.evacortex.kinetic.core.storage.HashingUtil;
import ai.evacortex.kinetic.core.storage.util.AutoLock;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Persisted table of manual placement and prefloat overrides, shaped
 * {@code [grid][orientation category][letter][turns tuple] -> {key: value}}.
 *
 * <p>Reads may come from any thread and are served from a bounded per-scope cache.
 * Every write runs mutate, persist, invalidate and notify inside one write-locked section,
 * so no reader observes a half-applied change. Cached scopes carry the write generation
 * they were read at; a scope cached before the latest write is read again. Persistence writes a temp file, keeps the
 * previous file as {@code .bak}, moves the new file into place and records an xxHash64
 * checksum next to it.</p>
 *
 * <p>A file that fails to parse or fails its checksum is never fatal: the store falls back
 * to the backup copy and, failing that, starts empty.</p>
 */
public class PrefloatOverrideStore {

    private static final Logger log = LoggerFactory.getLogger(PrefloatOverrideStore.class);

    private static final String BACKUP_SUFFIX = ".bak";
    private static final String CHECKSUM_SUFFIX = ".xxh";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final int SCOPE_DEPTH = 4;

    private final Path file;
    private final boolean checksumEnabled;
    private final Duration writeLockTimeout;
    private final ObjectMapper mapper;
    private final ReadWriteLock rwLock;
    private final ObjectNode root;
    private final AtomicLong generation;
    private final LoadingCache<OverrideScope, ScopeSnapshot> scopeCache;
    private final List<OverrideChangeListener> listeners;

    private PrefloatOverrideStore(Path file, EngineConfig config) {
        this.file = file;
        this.checksumEnabled = config.checksumEnabled();
        this.writeLockTimeout = config.writeLockTimeout();
        this.mapper = new ObjectMapper();
        this.rwLock = new ReentrantReadWriteLock();
        this.root = mapper.createObjectNode();
        this.listeners = new CopyOnWriteArrayList<>();
        this.generation = new AtomicLong();
        this.scopeCache = Caffeine.newBuilder()
                .maximumSize(config.overrideCacheSize())
                .build(this::loadScope);
    }

    public static PrefloatOverrideStore loadOrCreate(Path path) {
        return loadOrCreate(EngineConfig.fromSystemProperties().withOverridesPath(path));
    }

    public static PrefloatOverrideStore loadOrCreate(EngineConfig config) {
        Path path = config.overridesPath().toAbsolutePath();
        PrefloatOverrideStore store = new PrefloatOverrideStore(path, config);
        ObjectNode loaded = store.recover(path);
        if (loaded != null) {
            store.root.setAll(loaded);
        }
        log.info("Loaded override store {} ({} grid sections)", path, store.root.size());
        return store;
    }

    /** Store without a backing file; writes stay in memory. */
    public static PrefloatOverrideStore inMemory() {
        return new PrefloatOverrideStore(null, EngineConfig.fromSystemProperties());
    }

    private ObjectNode recover(Path path) {
        if (!Files.exists(path)) {
            return null;
        }
        try {
            return readValidated(path);
        } catch (OverrideStoreCorruptException e) {
            log.warn("Discarding override store {}: {}", path, e.getMessage());
        }
        Path backup = sibling(path, BACKUP_SUFFIX);
        if (Files.exists(backup)) {
            try {
                ObjectNode restored = readValidated(backup);
                log.warn("Recovered override store from backup {}", backup);
                return restored;
            } catch (OverrideStoreCorruptException e) {
                log.warn("Discarding override store backup {}: {}", backup, e.getMessage());
            }
        }
        log.warn("Override store {} reinitialized empty", path);
        return null;
    }

    private ObjectNode readValidated(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read override store " + path, e);
        }
        if (checksumEnabled) {
            Path checksumFile = sibling(path, CHECKSUM_SUFFIX);
            if (Files.exists(checksumFile)) {
                String expected;
                try {
                    expected = Files.readString(checksumFile, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read checksum " + checksumFile, e);
                }
                if (!HashingUtil.matches(bytes, expected)) {
                    throw new OverrideStoreCorruptException("checksum mismatch for " + path.getFileName());
                }
            }
        }
        JsonNode tree;
        try {
            tree = mapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new OverrideStoreCorruptException("unparseable JSON in " + path.getFileName(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse override store " + path, e);
        }
        if (tree == null || tree.isMissingNode()) {
            return mapper.createObjectNode();
        }
        if (!tree.isObject()) {
            throw new OverrideStoreCorruptException("root is not an object");
        }
        validateDepth(tree, 0, "$");
        return (ObjectNode) tree;
    }

    private static void validateDepth(JsonNode node, int depth, String at) {
        if (depth == SCOPE_DEPTH) return;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = at + "." + field.getKey();
            if (!field.getValue().isObject()) {
                throw new OverrideStoreCorruptException("expected object at " + path);
            }
            validateDepth(field.getValue(), depth + 1, path);
        }
    }

    // ---- reads ----

    /** All entries under a scope; empty for a {@code null} scope. */
    public Map<String, JsonNode> entries(OverrideScope scope) {
        if (scope == null) return Map.of();
        ScopeSnapshot cached = scopeCache.get(scope);
        if (cached.generation() == generation.get()) {
            return cached.entries();
        }
        ScopeSnapshot fresh = loadScope(scope);
        scopeCache.asMap().replace(scope, cached, fresh);
        return fresh.entries();
    }

    long generation() {
        return generation.get();
    }

    public Optional<JsonNode> get(OverrideScope scope, String key) {
        return Optional.ofNullable(entries(scope).get(key));
    }

    public Optional<String> getText(OverrideScope scope, String key) {
        return get(scope, key).filter(JsonNode::isTextual).map(JsonNode::asText);
    }

    public boolean isEnabled(OverrideScope scope, String key) {
        return get(scope, key).map(JsonNode::asBoolean).orElse(false);
    }

    public boolean isEmpty() {
        try (AutoLock ignored = AutoLock.read(rwLock)) {
            return root.isEmpty();
        }
    }

    public ObjectNode snapshot() {
        try (AutoLock ignored = AutoLock.read(rwLock)) {
            return root.deepCopy();
        }
    }

    public Path file() {
        return file;
    }

    private ScopeSnapshot loadScope(OverrideScope scope) {
        try (AutoLock ignored = AutoLock.read(rwLock)) {
            long readAt = generation.get();
            JsonNode leaf = root.path(scope.grid().wireName())
                    .path(scope.category().key())
                    .path(scope.letter().symbol())
                    .path(scope.turns().value());
            if (!leaf.isObject()) return new ScopeSnapshot(readAt, Map.of());
            Map<String, JsonNode> copy = new LinkedHashMap<>();
            leaf.fields().forEachRemaining(e -> copy.put(e.getKey(), e.getValue().deepCopy()));
            return new ScopeSnapshot(readAt, Collections.unmodifiableMap(copy));
        }
    }

    private record ScopeSnapshot(long generation, Map<String, JsonNode> entries) {}

    // ---- writes ----

    public void put(OverrideScope scope, String key, JsonNode value) {
        Objects.requireNonNull(value, "value");
        mutate(scope, key, leaf -> leaf.set(key, value.deepCopy()));
    }

    public void putText(OverrideScope scope, String key, String value) {
        put(scope, key, TextNode.valueOf(value));
    }

    /** Writes several entries under one scope in a single persisted change. */
    public void putAll(OverrideScope scope, Map<String, JsonNode> values) {
        Map<String, JsonNode> copy = new LinkedHashMap<>(values);
        mutate(scope, copy.keySet(), leaf -> copy.forEach((k, v) -> leaf.set(k, v.deepCopy())));
    }

    public boolean remove(OverrideScope scope, String key) {
        boolean[] removed = new boolean[1];
        mutate(scope, key, leaf -> removed[0] = leaf.remove(key) != null);
        return removed[0];
    }

    /**
     * Flips a boolean flag: present entries are removed, absent ones are set to {@code true}.
     *
     * @return the flag's new state
     */
    public boolean toggle(OverrideScope scope, String key) {
        boolean[] enabled = new boolean[1];
        mutate(scope, key, leaf -> {
            if (leaf.has(key)) {
                leaf.remove(key);
                enabled[0] = false;
            } else {
                leaf.set(key, BooleanNode.TRUE);
                enabled[0] = true;
            }
        });
        return enabled[0];
    }

    public void addListener(OverrideChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(OverrideChangeListener listener) {
        listeners.remove(listener);
    }

    /** Rewrites the backing file from the in-memory table. */
    public void flush() {
        try (AutoLock ignored = AutoLock.tryWrite(rwLock, writeLockTimeout)) {
            persist();
        }
    }

    private void mutate(OverrideScope scope, String key, Consumer<ObjectNode> change) {
        mutate(scope, List.of(Objects.requireNonNull(key, "key")), change);
    }

    private void mutate(OverrideScope scope, Collection<String> keys, Consumer<ObjectNode> change) {
        Objects.requireNonNull(scope, "scope");
        try (AutoLock ignored = AutoLock.tryWrite(rwLock, writeLockTimeout)) {
            ObjectNode before = root.deepCopy();
            try {
                change.accept(leafFor(scope));
                prune(root, 0);
                persist();
            } catch (UncheckedIOException e) {
                root.removeAll();
                root.setAll(before);
                throw e;
            }
            generation.incrementAndGet();
            scopeCache.invalidateAll();
            log.debug("Overrides {} changed under {}", keys, scope);
            for (String key : keys) {
                for (OverrideChangeListener listener : listeners) {
                    listener.onOverrideChanged(scope, key);
                }
            }
        }
    }

    private ObjectNode leafFor(OverrideScope scope) {
        ObjectNode node = root;
        for (String part : List.of(scope.grid().wireName(), scope.category().key(),
                scope.letter().symbol(), scope.turns().value())) {
            JsonNode child = node.get(part);
            node = child instanceof ObjectNode existing ? existing : node.putObject(part);
        }
        return node;
    }

    private static void prune(ObjectNode node, int depth) {
        if (depth == SCOPE_DEPTH) return;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            JsonNode child = fields.next().getValue();
            if (child instanceof ObjectNode object) {
                prune(object, depth + 1);
                if (object.isEmpty()) fields.remove();
            }
        }
    }

    private void persist() {
        if (file == null) return;
        try {
            Files.createDirectories(file.getParent());
            byte[] bytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);

            Path tmp = sibling(file, TEMP_SUFFIX);
            Files.write(tmp, bytes);

            Path checksumFile = sibling(file, CHECKSUM_SUFFIX);
            if (Files.exists(file)) {
                Files.copy(file, sibling(file, BACKUP_SUFFIX), StandardCopyOption.REPLACE_EXISTING);
                if (Files.exists(checksumFile)) {
                    Files.copy(checksumFile, sibling(sibling(file, BACKUP_SUFFIX), CHECKSUM_SUFFIX),
                            StandardCopyOption.REPLACE_EXISTING);
                }
            }
            moveIntoPlace(tmp, file);

            if (checksumEnabled) {
                Path tmpChecksum = sibling(checksumFile, TEMP_SUFFIX);
                Files.writeString(tmpChecksum, HashingUtil.xxHash64Hex(bytes), StandardCharsets.UTF_8);
                moveIntoPlace(tmpChecksum, checksumFile);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist override store " + file, e);
        }
    }

    private static void moveIntoPlace(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Path sibling(Path path, String suffix) {
        return path.resolveSibling(path.getFileName().toString() + suffix);
    }
}
