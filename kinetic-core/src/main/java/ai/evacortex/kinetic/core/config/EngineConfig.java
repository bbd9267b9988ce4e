/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.config;

import ai.evacortex.kinetic.core.geometry.MirrorAxis;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Engine settings, read from {@code kinetic.*} system properties.
 */
public record EngineConfig(Path overridesPath,
                           int overrideCacheSize,
                           boolean checksumEnabled,
                           Duration writeLockTimeout,
                           MirrorAxis mirrorAxis) {

    public static final String OVERRIDES_PATH = "kinetic.overrides.path";
    public static final String OVERRIDES_CACHE_SIZE = "kinetic.overrides.cacheSize";
    public static final String OVERRIDES_CHECKSUM = "kinetic.overrides.checksum";
    public static final String OVERRIDES_LOCK_TIMEOUT_MS = "kinetic.overrides.lockTimeoutMs";
    public static final String CAP_MIRROR_AXIS = "kinetic.cap.mirrorAxis";

    public EngineConfig {
        if (overrideCacheSize <= 0) {
            throw new IllegalArgumentException("overrideCacheSize must be positive");
        }
    }

    public static EngineConfig fromSystemProperties() {
        return new EngineConfig(
                Path.of(System.getProperty(OVERRIDES_PATH, "overrides/special_placements.json")),
                Integer.parseInt(System.getProperty(OVERRIDES_CACHE_SIZE, "512")),
                Boolean.parseBoolean(System.getProperty(OVERRIDES_CHECKSUM, "true")),
                Duration.ofMillis(Long.parseLong(System.getProperty(OVERRIDES_LOCK_TIMEOUT_MS, "5000"))),
                MirrorAxis.fromWire(System.getProperty(CAP_MIRROR_AXIS, "vertical")));
    }

    public EngineConfig withOverridesPath(Path path) {
        return new EngineConfig(path, overrideCacheSize, checksumEnabled, writeLockTimeout, mirrorAxis);
    }
}
