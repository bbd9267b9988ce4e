/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.storage;

import net.jpountz.xxhash.XXHashFactory;

import java.util.HexFormat;

public final class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private HashingUtil() {}

    public static long xxHash64(byte[] bytes) {
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    /** 16 lowercase hex chars. */
    public static String xxHash64Hex(byte[] bytes) {
        return HexFormat.of().toHexDigits(xxHash64(bytes));
    }

    public static boolean matches(byte[] bytes, String expectedHex) {
        return expectedHex != null && xxHash64Hex(bytes).equalsIgnoreCase(expectedHex.trim());
    }
}
