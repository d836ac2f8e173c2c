/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core.util;

import net.jpountz.xxhash.XXHashFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final int SEED = 0x9747b28c;

    private static final ThreadLocal<MessageDigest> MD5_DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("MD5 algorithm not available", e);
        }
    });

    private HashingUtil() {
    }

    public static byte[] md5(String input) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();
        return digest.digest(input.getBytes(StandardCharsets.UTF_8));
    }

    /** 32-character lowercase hex MD5 of the UTF-8 bytes of {@code input}. */
    public static String md5Hex(String input) {
        return HexFormat.of().formatHex(md5(input));
    }

    public static long xxHash64(byte[] bytes) {
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    public static long xxHash64(String input) {
        return xxHash64(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String toHex(long value) {
        return HexFormat.of().toHexDigits(value);
    }
}
