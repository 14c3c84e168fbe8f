/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.storage;

import ai.evacortex.ramanujan.core.sharding.CoefficientDomain;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private static final ThreadLocal<MessageDigest> MD5_DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("MD5 algorithm not available", e);
        }
    });

    private HashingUtil() {}

    public static byte[] md5(String input) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();
        return digest.digest(input.getBytes(StandardCharsets.US_ASCII));
    }

    public static String md5Hex(String input) {
        return HexFormat.of().formatHex(md5(input));
    }

    /**
     * Fingerprint of the domain's axis ranges. Two domains with the same shape share it,
     * any narrower sub-domain gets its own.
     */
    public static String domainIdentity(CoefficientDomain domain) {
        return md5Hex(domain.describeRanges());
    }

    /** 64-bit content key of a coefficient pair, stable across runs. */
    public static long pairKey(long[] an, long[] bn) {
        ByteBuffer buffer = ByteBuffer.allocate((an.length + bn.length) * Long.BYTES + 2 * Integer.BYTES);
        buffer.putInt(an.length);
        for (long v : an) buffer.putLong(v);
        buffer.putInt(bn.length);
        for (long v : bn) buffer.putLong(v);
        byte[] bytes = buffer.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }
}
