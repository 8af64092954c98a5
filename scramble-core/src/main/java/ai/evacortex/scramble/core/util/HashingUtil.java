/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.util;

import ai.evacortex.scramble.core.Frame;
import ai.evacortex.scramble.core.Signal;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final int SEED = 0x9747b28c;

    private static final ThreadLocal<MessageDigest> MD5_DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("MD5 algorithm not available", e);
        }
    });

    private HashingUtil() {}

    /**
     * MD5 hex of the signal's shape and samples; identifies the source of a stored scramble.
     * The digest is fed one sample row at a time.
     */
    public static String computeContentHash(Signal signal) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();

        digest.update(ByteBuffer.allocate(8)
                .putInt(signal.samples())
                .putInt(signal.channels())
                .array());
        ByteBuffer row = ByteBuffer.allocate(signal.channels() * Double.BYTES);
        for (double[] sample : signal.data()) {
            updateRow(digest, row, sample);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String computeContentHash(Frame frame) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();

        digest.update(ByteBuffer.allocate(12)
                .putInt(frame.planeCount())
                .putInt(frame.rows())
                .putInt(frame.cols())
                .array());
        ByteBuffer row = ByteBuffer.allocate(frame.cols() * Double.BYTES);
        for (double[][] plane : frame.planes()) {
            for (double[] pixels : plane) {
                updateRow(digest, row, pixels);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void updateRow(MessageDigest digest, ByteBuffer row, double[] values) {
        row.clear();
        for (double v : values) {
            row.putDouble(v);
        }
        digest.update(row.array(), 0, row.position());
    }

    public static byte[] parseAndValidateMd5(String hex) {
        byte[] bytes = HexFormat.of().parseHex(hex);
        if (bytes.length != 16) throw new IllegalArgumentException("Invalid MD5 hex length");
        return bytes;
    }

    /**
     * xxHash64 of the raw IEEE-754 bits of {@code values}.
     */
    public static long checksum(double[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 8);
        for (double v : values) {
            buffer.putDouble(v);
        }
        byte[] bytes = buffer.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }
}
