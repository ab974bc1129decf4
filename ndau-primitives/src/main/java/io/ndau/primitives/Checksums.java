// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.primitives;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Short checksums used by the address and HD key encodings.
 *
 * <p>{@link #checksum16(byte[])} is CRC-16/AUG-CCITT: polynomial {@code 0x1021}, initial
 * value {@code 0x1D0F}, no reflection and no final xor, written big-endian.
 *
 * @since 0.1.0
 */
public final class Checksums {

    private static final int CRC16_INIT = 0x1D0F;
    private static final int[] CRC16_TABLE = new int[256];

    static {
        for (int i = 0; i < 256; i++) {
            int crc = i << 8;
            for (int bit = 0; bit < 8; bit++) {
                crc = (crc & 0x8000) != 0 ? (crc << 1) ^ 0x1021 : crc << 1;
            }
            CRC16_TABLE[i] = crc & 0xFFFF;
        }
    }

    private Checksums() {
        // Utility class
    }

    /**
     * Computes the 2-byte CRC of {@code data}.
     *
     * @param data the bytes to checksum
     * @return the CRC, most significant byte first
     * @throws IllegalArgumentException if {@code data} is {@code null}
     */
    public static byte[] checksum16(final byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        int crc = CRC16_INIT;
        for (final byte b : data) {
            crc = ((crc << 8) ^ CRC16_TABLE[((crc >>> 8) ^ b) & 0xFF]) & 0xFFFF;
        }
        return new byte[] { (byte) (crc >>> 8), (byte) crc };
    }

    /**
     * Returns whether {@code checksum} is the 2-byte CRC of {@code data}.
     *
     * @param data     the checksummed bytes
     * @param checksum the expected CRC
     * @return {@code true} on a match
     */
    public static boolean check16(final byte[] data, final byte[] checksum) {
        if (checksum == null || checksum.length != 2) {
            return false;
        }
        return MessageDigest.isEqual(checksum16(data), checksum);
    }

    /**
     * Returns the first 3 bytes of the SHA-256 hash of {@code data}.
     *
     * @param data the bytes to checksum
     * @return 3 bytes
     * @throws IllegalArgumentException if {@code data} is {@code null}
     */
    public static byte[] checksum24(final byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        return Arrays.copyOf(sha256(data), 3);
    }

    private static byte[] sha256(final byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    }
}
