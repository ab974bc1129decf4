// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Objects;

import io.ndau.core.error.KeyException;

/**
 * Variable-width checksum framing for key and signature text.
 *
 * <p>A framed buffer is {@code [width] ++ payload ++ checksum}, where {@code checksum} is the
 * last {@code width} bytes of SHA-224 over the payload and {@code width} is the smallest value
 * of at least 3 that makes the framed length a multiple of 5. Multiples of 5 bytes encode to
 * base32 with no partial group.
 *
 * @since 0.1.0
 */
public final class TextChecksum {

    private static final int MIN_WIDTH = 3;
    private static final int MAX_WIDTH = 28;

    private TextChecksum() {
        // Utility class
    }

    /**
     * Returns the checksum width used for a payload of the given size.
     *
     * @param payloadLength payload size in bytes
     * @return width in bytes, between 3 and 7
     */
    public static int width(final int payloadLength) {
        int fill = 5 - (payloadLength + 1) % 5;
        if (fill < MIN_WIDTH) {
            fill += 5;
        }
        return fill;
    }

    /**
     * Frames {@code payload} with its checksum.
     *
     * @param payload the bytes to protect
     * @return the framed buffer
     */
    public static byte[] add(final byte[] payload) {
        Objects.requireNonNull(payload, "payload cannot be null");

        final int width = width(payload.length);
        final byte[] hash = Sha224.hash(payload);
        final byte[] out = new byte[1 + payload.length + width];
        out[0] = (byte) width;
        System.arraycopy(payload, 0, out, 1, payload.length);
        System.arraycopy(hash, hash.length - width, out, 1 + payload.length, width);
        return out;
    }

    /**
     * Verifies a framed buffer and returns its payload.
     *
     * @param framed a buffer produced by {@link #add(byte[])}
     * @return the payload
     * @throws KeyException with kind BAD_CHECKSUM if the buffer is malformed or its checksum does not match
     */
    public static byte[] check(final byte[] framed) {
        Objects.requireNonNull(framed, "framed cannot be null");

        if (framed.length < 1 + MIN_WIDTH) {
            throw KeyException.badChecksum("checksummed data too short");
        }
        final int width = framed[0] & 0xFF;
        if (width < MIN_WIDTH || width > MAX_WIDTH || width > framed.length - 1) {
            throw KeyException.badChecksum("checksum width " + width + " out of range");
        }
        final byte[] payload = Arrays.copyOfRange(framed, 1, framed.length - width);
        final byte[] hash = Sha224.hash(payload);
        final byte[] expected = Arrays.copyOfRange(hash, hash.length - width, hash.length);
        final byte[] actual = Arrays.copyOfRange(framed, framed.length - width, framed.length);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw KeyException.badChecksum("checksummed data");
        }
        return payload;
    }
}
