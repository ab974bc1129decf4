// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.hd;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import io.ndau.core.crypto.Secp256k1Curve;
import io.ndau.core.crypto.Sha256;
import io.ndau.core.error.KeyException;
import io.ndau.primitives.B32;

/**
 * Reads extended keys written in the serialization used before October 2018.
 *
 * <p>
 * The base32 text decodes to 80 bytes:
 *
 * <pre>
 * version(3) ‖ depth(1) ‖ parentFingerprint(3) ‖ childIndex(4) ‖ chainCode(32) ‖ keyData(33) ‖ checksum(4)
 * </pre>
 *
 * <p>
 * The checksum is the first four bytes of the double SHA-256 of the preceding 76 bytes. Key
 * data starting with {@code 0x00} holds a private scalar in the remaining 32 bytes; anything
 * else is a compressed public point. The version bytes are not checked.
 */
final class LegacyKeyDecoder {

    /** Length of the legacy text form. */
    static final int ENCODED_LENGTH = 128;

    private static final int PAYLOAD_LENGTH = 3 + 1 + 3 + 4 + 32 + 33;
    private static final int CHECKSUM_LENGTH = 4;

    private LegacyKeyDecoder() {
        // Utility class
    }

    /**
     * Decodes a legacy extended key.
     *
     * @param text base32 text
     * @return the key, which marshals to the current text form
     * @throws KeyException with kind PARSE_FAILURE for text outside the alphabet or an invalid
     *                      public point, INVALID_LENGTH for a payload of the wrong size,
     *                      BAD_CHECKSUM, or UNUSABLE_VALUE for a private scalar outside
     *                      {@code [1, n)}
     */
    static ExtendedKey decode(final String text) {
        Objects.requireNonNull(text, "text cannot be null");

        final byte[] decoded;
        try {
            decoded = B32.decode(text);
        } catch (IllegalArgumentException e) {
            throw KeyException.parseFailure("invalid legacy key encoding", e);
        }
        if (decoded.length != PAYLOAD_LENGTH + CHECKSUM_LENGTH) {
            throw KeyException.invalidLength("legacy extended key",
                    String.valueOf(PAYLOAD_LENGTH + CHECKSUM_LENGTH), decoded.length);
        }

        final byte[] payload = Arrays.copyOfRange(decoded, 0, PAYLOAD_LENGTH);
        final byte[] checksum = Arrays.copyOfRange(decoded, PAYLOAD_LENGTH, decoded.length);
        final byte[] expected = Arrays.copyOf(Sha256.doubleHash(payload), CHECKSUM_LENGTH);
        if (!Arrays.equals(checksum, expected)) {
            throw KeyException.badChecksum("legacy extended key");
        }

        final int depth = payload[3] & 0xFF;
        final byte[] parentFingerprint = Arrays.copyOfRange(payload, 4, 7);
        final int childNumber = ((payload[7] & 0xFF) << 24)
                | ((payload[8] & 0xFF) << 16)
                | ((payload[9] & 0xFF) << 8)
                | (payload[10] & 0xFF);
        final byte[] chainCode = Arrays.copyOfRange(payload, 11, 43);
        final byte[] keyData = Arrays.copyOfRange(payload, 43, 76);

        try {
            final boolean isPrivate = keyData[0] == 0x00;
            final byte[] key;
            if (isPrivate) {
                key = Arrays.copyOfRange(keyData, 1, keyData.length);
                if (!Secp256k1Curve.isValidScalar(new BigInteger(1, key))) {
                    Arrays.fill(key, (byte) 0);
                    throw KeyException.unusableValue("legacy private key is outside the curve order");
                }
            } else {
                key = keyData.clone();
                try {
                    Secp256k1Curve.decodePoint(key);
                } catch (IllegalArgumentException e) {
                    throw KeyException.parseFailure("legacy public key is not a curve point", e);
                }
            }
            final ExtendedKey result = new ExtendedKey(key, chainCode, parentFingerprint, depth, childNumber, isPrivate);
            Arrays.fill(key, (byte) 0);
            return result;
        } finally {
            Arrays.fill(decoded, (byte) 0);
            Arrays.fill(payload, (byte) 0);
            Arrays.fill(keyData, (byte) 0);
            Arrays.fill(chainCode, (byte) 0);
        }
    }
}
