// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.address;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import io.ndau.core.DebugLogger;
import io.ndau.core.crypto.Sha256;
import io.ndau.core.crypto.signature.PublicKey;
import io.ndau.core.error.AddressException;
import io.ndau.primitives.B32;
import io.ndau.primitives.Checksums;

/**
 * A 48-character ndau account address.
 *
 * <p>
 * An address is derived from the raw bytes of a public key, without the algorithm tag or
 * any extra bytes: the last {@value #HASH_TRIM} bytes of their
 * SHA-256, behind a two-byte header and followed by a CRC-16, written in the ndau base32
 * alphabet. The header is chosen so that the text starts with the network prefix
 * ({@code nd} on the main net) and the {@link AddressKind} letter.
 *
 * <pre>
 * header(2) ‖ sha256(data)[6..32](26) ‖ crc16(2)  = 30 bytes = 48 characters
 * </pre>
 *
 * <p>
 * Instances only come out of the {@code generate} methods and
 * {@link #validate(String)}, so holding one means the text has passed validation.
 *
 * <h2>Network Prefix</h2>
 *
 * <p>
 * {@link #validate(String)} does not look at the first two characters, since networks
 * differ in them. Callers that care about the network compare {@link #networkPrefix()}
 * themselves.
 *
 * @since 0.1.0
 */
public final class Address {

    /** Prefix of main net addresses. */
    public static final String MAIN_NET_PREFIX = "nd";

    /** Prefix of test net addresses. */
    public static final String TEST_NET_PREFIX = "tn";

    /** Number of trailing hash bytes kept. */
    public static final int HASH_TRIM = 26;

    /** Length of an address in characters. */
    public static final int LENGTH = 48;

    /** Smallest input accepted by {@link #generate(AddressKind, byte[])}. */
    public static final int MIN_DATA_LENGTH = 12;

    private static final int KIND_OFFSET = MAIN_NET_PREFIX.length();

    private final String text;

    private Address(final String text) {
        this.text = text;
    }

    /**
     * Generates the main net address of a public key.
     *
     * @param kind      the account kind
     * @param publicKey the key; only its {@link PublicKey#keyBytes() key bytes} are hashed
     * @return the address
     */
    public static Address generate(final AddressKind kind, final PublicKey publicKey) {
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        return generate(MAIN_NET_PREFIX, kind, publicKey.keyBytes());
    }

    /**
     * Generates the main net address of {@code data}, normally the raw bytes of a public key
     * as returned by {@link PublicKey#keyBytes()}.
     *
     * @param kind the account kind
     * @param data at least {@value #MIN_DATA_LENGTH} bytes
     * @return the address
     * @throws AddressException with kind INVALID_LENGTH if {@code data} is too short
     */
    public static Address generate(final AddressKind kind, final byte[] data) {
        return generate(MAIN_NET_PREFIX, kind, data);
    }

    /**
     * Generates an address with the given network prefix.
     *
     * @param networkPrefix two characters of the ndau base32 alphabet, such as
     *                      {@value #MAIN_NET_PREFIX} or {@value #TEST_NET_PREFIX}
     * @param kind          the account kind
     * @param data          at least {@value #MIN_DATA_LENGTH} bytes
     * @return the address
     * @throws AddressException with kind PARSE_FAILURE for a bad prefix, or INVALID_LENGTH
     *                          if {@code data} is too short
     */
    public static Address generate(final String networkPrefix, final AddressKind kind, final byte[] data) {
        Objects.requireNonNull(networkPrefix, "networkPrefix cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(data, "data cannot be null");

        final String prefix = networkPrefix.toLowerCase(Locale.ROOT);
        if (prefix.length() != KIND_OFFSET || B32.index(prefix.charAt(0)) < 0 || B32.index(prefix.charAt(1)) < 0) {
            throw AddressException.invalidPrefix(networkPrefix);
        }
        if (data.length < MIN_DATA_LENGTH) {
            throw AddressException.invalidLength(
                    "address data must be at least " + MIN_DATA_LENGTH + " bytes, got " + data.length);
        }

        final byte[] hash = Sha256.hash(data);
        final int header = (B32.index(prefix.charAt(0)) << 11)
                | (B32.index(prefix.charAt(1)) << 6)
                | (B32.index(kind.letter()) << 1);

        final byte[] body = new byte[2 + HASH_TRIM];
        body[0] = (byte) (header >>> 8);
        body[1] = (byte) header;
        System.arraycopy(hash, hash.length - HASH_TRIM, body, 2, HASH_TRIM);

        final byte[] crc = Checksums.checksum16(body);
        final byte[] full = Arrays.copyOf(body, body.length + crc.length);
        System.arraycopy(crc, 0, full, body.length, crc.length);

        final Address address = new Address(B32.encode(full));
        DebugLogger.logAddress("[ADDRESS] generated %s kind=%s", address, kind);
        return address;
    }

    /**
     * Checks an address and returns it in lower case.
     *
     * <p>
     * The length, the kind letter, the alphabet and the CRC are checked; the network prefix
     * is not.
     *
     * @param text the address, in either case
     * @return the address
     * @throws AddressException with kind INVALID_LENGTH, PARSE_FAILURE or BAD_CHECKSUM
     */
    public static Address validate(final String text) {
        Objects.requireNonNull(text, "text cannot be null");

        final String lower = text.toLowerCase(Locale.ROOT);
        if (lower.length() != LENGTH) {
            throw AddressException.invalidLength(
                    "address must be " + LENGTH + " characters, got " + lower.length());
        }
        AddressKind.fromLetter(lower.charAt(KIND_OFFSET));

        final byte[] decoded;
        try {
            decoded = B32.decode(lower);
        } catch (IllegalArgumentException e) {
            throw AddressException.undecodable(e);
        }
        final byte[] body = Arrays.copyOf(decoded, decoded.length - 2);
        final byte[] crc = Arrays.copyOfRange(decoded, decoded.length - 2, decoded.length);
        if (!Checksums.check16(body, crc)) {
            DebugLogger.logAddress("[ADDRESS] checksum failure for %s", lower);
            throw AddressException.badChecksum();
        }
        return new Address(lower);
    }

    /**
     * Validates this address again.
     *
     * @throws AddressException as {@link #validate(String)}
     */
    public void revalidate() {
        validate(text);
    }

    public AddressKind kind() {
        return AddressKind.fromLetter(text.charAt(KIND_OFFSET));
    }

    /**
     * Returns the first two characters, such as {@value #MAIN_NET_PREFIX}.
     *
     * @return the network prefix
     */
    public String networkPrefix() {
        return text.substring(0, KIND_OFFSET);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Address other)) {
            return false;
        }
        return text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    /**
     * Returns the address text.
     */
    @Override
    public String toString() {
        return text;
    }
}
