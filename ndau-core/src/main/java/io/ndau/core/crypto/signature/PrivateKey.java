// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.util.Arrays;
import java.util.Objects;

/**
 * A private key. Its text form starts with {@value #PREFIX}.
 *
 * <p>
 * {@link #toString()} shows only 12 characters of the text form. Call {@link #zeroize()}
 * once the key is no longer needed.
 *
 * @since 0.1.0
 */
public final class PrivateKey extends Key {

    /** Text prefix of private keys. */
    public static final String PREFIX = "npvt";

    private PrivateKey(final Algorithm algorithm, final byte[] key, final byte[] extra) {
        super(algorithm, key, extra);
    }

    /**
     * Creates a private key from raw bytes.
     *
     * @param algorithm the algorithm
     * @param key       raw key, exactly {@link Algorithm#privateKeySize()} bytes
     * @param extra     extra bytes, or {@code null} for none
     * @return the key
     * @throws io.ndau.core.error.KeyException with kind INVALID_LENGTH on a size mismatch
     */
    public static PrivateKey raw(final Algorithm algorithm, final byte[] key, final byte[] extra) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        checkSize("private key", algorithm.privateKeySize(), key);
        return new PrivateKey(algorithm, key, extra);
    }

    public static PrivateKey raw(final Algorithm algorithm, final byte[] key) {
        return raw(algorithm, key, null);
    }

    public static PrivateKey unmarshal(final byte[] serialized) {
        return unmarshal(serialized, AlgorithmRegistry.defaultRegistry());
    }

    /**
     * Decodes marshaled bytes and checks the key size against the algorithm.
     *
     * @param serialized output of {@link #marshal()}
     * @param registry   registry resolving the algorithm id
     * @return the key
     * @throws io.ndau.core.error.KeyException with kind PARSE_FAILURE, UNKNOWN_ALGORITHM or
     *                                         INVALID_LENGTH
     */
    public static PrivateKey unmarshal(final byte[] serialized, final AlgorithmRegistry registry) {
        final Decoded decoded = decode(serialized, registry);
        try {
            return raw(decoded.algorithm(), decoded.key(), decoded.extra());
        } finally {
            Arrays.fill(decoded.key(), (byte) 0);
        }
    }

    public static PrivateKey parse(final String text) {
        return parse(text, AlgorithmRegistry.defaultRegistry());
    }

    /**
     * Decodes the text form.
     *
     * @param text     output of {@link #marshalText()}
     * @param registry registry resolving the algorithm id
     * @return the key
     * @throws io.ndau.core.error.KeyException with kind PARSE_FAILURE, BAD_CHECKSUM,
     *                                         UNKNOWN_ALGORITHM or INVALID_LENGTH
     */
    public static PrivateKey parse(final String text, final AlgorithmRegistry registry) {
        final byte[] serialized = TextCodec.decode(PREFIX, text);
        try {
            return unmarshal(serialized, registry);
        } finally {
            Arrays.fill(serialized, (byte) 0);
        }
    }

    @Override
    public String prefix() {
        return PREFIX;
    }

    @Override
    public PrivateKey truncate() {
        return new PrivateKey(algorithm(), keyBytes(), null);
    }

    /**
     * Signs a message.
     *
     * @param message the message
     * @return the signature
     */
    public Signature sign(final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        final byte[] key = keyBytes();
        try {
            return Signature.raw(algorithm(), algorithm().sign(key, message));
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * Derives the matching public key. Extra bytes are carried over unchanged.
     *
     * @return the public key
     */
    public PublicKey toPublic() {
        final byte[] key = keyBytes();
        try {
            return PublicKey.raw(algorithm(), algorithm().derivePublic(key), extraBytes());
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }
}
