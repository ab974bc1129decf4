// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.util.Objects;

/**
 * A public key. Its text form starts with {@value #PREFIX}.
 *
 * @since 0.1.0
 */
public final class PublicKey extends Key {

    /** Text prefix of public keys. */
    public static final String PREFIX = "npub";

    private PublicKey(final Algorithm algorithm, final byte[] key, final byte[] extra) {
        super(algorithm, key, extra);
    }

    /**
     * Creates a public key from raw bytes.
     *
     * @param algorithm the algorithm
     * @param key       raw key, exactly {@link Algorithm#publicKeySize()} bytes
     * @param extra     extra bytes, or {@code null} for none
     * @return the key
     * @throws io.ndau.core.error.KeyException with kind INVALID_LENGTH on a size mismatch
     */
    public static PublicKey raw(final Algorithm algorithm, final byte[] key, final byte[] extra) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        checkSize("public key", algorithm.publicKeySize(), key);
        return new PublicKey(algorithm, key, extra);
    }

    public static PublicKey raw(final Algorithm algorithm, final byte[] key) {
        return raw(algorithm, key, null);
    }

    public static PublicKey unmarshal(final byte[] serialized) {
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
    public static PublicKey unmarshal(final byte[] serialized, final AlgorithmRegistry registry) {
        final Decoded decoded = decode(serialized, registry);
        return raw(decoded.algorithm(), decoded.key(), decoded.extra());
    }

    public static PublicKey parse(final String text) {
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
    public static PublicKey parse(final String text, final AlgorithmRegistry registry) {
        return unmarshal(TextCodec.decode(PREFIX, text), registry);
    }

    @Override
    public String prefix() {
        return PREFIX;
    }

    @Override
    public PublicKey truncate() {
        return new PublicKey(algorithm(), keyBytes(), null);
    }

    /**
     * Verifies a signature over {@code message}.
     *
     * @param message   the signed message
     * @param signature the signature
     * @return {@code false} if the signature is invalid or uses a different algorithm
     */
    public boolean verify(final byte[] message, final Signature signature) {
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        if (!AlgorithmRegistry.sameAlgorithm(algorithm(), signature.algorithm())) {
            return false;
        }
        return algorithm().verify(keyBytes(), message, signature.bytes());
    }
}
