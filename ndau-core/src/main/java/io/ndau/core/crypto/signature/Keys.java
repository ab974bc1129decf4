// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import io.ndau.core.error.KeyException;

/**
 * Entry points for generating, parsing and pairing keys whose role or algorithm is not
 * known in advance.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Keys.KeyPair pair = Keys.generate(Ed25519Algorithm.INSTANCE, new SecureRandom());
 * String text = pair.privateKey().marshalText();
 *
 * Key parsed = Keys.parse(text);          // a PrivateKey
 * assert Keys.match(pair.publicKey(), (PrivateKey) parsed);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Keys {

    private static final int MATCH_MESSAGE_SIZE = 64;

    private Keys() {
        // Utility class
    }

    /**
     * Generates a keypair.
     *
     * @param algorithm the algorithm
     * @param random    source of key material
     * @return the keypair
     * @throws KeyException with kind UNSUPPORTED_OPERATION for the null algorithm
     */
    public static KeyPair generate(final Algorithm algorithm, final SecureRandom random) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(random, "random cannot be null");

        final Algorithm.KeyPairBytes raw = algorithm.generate(random);
        try {
            return new KeyPair(
                    PublicKey.raw(algorithm, raw.publicKey()),
                    PrivateKey.raw(algorithm, raw.privateKey()));
        } finally {
            Arrays.fill(raw.privateKey(), (byte) 0);
        }
    }

    public static Key parse(final String text) {
        return parse(text, AlgorithmRegistry.defaultRegistry());
    }

    /**
     * Decodes the text form of a key of either role.
     *
     * @param text     text starting with {@value PublicKey#PREFIX} or {@value PrivateKey#PREFIX}
     * @param registry registry resolving the algorithm id
     * @return a {@link PublicKey} or a {@link PrivateKey}
     * @throws KeyException with kind PARSE_FAILURE if neither prefix matches, or as
     *                      {@link PublicKey#parse(String)} and {@link PrivateKey#parse(String)}
     */
    public static Key parse(final String text, final AlgorithmRegistry registry) {
        Objects.requireNonNull(text, "text cannot be null");
        if (text.startsWith(PublicKey.PREFIX)) {
            return PublicKey.parse(text, registry);
        }
        if (text.startsWith(PrivateKey.PREFIX)) {
            return PrivateKey.parse(text, registry);
        }
        throw KeyException.parseFailure(
                "key text must start with \"" + PublicKey.PREFIX + "\" or \"" + PrivateKey.PREFIX + "\"");
    }

    /**
     * Returns whether {@code text} looks like a public key. Only the prefix is checked.
     *
     * @param text candidate text
     * @return {@code true} if it starts with {@value PublicKey#PREFIX}
     */
    public static boolean maybePublic(final String text) {
        return text != null && text.startsWith(PublicKey.PREFIX);
    }

    /**
     * Returns whether {@code text} looks like a private key. Only the prefix is checked.
     *
     * @param text candidate text
     * @return {@code true} if it starts with {@value PrivateKey#PREFIX}
     */
    public static boolean maybePrivate(final String text) {
        return text != null && text.startsWith(PrivateKey.PREFIX);
    }

    public static boolean match(final PublicKey publicKey, final PrivateKey privateKey) {
        return match(publicKey, privateKey, new SecureRandom());
    }

    /**
     * Checks that two keys belong together by signing random bytes with {@code privateKey}
     * and verifying them with {@code publicKey}.
     *
     * @param publicKey  the public key
     * @param privateKey the private key
     * @param random     source of the test message
     * @return {@code true} if the signature verifies
     */
    public static boolean match(final PublicKey publicKey, final PrivateKey privateKey, final SecureRandom random) {
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        Objects.requireNonNull(privateKey, "privateKey cannot be null");
        Objects.requireNonNull(random, "random cannot be null");

        final byte[] message = new byte[MATCH_MESSAGE_SIZE];
        random.nextBytes(message);
        return publicKey.verify(message, privateKey.sign(message));
    }

    /**
     * A public key and its private key.
     *
     * @param publicKey  the public key
     * @param privateKey the private key
     */
    public record KeyPair(PublicKey publicKey, PrivateKey privateKey) {

        public KeyPair {
            Objects.requireNonNull(publicKey, "publicKey cannot be null");
            Objects.requireNonNull(privateKey, "privateKey cannot be null");
        }
    }
}
