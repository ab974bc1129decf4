// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 hashing utility.
 *
 * <p>
 * Used for address payloads, HD fingerprints, legacy key checksums and the
 * secp256k1 message pre-hash.
 *
 * <h2>ThreadLocal Memory Management</h2>
 *
 * <p>
 * Digest instances are cached per thread. In thread pool environments, call
 * {@link #cleanup()} when a pooled thread is returned or the application is
 * redeployed.
 *
 * @since 0.1.0
 */
public final class Sha256 {

    private static final String ALGORITHM = "SHA-256";

    private static final ThreadLocal<MessageDigest> DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    });

    private Sha256() {
        // Utility class
    }

    /**
     * Computes the SHA-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final MessageDigest digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes {@code SHA-256(SHA-256(input))}.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] doubleHash(final byte[] input) {
        return hash(hash(input));
    }

    /**
     * Removes the cached digest instance from the current thread.
     *
     * @see ThreadLocal#remove()
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
