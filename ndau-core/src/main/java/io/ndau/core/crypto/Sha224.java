// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto;

import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.SHA224;

/**
 * SHA-224 hashing utility, the source of key and signature text checksums.
 *
 * <p>
 * Like {@link Sha256}, digests are cached per thread; call {@link #cleanup()}
 * from pooled threads.
 *
 * @since 0.1.0
 */
public final class Sha224 {

    private static final ThreadLocal<SHA224.Digest> DIGEST = ThreadLocal.withInitial(SHA224.Digest::new);

    private Sha224() {
        // Utility class
    }

    /**
     * Computes the SHA-224 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 28-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final SHA224.Digest digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
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
