// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.security.SecureRandom;

import io.ndau.core.error.KeyException;

/**
 * The empty algorithm: zero-length keys and signatures, nothing ever verifies.
 *
 * <p>Always bound to id 0. Zeroized keys carry this algorithm.
 *
 * @since 0.1.0
 */
public final class NullAlgorithm implements Algorithm {

    public static final NullAlgorithm INSTANCE = new NullAlgorithm();

    private static final byte[] EMPTY = new byte[0];

    private NullAlgorithm() {
    }

    @Override
    public String name() {
        return "null";
    }

    @Override
    public int publicKeySize() {
        return 0;
    }

    @Override
    public int privateKeySize() {
        return 0;
    }

    @Override
    public int signatureSize() {
        return 0;
    }

    @Override
    public KeyPairBytes generate(final SecureRandom random) {
        throw KeyException.unsupported("generating null keys is not permitted");
    }

    @Override
    public byte[] sign(final byte[] privateKey, final byte[] message) {
        return EMPTY.clone();
    }

    @Override
    public boolean verify(final byte[] publicKey, final byte[] message, final byte[] signature) {
        return false;
    }

    @Override
    public byte[] derivePublic(final byte[] privateKey) {
        return EMPTY.clone();
    }

    @Override
    public String toString() {
        return name();
    }
}
