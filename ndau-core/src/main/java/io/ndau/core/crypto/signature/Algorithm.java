// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.security.SecureRandom;

/**
 * A signature algorithm: key sizes, key generation, signing and verification over raw bytes.
 *
 * <p>Implementations are stateless and thread-safe. They are identified on the wire by the
 * small integer id an {@link AlgorithmRegistry} binds them to, and across registries by
 * {@link #name()}.
 *
 * @since 0.1.0
 */
public interface Algorithm {

    /** Size reported by algorithms whose signatures vary in length. */
    int UNBOUNDED = -1;

    /**
     * Returns the stable name of this algorithm.
     *
     * @return the name, e.g. {@code "ed25519"}
     */
    String name();

    /**
     * Returns the size of a public key in bytes.
     *
     * @return the size
     */
    int publicKeySize();

    /**
     * Returns the size of a private key in bytes.
     *
     * @return the size
     */
    int privateKeySize();

    /**
     * Returns the size of a signature in bytes.
     *
     * @return the size, or {@link #UNBOUNDED} if signatures vary in length
     */
    int signatureSize();

    /**
     * Generates a keypair from the supplied randomness.
     *
     * @param random source of key material
     * @return the raw public and private key bytes
     * @throws io.ndau.core.error.KeyException if this algorithm cannot generate keys
     */
    KeyPairBytes generate(SecureRandom random);

    /**
     * Signs a message.
     *
     * @param privateKey raw private key
     * @param message    the message
     * @return raw signature bytes
     */
    byte[] sign(byte[] privateKey, byte[] message);

    /**
     * Verifies a signature. Never throws on malformed keys or signatures.
     *
     * @param publicKey raw public key
     * @param message   the message
     * @param signature raw signature bytes
     * @return {@code true} if the signature is valid
     */
    boolean verify(byte[] publicKey, byte[] message, byte[] signature);

    /**
     * Derives the public key belonging to a private key.
     *
     * @param privateKey raw private key
     * @return raw public key
     */
    byte[] derivePublic(byte[] privateKey);

    /**
     * Raw output of {@link Algorithm#generate(SecureRandom)}.
     *
     * @param publicKey  raw public key
     * @param privateKey raw private key
     */
    record KeyPairBytes(byte[] publicKey, byte[] privateKey) {
    }
}
