// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import io.ndau.core.error.KeyException;

/**
 * Ed25519 (RFC 8032) signatures.
 *
 * <p>A private key is the 32-byte seed followed by the 32-byte public key. Signing is
 * deterministic, and generation reads exactly 32 bytes from the supplied randomness, so
 * identical random bytes always produce the identical keypair.
 *
 * @since 0.1.0
 */
public final class Ed25519Algorithm implements Algorithm {

    public static final Ed25519Algorithm INSTANCE = new Ed25519Algorithm();

    private static final int SEED_SIZE = Ed25519PrivateKeyParameters.KEY_SIZE;
    private static final int PUBLIC_SIZE = Ed25519PublicKeyParameters.KEY_SIZE;

    private Ed25519Algorithm() {
    }

    @Override
    public String name() {
        return "ed25519";
    }

    @Override
    public int publicKeySize() {
        return PUBLIC_SIZE;
    }

    @Override
    public int privateKeySize() {
        return SEED_SIZE + PUBLIC_SIZE;
    }

    @Override
    public int signatureSize() {
        return Ed25519PrivateKeyParameters.SIGNATURE_SIZE;
    }

    @Override
    public KeyPairBytes generate(final SecureRandom random) {
        Objects.requireNonNull(random, "random cannot be null");

        final byte[] seed = new byte[SEED_SIZE];
        random.nextBytes(seed);
        try {
            final byte[] publicKey = new Ed25519PrivateKeyParameters(seed, 0).generatePublicKey().getEncoded();
            final byte[] privateKey = new byte[SEED_SIZE + PUBLIC_SIZE];
            System.arraycopy(seed, 0, privateKey, 0, SEED_SIZE);
            System.arraycopy(publicKey, 0, privateKey, SEED_SIZE, PUBLIC_SIZE);
            return new KeyPairBytes(publicKey, privateKey);
        } finally {
            Arrays.fill(seed, (byte) 0);
        }
    }

    @Override
    public byte[] sign(final byte[] privateKey, final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        final Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateParameters(privateKey));
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    @Override
    public boolean verify(final byte[] publicKey, final byte[] message, final byte[] signature) {
        if (publicKey == null || publicKey.length != PUBLIC_SIZE
                || signature == null || signature.length != signatureSize()
                || message == null) {
            return false;
        }
        final Ed25519PublicKeyParameters parameters;
        try {
            parameters = new Ed25519PublicKeyParameters(publicKey, 0);
        } catch (IllegalArgumentException e) {
            // not a curve point
            return false;
        }
        final Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, parameters);
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }

    @Override
    public byte[] derivePublic(final byte[] privateKey) {
        checkPrivateKey(privateKey);
        return Arrays.copyOfRange(privateKey, SEED_SIZE, SEED_SIZE + PUBLIC_SIZE);
    }

    private Ed25519PrivateKeyParameters privateParameters(final byte[] privateKey) {
        checkPrivateKey(privateKey);
        return new Ed25519PrivateKeyParameters(privateKey, 0);
    }

    private void checkPrivateKey(final byte[] privateKey) {
        Objects.requireNonNull(privateKey, "privateKey cannot be null");
        if (privateKey.length != privateKeySize()) {
            throw KeyException.invalidLength("ed25519 private key", String.valueOf(privateKeySize()), privateKey.length);
        }
    }

    @Override
    public String toString() {
        return name();
    }
}
