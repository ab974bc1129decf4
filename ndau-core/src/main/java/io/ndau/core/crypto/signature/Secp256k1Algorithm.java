// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;

import io.ndau.core.crypto.Secp256k1Curve;
import io.ndau.core.crypto.Sha256;
import io.ndau.core.crypto.hd.Bip32;
import io.ndau.core.error.KeyException;

/**
 * ECDSA over secp256k1.
 *
 * <p>
 * Public keys are 33-byte compressed points and private keys 32-byte scalars. Messages
 * are hashed with SHA-256 before signing. Signatures are deterministic
 * (<a href="https://tools.ietf.org/html/rfc6979">RFC 6979</a>), normalized to low S,
 * and DER encoded, so their length varies and {@link #signatureSize()} is
 * {@link Algorithm#UNBOUNDED}.
 *
 * <p>
 * Keys are generated through the HD seed routine: a seed of
 * {@link Bip32#RECOMMENDED_SEED_LENGTH} bytes is drawn from the supplied randomness
 * and the keypair is the master key of that seed.
 *
 * @since 0.1.0
 */
public final class Secp256k1Algorithm implements Algorithm {

    public static final Secp256k1Algorithm INSTANCE = new Secp256k1Algorithm();

    private Secp256k1Algorithm() {
    }

    @Override
    public String name() {
        return "secp256k1";
    }

    @Override
    public int publicKeySize() {
        return Secp256k1Curve.COMPRESSED_POINT_SIZE;
    }

    @Override
    public int privateKeySize() {
        return Secp256k1Curve.SCALAR_SIZE;
    }

    @Override
    public int signatureSize() {
        return UNBOUNDED;
    }

    @Override
    public KeyPairBytes generate(final SecureRandom random) {
        final byte[] seed = Bip32.generateSeed(Bip32.RECOMMENDED_SEED_LENGTH, random);
        try {
            final Bip32.Master master = Bip32.newMaster(seed);
            Arrays.fill(master.chainCode(), (byte) 0);
            return new KeyPairBytes(Bip32.privateToPublic(master.key()), master.key());
        } finally {
            Arrays.fill(seed, (byte) 0);
        }
    }

    @Override
    public byte[] sign(final byte[] privateKey, final byte[] message) {
        Objects.requireNonNull(message, "message cannot be null");
        checkPrivateKey(privateKey);

        final BigInteger d = new BigInteger(1, privateKey);
        if (!Secp256k1Curve.isValidScalar(d)) {
            throw KeyException.unusableValue("secp256k1 private key out of range");
        }

        final byte[] hash = Sha256.hash(message);
        final BigInteger n = Secp256k1Curve.ORDER;
        final BigInteger z = new BigInteger(1, hash);

        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(n, d, hash);

        BigInteger r;
        BigInteger s;
        do {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = Secp256k1Curve.multiplyG(k);

            // r = x1 mod n, s = k^-1 * (z + r * d) mod n
            r = p.getAffineXCoord().toBigInteger().mod(n);
            s = k.modInverse(n).multiply(z.add(r.multiply(d))).mod(n);
        } while (r.signum() == 0 || s.signum() == 0);

        // (r, s) and (r, n - s) both verify; emit the low one
        if (s.compareTo(Secp256k1Curve.HALF_ORDER) > 0) {
            s = n.subtract(s);
        }

        try {
            return new DERSequence(new ASN1Integer[] { new ASN1Integer(r), new ASN1Integer(s) })
                    .getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new IllegalStateException("DER encoding of an in-memory signature failed", e);
        }
    }

    @Override
    public boolean verify(final byte[] publicKey, final byte[] message, final byte[] signature) {
        if (publicKey == null || message == null || signature == null) {
            return false;
        }

        final ECPoint point;
        final BigInteger r;
        final BigInteger s;
        try {
            point = Secp256k1Curve.decodePoint(publicKey);
            final ASN1Sequence sequence = ASN1Sequence.getInstance(ASN1Primitive.fromByteArray(signature));
            if (sequence.size() != 2) {
                return false;
            }
            r = ASN1Integer.getInstance(sequence.getObjectAt(0)).getPositiveValue();
            s = ASN1Integer.getInstance(sequence.getObjectAt(1)).getPositiveValue();
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            // unparsable key or signature
            return false;
        }

        final ECDSASigner verifier = new ECDSASigner();
        verifier.init(false, new ECPublicKeyParameters(point, Secp256k1Curve.CURVE));
        return verifier.verifySignature(Sha256.hash(message), r, s);
    }

    @Override
    public byte[] derivePublic(final byte[] privateKey) {
        checkPrivateKey(privateKey);
        return Bip32.privateToPublic(privateKey);
    }

    private void checkPrivateKey(final byte[] privateKey) {
        Objects.requireNonNull(privateKey, "privateKey cannot be null");
        if (privateKey.length != privateKeySize()) {
            throw KeyException.invalidLength("secp256k1 private key", String.valueOf(privateKeySize()), privateKey.length);
        }
    }

    @Override
    public String toString() {
        return name();
    }
}
