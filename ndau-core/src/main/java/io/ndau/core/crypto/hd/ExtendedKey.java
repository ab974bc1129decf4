// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.hd;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.math.ec.ECPoint;
import org.jspecify.annotations.Nullable;

import io.ndau.core.DebugLogger;
import io.ndau.core.crypto.Secp256k1Curve;
import io.ndau.core.crypto.Sha256;
import io.ndau.core.crypto.signature.AlgorithmRegistry;
import io.ndau.core.crypto.signature.Key;
import io.ndau.core.crypto.signature.Keys;
import io.ndau.core.crypto.signature.PrivateKey;
import io.ndau.core.crypto.signature.PublicKey;
import io.ndau.core.crypto.signature.Secp256k1Algorithm;
import io.ndau.core.error.KeyException;
import io.ndau.primitives.Checksums;

/**
 * A node of an ndau HD key tree.
 *
 * <p>
 * A node is either private, holding a 32-byte secp256k1 scalar, or public, holding a
 * 33-byte compressed point. Both carry a chain code, their depth, the fingerprint of their
 * parent's public key and their own child index. Derivation never changes a node; it
 * returns a new one.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ExtendedKey master = ExtendedKey.newMaster(seed);
 * ExtendedKey account = master.deriveFrom("/", "/44'/20036'/100");
 * ExtendedKey watchOnly = account.toPublic();
 *
 * // the same public child, with or without the private key
 * assert watchOnly.child(7).equals(account.child(7).toPublic());
 * }</pre>
 *
 * <h2>Text Form</h2>
 *
 * <p>
 * {@link #marshalText()} exports the node as a secp256k1 {@link PrivateKey} or
 * {@link PublicKey} whose 40 extra bytes are {@code depth(1) ‖ parentFingerprint(3) ‖
 * childIndex(4, big-endian) ‖ chainCode(32)}.
 *
 * <h2>Invalid Children</h2>
 *
 * <p>
 * With probability below {@code 2^-127} an index yields no valid child. {@link #child(int)}
 * then throws a {@link KeyException} whose {@link KeyException#isRetryable()} is true, and
 * the caller should move on to the next index.
 *
 * @see Bip32
 * @see DerivationPath
 */
public final class ExtendedKey {

    /** Size of the extra bytes carried by the exported signature key. */
    public static final int EXTRA_LENGTH = 1 + 3 + 4 + 32;

    private static final byte[] MASTER_FINGERPRINT = new byte[3];

    private final byte[] key;
    private final byte[] chainCode;
    private final byte[] parentFingerprint;
    private final int depth;
    private final int childNumber;
    private final boolean isPrivate;

    // Public key of a private node, computed on first use.
    private volatile byte @Nullable [] publicKey;

    ExtendedKey(final byte[] key, final byte[] chainCode, final byte[] parentFingerprint,
            final int depth, final int childNumber, final boolean isPrivate) {
        this.key = key.clone();
        this.chainCode = chainCode.clone();
        this.parentFingerprint = parentFingerprint.clone();
        this.depth = depth;
        this.childNumber = childNumber;
        this.isPrivate = isPrivate;
    }

    /**
     * Creates the master node of a seed.
     *
     * @param seed between 16 and 64 bytes of entropy
     * @return private master node at depth 0
     * @throws KeyException with kind INVALID_LENGTH for a bad seed length, or
     *                      UNUSABLE_VALUE if the caller must pick another seed
     */
    public static ExtendedKey newMaster(final byte[] seed) {
        final Bip32.Master master = Bip32.newMaster(seed);
        try {
            return new ExtendedKey(master.key(), master.chainCode(), MASTER_FINGERPRINT, 0, 0, true);
        } finally {
            Arrays.fill(master.key(), (byte) 0);
            Arrays.fill(master.chainCode(), (byte) 0);
        }
    }

    /**
     * Derives the child at {@code index}.
     *
     * <p>
     * Indices are unsigned 32-bit values; those from {@link Bip32#HARDENED_KEY_START} up
     * (negative as a Java {@code int}) are hardened and need a private node. A private node
     * yields a private child and a public node a public child.
     *
     * @param index the child index
     * @return the child
     * @throws KeyException with kind DEPTH_EXCEEDED at depth 255, UNSUPPORTED_OPERATION for a
     *                      hardened index on a public node, or UNUSABLE_VALUE if the index has
     *                      no valid child
     */
    public ExtendedKey child(final int index) {
        if (depth == Bip32.MAX_DEPTH) {
            throw KeyException.depthExceeded();
        }

        // HARDENED_KEY_START sets the sign bit
        final boolean hardened = index < 0;
        if (hardened && !isPrivate) {
            throw KeyException.unsupported("cannot derive a hardened key from a public key");
        }

        // hardened: 0x00 || ser256(k) || ser32(i)
        // normal:   serP(K) || ser32(i)
        final byte[] data = new byte[37];
        if (hardened) {
            System.arraycopy(key, 0, data, 1, 32);
        } else {
            System.arraycopy(publicKeyBytes(), 0, data, 0, 33);
        }
        data[33] = (byte) (index >>> 24);
        data[34] = (byte) (index >>> 16);
        data[35] = (byte) (index >>> 8);
        data[36] = (byte) index;

        final byte[] hmacResult = Bip32.hmacSha512(chainCode, data);
        Arrays.fill(data, (byte) 0);
        final byte[] il = Arrays.copyOfRange(hmacResult, 0, 32);
        final byte[] childChainCode = Arrays.copyOfRange(hmacResult, 32, 64);
        Arrays.fill(hmacResult, (byte) 0);

        final BigInteger ilValue = new BigInteger(1, il);
        Arrays.fill(il, (byte) 0);
        if (!Secp256k1Curve.isValidScalar(ilValue)) {
            throw KeyException.invalidChild(index);
        }

        final byte[] childKey;
        if (isPrivate) {
            final BigInteger childValue = ilValue.add(new BigInteger(1, key)).mod(Secp256k1Curve.ORDER);
            if (childValue.signum() == 0) {
                throw KeyException.invalidChild(index);
            }
            childKey = Secp256k1Curve.toBytes32(childValue);
        } else {
            final ECPoint parentPoint;
            try {
                parentPoint = Secp256k1Curve.decodePoint(key);
            } catch (IllegalArgumentException e) {
                throw KeyException.parseFailure("public extended key is not a curve point", e);
            }
            final ECPoint childPoint = Secp256k1Curve.multiplyG(ilValue).add(parentPoint).normalize();
            if (childPoint.isInfinity()) {
                throw KeyException.invalidChild(index);
            }
            childKey = childPoint.getEncoded(true);
        }

        final byte[] fingerprint = Checksums.checksum24(Sha256.hash(publicKeyBytes()));
        try {
            return new ExtendedKey(childKey, childChainCode, fingerprint, depth + 1, index, isPrivate);
        } finally {
            Arrays.fill(childKey, (byte) 0);
            Arrays.fill(childChainCode, (byte) 0);
        }
    }

    /**
     * Derives the hardened child {@code n}, that is {@code child(n + 2^31)}.
     *
     * @param n the unhardened index; the addition wraps modulo {@code 2^32}
     * @return the child
     * @throws KeyException as {@link #child(int)}
     */
    public ExtendedKey hardenedChild(final int n) {
        return child(n + Bip32.HARDENED_KEY_START);
    }

    /**
     * Walks from this node, known to sit at {@code parentPath}, down to {@code childPath}.
     *
     * <p>
     * The parent path is taken on trust; nothing checks that this node really sits there.
     *
     * @param parentPath the path of this node
     * @param childPath  the path to derive, strictly below {@code parentPath}
     * @return the node at {@code childPath}
     * @throws KeyException with kind PARSE_FAILURE for malformed paths or a child path that is
     *                      not below the parent path, or the first failure of a derivation step
     */
    public ExtendedKey deriveFrom(final String parentPath, final String childPath) {
        final DerivationPath parent = DerivationPath.parse(parentPath);
        final DerivationPath child = DerivationPath.parse(childPath);
        final DerivationPath steps = parent.relativize(child);

        DebugLogger.logKeys("[DERIVE] from=%s to=%s steps=%d", parent, child, steps.size());

        ExtendedKey current = this;
        for (final DerivationPath.Element element : steps.elements()) {
            current = element.hardened()
                    ? current.hardenedChild(element.index())
                    : current.child(element.index());
        }
        return current;
    }

    /**
     * Returns the public node with the same position in the tree.
     *
     * @return this node if it is already public, otherwise a new public node
     */
    public ExtendedKey toPublic() {
        if (!isPrivate) {
            return this;
        }
        return new ExtendedKey(publicKeyBytes(), chainCode, parentFingerprint, depth, childNumber, false);
    }

    /**
     * Returns the compressed public key of this node.
     *
     * @return 33 bytes
     */
    public byte[] publicKeyBytes() {
        if (!isPrivate) {
            return key.clone();
        }
        byte[] cached = publicKey;
        if (cached == null) {
            cached = Bip32.privateToPublic(key);
            publicKey = cached;
        }
        return cached.clone();
    }

    /**
     * Returns the private scalar of this node.
     *
     * @return 32 bytes
     * @throws KeyException with kind UNSUPPORTED_OPERATION for a public node
     */
    public byte[] privateKeyBytes() {
        if (!isPrivate) {
            throw KeyException.unsupported("the key is not a private extended key");
        }
        return key.clone();
    }

    public boolean isPrivate() {
        return isPrivate;
    }

    public int depth() {
        return depth;
    }

    /**
     * Returns the child index of this node, as an unsigned 32-bit value.
     *
     * @return the index
     */
    public int childNumber() {
        return childNumber;
    }

    public byte[] chainCode() {
        return chainCode.clone();
    }

    /**
     * Returns the 3-byte fingerprint of the parent's public key, all zeros for a master node.
     *
     * @return 3 bytes
     */
    public byte[] parentFingerprint() {
        return parentFingerprint.clone();
    }

    /**
     * Exports this node as a secp256k1 key of the same role carrying the HD metadata as
     * extra bytes.
     *
     * @return a {@link PrivateKey} for a private node, a {@link PublicKey} otherwise
     */
    public Key asSignatureKey() {
        final byte[] extra = extra();
        if (isPrivate) {
            return PrivateKey.raw(Secp256k1Algorithm.INSTANCE, key, extra);
        }
        return PublicKey.raw(Secp256k1Algorithm.INSTANCE, key, extra);
    }

    /**
     * Returns the private signing key of this node.
     *
     * @return the key, with HD metadata as extra bytes
     * @throws KeyException with kind UNSUPPORTED_OPERATION for a public node
     */
    public PrivateKey toSigningKey() {
        if (!isPrivate) {
            throw KeyException.unsupported("cannot sign with a public extended key");
        }
        return (PrivateKey) asSignatureKey();
    }

    /**
     * Returns the public verification key of this node.
     *
     * @return the key, with HD metadata as extra bytes
     */
    public PublicKey toVerifyingKey() {
        return (PublicKey) toPublic().asSignatureKey();
    }

    /**
     * Rebuilds a node from a key produced by {@link #asSignatureKey()}.
     *
     * @param signatureKey a secp256k1 key with at least 40 extra bytes
     * @return the node
     * @throws KeyException with kind UNSUPPORTED_OPERATION for another algorithm,
     *                      INVALID_LENGTH if the extra bytes are too short, UNUSABLE_VALUE for a
     *                      private scalar outside {@code [1, n)}, or PARSE_FAILURE for a public
     *                      key that is not a curve point
     */
    public static ExtendedKey fromSignatureKey(final Key signatureKey) {
        Objects.requireNonNull(signatureKey, "signatureKey cannot be null");
        if (!AlgorithmRegistry.sameAlgorithm(signatureKey.algorithm(), Secp256k1Algorithm.INSTANCE)) {
            throw KeyException.unsupported("extended keys must use " + Secp256k1Algorithm.INSTANCE.name()
                    + "; provided key uses " + signatureKey.algorithm().name());
        }

        final byte[] extra = signatureKey.extraBytes();
        if (extra.length < EXTRA_LENGTH) {
            throw KeyException.invalidLength("extended key extra data", "at least " + EXTRA_LENGTH, extra.length);
        }
        final int depth = extra[0] & 0xFF;
        final byte[] parentFingerprint = Arrays.copyOfRange(extra, 1, 4);
        final int childNumber = ((extra[4] & 0xFF) << 24)
                | ((extra[5] & 0xFF) << 16)
                | ((extra[6] & 0xFF) << 8)
                | (extra[7] & 0xFF);
        final byte[] chainCode = Arrays.copyOfRange(extra, 8, 40);
        final byte[] key = signatureKey.keyBytes();
        try {
            if (signatureKey.isPrivate()) {
                if (!Secp256k1Curve.isValidScalar(new BigInteger(1, key))) {
                    throw KeyException.unusableValue("extended private key is outside the curve order");
                }
            } else {
                try {
                    Secp256k1Curve.decodePoint(key);
                } catch (IllegalArgumentException e) {
                    throw KeyException.parseFailure("extended public key is not a curve point", e);
                }
            }
            return new ExtendedKey(key, chainCode, parentFingerprint, depth, childNumber, signatureKey.isPrivate());
        } finally {
            Arrays.fill(key, (byte) 0);
            Arrays.fill(chainCode, (byte) 0);
            Arrays.fill(extra, (byte) 0);
        }
    }

    /**
     * Returns the checksummed text form, starting with {@code npvt} or {@code npub}.
     *
     * @return the text
     */
    public String marshalText() {
        final Key exported = asSignatureKey();
        try {
            return exported.marshalText();
        } finally {
            exported.zeroize();
        }
    }

    /**
     * Parses the text form produced by {@link #marshalText()}.
     *
     * @param text the text
     * @return the node
     * @throws KeyException as {@link Keys#parse(String)} and {@link #fromSignatureKey(Key)}
     */
    public static ExtendedKey parse(final String text) {
        final Key parsed = Keys.parse(text);
        try {
            return fromSignatureKey(parsed);
        } finally {
            parsed.zeroize();
        }
    }

    /**
     * Parses either the current text form or the legacy serialization.
     *
     * @param text the text
     * @return the node
     * @throws KeyException as {@link #parse(String)} when the text is in neither form
     */
    public static ExtendedKey fromString(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        try {
            return parse(text);
        } catch (KeyException e) {
            if (text.length() != LegacyKeyDecoder.ENCODED_LENGTH) {
                throw e;
            }
            final ExtendedKey migrated;
            try {
                migrated = LegacyKeyDecoder.decode(text);
            } catch (KeyException legacyFailure) {
                e.addSuppressed(legacyFailure);
                throw e;
            }
            DebugLogger.logKeys("[MIGRATE] legacy extended key at depth %d", migrated.depth);
            return migrated;
        }
    }

    /**
     * Overwrites the key material of this node. The node must not be used afterwards.
     */
    public void zeroize() {
        Arrays.fill(key, (byte) 0);
        Arrays.fill(chainCode, (byte) 0);
        Arrays.fill(parentFingerprint, (byte) 0);
        final byte[] cached = publicKey;
        if (cached != null) {
            Arrays.fill(cached, (byte) 0);
            publicKey = null;
        }
    }

    private byte[] extra() {
        final byte[] out = new byte[EXTRA_LENGTH];
        out[0] = (byte) depth;
        System.arraycopy(parentFingerprint, 0, out, 1, 3);
        out[4] = (byte) (childNumber >>> 24);
        out[5] = (byte) (childNumber >>> 16);
        out[6] = (byte) (childNumber >>> 8);
        out[7] = (byte) childNumber;
        System.arraycopy(chainCode, 0, out, 8, 32);
        return out;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ExtendedKey other)) {
            return false;
        }
        return isPrivate == other.isPrivate
                && depth == other.depth
                && childNumber == other.childNumber
                && Arrays.equals(key, other.key)
                && Arrays.equals(chainCode, other.chainCode)
                && Arrays.equals(parentFingerprint, other.parentFingerprint);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(chainCode);
        result = 31 * result + depth;
        result = 31 * result + childNumber;
        return result;
    }

    /**
     * Returns the first 8 and last 4 characters of the text form.
     */
    @Override
    public String toString() {
        final String text = marshalText();
        return text.substring(0, 8) + "..." + text.substring(text.length() - 4);
    }
}
