// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * secp256k1 domain parameters and the scalar/point conversions shared by signing,
 * HD derivation and legacy key import.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Stateless. The shared {@link FixedPointCombMultiplier} keeps its precomputation on the
 * curve, where Bouncy Castle guards it for concurrent use.
 *
 * @since 0.1.0
 */
public final class Secp256k1Curve {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    /** Domain parameters. */
    public static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());

    /** Group order {@code n}. */
    public static final BigInteger ORDER = CURVE.getN();

    /** {@code n / 2}, the largest low-S value. */
    public static final BigInteger HALF_ORDER = ORDER.shiftRight(1);

    /** Size of a private scalar. */
    public static final int SCALAR_SIZE = 32;

    /** Size of a compressed point. */
    public static final int COMPRESSED_POINT_SIZE = 33;

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private Secp256k1Curve() {
        // Utility class
    }

    /**
     * Returns whether {@code value} lies in {@code [1, n)}.
     *
     * @param value the candidate scalar
     * @return {@code true} if it is a usable private key
     */
    public static boolean isValidScalar(final BigInteger value) {
        return value.signum() > 0 && value.compareTo(ORDER) < 0;
    }

    /**
     * Computes {@code scalar * G}.
     *
     * @param scalar the multiplier
     * @return the normalized point
     */
    public static ECPoint multiplyG(final BigInteger scalar) {
        return MULTIPLIER.multiply(CURVE.getG(), scalar).normalize();
    }

    /**
     * Derives the compressed public key of a private scalar.
     *
     * @param privateKey 32-byte big-endian scalar
     * @return 33-byte compressed point
     */
    public static byte[] publicKeyOf(final byte[] privateKey) {
        return multiplyG(new BigInteger(1, privateKey)).getEncoded(true);
    }

    /**
     * Decodes a SEC1-encoded point and checks that it lies on the curve.
     *
     * @param encoded compressed or uncompressed point
     * @return the point
     * @throws IllegalArgumentException if the bytes do not encode a curve point
     */
    public static ECPoint decodePoint(final byte[] encoded) {
        final ECPoint point = CURVE.getCurve().decodePoint(encoded);
        if (point.isInfinity() || !point.isValid()) {
            throw new IllegalArgumentException("point is not on secp256k1");
        }
        return point;
    }

    /**
     * Converts a non-negative value below {@code 2^256} to exactly 32 big-endian bytes,
     * restoring leading zeros that {@link BigInteger#toByteArray()} drops.
     *
     * @param value the value
     * @return 32 bytes
     */
    public static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length == SCALAR_SIZE) {
            return bytes;
        }
        final byte[] result = new byte[SCALAR_SIZE];
        if (bytes.length < SCALAR_SIZE) {
            System.arraycopy(bytes, 0, result, SCALAR_SIZE - bytes.length, bytes.length);
        } else {
            // Drop the sign byte
            System.arraycopy(bytes, bytes.length - SCALAR_SIZE, result, 0, SCALAR_SIZE);
        }
        return result;
    }
}
