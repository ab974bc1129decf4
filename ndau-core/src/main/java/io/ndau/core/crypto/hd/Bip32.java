// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.hd;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import io.ndau.core.crypto.Secp256k1Curve;
import io.ndau.core.error.KeyException;

/**
 * Seed handling and master key generation for ndau HD keys.
 *
 * <p>
 * This follows BIP-32 except for the HMAC key of the master step, which is
 * {@code "ndau seed"} instead of {@code "Bitcoin seed"}. Trees built from the same
 * seed by a Bitcoin wallet therefore differ from ndau trees.
 *
 * @see <a href="https://github.com/bitcoin/bips/blob/master/bip-0032.mediawiki">BIP-32</a>
 * @see ExtendedKey
 */
public final class Bip32 {

    /** Smallest accepted seed, in bytes. */
    public static final int MIN_SEED_LENGTH = 16;

    /** Largest accepted seed, in bytes. */
    public static final int MAX_SEED_LENGTH = 64;

    /** Seed length used when generating keys. */
    public static final int RECOMMENDED_SEED_LENGTH = 32;

    /** First hardened child index, {@code 2^31}. Negative as a Java {@code int}. */
    public static final int HARDENED_KEY_START = 0x80000000;

    /** Deepest level a key may sit at. */
    public static final int MAX_DEPTH = 255;

    private static final byte[] MASTER_KEY = "ndau seed".getBytes(StandardCharsets.UTF_8);

    private Bip32() {
        // Utility class
    }

    /**
     * Draws a seed from {@code random}.
     *
     * @param length seed length, between {@link #MIN_SEED_LENGTH} and {@link #MAX_SEED_LENGTH}
     * @param random the entropy source
     * @return a fresh seed
     * @throws KeyException with kind INVALID_LENGTH if {@code length} is out of range
     */
    public static byte[] generateSeed(final int length, final SecureRandom random) {
        Objects.requireNonNull(random, "random cannot be null");
        checkSeedLength(length);

        final byte[] seed = new byte[length];
        random.nextBytes(seed);
        return seed;
    }

    /**
     * Computes the master private scalar and chain code of a seed.
     *
     * @param seed between 16 and 64 bytes
     * @return the master key material
     * @throws KeyException with kind INVALID_LENGTH for a bad seed length, or
     *                      UNUSABLE_VALUE if the seed yields no valid scalar
     */
    public static Master newMaster(final byte[] seed) {
        Objects.requireNonNull(seed, "seed cannot be null");
        checkSeedLength(seed.length);

        final byte[] hmacResult = hmacSha512(MASTER_KEY, seed);
        final byte[] key = Arrays.copyOfRange(hmacResult, 0, 32);
        final byte[] chainCode = Arrays.copyOfRange(hmacResult, 32, 64);
        Arrays.fill(hmacResult, (byte) 0);

        if (!Secp256k1Curve.isValidScalar(new BigInteger(1, key))) {
            Arrays.fill(key, (byte) 0);
            Arrays.fill(chainCode, (byte) 0);
            throw KeyException.unusableSeed();
        }
        return new Master(key, chainCode);
    }

    /**
     * Derives the compressed public key of a private scalar.
     *
     * @param privateKey 32-byte scalar
     * @return 33-byte compressed point
     */
    public static byte[] privateToPublic(final byte[] privateKey) {
        Objects.requireNonNull(privateKey, "privateKey cannot be null");
        return Secp256k1Curve.publicKeyOf(privateKey);
    }

    /**
     * Computes HMAC-SHA512.
     */
    static byte[] hmacSha512(final byte[] key, final byte[] data) {
        final HMac hmac = new HMac(new SHA512Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(data, 0, data.length);
        final byte[] result = new byte[64];
        hmac.doFinal(result, 0);
        return result;
    }

    private static void checkSeedLength(final int length) {
        if (length < MIN_SEED_LENGTH || length > MAX_SEED_LENGTH) {
            throw KeyException.invalidLength("seed", MIN_SEED_LENGTH + "-" + MAX_SEED_LENGTH, length);
        }
    }

    /**
     * Master key material. The arrays are not copied; the caller owns them and should
     * clear them once consumed.
     *
     * @param key       32-byte private scalar
     * @param chainCode 32-byte chain code
     */
    public record Master(byte[] key, byte[] chainCode) {
    }
}
