// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import org.bouncycastle.util.encoders.Hex;
import org.bouncycastle.util.test.FixedSecureRandom;
import org.junit.jupiter.api.Test;

import io.ndau.core.crypto.Secp256k1Curve;
import io.ndau.core.crypto.hd.ExtendedKey;
import io.ndau.core.error.KeyException;
import io.ndau.core.error.NdauException;

/**
 * Tests for deterministic secp256k1 ECDSA.
 */
class Secp256k1AlgorithmTest {

    private static final Secp256k1Algorithm SECP = Secp256k1Algorithm.INSTANCE;

    private static final byte[] ONE = Secp256k1Curve.toBytes32(BigInteger.ONE);

    @Test
    void testSizes() {
        assertEquals("secp256k1", SECP.name());
        assertEquals(33, SECP.publicKeySize());
        assertEquals(32, SECP.privateKeySize());
        assertEquals(Algorithm.UNBOUNDED, SECP.signatureSize());
    }

    @Test
    void testRfc6979Signature() {
        // private key 1, "Satoshi Nakamoto", widely used RFC 6979 vector
        final byte[] signature = SECP.sign(ONE, "Satoshi Nakamoto".getBytes(StandardCharsets.UTF_8));

        assertEquals("3045022100934b1ea10a4b3c1757e2b0c017d0b6143ce3c9a7e6a4a49860d7a6ab210ee3d8"
                + "02202442ce9d2b916064108014783e923ec36b49743e2ffa1c4496f01a512aafd9e5",
                Hex.toHexString(signature));
    }

    @Test
    void testSignaturesAreLowS() {
        // the raw s of this vector is above n/2
        final byte[] signature = SECP.sign(ONE, ("All those moments will be lost in time, like tears in rain. "
                + "Time to die...").getBytes(StandardCharsets.UTF_8));

        assertEquals("30450221008600dbd41e348fe5c9465ab92d23e3db8b98b873beecd930736488696438cb6b"
                + "0220547fe64427496db33bf66019dacbf0039c04199abb0122918601db38a72cfc21",
                Hex.toHexString(signature));
    }

    @Test
    void testSignIsDeterministic() {
        final byte[] message = "deterministic".getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(SECP.sign(ONE, message), SECP.sign(ONE, message));
    }

    @Test
    void testDerivePublicOfOneIsGenerator() {
        assertEquals("0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798",
                Hex.toHexString(SECP.derivePublic(ONE)));
    }

    @Test
    void testSignVerifyRoundTrip() {
        final byte[] message = "transfer 10 ndau".getBytes(StandardCharsets.UTF_8);
        final byte[] publicKey = SECP.derivePublic(ONE);
        final byte[] signature = SECP.sign(ONE, message);

        assertTrue(SECP.verify(publicKey, message, signature));

        message[0] ^= 0x01;
        assertFalse(SECP.verify(publicKey, message, signature));
    }

    @Test
    void testVerifyNeverThrowsOnMalformedInput() {
        final byte[] publicKey = SECP.derivePublic(ONE);

        assertFalse(SECP.verify(publicKey, new byte[0], new byte[] {0x30, 0x02, 0x01}));
        assertFalse(SECP.verify(publicKey, new byte[0], new byte[70]));
        assertFalse(SECP.verify(new byte[33], new byte[0], SECP.sign(ONE, new byte[0])));
        assertFalse(SECP.verify(null, new byte[0], new byte[0]));
    }

    @Test
    void testGenerateMatchesHdMaster() {
        final byte[] seed = new byte[32];
        for (int i = 0; i < seed.length; i++) {
            seed[i] = (byte) i;
        }

        final Algorithm.KeyPairBytes pair = SECP.generate(new FixedSecureRandom(seed));
        final ExtendedKey master = ExtendedKey.newMaster(seed);

        assertArrayEquals(master.privateKeyBytes(), pair.privateKey());
        assertArrayEquals(master.publicKeyBytes(), pair.publicKey());
    }

    @Test
    void testSignRejectsOutOfRangeScalar() {
        final KeyException zero = assertThrows(KeyException.class, () -> SECP.sign(new byte[32], new byte[0]));
        assertEquals(NdauException.Kind.UNUSABLE_VALUE, zero.kind());

        final KeyException size = assertThrows(KeyException.class, () -> SECP.sign(new byte[31], new byte[0]));
        assertEquals(NdauException.Kind.INVALID_LENGTH, size.kind());
    }
}
