// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import static org.junit.jupiter.api.Assertions.*;

import java.util.function.Function;

import org.bouncycastle.util.encoders.Hex;
import org.bouncycastle.util.test.FixedSecureRandom;
import org.junit.jupiter.api.Test;

import io.ndau.core.error.KeyException;
import io.ndau.core.error.NdauException;
import io.ndau.primitives.container.Container;
import io.ndau.primitives.container.IdentifiedData;

class KeyTest {

    private static final byte[] EXTRA = {9, 8, 7, 6, 5};

    @Test
    void testPackLayout() {
        final PublicKey key = PublicKey.raw(Ed25519Algorithm.INSTANCE, new byte[32], new byte[] {1, 2});
        final byte[] packed = key.pack();

        assertEquals(35, packed.length);
        assertEquals(32, packed[0]);
        assertEquals(1, packed[33]);
        assertEquals(2, packed[34]);

        final Key.Unpacked unpacked = Key.unpack(packed);
        assertArrayEquals(new byte[32], unpacked.key());
        assertArrayEquals(new byte[] {1, 2}, unpacked.extra());
    }

    @Test
    void testUnpackRejectsOverrun() {
        final KeyException empty = assertThrows(KeyException.class, () -> Key.unpack(new byte[0]));
        assertEquals(NdauException.Kind.INVALID_LENGTH, empty.kind());

        final KeyException overrun = assertThrows(KeyException.class, () -> Key.unpack(new byte[] {5, 1, 2}));
        assertEquals(NdauException.Kind.INVALID_LENGTH, overrun.kind());
    }

    @Test
    void testMarshalIsTaggedContainer() {
        final PublicKey key = PublicKey.raw(Ed25519Algorithm.INSTANCE, new byte[32]);
        final IdentifiedData data = Container.decode(key.marshal());

        assertEquals(1, data.algorithmId());
        assertArrayEquals(key.pack(), data.data());
    }

    @Test
    void testTextRoundTripPreservesExtra() {
        final Keys.KeyPair pair = ed25519Pair();
        final PrivateKey priv = PrivateKey.raw(Ed25519Algorithm.INSTANCE, pair.privateKey().keyBytes(), EXTRA);
        final PublicKey pub = PublicKey.raw(Ed25519Algorithm.INSTANCE, pair.publicKey().keyBytes(), EXTRA);

        final PrivateKey parsedPriv = PrivateKey.parse(priv.marshalText());
        final PublicKey parsedPub = PublicKey.parse(pub.marshalText());

        assertEquals(priv, parsedPriv);
        assertEquals(pub, parsedPub);
        assertArrayEquals(EXTRA, parsedPub.extraBytes());
        assertTrue(priv.marshalText().startsWith("npvt"));
        assertTrue(pub.marshalText().startsWith("npub"));
    }

    @Test
    void testBinaryRoundTrip() {
        final PrivateKey priv = ed25519Pair().privateKey();

        assertEquals(priv, PrivateKey.unmarshal(priv.marshal()));
    }

    @Test
    void testEveryBitFlipInKeyTextIsDetected() {
        final byte[] scalar = new byte[32];
        for (int i = 0; i < scalar.length; i++) {
            scalar[i] = (byte) (i + 1);
        }
        final PrivateKey secpPrivate = PrivateKey.raw(Secp256k1Algorithm.INSTANCE, scalar);
        final byte[] edPrivate = new byte[64];
        for (int i = 0; i < edPrivate.length; i++) {
            edPrivate[i] = (byte) i;
        }
        final byte[] edPublic = new byte[32];
        for (int i = 0; i < edPublic.length; i++) {
            edPublic[i] = (byte) (i * 3);
        }

        assertEveryBitFlipRejected(PublicKey.raw(Ed25519Algorithm.INSTANCE, edPublic).marshalText(),
                PublicKey.PREFIX.length(), PublicKey::parse);
        assertEveryBitFlipRejected(PrivateKey.raw(Ed25519Algorithm.INSTANCE, edPrivate).marshalText(),
                PrivateKey.PREFIX.length(), PrivateKey::parse);
        assertEveryBitFlipRejected(secpPrivate.marshalText(), PrivateKey.PREFIX.length(), PrivateKey::parse);
        assertEveryBitFlipRejected(secpPrivate.toPublic().marshalText(), PublicKey.PREFIX.length(), PublicKey::parse);
    }

    @Test
    void testEveryBitFlipInSignatureTextIsDetected() {
        final byte[] edSignature = new byte[64];
        for (int i = 0; i < edSignature.length; i++) {
            edSignature[i] = (byte) (255 - i);
        }
        final byte[] der = Hex.decode(
                "3045022100934b1ea10a4b3c1757e2b0c017d0b6143ce3c9a7e6a4a49860d7a6ab210ee3d8"
                        + "02202442ce9d2b916064108014783e923ec36b49743e2ffa1c4496f01a512aafd9e5");

        assertEveryBitFlipRejected(Signature.raw(Ed25519Algorithm.INSTANCE, edSignature).marshalText(), 0,
                Signature::parse);
        assertEveryBitFlipRejected(Signature.raw(Secp256k1Algorithm.INSTANCE, der).marshalText(), 0,
                Signature::parse);
    }

    // 0x20 only toggles case, which parsing ignores
    private static void assertEveryBitFlipRejected(final String text, final int prefixLength,
            final Function<String, ?> parser) {
        assertDoesNotThrow(() -> parser.apply(text));
        for (int i = prefixLength; i < text.length(); i++) {
            for (int bit = 0; bit < 8; bit++) {
                if (bit == 5) {
                    continue;
                }
                final char[] chars = text.toCharArray();
                chars[i] = (char) (chars[i] ^ (1 << bit));
                final String corrupted = new String(chars);
                assertThrows(KeyException.class, () -> parser.apply(corrupted), "bit " + bit + " at " + i);
            }
        }
    }

    @Test
    void testWrongPrefixIsParseFailure() {
        final String text = ed25519Pair().publicKey().marshalText();

        final KeyException ex = assertThrows(KeyException.class, () -> PrivateKey.parse(text));
        assertEquals(NdauException.Kind.PARSE_FAILURE, ex.kind());
    }

    @Test
    void testRawChecksSize() {
        final KeyException ex = assertThrows(KeyException.class,
                () -> PublicKey.raw(Ed25519Algorithm.INSTANCE, new byte[31]));
        assertEquals(NdauException.Kind.INVALID_LENGTH, ex.kind());
    }

    @Test
    void testTruncateDropsExtra() {
        final PublicKey key = PublicKey.raw(Ed25519Algorithm.INSTANCE, new byte[32], EXTRA);

        assertEquals(0, key.truncate().extraBytes().length);
        assertArrayEquals(key.keyBytes(), key.truncate().keyBytes());
        assertNotEquals(key, key.truncate());
    }

    @Test
    void testRoleAndEquality() {
        final Keys.KeyPair pair = ed25519Pair();

        assertTrue(pair.publicKey().isPublic());
        assertTrue(pair.privateKey().isPrivate());
        assertNotEquals(pair.publicKey(), PublicKey.raw(Ed25519Algorithm.INSTANCE, new byte[32]));
        assertEquals(pair.publicKey().hashCode(),
                PublicKey.raw(Ed25519Algorithm.INSTANCE, pair.publicKey().keyBytes()).hashCode());
    }

    @Test
    void testZeroizeLeavesEmptyNullKey() {
        final PrivateKey key = ed25519Pair().privateKey();

        key.zeroize();

        assertTrue(key.isDestroyed());
        assertSame(NullAlgorithm.INSTANCE, key.algorithm());
        assertEquals(0, key.keyBytes().length);
        assertEquals(0, key.extraBytes().length);
    }

    @Test
    void testToPublicCarriesExtra() {
        final PrivateKey priv = PrivateKey.raw(Ed25519Algorithm.INSTANCE, ed25519Pair().privateKey().keyBytes(), EXTRA);

        assertArrayEquals(EXTRA, priv.toPublic().extraBytes());
    }

    @Test
    void testToStringIsShorthand() {
        final String text = ed25519Pair().publicKey().marshalText();
        final String shorthand = PublicKey.parse(text).toString();

        assertEquals(text.substring(0, 8) + "..." + text.substring(text.length() - 4), shorthand);
    }

    static Keys.KeyPair ed25519Pair() {
        final byte[] seed = new byte[32];
        for (int i = 0; i < seed.length; i++) {
            seed[i] = (byte) (i * 7);
        }
        return Keys.generate(Ed25519Algorithm.INSTANCE, new FixedSecureRandom(seed));
    }
}
