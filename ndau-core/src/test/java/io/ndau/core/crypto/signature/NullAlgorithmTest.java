// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import static org.junit.jupiter.api.Assertions.*;

import java.security.SecureRandom;

import org.junit.jupiter.api.Test;

import io.ndau.core.error.KeyException;
import io.ndau.core.error.NdauException;

class NullAlgorithmTest {

    private static final NullAlgorithm NULL = NullAlgorithm.INSTANCE;

    @Test
    void hasZeroSizes() {
        assertEquals("null", NULL.name());
        assertEquals(0, NULL.publicKeySize());
        assertEquals(0, NULL.privateKeySize());
        assertEquals(0, NULL.signatureSize());
    }

    @Test
    void generateIsRefused() {
        final KeyException ex = assertThrows(KeyException.class, () -> NULL.generate(new SecureRandom()));
        assertEquals(NdauException.Kind.UNSUPPORTED_OPERATION, ex.kind());
    }

    @Test
    void signaturesAreEmptyAndNeverVerify() {
        final byte[] signature = NULL.sign(new byte[0], new byte[] {1, 2, 3});

        assertEquals(0, signature.length);
        assertFalse(NULL.verify(new byte[0], new byte[] {1, 2, 3}, signature));
        assertEquals(0, NULL.derivePublic(new byte[0]).length);
    }

    @Test
    void nullKeysRoundTrip() {
        final PublicKey key = PublicKey.raw(NULL, new byte[0]);

        assertEquals(key, PublicKey.parse(key.marshalText()));
    }
}
