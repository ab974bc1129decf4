// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.primitives;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class B32Test {

    @ParameterizedTest
    @CsvSource({
        "'', ''",
        "f, n2",
        "fo, n3zs",
        "foo, n3zy8",
        "foob, n3zy82s",
        "fooba, n3zy82vb",
        "foobar, n3zy82vbqi"
    })
    void encodesRfc4648VectorsWithoutPadding(final String plain, final String encoded) {
        assertEquals(encoded, B32.encode(plain.getBytes(StandardCharsets.US_ASCII)));
        assertArrayEquals(plain.getBytes(StandardCharsets.US_ASCII), B32.decode(encoded));
    }

    @Test
    void encodesBinaryData() {
        final byte[] data = new byte[16];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        assertEquals("aaasea2eawdaqcajbifs2diqb6", B32.encode(data));
        assertEquals("99999999", B32.encode(new byte[] { -1, -1, -1, -1, -1 }));
    }

    @Test
    void decodeIsCaseInsensitive() {
        assertArrayEquals(
                "foobar".getBytes(StandardCharsets.US_ASCII),
                B32.decode("N3ZY82VBQI"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "n3zl", "n3z0", "n3z1", "n3zo", "n3z=", "n3zy82vbq!" })
    void rejectsCharactersOutsideTheAlphabet(final String text) {
        assertThrows(IllegalArgumentException.class, () -> B32.decode(text));
    }

    @ParameterizedTest
    @ValueSource(strings = { "n", "n3z", "n3zy82" })
    void rejectsImpossibleLengths(final String text) {
        assertThrows(IllegalArgumentException.class, () -> B32.decode(text));
    }

    @Test
    void rejectsNonZeroTrailingBits() {
        // "n2" is 'f'; "n3" sets one of the two discarded bits
        assertThrows(IllegalArgumentException.class, () -> B32.decode("n3"));
    }

    @Test
    void indexAndSymbolAreInverse() {
        for (int i = 0; i < 32; i++) {
            assertEquals(i, B32.index(B32.symbol(i)));
            assertEquals(i, B32.index(Character.toUpperCase(B32.symbol(i))));
        }
        assertEquals(-1, B32.index('l'));
        assertEquals(-1, B32.index('0'));
        assertEquals(-1, B32.index('é'));
        assertEquals(12, B32.index('n'));
        assertEquals(3, B32.index('d'));
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> B32.encode(null));
        assertThrows(IllegalArgumentException.class, () -> B32.decode(null));
    }
}
