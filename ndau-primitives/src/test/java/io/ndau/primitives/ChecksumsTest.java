// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.primitives;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import org.junit.jupiter.api.Test;

class ChecksumsTest {

    private static byte[] ascii(final String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void testChecksum16KnownValues() {
        assertArrayEquals(new byte[] { 111, (byte) 238 }, Checksums.checksum16(ascii("this is a test")));
        assertArrayEquals(new byte[] { 29, 15 }, Checksums.checksum16(new byte[0]));
        assertArrayEquals(new byte[] { (byte) 165, (byte) 254 }, Checksums.checksum16(ascii("this was a test")));
        assertArrayEquals(new byte[] { (byte) 200, 18 }, Checksums.checksum16(ascii("this Is a test")));
    }

    @Test
    void testCheck16() {
        assertTrue(Checksums.check16(ascii("this is a test"), new byte[] { 111, (byte) 238 }));
        assertFalse(Checksums.check16(ascii("this is a test"), new byte[] { 111, (byte) 239 }));
        assertFalse(Checksums.check16(ascii("this is a test"), new byte[] { 111 }));
        assertFalse(Checksums.check16(ascii("this is a test"), null));
    }

    @Test
    void testChecksum24IsSha256Prefix() {
        // sha256("abc") = ba7816bf...
        assertArrayEquals(HexFormat.of().parseHex("ba7816"), Checksums.checksum24(ascii("abc")));
    }

    @Test
    void testNullInputRejected() {
        assertThrows(IllegalArgumentException.class, () -> Checksums.checksum16(null));
        assertThrows(IllegalArgumentException.class, () -> Checksums.checksum24(null));
    }
}
