// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.primitives.container;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HexFormat;

import org.junit.jupiter.api.Test;

class ContainerTest {

    private static final HexFormat HEX = HexFormat.of();

    @Test
    void testEncodeSmallId() {
        final byte[] encoded = Container.encode(new IdentifiedData(2, new byte[] { 1, 2, 3 }));
        assertEquals("9202c403010203", HEX.formatHex(encoded));
    }

    @Test
    void testEncodeExtensionId() {
        final byte[] encoded = Container.encode(new IdentifiedData(200, new byte[0]));
        assertEquals("92ccc8c400", HEX.formatHex(encoded));
    }

    @Test
    void testEncodeLongData() {
        final byte[] data = new byte[300];
        final byte[] encoded = Container.encode(new IdentifiedData(1, data));
        assertEquals("9201c5012c", HEX.formatHex(encoded).substring(0, 10));
        assertEquals(5 + 300, encoded.length);
        assertEquals(new IdentifiedData(1, data), Container.decode(encoded));

        final byte[] huge = new byte[70_000];
        final byte[] hugeEncoded = Container.encode(new IdentifiedData(1, huge));
        assertEquals((byte) 0xc6, hugeEncoded[2]);
        assertEquals(new IdentifiedData(1, huge), Container.decode(hugeEncoded));
    }

    @Test
    void testDecodeAcceptsWiderIntegerEncodings() {
        // uint16 id and array16 header are legal MessagePack for the same value
        final IdentifiedData decoded = Container.decode(HEX.parseHex("dc0002cd0002c40109"));
        assertEquals(2, decoded.algorithmId());
        assertArrayEquals(new byte[] { 9 }, decoded.data());
    }

    @Test
    void testDecodeRejectsOutOfRangeId() {
        assertThrows(IllegalArgumentException.class, () -> Container.decode(HEX.parseHex("92cd0100c400")));
        assertThrows(IllegalArgumentException.class, () -> Container.decode(HEX.parseHex("92ffc400")));
    }

    @Test
    void testDecodeRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Container.decode(new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> Container.decode(HEX.parseHex("9302c400")));
        assertThrows(IllegalArgumentException.class, () -> Container.decode(HEX.parseHex("9202a3616263")));
        assertThrows(IllegalArgumentException.class, () -> Container.decode(HEX.parseHex("9202c40501")));
    }

    @Test
    void testTrailingBytes() {
        final byte[] encoded = HEX.parseHex("9201c4010aff");
        assertThrows(IllegalArgumentException.class, () -> Container.decode(encoded));

        final Container.DecodeResult result = Container.decodePrefix(encoded);
        assertEquals(5, result.consumed());
        assertEquals(new IdentifiedData(1, new byte[] { 10 }), result.value());
    }

    @Test
    void testIdentifiedDataCopiesItsBytes() {
        final byte[] data = { 1, 2 };
        final IdentifiedData value = new IdentifiedData(1, data);
        data[0] = 9;
        assertArrayEquals(new byte[] { 1, 2 }, value.data());
        assertThrows(IllegalArgumentException.class, () -> new IdentifiedData(256, data));
        assertThrows(IllegalArgumentException.class, () -> new IdentifiedData(-1, data));
    }
}
