// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.hd;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.ndau.core.error.KeyException;
import io.ndau.core.error.NdauException;

class DerivationPathTest {

    @Test
    void testRoot() {
        final DerivationPath root = DerivationPath.parse("/");

        assertTrue(root.isRoot());
        assertEquals(DerivationPath.root(), root);
        assertEquals("/", root.toString());
    }

    @Test
    void testParseSegments() {
        assertEquals(List.of(new DerivationPath.Element(123, false)), DerivationPath.parse("/123").elements());
        assertEquals(List.of(new DerivationPath.Element(123, true)), DerivationPath.parse("/123'").elements());
        assertEquals(List.of(
                new DerivationPath.Element(123, false),
                new DerivationPath.Element(4, false),
                new DerivationPath.Element(567890, false)),
                DerivationPath.parse("/123/4/567890").elements());
        assertEquals(List.of(
                new DerivationPath.Element(123, true),
                new DerivationPath.Element(4, true),
                new DerivationPath.Element(567890, false)),
                DerivationPath.parse("/123'/4'/567890").elements());
    }

    @Test
    void testLargestIndex() {
        final DerivationPath path = DerivationPath.parse("/4294967295");

        assertEquals(-1, path.elements().get(0).index());
        assertEquals("/4294967295", path.toString());
    }

    @Test
    void testWhitespaceIsIgnored() {
        assertEquals(DerivationPath.parse("/44'/20036'/100"), DerivationPath.parse(" /44' /\t20036'/ 100\n"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"/foo", "/'", "/123/123749327234979", "/foo//bar", "//", "", "1/2", "/4294967296", "m/1"})
    void testInvalidPaths(final String path) {
        final KeyException ex = assertThrows(KeyException.class, () -> DerivationPath.parse(path));
        assertEquals(NdauException.Kind.PARSE_FAILURE, ex.kind());
    }

    @Test
    void testIsParentOf() {
        final DerivationPath parent = DerivationPath.parse("/1/2'");

        assertTrue(parent.isParentOf(DerivationPath.parse("/1/2'/3")));
        assertTrue(DerivationPath.root().isParentOf(parent));
        assertFalse(parent.isParentOf(parent));
        assertFalse(parent.isParentOf(DerivationPath.parse("/1/2/3")));
        assertFalse(parent.isParentOf(DerivationPath.parse("/1")));
    }

    @Test
    void testRelativize() {
        final DerivationPath steps = DerivationPath.parse("/1").relativize(DerivationPath.parse("/1/2'/3"));

        assertEquals("/2'/3", steps.toString());
        assertThrows(KeyException.class, () -> DerivationPath.parse("/2").relativize(DerivationPath.parse("/1/1")));
    }

    @Test
    void testToStringIsCanonical() {
        assertEquals("/44'/20036'/100", DerivationPath.parse("/ 44' / 20036' / 100").toString());
    }
}
