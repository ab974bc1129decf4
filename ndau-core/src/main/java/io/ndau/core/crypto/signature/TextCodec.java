// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.util.Objects;

import io.ndau.core.crypto.TextChecksum;
import io.ndau.core.error.KeyException;
import io.ndau.primitives.B32;

/**
 * Prefix + base32 + checksum text form shared by keys and signatures.
 */
final class TextCodec {

    private TextCodec() {
    }

    static String encode(final String prefix, final byte[] marshaled) {
        return prefix + B32.encode(TextChecksum.add(marshaled));
    }

    static byte[] decode(final String prefix, final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        if (!text.startsWith(prefix)) {
            throw KeyException.parseFailure("expected text to start with \"" + prefix + "\"");
        }

        final byte[] framed;
        try {
            framed = B32.decode(text.substring(prefix.length()));
        } catch (IllegalArgumentException e) {
            throw KeyException.parseFailure("text is not valid base32", e);
        }
        return TextChecksum.check(framed);
    }

    /**
     * First 8 and last 4 characters of {@code text}, for display.
     */
    static String shorthand(final String text) {
        if (text.length() <= 15) {
            return text;
        }
        return text.substring(0, 8) + "..." + text.substring(text.length() - 4);
    }
}
