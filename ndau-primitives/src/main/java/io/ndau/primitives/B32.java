// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.primitives;

import java.util.Arrays;

/**
 * Base32 codec over the ndau alphabet.
 *
 * <p>The alphabet drops the visually confusable symbols {@code l}, {@code 1}, {@code 0}
 * and {@code o}. Bits are packed exactly as RFC 4648 base32, but no {@code =} padding is
 * ever written or accepted: a trailing partial group is emitted as its significant
 * characters only. Decoding is case-insensitive.
 *
 * @since 0.1.0
 */
public final class B32 {

    /** The 32 symbols, in value order. */
    public static final String ALPHABET = "abcdefghijkmnpqrstuvwxyz23456789";

    private static final char[] SYMBOLS = ALPHABET.toCharArray();
    private static final int[] LOOKUP = new int[128];

    static {
        Arrays.fill(LOOKUP, -1);
        for (int i = 0; i < SYMBOLS.length; i++) {
            LOOKUP[SYMBOLS[i]] = i;
            LOOKUP[Character.toUpperCase(SYMBOLS[i])] = i;
        }
    }

    private B32() {
        // Utility class
    }

    /**
     * Encodes bytes as unpadded base32 text.
     *
     * @param bytes the bytes to encode
     * @return lowercase text, {@code ceil(8 * bytes.length / 5)} characters long
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] out = new char[(bytes.length * 8 + 4) / 5];
        int buffer = 0;
        int bits = 0;
        int pos = 0;
        for (final byte b : bytes) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                bits -= 5;
                out[pos++] = SYMBOLS[(buffer >>> bits) & 0x1F];
            }
        }
        if (bits > 0) {
            out[pos++] = SYMBOLS[(buffer << (5 - bits)) & 0x1F];
        }
        return new String(out, 0, pos);
    }

    /**
     * Decodes unpadded base32 text.
     *
     * @param text the text to decode, in any case
     * @return the decoded bytes
     * @throws IllegalArgumentException if {@code text} is {@code null}, contains a character
     *                                  outside the alphabet, has a length no byte sequence
     *                                  encodes to, or carries non-zero trailing bits
     */
    public static byte[] decode(final CharSequence text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }

        final int length = text.length();
        final int tail = length % 8;
        if (tail == 1 || tail == 3 || tail == 6) {
            throw new IllegalArgumentException("invalid base32 length: " + length);
        }

        final byte[] out = new byte[length * 5 / 8];
        int buffer = 0;
        int bits = 0;
        int pos = 0;
        for (int i = 0; i < length; i++) {
            final int value = index(text.charAt(i));
            if (value < 0) {
                throw new IllegalArgumentException(
                        "illegal base32 character '" + text.charAt(i) + "' at offset " + i);
            }
            buffer = (buffer << 5) | value;
            bits += 5;
            if (bits >= 8) {
                bits -= 8;
                out[pos++] = (byte) (buffer >>> bits);
            }
        }
        if ((buffer & ((1 << bits) - 1)) != 0) {
            throw new IllegalArgumentException("non-zero trailing bits in base32 input");
        }
        return out;
    }

    /**
     * Returns the value of a single symbol.
     *
     * @param c the symbol, in either case
     * @return its index in {@link #ALPHABET}, or {@code -1} if it is not a symbol
     */
    public static int index(final char c) {
        if (c >= LOOKUP.length) {
            return -1;
        }
        return LOOKUP[c];
    }

    /**
     * Returns the symbol for a 5-bit value.
     *
     * @param value the value, 0 to 31
     * @return the symbol
     * @throws IllegalArgumentException if {@code value} is out of range
     */
    public static char symbol(final int value) {
        if (value < 0 || value >= SYMBOLS.length) {
            throw new IllegalArgumentException("base32 value out of range: " + value);
        }
        return SYMBOLS[value];
    }
}
