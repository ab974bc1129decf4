// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.primitives.container;

import java.util.Objects;

/**
 * Binary codec for {@link IdentifiedData}.
 *
 * <p>The wire form is the MessagePack encoding of the two-element array
 * {@code [algorithmId, data]}:
 * <pre>
 * 0x92                       fixarray of 2
 * 0x00-0x7f | 0xcc u8        algorithm id
 * 0xc4 u8 | 0xc5 u16 | 0xc6 u32, bytes
 * </pre>
 * The encoder always writes the shortest form. The decoder accepts every MessagePack
 * array header and every integer encoding whose value fits in an unsigned byte, and
 * rejects anything else.
 *
 * @since 0.1.0
 */
public final class Container {

    private static final int FIXARRAY_2 = 0x92;
    private static final int ARRAY16 = 0xDC;
    private static final int ARRAY32 = 0xDD;

    private static final int BIN8 = 0xC4;
    private static final int BIN16 = 0xC5;
    private static final int BIN32 = 0xC6;

    private static final int UINT8 = 0xCC;
    private static final int UINT16 = 0xCD;
    private static final int UINT32 = 0xCE;
    private static final int UINT64 = 0xCF;
    private static final int INT8 = 0xD0;
    private static final int INT16 = 0xD1;
    private static final int INT32 = 0xD2;
    private static final int INT64 = 0xD3;

    private Container() {
        // Utility class
    }

    /**
     * Encodes tagged data.
     *
     * @param value the value to encode
     * @return encoded bytes
     */
    public static byte[] encode(final IdentifiedData value) {
        Objects.requireNonNull(value, "value cannot be null");

        final int id = value.algorithmId();
        final byte[] data = value.data();
        final int idSize = id < 0x80 ? 1 : 2;
        final int lengthSize = data.length <= 0xFF ? 1 : data.length <= 0xFFFF ? 2 : 4;

        final byte[] out = new byte[1 + idSize + 1 + lengthSize + data.length];
        int pos = 0;
        out[pos++] = (byte) FIXARRAY_2;
        if (idSize == 2) {
            out[pos++] = (byte) UINT8;
        }
        out[pos++] = (byte) id;

        out[pos++] = (byte) (lengthSize == 1 ? BIN8 : lengthSize == 2 ? BIN16 : BIN32);
        for (int shift = (lengthSize - 1) * 8; shift >= 0; shift -= 8) {
            out[pos++] = (byte) (data.length >>> shift);
        }
        System.arraycopy(data, 0, out, pos, data.length);
        return out;
    }

    /**
     * Decodes tagged data that must span the whole input.
     *
     * @param encoded the encoded bytes
     * @return decoded value
     * @throws IllegalArgumentException if the input is malformed or has trailing bytes
     */
    public static IdentifiedData decode(final byte[] encoded) {
        final DecodeResult result = decodePrefix(encoded);
        if (result.consumed() != encoded.length) {
            throw new IllegalArgumentException(
                    "container has " + (encoded.length - result.consumed()) + " trailing bytes");
        }
        return result.value();
    }

    /**
     * Decodes tagged data from the start of the input, ignoring whatever follows it.
     *
     * @param encoded the encoded bytes
     * @return the value and the number of bytes it occupied
     * @throws IllegalArgumentException if the input is malformed
     */
    public static DecodeResult decodePrefix(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        final Reader reader = new Reader(encoded);

        final long size = reader.arrayHeader();
        if (size != 2) {
            throw new IllegalArgumentException("container must be an array of 2 elements, got " + size);
        }
        final long id = reader.integer();
        if (id < 0 || id > 0xFF) {
            throw new IllegalArgumentException("algorithm id out of range: " + id);
        }
        final byte[] data = reader.bytes();
        return new DecodeResult(new IdentifiedData((int) id, data), reader.pos);
    }

    /**
     * Outcome of {@link #decodePrefix(byte[])}.
     *
     * @param value    the decoded value
     * @param consumed number of input bytes it occupied
     */
    public record DecodeResult(IdentifiedData value, int consumed) {
    }

    private static final class Reader {
        private final byte[] data;
        private int pos;

        Reader(final byte[] data) {
            this.data = data;
        }

        long arrayHeader() {
            final int prefix = next();
            if ((prefix & 0xF0) == 0x90) {
                return prefix & 0x0F;
            }
            if (prefix == ARRAY16) {
                return readUnsigned(2);
            }
            if (prefix == ARRAY32) {
                return readUnsigned(4);
            }
            throw new IllegalArgumentException("expected array header, got 0x" + Integer.toHexString(prefix));
        }

        long integer() {
            final int prefix = next();
            if (prefix <= 0x7F) {
                return prefix;
            }
            if (prefix >= 0xE0) {
                return (byte) prefix;
            }
            switch (prefix) {
                case UINT8:
                    return readUnsigned(1);
                case UINT16:
                    return readUnsigned(2);
                case UINT32:
                    return readUnsigned(4);
                case UINT64: {
                    final long value = readUnsigned(8);
                    if (value < 0) {
                        throw new IllegalArgumentException("uint64 value out of range");
                    }
                    return value;
                }
                case INT8:
                    return (byte) next();
                case INT16:
                    return (short) readUnsigned(2);
                case INT32:
                    return (int) readUnsigned(4);
                case INT64:
                    return readUnsigned(8);
                default:
                    throw new IllegalArgumentException("expected integer, got 0x" + Integer.toHexString(prefix));
            }
        }

        byte[] bytes() {
            final int prefix = next();
            final long length;
            switch (prefix) {
                case BIN8:
                    length = readUnsigned(1);
                    break;
                case BIN16:
                    length = readUnsigned(2);
                    break;
                case BIN32:
                    length = readUnsigned(4);
                    break;
                default:
                    throw new IllegalArgumentException("expected bin header, got 0x" + Integer.toHexString(prefix));
            }
            if (length > data.length - pos) {
                throw new IllegalArgumentException(
                        "bin length " + length + " exceeds remaining " + (data.length - pos) + " bytes");
            }
            final byte[] out = new byte[(int) length];
            System.arraycopy(data, pos, out, 0, out.length);
            pos += out.length;
            return out;
        }

        private int next() {
            if (pos >= data.length) {
                throw new IllegalArgumentException("unexpected end of container at offset " + pos);
            }
            return data[pos++] & 0xFF;
        }

        private long readUnsigned(final int size) {
            long value = 0;
            for (int i = 0; i < size; i++) {
                value = (value << 8) | next();
            }
            return value;
        }
    }
}
