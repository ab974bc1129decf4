// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.jspecify.annotations.Nullable;

import io.ndau.core.error.KeyException;
import io.ndau.primitives.container.Container;
import io.ndau.primitives.container.IdentifiedData;

/**
 * A public or private key: an algorithm, the raw key bytes and optional extra bytes.
 *
 * <p>
 * Extra bytes ride along with the key through every encoding; HD keys use them for their
 * depth, parent fingerprint, child index and chain code.
 *
 * <h2>Encodings</h2>
 * <ul>
 * <li><b>pack</b>: {@code [len(key)] ++ key ++ extra}</li>
 * <li><b>marshal</b>: the packed bytes in a {@link Container} tagged with the algorithm id</li>
 * <li><b>text</b>: {@link #prefix()} followed by the base32 of the checksummed marshaled
 * bytes</li>
 * </ul>
 *
 * <h2>Security Considerations</h2>
 *
 * <p>
 * {@link #zeroize()} overwrites the key and extra bytes in place and leaves an empty key
 * of the null algorithm. It mutates the instance, so the caller must make sure no other
 * thread is still using it. Arrays returned by accessors are copies and are not cleared.
 *
 * @since 0.1.0
 */
public abstract sealed class Key implements Destroyable permits PublicKey, PrivateKey {

    private static final byte[] EMPTY = new byte[0];

    private Algorithm algorithm;
    private byte[] key;
    private byte[] extra;
    private boolean destroyed;

    Key(final Algorithm algorithm, final byte[] key, final byte @Nullable [] extra) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm cannot be null");
        this.key = Objects.requireNonNull(key, "key cannot be null").clone();
        this.extra = extra == null ? EMPTY : extra.clone();
    }

    /**
     * Returns the text prefix of this key's role, {@code "npub"} or {@code "npvt"}.
     *
     * @return the prefix
     */
    public abstract String prefix();

    /**
     * Returns a copy of this key without its extra bytes.
     *
     * @return the truncated key
     */
    public abstract Key truncate();

    public Algorithm algorithm() {
        return algorithm;
    }

    public byte[] keyBytes() {
        return key.clone();
    }

    public byte[] extraBytes() {
        return extra.clone();
    }

    public boolean isPublic() {
        return this instanceof PublicKey;
    }

    public boolean isPrivate() {
        return this instanceof PrivateKey;
    }

    /**
     * Serializes the key and extra bytes without the algorithm.
     *
     * @return {@code [len(key)] ++ key ++ extra}
     * @throws KeyException with kind INVALID_LENGTH if the key is longer than 255 bytes
     */
    public byte[] pack() {
        if (key.length > 0xFF) {
            throw KeyException.invalidLength("packed key", "at most 255", key.length);
        }
        final byte[] out = new byte[1 + key.length + extra.length];
        out[0] = (byte) key.length;
        System.arraycopy(key, 0, out, 1, key.length);
        System.arraycopy(extra, 0, out, 1 + key.length, extra.length);
        return out;
    }

    /**
     * Splits packed bytes into key and extra bytes.
     *
     * @param packed output of {@link #pack()}
     * @return the parts
     * @throws KeyException with kind INVALID_LENGTH if the declared key length exceeds the buffer
     */
    public static Unpacked unpack(final byte[] packed) {
        Objects.requireNonNull(packed, "packed cannot be null");
        if (packed.length == 0) {
            throw KeyException.invalidLength("packed key", "at least 1", 0);
        }
        final int keyLength = packed[0] & 0xFF;
        if (1 + keyLength > packed.length) {
            throw KeyException.invalidLength("packed key", "at least " + (1 + keyLength), packed.length);
        }
        return new Unpacked(
                Arrays.copyOfRange(packed, 1, 1 + keyLength),
                Arrays.copyOfRange(packed, 1 + keyLength, packed.length));
    }

    /**
     * Serializes the key with the id the default registry binds its algorithm to.
     *
     * @return marshaled bytes
     * @throws KeyException with kind UNKNOWN_ALGORITHM if the algorithm is not registered
     */
    public byte[] marshal() {
        return marshal(AlgorithmRegistry.defaultRegistry());
    }

    /**
     * Serializes the key with the id {@code registry} binds its algorithm to.
     *
     * @param registry the registry
     * @return marshaled bytes
     * @throws KeyException with kind UNKNOWN_ALGORITHM if the algorithm is not registered
     */
    public byte[] marshal(final AlgorithmRegistry registry) {
        Objects.requireNonNull(registry, "registry cannot be null");
        return Container.encode(new IdentifiedData(registry.requireId(algorithm), pack()));
    }

    /**
     * Returns the checksummed text form of this key.
     *
     * @return prefixed base32 text
     */
    public String marshalText() {
        return marshalText(AlgorithmRegistry.defaultRegistry());
    }

    /**
     * Returns the checksummed text form of this key, with ids from {@code registry}.
     *
     * @param registry the registry
     * @return prefixed base32 text
     */
    public String marshalText(final AlgorithmRegistry registry) {
        return TextCodec.encode(prefix(), marshal(registry));
    }

    /**
     * Overwrites the key material and leaves an empty null-algorithm key.
     */
    public void zeroize() {
        Arrays.fill(key, (byte) 0);
        Arrays.fill(extra, (byte) 0);
        key = EMPTY;
        extra = EMPTY;
        algorithm = NullAlgorithm.INSTANCE;
        destroyed = true;
    }

    /**
     * Same as {@link #zeroize()}.
     */
    @Override
    public void destroy() {
        zeroize();
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Decodes marshaled bytes into algorithm, key and extra bytes.
     */
    static Decoded decode(final byte[] serialized, final AlgorithmRegistry registry) {
        Objects.requireNonNull(serialized, "serialized cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");

        final IdentifiedData data;
        try {
            data = Container.decode(serialized);
        } catch (IllegalArgumentException e) {
            throw KeyException.parseFailure("malformed key container: " + e.getMessage(), e);
        }
        final Algorithm algorithm = registry.byId(data.algorithmId());
        final Unpacked parts = unpack(data.data());
        return new Decoded(algorithm, parts.key(), parts.extra());
    }

    static void checkSize(final String role, final int expected, final byte[] key) {
        if (key.length != expected) {
            throw KeyException.invalidLength(role, String.valueOf(expected), key.length);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Key other = (Key) o;
        return AlgorithmRegistry.sameAlgorithm(algorithm, other.algorithm)
                && Arrays.equals(key, other.key)
                && Arrays.equals(extra, other.extra);
    }

    @Override
    public int hashCode() {
        int result = algorithm.name().hashCode();
        result = 31 * result + Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(extra);
        return result;
    }

    /**
     * Returns the first 8 and last 4 characters of the text form.
     */
    @Override
    public String toString() {
        if (AlgorithmRegistry.defaultRegistry().idOf(algorithm).isEmpty()) {
            return prefix() + "(" + algorithm.name() + ")";
        }
        return TextCodec.shorthand(marshalText());
    }

    /**
     * Result of {@link #unpack(byte[])}.
     *
     * @param key   raw key bytes
     * @param extra extra bytes, possibly empty
     */
    public record Unpacked(byte[] key, byte[] extra) {
    }

    record Decoded(Algorithm algorithm, byte[] key, byte[] extra) {
    }
}
