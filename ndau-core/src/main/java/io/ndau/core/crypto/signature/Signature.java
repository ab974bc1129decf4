// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.crypto.signature;

import java.util.Arrays;
import java.util.Objects;

import io.ndau.core.error.KeyException;
import io.ndau.primitives.container.Container;
import io.ndau.primitives.container.IdentifiedData;

/**
 * A signature and the algorithm that made it.
 *
 * <p>
 * Marshaled signatures are the raw bytes in a {@link Container}; there is no pack layer.
 * The text form is the base32 of the checksummed marshaled bytes, with no prefix.
 *
 * @since 0.1.0
 */
public final class Signature {

    private final Algorithm algorithm;
    private final byte[] data;

    private Signature(final Algorithm algorithm, final byte[] data) {
        this.algorithm = algorithm;
        this.data = data.clone();
    }

    /**
     * Creates a signature from raw bytes.
     *
     * @param algorithm the algorithm
     * @param data      raw signature; must match {@link Algorithm#signatureSize()} unless
     *                  that is {@link Algorithm#UNBOUNDED}
     * @return the signature
     * @throws KeyException with kind INVALID_LENGTH on a size mismatch
     */
    public static Signature raw(final Algorithm algorithm, final byte[] data) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        final int expected = algorithm.signatureSize();
        if (expected >= 0 && data.length != expected) {
            throw KeyException.invalidLength(algorithm.name() + " signature", String.valueOf(expected), data.length);
        }
        return new Signature(algorithm, data);
    }

    public static Signature unmarshal(final byte[] serialized) {
        return unmarshal(serialized, AlgorithmRegistry.defaultRegistry());
    }

    /**
     * Decodes marshaled bytes.
     *
     * @param serialized output of {@link #marshal()}
     * @param registry   registry resolving the algorithm id
     * @return the signature
     * @throws KeyException with kind PARSE_FAILURE, UNKNOWN_ALGORITHM or INVALID_LENGTH
     */
    public static Signature unmarshal(final byte[] serialized, final AlgorithmRegistry registry) {
        Objects.requireNonNull(serialized, "serialized cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");

        final IdentifiedData decoded;
        try {
            decoded = Container.decode(serialized);
        } catch (IllegalArgumentException e) {
            throw KeyException.parseFailure("malformed signature container: " + e.getMessage(), e);
        }
        return raw(registry.byId(decoded.algorithmId()), decoded.data());
    }

    public static Signature parse(final String text) {
        return parse(text, AlgorithmRegistry.defaultRegistry());
    }

    /**
     * Decodes the text form.
     *
     * @param text     output of {@link #marshalText()}
     * @param registry registry resolving the algorithm id
     * @return the signature
     * @throws KeyException with kind PARSE_FAILURE, BAD_CHECKSUM, UNKNOWN_ALGORITHM or
     *                      INVALID_LENGTH
     */
    public static Signature parse(final String text, final AlgorithmRegistry registry) {
        return unmarshal(TextCodec.decode("", text), registry);
    }

    public Algorithm algorithm() {
        return algorithm;
    }

    public byte[] bytes() {
        return data.clone();
    }

    public byte[] marshal() {
        return marshal(AlgorithmRegistry.defaultRegistry());
    }

    /**
     * Serializes the signature with the id {@code registry} binds its algorithm to.
     *
     * @param registry the registry
     * @return marshaled bytes
     * @throws KeyException with kind UNKNOWN_ALGORITHM if the algorithm is not registered
     */
    public byte[] marshal(final AlgorithmRegistry registry) {
        Objects.requireNonNull(registry, "registry cannot be null");
        return Container.encode(new IdentifiedData(registry.requireId(algorithm), data));
    }

    public String marshalText() {
        return TextCodec.encode("", marshal());
    }

    /**
     * Verifies this signature over {@code message}.
     *
     * @param message   the signed message
     * @param publicKey the signer's public key
     * @return {@code true} if valid
     */
    public boolean verify(final byte[] message, final PublicKey publicKey) {
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        return publicKey.verify(message, this);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Signature other)) {
            return false;
        }
        return AlgorithmRegistry.sameAlgorithm(algorithm, other.algorithm) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.name().hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Signature[algorithm=" + algorithm.name() + ", length=" + data.length + "]";
    }
}
