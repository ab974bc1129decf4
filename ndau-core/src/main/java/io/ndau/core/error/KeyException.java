// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.error;

/**
 * Exception for key, signature and HD derivation failures.
 *
 * @since 0.1.0
 */
public final class KeyException extends NdauException {

    public KeyException(final Kind kind, final String message) {
        super(kind, message);
    }

    public KeyException(final Kind kind, final String message, final Throwable cause) {
        super(kind, message, cause);
    }

    /**
     * Creates an exception for a value of the wrong size.
     *
     * @param what     what was measured, e.g. {@code "seed"}
     * @param expected the expected size or range, e.g. {@code "32"} or {@code "16-64"}
     * @param actual   the actual size
     * @return a new KeyException with kind INVALID_LENGTH
     */
    public static KeyException invalidLength(final String what, final String expected, final int actual) {
        return new KeyException(Kind.INVALID_LENGTH,
                what + " must be " + expected + " bytes, got " + actual);
    }

    /**
     * Creates an exception for a seed whose master scalar is zero or not below the curve order.
     *
     * @return a new KeyException with kind UNUSABLE_VALUE
     */
    public static KeyException unusableSeed() {
        return new KeyException(Kind.UNUSABLE_VALUE, "unusable seed");
    }

    /**
     * Creates an exception for a child index that yields no valid key.
     *
     * @param index the child index, as an unsigned 32-bit value
     * @return a new KeyException with kind UNUSABLE_VALUE
     */
    public static KeyException invalidChild(final int index) {
        return new KeyException(Kind.UNUSABLE_VALUE,
                "the extended key at index " + Integer.toUnsignedString(index)
                        + " is invalid; retry with the next index");
    }

    /**
     * Creates an exception for a scalar outside {@code [1, n)}.
     *
     * @param message description of the value
     * @return a new KeyException with kind UNUSABLE_VALUE
     */
    public static KeyException unusableValue(final String message) {
        return new KeyException(Kind.UNUSABLE_VALUE, message);
    }

    /**
     * Creates an exception for text whose checksum does not match.
     *
     * @param what what was being decoded
     * @return a new KeyException with kind BAD_CHECKSUM
     */
    public static KeyException badChecksum(final String what) {
        return new KeyException(Kind.BAD_CHECKSUM, what + ": checksum failure");
    }

    /**
     * Creates an exception for malformed input.
     *
     * @param message description of the parse failure
     * @return a new KeyException with kind PARSE_FAILURE
     */
    public static KeyException parseFailure(final String message) {
        return new KeyException(Kind.PARSE_FAILURE, message);
    }

    /**
     * Creates an exception for malformed input with the underlying cause.
     *
     * @param message description of the parse failure
     * @param cause   the underlying cause
     * @return a new KeyException with kind PARSE_FAILURE
     */
    public static KeyException parseFailure(final String message, final Throwable cause) {
        return new KeyException(Kind.PARSE_FAILURE, message, cause);
    }

    /**
     * Creates an exception for an operation the key or algorithm does not support.
     *
     * @param message description of the operation
     * @return a new KeyException with kind UNSUPPORTED_OPERATION
     */
    public static KeyException unsupported(final String message) {
        return new KeyException(Kind.UNSUPPORTED_OPERATION, message);
    }

    /**
     * Creates an exception for an algorithm id missing from the registry.
     *
     * @param id the algorithm id
     * @return a new KeyException with kind UNKNOWN_ALGORITHM
     */
    public static KeyException unknownAlgorithm(final int id) {
        return new KeyException(Kind.UNKNOWN_ALGORITHM, "unknown algorithm id " + id);
    }

    /**
     * Creates an exception for an algorithm that no registry id is bound to.
     *
     * @param name the algorithm name
     * @return a new KeyException with kind UNKNOWN_ALGORITHM
     */
    public static KeyException unknownAlgorithm(final String name) {
        return new KeyException(Kind.UNKNOWN_ALGORITHM, "algorithm " + name + " is not registered");
    }

    /**
     * Creates an exception for derivation below the deepest allowed level.
     *
     * @return a new KeyException with kind DEPTH_EXCEEDED
     */
    public static KeyException depthExceeded() {
        return new KeyException(Kind.DEPTH_EXCEEDED, "cannot derive a key with more than 255 indices in its path");
    }
}
