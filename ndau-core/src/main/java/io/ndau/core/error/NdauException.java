// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.error;

import java.util.Objects;

/**
 * Base runtime exception for all ndau key-library failures.
 *
 * <p>
 * Every failure carries a {@link Kind} so callers can branch on the category
 * without catching individual subclasses.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * NdauException
 * ├── {@link KeyException} - key, signature and HD derivation failures
 * └── {@link AddressException} - address generation and validation failures
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * ExtendedKey child;
 * try {
 *     child = parent.child(index);
 * } catch (NdauException e) {
 *     if (!e.isRetryable()) {
 *         throw e;
 *     }
 *     child = parent.child(index + 1);
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class NdauException extends RuntimeException
        permits KeyException,
        AddressException {

    /**
     * Categorizes the failure.
     */
    public enum Kind {
        /** A seed, key, signature or buffer has the wrong size. */
        INVALID_LENGTH,
        /** A derived scalar or point is outside the usable range; retry with another seed or index. */
        UNUSABLE_VALUE,
        /** Decoded text failed its checksum. */
        BAD_CHECKSUM,
        /** Malformed text, prefix or path. */
        PARSE_FAILURE,
        /** The operation is not defined for this key or algorithm. */
        UNSUPPORTED_OPERATION,
        /** An algorithm id is not present in the registry. */
        UNKNOWN_ALGORITHM,
        /** Derivation would exceed the maximum tree depth. */
        DEPTH_EXCEEDED
    }

    private final Kind kind;

    public NdauException(final Kind kind, final String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public NdauException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    /**
     * Returns the category of this failure.
     *
     * @return the failure kind
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Returns whether the caller may retry with a different seed or the next child index.
     *
     * @return {@code true} only for {@link Kind#UNUSABLE_VALUE}
     */
    public boolean isRetryable() {
        return kind == Kind.UNUSABLE_VALUE;
    }
}
