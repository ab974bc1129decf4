// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.error;

/**
 * Exception for address generation and validation failures.
 *
 * @since 0.1.0
 */
public final class AddressException extends NdauException {

    public AddressException(final Kind kind, final String message) {
        super(kind, message);
    }

    public AddressException(final Kind kind, final String message, final Throwable cause) {
        super(kind, message, cause);
    }

    /**
     * Creates an exception for an unrecognized kind letter or name.
     *
     * @param kind the rejected kind
     * @return a new AddressException with kind PARSE_FAILURE
     */
    public static AddressException invalidKind(final String kind) {
        return new AddressException(Kind.PARSE_FAILURE, "invalid address kind: " + kind);
    }

    /**
     * Creates an exception for input of the wrong size.
     *
     * @param message description of the size problem
     * @return a new AddressException with kind INVALID_LENGTH
     */
    public static AddressException invalidLength(final String message) {
        return new AddressException(Kind.INVALID_LENGTH, message);
    }

    /**
     * Creates an exception for an address whose checksum does not match.
     *
     * @return a new AddressException with kind BAD_CHECKSUM
     */
    public static AddressException badChecksum() {
        return new AddressException(Kind.BAD_CHECKSUM, "address checksum failure");
    }

    /**
     * Creates an exception for text outside the address alphabet.
     *
     * @param cause the decoding failure
     * @return a new AddressException with kind PARSE_FAILURE
     */
    public static AddressException undecodable(final Throwable cause) {
        return new AddressException(Kind.PARSE_FAILURE, "address is not valid base32", cause);
    }

    /**
     * Creates an exception for a network prefix that cannot start an address.
     *
     * @param prefix the rejected prefix
     * @return a new AddressException with kind PARSE_FAILURE
     */
    public static AddressException invalidPrefix(final String prefix) {
        return new AddressException(Kind.PARSE_FAILURE,
                "network prefix must be two base32 characters: " + prefix);
    }
}
