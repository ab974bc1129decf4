// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core.address;

import java.util.Locale;
import java.util.Objects;

import io.ndau.core.error.AddressException;

/**
 * The kind of account an address belongs to, encoded as the third character of the
 * address.
 *
 * <p>
 * The kind tells users what sort of account they are dealing with; the chain may or may
 * not enforce it.
 */
public enum AddressKind {

    USER('a'),
    NDAU('n'),
    ENDOWMENT('e'),
    EXCHANGE('x'),
    BPC('b'),
    MARKET_MAKER('m');

    private final char letter;

    AddressKind(final char letter) {
        this.letter = letter;
    }

    /**
     * Returns the letter this kind is written as.
     *
     * @return one of {@code a n e x b m}
     */
    public char letter() {
        return letter;
    }

    /**
     * Looks a kind up by its letter.
     *
     * @param letter the letter, in either case
     * @return the kind
     * @throws AddressException with kind PARSE_FAILURE for any other letter
     */
    public static AddressKind fromLetter(final char letter) {
        final char lower = Character.toLowerCase(letter);
        for (final AddressKind kind : values()) {
            if (kind.letter == lower) {
                return kind;
            }
        }
        throw AddressException.invalidKind(String.valueOf(letter));
    }

    /**
     * Parses a kind from its name or letter, ignoring case.
     *
     * <p>
     * Accepted names are {@code user} (or {@code u}), {@code ndau}, {@code endowment},
     * {@code exchange}, {@code bpc} and {@code marketmaker}. Any other value must be a single
     * kind letter.
     *
     * @param value the name or letter
     * @return the kind
     * @throws AddressException with kind PARSE_FAILURE for an empty or unknown value
     */
    public static AddressKind parse(final String value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.isEmpty()) {
            throw AddressException.invalidKind("empty string");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "u", "user" -> USER;
            case "ndau" -> NDAU;
            case "endowment" -> ENDOWMENT;
            case "exchange" -> EXCHANGE;
            case "bpc" -> BPC;
            case "marketmaker" -> MARKET_MAKER;
            default -> {
                if (value.length() != 1) {
                    throw AddressException.invalidKind(value);
                }
                yield fromLetter(value.charAt(0));
            }
        };
    }
}
