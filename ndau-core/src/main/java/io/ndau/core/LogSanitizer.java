// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility that removes key material from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts private keys, both in {@code npvt} text form and as labelled hex scalars</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Private key text: the {@code npvt} prefix followed by base32 symbols. */
    private static final Pattern PRIVATE_TEXT_PATTERN =
            Pattern.compile("npvt[abcdefghijkmnpqrstuvwxyz23456789]+", Pattern.CASE_INSENSITIVE);

    private static final String PRIVATE_TEXT_REPLACEMENT = "npvt***[REDACTED]***";

    /** Hex scalars labelled as private keys or seeds, e.g. {@code privateKey=0xab..} or {@code "seed":"ab.."}. */
    private static final Pattern SECRET_HEX_PATTERN = Pattern.compile(
            "(\"?(?:privateKey|seed|scalar)\"?\\s*[:=]\\s*\"?)(?:0x)?[0-9a-fA-F]+",
            Pattern.CASE_INSENSITIVE);

    private static final String SECRET_HEX_REPLACEMENT = "$1***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.toLowerCase(Locale.ROOT).contains("npvt")) {
            sanitized = PRIVATE_TEXT_PATTERN.matcher(sanitized).replaceAll(PRIVATE_TEXT_REPLACEMENT);
        }

        sanitized = SECRET_HEX_PATTERN.matcher(sanitized).replaceAll(SECRET_HEX_REPLACEMENT);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
