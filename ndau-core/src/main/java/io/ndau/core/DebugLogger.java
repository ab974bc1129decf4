// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for key and address operations.
 *
 * <p>Messages use {@link String#format} placeholders and go to the {@code io.ndau.debug}
 * SLF4J logger only while the matching {@link NdauDebug} channel is on. Every message is
 * passed through {@link LogSanitizer} first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.ndau.debug");

    private DebugLogger() {
    }

    public static void logKeys(final String message, final Object... args) {
        if (!NdauDebug.isKeyLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logAddress(final String message, final Object... args) {
        if (!NdauDebug.isAddressLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
