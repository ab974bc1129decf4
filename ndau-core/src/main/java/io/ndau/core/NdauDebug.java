// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core;

/**
 * Global toggle for verbose debug logging in the ndau key modules.
 *
 * <p>Initial values come from the system properties {@code ndau.debug} (both channels),
 * {@code ndau.debug.keys} and {@code ndau.debug.address}, read once when the class loads.
 * The setters override them at runtime.
 *
 * <p>Thread safety: the flags are volatile. {@link #isEnabled()} reads them non-atomically,
 * which is fine for best-effort logging.
 */
public final class NdauDebug {

    private static volatile boolean keyLogging = flag("ndau.debug.keys");
    private static volatile boolean addressLogging = flag("ndau.debug.address");

    private NdauDebug() {
    }

    private static boolean flag(final String name) {
        return Boolean.getBoolean("ndau.debug") || Boolean.getBoolean(name);
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either key or address logging is enabled
     */
    public static boolean isEnabled() {
        return keyLogging || addressLogging;
    }

    public static void setEnabled(final boolean enabled) {
        keyLogging = enabled;
        addressLogging = enabled;
    }

    public static void setKeyLogging(final boolean enabled) {
        keyLogging = enabled;
    }

    public static boolean isKeyLoggingEnabled() {
        return keyLogging;
    }

    public static void setAddressLogging(final boolean enabled) {
        addressLogging = enabled;
    }

    public static boolean isAddressLoggingEnabled() {
        return addressLogging;
    }
}
