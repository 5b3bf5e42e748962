// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core;

/**
 * Global toggle for verbose debug logging across Wormhole modules.
 *
 * <p>All flags are off by default. Thread safety: the flags are volatile; updates are
 * visible to other threads but not ordered with respect to each other.
 */
public final class WormholeDebug {

    private static volatile boolean codecLogging = false;

    private WormholeDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     */
    public static boolean isEnabled() {
        return codecLogging;
    }

    public static void setEnabled(final boolean enabled) {
        codecLogging = enabled;
    }

    public static void setCodecLogging(final boolean enabled) {
        codecLogging = enabled;
    }

    public static boolean isCodecLoggingEnabled() {
        return codecLogging;
    }
}
