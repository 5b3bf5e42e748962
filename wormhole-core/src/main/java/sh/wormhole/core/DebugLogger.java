// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger writing to the {@code sh.wormhole.debug} SLF4J logger.
 */
public final class DebugLogger {

    static final String LOGGER_NAME = "sh.wormhole.debug";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private DebugLogger() {
    }

    public static void logCodec(final String message, final Object... args) {
        if (!WormholeDebug.isCodecLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!WormholeDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(formatted);
    }
}
