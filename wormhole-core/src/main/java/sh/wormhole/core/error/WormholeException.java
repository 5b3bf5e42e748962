// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core.error;

/**
 * Base runtime exception for Wormhole SDK failures.
 *
 * <p>
 * Sealed so that every library-specific error can be caught with a single clause
 * while the set of subtypes stays closed.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * WormholeException
 * └── {@link InvalidChainException} - text that does not name a chain
 * </pre>
 *
 * <p>
 * Argument contract violations (out-of-range numbers, short buffers, malformed hex)
 * are reported with {@link IllegalArgumentException}, not with this hierarchy.
 *
 * @since 0.1.0
 */
public sealed class WormholeException extends RuntimeException
        permits InvalidChainException {

    public WormholeException(final String message) {
        super(message);
    }

    public WormholeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
