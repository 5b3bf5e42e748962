// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core.error;

/**
 * Thrown when text cannot be parsed as a {@link sh.wormhole.core.chain.Chain}.
 *
 * <p>The offending input is kept verbatim in {@link #input()}.
 *
 * @since 0.1.0
 */
public final class InvalidChainException extends WormholeException {

    private final String input;

    public InvalidChainException(final String input) {
        super("invalid chain: " + input);
        this.input = input;
    }

    public String input() {
        return input;
    }
}
