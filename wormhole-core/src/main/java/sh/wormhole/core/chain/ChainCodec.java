// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core.chain;

import java.util.Objects;

import sh.wormhole.core.DebugLogger;
import sh.wormhole.primitives.Hex;
import sh.wormhole.primitives.Uint16;

/**
 * Binary framing of a {@link Chain} as used in Wormhole messages.
 *
 * <p>A chain occupies {@value #BYTES} bytes, big-endian, matching the chain id fields of
 * VAA bodies and governance payloads. {@link Chain} itself has no byte order; this class
 * is where the order is fixed.
 *
 * <pre>{@code
 * ChainCodec.encode(Chain.SOLANA);     // {0x00, 0x01}
 * ChainCodec.toHex(Chain.fromU16(42)); // "0x002a"
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ChainCodec {

    /** Encoded width in bytes. */
    public static final int BYTES = Uint16.BYTES;

    private ChainCodec() {
        // Utility class
    }

    /**
     * Encodes a chain into a new 2-byte array.
     *
     * @param chain the chain to encode
     * @return big-endian wire bytes
     */
    public static byte[] encode(final Chain chain) {
        final byte[] out = new byte[BYTES];
        encodeTo(chain, out, 0);
        return out;
    }

    /**
     * Writes a chain into {@code dest} at {@code offset}.
     *
     * @throws IllegalArgumentException if fewer than 2 bytes remain at {@code offset}
     */
    public static void encodeTo(final Chain chain, final byte[] dest, final int offset) {
        Objects.requireNonNull(chain, "chain");
        Uint16.writeBigEndian(chain.toU16(), dest, offset);
    }

    /**
     * Decodes a chain from exactly 2 bytes.
     *
     * @throws IllegalArgumentException if {@code src} is null or not 2 bytes long
     */
    public static Chain decode(final byte[] src) {
        if (src == null || src.length != BYTES) {
            throw new IllegalArgumentException("chain must be exactly " + BYTES + " bytes");
        }
        return decode(src, 0);
    }

    /**
     * Decodes a chain from {@code src} at {@code offset}.
     *
     * @throws IllegalArgumentException if fewer than 2 bytes remain at {@code offset}
     */
    public static Chain decode(final byte[] src, final int offset) {
        final Chain chain = Chain.fromU16(Uint16.readBigEndian(src, offset));
        DebugLogger.logCodec("[CHAIN-DECODE] offset=%d chain=%s", offset, chain);
        return chain;
    }

    /**
     * Returns the {@code 0x}-prefixed hex of the wire bytes, e.g. {@code "0x0001"}.
     */
    public static String toHex(final Chain chain) {
        return Hex.encode(encode(chain));
    }

    /**
     * Decodes a chain from the hex of its wire bytes ({@code 0x} prefix optional).
     *
     * @throws IllegalArgumentException if {@code hex} is malformed or not 2 bytes
     */
    public static Chain fromHex(final String hex) {
        return decode(Hex.decode(hex));
    }
}
