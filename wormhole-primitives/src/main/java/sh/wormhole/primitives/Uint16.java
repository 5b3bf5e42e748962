// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.primitives;

/**
 * Helpers for 16-bit unsigned integers carried in Java {@code int}s.
 *
 * <p>Java has no unsigned 16-bit primitive, so values are passed around as {@code int}
 * in the range {@code 0..65535}. Byte access is big-endian, the order used by the
 * Wormhole wire format.
 *
 * @since 0.1.0
 */
public final class Uint16 {

    /** Largest value representable in 16 unsigned bits. */
    public static final int MAX_VALUE = 0xFFFF;

    /** Encoded width in bytes. */
    public static final int BYTES = 2;

    private Uint16() {
        // Utility class
    }

    public static boolean isInRange(final int value) {
        return value >= 0 && value <= MAX_VALUE;
    }

    /**
     * Returns {@code value} unchanged if it fits in 16 unsigned bits.
     *
     * @param value the value to check
     * @param name  name used in the error message
     * @return {@code value}
     * @throws IllegalArgumentException if {@code value} is outside {@code 0..65535}
     */
    public static int requireInRange(final int value, final String name) {
        if (!isInRange(value)) {
            throw new IllegalArgumentException(name + " must be in range 0-" + MAX_VALUE + ": " + value);
        }
        return value;
    }

    /**
     * Reads a big-endian 16-bit unsigned value.
     *
     * @param src    source buffer
     * @param offset index of the high byte
     * @return the value in {@code 0..65535}
     * @throws IllegalArgumentException if {@code src} is null or fewer than 2 bytes remain at {@code offset}
     */
    public static int readBigEndian(final byte[] src, final int offset) {
        checkBounds(src, offset);
        return ((src[offset] & 0xFF) << 8) | (src[offset + 1] & 0xFF);
    }

    /**
     * Writes {@code value} as 2 big-endian bytes.
     *
     * @param value  value in {@code 0..65535}
     * @param dest   destination buffer
     * @param offset index of the high byte
     * @throws IllegalArgumentException if {@code value} is out of range, {@code dest} is null,
     *                                  or fewer than 2 bytes remain at {@code offset}
     */
    public static void writeBigEndian(final int value, final byte[] dest, final int offset) {
        requireInRange(value, "value");
        checkBounds(dest, offset);
        dest[offset] = (byte) (value >>> 8);
        dest[offset + 1] = (byte) value;
    }

    private static void checkBounds(final byte[] buffer, final int offset) {
        if (buffer == null) {
            throw new IllegalArgumentException("buffer cannot be null");
        }
        if (offset < 0 || offset > buffer.length - BYTES) {
            throw new IllegalArgumentException(
                    "need " + BYTES + " bytes at offset " + offset + " but buffer length is " + buffer.length);
        }
    }
}
