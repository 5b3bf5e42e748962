// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core.chain;

import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import sh.wormhole.core.error.InvalidChainException;
import sh.wormhole.primitives.Uint16;

/**
 * Identifies a chain participating in Wormhole messaging.
 *
 * <p>On the wire a chain is a 16-bit unsigned integer. Every value in {@code 0..65535}
 * decodes to exactly one {@code Chain}:
 * <ul>
 * <li>{@code 0} is {@link Any}, meaning no specific origin or destination</li>
 * <li>{@code 1} is {@link Solana}</li>
 * <li>anything else is {@link Unknown}, which keeps the raw value so ids assigned after
 * this release survive a decode/encode cycle</li>
 * </ul>
 *
 * <p>Text forms are {@code "Any"}, {@code "Solana"} and {@code "Unknown(<decimal>)"}.
 * In JSON a chain is a bare number (see {@link ChainJsonSerializer}).
 *
 * <pre>{@code
 * Chain chain = Chain.fromU16(42);      // Unknown(42)
 * chain.toString();                     // "Unknown(42)"
 * Chain.parse("unknown(42)");           // Unknown(42)
 * Chain.parse("Unknown(1)");            // Solana
 * }</pre>
 *
 * <p>Instances are immutable values; equality follows the numeric encoding.
 *
 * @since 0.1.0
 */
@JsonSerialize(using = ChainJsonSerializer.class)
@JsonDeserialize(using = ChainJsonDeserializer.class)
public sealed interface Chain extends Comparable<Chain> permits Chain.Any, Chain.Solana, Chain.Unknown {

    /** Wire value {@code 0}. */
    Chain ANY = new Any();

    /** Wire value {@code 1}. */
    Chain SOLANA = new Solana();

    /**
     * Returns the default chain, {@link #ANY}.
     */
    static Chain defaultChain() {
        return ANY;
    }

    /**
     * Decodes a wire value.
     *
     * @param value an unsigned 16-bit value
     * @return {@link #ANY} for 0, {@link #SOLANA} for 1, otherwise {@link Unknown}
     * @throws IllegalArgumentException if {@code value} is outside {@code 0..65535}
     */
    static Chain fromU16(final int value) {
        switch (Uint16.requireInRange(value, "chain")) {
            case Any.VALUE:
                return ANY;
            case Solana.VALUE:
                return SOLANA;
            default:
                return new Unknown(value);
        }
    }

    /**
     * Parses the text form produced by {@link #toString()}.
     *
     * <p>{@code "any"} and {@code "solana"} match in any ASCII case. Otherwise the text is
     * split on {@code (} and {@code )}: the first segment must be {@code "unknown"} (any
     * case) and the second a decimal value in {@code 0..65535}, optionally preceded by
     * {@code +}. The value goes through {@link #fromU16(int)}, so {@code "Unknown(0)"}
     * yields {@link #ANY}.
     *
     * @param text the text to parse
     * @return the parsed chain
     * @throws NullPointerException  if {@code text} is null
     * @throws InvalidChainException if {@code text} does not name a chain
     */
    static Chain parse(final String text) {
        Objects.requireNonNull(text, "text");
        if (asciiEqualsIgnoreCase(text, Any.NAME)) {
            return ANY;
        }
        if (asciiEqualsIgnoreCase(text, Solana.NAME)) {
            return SOLANA;
        }

        final String[] segments = Unknown.SEGMENT_SEPARATORS.split(text, -1);
        if (segments.length < 2 || !asciiEqualsIgnoreCase(segments[0], Unknown.NAME)) {
            throw new InvalidChainException(text);
        }
        final int value = parseDecimalU16(segments[1]);
        if (value < 0) {
            throw new InvalidChainException(text);
        }
        return fromU16(value);
    }

    /**
     * Encodes this chain as its wire value.
     *
     * @return value in {@code 0..65535}
     */
    int toU16();

    /**
     * Returns {@code true} if this chain has a named variant.
     */
    default boolean isKnown() {
        return !(this instanceof Unknown);
    }

    /**
     * Orders chains by wire value.
     */
    @Override
    default int compareTo(final Chain other) {
        return Integer.compare(toU16(), other.toU16());
    }

    /**
     * Sentinel for "no specific chain". Wire value {@code 0}.
     */
    record Any() implements Chain {
        static final int VALUE = 0;
        static final String NAME = "Any";

        @Override
        public int toU16() {
            return VALUE;
        }

        @Override
        public String toString() {
            return NAME;
        }
    }

    /**
     * Solana. Wire value {@code 1}.
     */
    record Solana() implements Chain {
        static final int VALUE = 1;
        static final String NAME = "Solana";

        @Override
        public int toU16() {
            return VALUE;
        }

        @Override
        public String toString() {
            return NAME;
        }
    }

    /**
     * A chain without a named variant, carrying its raw wire value.
     *
     * <p>Values {@code 0} and {@code 1} are rejected: they belong to {@link Any} and
     * {@link Solana}. Use {@link Chain#fromU16(int)} to decode arbitrary values.
     *
     * @param value wire value in {@code 2..65535}
     */
    record Unknown(int value) implements Chain {
        static final String NAME = "Unknown";
        static final Pattern SEGMENT_SEPARATORS = Pattern.compile("[()]");

        public Unknown {
            Uint16.requireInRange(value, "chain");
            if (value == Any.VALUE || value == Solana.VALUE) {
                throw new IllegalArgumentException(
                        "chain " + value + " has a named variant; use Chain.fromU16");
            }
        }

        @Override
        public int toU16() {
            return value;
        }

        @Override
        public String toString() {
            return NAME + "(" + value + ")";
        }
    }

    private static boolean asciiEqualsIgnoreCase(final String text, final String keyword) {
        if (text.length() != keyword.length()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (toAsciiLower(text.charAt(i)) != toAsciiLower(keyword.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static char toAsciiLower(final char c) {
        return c >= 'A' && c <= 'Z' ? (char) (c + ('a' - 'A')) : c;
    }

    /**
     * Returns the value of an optionally {@code +}-signed ASCII decimal, or -1 if the text is
     * not one or exceeds 16 bits.
     */
    private static int parseDecimalU16(final String digits) {
        final int start = digits.startsWith("+") ? 1 : 0;
        if (digits.length() == start) {
            return -1;
        }
        int value = 0;
        for (int i = start; i < digits.length(); i++) {
            final char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
            if (value > Uint16.MAX_VALUE) {
                return -1;
            }
        }
        return value;
    }
}
