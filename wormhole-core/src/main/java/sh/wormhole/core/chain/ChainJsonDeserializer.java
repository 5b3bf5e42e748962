// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core.chain;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import sh.wormhole.primitives.Uint16;

/**
 * Reads a {@link Chain} from a JSON integer via {@link Chain#fromU16(int)}.
 *
 * <p>Only integer tokens in {@code 0..65535} are accepted. Strings, floats and other
 * tokens are reported through the {@link DeserializationContext}, which raises a
 * {@link com.fasterxml.jackson.databind.exc.MismatchedInputException} unless a
 * problem handler is registered. JSON {@code null} yields {@code null}.
 *
 * @see ChainJsonSerializer
 */
public final class ChainJsonDeserializer extends StdDeserializer<Chain> {

    private static final long serialVersionUID = 1L;

    public ChainJsonDeserializer() {
        super(Chain.class);
    }

    @Override
    public Chain deserialize(final JsonParser p, final DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_NUMBER_INT) {
            return (Chain) ctxt.handleUnexpectedToken(Chain.class, p);
        }
        if (p.getNumberType() != JsonParser.NumberType.INT || !Uint16.isInRange(p.getIntValue())) {
            return (Chain) ctxt.handleWeirdNumberValue(Chain.class, p.getNumberValue(),
                    "chain must be in range 0-%d", Uint16.MAX_VALUE);
        }
        return Chain.fromU16(p.getIntValue());
    }
}
