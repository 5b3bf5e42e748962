// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core.chain;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Writes a {@link Chain} as a bare JSON number equal to {@link Chain#toU16()}.
 *
 * <p>{@code Chain.SOLANA} serializes as {@code 1}; there is no tag or wrapper object.
 *
 * @see ChainJsonDeserializer
 */
public final class ChainJsonSerializer extends StdSerializer<Chain> {

    private static final long serialVersionUID = 1L;

    public ChainJsonSerializer() {
        super(Chain.class);
    }

    @Override
    public void serialize(final Chain value, final JsonGenerator gen, final SerializerProvider provider)
            throws IOException {
        gen.writeNumber(value.toU16());
    }
}
