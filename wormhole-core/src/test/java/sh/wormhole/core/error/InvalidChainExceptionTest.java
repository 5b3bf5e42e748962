// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.wormhole.core.chain.Chain;

class InvalidChainExceptionTest {

    @Test
    void keepsInputVerbatim() {
        InvalidChainException ex = new InvalidChainException("  Solna(");
        assertEquals("  Solna(", ex.input());
        assertEquals("invalid chain:   Solna(", ex.getMessage());
    }

    @Test
    void isWormholeRuntimeException() {
        WormholeException ex = assertThrows(WormholeException.class, () -> Chain.parse("Unknown()"));
        assertInstanceOf(InvalidChainException.class, ex);
        assertInstanceOf(RuntimeException.class, ex);
    }
}
