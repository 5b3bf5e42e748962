// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.wormhole.core.chain;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.wormhole.core.WormholeDebug;

class ChainCodecTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.wormhole.debug");

    @AfterEach
    void reset() {
        WormholeDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void encodesBigEndian() {
        assertArrayEquals(new byte[] {0x00, 0x00}, ChainCodec.encode(Chain.ANY));
        assertArrayEquals(new byte[] {0x00, 0x01}, ChainCodec.encode(Chain.SOLANA));
        assertArrayEquals(new byte[] {0x01, 0x02}, ChainCodec.encode(Chain.fromU16(258)));
        assertArrayEquals(new byte[] {(byte) 0xFF, (byte) 0xFF}, ChainCodec.encode(Chain.fromU16(65535)));
    }

    @Test
    void decodesBigEndian() {
        assertEquals(Chain.SOLANA, ChainCodec.decode(new byte[] {0x00, 0x01}));
        assertEquals(new Chain.Unknown(256), ChainCodec.decode(new byte[] {0x01, 0x00}));
        assertEquals(new Chain.Unknown(0x8000), ChainCodec.decode(new byte[] {(byte) 0x80, 0x00}));
    }

    @Test
    void roundTripsOverFullRange() {
        for (int i = 0; i <= 0xFFFF; i++) {
            Chain chain = Chain.fromU16(i);
            assertEquals(chain, ChainCodec.decode(ChainCodec.encode(chain)));
        }
    }

    @Test
    void readsAndWritesAtOffset() {
        byte[] frame = new byte[6];
        ChainCodec.encodeTo(Chain.SOLANA, frame, 0);
        ChainCodec.encodeTo(Chain.fromU16(4), frame, 4);
        assertArrayEquals(new byte[] {0x00, 0x01, 0x00, 0x00, 0x00, 0x04}, frame);

        assertEquals(Chain.SOLANA, ChainCodec.decode(frame, 0));
        assertEquals(Chain.ANY, ChainCodec.decode(frame, 2));
        assertEquals(Chain.fromU16(4), ChainCodec.decode(frame, 4));
    }

    @Test
    void rejectsShortOrMisizedBuffers() {
        assertThrows(IllegalArgumentException.class, () -> ChainCodec.decode(new byte[] {0x01}));
        assertThrows(IllegalArgumentException.class, () -> ChainCodec.decode(new byte[] {0x00, 0x01, 0x02}));
        assertThrows(IllegalArgumentException.class, () -> ChainCodec.decode(null));
        assertThrows(IllegalArgumentException.class, () -> ChainCodec.decode(new byte[3], 2));
        assertThrows(IllegalArgumentException.class, () -> ChainCodec.encodeTo(Chain.SOLANA, new byte[2], 1));
        assertThrows(NullPointerException.class, () -> ChainCodec.encodeTo(null, new byte[2], 0));
    }

    @Test
    void hexForm() {
        assertEquals("0x0000", ChainCodec.toHex(Chain.ANY));
        assertEquals("0x0001", ChainCodec.toHex(Chain.SOLANA));
        assertEquals("0x002a", ChainCodec.toHex(Chain.fromU16(42)));
        assertEquals(Chain.SOLANA, ChainCodec.fromHex("0x0001"));
        assertEquals(Chain.fromU16(42), ChainCodec.fromHex("002A"));
        assertThrows(IllegalArgumentException.class, () -> ChainCodec.fromHex("0x01"));
        assertThrows(IllegalArgumentException.class, () -> ChainCodec.fromHex("0x0g01"));
    }

    @Test
    void logsDecodesOnlyWhenCodecLoggingEnabled() {
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);

        ChainCodec.decode(new byte[] {0x00, 0x2A});
        assertTrue(appender.list.isEmpty());

        WormholeDebug.setCodecLogging(true);
        ChainCodec.decode(new byte[] {0x00, 0x00, 0x00, 0x2A}, 2);

        assertEquals(1, appender.list.size());
        assertEquals("[CHAIN-DECODE] offset=2 chain=Unknown(42)", appender.list.get(0).getFormattedMessage());
    }
}
