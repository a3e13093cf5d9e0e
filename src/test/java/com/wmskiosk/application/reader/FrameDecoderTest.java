package com.wmskiosk.application.reader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.wmskiosk.support.FakeCardReaderDevice.report;
import static org.junit.jupiter.api.Assertions.*;

final class FrameDecoderTest {

    private FrameDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new FrameDecoder();
    }

    @Test
    void tokenSplitAcrossTwoReportsIsEmittedOnce() {
        assertTrue(decoder.feed(report("12345")).isEmpty());
        assertEquals("12345", decoder.pending());

        List<String> tokens = decoder.feed(report("67890\r"));

        assertEquals(List.of("1234567890"), tokens);
        assertEquals("", decoder.pending());
    }

    @Test
    void allZeroReportIsIgnoredAndKeepsPendingSegment() {
        decoder.feed(report("ABC"));

        assertTrue(decoder.feed(new byte[64]).isEmpty());
        assertTrue(decoder.feed(new byte[0]).isEmpty());
        assertTrue(decoder.feed(null).isEmpty());
        assertEquals("ABC", decoder.pending());
    }

    @Test
    void nonPrintableBytesAreDropped() {
        byte[] raw = { 0x02, 'A', 'B', 'C', 0x1B, '1', '2', '3', 0x03, (byte) 0xFF, '\r' };

        assertEquals(List.of("ABC123"), decoder.feed(raw));
    }

    @Test
    void segmentShorterThanMinimumIsDiscarded() {
        assertTrue(decoder.feed(report("12345\r")).isEmpty());
        assertEquals("", decoder.pending());
    }

    @Test
    void minimumLengthIsConfigurable() {
        FrameDecoder shortTokens = new FrameDecoder(3);

        assertEquals(List.of("ABC"), shortTokens.feed(report("ABC\n")));
    }

    @Test
    void segmentIsTrimmedBeforeLengthCheck() {
        assertEquals(List.of("ABC123"), decoder.feed(report("   ABC123  \n")));
        assertTrue(decoder.feed(report("  12   \r")).isEmpty());
    }

    @Test
    void crLfPairProducesSingleToken() {
        assertEquals(List.of("CARD0001"), decoder.feed(report("CARD0001\r\n")));
    }

    @Test
    void severalTokensInOneReportKeepTheirOrder() {
        assertEquals(List.of("CARD0001", "CARD0002"), decoder.feed(report("CARD0001\rCARD0002\r")));
    }

    @Test
    void unterminatedOverflowIsDiscarded() {
        StringBuilder noise = new StringBuilder();
        for (int i = 0; i < FrameDecoder.MAX_BUFFER_LENGTH + 10; i++) {
            noise.append('X');
        }

        assertTrue(decoder.feed(report(noise.toString())).isEmpty());
        assertEquals("", decoder.pending());

        assertEquals(List.of("ABC123"), decoder.feed(report("ABC123\r")));
    }

    @Test
    void resetDropsPendingSegment() {
        decoder.feed(report("ABC"));
        decoder.reset();

        assertEquals(List.of("123456"), decoder.feed(report("123456\r")));
    }

    @Test
    void rejectsNonPositiveMinimumLength() {
        assertThrows(IllegalArgumentException.class, () -> new FrameDecoder(0));
    }
}
