package net;

import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class LineReaderTest {

    @Test
    void splitsOnNewlineAndDropsCarriageReturn() throws Exception {
        LineReader r = new LineReader(new StringReader("one\r\ntwo\n\nthree"));

        assertEquals("one", r.readLine());
        assertEquals("two", r.readLine());
        assertEquals("", r.readLine());
        assertEquals("three", r.readLine());
        assertNull(r.readLine());
    }

    @Test
    void emptyStreamEndsImmediately() throws Exception {
        assertNull(new LineReader(new StringReader("")).readLine());
    }

    @Test
    void lineAtTheCapIsAccepted() throws Exception {
        String exact = "x".repeat(16);
        LineReader r = new LineReader(new StringReader(exact + "\nnext\n"), 16);

        assertEquals(exact, r.readLine());
        assertEquals("next", r.readLine());
    }

    @Test
    void lineOverTheCapIsRefused() {
        LineReader r = new LineReader(new StringReader("x".repeat(17) + "\n"), 16);

        assertThrows(ProtocolException.class, r::readLine);
    }

    @Test
    void unterminatedFloodIsRefusedBeforeEndOfStream() {
        LineReader r = new LineReader(new StringReader("y".repeat(200_000)));

        assertThrows(ProtocolException.class, r::readLine);
    }

    @Test
    void longLinesSpanningBufferRefillsStayIntact() throws Exception {
        String big = "z".repeat(20_000);
        LineReader r = new LineReader(new StringReader(big + "\nend\n"));

        assertEquals(big, r.readLine());
        assertEquals("end", r.readLine());
    }
}
