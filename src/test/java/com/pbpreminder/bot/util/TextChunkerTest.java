package com.pbpreminder.bot.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextChunkerTest {

    @Test
    void shortTextIsOneChunk() {
        assertEquals(List.of("hello"), TextChunker.splitByLines("hello", 10));
        assertTrue(TextChunker.splitByLines(null, 10).isEmpty());
    }

    @Test
    void splitsOnLineBreaks() {
        List<String> chunks = TextChunker.splitByLines("aaaa\nbbbb\ncccc", 10);
        assertEquals(List.of("aaaa\nbbbb", "cccc"), chunks);
        for (String c : chunks) assertTrue(c.length() <= 10);
    }

    @Test
    void overlongLineIsCutHard() {
        List<String> chunks = TextChunker.splitByLines("x\n" + "y".repeat(25), 10);
        assertEquals(List.of("x", "yyyyyyyyyy", "yyyyyyyyyy", "yyyyy"), chunks);
    }

    @Test
    void htmlEscaping() {
        assertEquals("a &lt;b&gt; &amp; c", Html.esc("a <b> & c"));
        assertEquals("", Html.esc(null));
        assertEquals("<s>x</s>", Html.strike("x"));
    }
}
