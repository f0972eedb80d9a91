package com.nginx.log.files;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class LogLineReaderTest {

    private static LogLineReader reader(String content, int maxLineLength) {
        return new LogLineReader(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), maxLineLength,
                "test.log", content.length(), false, false);
    }

    @Test
    public void testReadsLinesAndCountsBytes() throws Exception {
        LogLineReader reader = new LogLineReader(new ByteArrayInputStream("first\r\nsecond\n\nlast".getBytes(StandardCharsets.UTF_8)));

        assertEquals("first", reader.readLine());
        assertEquals(7, reader.getBytesConsumed());
        assertEquals("second", reader.readLine());
        assertEquals("", reader.readLine());
        assertEquals("last", reader.readLine());
        assertNull(reader.readLine());
        assertEquals(19, reader.getBytesConsumed());
    }

    @Test
    public void testOverlongLineIsSkipped() throws Exception {
        LogLineReader reader = reader("short\n0123456789abcdef\nnext\n", 10);

        assertEquals("short", reader.readLine());
        assertEquals("next", reader.readLine());
        assertNull(reader.readLine());
        assertEquals(1, reader.getSkippedLines());
        assertEquals(28, reader.getBytesConsumed());
    }

    @Test
    public void testLinesSpanningBufferBoundary() throws Exception {
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < 20000; i++) {
            content.append("line-").append(i).append('\n');
        }
        LogLineReader reader = reader(content.toString(), LogLineReader.DEFAULT_MAX_LINE_LENGTH);

        int count = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            assertEquals("line-" + count, line);
            count++;
        }
        assertEquals(20000, count);
        assertEquals(content.length(), reader.getBytesConsumed());
    }

    @Test
    public void testMultiByteCharacters() throws Exception {
        String content = "北京 GET /\n";
        LogLineReader reader = new LogLineReader(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));

        assertEquals("北京 GET /", reader.readLine());
        assertEquals(content.getBytes(StandardCharsets.UTF_8).length, reader.getBytesConsumed());
    }
}
