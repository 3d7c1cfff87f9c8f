package com.sparqlx.jena.http;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResponseText.
 */
public class ResponseTextTest {

    /** Stream that records whether it was closed. */
    private static final class TrackingStream extends FilterInputStream {
        private boolean closed;

        TrackingStream(final byte[] data) {
            super(new ByteArrayInputStream(data));
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }

    private static StreamingResponse response(final String contentType,
                                              final byte[] body) {
        return new StreamingResponse(200, "http://ex/q",
            new HttpHeaders(Map.of("Content-Type", List.of(contentType))),
            new TrackingStream(body));
    }

    @Test
    @DisplayName("Test text is split into chunks of characters, not bytes")
    public void testChunksByCharacter() {
        byte[] body = "ééééé"
            .getBytes(StandardCharsets.UTF_8);
        List<String> chunks = new ArrayList<>();

        try (ResponseText text = new ResponseText(
                response("application/sparql-results+json", body), 2)) {
            text.forEachRemaining(chunks::add);
        }

        assertEquals(List.of("éé", "éé", "é"), chunks);
    }

    @Test
    @DisplayName("Test the Content-Type charset is used to decode")
    public void testCharset() {
        byte[] body = "naïve".getBytes(StandardCharsets.UTF_16BE);
        try (ResponseText text = new ResponseText(
                response("text/plain; charset=UTF-16BE", body), 64)) {
            assertEquals("naïve", text.next());
            assertFalse(text.hasNext());
        }
    }

    @Test
    @DisplayName("Test an unknown charset falls back to UTF-8")
    public void testUnknownCharset() {
        byte[] body = "ok".getBytes(StandardCharsets.UTF_8);
        try (ResponseText text = new ResponseText(
                response("text/plain; charset=x-no-such-charset", body), 8)) {
            assertEquals("ok", text.next());
        }
    }

    @Test
    @DisplayName("Test closing after the first chunk releases the stream")
    public void testEarlyClose() {
        TrackingStream body = new TrackingStream(
            "abcdefghij".getBytes(StandardCharsets.UTF_8));
        ResponseText text = new ResponseText(new StreamingResponse(200,
            "http://ex/q", new HttpHeaders(Map.of()), body), 3);

        assertEquals("abc", text.next());
        text.close();

        assertTrue(body.closed);
        assertTrue(text.isClosed());
        assertFalse(text.hasNext());
    }

    @Test
    @DisplayName("Test non-positive chunk size is rejected")
    public void testInvalidChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseText(
            response("text/plain", new byte[0]), -1));
    }
}
