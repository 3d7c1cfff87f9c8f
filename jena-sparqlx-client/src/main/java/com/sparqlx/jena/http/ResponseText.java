package com.sparqlx.jena.http;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;

/**
 * Iterates over a streamed response body as decoded text chunks of at most
 * a fixed number of characters.
 *
 * <p>The body is decoded with the Content-Type charset, UTF-8 when the
 * response names none.</p>
 */
public final class ResponseText extends ResponseStream<String> {
    /** Maximum chunk length in characters. */
    private final int chunkSize;
    /** Decoder over the body. */
    private final Reader reader;

    /**
     * Create a text chunk iterator.
     *
     * @param response the response to read; closed by this iterator
     * @param chunkSize the maximum chunk length, positive
     */
    public ResponseText(final StreamingResponse response,
                        final int chunkSize) {
        super(response);
        this.chunkSize = checkChunkSize(chunkSize);
        this.reader = new InputStreamReader(response.body(), bodyCharset());
    }

    @Override
    protected String readNext() throws IOException {
        char[] buffer = new char[chunkSize];
        int filled = 0;
        while (filled < chunkSize) {
            int read = reader.read(buffer, filled, chunkSize - filled);
            if (read < 0) {
                break;
            }
            filled += read;
        }
        return filled == 0 ? null : new String(buffer, 0, filled);
    }
}
