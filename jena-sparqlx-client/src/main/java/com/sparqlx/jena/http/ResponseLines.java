package com.sparqlx.jena.http;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;

/**
 * Iterates over a streamed response body line by line. Line terminators
 * are not included.
 *
 * <p>The body is decoded with the Content-Type charset, UTF-8 when the
 * response names none.</p>
 */
public final class ResponseLines extends ResponseStream<String> {
    /** Line reader over the body. */
    private final BufferedReader reader;

    /**
     * Create a line iterator.
     *
     * @param response the response to read; closed by this iterator
     */
    public ResponseLines(final StreamingResponse response) {
        super(response);
        this.reader = new BufferedReader(
            new InputStreamReader(response.body(), bodyCharset()));
    }

    @Override
    protected String readNext() throws IOException {
        return reader.readLine();
    }
}
