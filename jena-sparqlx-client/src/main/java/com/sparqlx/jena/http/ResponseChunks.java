package com.sparqlx.jena.http;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * Iterates over a streamed response body in byte chunks of at most a
 * fixed size. Every chunk but the last is full.
 */
public final class ResponseChunks extends ResponseStream<byte[]> {
    /** Default chunk size in bytes. */
    public static final int DEFAULT_CHUNK_SIZE = 8192;

    /** Maximum chunk size. */
    private final int chunkSize;

    /**
     * Create a chunk iterator.
     *
     * @param response the response to read; closed by this iterator
     * @param chunkSize the maximum chunk size, positive
     */
    public ResponseChunks(final StreamingResponse response,
                          final int chunkSize) {
        super(response);
        this.chunkSize = checkChunkSize(chunkSize);
    }

    @Override
    protected byte[] readNext() throws IOException {
        InputStream body = response().body();
        byte[] buffer = new byte[chunkSize];
        int filled = 0;
        while (filled < chunkSize) {
            int read = body.read(buffer, filled, chunkSize - filled);
            if (read < 0) {
                break;
            }
            filled += read;
        }
        if (filled == 0) {
            return null;
        }
        return filled == chunkSize ? buffer : Arrays.copyOf(buffer, filled);
    }
}
