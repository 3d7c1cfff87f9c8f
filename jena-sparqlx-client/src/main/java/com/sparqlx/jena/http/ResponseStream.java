package com.sparqlx.jena.http;

import com.sparqlx.jena.SparqlTransportException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Iterates over a streamed response body, one item at a time.
 *
 * <p>The connection is released when the body is exhausted, when reading
 * fails, or when {@link #close()} is called, whichever happens first.
 * Callers that stop early must close, ideally with try-with-resources:</p>
 * <pre>{@code
 * try (ResponseLines lines = client.queryLines(query)) {
 *     while (lines.hasNext()) {
 *         handle(lines.next());
 *     }
 * }
 * }</pre>
 *
 * @param <T> the item type
 */
public abstract class ResponseStream<T> implements Iterator<T>, AutoCloseable {
    /** The response being read. */
    private final StreamingResponse response;
    /** Item read ahead by hasNext(), or null. */
    private T pending;
    /** Whether the stream has been released. */
    private boolean closed;

    /**
     * Create an iterator over a response.
     *
     * @param streamingResponse the response to read; closed by this iterator
     */
    protected ResponseStream(final StreamingResponse streamingResponse) {
        this.response = Objects.requireNonNull(streamingResponse, "response");
    }

    /**
     * Returns the response headers.
     *
     * @return the headers
     */
    public HttpHeaders headers() {
        return response.headers();
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        pending = readOrClose();
        if (pending == null) {
            close();
            return false;
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T item = pending;
        pending = null;
        return item;
    }

    /**
     * Whether the underlying connection has been released.
     *
     * @return true once closed or exhausted
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Release the connection. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pending = null;
        try {
            response.close();
        } catch (IOException e) {
            throw new UncheckedIOException(
                "Failed to release streamed response", e);
        }
    }

    /**
     * Returns the response being read.
     *
     * @return the response
     */
    protected final StreamingResponse response() {
        return response;
    }

    /**
     * Returns the charset of a text body: the Content-Type charset, or
     * UTF-8 when none is named.
     *
     * @return the charset
     */
    protected final Charset bodyCharset() {
        return HttpHeaders.charset(response.headers().first("Content-Type"),
            StandardCharsets.UTF_8);
    }

    /**
     * Read the next item from the body.
     *
     * @return the item, or null once the body is exhausted
     * @throws IOException if reading fails
     */
    protected abstract T readNext() throws IOException;

    /**
     * Reject non-positive chunk sizes.
     *
     * @param chunkSize the requested size
     * @return the size
     */
    static int checkChunkSize(final int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException(
                "Chunk size must be positive: " + chunkSize);
        }
        return chunkSize;
    }

    private T readOrClose() {
        try {
            return readNext();
        } catch (IOException e) {
            SparqlTransportException failure = new SparqlTransportException(
                "Failed reading streamed response from " + response.url(), e);
            try {
                close();
            } catch (UncheckedIOException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
    }
}
