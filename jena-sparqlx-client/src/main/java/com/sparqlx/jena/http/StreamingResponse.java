package com.sparqlx.jena.http;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * An HTTP response whose body has not been read yet. The connection stays
 * open until {@link #close()} is called.
 */
public final class StreamingResponse implements Closeable {
    /** HTTP status code. */
    private final int statusCode;
    /** URL the request was sent to. */
    private final String url;
    /** Response headers. */
    private final HttpHeaders headers;
    /** Unread response body. */
    private final InputStream body;

    /**
     * Create a streaming response.
     *
     * @param statusCode the HTTP status code
     * @param url the request URL
     * @param headers the response headers
     * @param body the unread body; closed by {@link #close()}
     */
    public StreamingResponse(final int statusCode,
                             final String url,
                             final HttpHeaders headers,
                             final InputStream body) {
        this.statusCode = statusCode;
        this.url = url;
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = Objects.requireNonNull(body, "body");
    }

    /**
     * Returns the HTTP status code.
     *
     * @return the status code
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * Whether the status code is in the 2xx range.
     *
     * @return true for success
     */
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Returns the request URL.
     *
     * @return the URL
     */
    public String url() {
        return url;
    }

    /**
     * Returns the response headers.
     *
     * @return the headers
     */
    public HttpHeaders headers() {
        return headers;
    }

    /**
     * Returns the unread body.
     *
     * @return the body stream
     */
    public InputStream body() {
        return body;
    }

    /**
     * Releases the connection by closing the body stream.
     *
     * @throws IOException if closing fails
     */
    @Override
    public void close() throws IOException {
        body.close();
    }
}
