package com.sparqlx.jena.http;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A fully buffered HTTP response from a SPARQL endpoint.
 */
public final class SparqlResponse {
    /** HTTP status code. */
    private final int statusCode;
    /** URL the request was sent to. */
    private final String url;
    /** Response headers. */
    private final HttpHeaders headers;
    /** Response body. */
    private final byte[] body;

    /**
     * Create a response.
     *
     * @param statusCode the HTTP status code
     * @param url the request URL
     * @param headers the response headers
     * @param body the response body; not copied
     */
    public SparqlResponse(final int statusCode,
                          final String url,
                          final HttpHeaders headers,
                          final byte[] body) {
        this.statusCode = statusCode;
        this.url = url;
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body == null ? new byte[0] : body;
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
     * Returns the raw Content-Type header.
     *
     * @return the content type, or null if absent
     */
    public String contentType() {
        return headers.first("Content-Type");
    }

    /**
     * Returns the Content-Type without parameters.
     *
     * @return the MIME type, or null if absent
     */
    public String mimeType() {
        return HttpHeaders.mimeType(contentType());
    }

    /**
     * Returns the response body. The array is shared, not copied.
     *
     * @return the body bytes
     */
    public byte[] body() {
        return body;
    }

    /**
     * Returns the body decoded as UTF-8.
     *
     * @return the body text
     */
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "SparqlResponse[" + statusCode + " " + url + ", "
            + body.length + " bytes]";
    }
}
