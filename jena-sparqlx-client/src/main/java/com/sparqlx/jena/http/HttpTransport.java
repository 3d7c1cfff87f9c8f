package com.sparqlx.jena.http;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;

/**
 * The HTTP capability the client sends requests through.
 *
 * <p>Implementations deliver requests and report the status as received;
 * deciding that a non-2xx status is an error is left to the caller.
 * Timeouts, pooling and TLS are the implementation's concern.</p>
 */
public interface HttpTransport extends Closeable {

    /**
     * Send a request and buffer the whole response.
     *
     * @param request the request
     * @return the response
     * @throws com.sparqlx.jena.SparqlTransportException if the request
     *     cannot be delivered
     */
    SparqlResponse send(SparqlRequest request);

    /**
     * Send a request without blocking the calling thread.
     *
     * @param request the request
     * @return a future completing with the response, or exceptionally
     *     with a {@link com.sparqlx.jena.SparqlTransportException}
     */
    CompletableFuture<SparqlResponse> sendAsync(SparqlRequest request);

    /**
     * Send a request and return as soon as the headers arrive. The caller
     * must close the returned response.
     *
     * @param request the request
     * @return the unread response
     * @throws com.sparqlx.jena.SparqlTransportException if the request
     *     cannot be delivered
     */
    StreamingResponse stream(SparqlRequest request);

    /**
     * Send a request without blocking, completing once the headers
     * arrive. The caller must close the response the future completes
     * with.
     *
     * @param request the request
     * @return a future completing with the unread response, or
     *     exceptionally with a
     *     {@link com.sparqlx.jena.SparqlTransportException}
     */
    CompletableFuture<StreamingResponse> streamAsync(SparqlRequest request);

    /**
     * Whether the transport can still send requests.
     *
     * @return true until {@link #close()} has been called
     */
    boolean isOpen();

    /**
     * Release the transport's resources. Idempotent.
     */
    @Override
    void close();
}
