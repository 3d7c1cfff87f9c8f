package com.sparqlx.jena;

/**
 * Thrown when a request cannot be delivered: connection failures, I/O
 * errors while reading the response, or interruption of the calling
 * thread.
 */
public class SparqlTransportException extends SparqlClientException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception with a detail message and cause.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public SparqlTransportException(final String message,
                                    final Throwable cause) {
        super(message, cause);
    }
}
