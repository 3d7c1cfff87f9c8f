package com.sparqlx.jena;

/**
 * Root of all errors raised by the SPARQL protocol client.
 *
 * <p>Every failure propagates to the caller unchanged; the client never
 * retries internally and never substitutes a default value.</p>
 */
public class SparqlClientException extends RuntimeException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public SparqlClientException(final String message) {
        super(message);
    }

    /**
     * Constructs a new exception with a detail message and cause.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public SparqlClientException(final String message,
                                 final Throwable cause) {
        super(message, cause);
    }
}
