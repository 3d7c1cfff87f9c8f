package com.sparqlx.jena.convert;

import com.sparqlx.jena.SparqlClientException;

/**
 * Root of the payload-shape errors: the endpoint answered successfully but
 * with something the converters cannot interpret.
 */
public class ResultConversionException extends SparqlClientException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public ResultConversionException(final String message) {
        super(message);
    }

    /**
     * Constructs a new exception with a detail message and cause.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public ResultConversionException(final String message,
                                     final Throwable cause) {
        super(message, cause);
    }
}
