package com.sparqlx.jena.convert;

/**
 * Thrown when an ASK response body is not JSON, or its {@code boolean}
 * field does not hold a JSON boolean.
 */
public class MalformedAskPayloadException extends ResultConversionException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception wrapping the JSON parse failure.
     *
     * @param cause the JSON parse failure
     */
    public MalformedAskPayloadException(final Throwable cause) {
        super("Expected JSON response for ASK query", cause);
    }

    /**
     * Constructs a new exception with a detail message.
     *
     * @param message the detail message
     */
    public MalformedAskPayloadException(final String message) {
        super(message);
    }
}
