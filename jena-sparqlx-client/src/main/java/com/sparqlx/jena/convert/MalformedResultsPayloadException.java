package com.sparqlx.jena.convert;

/**
 * Thrown when a SELECT response is not JSON or lacks the
 * {@code head.vars} / {@code results.bindings} structure.
 */
public class MalformedResultsPayloadException extends ResultConversionException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public MalformedResultsPayloadException(final String message) {
        super(message);
    }

    /**
     * Constructs a new exception with a detail message and cause.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public MalformedResultsPayloadException(final String message,
                                            final Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates the exception for a missing or mistyped field.
     *
     * @param field the dotted path of the field, e.g. {@code head.vars}
     * @return the exception
     */
    static MalformedResultsPayloadException missingField(final String field) {
        return new MalformedResultsPayloadException(
            "SPARQL JSON results missing '" + field + "'");
    }
}
