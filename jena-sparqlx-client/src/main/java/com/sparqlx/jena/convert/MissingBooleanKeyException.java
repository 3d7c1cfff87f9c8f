package com.sparqlx.jena.convert;

/**
 * Thrown when an ASK response is JSON but has no {@code boolean} field.
 */
public class MissingBooleanKeyException extends ResultConversionException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /** Constructs a new exception. */
    public MissingBooleanKeyException() {
        super("ASK response missing 'boolean' key");
    }
}
