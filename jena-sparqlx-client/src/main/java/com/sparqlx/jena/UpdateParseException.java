package com.sparqlx.jena;

/**
 * Thrown when a SPARQL update request cannot be parsed.
 */
public class UpdateParseException extends SparqlClientException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception wrapping the parser failure.
     *
     * @param diagnostic the parser diagnostic
     * @param cause the parser exception
     */
    public UpdateParseException(final String diagnostic,
                                final Throwable cause) {
        super("Invalid SPARQL update request: " + diagnostic, cause);
    }
}
