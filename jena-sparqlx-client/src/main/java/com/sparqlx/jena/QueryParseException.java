package com.sparqlx.jena;

/**
 * Thrown when SPARQL query text cannot be parsed.
 *
 * <p>The Jena parser diagnostic is carried both in the message and as the
 * cause.</p>
 */
public class QueryParseException extends SparqlClientException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception wrapping the parser failure.
     *
     * @param diagnostic the parser diagnostic
     * @param cause the parser exception
     */
    public QueryParseException(final String diagnostic,
                               final Throwable cause) {
        super("Invalid SPARQL query: " + diagnostic, cause);
    }
}
