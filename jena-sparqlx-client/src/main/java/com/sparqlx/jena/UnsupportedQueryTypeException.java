package com.sparqlx.jena;

/**
 * Thrown when a parsed query has a form other than SELECT, ASK, CONSTRUCT
 * or DESCRIBE. Valid SPARQL never reaches this.
 */
public class UnsupportedQueryTypeException extends SparqlClientException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception for the given query form.
     *
     * @param queryForm the name of the unsupported form
     */
    public UnsupportedQueryTypeException(final String queryForm) {
        super("Unsupported query type: " + queryForm);
    }
}
