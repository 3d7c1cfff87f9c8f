package com.sparqlx.jena.query;

/**
 * The SPARQL query forms this client sends.
 */
public enum QueryType {
    /** SELECT, answered with a binding set. */
    SELECT,
    /** ASK, answered with a boolean. */
    ASK,
    /** CONSTRUCT, answered with a graph. */
    CONSTRUCT,
    /** DESCRIBE, answered with a graph. */
    DESCRIBE;

    /**
     * Whether the answer is a SPARQL results document rather than an RDF
     * graph.
     *
     * @return true for SELECT and ASK
     */
    public boolean returnsResultsDocument() {
        return switch (this) {
            case SELECT, ASK -> true;
            case CONSTRUCT, DESCRIBE -> false;
        };
    }
}
