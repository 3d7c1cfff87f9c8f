package com.sparqlx.jena.query;

import java.util.Objects;

/**
 * Query text tagged with its query form.
 *
 * <p>A tag supplied by the caller is trusted: the client does not parse
 * the text to check it.</p>
 *
 * @param text the SPARQL query text
 * @param type the query form
 */
public record SparqlQuery(String text, QueryType type) {

    /**
     * Validates the parts.
     *
     * @param text the query text
     * @param type the query form
     */
    public SparqlQuery {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Tag text as a SELECT query.
     *
     * @param text the query text
     * @return the tagged query
     */
    public static SparqlQuery select(final String text) {
        return new SparqlQuery(text, QueryType.SELECT);
    }

    /**
     * Tag text as an ASK query.
     *
     * @param text the query text
     * @return the tagged query
     */
    public static SparqlQuery ask(final String text) {
        return new SparqlQuery(text, QueryType.ASK);
    }

    /**
     * Tag text as a CONSTRUCT query.
     *
     * @param text the query text
     * @return the tagged query
     */
    public static SparqlQuery construct(final String text) {
        return new SparqlQuery(text, QueryType.CONSTRUCT);
    }

    /**
     * Tag text as a DESCRIBE query.
     *
     * @param text the query text
     * @return the tagged query
     */
    public static SparqlQuery describe(final String text) {
        return new SparqlQuery(text, QueryType.DESCRIBE);
    }
}
