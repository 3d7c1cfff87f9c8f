package com.sparqlx.jena.query;

import com.sparqlx.jena.QueryParseException;
import com.sparqlx.jena.UnsupportedQueryTypeException;
import com.sparqlx.jena.UpdateParseException;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryException;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.update.UpdateFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the form of a query, either from a caller-supplied tag or by
 * parsing the text with the Jena SPARQL grammar, and checks update
 * syntax.
 */
public final class QueryClassifier {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QueryClassifier.class);

    private QueryClassifier() {
        throw new AssertionError("No instances");
    }

    /**
     * Parse query text and return its form.
     *
     * @param text the query text
     * @return the query form
     * @throws QueryParseException if the text is not valid SPARQL
     * @throws UnsupportedQueryTypeException if the parsed form is not one
     *     of the four supported
     */
    public static QueryType classify(final String text) {
        Query query;
        try {
            query = QueryFactory.create(text);
        } catch (QueryException e) {
            throw new QueryParseException(e.getMessage(), e);
        }
        QueryType type = switch (query.queryType()) {
            case SELECT -> QueryType.SELECT;
            case ASK -> QueryType.ASK;
            case CONSTRUCT -> QueryType.CONSTRUCT;
            case DESCRIBE -> QueryType.DESCRIBE;
            default -> throw new UnsupportedQueryTypeException(
                query.queryType().name());
        };
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Classified query as {}", type);
        }
        return type;
    }

    /**
     * Tag untyped query text.
     *
     * @param text the query text
     * @param parse whether parsing is allowed
     * @return the tagged query
     * @throws IllegalArgumentException if parsing is disabled, since the
     *     form cannot then be known
     * @throws QueryParseException if the text is not valid SPARQL
     */
    public static SparqlQuery resolve(final String text, final boolean parse) {
        if (!parse) {
            throw new IllegalArgumentException(
                "Query parsing is disabled: pass a typed SparqlQuery "
                    + "(SparqlQuery.select(...), ask, construct or describe)");
        }
        return new SparqlQuery(text, classify(text));
    }

    /**
     * Return a tagged query as is. The tag is trusted whatever the parse
     * setting.
     *
     * @param query the tagged query
     * @param parse ignored for tagged queries
     * @return the same query
     */
    public static SparqlQuery resolve(final SparqlQuery query,
                                      final boolean parse) {
        return query;
    }

    /**
     * Check update request syntax.
     *
     * @param text the update request text
     * @throws UpdateParseException if the text is not a valid SPARQL
     *     update request
     */
    public static void validateUpdate(final String text) {
        try {
            UpdateFactory.create(text);
        } catch (QueryException e) {
            throw new UpdateParseException(e.getMessage(), e);
        }
    }
}
