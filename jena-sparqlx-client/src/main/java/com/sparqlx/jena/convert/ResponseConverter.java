package com.sparqlx.jena.convert;

import com.sparqlx.jena.http.SparqlResponse;

/**
 * Converts a successful endpoint response into a {@link QueryResult}.
 *
 * <p>Converters are pure: they read only the response they are given and
 * hold no state between calls.</p>
 */
@FunctionalInterface
public interface ResponseConverter {

    /**
     * Convert a response.
     *
     * @param response the buffered response
     * @return the converted result
     * @throws ResultConversionException if the payload cannot be
     *     interpreted
     */
    QueryResult convert(SparqlResponse response);
}
