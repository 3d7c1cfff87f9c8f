package com.sparqlx.jena.query;

import java.util.Map;
import java.util.Set;

/**
 * Response format aliases and their MIME types.
 *
 * <p>Short names and full MIME types are interchangeable: a name that is
 * not an alias is used verbatim as the MIME type.</p>
 */
public final class ResponseFormats {
    /** SPARQL JSON results MIME type. */
    public static final String SPARQL_RESULTS_JSON =
        "application/sparql-results+json";
    /** Turtle MIME type. */
    public static final String TURTLE = "text/turtle";

    /** Default alias for SELECT and ASK. */
    public static final String DEFAULT_BINDINGS_FORMAT = "json";
    /** Default alias for CONSTRUCT and DESCRIBE. */
    public static final String DEFAULT_GRAPH_FORMAT = "turtle";

    /** Aliases for results-document formats. */
    private static final Map<String, String> BINDINGS_FORMATS = Map.of(
        "json", SPARQL_RESULTS_JSON,
        "xml", "application/sparql-results+xml",
        "csv", "text/csv",
        "tsv", "text/tab-separated-values");

    /** Aliases for graph formats. */
    private static final Map<String, String> GRAPH_FORMATS = Map.of(
        "turtle", TURTLE,
        "xml", "application/rdf+xml",
        "ntriples", "application/n-triples",
        "json-ld", "application/ld+json");

    /** MIME types the binding-set and ASK converters read. */
    private static final Set<String> JSON_TYPES = Set.of(
        "application/json", SPARQL_RESULTS_JSON);

    private ResponseFormats() {
        throw new AssertionError("No instances");
    }

    /**
     * Resolve a results-document format.
     *
     * @param format an alias, a MIME type, or null for the default
     * @return the MIME type
     */
    public static String bindingsMimeType(final String format) {
        return lookup(BINDINGS_FORMATS,
            format == null ? DEFAULT_BINDINGS_FORMAT : format);
    }

    /**
     * Resolve a graph format.
     *
     * @param format an alias, a MIME type, or null for the default
     * @return the MIME type
     */
    public static String graphMimeType(final String format) {
        return lookup(GRAPH_FORMATS,
            format == null ? DEFAULT_GRAPH_FORMAT : format);
    }

    /**
     * Resolve a format for a query form.
     *
     * @param type the query form
     * @param format an alias, a MIME type, or null for the default
     * @return the MIME type
     */
    public static String mimeType(final QueryType type, final String format) {
        return type.returnsResultsDocument()
            ? bindingsMimeType(format) : graphMimeType(format);
    }

    /**
     * Whether the converters can read a results document of this type.
     *
     * @param mimeType the resolved MIME type
     * @return true for the two JSON variants
     */
    public static boolean isJson(final String mimeType) {
        return JSON_TYPES.contains(mimeType);
    }

    private static String lookup(final Map<String, String> aliases,
                                 final String format) {
        return aliases.getOrDefault(format, format);
    }
}
