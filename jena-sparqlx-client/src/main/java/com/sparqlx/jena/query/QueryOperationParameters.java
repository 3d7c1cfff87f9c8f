package com.sparqlx.jena.query;

import com.sparqlx.jena.convert.AskConverter;
import com.sparqlx.jena.convert.BindingSetConverter;
import com.sparqlx.jena.convert.GraphConverter;
import com.sparqlx.jena.convert.ResponseConverter;
import java.util.Map;

/**
 * Everything needed to send one query and interpret its answer: the
 * response MIME type, request headers, form body and converter.
 *
 * <p>Built fresh for every call. Invalid combinations are rejected here,
 * before any request is made.</p>
 */
public final class QueryOperationParameters {
    /** Message for a non-JSON format combined with conversion. */
    public static final String JSON_REQUIRED_MESSAGE =
        "JSON response format required for convert=True on SELECT and "
            + "ASK query results.";

    /** The tagged query. */
    private final SparqlQuery query;
    /** Resolved response MIME type. */
    private final String mimeType;
    /** Form body. */
    private final ProtocolParameters body;
    /** Request headers. */
    private final Map<String, String> headers;

    private QueryOperationParameters(final SparqlQuery sparqlQuery,
                                     final String responseMimeType,
                                     final ProtocolParameters formBody) {
        this.query = sparqlQuery;
        this.mimeType = responseMimeType;
        this.body = formBody;
        this.headers = Map.of(
            "Accept", responseMimeType,
            "Content-Type", ProtocolParameters.FORM_CONTENT_TYPE);
    }

    /**
     * Derive the parameters for a query.
     *
     * @param query the tagged query
     * @param options the per-call options
     * @param convert whether the answer will be converted
     * @return the parameters
     * @throws IllegalArgumentException if conversion is requested for a
     *     SELECT or ASK query with a non-JSON response format
     */
    public static QueryOperationParameters create(final SparqlQuery query,
                                                  final QueryOptions options,
                                                  final boolean convert) {
        String mimeType = ResponseFormats.mimeType(query.type(),
            options.getResponseFormat());
        if (convert && query.type().returnsResultsDocument()
                && !ResponseFormats.isJson(mimeType)) {
            throw new IllegalArgumentException(JSON_REQUIRED_MESSAGE);
        }
        ProtocolParameters body = ProtocolParameters.builder()
            .param("query", query.text())
            .param("version", options.getVersion())
            .param("default_graph_uri", options.getDefaultGraphUris())
            .param("named_graph_uri", options.getNamedGraphUris())
            .build();
        return new QueryOperationParameters(query, mimeType, body);
    }

    /**
     * Returns the tagged query.
     *
     * @return the query
     */
    public SparqlQuery getQuery() {
        return query;
    }

    /**
     * Returns the MIME type sent in the Accept header.
     *
     * @return the MIME type
     */
    public String getMimeType() {
        return mimeType;
    }

    /**
     * Returns the form body.
     *
     * @return the body fields
     */
    public ProtocolParameters getBody() {
        return body;
    }

    /**
     * Returns the request headers.
     *
     * @return Accept and Content-Type
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Returns the converter for the query form.
     *
     * @return the converter
     */
    public ResponseConverter getConverter() {
        return switch (query.type()) {
            case SELECT -> BindingSetConverter.INSTANCE;
            case ASK -> AskConverter.INSTANCE;
            case CONSTRUCT, DESCRIBE -> GraphConverter.INSTANCE;
        };
    }
}
