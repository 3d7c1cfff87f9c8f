package com.sparqlx.jena.http;

import com.sparqlx.jena.query.ProtocolParameters;
import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * A SPARQL protocol request ready to be sent: a form-encoded POST to an
 * endpoint.
 *
 * @param method the HTTP method, always {@code POST} for this client
 * @param url the endpoint URL
 * @param body the form body fields
 * @param headers the request headers (Accept, Content-Type)
 */
public record SparqlRequest(String method,
                            URI url,
                            ProtocolParameters body,
                            Map<String, String> headers) {

    /** The only method this client sends. */
    public static final String POST = "POST";

    /**
     * Validates and copies the parts.
     *
     * @param method the HTTP method
     * @param url the endpoint URL
     * @param body the form body fields
     * @param headers the request headers
     */
    public SparqlRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(body, "body");
        headers = Map.copyOf(headers);
    }

    /**
     * Create a form POST request.
     *
     * @param url the endpoint URL
     * @param body the form body fields
     * @param headers the request headers
     * @return the request
     */
    public static SparqlRequest post(final URI url,
                                     final ProtocolParameters body,
                                     final Map<String, String> headers) {
        return new SparqlRequest(POST, url, body, headers);
    }

    /**
     * Returns the SPARQL operation carried by the body.
     *
     * @return {@code update} when the body carries an update, else
     *     {@code query}
     */
    public String operation() {
        return body.contains(ProtocolParameters.UPDATE)
            ? ProtocolParameters.UPDATE : ProtocolParameters.QUERY;
    }
}
