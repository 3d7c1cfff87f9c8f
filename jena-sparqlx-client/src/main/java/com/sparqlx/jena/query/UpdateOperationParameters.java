package com.sparqlx.jena.query;

import java.util.Map;

/**
 * Form body and headers for one update request.
 */
public final class UpdateOperationParameters {
    /** Form body. */
    private final ProtocolParameters body;
    /** Request headers. */
    private final Map<String, String> headers;

    private UpdateOperationParameters(final ProtocolParameters formBody) {
        this.body = formBody;
        this.headers = Map.of(
            "Content-Type", ProtocolParameters.FORM_CONTENT_TYPE);
    }

    /**
     * Derive the parameters for an update request.
     *
     * @param update the update request text
     * @param options the per-call options
     * @return the parameters
     */
    public static UpdateOperationParameters create(final String update,
                                                   final UpdateOptions options) {
        ProtocolParameters body = ProtocolParameters.builder()
            .param("update", update)
            .param("version", options.getVersion())
            .param("using_graph_uri", options.getUsingGraphUris())
            .param("using_named_graph_uri", options.getUsingNamedGraphUris())
            .build();
        return new UpdateOperationParameters(body);
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
     * @return Content-Type
     */
    public Map<String, String> getHeaders() {
        return headers;
    }
}
