package com.sparqlx.jena;

/**
 * Thrown when an endpoint answers with a non-2xx status.
 */
public class SparqlHttpException extends SparqlClientException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /** HTTP status code returned by the endpoint. */
    private final int statusCode;
    /** Endpoint URL the request was sent to. */
    private final String url;
    /** Response body text, possibly empty. */
    private final String responseBody;

    /**
     * Constructs a new exception for a failed response.
     *
     * @param statusCode the HTTP status code
     * @param url the endpoint URL
     * @param responseBody the response body text
     */
    public SparqlHttpException(final int statusCode,
                               final String url,
                               final String responseBody) {
        super("HTTP " + statusCode + " from " + url
            + (responseBody == null || responseBody.isBlank()
                ? "" : ": " + responseBody.strip()));
        this.statusCode = statusCode;
        this.url = url;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    /**
     * Returns the HTTP status code.
     *
     * @return the status code
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the endpoint URL.
     *
     * @return the URL
     */
    public String getUrl() {
        return url;
    }

    /**
     * Returns the response body text.
     *
     * @return the body, never null
     */
    public String getResponseBody() {
        return responseBody;
    }
}
