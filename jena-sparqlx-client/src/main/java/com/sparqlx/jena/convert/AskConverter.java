package com.sparqlx.jena.convert;

import com.sparqlx.jena.http.SparqlResponse;
import java.io.ByteArrayInputStream;
import org.apache.jena.atlas.json.JSON;
import org.apache.jena.atlas.json.JsonException;
import org.apache.jena.atlas.json.JsonObject;
import org.apache.jena.atlas.json.JsonValue;

/**
 * Converts the JSON answer of an ASK query into a boolean.
 */
public final class AskConverter implements ResponseConverter {

    /** Shared instance; the converter is stateless. */
    public static final AskConverter INSTANCE = new AskConverter();

    /** Key holding the answer. */
    private static final String KEY_BOOLEAN = "boolean";

    private AskConverter() {
    }

    @Override
    public QueryResult.AskResult convert(final SparqlResponse response) {
        return new QueryResult.AskResult(toBoolean(response.body()));
    }

    /**
     * Read the answer from an ASK results document.
     *
     * @param body the JSON document bytes
     * @return the answer
     * @throws MalformedAskPayloadException if the body is not JSON or the
     *     {@code boolean} field is not a JSON boolean
     * @throws MissingBooleanKeyException if the document has no
     *     {@code boolean} field
     */
    public boolean toBoolean(final byte[] body) {
        JsonObject document;
        try {
            document = JSON.parse(new ByteArrayInputStream(body));
        } catch (JsonException e) {
            throw new MalformedAskPayloadException(e);
        }
        JsonValue answer = document.get(KEY_BOOLEAN);
        if (answer == null) {
            throw new MissingBooleanKeyException();
        }
        if (!answer.isBoolean()) {
            throw new MalformedAskPayloadException(
                "ASK response 'boolean' value is not a JSON boolean: "
                    + answer);
        }
        return answer.getAsBoolean().value();
    }
}
