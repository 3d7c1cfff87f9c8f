package com.sparqlx.jena.convert;

import com.sparqlx.jena.http.SparqlResponse;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.apache.jena.atlas.json.JSON;
import org.apache.jena.atlas.json.JsonArray;
import org.apache.jena.atlas.json.JsonException;
import org.apache.jena.atlas.json.JsonObject;
import org.apache.jena.atlas.json.JsonValue;

/**
 * Converts a SPARQL JSON results document
 * ({@code application/sparql-results+json}) into result rows.
 *
 * <p>Every row covers every variable listed in {@code head.vars}, in that
 * order; variables missing from a row, or mapped to JSON {@code null}, are
 * {@link BindingValue#UNBOUND}.
 * Rows keep the order of {@code results.bindings}.</p>
 */
public final class BindingSetConverter implements ResponseConverter {

    /** Shared instance; the converter is stateless. */
    public static final BindingSetConverter INSTANCE =
        new BindingSetConverter();

    /** Key of the literal language tag in a term descriptor. */
    private static final String KEY_LANG = "xml:lang";

    private BindingSetConverter() {
    }

    @Override
    public QueryResult.SelectResult convert(final SparqlResponse response) {
        return convert(response.body());
    }

    /**
     * Convert a results document, materializing every row.
     *
     * @param body the JSON document bytes
     * @return the rows with their declared variables
     * @throws MalformedResultsPayloadException if the body is not JSON or
     *     lacks {@code head.vars} / {@code results.bindings}
     */
    public QueryResult.SelectResult convert(final byte[] body) {
        BindingIterator rows = iterate(body);
        List<ResultBinding> bindings = new ArrayList<>();
        rows.forEachRemaining(bindings::add);
        return new QueryResult.SelectResult(rows.variables(), bindings);
    }

    /**
     * Parse a results document and return an iterator that converts rows
     * only as they are requested. The document structure is checked
     * eagerly; row contents are checked as each row is reached.
     *
     * @param body the JSON document bytes
     * @return the row iterator
     * @throws MalformedResultsPayloadException if the body is not JSON or
     *     lacks {@code head.vars} / {@code results.bindings}
     */
    public BindingIterator iterate(final byte[] body) {
        JsonObject document = parse(body);
        List<String> variables = readVariables(document);
        JsonArray bindings = readBindings(document);
        return new BindingIterator(variables, bindings);
    }

    private static JsonObject parse(final byte[] body) {
        try {
            return JSON.parse(new ByteArrayInputStream(body));
        } catch (JsonException e) {
            throw new MalformedResultsPayloadException(
                "SPARQL results payload is not valid JSON: " + e.getMessage(),
                e);
        }
    }

    private static List<String> readVariables(final JsonObject document) {
        JsonValue head = document.get("head");
        if (head == null || !head.isObject()) {
            throw MalformedResultsPayloadException.missingField("head");
        }
        JsonValue vars = head.getAsObject().get("vars");
        if (vars == null || !vars.isArray()) {
            throw MalformedResultsPayloadException.missingField("head.vars");
        }
        List<String> variables = new ArrayList<>();
        for (JsonValue var : vars.getAsArray()) {
            if (!var.isString()) {
                throw new MalformedResultsPayloadException(
                    "Non-string entry in 'head.vars': " + var);
            }
            variables.add(var.getAsString().value());
        }
        return Collections.unmodifiableList(variables);
    }

    private static JsonArray readBindings(final JsonObject document) {
        JsonValue results = document.get("results");
        if (results == null || !results.isObject()) {
            throw MalformedResultsPayloadException.missingField("results");
        }
        JsonValue bindings = results.getAsObject().get("bindings");
        if (bindings == null || !bindings.isArray()) {
            throw MalformedResultsPayloadException.missingField(
                "results.bindings");
        }
        return bindings.getAsArray();
    }

    private static ResultBinding toBinding(final List<String> variables,
                                           final JsonValue row,
                                           final int index) {
        if (!row.isObject()) {
            throw new MalformedResultsPayloadException(
                "Entry " + index + " of 'results.bindings' is not an object");
        }
        JsonObject object = row.getAsObject();
        Map<String, BindingValue> values = new LinkedHashMap<>();
        for (String variable : variables) {
            JsonValue term = object.get(variable);
            values.put(variable, LiteralCoercion.toBindingValue(
                term == null || term.isNull()
                    ? null : toTerm(term, variable, index)));
        }
        return new ResultBinding(values);
    }

    private static RdfTerm toTerm(final JsonValue value,
                                  final String variable,
                                  final int index) {
        String path = "results.bindings[" + index + "]." + variable;
        if (!value.isObject()) {
            throw new MalformedResultsPayloadException(
                "Term '" + path + "' is not an object");
        }
        JsonObject term = value.getAsObject();
        return new RdfTerm(
            requiredString(term, "type", path),
            requiredString(term, "value", path),
            optionalString(term, "datatype"),
            optionalString(term, KEY_LANG));
    }

    private static String requiredString(final JsonObject object,
                                         final String key,
                                         final String path) {
        String value = optionalString(object, key);
        if (value == null) {
            throw MalformedResultsPayloadException.missingField(
                path + "." + key);
        }
        return value;
    }

    private static String optionalString(final JsonObject object,
                                         final String key) {
        JsonValue value = object.get(key);
        return value != null && value.isString()
            ? value.getAsString().value() : null;
    }

    /**
     * Lazily converting iterator over the rows of one results document.
     */
    public static final class BindingIterator implements Iterator<ResultBinding> {
        /** Declared variables. */
        private final List<String> variables;
        /** Unconverted rows. */
        private final JsonArray rows;
        /** Index of the next row. */
        private int position;

        private BindingIterator(final List<String> variables,
                                final JsonArray rows) {
            this.variables = variables;
            this.rows = rows;
        }

        /**
         * Returns the declared variables, in header order.
         *
         * @return the variable names
         */
        public List<String> variables() {
            return variables;
        }

        @Override
        public boolean hasNext() {
            return position < rows.size();
        }

        @Override
        public ResultBinding next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int index = position++;
            return toBinding(variables, rows.get(index), index);
        }
    }
}
