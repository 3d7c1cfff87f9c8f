package com.sparqlx.jena.query;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Request body fields of a SPARQL protocol operation, sent as an
 * {@code application/x-www-form-urlencoded} POST body.
 *
 * <p>Option names are translated to protocol parameter names by replacing
 * underscores with hyphens, so {@code named_graph_uri} is sent as
 * {@code named-graph-uri}. Null options are omitted. Multi-valued options
 * repeat the parameter once per value, in input order.</p>
 */
public final class ProtocolParameters {
    /** Content type of every encoded body. */
    public static final String FORM_CONTENT_TYPE =
        "application/x-www-form-urlencoded";

    /** Protocol parameter carrying query text. */
    public static final String QUERY = "query";
    /** Protocol parameter carrying update text. */
    public static final String UPDATE = "update";
    /** Protocol parameter carrying the SPARQL version. */
    public static final String VERSION = "version";
    /** Query protocol default graph parameter. */
    public static final String DEFAULT_GRAPH_URI = "default-graph-uri";
    /** Query protocol named graph parameter. */
    public static final String NAMED_GRAPH_URI = "named-graph-uri";
    /** Update protocol default graph parameter. */
    public static final String USING_GRAPH_URI = "using-graph-uri";
    /** Update protocol named graph parameter. */
    public static final String USING_NAMED_GRAPH_URI = "using-named-graph-uri";

    /** Values keyed by protocol parameter name, in insertion order. */
    private final Map<String, List<String>> fields;

    private ProtocolParameters(final Map<String, List<String>> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Obtain a builder.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Translate an option name to its protocol parameter name.
     *
     * @param optionName the option name, e.g. {@code default_graph_uri}
     * @return the parameter name, e.g. {@code default-graph-uri}
     */
    public static String toProtocolName(final String optionName) {
        return optionName.replace('_', '-');
    }

    /**
     * Returns the values of a parameter.
     *
     * @param name the protocol parameter name
     * @return the values in order, empty if the parameter is absent
     */
    public List<String> get(final String name) {
        return fields.getOrDefault(name, List.of());
    }

    /**
     * Returns the single value of a parameter.
     *
     * @param name the protocol parameter name
     * @return the first value, or null if absent
     */
    public String first(final String name) {
        List<String> values = fields.get(name);
        return values == null ? null : values.get(0);
    }

    /**
     * Whether a parameter is present.
     *
     * @param name the protocol parameter name
     * @return true if present
     */
    public boolean contains(final String name) {
        return fields.containsKey(name);
    }

    /**
     * Returns all fields.
     *
     * @return values keyed by parameter name, in insertion order
     */
    public Map<String, List<String>> asMap() {
        return fields;
    }

    /**
     * Encode the fields as a form body. Repeated parameters produce one
     * {@code name=value} pair per value.
     *
     * @return the encoded body
     */
    public String toFormEncoded() {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, List<String>> entry : fields.entrySet()) {
            String name = URLEncoder.encode(entry.getKey(),
                StandardCharsets.UTF_8);
            for (String value : entry.getValue()) {
                joiner.add(name + "="
                    + URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        }
        return joiner.toString();
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof ProtocolParameters that
            && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    /**
     * Builder for {@link ProtocolParameters}.
     */
    public static final class Builder {
        /** Accumulated fields. */
        private final Map<String, List<String>> fields = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Add a single-valued option. Null values are skipped.
         *
         * @param optionName the option name; underscores become hyphens
         * @param value the value, or null
         * @return this builder
         */
        public Builder param(final String optionName, final String value) {
            if (value != null) {
                fields.computeIfAbsent(toProtocolName(optionName),
                    k -> new ArrayList<>()).add(value);
            }
            return this;
        }

        /**
         * Add a multi-valued option. A null collection is skipped; each
         * element is added in iteration order.
         *
         * @param optionName the option name; underscores become hyphens
         * @param values the values, or null
         * @return this builder
         */
        public Builder param(final String optionName,
                             final Collection<String> values) {
            if (values != null) {
                for (String value : values) {
                    param(optionName, value);
                }
            }
            return this;
        }

        /**
         * Build the parameters.
         *
         * @return the immutable parameters
         */
        public ProtocolParameters build() {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            fields.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return new ProtocolParameters(copy);
        }
    }
}
