package com.sparqlx.jena.query;

import java.util.List;

/**
 * Per-call options for a query. Unset options are not sent.
 */
public final class QueryOptions {
    /** Options with nothing set. */
    private static final QueryOptions DEFAULTS = builder().build();

    /** Response format alias or MIME type. */
    private final String responseFormat;
    /** SPARQL version parameter. */
    private final String version;
    /** Default graph URIs. */
    private final List<String> defaultGraphUris;
    /** Named graph URIs. */
    private final List<String> namedGraphUris;
    /** Parse override, or null to use the client setting. */
    private final Boolean parse;

    private QueryOptions(final Builder builder) {
        this.responseFormat = builder.responseFormat;
        this.version = builder.version;
        this.defaultGraphUris = builder.defaultGraphUris;
        this.namedGraphUris = builder.namedGraphUris;
        this.parse = builder.parse;
    }

    /**
     * Returns options with nothing set.
     *
     * @return the empty options
     */
    public static QueryOptions defaults() {
        return DEFAULTS;
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
     * Returns the requested response format.
     *
     * @return an alias or MIME type, or null for the default
     */
    public String getResponseFormat() {
        return responseFormat;
    }

    /**
     * Returns the SPARQL version parameter.
     *
     * @return the version, or null
     */
    public String getVersion() {
        return version;
    }

    /**
     * Returns the default graph URIs.
     *
     * @return the URIs, or null when unset
     */
    public List<String> getDefaultGraphUris() {
        return defaultGraphUris;
    }

    /**
     * Returns the named graph URIs.
     *
     * @return the URIs, or null when unset
     */
    public List<String> getNamedGraphUris() {
        return namedGraphUris;
    }

    /**
     * Decide whether to parse, given the client-wide setting.
     *
     * @param clientDefault the client setting
     * @return the override if set, else the client setting
     */
    public boolean parseOr(final boolean clientDefault) {
        return parse == null ? clientDefault : parse;
    }

    /**
     * Builder for {@link QueryOptions}.
     */
    public static final class Builder {
        /** Response format. */
        private String responseFormat;
        /** Version. */
        private String version;
        /** Default graph URIs. */
        private List<String> defaultGraphUris;
        /** Named graph URIs. */
        private List<String> namedGraphUris;
        /** Parse override. */
        private Boolean parse;

        private Builder() {
        }

        /**
         * Set the response format.
         *
         * @param format an alias ({@code json}, {@code xml}, {@code csv},
         *     {@code tsv}, {@code turtle}, {@code ntriples},
         *     {@code json-ld}) or a MIME type
         * @return this builder
         */
        public Builder responseFormat(final String format) {
            this.responseFormat = format;
            return this;
        }

        /**
         * Set the SPARQL version parameter.
         *
         * @param sparqlVersion the version
         * @return this builder
         */
        public Builder version(final String sparqlVersion) {
            this.version = sparqlVersion;
            return this;
        }

        /**
         * Set the default graph URIs.
         *
         * @param uris the URIs, sent in this order
         * @return this builder
         */
        public Builder defaultGraphUri(final String... uris) {
            this.defaultGraphUris = List.of(uris);
            return this;
        }

        /**
         * Set the named graph URIs.
         *
         * @param uris the URIs, sent in this order
         * @return this builder
         */
        public Builder namedGraphUri(final String... uris) {
            this.namedGraphUris = List.of(uris);
            return this;
        }

        /**
         * Override the client's parse setting for this call.
         *
         * @param parseQuery whether to parse untyped query text
         * @return this builder
         */
        public Builder parse(final boolean parseQuery) {
            this.parse = parseQuery;
            return this;
        }

        /**
         * Build the options.
         *
         * @return the options
         */
        public QueryOptions build() {
            return new QueryOptions(this);
        }
    }
}
