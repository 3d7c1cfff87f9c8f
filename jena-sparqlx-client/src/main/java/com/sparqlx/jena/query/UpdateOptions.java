package com.sparqlx.jena.query;

import java.util.List;

/**
 * Per-call options for an update request. Unset options are not sent.
 */
public final class UpdateOptions {
    /** Options with nothing set. */
    private static final UpdateOptions DEFAULTS = builder().build();

    /** SPARQL version parameter. */
    private final String version;
    /** Using graph URIs. */
    private final List<String> usingGraphUris;
    /** Using named graph URIs. */
    private final List<String> usingNamedGraphUris;
    /** Parse override, or null to use the client setting. */
    private final Boolean parse;

    private UpdateOptions(final Builder builder) {
        this.version = builder.version;
        this.usingGraphUris = builder.usingGraphUris;
        this.usingNamedGraphUris = builder.usingNamedGraphUris;
        this.parse = builder.parse;
    }

    /**
     * Returns options with nothing set.
     *
     * @return the empty options
     */
    public static UpdateOptions defaults() {
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
     * Returns the SPARQL version parameter.
     *
     * @return the version, or null
     */
    public String getVersion() {
        return version;
    }

    /**
     * Returns the using graph URIs.
     *
     * @return the URIs, or null when unset
     */
    public List<String> getUsingGraphUris() {
        return usingGraphUris;
    }

    /**
     * Returns the using named graph URIs.
     *
     * @return the URIs, or null when unset
     */
    public List<String> getUsingNamedGraphUris() {
        return usingNamedGraphUris;
    }

    /**
     * Decide whether to validate update syntax before sending.
     *
     * @param clientDefault the client setting
     * @return the override if set, else the client setting
     */
    public boolean parseOr(final boolean clientDefault) {
        return parse == null ? clientDefault : parse;
    }

    /**
     * Builder for {@link UpdateOptions}.
     */
    public static final class Builder {
        /** Version. */
        private String version;
        /** Using graph URIs. */
        private List<String> usingGraphUris;
        /** Using named graph URIs. */
        private List<String> usingNamedGraphUris;
        /** Parse override. */
        private Boolean parse;

        private Builder() {
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
         * Set the using graph URIs.
         *
         * @param uris the URIs, sent in this order
         * @return this builder
         */
        public Builder usingGraphUri(final String... uris) {
            this.usingGraphUris = List.of(uris);
            return this;
        }

        /**
         * Set the using named graph URIs.
         *
         * @param uris the URIs, sent in this order
         * @return this builder
         */
        public Builder usingNamedGraphUri(final String... uris) {
            this.usingNamedGraphUris = List.of(uris);
            return this;
        }

        /**
         * Override the client's parse setting for this call.
         *
         * @param parseUpdate whether to check update syntax locally
         * @return this builder
         */
        public Builder parse(final boolean parseUpdate) {
            this.parse = parseUpdate;
            return this;
        }

        /**
         * Build the options.
         *
         * @return the options
         */
        public UpdateOptions build() {
            return new UpdateOptions(this);
        }
    }
}
