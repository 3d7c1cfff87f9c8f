package com.sparqlx.jena.http;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for a transport the client creates and owns.
 *
 * <p>Defaults can be overridden through environment variables with
 * {@link #fromEnvironment()}:</p>
 * <ul>
 *   <li>{@code SPARQL_CONNECT_TIMEOUT_MS} - connect timeout
 *       (default: 10000)</li>
 *   <li>{@code SPARQL_REQUEST_TIMEOUT_MS} - per-request timeout
 *       (default: none)</li>
 * </ul>
 */
public final class TransportConfig {
    /** Default connect timeout. */
    public static final Duration DEFAULT_CONNECT_TIMEOUT =
        Duration.ofSeconds(10);

    /** Environment variable for the connect timeout. */
    static final String ENV_CONNECT_TIMEOUT = "SPARQL_CONNECT_TIMEOUT_MS";

    /** Environment variable for the request timeout. */
    static final String ENV_REQUEST_TIMEOUT = "SPARQL_REQUEST_TIMEOUT_MS";

    /** Connect timeout. */
    private final Duration connectTimeout;
    /** Request timeout, or null for none. */
    private final Duration requestTimeout;
    /** Redirect policy. */
    private final HttpClient.Redirect redirect;

    private TransportConfig(final Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.redirect = builder.redirect;
    }

    /**
     * Returns the default configuration.
     *
     * @return the defaults
     */
    public static TransportConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a configuration read from environment variables, falling
     * back to defaults for unset variables.
     *
     * @return the configuration
     */
    public static TransportConfig fromEnvironment() {
        Builder builder = builder();
        String connect = System.getenv(ENV_CONNECT_TIMEOUT);
        if (connect != null && !connect.isEmpty()) {
            builder.connectTimeout(Duration.ofMillis(Long.parseLong(connect)));
        }
        String request = System.getenv(ENV_REQUEST_TIMEOUT);
        if (request != null && !request.isEmpty()) {
            builder.requestTimeout(Duration.ofMillis(Long.parseLong(request)));
        }
        return builder.build();
    }

    /**
     * Obtain a {@link Builder}.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the connect timeout.
     *
     * @return the connect timeout
     */
    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Returns the per-request timeout.
     *
     * @return the request timeout, or null for none
     */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Returns the redirect policy.
     *
     * @return the redirect policy
     */
    public HttpClient.Redirect getRedirect() {
        return redirect;
    }

    /**
     * Builder for {@link TransportConfig}.
     */
    public static final class Builder {
        /** Connect timeout. */
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        /** Request timeout. */
        private Duration requestTimeout = null;
        /** Redirect policy. */
        private HttpClient.Redirect redirect = HttpClient.Redirect.NORMAL;

        private Builder() {
        }

        /**
         * Set the connect timeout.
         *
         * @param value the timeout
         * @return this builder
         */
        public Builder connectTimeout(final Duration value) {
            this.connectTimeout = Objects.requireNonNull(value);
            return this;
        }

        /**
         * Set the per-request timeout.
         *
         * @param value the timeout, or null for none
         * @return this builder
         */
        public Builder requestTimeout(final Duration value) {
            this.requestTimeout = value;
            return this;
        }

        /**
         * Set the redirect policy.
         *
         * @param value the policy
         * @return this builder
         */
        public Builder redirect(final HttpClient.Redirect value) {
            this.redirect = Objects.requireNonNull(value);
            return this;
        }

        /**
         * Build the configuration.
         *
         * @return the configuration
         */
        public TransportConfig build() {
            return new TransportConfig(this);
        }
    }
}
