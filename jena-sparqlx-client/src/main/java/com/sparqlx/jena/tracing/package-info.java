/**
 * OpenTelemetry tracing for SPARQL requests.
 *
 * <p>{@link com.sparqlx.jena.tracing.TracedTransport} records one span
 * per request sent through an {@link com.sparqlx.jena.http.HttpTransport};
 * {@link com.sparqlx.jena.tracing.TracingUtil} sets up OTLP export.</p>
 */
package com.sparqlx.jena.tracing;
