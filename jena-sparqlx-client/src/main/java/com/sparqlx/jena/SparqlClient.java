package com.sparqlx.jena;

import com.sparqlx.jena.convert.QueryResult;
import com.sparqlx.jena.http.HttpTransport;
import com.sparqlx.jena.http.JdkHttpTransport;
import com.sparqlx.jena.http.ResponseChunks;
import com.sparqlx.jena.http.ResponseLines;
import com.sparqlx.jena.http.ResponseText;
import com.sparqlx.jena.http.SparqlRequest;
import com.sparqlx.jena.http.SparqlResponse;
import com.sparqlx.jena.http.StreamingResponse;
import com.sparqlx.jena.http.TransportConfig;
import com.sparqlx.jena.query.QueryClassifier;
import com.sparqlx.jena.query.QueryOperationParameters;
import com.sparqlx.jena.query.QueryOptions;
import com.sparqlx.jena.query.SparqlQuery;
import com.sparqlx.jena.query.UpdateOperationParameters;
import com.sparqlx.jena.query.UpdateOptions;
import com.sparqlx.jena.tracing.TracedTransport;
import com.sparqlx.jena.tracing.TracingUtil;
import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.apache.jena.graph.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the SPARQL 1.1 Query and Update protocols.
 *
 * <p>Queries and updates are sent as form-encoded POST requests. Query
 * methods come in two families: {@code query*} methods return the raw
 * {@link SparqlResponse}, {@code queryAndConvert*} methods return a
 * {@link QueryResult}. A non-2xx status always raises
 * {@link SparqlHttpException}.</p>
 *
 * <p>Untyped query text is parsed to find its form unless parsing is
 * disabled, in which case only {@link SparqlQuery} values are accepted.
 * Parameter errors are raised before any request is sent.</p>
 *
 * <p>A transport passed to the builder is borrowed: the client never
 * closes it and logs a warning if it is still open when the client is
 * closed. Otherwise the client creates a {@link JdkHttpTransport} on first
 * use and closes it in {@link #close()}.</p>
 *
 * <pre>{@code
 * try (SparqlClient client = SparqlClient.builder()
 *         .queryEndpoint("http://localhost:3030/ds/query")
 *         .build()) {
 *     QueryResult.SelectResult rows =
 *         client.select("SELECT ?s WHERE { ?s ?p ?o }");
 * }
 * }</pre>
 */
public final class SparqlClient implements AutoCloseable {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SparqlClient.class);

    /** Query endpoint, or null. */
    private final URI queryEndpoint;
    /** Update endpoint, or null. */
    private final URI updateEndpoint;
    /** Caller-supplied transport, or null when the client owns one. */
    private final HttpTransport borrowedTransport;
    /** Settings for the owned transport. */
    private final TransportConfig transportConfig;
    /** Whether untyped query text is parsed and updates validated. */
    private final boolean parse;
    /** Explicit tracer, or null to follow the environment. */
    private final Tracer tracer;
    /** Lazily created owned transport. */
    private HttpTransport ownedTransport;
    /** Guards creation and release of the owned transport. */
    private final Object transportLock = new Object();
    /** Whether close() has been called. */
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SparqlClient(final Builder builder) {
        this.queryEndpoint = builder.queryEndpoint;
        this.updateEndpoint = builder.updateEndpoint;
        this.transportConfig = builder.transportConfig;
        this.parse = builder.parse;
        this.tracer = builder.tracer;
        HttpTransport supplied = builder.transport;
        if (supplied == null && builder.httpClient != null) {
            supplied = new JdkHttpTransport(builder.httpClient,
                builder.transportConfig);
        }
        this.borrowedTransport = supplied == null ? null : traced(supplied);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("SparqlClient created: query={}, update={}, "
                + "transport={}", queryEndpoint, updateEndpoint,
                borrowedTransport == null ? "owned" : "borrowed");
        }
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
     * Run a query and return the raw response.
     *
     * @param query the query text
     * @return the successful response
     */
    public SparqlResponse query(final String query) {
        return query(query, QueryOptions.defaults());
    }

    /**
     * Run a query and return the raw response.
     *
     * @param query the query text
     * @param options per-call options
     * @return the successful response
     * @throws QueryParseException if the text is not valid SPARQL
     * @throws SparqlHttpException on a non-2xx status
     */
    public SparqlResponse query(final String query,
                                final QueryOptions options) {
        return query(resolve(query, options), options);
    }

    /**
     * Run a typed query and return the raw response.
     *
     * @param query the typed query
     * @param options per-call options
     * @return the successful response
     * @throws SparqlHttpException on a non-2xx status
     */
    public SparqlResponse query(final SparqlQuery query,
                                final QueryOptions options) {
        QueryOperationParameters params =
            QueryOperationParameters.create(query, options, false);
        return checkStatus(transport().send(queryRequest(params)));
    }

    /**
     * Run a query without blocking.
     *
     * @param query the query text
     * @param options per-call options
     * @return a future completing with the successful response, or
     *     exceptionally with {@link SparqlHttpException}
     */
    public CompletableFuture<SparqlResponse> queryAsync(
            final String query, final QueryOptions options) {
        return queryAsync(resolve(query, options), options);
    }

    /**
     * Run a typed query without blocking.
     *
     * @param query the typed query
     * @param options per-call options
     * @return a future completing with the successful response
     */
    public CompletableFuture<SparqlResponse> queryAsync(
            final SparqlQuery query, final QueryOptions options) {
        QueryOperationParameters params =
            QueryOperationParameters.create(query, options, false);
        return transport().sendAsync(queryRequest(params))
            .thenApply(SparqlClient::checkStatus);
    }

    /**
     * Run several queries concurrently with default options.
     *
     * @param queries the query texts
     * @return the responses, in input order
     */
    public List<SparqlResponse> queries(final String... queries) {
        return queries(QueryOptions.defaults(), queries);
    }

    /**
     * Run several queries concurrently. If any fails, the others are
     * cancelled and the failure is thrown.
     *
     * @param options options applied to every query
     * @param queries the query texts
     * @return the responses, in input order
     */
    public List<SparqlResponse> queries(final QueryOptions options,
                                        final String... queries) {
        return queries(options, resolveAll(queries, options));
    }

    /**
     * Run several typed queries concurrently.
     *
     * @param options options applied to every query
     * @param queries the typed queries
     * @return the responses, in input order
     */
    public List<SparqlResponse> queries(final QueryOptions options,
                                        final SparqlQuery... queries) {
        List<QueryOperationParameters> params = new ArrayList<>();
        for (SparqlQuery query : queries) {
            params.add(QueryOperationParameters.create(query, options, false));
        }
        HttpTransport transport = transport();
        List<CompletableFuture<SparqlResponse>> futures = new ArrayList<>();
        for (QueryOperationParameters param : params) {
            futures.add(transport.sendAsync(queryRequest(param))
                .thenApply(SparqlClient::checkStatus));
        }
        return joinAll(futures);
    }

    /**
     * Run a query and convert the answer.
     *
     * @param query the query text
     * @return the converted result
     */
    public QueryResult queryAndConvert(final String query) {
        return queryAndConvert(query, QueryOptions.defaults());
    }

    /**
     * Run a query and convert the answer.
     *
     * @param query the query text
     * @param options per-call options
     * @return the converted result
     * @throws IllegalArgumentException if a SELECT or ASK query asks for
     *     a non-JSON format
     * @throws com.sparqlx.jena.convert.ResultConversionException if the
     *     answer cannot be interpreted
     */
    public QueryResult queryAndConvert(final String query,
                                       final QueryOptions options) {
        return queryAndConvert(resolve(query, options), options);
    }

    /**
     * Run a typed query and convert the answer.
     *
     * @param query the typed query
     * @param options per-call options
     * @return the converted result
     */
    public QueryResult queryAndConvert(final SparqlQuery query,
                                       final QueryOptions options) {
        QueryOperationParameters params =
            QueryOperationParameters.create(query, options, true);
        SparqlResponse response = checkStatus(
            transport().send(queryRequest(params)));
        return params.getConverter().convert(response);
    }

    /**
     * Run a query without blocking and convert the answer.
     *
     * @param query the query text
     * @param options per-call options
     * @return a future completing with the converted result
     */
    public CompletableFuture<QueryResult> queryAndConvertAsync(
            final String query, final QueryOptions options) {
        return queryAndConvertAsync(resolve(query, options), options);
    }

    /**
     * Run a typed query without blocking and convert the answer.
     *
     * @param query the typed query
     * @param options per-call options
     * @return a future completing with the converted result
     */
    public CompletableFuture<QueryResult> queryAndConvertAsync(
            final SparqlQuery query, final QueryOptions options) {
        QueryOperationParameters params =
            QueryOperationParameters.create(query, options, true);
        return convertAsync(transport(), params);
    }

    /**
     * Run several queries concurrently and convert every answer.
     *
     * @param queries the query texts
     * @return the converted results, in input order
     */
    public List<QueryResult> queriesAndConvert(final String... queries) {
        return queriesAndConvert(QueryOptions.defaults(), queries);
    }

    /**
     * Run several queries concurrently and convert every answer.
     *
     * @param options options applied to every query
     * @param queries the query texts
     * @return the converted results, in input order
     */
    public List<QueryResult> queriesAndConvert(final QueryOptions options,
                                               final String... queries) {
        return queriesAndConvert(options, resolveAll(queries, options));
    }

    /**
     * Run several typed queries concurrently and convert every answer.
     *
     * @param options options applied to every query
     * @param queries the typed queries
     * @return the converted results, in input order
     */
    public List<QueryResult> queriesAndConvert(final QueryOptions options,
                                               final SparqlQuery... queries) {
        List<QueryOperationParameters> params = new ArrayList<>();
        for (SparqlQuery query : queries) {
            params.add(QueryOperationParameters.create(query, options, true));
        }
        HttpTransport transport = transport();
        List<CompletableFuture<QueryResult>> futures = new ArrayList<>();
        for (QueryOperationParameters param : params) {
            futures.add(convertAsync(transport, param));
        }
        return joinAll(futures);
    }

    /**
     * Run a SELECT query and return its rows.
     *
     * @param query the SELECT query text; not parsed
     * @return the rows
     */
    public QueryResult.SelectResult select(final String query) {
        return select(query, QueryOptions.defaults());
    }

    /**
     * Run a SELECT query with per-call options and return its rows.
     *
     * @param query the SELECT query text; not parsed
     * @param options per-call options
     * @return the rows
     */
    public QueryResult.SelectResult select(final String query,
                                           final QueryOptions options) {
        return (QueryResult.SelectResult) queryAndConvert(
            SparqlQuery.select(query), options);
    }

    /**
     * Run an ASK query and return its answer.
     *
     * @param query the ASK query text; not parsed
     * @return the answer
     */
    public boolean ask(final String query) {
        return ask(query, QueryOptions.defaults());
    }

    /**
     * Run an ASK query with per-call options and return its answer.
     *
     * @param query the ASK query text; not parsed
     * @param options per-call options
     * @return the answer
     */
    public boolean ask(final String query, final QueryOptions options) {
        return ((QueryResult.AskResult) queryAndConvert(
            SparqlQuery.ask(query), options)).value();
    }

    /**
     * Run a CONSTRUCT query and return its graph.
     *
     * @param query the CONSTRUCT query text; not parsed
     * @return the graph
     */
    public Graph construct(final String query) {
        return construct(query, QueryOptions.defaults());
    }

    /**
     * Run a CONSTRUCT query with per-call options and return its graph.
     *
     * @param query the CONSTRUCT query text; not parsed
     * @param options per-call options
     * @return the graph
     */
    public Graph construct(final String query, final QueryOptions options) {
        return ((QueryResult.GraphResult) queryAndConvert(
            SparqlQuery.construct(query), options)).graph();
    }

    /**
     * Run a DESCRIBE query and return its graph.
     *
     * @param query the DESCRIBE query text; not parsed
     * @return the graph
     */
    public Graph describe(final String query) {
        return describe(query, QueryOptions.defaults());
    }

    /**
     * Run a DESCRIBE query with per-call options and return its graph.
     *
     * @param query the DESCRIBE query text; not parsed
     * @param options per-call options
     * @return the graph
     */
    public Graph describe(final String query, final QueryOptions options) {
        return ((QueryResult.GraphResult) queryAndConvert(
            SparqlQuery.describe(query), options)).graph();
    }

    /**
     * Run a query and stream the answer in chunks of the default size.
     *
     * @param query the query text
     * @return the chunk iterator; the caller must close it
     */
    public ResponseChunks queryStream(final String query) {
        return queryStream(query, QueryOptions.defaults(),
            ResponseChunks.DEFAULT_CHUNK_SIZE);
    }

    /**
     * Run a query and stream the answer.
     *
     * @param query the query text
     * @param options per-call options
     * @param chunkSize the maximum chunk size in bytes
     * @return the chunk iterator; the caller must close it
     */
    public ResponseChunks queryStream(final String query,
                                      final QueryOptions options,
                                      final int chunkSize) {
        return queryStream(resolve(query, options), options, chunkSize);
    }

    /**
     * Run a typed query and stream the answer. The connection stays open
     * until the chunks are exhausted or the iterator is closed.
     *
     * @param query the typed query
     * @param options per-call options
     * @param chunkSize the maximum chunk size in bytes
     * @return the chunk iterator; the caller must close it
     * @throws IllegalArgumentException if the chunk size is not positive
     * @throws SparqlHttpException on a non-2xx status
     */
    public ResponseChunks queryStream(final SparqlQuery query,
                                      final QueryOptions options,
                                      final int chunkSize) {
        checkChunkSize(chunkSize);
        return openStream(query, options,
            response -> new ResponseChunks(response, chunkSize));
    }

    /**
     * Run a query and stream the answer without blocking on the
     * response headers.
     *
     * @param query the query text
     * @param options per-call options
     * @param chunkSize the maximum chunk size in bytes
     * @return a future completing with the chunk iterator, which the
     *     caller must close
     */
    public CompletableFuture<ResponseChunks> queryStreamAsync(
            final String query, final QueryOptions options,
            final int chunkSize) {
        return queryStreamAsync(resolve(query, options), options, chunkSize);
    }

    /**
     * Run a typed query and stream the answer without blocking on the
     * response headers. A non-2xx status completes the future
     * exceptionally with {@link SparqlHttpException}.
     *
     * @param query the typed query
     * @param options per-call options
     * @param chunkSize the maximum chunk size in bytes
     * @return a future completing with the chunk iterator, which the
     *     caller must close
     * @throws IllegalArgumentException if the chunk size is not positive
     */
    public CompletableFuture<ResponseChunks> queryStreamAsync(
            final SparqlQuery query, final QueryOptions options,
            final int chunkSize) {
        checkChunkSize(chunkSize);
        return openStreamAsync(query, options,
            response -> new ResponseChunks(response, chunkSize));
    }

    /**
     * Run a query and stream the answer as decoded text chunks.
     *
     * @param query the query text
     * @param options per-call options
     * @param chunkSize the maximum chunk length in characters
     * @return the text iterator; the caller must close it
     */
    public ResponseText queryTextStream(final String query,
                                        final QueryOptions options,
                                        final int chunkSize) {
        return queryTextStream(resolve(query, options), options, chunkSize);
    }

    /**
     * Run a typed query and stream the answer as decoded text chunks.
     *
     * @param query the typed query
     * @param options per-call options
     * @param chunkSize the maximum chunk length in characters
     * @return the text iterator; the caller must close it
     * @throws IllegalArgumentException if the chunk size is not positive
     * @throws SparqlHttpException on a non-2xx status
     */
    public ResponseText queryTextStream(final SparqlQuery query,
                                        final QueryOptions options,
                                        final int chunkSize) {
        checkChunkSize(chunkSize);
        return openStream(query, options,
            response -> new ResponseText(response, chunkSize));
    }

    /**
     * Run a query and stream the answer line by line.
     *
     * @param query the query text
     * @return the line iterator; the caller must close it
     */
    public ResponseLines queryLines(final String query) {
        return queryLines(query, QueryOptions.defaults());
    }

    /**
     * Run a query and stream the answer line by line.
     *
     * @param query the query text
     * @param options per-call options
     * @return the line iterator; the caller must close it
     */
    public ResponseLines queryLines(final String query,
                                    final QueryOptions options) {
        return queryLines(resolve(query, options), options);
    }

    /**
     * Run a typed query and stream the answer line by line.
     *
     * @param query the typed query
     * @param options per-call options
     * @return the line iterator; the caller must close it
     * @throws SparqlHttpException on a non-2xx status
     */
    public ResponseLines queryLines(final SparqlQuery query,
                                    final QueryOptions options) {
        return openStream(query, options, ResponseLines::new);
    }

    /**
     * Run a query and stream the answer line by line without blocking on
     * the response headers.
     *
     * @param query the query text
     * @param options per-call options
     * @return a future completing with the line iterator, which the
     *     caller must close
     */
    public CompletableFuture<ResponseLines> queryLinesAsync(
            final String query, final QueryOptions options) {
        return queryLinesAsync(resolve(query, options), options);
    }

    /**
     * Run a typed query and stream the answer line by line without
     * blocking on the response headers.
     *
     * @param query the typed query
     * @param options per-call options
     * @return a future completing with the line iterator, which the
     *     caller must close
     */
    public CompletableFuture<ResponseLines> queryLinesAsync(
            final SparqlQuery query, final QueryOptions options) {
        return openStreamAsync(query, options, ResponseLines::new);
    }

    /**
     * Run an update request.
     *
     * @param update the update request text
     * @return the successful response
     */
    public SparqlResponse update(final String update) {
        return update(update, UpdateOptions.defaults());
    }

    /**
     * Run an update request.
     *
     * @param update the update request text
     * @param options per-call options
     * @return the successful response
     * @throws UpdateParseException if validation is on and the text is
     *     not a valid update request
     * @throws SparqlHttpException on a non-2xx status
     */
    public SparqlResponse update(final String update,
                                 final UpdateOptions options) {
        UpdateOperationParameters params = updateParameters(update, options);
        return checkStatus(transport().send(updateRequest(params)));
    }

    /**
     * Run an update request without blocking.
     *
     * @param update the update request text
     * @param options per-call options
     * @return a future completing with the successful response
     */
    public CompletableFuture<SparqlResponse> updateAsync(
            final String update, final UpdateOptions options) {
        UpdateOperationParameters params = updateParameters(update, options);
        return transport().sendAsync(updateRequest(params))
            .thenApply(SparqlClient::checkStatus);
    }

    /**
     * Run several update requests concurrently with default options.
     *
     * @param updates the update request texts
     * @return the responses, in input order
     */
    public List<SparqlResponse> updates(final String... updates) {
        return updates(UpdateOptions.defaults(), updates);
    }

    /**
     * Run several update requests concurrently. The requests are
     * independent; the endpoint may apply them in any order. If any
     * fails, the others are cancelled and the failure is thrown.
     *
     * @param options options applied to every update
     * @param updates the update request texts
     * @return the responses, in input order
     */
    public List<SparqlResponse> updates(final UpdateOptions options,
                                        final String... updates) {
        List<UpdateOperationParameters> params = new ArrayList<>();
        for (String update : updates) {
            params.add(updateParameters(update, options));
        }
        HttpTransport transport = transport();
        List<CompletableFuture<SparqlResponse>> futures = new ArrayList<>();
        for (UpdateOperationParameters param : params) {
            futures.add(transport.sendAsync(updateRequest(param))
                .thenApply(SparqlClient::checkStatus));
        }
        return joinAll(futures);
    }

    /**
     * Returns the query endpoint.
     *
     * @return the endpoint, or null
     */
    public URI getQueryEndpoint() {
        return queryEndpoint;
    }

    /**
     * Returns the update endpoint.
     *
     * @return the endpoint, or null
     */
    public URI getUpdateEndpoint() {
        return updateEndpoint;
    }

    /**
     * Whether untyped queries are parsed and updates validated by default.
     *
     * @return the client-wide parse setting
     */
    public boolean isParse() {
        return parse;
    }

    /**
     * Whether the client created, and will close, its transport.
     *
     * @return true unless a transport or HTTP client was supplied
     */
    public boolean ownsTransport() {
        return borrowedTransport == null;
    }

    /**
     * Close the owned transport, if one was created. A borrowed transport
     * is left open; a warning is logged if it still is. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (borrowedTransport != null) {
            if (borrowedTransport.isOpen() && LOGGER.isWarnEnabled()) {
                LOGGER.warn("HTTP transport {} is not managed by "
                    + "SparqlClient; close it when it is no longer needed",
                    borrowedTransport);
            }
            return;
        }
        synchronized (transportLock) {
            if (ownedTransport != null) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Closing owned HTTP transport");
                }
                ownedTransport.close();
                ownedTransport = null;
            }
        }
    }

    private HttpTransport transport() {
        if (closed.get()) {
            throw new IllegalStateException("SparqlClient is closed");
        }
        if (borrowedTransport != null) {
            return borrowedTransport;
        }
        synchronized (transportLock) {
            if (ownedTransport == null) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Creating owned HTTP transport");
                }
                ownedTransport = traced(new JdkHttpTransport(transportConfig));
            }
            return ownedTransport;
        }
    }

    private HttpTransport traced(final HttpTransport transport) {
        if (tracer != null) {
            return new TracedTransport(transport, tracer);
        }
        if (TracingUtil.isTracingEnabled()) {
            return new TracedTransport(transport);
        }
        return transport;
    }

    private SparqlQuery resolve(final String query,
                                final QueryOptions options) {
        return QueryClassifier.resolve(query, options.parseOr(parse));
    }

    private SparqlQuery[] resolveAll(final String[] queries,
                                     final QueryOptions options) {
        SparqlQuery[] resolved = new SparqlQuery[queries.length];
        for (int i = 0; i < queries.length; i++) {
            resolved[i] = resolve(queries[i], options);
        }
        return resolved;
    }

    private UpdateOperationParameters updateParameters(
            final String update, final UpdateOptions options) {
        if (options.parseOr(parse)) {
            QueryClassifier.validateUpdate(update);
        }
        return UpdateOperationParameters.create(update, options);
    }

    private SparqlRequest queryRequest(final QueryOperationParameters params) {
        if (queryEndpoint == null) {
            throw new IllegalStateException("No query endpoint configured");
        }
        return SparqlRequest.post(queryEndpoint, params.getBody(),
            params.getHeaders());
    }

    private SparqlRequest updateRequest(
            final UpdateOperationParameters params) {
        if (updateEndpoint == null) {
            throw new IllegalStateException("No update endpoint configured");
        }
        return SparqlRequest.post(updateEndpoint, params.getBody(),
            params.getHeaders());
    }

    private CompletableFuture<QueryResult> convertAsync(
            final HttpTransport transport,
            final QueryOperationParameters params) {
        return transport.sendAsync(queryRequest(params))
            .thenApply(response -> params.getConverter()
                .convert(checkStatus(response)));
    }

    private static SparqlResponse checkStatus(final SparqlResponse response) {
        if (!response.isSuccessful()) {
            throw new SparqlHttpException(response.statusCode(),
                response.url(), response.bodyAsString());
        }
        return response;
    }

    private <T> T openStream(final SparqlQuery query,
                             final QueryOptions options,
                             final Function<StreamingResponse, T> reader) {
        QueryOperationParameters params =
            QueryOperationParameters.create(query, options, false);
        return readStream(transport().stream(queryRequest(params)), reader);
    }

    private <T> CompletableFuture<T> openStreamAsync(
            final SparqlQuery query,
            final QueryOptions options,
            final Function<StreamingResponse, T> reader) {
        QueryOperationParameters params =
            QueryOperationParameters.create(query, options, false);
        return transport().streamAsync(queryRequest(params))
            .thenApply(response -> readStream(response, reader));
    }

    private static <T> T readStream(final StreamingResponse response,
                                    final Function<StreamingResponse, T> reader) {
        if (!response.isSuccessful()) {
            throw failedStream(response);
        }
        return reader.apply(response);
    }

    private static void checkChunkSize(final int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException(
                "Chunk size must be positive: " + chunkSize);
        }
    }

    private static SparqlHttpException failedStream(
            final StreamingResponse response) {
        String body = "";
        IOException readFailure = null;
        try (StreamingResponse failed = response) {
            body = new String(failed.body().readAllBytes(),
                StandardCharsets.UTF_8);
        } catch (IOException e) {
            readFailure = e;
        }
        SparqlHttpException error = new SparqlHttpException(
            response.statusCode(), response.url(), body);
        if (readFailure != null) {
            error.addSuppressed(readFailure);
        }
        return error;
    }

    private static <T> List<T> joinAll(
            final List<CompletableFuture<T>> futures) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Waiting for {} concurrent requests", futures.size());
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(
            futures.toArray(new CompletableFuture<?>[0]));
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        for (CompletableFuture<T> future : futures) {
            future.whenComplete((result, error) -> {
                if (error != null) {
                    firstFailure.completeExceptionally(error);
                }
            });
        }
        try {
            CompletableFuture.anyOf(all, firstFailure).join();
        } catch (CompletionException | CancellationException e) {
            for (CompletableFuture<T> future : futures) {
                future.cancel(true);
            }
            throw rethrowable(e);
        }
        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private static RuntimeException rethrowable(final Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new SparqlClientException("Concurrent request failed: "
            + cause.getMessage(), cause);
    }

    /**
     * Builder for {@link SparqlClient}.
     */
    public static final class Builder {
        /** Query endpoint. */
        private URI queryEndpoint;
        /** Update endpoint. */
        private URI updateEndpoint;
        /** Borrowed transport. */
        private HttpTransport transport;
        /** Borrowed JDK client. */
        private HttpClient httpClient;
        /** Settings for an owned transport. */
        private TransportConfig transportConfig = TransportConfig.defaults();
        /** Client-wide parse setting. */
        private boolean parse = true;
        /** Explicit tracer. */
        private Tracer tracer;

        private Builder() {
        }

        /**
         * Set the query endpoint.
         *
         * @param url the endpoint URL
         * @return this builder
         */
        public Builder queryEndpoint(final String url) {
            this.queryEndpoint = url == null ? null : URI.create(url);
            return this;
        }

        /**
         * Set the update endpoint.
         *
         * @param url the endpoint URL
         * @return this builder
         */
        public Builder updateEndpoint(final String url) {
            this.updateEndpoint = url == null ? null : URI.create(url);
            return this;
        }

        /**
         * Send through a caller-managed transport. The client never closes
         * it.
         *
         * @param value the transport
         * @return this builder
         */
        public Builder transport(final HttpTransport value) {
            this.transport = value;
            return this;
        }

        /**
         * Send through a caller-managed JDK client. The client never shuts
         * it down.
         *
         * @param value the JDK client
         * @return this builder
         */
        public Builder httpClient(final HttpClient value) {
            this.httpClient = value;
            return this;
        }

        /**
         * Set the transport settings. The request timeout also applies to
         * a borrowed JDK client.
         *
         * @param value the settings
         * @return this builder
         */
        public Builder transportConfig(final TransportConfig value) {
            this.transportConfig = value;
            return this;
        }

        /**
         * Set whether untyped query text is parsed and update text
         * validated before sending.
         *
         * @param value the client-wide setting, default true
         * @return this builder
         */
        public Builder parse(final boolean value) {
            this.parse = value;
            return this;
        }

        /**
         * Trace every request with this tracer, whatever the environment
         * says.
         *
         * @param value the tracer
         * @return this builder
         */
        public Builder tracer(final Tracer value) {
            this.tracer = value;
            return this;
        }

        /**
         * Build the client.
         *
         * @return the client
         * @throws IllegalArgumentException if both a transport and an
         *     HTTP client are set
         */
        public SparqlClient build() {
            if (transport != null && httpClient != null) {
                throw new IllegalArgumentException(
                    "Set either a transport or an HTTP client, not both");
            }
            if (transportConfig == null) {
                throw new IllegalArgumentException(
                    "Transport config must not be null");
            }
            return new SparqlClient(this);
        }
    }
}
