package com.sparqlx.jena.http;

import com.sparqlx.jena.SparqlTransportException;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpTransport} backed by {@link java.net.http.HttpClient}, the
 * client Jena's own HTTP layer uses.
 *
 * <p>When built from a {@link TransportConfig} the transport owns a
 * dedicated executor and shuts it down on {@link #close()}. When wrapping
 * a caller-supplied {@link HttpClient}, closing only stops this transport
 * from sending; the client itself is left alone.</p>
 *
 * <p>Each request is logged at INFO (method and URL) and DEBUG (headers
 * and form body); each response at INFO (status and URL) and DEBUG
 * (headers).</p>
 */
public final class JdkHttpTransport implements HttpTransport {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        JdkHttpTransport.class);

    /** Counter for executor thread names. */
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    /** Underlying JDK client. */
    private final HttpClient client;
    /** Executor owned by this transport, or null. */
    private final ExecutorService ownedExecutor;
    /** Transport settings. */
    private final TransportConfig config;
    /** Whether close() has been called. */
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Create a transport with its own client and executor.
     *
     * @param transportConfig the settings
     */
    public JdkHttpTransport(final TransportConfig transportConfig) {
        this.config = transportConfig;
        this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads());
        this.client = HttpClient.newBuilder()
            .connectTimeout(transportConfig.getConnectTimeout())
            .followRedirects(transportConfig.getRedirect())
            .executor(ownedExecutor)
            .build();
    }

    /**
     * Create a transport over a caller-supplied client.
     *
     * @param httpClient the client to send with; never shut down here
     * @param transportConfig settings; only the request timeout applies
     */
    public JdkHttpTransport(final HttpClient httpClient,
                            final TransportConfig transportConfig) {
        this.config = transportConfig;
        this.ownedExecutor = null;
        this.client = httpClient;
    }

    @Override
    public SparqlResponse send(final SparqlRequest request) {
        HttpRequest httpRequest = toHttpRequest(request);
        try {
            HttpResponse<byte[]> response = client.send(httpRequest,
                HttpResponse.BodyHandlers.ofByteArray());
            return toSparqlResponse(request, response);
        } catch (IOException e) {
            throw failure(request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(request, e);
        }
    }

    @Override
    public CompletableFuture<SparqlResponse> sendAsync(
            final SparqlRequest request) {
        HttpRequest httpRequest = toHttpRequest(request);
        return client.sendAsync(httpRequest,
                HttpResponse.BodyHandlers.ofByteArray())
            .handle((response, error) -> {
                if (error != null) {
                    throw failure(request, unwrap(error));
                }
                return toSparqlResponse(request, response);
            });
    }

    @Override
    public StreamingResponse stream(final SparqlRequest request) {
        HttpRequest httpRequest = toHttpRequest(request);
        try {
            return toStreamingResponse(request, client.send(httpRequest,
                HttpResponse.BodyHandlers.ofInputStream()));
        } catch (IOException e) {
            throw failure(request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(request, e);
        }
    }

    @Override
    public CompletableFuture<StreamingResponse> streamAsync(
            final SparqlRequest request) {
        HttpRequest httpRequest = toHttpRequest(request);
        return client.sendAsync(httpRequest,
                HttpResponse.BodyHandlers.ofInputStream())
            .handle((response, error) -> {
                if (error != null) {
                    throw failure(request, unwrap(error));
                }
                return toStreamingResponse(request, response);
            });
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && ownedExecutor != null) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Shutting down owned HTTP executor");
            }
            ownedExecutor.shutdownNow();
        }
    }

    /**
     * Returns the underlying JDK client.
     *
     * @return the client
     */
    public HttpClient getHttpClient() {
        return client;
    }

    private HttpRequest toHttpRequest(final SparqlRequest request) {
        if (closed.get()) {
            throw new IllegalStateException("HTTP transport is closed");
        }
        String form = request.body().toFormEncoded();
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
            .method(request.method(),
                HttpRequest.BodyPublishers.ofString(form));
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if (config.getRequestTimeout() != null) {
            builder.timeout(config.getRequestTimeout());
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Request {} {}", request.method(), request.url());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Request {} {} headers={} body={}",
                request.method(), request.url(), request.headers(), form);
        }
        return builder.build();
    }

    private SparqlResponse toSparqlResponse(final SparqlRequest request,
                                            final HttpResponse<byte[]> response) {
        logResponse(request, response);
        return new SparqlResponse(response.statusCode(),
            request.url().toString(),
            new HttpHeaders(response.headers().map()),
            response.body());
    }

    private static StreamingResponse toStreamingResponse(
            final SparqlRequest request,
            final HttpResponse<InputStream> response) {
        logResponse(request, response);
        return new StreamingResponse(response.statusCode(),
            request.url().toString(),
            new HttpHeaders(response.headers().map()),
            response.body());
    }

    private static void logResponse(final SparqlRequest request,
                                    final HttpResponse<?> response) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Response {} {}", response.statusCode(),
                request.url());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Response {} {} version={} headers={}",
                response.statusCode(), request.url(), response.version(),
                response.headers().map());
        }
    }

    private static SparqlTransportException failure(
            final SparqlRequest request, final Throwable cause) {
        if (cause instanceof SparqlTransportException transportException) {
            return transportException;
        }
        return new SparqlTransportException("Failed to send "
            + request.method() + " " + request.url() + ": "
            + cause.getMessage(), cause);
    }

    private static Throwable unwrap(final Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable,
                "sparqlx-http-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
