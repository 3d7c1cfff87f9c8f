package com.sparqlx.jena.tracing;

import com.sparqlx.jena.http.HttpTransport;
import com.sparqlx.jena.http.SparqlRequest;
import com.sparqlx.jena.http.SparqlResponse;
import com.sparqlx.jena.http.StreamingResponse;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * An {@link HttpTransport} decorator that records one CLIENT span per
 * SPARQL request.
 *
 * <p>Spans carry the HTTP method, endpoint URL, SPARQL operation and,
 * once known, the response status. A non-2xx status marks the span as
 * failed.</p>
 */
public final class TracedTransport implements HttpTransport {
    /** The wrapped transport. */
    private final HttpTransport delegate;

    /** Tracer for creating spans. */
    private final Tracer tracer;

    /** Whether spans are recorded. */
    private final boolean enabled;

    /** Attribute key for the HTTP method. */
    private static final AttributeKey<String> ATTR_HTTP_METHOD =
        AttributeKey.stringKey("http.request.method");

    /** Attribute key for the endpoint URL. */
    private static final AttributeKey<String> ATTR_URL =
        AttributeKey.stringKey("url.full");

    /** Attribute key for the SPARQL operation. */
    private static final AttributeKey<String> ATTR_OPERATION =
        AttributeKey.stringKey("sparql.operation");

    /** Attribute key for the response status. */
    private static final AttributeKey<Long> ATTR_STATUS =
        AttributeKey.longKey("http.response.status_code");

    /**
     * Wrap a transport, tracing only when {@link TracingUtil} reports
     * tracing enabled.
     *
     * @param transport the transport to wrap
     */
    public TracedTransport(final HttpTransport transport) {
        this(transport,
            TracingUtil.getTracer(TracingUtil.SCOPE_HTTP_TRANSPORT),
            TracingUtil.isTracingEnabled());
    }

    /**
     * Wrap a transport with an explicit tracer. Spans are always
     * recorded.
     *
     * @param transport the transport to wrap
     * @param spanTracer the tracer
     */
    public TracedTransport(final HttpTransport transport,
                           final Tracer spanTracer) {
        this(transport, spanTracer, true);
    }

    private TracedTransport(final HttpTransport transport,
                            final Tracer spanTracer,
                            final boolean tracingEnabled) {
        this.delegate = transport;
        this.tracer = spanTracer;
        this.enabled = tracingEnabled;
    }

    @Override
    public SparqlResponse send(final SparqlRequest request) {
        return traced(request, () -> delegate.send(request),
            SparqlResponse::statusCode);
    }

    @Override
    public CompletableFuture<SparqlResponse> sendAsync(
            final SparqlRequest request) {
        return tracedAsync(request, () -> delegate.sendAsync(request),
            SparqlResponse::statusCode);
    }

    @Override
    public StreamingResponse stream(final SparqlRequest request) {
        return traced(request, () -> delegate.stream(request),
            StreamingResponse::statusCode);
    }

    @Override
    public CompletableFuture<StreamingResponse> streamAsync(
            final SparqlRequest request) {
        return tracedAsync(request, () -> delegate.streamAsync(request),
            StreamingResponse::statusCode);
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public void close() {
        delegate.close();
    }

    /**
     * Get the wrapped transport.
     *
     * @return the delegate
     */
    public HttpTransport getDelegate() {
        return delegate;
    }

    private <T> T traced(final SparqlRequest request,
                         final Supplier<T> call,
                         final ToIntFunction<T> status) {
        if (!enabled) {
            return call.get();
        }
        Span span = startSpan(request);
        try (Scope scope = span.makeCurrent()) {
            T result = call.get();
            recordStatus(span, status.applyAsInt(result));
            return result;
        } catch (RuntimeException e) {
            fail(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private <T> CompletableFuture<T> tracedAsync(
            final SparqlRequest request,
            final Supplier<CompletableFuture<T>> call,
            final ToIntFunction<T> status) {
        if (!enabled) {
            return call.get();
        }
        Span span = startSpan(request);
        CompletableFuture<T> future;
        try (Scope scope = span.makeCurrent()) {
            future = call.get();
        } catch (RuntimeException e) {
            fail(span, e);
            span.end();
            throw e;
        }
        return future.whenComplete((result, error) -> {
            if (error != null) {
                fail(span, error);
            } else {
                recordStatus(span, status.applyAsInt(result));
            }
            span.end();
        });
    }

    private Span startSpan(final SparqlRequest request) {
        return tracer.spanBuilder("SPARQL " + request.operation())
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute(ATTR_HTTP_METHOD, request.method())
            .setAttribute(ATTR_URL, request.url().toString())
            .setAttribute(ATTR_OPERATION, request.operation())
            .startSpan();
    }

    private static void recordStatus(final Span span, final int statusCode) {
        span.setAttribute(ATTR_STATUS, (long) statusCode);
        if (statusCode >= 200 && statusCode < 300) {
            span.setStatus(StatusCode.OK);
        } else {
            span.setStatus(StatusCode.ERROR, "HTTP " + statusCode);
        }
    }

    private static void fail(final Span span, final Throwable error) {
        span.setStatus(StatusCode.ERROR, error.getMessage());
        span.recordException(error);
    }
}
