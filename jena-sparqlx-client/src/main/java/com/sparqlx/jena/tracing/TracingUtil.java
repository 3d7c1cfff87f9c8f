package com.sparqlx.jena.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ServiceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configures the OpenTelemetry SDK used to trace SPARQL requests.
 *
 * <p>Spans are exported over OTLP gRPC. Configuration comes from the
 * environment:</p>
 * <ul>
 *   <li>{@code OTEL_TRACING_ENABLED} - enable tracing
 *       (default: false)</li>
 *   <li>{@code OTEL_SERVICE_NAME} - service name
 *       (default: jena-sparqlx-client)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT} - OTLP endpoint
 *       (default: http://localhost:4317)</li>
 * </ul>
 *
 * <p>Tracing stays off unless {@code OTEL_TRACING_ENABLED} is
 * {@code true}.</p>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Default service name. */
    private static final String DEFAULT_SERVICE_NAME = "jena-sparqlx-client";

    /** Default OTLP endpoint. */
    private static final String DEFAULT_OTLP_ENDPOINT =
        "http://localhost:4317";

    /** Environment variable for OTLP endpoint. */
    private static final String ENV_OTLP_ENDPOINT =
        "OTEL_EXPORTER_OTLP_ENDPOINT";

    /** Environment variable for service name. */
    private static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";

    /** Environment variable to enable tracing. */
    private static final String ENV_TRACING_ENABLED = "OTEL_TRACING_ENABLED";

    /** Instrumentation scope for HTTP transport calls. */
    public static final String SCOPE_HTTP_TRANSPORT = "com.sparqlx.jena.http";

    /** Singleton OpenTelemetry instance. */
    private static volatile OpenTelemetry openTelemetry;

    /** Lock for initialization. */
    private static final Object INIT_LOCK = new Object();

    /** Whether tracing is enabled. */
    private static volatile boolean tracingEnabled;

    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * Initialize OpenTelemetry once and return it.
     *
     * @return the OpenTelemetry instance, a no-op one when disabled
     */
    public static OpenTelemetry getOpenTelemetry() {
        if (openTelemetry == null) {
            synchronized (INIT_LOCK) {
                if (openTelemetry == null) {
                    openTelemetry = initializeOpenTelemetry();
                }
            }
        }
        return openTelemetry;
    }

    /**
     * Get a tracer for an instrumentation scope.
     *
     * @param scopeName the instrumentation scope name
     * @return the tracer
     */
    public static Tracer getTracer(final String scopeName) {
        return getOpenTelemetry().getTracer(scopeName);
    }

    /**
     * Check if tracing is enabled.
     *
     * @return true if {@code OTEL_TRACING_ENABLED} is {@code true}
     */
    public static boolean isTracingEnabled() {
        getOpenTelemetry();
        return tracingEnabled;
    }

    private static OpenTelemetry initializeOpenTelemetry() {
        String enabledEnv = System.getenv(ENV_TRACING_ENABLED);
        tracingEnabled = enabledEnv != null
            && Boolean.parseBoolean(enabledEnv.trim());

        if (!tracingEnabled) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("OpenTelemetry tracing is disabled");
            }
            return OpenTelemetry.noop();
        }

        String serviceName = getEnvOrDefault(ENV_SERVICE_NAME,
            DEFAULT_SERVICE_NAME);
        String otlpEndpoint = getEnvOrDefault(ENV_OTLP_ENDPOINT,
            DEFAULT_OTLP_ENDPOINT);

        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Initializing OpenTelemetry with service={}, "
                + "endpoint={}", serviceName, otlpEndpoint);
        }

        Resource resource = Resource.getDefault()
            .merge(Resource.create(Attributes.of(
                ServiceAttributes.SERVICE_NAME, serviceName)));

        OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(otlpEndpoint)
            .build();

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
            .setResource(resource)
            .build();

        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(
                W3CTraceContextPropagator.getInstance()))
            .build();

        // flush pending spans on exit
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Shutting down OpenTelemetry tracer provider");
            }
            tracerProvider.shutdown();
        }));

        return sdk;
    }

    private static String getEnvOrDefault(final String name,
            final String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    /**
     * Shut the tracing system down, flushing pending spans.
     */
    public static void shutdown() {
        if (openTelemetry instanceof OpenTelemetrySdk sdk) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Shutting down OpenTelemetry SDK");
            }
            sdk.getSdkTracerProvider().shutdown();
        }
    }
}
