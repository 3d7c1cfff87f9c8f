package com.sparqlx.jena.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TracingUtil class.
 */
public class TracingUtilTest {

    @Test
    @DisplayName("Test scope constant is defined correctly")
    public void testScopeConstant() {
        assertEquals("com.sparqlx.jena.http",
            TracingUtil.SCOPE_HTTP_TRANSPORT);
    }

    @Test
    @DisplayName("Test getOpenTelemetry returns the same instance")
    public void testGetOpenTelemetrySingleton() {
        OpenTelemetry first = TracingUtil.getOpenTelemetry();
        assertNotNull(first);
        assertSame(first, TracingUtil.getOpenTelemetry());
    }

    @Test
    @DisplayName("Test getTracer returns non-null tracer")
    public void testGetTracer() {
        Tracer tracer = TracingUtil.getTracer(TracingUtil.SCOPE_HTTP_TRANSPORT);
        assertNotNull(tracer);
    }

    @Test
    @DisplayName("Test tracing follows OTEL_TRACING_ENABLED")
    public void testIsTracingEnabled() {
        boolean expected = "true".equalsIgnoreCase(
            String.valueOf(System.getenv("OTEL_TRACING_ENABLED")).trim());
        assertEquals(expected, TracingUtil.isTracingEnabled());
    }

    @Test
    @DisplayName("Test shutdown does not throw")
    public void testShutdown() {
        assertDoesNotThrow(TracingUtil::shutdown);
    }

    @Test
    @DisplayName("Test TracingUtil constructor is private")
    public void testPrivateConstructor() {
        var constructors = TracingUtil.class.getDeclaredConstructors();
        assertEquals(1, constructors.length);
        assertFalse(constructors[0].canAccess(null));
    }
}
