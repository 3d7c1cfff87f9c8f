package com.sparqlx.jena.query;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ProtocolParameters.
 */
public class ProtocolParametersTest {

    @Test
    @DisplayName("Test option names are hyphenated")
    public void testProtocolName() {
        assertEquals("named-graph-uri",
            ProtocolParameters.toProtocolName("named_graph_uri"));
        assertEquals("using-named-graph-uri",
            ProtocolParameters.toProtocolName("using_named_graph_uri"));
        assertEquals("query", ProtocolParameters.toProtocolName("query"));
    }

    @Test
    @DisplayName("Test named graph option is sent under its protocol name")
    public void testNamedGraphField() {
        ProtocolParameters body = ProtocolParameters.builder()
            .param("query", "SELECT * WHERE { ?s ?p ?o }")
            .param("named_graph_uri", List.of("https://named.graph"))
            .build();
        assertEquals(List.of("https://named.graph"),
            body.get(ProtocolParameters.NAMED_GRAPH_URI));
        assertFalse(body.contains("named_graph_uri"));
    }

    @Test
    @DisplayName("Test null options are omitted")
    public void testNullOmitted() {
        String version = null;
        List<String> graphs = null;
        ProtocolParameters body = ProtocolParameters.builder()
            .param("query", "ASK {}")
            .param("version", version)
            .param("default_graph_uri", graphs)
            .build();
        assertFalse(body.contains(ProtocolParameters.VERSION));
        assertFalse(body.contains(ProtocolParameters.DEFAULT_GRAPH_URI));
        assertEquals("query=ASK+%7B%7D", body.toFormEncoded());
    }

    @Test
    @DisplayName("Test repeated values keep input order")
    public void testRepeatedValues() {
        ProtocolParameters body = ProtocolParameters.builder()
            .param("default_graph_uri", List.of("http://g/2", "http://g/1"))
            .build();
        assertEquals(List.of("http://g/2", "http://g/1"),
            body.get("default-graph-uri"));
        assertEquals("default-graph-uri=http%3A%2F%2Fg%2F2"
            + "&default-graph-uri=http%3A%2F%2Fg%2F1", body.toFormEncoded());
    }

    @Test
    @DisplayName("Test absent parameter lookups")
    public void testAbsent() {
        ProtocolParameters body = ProtocolParameters.builder().build();
        assertEquals(List.of(), body.get("query"));
        assertNull(body.first("query"));
        assertEquals("", body.toFormEncoded());
    }

    @Test
    @DisplayName("Test equality is by content")
    public void testEquality() {
        ProtocolParameters a = ProtocolParameters.builder()
            .param("update", "CLEAR ALL").build();
        ProtocolParameters b = ProtocolParameters.builder()
            .param("update", "CLEAR ALL").build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
