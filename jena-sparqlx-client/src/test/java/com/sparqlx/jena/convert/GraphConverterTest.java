package com.sparqlx.jena.convert;

import com.sparqlx.jena.http.HttpHeaders;
import com.sparqlx.jena.http.SparqlResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.riot.Lang;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GraphConverter.
 */
public class GraphConverterTest {

    private static final String TURTLE =
        "@prefix ex: <http://example.org/> .\n"
            + "ex:alice ex:knows ex:bob .\n"
            + "ex:bob ex:name \"Bob\" .\n";

    private static SparqlResponse response(final String contentType,
                                           final String body) {
        Map<String, List<String>> headers = contentType == null
            ? Map.of() : Map.of("Content-Type", List.of(contentType));
        return new SparqlResponse(200, "http://ex/q", new HttpHeaders(headers),
            body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Test Turtle response with charset parameter")
    public void testTurtle() {
        QueryResult.GraphResult result = GraphConverter.INSTANCE.convert(
            response("text/turtle; charset=utf-8", TURTLE));
        Graph graph = result.graph();
        assertEquals(2, graph.size());
        Node alice = NodeFactory.createURI("http://example.org/alice");
        Node knows = NodeFactory.createURI("http://example.org/knows");
        Node bob = NodeFactory.createURI("http://example.org/bob");
        assertTrue(graph.contains(alice, knows, bob));
    }

    @Test
    @DisplayName("Test N-Triples response")
    public void testNTriples() {
        Graph graph = GraphConverter.INSTANCE.toGraph(
            ("<http://example.org/a> <http://example.org/p> \"v\" .\n")
                .getBytes(StandardCharsets.UTF_8),
            "application/n-triples");
        assertEquals(1, graph.size());
    }

    @Test
    @DisplayName("Test header is resolved to a RIOT language")
    public void testResolveLang() {
        assertEquals(Lang.TURTLE, GraphConverter.resolveLang("text/turtle"));
        assertEquals(Lang.RDFXML,
            GraphConverter.resolveLang("application/rdf+xml;charset=UTF-8"));
        assertEquals(Lang.JSONLD,
            GraphConverter.resolveLang("application/ld+json"));
    }

    @Test
    @DisplayName("Test missing content type")
    public void testMissingContentType() {
        UnknownGraphFormatException e = assertThrows(
            UnknownGraphFormatException.class,
            () -> GraphConverter.INSTANCE.convert(response(null, TURTLE)));
        assertTrue(e.getMessage().contains("no content type"), e.getMessage());
    }

    @Test
    @DisplayName("Test content type that is not an RDF syntax")
    public void testUnknownContentType() {
        UnknownGraphFormatException e = assertThrows(
            UnknownGraphFormatException.class,
            () -> GraphConverter.INSTANCE.convert(
                response("application/pdf", TURTLE)));
        assertTrue(e.getMessage().contains("application/pdf"), e.getMessage());
    }

    @Test
    @DisplayName("Test body the codec rejects")
    public void testMalformedBody() {
        assertThrows(MalformedGraphPayloadException.class,
            () -> GraphConverter.INSTANCE.convert(
                response("text/turtle", "ex:a ex:b")));
    }
}
