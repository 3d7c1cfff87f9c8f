package com.sparqlx.jena;

import com.sparqlx.jena.convert.QueryResult;
import com.sparqlx.jena.http.HttpHeaders;
import com.sparqlx.jena.http.HttpTransport;
import com.sparqlx.jena.http.ResponseChunks;
import com.sparqlx.jena.http.ResponseLines;
import com.sparqlx.jena.http.ResponseText;
import com.sparqlx.jena.http.SparqlRequest;
import com.sparqlx.jena.http.SparqlResponse;
import com.sparqlx.jena.http.StreamingResponse;
import com.sparqlx.jena.query.ProtocolParameters;
import com.sparqlx.jena.query.QueryOptions;
import com.sparqlx.jena.query.SparqlQuery;
import com.sparqlx.jena.query.UpdateOptions;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigInteger;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.apache.jena.graph.Graph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SparqlClient against a mocked transport.
 */
@ExtendWith(MockitoExtension.class)
public class SparqlClientTest {

    private static final String QUERY_URL = "http://localhost:3030/ds/query";
    private static final String UPDATE_URL = "http://localhost:3030/ds/update";

    private static final String SELECT_JSON = """
        {"head": {"vars": ["x", "y"]},
         "results": {"bindings": [
           {"x": {"type": "literal", "value": "1",
                  "datatype": "http://www.w3.org/2001/XMLSchema#integer"},
            "y": {"type": "literal", "value": "2",
                  "datatype": "http://www.w3.org/2001/XMLSchema#integer"}}
         ]}}
        """;

    @Mock
    private HttpTransport transport;

    private SparqlClient client;

    @BeforeEach
    public void setUp() {
        client = SparqlClient.builder()
            .queryEndpoint(QUERY_URL)
            .updateEndpoint(UPDATE_URL)
            .transport(transport)
            .build();
    }

    private static SparqlResponse response(final int status,
                                           final String contentType,
                                           final String body) {
        return new SparqlResponse(status, QUERY_URL,
            new HttpHeaders(contentType == null ? Map.of()
                : Map.of("Content-Type", List.of(contentType))),
            body.getBytes(StandardCharsets.UTF_8));
    }

    private SparqlRequest captureSend() {
        ArgumentCaptor<SparqlRequest> captor =
            ArgumentCaptor.forClass(SparqlRequest.class);
        verify(transport).send(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Test query posts the form body to the query endpoint")
    public void testQueryRequest() {
        when(transport.send(any())).thenReturn(
            response(200, "application/sparql-results+json", SELECT_JSON));

        client.query("SELECT * WHERE { ?s ?p ?o }", QueryOptions.builder()
            .namedGraphUri("http://example.org/g1", "http://example.org/g2")
            .build());

        SparqlRequest request = captureSend();
        assertEquals("POST", request.method());
        assertEquals(QUERY_URL, request.url().toString());
        assertEquals("SELECT * WHERE { ?s ?p ?o }",
            request.body().first(ProtocolParameters.QUERY));
        assertEquals(List.of("http://example.org/g1", "http://example.org/g2"),
            request.body().get(ProtocolParameters.NAMED_GRAPH_URI));
        assertFalse(request.body().contains(ProtocolParameters.VERSION));
        assertFalse(request.body().contains(
            ProtocolParameters.DEFAULT_GRAPH_URI));
        assertEquals("application/sparql-results+json",
            request.headers().get("Accept"));
        assertEquals(ProtocolParameters.FORM_CONTENT_TYPE,
            request.headers().get("Content-Type"));
    }

    @Test
    @DisplayName("Test construct query asks for turtle")
    public void testConstructAcceptHeader() {
        when(transport.send(any())).thenReturn(response(200, "text/turtle",
            "<http://example.org/s> <http://example.org/p> \"o\" ."));

        client.query("CONSTRUCT WHERE { ?s ?p ?o }");

        assertEquals("text/turtle", captureSend().headers().get("Accept"));
    }

    @Test
    @DisplayName("Test non-2xx status raises SparqlHttpException")
    public void testHttpError() {
        when(transport.send(any())).thenReturn(
            response(400, "text/plain", "Parse error"));

        SparqlHttpException e = assertThrows(SparqlHttpException.class,
            () -> client.query("ASK { ?s ?p ?o }"));

        assertEquals(400, e.getStatusCode());
        assertEquals(QUERY_URL, e.getUrl());
        assertEquals("Parse error", e.getResponseBody());
    }

    @Test
    @DisplayName("Test queryAndConvert returns converted select rows")
    public void testQueryAndConvertSelect() {
        when(transport.send(any())).thenReturn(
            response(200, "application/sparql-results+json", SELECT_JSON));

        QueryResult result = client.queryAndConvert(
            "SELECT ?x ?y WHERE { ?x ?p ?y }");

        QueryResult.SelectResult select =
            assertInstanceOf(QueryResult.SelectResult.class, result);
        assertEquals(List.of("x", "y"), select.variables());
        assertEquals(1, select.size());
        assertEquals(BigInteger.ONE, select.bindings().get(0).getNative("x"));
        assertEquals(BigInteger.TWO, select.bindings().get(0).getNative("y"));
    }

    @Test
    @DisplayName("Test ask shortcut returns the boolean")
    public void testAsk() {
        when(transport.send(any())).thenReturn(response(200,
            "application/sparql-results+json", "{\"head\":{},\"boolean\":true}"));

        assertTrue(client.ask("ASK { ?s ?p ?o }"));
    }

    @Test
    @DisplayName("Test non-JSON format with conversion is rejected before sending")
    public void testConvertRequiresJson() {
        QueryOptions options = QueryOptions.builder()
            .responseFormat("csv")
            .build();

        IllegalArgumentException e = assertThrows(
            IllegalArgumentException.class,
            () -> client.queryAndConvert("SELECT * WHERE { ?s ?p ?o }",
                options));

        assertTrue(e.getMessage().contains("JSON response format required"));
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("Test invalid query text is rejected before sending")
    public void testQueryParseError() {
        assertThrows(QueryParseException.class,
            () -> client.query("SELEKT nothing"));
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("Test parse disabled requires typed queries")
    public void testParseDisabled() {
        SparqlClient unparsed = SparqlClient.builder()
            .queryEndpoint(QUERY_URL)
            .transport(transport)
            .parse(false)
            .build();

        assertThrows(IllegalArgumentException.class,
            () -> unparsed.query("SELECT * WHERE { ?s ?p ?o }"));
        verifyNoInteractions(transport);

        when(transport.send(any())).thenReturn(
            response(200, "application/sparql-results+json", SELECT_JSON));
        unparsed.query(SparqlQuery.select("not parsed"),
            QueryOptions.defaults());
        assertEquals("not parsed",
            captureSend().body().first(ProtocolParameters.QUERY));
    }

    @Test
    @DisplayName("Test update posts to the update endpoint without Accept")
    public void testUpdateRequest() {
        when(transport.send(any())).thenReturn(response(204, null, ""));

        client.update("INSERT DATA { <urn:s> <urn:p> 1 }",
            UpdateOptions.builder().usingGraphUri("urn:g").build());

        SparqlRequest request = captureSend();
        assertEquals(UPDATE_URL, request.url().toString());
        assertEquals("INSERT DATA { <urn:s> <urn:p> 1 }",
            request.body().first(ProtocolParameters.UPDATE));
        assertEquals(List.of("urn:g"),
            request.body().get(ProtocolParameters.USING_GRAPH_URI));
        assertNull(request.headers().get("Accept"));
        assertEquals("update", request.operation());
    }

    @Test
    @DisplayName("Test invalid update is rejected before sending")
    public void testUpdateParseError() {
        assertThrows(UpdateParseException.class,
            () -> client.update("INSERT NOTHING"));
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("Test batch queries keep input order")
    public void testQueriesOrder() {
        when(transport.sendAsync(any())).thenAnswer(invocation -> {
            SparqlRequest request = invocation.getArgument(0);
            return CompletableFuture.completedFuture(response(200,
                "application/sparql-results+json",
                request.body().first(ProtocolParameters.QUERY)));
        });

        List<SparqlResponse> responses = client.queries(
            "ASK { ?a ?b ?c }", "SELECT ?s WHERE { ?s ?p ?o }",
            "ASK { ?x ?y ?z }");

        assertEquals(3, responses.size());
        assertEquals("ASK { ?a ?b ?c }", responses.get(0).bodyAsString());
        assertEquals("SELECT ?s WHERE { ?s ?p ?o }",
            responses.get(1).bodyAsString());
        assertEquals("ASK { ?x ?y ?z }", responses.get(2).bodyAsString());
    }

    @Test
    @DisplayName("Test one failing update fails the whole batch")
    public void testUpdatesFailure() {
        when(transport.sendAsync(any())).thenAnswer(invocation -> {
            SparqlRequest request = invocation.getArgument(0);
            boolean bad = request.body().first(ProtocolParameters.UPDATE)
                .contains("urn:bad");
            return CompletableFuture.completedFuture(
                response(bad ? 500 : 204, null, bad ? "boom" : ""));
        });

        SparqlHttpException e = assertThrows(SparqlHttpException.class,
            () -> client.updates(
                "INSERT DATA { <urn:a> <urn:p> 1 }",
                "INSERT DATA { <urn:b> <urn:p> 2 }",
                "INSERT DATA { <urn:bad> <urn:p> 3 }",
                "INSERT DATA { <urn:c> <urn:p> 4 }",
                "INSERT DATA { <urn:d> <urn:p> 5 }"));

        assertEquals(500, e.getStatusCode());
        assertEquals("boom", e.getResponseBody());
    }

    @Test
    @DisplayName("Test a bad update in a batch is rejected before any send")
    public void testUpdatesValidatedUpFront() {
        assertThrows(UpdateParseException.class, () -> client.updates(
            "INSERT DATA { <urn:a> <urn:p> 1 }", "NOT AN UPDATE"));
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("Test batch conversion returns results in order")
    public void testQueriesAndConvert() {
        when(transport.sendAsync(any())).thenAnswer(invocation -> {
            SparqlRequest request = invocation.getArgument(0);
            String body = request.body().first(ProtocolParameters.QUERY)
                .startsWith("ASK")
                ? "{\"boolean\": false}" : SELECT_JSON;
            return CompletableFuture.completedFuture(response(200,
                "application/sparql-results+json", body));
        });

        List<QueryResult> results = client.queriesAndConvert(
            "SELECT ?x ?y WHERE { ?x ?p ?y }", "ASK { ?s ?p ?o }");

        assertInstanceOf(QueryResult.SelectResult.class, results.get(0));
        assertEquals(new QueryResult.AskResult(false), results.get(1));
    }

    @Test
    @DisplayName("Test streaming yields the body in chunks")
    public void testQueryStream() throws Exception {
        byte[] body = "0123456789".getBytes(StandardCharsets.UTF_8);
        when(transport.stream(any())).thenReturn(new StreamingResponse(200,
            QUERY_URL, new HttpHeaders(Map.of()),
            new ByteArrayInputStream(body)));

        StringBuilder read = new StringBuilder();
        int count = 0;
        try (ResponseChunks chunks = client.queryStream(
                "SELECT * WHERE { ?s ?p ?o }", QueryOptions.defaults(), 4)) {
            while (chunks.hasNext()) {
                read.append(new String(chunks.next(), StandardCharsets.UTF_8));
                count++;
            }
            assertTrue(chunks.isClosed());
        }
        assertEquals("0123456789", read.toString());
        assertEquals(3, count);
    }

    @Test
    @DisplayName("Test streaming error status closes the response")
    public void testQueryStreamError() {
        TrackingStream stream = new TrackingStream("no such graph");
        when(transport.stream(any())).thenReturn(new StreamingResponse(404,
            QUERY_URL, new HttpHeaders(Map.of()), stream));

        SparqlHttpException e = assertThrows(SparqlHttpException.class,
            () -> client.queryStream("SELECT * WHERE { ?s ?p ?o }"));

        assertEquals(404, e.getStatusCode());
        assertEquals("no such graph", e.getResponseBody());
        assertTrue(stream.closed);
    }

    @Test
    @DisplayName("Test non-positive chunk size is rejected")
    public void testQueryStreamChunkSize() {
        assertThrows(IllegalArgumentException.class,
            () -> client.queryStream("SELECT * WHERE { ?s ?p ?o }",
                QueryOptions.defaults(), 0));
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("Test borrowed transport is never closed by the client")
    public void testBorrowedTransportNotClosed() {
        when(transport.isOpen()).thenReturn(true);

        assertFalse(client.ownsTransport());
        client.close();

        verify(transport, never()).close();
        assertThrows(IllegalStateException.class,
            () -> client.query("ASK { ?s ?p ?o }"));
    }

    @Test
    @DisplayName("Test closing an open borrowed transport logs a warning")
    public void testBorrowedTransportWarning() {
        when(transport.isOpen()).thenReturn(true);

        String log = captureStderr(client::close);

        assertTrue(log.contains("WARN"), log);
        assertTrue(log.contains("is not managed by SparqlClient"), log);
    }

    @Test
    @DisplayName("Test closing a closed borrowed transport logs nothing")
    public void testBorrowedTransportNoWarning() {
        when(transport.isOpen()).thenReturn(false);

        String log = captureStderr(client::close);

        assertFalse(log.contains("is not managed by SparqlClient"), log);
        verify(transport, never()).close();
    }

    @Test
    @DisplayName("Test typed shortcuts send per-call options")
    public void testShortcutOptions() {
        when(transport.send(any())).thenReturn(
            response(200, "application/sparql-results+json", SELECT_JSON));
        QueryOptions options = QueryOptions.builder()
            .namedGraphUri("http://example.org/g1")
            .version("1.1")
            .build();

        QueryResult.SelectResult rows =
            client.select("SELECT ?x ?y WHERE { ?x ?p ?y }", options);

        SparqlRequest request = captureSend();
        assertEquals(List.of("http://example.org/g1"),
            request.body().get(ProtocolParameters.NAMED_GRAPH_URI));
        assertEquals("1.1", request.body().first(ProtocolParameters.VERSION));
        assertEquals(1, rows.bindings().size());
    }

    @Test
    @DisplayName("Test ask, construct and describe shortcuts send options")
    public void testGraphShortcutOptions() {
        QueryOptions options = QueryOptions.builder()
            .defaultGraphUri("http://example.org/d")
            .build();
        when(transport.send(any())).thenAnswer(invocation -> {
            SparqlRequest request = invocation.getArgument(0);
            assertEquals("http://example.org/d", request.body()
                .first(ProtocolParameters.DEFAULT_GRAPH_URI));
            return request.body().first(ProtocolParameters.QUERY)
                .startsWith("ASK")
                ? response(200, "application/sparql-results+json",
                    "{\"boolean\": true}")
                : response(200, "text/turtle", "<urn:a> <urn:p> <urn:b> .");
        });

        assertTrue(client.ask("ASK { ?s ?p ?o }", options));
        Graph constructed = client.construct(
            "CONSTRUCT { ?s ?p ?o } WHERE { ?s ?p ?o }", options);
        Graph described = client.describe("DESCRIBE <urn:a>", options);

        assertEquals(1, constructed.size());
        assertEquals(1, described.size());
        verify(transport, times(3)).send(any());
    }

    @Test
    @DisplayName("Test asynchronous streaming can be closed after one chunk")
    public void testQueryStreamAsync() {
        TrackingStream stream = new TrackingStream("0123456789");
        when(transport.streamAsync(any())).thenReturn(
            CompletableFuture.completedFuture(new StreamingResponse(200,
                QUERY_URL, new HttpHeaders(Map.of()), stream)));

        CompletableFuture<ResponseChunks> future = client.queryStreamAsync(
            "SELECT * WHERE { ?s ?p ?o }", QueryOptions.defaults(), 4);
        try (ResponseChunks chunks = future.join()) {
            assertEquals("0123",
                new String(chunks.next(), StandardCharsets.UTF_8));
            assertFalse(stream.closed);
        }

        assertTrue(stream.closed);
        verify(transport, never()).stream(any());
    }

    @Test
    @DisplayName("Test asynchronous streaming error status fails the future")
    public void testQueryStreamAsyncError() {
        TrackingStream stream = new TrackingStream("bad query");
        when(transport.streamAsync(any())).thenReturn(
            CompletableFuture.completedFuture(new StreamingResponse(400,
                QUERY_URL, new HttpHeaders(Map.of()), stream)));

        CompletionException e = assertThrows(CompletionException.class,
            () -> client.queryStreamAsync("SELECT * WHERE { ?s ?p ?o }",
                QueryOptions.defaults(), 8).join());

        SparqlHttpException cause =
            assertInstanceOf(SparqlHttpException.class, e.getCause());
        assertEquals(400, cause.getStatusCode());
        assertEquals("bad query", cause.getResponseBody());
        assertTrue(stream.closed);
    }

    @Test
    @DisplayName("Test asynchronous streaming checks the chunk size first")
    public void testQueryStreamAsyncChunkSize() {
        assertThrows(IllegalArgumentException.class,
            () -> client.queryStreamAsync("SELECT * WHERE { ?s ?p ?o }",
                QueryOptions.defaults(), 0));
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("Test line streaming can be closed after one line")
    public void testQueryLines() {
        TrackingStream stream = new TrackingStream("s\nurn:a\nurn:b\n");
        when(transport.stream(any())).thenReturn(new StreamingResponse(200,
            QUERY_URL, new HttpHeaders(Map.of("Content-Type",
                List.of("text/csv; charset=utf-8"))), stream));

        try (ResponseLines lines = client.queryLines(
                "SELECT ?s WHERE { ?s ?p ?o }", QueryOptions.builder()
                    .responseFormat("csv")
                    .build())) {
            assertEquals("s", lines.next());
            assertEquals("text/csv; charset=utf-8",
                lines.headers().first("Content-Type"));
        }

        assertTrue(stream.closed);
        ArgumentCaptor<SparqlRequest> captor =
            ArgumentCaptor.forClass(SparqlRequest.class);
        verify(transport).stream(captor.capture());
        assertEquals("text/csv", captor.getValue().headers().get("Accept"));
    }

    @Test
    @DisplayName("Test asynchronous line streaming reads every line")
    public void testQueryLinesAsync() {
        TrackingStream stream = new TrackingStream("a\nb");
        when(transport.streamAsync(any())).thenReturn(
            CompletableFuture.completedFuture(new StreamingResponse(200,
                QUERY_URL, new HttpHeaders(Map.of()), stream)));

        List<String> read = new ArrayList<>();
        try (ResponseLines lines = client.queryLinesAsync(
                "SELECT * WHERE { ?s ?p ?o }", QueryOptions.defaults()).join()) {
            lines.forEachRemaining(read::add);
        }

        assertEquals(List.of("a", "b"), read);
        assertTrue(stream.closed);
    }

    @Test
    @DisplayName("Test text streaming yields decoded chunks")
    public void testQueryTextStream() {
        when(transport.stream(any())).thenReturn(new StreamingResponse(200,
            QUERY_URL, new HttpHeaders(Map.of()),
            new TrackingStream("{\"head\": {}}")));

        try (ResponseText text = client.queryTextStream(
                "SELECT * WHERE { ?s ?p ?o }", QueryOptions.defaults(), 6)) {
            assertEquals("{\"head", text.next());
            assertEquals("\": {}}", text.next());
            assertFalse(text.hasNext());
        }
    }

    @Test
    @DisplayName("Test missing update endpoint fails")
    public void testMissingEndpoint() {
        SparqlClient queryOnly = SparqlClient.builder()
            .queryEndpoint(QUERY_URL)
            .transport(transport)
            .build();

        assertThrows(IllegalStateException.class,
            () -> queryOnly.update("CLEAR ALL"));
        verify(transport, never()).send(any());
    }

    @Test
    @DisplayName("Test transport and HTTP client cannot both be set")
    public void testBuilderConflict() {
        SparqlClient.Builder builder = SparqlClient.builder()
            .queryEndpoint(QUERY_URL)
            .transport(transport)
            .httpClient(HttpClient.newHttpClient());

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    @DisplayName("Test client without a supplied transport owns one")
    public void testOwnedTransport() {
        SparqlClient owning = SparqlClient.builder()
            .queryEndpoint(QUERY_URL)
            .build();

        assertTrue(owning.ownsTransport());
        assertTrue(owning.isParse());
        owning.close();
        owning.close();
    }

    private static String captureStderr(final Runnable action) {
        PrintStream original = System.err;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setErr(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            action.run();
        } finally {
            System.setErr(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    /** Input stream that records whether it was closed. */
    private static final class TrackingStream extends ByteArrayInputStream {
        /** Whether close() was called. */
        private boolean closed;

        TrackingStream(final String content) {
            super(content.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
