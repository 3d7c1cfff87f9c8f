package com.sparqlx.jena;

import com.sparqlx.jena.convert.QueryResult;
import com.sparqlx.jena.convert.ResultBinding;
import com.sparqlx.jena.http.TransportConfig;
import org.apache.jena.graph.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple demo application that runs one query against a SPARQL endpoint
 * and logs the converted result.
 * <p>
 * The query is taken from the command line arguments, joined with
 * spaces; without arguments a query listing ten triples is used.
 * <p>
 * Settings can be configured via environment variables:
 * <ul>
 *   <li>SPARQL_ENDPOINT - query endpoint
 *       (default: http://localhost:3030/ds/query)</li>
 *   <li>SPARQL_CONNECT_TIMEOUT_MS, SPARQL_REQUEST_TIMEOUT_MS - see
 *       {@link TransportConfig#fromEnvironment()}</li>
 * </ul>
 */
public final class Main {
    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    /** Environment variable name for the query endpoint. */
    private static final String ENV_ENDPOINT = "SPARQL_ENDPOINT";

    /** Default endpoint when the environment variable is not set. */
    static final String DEFAULT_ENDPOINT = "http://localhost:3030/ds/query";

    /** Query run when none is given. */
    static final String DEFAULT_QUERY =
        "SELECT ?s ?p ?o WHERE { ?s ?p ?o } LIMIT 10";

    /** Prevent instantiation of this demo class. */
    private Main() {
        throw new AssertionError("No instances");
    }

    /**
     * Demo entry point.
     *
     * @param args the query text, possibly split over several arguments
     */
    public static void main(final String[] args) {
        String endpoint = System.getenv(ENV_ENDPOINT);
        if (endpoint == null || endpoint.isEmpty()) {
            endpoint = DEFAULT_ENDPOINT;
        }
        String query = args.length == 0 ? DEFAULT_QUERY : String.join(" ", args);

        runDemo(endpoint, query, TransportConfig.fromEnvironment());
    }

    /**
     * Run the demo against an endpoint.
     * This method is package-private to allow testing.
     *
     * @param endpoint the query endpoint
     * @param query the query text
     * @param config the transport settings
     * @return true if the query succeeded
     */
    static boolean runDemo(final String endpoint, final String query,
                           final TransportConfig config) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("SPARQL client demo against {}", endpoint);
        }
        try (SparqlClient client = SparqlClient.builder()
                .queryEndpoint(endpoint)
                .transportConfig(config)
                .build()) {
            QueryResult result = client.queryAndConvert(query);
            logResult(result);
            return true;
        } catch (SparqlClientException | IllegalArgumentException e) {
            if (LOGGER.isErrorEnabled()) {
                LOGGER.error("Query failed: {}", e.getMessage());
                LOGGER.error("Make sure a SPARQL endpoint is running at {}",
                    endpoint);
            }
            LOGGER.debug("Stack trace:", e);
            return false;
        }
    }

    private static void logResult(final QueryResult result) {
        if (!LOGGER.isInfoEnabled()) {
            return;
        }
        if (result instanceof QueryResult.SelectResult select) {
            LOGGER.info("Variables: {}", select.variables());
            for (ResultBinding row : select.bindings()) {
                LOGGER.info("  {}", row.toNativeMap());
            }
            LOGGER.info("Rows: {}", select.size());
        } else if (result instanceof QueryResult.AskResult ask) {
            LOGGER.info("Answer: {}", ask.value());
        } else if (result instanceof QueryResult.GraphResult graph) {
            graph.graph().find().forEachRemaining((Triple triple) ->
                LOGGER.info("  {}", triple));
            LOGGER.info("Triples: {}", graph.graph().size());
        }
    }
}
