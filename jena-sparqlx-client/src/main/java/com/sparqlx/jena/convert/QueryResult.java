package com.sparqlx.jena.convert;

import java.util.List;
import java.util.Objects;
import org.apache.jena.graph.Graph;

/**
 * A converted query response. The variant follows the query type:
 * SELECT gives {@link SelectResult}, ASK gives {@link AskResult},
 * CONSTRUCT and DESCRIBE give {@link GraphResult}.
 */
public sealed interface QueryResult permits QueryResult.SelectResult,
        QueryResult.AskResult, QueryResult.GraphResult {

    /**
     * Rows of a SELECT query, in payload order.
     *
     * @param variables the declared variables, in header order
     * @param bindings the rows
     */
    record SelectResult(List<String> variables, List<ResultBinding> bindings)
            implements QueryResult {
        /**
         * Copies both lists.
         *
         * @param variables the declared variables
         * @param bindings the rows
         */
        public SelectResult {
            variables = List.copyOf(variables);
            bindings = List.copyOf(bindings);
        }

        /**
         * Number of rows.
         *
         * @return the row count
         */
        public int size() {
            return bindings.size();
        }
    }

    /**
     * Answer of an ASK query.
     *
     * @param value the boolean answer
     */
    record AskResult(boolean value) implements QueryResult { }

    /**
     * Triples returned by a CONSTRUCT or DESCRIBE query.
     *
     * @param graph the parsed graph
     */
    record GraphResult(Graph graph) implements QueryResult {
        /**
         * Validates the graph is present.
         *
         * @param graph the parsed graph
         */
        public GraphResult {
            Objects.requireNonNull(graph, "graph");
        }
    }
}
