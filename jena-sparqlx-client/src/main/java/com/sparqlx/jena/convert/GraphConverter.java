package com.sparqlx.jena.convert;

import com.sparqlx.jena.http.HttpHeaders;
import com.sparqlx.jena.http.SparqlResponse;
import java.io.ByteArrayInputStream;
import org.apache.jena.graph.Graph;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFLanguages;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.RiotException;
import org.apache.jena.sparql.graph.GraphFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a CONSTRUCT or DESCRIBE response into a Jena {@link Graph}.
 *
 * <p>The serialization is taken from the response Content-Type (without
 * parameters) and the bytes are handed to Jena RIOT. No RDF parsing is
 * done here.</p>
 */
public final class GraphConverter implements ResponseConverter {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        GraphConverter.class);

    /** Shared instance; the converter is stateless. */
    public static final GraphConverter INSTANCE = new GraphConverter();

    private GraphConverter() {
    }

    @Override
    public QueryResult.GraphResult convert(final SparqlResponse response) {
        return new QueryResult.GraphResult(
            toGraph(response.body(), response.contentType()));
    }

    /**
     * Parse graph bytes in the serialization named by a Content-Type.
     *
     * @param body the serialized graph
     * @param contentType the Content-Type header, parameters allowed
     * @return the parsed graph
     * @throws UnknownGraphFormatException if the content type is absent or
     *     not an RDF syntax RIOT knows
     * @throws MalformedGraphPayloadException if RIOT rejects the bytes
     */
    public Graph toGraph(final byte[] body, final String contentType) {
        Lang lang = resolveLang(contentType);
        Graph graph = GraphFactory.createDefaultGraph();
        try {
            RDFParser.create()
                .source(new ByteArrayInputStream(body))
                .lang(lang)
                .parse(graph);
        } catch (RiotException e) {
            throw new MalformedGraphPayloadException(
                lang.getContentType().getContentTypeStr(), e);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Parsed {} triples as {}", graph.size(),
                lang.getName());
        }
        return graph;
    }

    /**
     * Resolve the RIOT language for a Content-Type.
     *
     * @param contentType the Content-Type header, parameters allowed
     * @return the language
     * @throws UnknownGraphFormatException if none matches
     */
    public static Lang resolveLang(final String contentType) {
        String mimeType = HttpHeaders.mimeType(contentType);
        if (mimeType == null) {
            throw new UnknownGraphFormatException(null);
        }
        Lang lang = RDFLanguages.contentTypeToLang(mimeType);
        if (lang == null || !RDFLanguages.isTriples(lang)
                && !RDFLanguages.isQuads(lang)) {
            throw new UnknownGraphFormatException(mimeType);
        }
        return lang;
    }
}
