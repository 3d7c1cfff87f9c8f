package com.sparqlx.jena.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResponseFormats.
 */
public class ResponseFormatsTest {

    @Test
    @DisplayName("Test results document aliases")
    public void testBindingsAliases() {
        assertEquals("application/sparql-results+json",
            ResponseFormats.bindingsMimeType("json"));
        assertEquals("application/sparql-results+xml",
            ResponseFormats.bindingsMimeType("xml"));
        assertEquals("text/csv", ResponseFormats.bindingsMimeType("csv"));
        assertEquals("text/tab-separated-values",
            ResponseFormats.bindingsMimeType("tsv"));
    }

    @Test
    @DisplayName("Test graph aliases")
    public void testGraphAliases() {
        assertEquals("text/turtle", ResponseFormats.graphMimeType("turtle"));
        assertEquals("application/rdf+xml",
            ResponseFormats.graphMimeType("xml"));
        assertEquals("application/n-triples",
            ResponseFormats.graphMimeType("ntriples"));
        assertEquals("application/ld+json",
            ResponseFormats.graphMimeType("json-ld"));
    }

    @Test
    @DisplayName("Test defaults per query form")
    public void testDefaults() {
        assertEquals("application/sparql-results+json",
            ResponseFormats.mimeType(QueryType.SELECT, null));
        assertEquals("application/sparql-results+json",
            ResponseFormats.mimeType(QueryType.ASK, null));
        assertEquals("text/turtle",
            ResponseFormats.mimeType(QueryType.CONSTRUCT, null));
        assertEquals("text/turtle",
            ResponseFormats.mimeType(QueryType.DESCRIBE, null));
    }

    @Test
    @DisplayName("Test the xml alias depends on the query form")
    public void testXmlAliasPerForm() {
        assertEquals("application/sparql-results+xml",
            ResponseFormats.mimeType(QueryType.SELECT, "xml"));
        assertEquals("application/rdf+xml",
            ResponseFormats.mimeType(QueryType.DESCRIBE, "xml"));
    }

    @Test
    @DisplayName("Test unknown names pass through unchanged")
    public void testPassThrough() {
        assertEquals("application/json",
            ResponseFormats.bindingsMimeType("application/json"));
        assertEquals("text/n3", ResponseFormats.graphMimeType("text/n3"));
        assertEquals("yaml", ResponseFormats.bindingsMimeType("yaml"));
    }

    @Test
    @DisplayName("Test JSON variants")
    public void testIsJson() {
        assertTrue(ResponseFormats.isJson("application/json"));
        assertTrue(ResponseFormats.isJson("application/sparql-results+json"));
        assertFalse(ResponseFormats.isJson("text/csv"));
        assertFalse(ResponseFormats.isJson("json"));
    }
}
