package com.sparqlx.jena.convert;

import java.util.Objects;

/**
 * One term descriptor as it appears in a SPARQL JSON results row.
 *
 * @param type the term type: {@code uri}, {@code bnode}, {@code literal}
 *     or the legacy {@code typed-literal}
 * @param value the IRI, blank node label or lexical form
 * @param datatype the literal datatype IRI, or null
 * @param language the literal language tag, or null
 */
public record RdfTerm(String type, String value, String datatype,
                      String language) {

    /** Term type for IRIs. */
    public static final String TYPE_URI = "uri";
    /** Term type for blank nodes. */
    public static final String TYPE_BNODE = "bnode";
    /** Term type for literals. */
    public static final String TYPE_LITERAL = "literal";
    /** Term type used for typed literals by SPARQL 1.0 era endpoints. */
    public static final String TYPE_TYPED_LITERAL = "typed-literal";

    /**
     * Validates the mandatory parts.
     *
     * @param type the term type
     * @param value the term value
     * @param datatype the datatype IRI
     * @param language the language tag
     */
    public RdfTerm {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Creates an IRI descriptor.
     *
     * @param iri the IRI
     * @return the descriptor
     */
    public static RdfTerm uri(final String iri) {
        return new RdfTerm(TYPE_URI, iri, null, null);
    }

    /**
     * Creates a blank node descriptor.
     *
     * @param id the blank node label
     * @return the descriptor
     */
    public static RdfTerm bnode(final String id) {
        return new RdfTerm(TYPE_BNODE, id, null, null);
    }

    /**
     * Creates a literal descriptor.
     *
     * @param lexicalForm the lexical form
     * @param datatype the datatype IRI, or null for a plain literal
     * @return the descriptor
     */
    public static RdfTerm literal(final String lexicalForm,
                                  final String datatype) {
        return new RdfTerm(TYPE_LITERAL, lexicalForm, datatype, null);
    }
}
