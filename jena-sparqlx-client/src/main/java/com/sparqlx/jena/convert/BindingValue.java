package com.sparqlx.jena.convert;

import java.util.Objects;

/**
 * The value bound to one variable in one result row.
 *
 * <p>Exactly one of:</p>
 * <ul>
 *   <li>{@link Uri} - an absolute IRI, unmodified</li>
 *   <li>{@link BlankNode} - a blank node label as sent by the endpoint</li>
 *   <li>{@link Literal} - a literal coerced to a native Java value</li>
 *   <li>{@link RawLiteral} - a literal kept in lexical form because no
 *       native type represents it without loss (e.g. {@code xsd:gYear})</li>
 *   <li>{@link Unbound} - the variable has no value in this row</li>
 * </ul>
 */
public sealed interface BindingValue permits BindingValue.Uri,
        BindingValue.BlankNode, BindingValue.Literal,
        BindingValue.RawLiteral, BindingValue.Unbound {

    /** Shared marker for variables without a value. */
    Unbound UNBOUND = new Unbound();

    /**
     * Returns the plain Java view of this value: the IRI string, the blank
     * node label, the native literal value, the lexical form of a raw
     * literal, or {@code null} when unbound.
     *
     * @return the native value, or null
     */
    Object toNative();

    /**
     * Whether this value is the unbound marker.
     *
     * @return true if unbound
     */
    default boolean isUnbound() {
        return this instanceof Unbound;
    }

    /**
     * An IRI term.
     *
     * @param iri the absolute IRI
     */
    record Uri(String iri) implements BindingValue {
        /**
         * Validates the IRI is present.
         *
         * @param iri the absolute IRI
         */
        public Uri {
            Objects.requireNonNull(iri, "iri");
        }

        @Override
        public Object toNative() {
            return iri;
        }
    }

    /**
     * A blank node term.
     *
     * @param id the blank node label
     */
    record BlankNode(String id) implements BindingValue {
        /**
         * Validates the label is present.
         *
         * @param id the blank node label
         */
        public BlankNode {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public Object toNative() {
            return id;
        }
    }

    /**
     * A literal coerced to a native Java value.
     *
     * @param value the native value
     * @param datatype the datatype IRI, or null for a plain literal
     * @param language the language tag, or null
     */
    record Literal(Object value, String datatype, String language)
            implements BindingValue {
        /**
         * Validates the value is present.
         *
         * @param value the native value
         * @param datatype the datatype IRI
         * @param language the language tag
         */
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object toNative() {
            return value;
        }
    }

    /**
     * A literal kept in its lexical form together with its datatype, so
     * it can be told apart from a plain string with the same text.
     *
     * @param lexicalForm the lexical form as sent by the endpoint
     * @param datatype the datatype IRI
     */
    record RawLiteral(String lexicalForm, String datatype)
            implements BindingValue {
        /**
         * Validates both parts are present.
         *
         * @param lexicalForm the lexical form
         * @param datatype the datatype IRI
         */
        public RawLiteral {
            Objects.requireNonNull(lexicalForm, "lexicalForm");
            Objects.requireNonNull(datatype, "datatype");
        }

        @Override
        public Object toNative() {
            return lexicalForm;
        }
    }

    /** A variable that has no value in the row. */
    record Unbound() implements BindingValue {
        @Override
        public Object toNative() {
            return null;
        }
    }
}
