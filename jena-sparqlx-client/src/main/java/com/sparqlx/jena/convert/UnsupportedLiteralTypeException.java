package com.sparqlx.jena.convert;

/**
 * Thrown when a literal carries a datatype with no native mapping.
 */
public class UnsupportedLiteralTypeException extends ResultConversionException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /** Datatype IRI of the literal. */
    private final String datatype;
    /** Lexical form of the literal. */
    private final String lexicalForm;

    /**
     * Constructs a new exception for the given literal.
     *
     * @param datatype the datatype IRI
     * @param lexicalForm the lexical form
     */
    public UnsupportedLiteralTypeException(final String datatype,
                                           final String lexicalForm) {
        super("Unsupported literal datatype <" + datatype
            + "> for value \"" + lexicalForm + "\"");
        this.datatype = datatype;
        this.lexicalForm = lexicalForm;
    }

    /**
     * Returns the datatype IRI.
     *
     * @return the datatype
     */
    public String getDatatype() {
        return datatype;
    }

    /**
     * Returns the lexical form.
     *
     * @return the lexical form
     */
    public String getLexicalForm() {
        return lexicalForm;
    }
}
