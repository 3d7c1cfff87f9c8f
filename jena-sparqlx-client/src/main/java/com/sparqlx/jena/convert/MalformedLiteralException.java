package com.sparqlx.jena.convert;

/**
 * Thrown when a literal's lexical form is not valid for its datatype.
 */
public class MalformedLiteralException extends ResultConversionException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception for the given literal.
     *
     * @param datatype the datatype IRI
     * @param lexicalForm the offending lexical form
     * @param cause the parse failure
     */
    public MalformedLiteralException(final String datatype,
                                     final String lexicalForm,
                                     final Throwable cause) {
        super("Lexical form \"" + lexicalForm + "\" is not valid for <"
            + datatype + ">", cause);
    }
}
