package com.sparqlx.jena.convert;

/**
 * Thrown when a CONSTRUCT/DESCRIBE response has no content type, or one
 * the RDF codec does not recognise.
 */
public class UnknownGraphFormatException extends ResultConversionException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception for the given content type.
     *
     * @param contentType the content type, possibly null
     */
    public UnknownGraphFormatException(final String contentType) {
        super(contentType == null
            ? "Graph response has no content type"
            : "Unknown RDF graph format: " + contentType);
    }
}
