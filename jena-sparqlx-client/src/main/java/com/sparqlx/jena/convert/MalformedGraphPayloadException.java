package com.sparqlx.jena.convert;

/**
 * Thrown when the RDF codec rejects a graph response body.
 */
public class MalformedGraphPayloadException extends ResultConversionException {
    /** Serial version. */
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception wrapping the codec failure.
     *
     * @param mimeType the MIME type the body was parsed as
     * @param cause the codec failure
     */
    public MalformedGraphPayloadException(final String mimeType,
                                          final Throwable cause) {
        super("Could not parse graph response as " + mimeType + ": "
            + cause.getMessage(), cause);
    }
}
