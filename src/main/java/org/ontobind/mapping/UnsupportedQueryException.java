package org.ontobind.mapping;

/**
 * Raised by mappings that cannot express their field as a search constraint.
 */
public class UnsupportedQueryException extends MappingException {

    private static final long serialVersionUID = 2874061911423513550L;

    public UnsupportedQueryException(final String message) {
        super(message);
    }
}
