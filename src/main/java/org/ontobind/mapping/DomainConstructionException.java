package org.ontobind.mapping;

/**
 * The decoded field values could not be turned into an instance of the domain type.
 */
public class DomainConstructionException extends MappingException {

    private static final long serialVersionUID = -1498733216300715034L;

    public DomainConstructionException(final String message) {
        super(message);
    }

    public DomainConstructionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
