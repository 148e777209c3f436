package org.ontobind.ontology;

public class OntologyStoreException extends RuntimeException {

    private static final long serialVersionUID = 4117205093512338475L;

    public OntologyStoreException(final String message) {
        super(message);
    }

    public OntologyStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
