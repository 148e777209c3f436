package org.ontobind.mapping;

public class MappingException extends RuntimeException {

    private static final long serialVersionUID = -6150446532906389265L;

    public MappingException(final String message) {
        super(message);
    }

    public MappingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
