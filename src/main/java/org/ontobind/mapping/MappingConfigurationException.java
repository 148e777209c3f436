package org.ontobind.mapping;

public class MappingConfigurationException extends MappingException {

    private static final long serialVersionUID = 7331279026151784420L;

    public MappingConfigurationException(final String message) {
        super(message);
    }

    public MappingConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
