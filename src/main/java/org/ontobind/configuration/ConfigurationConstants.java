package org.ontobind.configuration;


public final class ConfigurationConstants {
    private ConfigurationConstants() {
    }

    public static final String CONFIGURATION_RESOURCE = "/ontobind.properties";

    public static final String CONFIG_ONTOLOGY_LOCATION = "config.ontology_location";
    public static final String CONFIG_DEFAULT_NAMESPACE = "config.default_namespace";
    public static final String CONFIG_RDF_FORMAT = "config.rdf_format";
    public static final String CONFIG_MODEL_SPEC = "config.model_spec";

    public static final String DEFAULT_MODEL_SPEC = "OWL_MEM";
}
