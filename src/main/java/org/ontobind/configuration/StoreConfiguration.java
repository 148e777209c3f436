package org.ontobind.configuration;

import com.hp.hpl.jena.ontology.OntModelSpec;
import org.apache.commons.lang3.StringUtils;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFLanguages;
import org.ontobind.ontology.OntologyStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

import static org.ontobind.configuration.ConfigurationConstants.*;

/**
 * Settings used to open a {@link org.ontobind.ontology.JenaOntologyStore}.
 */
public final class StoreConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(StoreConfiguration.class);

    private final String ontologyLocation;
    private final String defaultNamespace;
    private final Lang rdfFormat;
    private final OntModelSpec modelSpec;

    private StoreConfiguration(final String ontologyLocation, final String defaultNamespace, final Lang rdfFormat, final OntModelSpec modelSpec) {
        this.ontologyLocation = ontologyLocation;
        this.defaultNamespace = defaultNamespace;
        this.rdfFormat = rdfFormat;
        this.modelSpec = modelSpec;
    }

    /**
     * Reads {@code /ontobind.properties} from the classpath.
     */
    public static StoreConfiguration load() {
        return load(new Properties());
    }

    /**
     * Reads {@code /ontobind.properties} from the classpath, entries of {@code overrides} taking precedence.
     */
    public static StoreConfiguration load(final Properties overrides) {
        final Properties properties = new Properties();
        try (InputStream inputStream = StoreConfiguration.class.getResourceAsStream(CONFIGURATION_RESOURCE)) {
            if (inputStream == null) {
                logger.debug("No {} on the classpath", CONFIGURATION_RESOURCE);
            } else {
                properties.load(inputStream);
            }
        } catch (final IOException e) {
            throw new OntologyStoreException("Could not read " + CONFIGURATION_RESOURCE, e);
        }
        properties.putAll(overrides);
        return fromProperties(properties);
    }

    public static StoreConfiguration fromProperties(final Properties properties) {
        final String location = properties.getProperty(CONFIG_ONTOLOGY_LOCATION);
        if (StringUtils.isBlank(location)) {
            throw new OntologyStoreException("Missing configuration entry " + CONFIG_ONTOLOGY_LOCATION);
        }

        final String namespace = StringUtils.trimToNull(properties.getProperty(CONFIG_DEFAULT_NAMESPACE));

        Lang lang = null;
        final String format = StringUtils.trimToNull(properties.getProperty(CONFIG_RDF_FORMAT));
        if (format != null) {
            lang = RDFLanguages.nameToLang(format);
            if (lang == null) {
                throw new OntologyStoreException("Unknown RDF format '" + format + "' in " + CONFIG_RDF_FORMAT);
            }
        }

        final String specName = properties.getProperty(CONFIG_MODEL_SPEC, DEFAULT_MODEL_SPEC);
        return new StoreConfiguration(location.trim(), namespace, lang, modelSpec(specName));
    }

    static OntModelSpec modelSpec(final String specName) {
        final OntModelSpec spec;
        switch (specName.trim().toUpperCase(Locale.ROOT)) {
            case "OWL_MEM":
                spec = OntModelSpec.OWL_MEM;
                break;
            case "OWL_DL_MEM":
                spec = OntModelSpec.OWL_DL_MEM;
                break;
            case "OWL_LITE_MEM":
                spec = OntModelSpec.OWL_LITE_MEM;
                break;
            case "OWL_MEM_RDFS_INF":
                spec = OntModelSpec.OWL_MEM_RDFS_INF;
                break;
            case "OWL_DL_MEM_RDFS_INF":
                spec = OntModelSpec.OWL_DL_MEM_RDFS_INF;
                break;
            case "RDFS_MEM":
                spec = OntModelSpec.RDFS_MEM;
                break;
            default:
                throw new OntologyStoreException("Unsupported model spec '" + specName + "' in " + CONFIG_MODEL_SPEC);
        }
        return spec;
    }

    public String getOntologyLocation() {
        return ontologyLocation;
    }

    /**
     * @return the configured default namespace, {@code null} to use the ontology's empty prefix
     */
    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public Lang getRdfFormat() {
        return rdfFormat;
    }

    public OntModelSpec getModelSpec() {
        return modelSpec;
    }
}
