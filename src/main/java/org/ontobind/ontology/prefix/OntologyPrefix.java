package org.ontobind.ontology.prefix;

import com.hp.hpl.jena.rdf.model.Model;
import com.hp.hpl.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.ontobind.ontology.OntologyStoreException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Set;

/**
 * Well-known namespace prefixes (owl, rdf, rdfs, xsd, skos, ...) read from {@code /prefixes.ttl}.
 */
public final class OntologyPrefix {

    private static final String PREFIXES_RESOURCE = "/prefixes.ttl";

    private static Model prefixModel;

    private OntologyPrefix() {
    }

    private static Model checkInit() {
        if (prefixModel == null) {
            final Model model = ModelFactory.createDefaultModel();
            try (InputStream prefixModelStream = OntologyPrefix.class.getResourceAsStream(PREFIXES_RESOURCE)) {
                if (prefixModelStream == null) {
                    throw new OntologyStoreException("Missing classpath resource " + PREFIXES_RESOURCE);
                }
                RDFDataMgr.read(model, prefixModelStream, Lang.TURTLE);
            } catch (final IOException e) {
                throw new OntologyStoreException("Could not read " + PREFIXES_RESOURCE, e);
            }
            prefixModel = model;
        }
        return prefixModel;
    }

    public static synchronized String getURI(final String entityName) {
        return checkInit().expandPrefix(entityName);
    }

    public static synchronized String getPrefixURI(final String prefix) {
        return checkInit().getNsPrefixURI(prefix);
    }

    public static synchronized Set<String> getPrefixes() {
        final Map<String, String> nsPrefixMap = checkInit().getNsPrefixMap();
        return nsPrefixMap.keySet();
    }
}
