package org.ontobind.ontology;


import com.hp.hpl.jena.ontology.Individual;
import com.hp.hpl.jena.ontology.OntClass;
import com.hp.hpl.jena.ontology.OntModel;
import com.hp.hpl.jena.ontology.OntModelSpec;
import com.hp.hpl.jena.ontology.OntProperty;
import com.hp.hpl.jena.ontology.OntResource;
import com.hp.hpl.jena.rdf.model.Literal;
import com.hp.hpl.jena.rdf.model.ModelFactory;
import com.hp.hpl.jena.rdf.model.RDFNode;
import com.hp.hpl.jena.util.iterator.ExtendedIterator;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.ontobind.configuration.StoreConfiguration;
import org.ontobind.ontology.prefix.OntologyPrefix;
import org.ontobind.utils.OntologyLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link OntologyStore} backed by an in-memory Jena {@link OntModel}.
 * <p>
 * The model runs with strict mode disabled so that any declared resource can be viewed as a class, a property or an
 * individual without the profile checks of the OWL vocabulary.
 */
public class JenaOntologyStore implements OntologyStore {

    private static final Logger logger = LoggerFactory.getLogger(JenaOntologyStore.class);

    private static final String DEFAULT_INDIVIDUAL_NAME = "individual";

    private final OntModel model;
    private final String defaultNamespace;

    private final Map<String, AtomicInteger> individualCounters = new HashMap<>();

    public JenaOntologyStore(final OntModel model, final String defaultNamespace) {
        this.model = model;
        this.defaultNamespace = defaultNamespace;
        model.setStrictMode(false);
        loadPrefixes();
    }

    /**
     * Creates a store around an empty OWL model, entities have to be declared through {@link #getModel()}.
     */
    public static JenaOntologyStore empty(final String defaultNamespace) {
        return new JenaOntologyStore(ModelFactory.createOntologyModel(OntModelSpec.OWL_MEM), defaultNamespace);
    }

    public static JenaOntologyStore load(final StoreConfiguration configuration) {
        final OntModel ontModel = OntologyLoader.loadModel(configuration.getOntologyLocation(),
                configuration.getModelSpec(), configuration.getRdfFormat());

        String namespace = configuration.getDefaultNamespace();
        if (namespace == null) {
            namespace = ontModel.getNsPrefixURI("");
        }
        if (namespace == null) {
            throw new OntologyStoreException("No default namespace configured and none declared by "
                    + configuration.getOntologyLocation());
        }
        logger.info("Ontology store ready, default namespace <{}>", namespace);
        return new JenaOntologyStore(ontModel, namespace);
    }

    private void loadPrefixes() {
        final Map<String, String> nsPrefixMap = model.getNsPrefixMap();
        for (final String systemPrefix : OntologyPrefix.getPrefixes()) {
            if (!nsPrefixMap.containsKey(systemPrefix)) {
                model.setNsPrefix(systemPrefix, OntologyPrefix.getPrefixURI(systemPrefix));
            }
        }
    }

    public OntModel getModel() {
        return model;
    }

    @Override
    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    @Override
    public OntResource resolveName(final String name, final String namespace) {
        final String namespaceURI = expandNamespace(namespace);
        final OntResource resource = model.getOntResource(joinNamespace(namespaceURI, name));
        if (resource == null) {
            throw new UnresolvableNameException(name, namespaceURI);
        }
        return resource;
    }

    private String expandNamespace(final String namespace) {
        final String namespaceURI;
        if (namespace == null) {
            namespaceURI = defaultNamespace;
        } else {
            final String prefixURI = model.getNsPrefixURI(namespace);
            namespaceURI = (prefixURI == null) ? namespace : prefixURI;
        }
        return namespaceURI;
    }

    static String joinNamespace(final String namespaceURI, final String name) {
        if (namespaceURI.endsWith("#") || namespaceURI.endsWith("/")) {
            return namespaceURI + name;
        }
        return namespaceURI + "#" + name;
    }

    @Override
    public Individual createIndividual(final OntClass ontClass) {
        String baseName = ontClass.getLocalName();
        if ((baseName == null) || baseName.isEmpty()) {
            baseName = DEFAULT_INDIVIDUAL_NAME;
        }
        baseName = baseName.toLowerCase(Locale.ROOT);

        final AtomicInteger counter = individualCounters.computeIfAbsent(baseName, key -> new AtomicInteger(0));
        String uri;
        do {
            uri = joinNamespace(defaultNamespace, baseName + counter.incrementAndGet());
        } while (model.getOntResource(uri) != null);

        logger.debug("Creating individual <{}>", uri);
        return model.createIndividual(uri, ontClass);
    }

    @Override
    public Object getPropertyValue(final Individual individual, final OntProperty property) {
        final RDFNode node = individual.getPropertyValue(property);
        return (node == null) ? null : toValue(node);
    }

    @Override
    public Collection<Object> getPropertyValues(final Individual individual, final OntProperty property) {
        final List<Object> values = new ArrayList<>();
        for (final RDFNode node : individual.listPropertyValues(property).toList()) {
            values.add(toValue(node));
        }
        return values;
    }

    @Override
    public void setPropertyValue(final Individual individual, final OntProperty property, final Object value) {
        individual.removeAll(property);
        if (value != null) {
            individual.addProperty(property, toNode(value));
        }
    }

    @Override
    public void setPropertyValues(final Individual individual, final OntProperty property, final Collection<?> values) {
        individual.removeAll(property);
        if (values != null) {
            for (final Object value : values) {
                individual.addProperty(property, toNode(value));
            }
        }
    }

    @Override
    public Individual searchOne(final OntClass ontClass, final Collection<PropertyConstraint> constraints) {
        final ExtendedIterator<Individual> candidates = model.listIndividuals(ontClass);
        try {
            while (candidates.hasNext()) {
                final Individual candidate = candidates.next();
                if (matchesAll(candidate, constraints)) {
                    return candidate;
                }
            }
        } finally {
            candidates.close();
        }
        return null;
    }

    private boolean matchesAll(final Individual candidate, final Collection<PropertyConstraint> constraints) {
        for (final PropertyConstraint constraint : constraints) {
            if (!matches(candidate, constraint)) {
                return false;
            }
        }
        return true;
    }

    private boolean matches(final Individual candidate, final PropertyConstraint constraint) {
        final List<RDFNode> stored = candidate.listPropertyValues(constraint.getProperty()).toList();
        final Object value = constraint.getValue();

        final List<RDFNode> expected = new ArrayList<>();
        if (value instanceof Collection) {
            for (final Object element : (Collection<?>) value) {
                expected.add(toNode(element));
            }
        } else if (value != null) {
            expected.add(toNode(value));
        }

        return sameNodes(stored, expected);
    }

    /**
     * Set equality of two node lists, literals being compared by value.
     */
    private static boolean sameNodes(final List<RDFNode> stored, final List<RDFNode> expected) {
        for (final RDFNode node : stored) {
            if (!containsNode(expected, node)) {
                return false;
            }
        }
        for (final RDFNode node : expected) {
            if (!containsNode(stored, node)) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsNode(final Iterable<RDFNode> nodes, final RDFNode node) {
        for (final RDFNode candidate : nodes) {
            if (sameNode(candidate, node)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameNode(final RDFNode left, final RDFNode right) {
        if (left.isLiteral() && right.isLiteral()) {
            return left.asLiteral().sameValueAs(right.asLiteral());
        }
        return left.equals(right);
    }

    private RDFNode toNode(final Object value) {
        if (value instanceof RDFNode) {
            return (RDFNode) value;
        }
        return model.createTypedLiteral(value);
    }

    private static Object toValue(final RDFNode node) {
        if (node.isLiteral()) {
            final Literal literal = node.asLiteral();
            return literal.getValue();
        }
        return node.as(Individual.class);
    }

    /**
     * Serializes the whole model, e.g. to save the individuals created by the mappers.
     */
    public void write(final OutputStream outputStream, final Lang lang) {
        RDFDataMgr.write(outputStream, model, lang);
    }
}
