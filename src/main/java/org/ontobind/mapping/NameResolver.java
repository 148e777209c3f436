package org.ontobind.mapping;

import com.hp.hpl.jena.ontology.OntClass;
import com.hp.hpl.jena.ontology.OntProperty;
import com.hp.hpl.jena.ontology.OntResource;
import org.ontobind.ontology.OntologyStore;

/**
 * Turns the names used in mapping declarations into store handles. Resolution failures raised by the store are
 * left untouched.
 */
public final class NameResolver {

    private NameResolver() {
    }

    public static OntResource resolve(final QualifiedName name, final OntologyStore store) {
        return store.resolveName(name.getName(), name.getNamespace());
    }

    public static OntProperty resolveProperty(final QualifiedName name, final OntologyStore store) {
        return resolve(name, store).asProperty();
    }

    public static OntClass resolveClass(final QualifiedName name, final OntologyStore store) {
        return resolve(name, store).asClass();
    }
}
