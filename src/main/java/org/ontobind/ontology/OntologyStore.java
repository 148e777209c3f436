package org.ontobind.ontology;

import com.hp.hpl.jena.ontology.Individual;
import com.hp.hpl.jena.ontology.OntClass;
import com.hp.hpl.jena.ontology.OntProperty;
import com.hp.hpl.jena.ontology.OntResource;

import java.util.Collection;

/**
 * Connection to the ontology holding the individuals that domain objects are mapped to.
 * <p>
 * Values exchanged through this interface are plain Java values ({@link String}, {@link Integer},
 * {@link Boolean}, ...) for data properties and {@link Individual} handles for object properties.
 * Implementations are not expected to be thread safe.
 */
public interface OntologyStore {

    String getDefaultNamespace();

    /**
     * Looks up a class, property or individual declared in the ontology.
     *
     * @param name      local name of the entity
     * @param namespace namespace URI or registered prefix, {@code null} for the default namespace
     * @throws UnresolvableNameException if the ontology declares no such entity
     */
    OntResource resolveName(final String name, final String namespace);

    Individual createIndividual(final OntClass ontClass);

    /**
     * @return the single value of the property, or {@code null} if it has none
     */
    Object getPropertyValue(final Individual individual, final OntProperty property);

    Collection<Object> getPropertyValues(final Individual individual, final OntProperty property);

    /**
     * Replaces every value of the property. A {@code null} value clears it.
     */
    void setPropertyValue(final Individual individual, final OntProperty property, final Object value);

    void setPropertyValues(final Individual individual, final OntProperty property, final Collection<?> values);

    /**
     * @return the first individual of {@code ontClass} satisfying every constraint, or {@code null}
     */
    Individual searchOne(final OntClass ontClass, final Collection<PropertyConstraint> constraints);
}
