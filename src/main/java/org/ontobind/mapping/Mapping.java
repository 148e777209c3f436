package org.ontobind.mapping;

import com.hp.hpl.jena.ontology.Individual;
import org.ontobind.ontology.OntologyStore;
import org.ontobind.ontology.PropertyConstraint;

/**
 * Binds one field of a domain object to one property of the ontology.
 *
 * @see DataPropertyMapping
 * @see ObjectPropertyMapping
 * @see ListMapping
 */
public interface Mapping {

    /**
     * Writes the value of {@code fieldName} read from {@code source} to {@code individual}.
     */
    void encode(final Individual individual, final Object source, final String fieldName, final OntologyStore store);

    /**
     * Reads the field value back from {@code individual}.
     */
    Object decode(final Individual individual, final OntologyStore store);

    /**
     * Builds the constraint an existing individual has to satisfy to stand for {@code source}.
     *
     * @throws UnsupportedQueryException if the field cannot be searched on
     */
    PropertyConstraint toConstraint(final Object source, final String fieldName, final OntologyStore store);

    default boolean isIdentityKey() {
        return false;
    }
}
