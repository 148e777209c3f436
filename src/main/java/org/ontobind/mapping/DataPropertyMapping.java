package org.ontobind.mapping;

import com.hp.hpl.jena.ontology.Individual;
import com.hp.hpl.jena.ontology.OntProperty;
import org.ontobind.ontology.OntologyStore;
import org.ontobind.ontology.PropertyConstraint;

import java.util.HashSet;
import java.util.Objects;

/**
 * Maps a scalar field, or a collection of scalars, to a data property.
 * <p>
 * Multi-valued fields decode to a {@link java.util.Set}: the order of the stored values is not kept.
 */
public class DataPropertyMapping implements Mapping {

    private final QualifiedName targetProperty;
    private final boolean functional;
    private final boolean identityKey;

    public DataPropertyMapping(final String targetProperty) {
        this(QualifiedName.of(targetProperty));
    }

    public DataPropertyMapping(final QualifiedName targetProperty) {
        this(targetProperty, true, false);
    }

    public DataPropertyMapping(final QualifiedName targetProperty, final boolean functional, final boolean identityKey) {
        this.targetProperty = Objects.requireNonNull(targetProperty, "targetProperty");
        this.functional = functional;
        this.identityKey = identityKey;
    }

    /**
     * Functional mapping used to find existing individuals.
     */
    public static DataPropertyMapping identityKey(final String targetProperty) {
        return new DataPropertyMapping(QualifiedName.of(targetProperty), true, true);
    }

    public static DataPropertyMapping multiValued(final QualifiedName targetProperty) {
        return new DataPropertyMapping(targetProperty, false, false);
    }

    @Override
    public void encode(final Individual individual, final Object source, final String fieldName, final OntologyStore store) {
        final OntProperty property = NameResolver.resolveProperty(targetProperty, store);
        final Object value = DomainObjects.readField(source, fieldName);
        if (functional) {
            store.setPropertyValue(individual, property, value);
        } else {
            store.setPropertyValues(individual, property, DomainObjects.elements(value, fieldName));
        }
    }

    @Override
    public Object decode(final Individual individual, final OntologyStore store) {
        final OntProperty property = NameResolver.resolveProperty(targetProperty, store);
        if (functional) {
            return store.getPropertyValue(individual, property);
        }
        return new HashSet<>(store.getPropertyValues(individual, property));
    }

    @Override
    public PropertyConstraint toConstraint(final Object source, final String fieldName, final OntologyStore store) {
        final Object value = DomainObjects.readField(source, fieldName);
        final Object target = functional ? value : DomainObjects.elements(value, fieldName);
        return new PropertyConstraint(NameResolver.resolveProperty(targetProperty, store), target);
    }

    @Override
    public boolean isIdentityKey() {
        return identityKey;
    }

    public QualifiedName getTargetProperty() {
        return targetProperty;
    }

    public boolean isFunctional() {
        return functional;
    }
}
