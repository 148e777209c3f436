package org.ontobind.ontology;

import com.hp.hpl.jena.ontology.OntProperty;

import java.util.Collection;
import java.util.Objects;

/**
 * Equality constraint used when searching the store for an existing individual.
 * The value is either a single value, a collection of values compared as a set, or {@code null}
 * to require that the property has no value at all.
 */
public final class PropertyConstraint {
    private final OntProperty property;
    private final Object value;

    public PropertyConstraint(final OntProperty property, final Object value) {
        this.property = Objects.requireNonNull(property, "property");
        this.value = value;
    }

    public OntProperty getProperty() {
        return property;
    }

    public Object getValue() {
        return value;
    }

    public boolean isMultiValued() {
        return value instanceof Collection;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropertyConstraint)) {
            return false;
        }
        final PropertyConstraint that = (PropertyConstraint) o;
        return property.equals(that.property) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, value);
    }

    @Override
    public String toString() {
        return property.getLocalName() + "=" + value;
    }
}
