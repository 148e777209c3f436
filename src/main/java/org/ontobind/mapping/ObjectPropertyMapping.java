package org.ontobind.mapping;

import com.hp.hpl.jena.ontology.Individual;
import com.hp.hpl.jena.ontology.OntProperty;
import org.ontobind.ontology.OntologyStore;
import org.ontobind.ontology.PropertyConstraint;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps a field holding another domain object, or a collection of them, to an object property.
 * <p>
 * Referenced objects go through a {@link Mapper} obtained from {@code mapperFactory} on every call, so that mappers
 * of mutually referencing types can be declared without building each other eagerly.
 *
 * @param <T> type of the referenced domain objects
 */
public class ObjectPropertyMapping<T> implements Mapping {

    private final QualifiedName relation;
    private final Supplier<? extends Mapper<T>> mapperFactory;
    private final boolean functional;

    public ObjectPropertyMapping(final String relation, final Supplier<? extends Mapper<T>> mapperFactory) {
        this(QualifiedName.of(relation), mapperFactory, true);
    }

    public ObjectPropertyMapping(final QualifiedName relation, final Supplier<? extends Mapper<T>> mapperFactory, final boolean functional) {
        this.relation = Objects.requireNonNull(relation, "relation");
        this.mapperFactory = Objects.requireNonNull(mapperFactory, "mapperFactory");
        this.functional = functional;
    }

    /**
     * Finds or creates the individuals standing for the referenced object(s).
     * Search constraints are built from these individuals, so building a query for the referring object may create
     * individuals for the objects it references.
     *
     * @return an {@link Individual}, a list of them for multi-valued fields, or {@code null} for a {@code null} field
     */
    @SuppressWarnings("unchecked")
    public Object materialize(final Object source, final String fieldName) {
        final Mapper<T> mapper = mapperFactory.get();
        final Object value = DomainObjects.readField(source, fieldName);
        if (functional) {
            return (value == null) ? null : mapper.encode((T) value);
        }
        final List<Individual> individuals = new ArrayList<>();
        for (final Object element : DomainObjects.elements(value, fieldName)) {
            individuals.add(mapper.encode((T) element));
        }
        return individuals;
    }

    @Override
    public void encode(final Individual individual, final Object source, final String fieldName, final OntologyStore store) {
        final OntProperty property = NameResolver.resolveProperty(relation, store);
        final Object target = materialize(source, fieldName);
        if (functional) {
            store.setPropertyValue(individual, property, target);
        } else {
            store.setPropertyValues(individual, property, (List<?>) target);
        }
    }

    @Override
    public Object decode(final Individual individual, final OntologyStore store) {
        final OntProperty property = NameResolver.resolveProperty(relation, store);
        final Mapper<T> mapper = mapperFactory.get();
        if (functional) {
            final Object target = store.getPropertyValue(individual, property);
            return (target == null) ? null : mapper.decode((Individual) target);
        }
        final Set<T> targets = new HashSet<>();
        for (final Object target : store.getPropertyValues(individual, property)) {
            targets.add(mapper.decode((Individual) target));
        }
        return targets;
    }

    @Override
    public PropertyConstraint toConstraint(final Object source, final String fieldName, final OntologyStore store) {
        return new PropertyConstraint(NameResolver.resolveProperty(relation, store), materialize(source, fieldName));
    }

    public QualifiedName getRelation() {
        return relation;
    }

    public boolean isFunctional() {
        return functional;
    }
}
