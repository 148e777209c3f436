package org.ontobind.mapping;

import com.hp.hpl.jena.ontology.Individual;
import com.hp.hpl.jena.ontology.OntClass;
import com.hp.hpl.jena.ontology.OntProperty;
import org.ontobind.ontology.OntologyStore;
import org.ontobind.ontology.PropertyConstraint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Maps an ordered list of domain objects to an object property.
 * <p>
 * Object properties hold sets, so every element is reached through a pivot individual carrying the element and its
 * position:
 * <pre>
 *   owner --relation--&gt; pivot --itemRelation--&gt; element
 *                        pivot --indexProperty--&gt; 0..n-1
 * </pre>
 * Encoding replaces the relation with a fresh set of pivots. Pivots assigned by an earlier encode are detached from
 * the owner but stay in the store.
 * <p>
 * The store is needed to create pivots. A {@link Mapper} never passes a {@code null} store since it requires one
 * when built, so the {@link MappingConfigurationException} for a missing store only arises when the mapping is
 * called directly.
 *
 * @param <T> type of the list elements
 */
public class ListMapping<T> implements Mapping {

    public static final String DEFAULT_INDEX_PROPERTY = "sequence_number";

    private final QualifiedName relation;
    private final QualifiedName pivotClass;
    private final QualifiedName itemRelation;
    private final QualifiedName indexProperty;
    private final Supplier<? extends Mapper<T>> itemMapperFactory;

    public ListMapping(final QualifiedName relation, final QualifiedName pivotClass, final QualifiedName itemRelation,
                       final Supplier<? extends Mapper<T>> itemMapperFactory) {
        this(relation, pivotClass, itemRelation, itemMapperFactory, QualifiedName.of(DEFAULT_INDEX_PROPERTY));
    }

    public ListMapping(final QualifiedName relation, final QualifiedName pivotClass, final QualifiedName itemRelation,
                       final Supplier<? extends Mapper<T>> itemMapperFactory, final QualifiedName indexProperty) {
        this.relation = Objects.requireNonNull(relation, "relation");
        this.pivotClass = Objects.requireNonNull(pivotClass, "pivotClass");
        this.itemRelation = Objects.requireNonNull(itemRelation, "itemRelation");
        this.itemMapperFactory = Objects.requireNonNull(itemMapperFactory, "itemMapperFactory");
        this.indexProperty = Objects.requireNonNull(indexProperty, "indexProperty");
    }

    @Override
    @SuppressWarnings("unchecked")
    public void encode(final Individual individual, final Object source, final String fieldName, final OntologyStore store) {
        checkStore(store);
        final OntProperty relationProperty = NameResolver.resolveProperty(relation, store);
        final OntClass pivotOntClass = NameResolver.resolveClass(pivotClass, store);
        final OntProperty itemProperty = NameResolver.resolveProperty(itemRelation, store);
        final OntProperty indexOntProperty = NameResolver.resolveProperty(indexProperty, store);

        final Mapper<T> mapper = itemMapperFactory.get();
        final List<Object> elements = DomainObjects.elements(DomainObjects.readField(source, fieldName), fieldName);
        final List<Individual> pivots = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            final Individual pivot = store.createIndividual(pivotOntClass);
            final Individual item = mapper.encode((T) elements.get(i));
            store.setPropertyValue(pivot, itemProperty, item);
            store.setPropertyValue(pivot, indexOntProperty, i);
            pivots.add(pivot);
        }
        store.setPropertyValues(individual, relationProperty, pivots);
    }

    @Override
    public Object decode(final Individual individual, final OntologyStore store) {
        checkStore(store);
        final OntProperty relationProperty = NameResolver.resolveProperty(relation, store);
        final OntProperty itemProperty = NameResolver.resolveProperty(itemRelation, store);
        final OntProperty indexOntProperty = NameResolver.resolveProperty(indexProperty, store);

        final List<Individual> pivots = new ArrayList<>();
        for (final Object pivot : store.getPropertyValues(individual, relationProperty)) {
            pivots.add((Individual) pivot);
        }
        pivots.sort(Comparator.comparingInt(pivot -> index(pivot, indexOntProperty, store)));

        final Mapper<T> mapper = itemMapperFactory.get();
        final List<T> elements = new ArrayList<>(pivots.size());
        for (final Individual pivot : pivots) {
            final Object item = store.getPropertyValue(pivot, itemProperty);
            if (item == null) {
                throw new MappingException(String.format("List item <%s> has no %s", pivot.getURI(), itemRelation));
            }
            elements.add(mapper.decode((Individual) item));
        }
        return elements;
    }

    private static int index(final Individual pivot, final OntProperty indexOntProperty, final OntologyStore store) {
        final Object index = store.getPropertyValue(pivot, indexOntProperty);
        if (!(index instanceof Number)) {
            throw new MappingException(String.format("List item <%s> has no numeric %s: %s",
                    pivot.getURI(), indexOntProperty.getLocalName(), index));
        }
        return ((Number) index).intValue();
    }

    @Override
    public PropertyConstraint toConstraint(final Object source, final String fieldName, final OntologyStore store) {
        throw new UnsupportedQueryException(String.format("Ordered list '%s' mapped through %s cannot be searched on",
                fieldName, relation));
    }

    private static void checkStore(final OntologyStore store) {
        if (store == null) {
            throw new MappingConfigurationException("ListMapping requires an ontology store to create its list items");
        }
    }

    public QualifiedName getRelation() {
        return relation;
    }

    public QualifiedName getPivotClass() {
        return pivotClass;
    }

    public QualifiedName getItemRelation() {
        return itemRelation;
    }

    public QualifiedName getIndexProperty() {
        return indexProperty;
    }
}
