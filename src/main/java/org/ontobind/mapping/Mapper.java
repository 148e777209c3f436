package org.ontobind.mapping;

import com.hp.hpl.jena.ontology.Individual;
import com.hp.hpl.jena.ontology.OntClass;
import org.ontobind.ontology.OntologyStore;
import org.ontobind.ontology.PropertyConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Translates domain objects of type {@code S} to individuals of one ontology class and back.
 * <p>
 * {@link #encode(Object)} never modifies an individual that already exists: when the search finds a matching
 * individual it is returned as is. The search and the creation are not atomic, two concurrent encodes of equal
 * objects may both create an individual.
 *
 * @param <S> the domain type
 */
public class Mapper<S> {

    private static final Logger logger = LoggerFactory.getLogger(Mapper.class);

    private final Class<S> sourceType;
    private final OntClass targetClass;
    private final QualifiedName targetClassName;
    private final Map<String, Mapping> mappings;
    private final OntologyStore store;
    private final String identityField;

    /**
     * @param targetClass name of the ontology class, resolved on every call
     * @param mappings    field name to mapping, iterated in the map's order
     */
    public Mapper(final Class<S> sourceType, final QualifiedName targetClass, final Map<String, ? extends Mapping> mappings, final OntologyStore store) {
        this(sourceType, null, Objects.requireNonNull(targetClass, "targetClass"), mappings, store);
    }

    public Mapper(final Class<S> sourceType, final OntClass targetClass, final Map<String, ? extends Mapping> mappings, final OntologyStore store) {
        this(sourceType, Objects.requireNonNull(targetClass, "targetClass"), null, mappings, store);
    }

    private Mapper(final Class<S> sourceType, final OntClass targetClass, final QualifiedName targetClassName,
                   final Map<String, ? extends Mapping> mappings, final OntologyStore store) {
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType");
        this.targetClass = targetClass;
        this.targetClassName = targetClassName;
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
        this.store = Objects.requireNonNull(store, "store");
        identityField = findIdentityField(sourceType, this.mappings);
    }

    private static String findIdentityField(final Class<?> sourceType, final Map<String, Mapping> mappings) {
        String identityField = null;
        for (final Map.Entry<String, Mapping> entry : mappings.entrySet()) {
            if (entry.getValue().isIdentityKey()) {
                if (identityField != null) {
                    throw new MappingConfigurationException(String.format("%s declares two identity keys: '%s' and '%s'",
                            sourceType.getSimpleName(), identityField, entry.getKey()));
                }
                identityField = entry.getKey();
            }
        }
        return identityField;
    }

    public static <S> Builder<S> builder(final Class<S> sourceType) {
        return new Builder<>(sourceType);
    }

    /**
     * Finds the individual standing for {@code source}, or creates and fills a new one.
     */
    public Individual encode(final S source) {
        final OntClass ontClass = resolveTargetClass();
        final List<PropertyConstraint> constraints = buildConstraints(source);

        final Individual existing = store.searchOne(ontClass, constraints);
        if (existing != null) {
            logger.debug("Found {} for {} matching {}", existing.getURI(), sourceType.getSimpleName(), constraints);
            return existing;
        }

        final Individual individual = store.createIndividual(ontClass);
        logger.debug("Created {} for {}", individual.getURI(), sourceType.getSimpleName());
        for (final Map.Entry<String, Mapping> entry : mappings.entrySet()) {
            entry.getValue().encode(individual, source, entry.getKey(), store);
        }
        return individual;
    }

    /**
     * Search constraints: the identity key alone when there is one, every searchable field otherwise.
     */
    private List<PropertyConstraint> buildConstraints(final S source) {
        if (identityField != null) {
            return Collections.singletonList(mappings.get(identityField).toConstraint(source, identityField, store));
        }

        final List<PropertyConstraint> constraints = new ArrayList<>();
        for (final Map.Entry<String, Mapping> entry : mappings.entrySet()) {
            try {
                constraints.add(entry.getValue().toConstraint(source, entry.getKey(), store));
            } catch (final UnsupportedQueryException e) {
                logger.warn("Field '{}' of {} left out of the search: {}", entry.getKey(), sourceType.getSimpleName(), e.getMessage());
            }
        }
        return constraints;
    }

    /**
     * Rebuilds a domain object from {@code individual}. A target class given by name is resolved first, so an
     * unknown class fails here as it does on {@link #encode(Object)}.
     */
    public S decode(final Individual individual) {
        resolveTargetClass();
        final Map<String, Object> values = new LinkedHashMap<>();
        for (final Map.Entry<String, Mapping> entry : mappings.entrySet()) {
            values.put(entry.getKey(), entry.getValue().decode(individual, store));
        }
        return DomainObjects.instantiate(sourceType, values);
    }

    private OntClass resolveTargetClass() {
        return (targetClass != null) ? targetClass : NameResolver.resolveClass(targetClassName, store);
    }

    public Class<S> getSourceType() {
        return sourceType;
    }

    public Map<String, Mapping> getMappings() {
        return mappings;
    }

    public OntologyStore getStore() {
        return store;
    }

    /**
     * @return the field used to find existing individuals, {@code null} when every field is searched on
     */
    public String getIdentityField() {
        return identityField;
    }

    public static final class Builder<S> {
        private final Class<S> sourceType;
        private final Map<String, Mapping> mappings = new LinkedHashMap<>();
        private QualifiedName targetClassName;
        private OntClass targetClass;

        private Builder(final Class<S> sourceType) {
            this.sourceType = sourceType;
        }

        public Builder<S> targetClass(final String name) {
            return targetClass(QualifiedName.of(name));
        }

        public Builder<S> targetClass(final QualifiedName name) {
            targetClassName = name;
            targetClass = null;
            return this;
        }

        public Builder<S> targetClass(final OntClass ontClass) {
            targetClass = ontClass;
            targetClassName = null;
            return this;
        }

        public Builder<S> map(final String fieldName, final Mapping mapping) {
            if (mappings.put(fieldName, mapping) != null) {
                throw new MappingConfigurationException("Field '" + fieldName + "' is mapped twice");
            }
            return this;
        }

        public Mapper<S> build(final OntologyStore store) {
            if (targetClass != null) {
                return new Mapper<>(sourceType, targetClass, mappings, store);
            }
            if (targetClassName == null) {
                throw new MappingConfigurationException("No target class for " + sourceType.getSimpleName());
            }
            return new Mapper<>(sourceType, targetClassName, mappings, store);
        }
    }
}
