package org.ontobind.mapping;

import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * Reference to a class or property of the ontology: a local name, optionally qualified by a namespace URI or prefix.
 */
public final class QualifiedName {
    private final String name;
    private final String namespace;

    private QualifiedName(final String name, final String namespace) {
        this.name = Validate.notBlank(name, "name must not be blank");
        this.namespace = namespace;
    }

    /**
     * A name in the store's default namespace.
     */
    public static QualifiedName of(final String name) {
        return new QualifiedName(name, null);
    }

    public static QualifiedName of(final String name, final String namespace) {
        return new QualifiedName(name, Validate.notBlank(namespace, "namespace must not be blank"));
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    public boolean isLocal() {
        return namespace == null;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QualifiedName)) {
            return false;
        }
        final QualifiedName that = (QualifiedName) o;
        return name.equals(that.name) && Objects.equals(namespace, that.namespace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, namespace);
    }

    @Override
    public String toString() {
        return isLocal() ? name : ("<" + namespace + ">" + name);
    }
}
