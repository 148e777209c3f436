package org.ontobind.ontology;

public class UnresolvableNameException extends OntologyStoreException {

    private static final long serialVersionUID = -2969440237135916180L;

    private final String name;
    private final String namespace;

    public UnresolvableNameException(final String name, final String namespace) {
        super(String.format("No entity named '%s' in namespace <%s>", name, namespace));
        this.name = name;
        this.namespace = namespace;
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }
}
