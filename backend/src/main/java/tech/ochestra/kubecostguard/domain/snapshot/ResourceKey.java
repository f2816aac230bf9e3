package tech.ochestra.kubecostguard.domain.snapshot;

/**
 * Namespaced object key rendered as {@code namespace/name}.
 */
public record ResourceKey(String namespace, String name) {

    public static ResourceKey of(String namespace, String name) {
        return new ResourceKey(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
