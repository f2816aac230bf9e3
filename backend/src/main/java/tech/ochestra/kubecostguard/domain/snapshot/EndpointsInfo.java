package tech.ochestra.kubecostguard.domain.snapshot;

/**
 * Endpoints object of a service, reduced to the number of subsets.
 */
public record EndpointsInfo(String namespace, String name, int subsetCount) {

    public ResourceKey key() {
        return ResourceKey.of(namespace, name);
    }
}
