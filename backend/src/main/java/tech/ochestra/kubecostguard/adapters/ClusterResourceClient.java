package tech.ochestra.kubecostguard.adapters;

/**
 * Port interface for the only cluster mutations the application performs:
 * deleting unused ConfigMaps and stale pods.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. Each call deletes exactly one named resource
 * 2. Failures surface as {@link tech.ochestra.kubecostguard.exception.ClusterOperationException}
 * 3. A resource already gone is not an error
 */
public interface ClusterResourceClient {

    void deleteConfigMap(String namespace, String name);

    void deletePod(String namespace, String name);
}
