package tech.ochestra.kubecostguard.optimization.cleanup;

import tech.ochestra.kubecostguard.domain.snapshot.ConfigMapInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ConfigMapReference;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceKey;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * ConfigMaps referenced by current pods, keyed by {@code namespace/name}.
 * Pods can only reference ConfigMaps in their own namespace.
 */
final class ConfigMapReferenceIndex {

    private final Set<ResourceKey> referenced;

    private ConfigMapReferenceIndex(Set<ResourceKey> referenced) {
        this.referenced = referenced;
    }

    static ConfigMapReferenceIndex of(Collection<PodInfo> pods) {
        Set<ResourceKey> keys = new HashSet<>();
        for (PodInfo pod : pods) {
            for (ConfigMapReference reference : pod.configMapReferences()) {
                keys.add(ResourceKey.of(pod.namespace(), reference.name()));
            }
        }
        return new ConfigMapReferenceIndex(keys);
    }

    boolean isReferenced(ConfigMapInfo configMap) {
        return referenced.contains(configMap.key());
    }

    int size() {
        return referenced.size();
    }
}
