package tech.ochestra.kubecostguard.optimization.cleanup;

import tech.ochestra.kubecostguard.domain.model.ResourceKind;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceKey;

import java.time.Duration;

/**
 * A resource proposed for deletion.
 *
 * @param resourceKind CONFIG_MAP or POD
 * @param age          age at snapshot time, null when the creation time is unknown
 */
public record CleanupRecommendation(
        ResourceKind resourceKind,
        String namespace,
        String name,
        String reason,
        Duration age
) {
    public ResourceKey key() {
        return ResourceKey.of(namespace, name);
    }
}
