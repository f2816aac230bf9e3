package tech.ochestra.kubecostguard.domain.snapshot;

import java.time.Instant;

public record ConfigMapInfo(String namespace, String name, Instant createdAt) {

    public ResourceKey key() {
        return ResourceKey.of(namespace, name);
    }
}
