package tech.ochestra.kubecostguard.domain.snapshot;

import java.util.Map;

/**
 * Service with its pod selector. Services without a selector (ExternalName,
 * manually managed endpoints) are not expected to have endpoints.
 */
public record ServiceInfo(String namespace, String name, Map<String, String> selector) {

    public ServiceInfo {
        selector = selector == null ? Map.of() : Map.copyOf(selector);
    }

    public boolean hasSelector() {
        return !selector.isEmpty();
    }

    public ResourceKey key() {
        return ResourceKey.of(namespace, name);
    }
}
