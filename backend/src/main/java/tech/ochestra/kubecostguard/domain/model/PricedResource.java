package tech.ochestra.kubecostguard.domain.model;

/**
 * Resource types carrying a unit price in the pricing table.
 *
 * GPU is priced separately by model and is not part of this enum.
 * Network is priced per node-hour, the others per core-hour or GiB-hour.
 */
public enum PricedResource {
    CPU("cpu"),
    MEMORY("memory"),
    STORAGE("storage"),
    NETWORK("network");

    private final String key;

    PricedResource(String key) {
        this.key = key;
    }

    /**
     * Field name used in the pricing document.
     */
    public String getKey() {
        return key;
    }
}
