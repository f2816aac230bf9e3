package tech.ochestra.kubecostguard.domain.snapshot;

/**
 * CPU, memory and storage amounts. Used for allocatable capacity,
 * container requests and observed usage.
 *
 * A null field means the amount was not declared or not measured,
 * which is different from zero.
 */
public record ResourceQuantities(
        Long cpuMillis,
        Long memoryBytes,
        Long storageBytes
) {
    private static final double BYTES_PER_GIB = 1024.0 * 1024.0 * 1024.0;

    public static ResourceQuantities of(long cpuMillis, long memoryBytes) {
        return new ResourceQuantities(cpuMillis, memoryBytes, null);
    }

    public static ResourceQuantities of(long cpuMillis, long memoryBytes, long storageBytes) {
        return new ResourceQuantities(cpuMillis, memoryBytes, storageBytes);
    }

    public Double cpuCores() {
        return cpuMillis == null ? null : cpuMillis / 1000.0;
    }

    public Double memoryGiB() {
        return memoryBytes == null ? null : memoryBytes / BYTES_PER_GIB;
    }

    public Double storageGiB() {
        return storageBytes == null ? null : storageBytes / BYTES_PER_GIB;
    }
}
