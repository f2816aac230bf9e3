package tech.ochestra.kubecostguard.cost;

import tech.ochestra.kubecostguard.domain.snapshot.ResourceQuantities;

/**
 * Usage divided by allocatable capacity, as fractions. A null field means
 * the value is unknown (no metrics or no capacity reported), never zero usage.
 */
public record NodeUtilization(Double cpu, Double memory, Double storage) {

    public static final NodeUtilization UNKNOWN = new NodeUtilization(null, null, null);

    public static NodeUtilization of(ResourceQuantities used, ResourceQuantities allocatable) {
        if (used == null || allocatable == null) {
            return UNKNOWN;
        }
        return new NodeUtilization(
                ratio(used.cpuMillis(), allocatable.cpuMillis()),
                ratio(used.memoryBytes(), allocatable.memoryBytes()),
                ratio(used.storageBytes(), allocatable.storageBytes()));
    }

    /**
     * The higher of CPU and memory utilization, or null when neither is known.
     */
    public Double max() {
        if (cpu == null) {
            return memory;
        }
        return memory == null ? cpu : Math.max(cpu, memory);
    }

    static Double ratio(Long used, Long total) {
        if (used == null || total == null || total <= 0) {
            return null;
        }
        return (double) used / total;
    }
}
