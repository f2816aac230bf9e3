package tech.ochestra.kubecostguard.health;

import java.util.List;

/**
 * Cluster-wide usage as percentages of allocatable capacity.
 *
 * @param storagePercent null when no node reports storage usage
 */
public record ResourceUsageStatus(
        double cpuPercent,
        double memoryPercent,
        Double storagePercent,
        List<String> highCpuNodes,
        List<String> highMemoryNodes,
        List<String> highUsageNamespaces,
        double score
) implements CategoryStatus {
}
