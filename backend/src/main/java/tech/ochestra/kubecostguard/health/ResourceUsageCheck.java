package tech.ochestra.kubecostguard.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.NodeInfo;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceQuantities;
import tech.ochestra.kubecostguard.exception.HealthCheckException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cluster-wide CPU and memory usage against allocatable capacity.
 *
 * SCORING:
 * 100 - max(0, cpu% - 80) x 2 - max(0, mem% - 80) x 2, floored at 0.
 *
 * Only nodes reporting both usage and allocatable capacity are counted.
 * When no node reports usage the metrics source is treated as unreachable
 * and the category is unknown rather than 0%.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResourceUsageCheck implements HealthCheck<ResourceUsageStatus> {

    static final double OVER_THRESHOLD_PENALTY = 2.0;

    private final KubeCostGuardProperties properties;

    @Override
    public HealthCategory getCategory() {
        return HealthCategory.RESOURCE_USAGE;
    }

    @Override
    public ResourceUsageStatus evaluate(ClusterSnapshot snapshot) {
        if (snapshot.nodes() == null) {
            throw new HealthCheckException(getCategory(), "Node list is not available");
        }
        double threshold = properties.getHealth().getResourceUsageThresholdPercent();

        long cpuUsed = 0;
        long cpuAllocatable = 0;
        long memoryUsed = 0;
        long memoryAllocatable = 0;
        long storageUsed = 0;
        long storageAllocatable = 0;
        int measuredNodes = 0;
        List<String> highCpu = new ArrayList<>();
        List<String> highMemory = new ArrayList<>();

        for (NodeInfo node : snapshot.nodes()) {
            ResourceQuantities usage = node.usage();
            ResourceQuantities allocatable = node.allocatable();
            if (!hasCpuAndMemory(usage) || !hasCpuAndMemory(allocatable)
                    || allocatable.cpuMillis() == 0 || allocatable.memoryBytes() == 0) {
                continue;
            }
            measuredNodes++;
            cpuUsed += usage.cpuMillis();
            cpuAllocatable += allocatable.cpuMillis();
            memoryUsed += usage.memoryBytes();
            memoryAllocatable += allocatable.memoryBytes();
            if (usage.storageBytes() != null && allocatable.storageBytes() != null) {
                storageUsed += usage.storageBytes();
                storageAllocatable += allocatable.storageBytes();
            }

            if (percent(usage.cpuMillis(), allocatable.cpuMillis()) > threshold) {
                highCpu.add(node.name());
            }
            if (percent(usage.memoryBytes(), allocatable.memoryBytes()) > threshold) {
                highMemory.add(node.name());
            }
        }

        if (measuredNodes == 0) {
            throw new HealthCheckException(getCategory(), "No node usage metrics available");
        }

        double cpuPercent = percent(cpuUsed, cpuAllocatable);
        double memoryPercent = percent(memoryUsed, memoryAllocatable);
        Double storagePercent = storageAllocatable > 0 ? percent(storageUsed, storageAllocatable) : null;
        double score = usageScore(cpuPercent, memoryPercent, threshold);

        highCpu.sort(String::compareTo);
        highMemory.sort(String::compareTo);

        log.debug("Resource usage check: cpu {}%, memory {}% over {} nodes, score {}",
                String.format("%.1f", cpuPercent), String.format("%.1f", memoryPercent), measuredNodes, score);

        return new ResourceUsageStatus(
                cpuPercent,
                memoryPercent,
                storagePercent,
                List.copyOf(highCpu),
                List.copyOf(highMemory),
                highUsageNamespaces(snapshot.pods(), threshold),
                score
        );
    }

    /**
     * Usage sub-score for a pair of percentages. Also applied per namespace.
     */
    public static double usageScore(double cpuPercent, double memoryPercent, double threshold) {
        double score = 100.0
                - Math.max(0.0, cpuPercent - threshold) * OVER_THRESHOLD_PENALTY
                - Math.max(0.0, memoryPercent - threshold) * OVER_THRESHOLD_PENALTY;
        return Math.max(0.0, score);
    }

    /**
     * Namespaces whose pods use more than the threshold of what they request.
     */
    private List<String> highUsageNamespaces(List<PodInfo> pods, double threshold) {
        if (pods == null) {
            return List.of();
        }
        Map<String, long[]> totals = new TreeMap<>();
        for (PodInfo pod : pods) {
            if (pod.usage() == null || pod.requests() == null) {
                continue;
            }
            long[] t = totals.computeIfAbsent(pod.namespace(), ns -> new long[4]);
            if (pod.usage().cpuMillis() != null && pod.requests().cpuMillis() != null) {
                t[0] += pod.usage().cpuMillis();
                t[1] += pod.requests().cpuMillis();
            }
            if (pod.usage().memoryBytes() != null && pod.requests().memoryBytes() != null) {
                t[2] += pod.usage().memoryBytes();
                t[3] += pod.requests().memoryBytes();
            }
        }
        List<String> high = new ArrayList<>();
        totals.forEach((namespace, t) -> {
            boolean cpuHigh = t[1] > 0 && percent(t[0], t[1]) > threshold;
            boolean memoryHigh = t[3] > 0 && percent(t[2], t[3]) > threshold;
            if (cpuHigh || memoryHigh) {
                high.add(namespace);
            }
        });
        return List.copyOf(high);
    }

    private static boolean hasCpuAndMemory(ResourceQuantities quantities) {
        return quantities != null && quantities.cpuMillis() != null && quantities.memoryBytes() != null;
    }

    static double percent(long used, long total) {
        return total == 0 ? 0.0 : 100.0 * used / total;
    }
}
