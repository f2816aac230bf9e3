package tech.ochestra.kubecostguard.domain.snapshot;

import lombok.Builder;
import tech.ochestra.kubecostguard.domain.model.PodPhase;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of one pod.
 *
 * @param nodeName             null when the pod is not scheduled
 * @param requests             summed container requests, fields null when undeclared
 * @param usage                current usage from the metrics API, null when unavailable
 * @param configMapReferences  ConfigMaps referenced through volumes or environment
 */
@Builder(toBuilder = true)
public record PodInfo(
        String namespace,
        String name,
        String nodeName,
        Map<String, String> labels,
        PodPhase phase,
        Instant createdAt,
        List<ContainerStatusInfo> containers,
        ResourceQuantities requests,
        ResourceQuantities usage,
        ResourceQuantities peakUsage,
        List<ConfigMapReference> configMapReferences
) {
    public PodInfo {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        phase = phase == null ? PodPhase.UNKNOWN : phase;
        containers = containers == null ? List.of() : List.copyOf(containers);
        configMapReferences = configMapReferences == null ? List.of() : List.copyOf(configMapReferences);
    }

    public ResourceKey key() {
        return ResourceKey.of(namespace, name);
    }

    public boolean isCrashLooping() {
        return containers.stream().anyMatch(ContainerStatusInfo::isCrashLooping);
    }

    public int maxRestartCount() {
        return containers.stream().mapToInt(ContainerStatusInfo::restartCount).max().orElse(0);
    }

    /**
     * Scheduled and not terminated, so it still holds a share of its node.
     */
    public boolean isResident() {
        return nodeName != null && !nodeName.isEmpty() && !phase.isTerminal();
    }

    public ResourceQuantities sizingUsage() {
        return peakUsage != null ? peakUsage : usage;
    }
}
