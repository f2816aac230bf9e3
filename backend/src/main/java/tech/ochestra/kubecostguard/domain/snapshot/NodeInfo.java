package tech.ochestra.kubecostguard.domain.snapshot;

import lombok.Builder;
import tech.ochestra.kubecostguard.domain.model.NodeConditionType;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of one node.
 *
 * @param conditions  node conditions whose status is True
 * @param allocatable null when the API did not report allocatable capacity
 * @param usage       current usage from the metrics API, null when unavailable
 * @param peakUsage   peak usage over the observation window, null to fall back on {@code usage}
 */
@Builder(toBuilder = true)
public record NodeInfo(
        String name,
        Map<String, String> labels,
        String instanceType,
        String region,
        String zone,
        ResourceQuantities allocatable,
        GpuInfo gpu,
        Set<NodeConditionType> conditions,
        ResourceQuantities usage,
        ResourceQuantities peakUsage
) {
    public NodeInfo {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        conditions = conditions == null || conditions.isEmpty()
                ? Set.of()
                : Set.copyOf(conditions);
    }

    public boolean isReady() {
        return conditions.contains(NodeConditionType.READY);
    }

    public Set<NodeConditionType> pressureConditions() {
        EnumSet<NodeConditionType> pressure = EnumSet.noneOf(NodeConditionType.class);
        for (NodeConditionType condition : conditions) {
            if (condition.isPressure()) {
                pressure.add(condition);
            }
        }
        return pressure;
    }

    /**
     * Usage to size against: the window peak when known, otherwise the current sample.
     */
    public ResourceQuantities sizingUsage() {
        return peakUsage != null ? peakUsage : usage;
    }
}
