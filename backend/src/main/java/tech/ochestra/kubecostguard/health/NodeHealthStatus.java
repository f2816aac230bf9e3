package tech.ochestra.kubecostguard.health;

import java.util.List;
import java.util.Map;

/**
 * @param nodeConditions  node name to the conditions currently True on it
 * @param pressuredNodes  node name to its pressure conditions, only nodes with at least one
 */
public record NodeHealthStatus(
        int totalNodes,
        int readyNodes,
        int memoryPressureNodes,
        int diskPressureNodes,
        int pidPressureNodes,
        int networkUnavailableNodes,
        List<String> notReadyNodes,
        Map<String, List<String>> pressuredNodes,
        Map<String, List<String>> nodeConditions,
        double score
) implements CategoryStatus {
}
