package tech.ochestra.kubecostguard.health;

import tech.ochestra.kubecostguard.domain.model.HealthCategory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Health assessment of one snapshot.
 *
 * Node and pod statuses are always present. The control plane, network and
 * resource usage statuses are null when their check was degraded; the matching
 * entry in {@code categoryScores} then carries the reason. {@code namespaceHealth}
 * is null when per-namespace evaluation failed.
 */
public record ClusterHealth(
        Instant timestamp,
        NodeHealthStatus nodeStatus,
        PodHealthStatus podStatus,
        ControlPlaneStatus controlPlaneStatus,
        NetworkStatus networkStatus,
        ResourceUsageStatus resourceUsage,
        Map<HealthCategory, CategoryScore> categoryScores,
        Map<String, NamespaceHealth> namespaceHealth,
        int healthScore,
        List<HealthIssue> issues
) {
    public CategoryScore scoreOf(HealthCategory category) {
        return categoryScores.get(category);
    }
}
