package tech.ochestra.kubecostguard.optimization;

import tech.ochestra.kubecostguard.domain.model.UtilizationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * @param recommendations sorted by potential saving, highest first
 * @param nodeStatuses    utilization classification of every node
 */
public record OptimizationReport(
        Instant timestamp,
        double totalPotentialMonthlySaving,
        List<Recommendation> recommendations,
        Map<String, UtilizationStatus> nodeStatuses
) {}
