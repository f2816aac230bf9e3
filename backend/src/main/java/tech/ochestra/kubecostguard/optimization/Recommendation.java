package tech.ochestra.kubecostguard.optimization;

import tech.ochestra.kubecostguard.domain.model.RecommendationAction;
import tech.ochestra.kubecostguard.domain.model.ResourceKind;
import tech.ochestra.kubecostguard.domain.model.UtilizationStatus;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceQuantities;

/**
 * Advisory optimization. Never applied automatically.
 *
 * All costs are monthly.
 *
 * @param namespace           null for nodes
 * @param peakUtilization     max of CPU and memory peak utilization, null when unknown
 * @param recommendedRequests new pod requests for RIGHTSIZE_POD_REQUESTS, otherwise null
 */
public record Recommendation(
        RecommendationAction action,
        ResourceKind resourceKind,
        String namespace,
        String name,
        String nodeName,
        UtilizationStatus utilizationStatus,
        Double peakUtilization,
        double currentMonthlyCost,
        double projectedMonthlyCost,
        double potentialMonthlySaving,
        ResourceQuantities recommendedRequests,
        String rationale
) {}
