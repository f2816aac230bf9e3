package tech.ochestra.kubecostguard.service;

import tech.ochestra.kubecostguard.cost.CostReport;
import tech.ochestra.kubecostguard.health.ClusterHealth;
import tech.ochestra.kubecostguard.metrics.GaugeSample;
import tech.ochestra.kubecostguard.optimization.OptimizationReport;
import tech.ochestra.kubecostguard.optimization.cleanup.CleanupResult;

import java.time.Instant;
import java.util.List;

/**
 * Everything one evaluation cycle produced.
 *
 * @param cleanup null when cleanup analysis was not possible (config maps not listed)
 */
public record EvaluationReport(
        Instant timestamp,
        ClusterHealth health,
        CostReport costs,
        OptimizationReport optimization,
        CleanupResult cleanup,
        List<GaugeSample> gauges
) {}
