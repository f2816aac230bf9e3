package tech.ochestra.kubecostguard.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import tech.ochestra.kubecostguard.cost.CostAggregator;
import tech.ochestra.kubecostguard.cost.CostReport;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.exception.SnapshotUnavailableException;
import tech.ochestra.kubecostguard.health.ClusterHealth;
import tech.ochestra.kubecostguard.health.HealthEvaluator;
import tech.ochestra.kubecostguard.metrics.ClusterGaugeCollector;
import tech.ochestra.kubecostguard.optimization.OptimizationAdvisor;
import tech.ochestra.kubecostguard.optimization.OptimizationReport;
import tech.ochestra.kubecostguard.optimization.cleanup.CleanupMode;
import tech.ochestra.kubecostguard.optimization.cleanup.CleanupResult;
import tech.ochestra.kubecostguard.optimization.cleanup.CleanupService;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Runs one evaluation cycle over a snapshot.
 *
 * FLOW:
 * 1. Health evaluation and cost computation in parallel
 * 2. Optimization advice once both are done
 * 3. Cleanup analysis (dry run unless apply is requested)
 * 4. Gauge collection
 *
 * A fatal snapshot problem aborts the cycle with no partial report.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvaluationCycleService {

    private final HealthEvaluator healthEvaluator;
    private final CostAggregator costAggregator;
    private final OptimizationAdvisor optimizationAdvisor;
    private final CleanupService cleanupService;
    private final ClusterGaugeCollector gaugeCollector;
    @Qualifier("evaluationExecutor")
    private final Executor evaluationExecutor;

    public EvaluationReport runCycle(ClusterSnapshot snapshot) {
        return runCycle(snapshot, CleanupMode.DRY_RUN, () -> false);
    }

    /**
     * @param cancelled checked between cleanup deletions in apply mode
     */
    public EvaluationReport runCycle(ClusterSnapshot snapshot, CleanupMode cleanupMode, BooleanSupplier cancelled) {
        log.info("Starting evaluation cycle for snapshot captured at {}", snapshot.capturedAt());

        CompletableFuture<ClusterHealth> healthFuture =
                CompletableFuture.supplyAsync(() -> healthEvaluator.evaluate(snapshot), evaluationExecutor);
        CompletableFuture<CostReport> costFuture =
                CompletableFuture.supplyAsync(() -> costAggregator.computeCosts(snapshot), evaluationExecutor);

        ClusterHealth health = join(healthFuture);
        CostReport costs = join(costFuture);

        OptimizationReport optimization = optimizationAdvisor.advise(snapshot, health, costs);
        CleanupResult cleanup = cleanup(snapshot, cleanupMode, cancelled);

        EvaluationReport report = new EvaluationReport(
                snapshot.capturedAt(),
                health,
                costs,
                optimization,
                cleanup,
                gaugeCollector.collect(snapshot, health, costs)
        );

        log.info("Evaluation cycle complete: health score {}, ${}/month, {} recommendations, {} cleanup candidates",
                health.healthScore(),
                String.format("%.2f", costs.totalMonthlyCost()),
                optimization.recommendations().size(),
                cleanup == null ? "unknown" : cleanup.recommendations().size());
        return report;
    }

    private CleanupResult cleanup(ClusterSnapshot snapshot, CleanupMode mode, BooleanSupplier cancelled) {
        if (snapshot.configMaps() == null) {
            log.warn("Cleanup analysis skipped: config maps are not available in the snapshot");
            return null;
        }
        return mode == CleanupMode.APPLY
                ? cleanupService.apply(snapshot, cancelled)
                : cleanupService.dryRun(snapshot);
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new SnapshotUnavailableException("Evaluation cycle failed", e.getCause());
        }
    }
}
