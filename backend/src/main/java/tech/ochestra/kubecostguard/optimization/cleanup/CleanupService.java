package tech.ochestra.kubecostguard.optimization.cleanup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import tech.ochestra.kubecostguard.adapters.ClusterResourceClient;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.exception.ClusterOperationException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Runs cleanup in dry-run or apply mode.
 *
 * Apply deletes exactly the recommendations the analysis returned, one at a
 * time. A failed deletion is logged and the run moves on. Cancellation is
 * checked before every deletion, never in the middle of one. Apply runs are
 * serialized so two runs cannot race on the same resource.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CleanupService {

    private final CleanupAnalyzer analyzer;
    private final ObjectProvider<ClusterResourceClient> clusterClient;
    private final ReentrantLock applyLock = new ReentrantLock();

    /**
     * Compute recommendations without touching the cluster.
     */
    public CleanupResult dryRun(ClusterSnapshot snapshot) {
        List<CleanupRecommendation> recommendations = analyzer.analyze(snapshot);
        log.info("Cleanup dry run: {} resources would be deleted", recommendations.size());
        return CleanupResult.dryRun(recommendations);
    }

    public CleanupResult apply(ClusterSnapshot snapshot) {
        return apply(snapshot, () -> false);
    }

    /**
     * Delete every recommended resource.
     *
     * @param cancelled polled before each deletion; once true the remaining items are skipped
     */
    public CleanupResult apply(ClusterSnapshot snapshot, BooleanSupplier cancelled) {
        ClusterResourceClient client = clusterClient.getIfAvailable();
        if (client == null) {
            throw new ClusterOperationException("Cleanup apply requested but no cluster client is configured");
        }
        List<CleanupRecommendation> recommendations = analyzer.analyze(snapshot);

        applyLock.lock();
        try {
            log.info("Starting cleanup of {} resources", recommendations.size());
            List<CleanupResult.Item> items = new ArrayList<>(recommendations.size());
            int deleted = 0;
            int failed = 0;
            int skipped = 0;

            for (CleanupRecommendation recommendation : recommendations) {
                if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                    items.add(new CleanupResult.Item(recommendation, CleanupOutcome.SKIPPED_CANCELLED, null));
                    skipped++;
                    continue;
                }
                try {
                    delete(client, recommendation);
                    items.add(new CleanupResult.Item(recommendation, CleanupOutcome.DELETED, null));
                    deleted++;
                    log.info("Deleted {} {}: {}", recommendation.resourceKind().getDisplayName(),
                            recommendation.key(), recommendation.reason());
                } catch (RuntimeException e) {
                    items.add(new CleanupResult.Item(recommendation, CleanupOutcome.FAILED, e.getMessage()));
                    failed++;
                    log.error("Failed to delete {} {}: {}", recommendation.resourceKind().getDisplayName(),
                            recommendation.key(), e.getMessage(), e);
                }
            }

            log.info("Cleanup complete: {} deleted, {} failed, {} skipped", deleted, failed, skipped);
            return new CleanupResult(CleanupMode.APPLY, recommendations, List.copyOf(items), failed + skipped > 0);
        } finally {
            applyLock.unlock();
        }
    }

    private void delete(ClusterResourceClient client, CleanupRecommendation recommendation) {
        switch (recommendation.resourceKind()) {
            case CONFIG_MAP -> client.deleteConfigMap(recommendation.namespace(), recommendation.name());
            case POD -> client.deletePod(recommendation.namespace(), recommendation.name());
            default -> throw new ClusterOperationException(
                    "Unsupported cleanup resource kind " + recommendation.resourceKind());
        }
    }
}
