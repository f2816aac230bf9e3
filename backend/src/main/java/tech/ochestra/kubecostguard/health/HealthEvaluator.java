package tech.ochestra.kubecostguard.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.exception.SnapshotUnavailableException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Reduces a snapshot into per-category statuses, a composite score and an
 * ordered issue list.
 *
 * FAILURE SEMANTICS:
 * - Nodes or pods missing: fatal, {@link SnapshotUnavailableException} propagates
 * - Control plane, network, resource usage or namespace evaluation failing: degraded,
 *   the category is scored unknown and excluded from the weighted score
 *
 * The five checks share nothing but the read-only snapshot and run as
 * independent tasks on the evaluation executor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthEvaluator {

    private final NodeHealthCheck nodeHealthCheck;
    private final PodHealthCheck podHealthCheck;
    private final ControlPlaneHealthCheck controlPlaneHealthCheck;
    private final NetworkHealthCheck networkHealthCheck;
    private final ResourceUsageCheck resourceUsageCheck;
    private final NamespaceHealthEvaluator namespaceHealthEvaluator;
    private final HealthScoreCalculator scoreCalculator;
    private final HealthIssueIdentifier issueIdentifier;
    @Qualifier("evaluationExecutor")
    private final Executor evaluationExecutor;

    public ClusterHealth evaluate(ClusterSnapshot snapshot) {
        if (snapshot.nodes() == null) {
            throw new SnapshotUnavailableException("Cannot evaluate health: node list is not available");
        }
        if (snapshot.pods() == null) {
            throw new SnapshotUnavailableException("Cannot evaluate health: pod list is not available");
        }
        log.debug("Evaluating health of {} nodes and {} pods", snapshot.nodes().size(), snapshot.pods().size());

        CompletableFuture<NodeHealthStatus> nodeFuture = submit(() -> nodeHealthCheck.evaluate(snapshot));
        CompletableFuture<PodHealthStatus> podFuture = submit(() -> podHealthCheck.evaluate(snapshot));
        CompletableFuture<CheckOutcome<ControlPlaneStatus>> controlPlaneFuture = submitDegradable(controlPlaneHealthCheck, snapshot);
        CompletableFuture<CheckOutcome<NetworkStatus>> networkFuture = submitDegradable(networkHealthCheck, snapshot);
        CompletableFuture<CheckOutcome<ResourceUsageStatus>> resourceFuture = submitDegradable(resourceUsageCheck, snapshot);
        CompletableFuture<Map<String, NamespaceHealth>> namespaceFuture = submit(() -> evaluateNamespaces(snapshot));

        NodeHealthStatus nodeStatus = joinFatal(nodeFuture);
        PodHealthStatus podStatus = joinFatal(podFuture);
        CheckOutcome<ControlPlaneStatus> controlPlane = controlPlaneFuture.join();
        CheckOutcome<NetworkStatus> network = networkFuture.join();
        CheckOutcome<ResourceUsageStatus> resources = resourceFuture.join();
        Map<String, NamespaceHealth> namespaceHealth = namespaceFuture.join();

        Map<HealthCategory, CategoryScore> scores = new EnumMap<>(HealthCategory.class);
        scores.put(HealthCategory.NODE, CategoryScore.known(HealthCategory.NODE, nodeStatus.score()));
        scores.put(HealthCategory.POD, CategoryScore.known(HealthCategory.POD, podStatus.score()));
        scores.put(HealthCategory.CONTROL_PLANE, controlPlane.toScore(HealthCategory.CONTROL_PLANE));
        scores.put(HealthCategory.NETWORK, network.toScore(HealthCategory.NETWORK));
        scores.put(HealthCategory.RESOURCE_USAGE, resources.toScore(HealthCategory.RESOURCE_USAGE));

        int healthScore = scoreCalculator.compositeScore(scores.values());

        List<HealthIssue> issues = issueIdentifier.identify(
                nodeStatus,
                podStatus,
                controlPlane.status(),
                network.status(),
                resources.status(),
                scores,
                namespaceHealth != null,
                snapshot.capturedAt());

        log.info("Health evaluation complete: score={} issues={}", healthScore, issues.size());

        return new ClusterHealth(
                snapshot.capturedAt(),
                nodeStatus,
                podStatus,
                controlPlane.status(),
                network.status(),
                resources.status(),
                Collections.unmodifiableMap(scores),
                namespaceHealth,
                healthScore,
                issues
        );
    }

    private Map<String, NamespaceHealth> evaluateNamespaces(ClusterSnapshot snapshot) {
        try {
            return namespaceHealthEvaluator.evaluate(snapshot);
        } catch (RuntimeException e) {
            log.warn("Per-namespace health unavailable: {}", e.getMessage());
            return null;
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, evaluationExecutor);
    }

    private <S extends CategoryStatus> CompletableFuture<CheckOutcome<S>> submitDegradable(
            HealthCheck<S> check, ClusterSnapshot snapshot) {
        return submit(() -> {
            try {
                return CheckOutcome.of(check.evaluate(snapshot));
            } catch (RuntimeException e) {
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("{} check degraded: {}", check.getCategory().getDisplayName(), reason);
                return CheckOutcome.failed(reason);
            }
        });
    }

    private static <T> T joinFatal(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof SnapshotUnavailableException fatal) {
                throw fatal;
            }
            throw new SnapshotUnavailableException("Health evaluation failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    /**
     * Result of a check that is allowed to fail.
     */
    private record CheckOutcome<S extends CategoryStatus>(S status, String failure) {

        static <S extends CategoryStatus> CheckOutcome<S> of(S status) {
            return new CheckOutcome<>(status, null);
        }

        static <S extends CategoryStatus> CheckOutcome<S> failed(String reason) {
            return new CheckOutcome<>(null, reason);
        }

        CategoryScore toScore(HealthCategory category) {
            return status != null
                    ? CategoryScore.known(category, status.score())
                    : CategoryScore.unknown(category, failure);
        }
    }
}
