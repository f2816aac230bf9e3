package tech.ochestra.kubecostguard.optimization.cleanup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.ResourceKind;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.ConfigMapInfo;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.exception.SnapshotUnavailableException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds resources that can be deleted:
 * - ConfigMaps no pod in their namespace references through a volume or the environment
 * - Failed or Succeeded pods older than the retention period
 *
 * Ages are measured against the snapshot time, so analysing the same snapshot
 * twice gives the same list.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CleanupAnalyzer {

    static final String UNUSED_CONFIG_MAP_REASON = "Not referenced by any pod";

    static final Comparator<CleanupRecommendation> ORDER = Comparator
            .comparing(CleanupRecommendation::resourceKind)
            .thenComparing(CleanupRecommendation::namespace)
            .thenComparing(CleanupRecommendation::name);

    private final KubeCostGuardProperties properties;

    public List<CleanupRecommendation> analyze(ClusterSnapshot snapshot) {
        if (snapshot.pods() == null) {
            throw new SnapshotUnavailableException("Cannot analyze cleanup: pod list is not available");
        }
        if (snapshot.configMaps() == null) {
            throw new SnapshotUnavailableException("Cannot analyze cleanup: config map list is not available");
        }
        Set<String> excluded = new HashSet<>(properties.getCleanup().getExcludedNamespaces());
        Instant now = snapshot.capturedAt();

        List<CleanupRecommendation> recommendations = new ArrayList<>();
        ConfigMapReferenceIndex index = ConfigMapReferenceIndex.of(snapshot.pods());

        for (ConfigMapInfo configMap : snapshot.configMaps()) {
            if (excluded.contains(configMap.namespace()) || index.isReferenced(configMap)) {
                continue;
            }
            recommendations.add(new CleanupRecommendation(
                    ResourceKind.CONFIG_MAP,
                    configMap.namespace(),
                    configMap.name(),
                    UNUSED_CONFIG_MAP_REASON,
                    age(configMap.createdAt(), now)));
        }

        Duration retention = properties.getCleanup().getRetention();
        for (PodInfo pod : snapshot.pods()) {
            if (excluded.contains(pod.namespace()) || !pod.phase().isTerminal() || pod.createdAt() == null) {
                continue;
            }
            Duration age = age(pod.createdAt(), now);
            if (age.compareTo(retention) > 0) {
                recommendations.add(new CleanupRecommendation(
                        ResourceKind.POD,
                        pod.namespace(),
                        pod.name(),
                        String.format("Failed/Completed pod older than %d days (status: %s)",
                                retention.toDays(), pod.phase().toApiValue()),
                        age));
            }
        }

        recommendations.sort(ORDER);
        log.debug("Cleanup analysis: {} config map references indexed, {} candidates",
                index.size(), recommendations.size());
        return List.copyOf(recommendations);
    }

    private static Duration age(Instant createdAt, Instant now) {
        return createdAt == null ? null : Duration.between(createdAt, now);
    }
}
