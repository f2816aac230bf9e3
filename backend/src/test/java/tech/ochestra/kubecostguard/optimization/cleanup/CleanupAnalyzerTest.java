package tech.ochestra.kubecostguard.optimization.cleanup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.PodPhase;
import tech.ochestra.kubecostguard.domain.model.ResourceKind;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.ConfigMapReference;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.exception.SnapshotUnavailableException;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tech.ochestra.kubecostguard.SnapshotFixtures.NOW;
import static tech.ochestra.kubecostguard.SnapshotFixtures.configMap;
import static tech.ochestra.kubecostguard.SnapshotFixtures.healthyCluster;
import static tech.ochestra.kubecostguard.SnapshotFixtures.runningPod;

/**
 * Tests for CleanupAnalyzer.
 *
 * Test strategy:
 * 1. ConfigMap references through volumes and the environment
 * 2. Stale terminal pods against the retention period
 * 3. Excluded namespaces and missing snapshot sections
 */
class CleanupAnalyzerTest {

    private KubeCostGuardProperties properties;
    private CleanupAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        properties = new KubeCostGuardProperties();
        properties.getCleanup().setExcludedNamespaces(List.of("kube-system"));
        analyzer = new CleanupAnalyzer(properties);
    }

    private static PodInfo finishedPod(String name, PodPhase phase, Duration age) {
        return runningPod("batch", name, "node-1").toBuilder()
                .phase(phase)
                .createdAt(NOW.minus(age))
                .build();
    }

    @Nested
    @DisplayName("Unused ConfigMaps")
    class ConfigMapTests {

        @Test
        @DisplayName("Should flag a ConfigMap no pod references, once, with the same result on every run")
        void shouldFlagUnreferencedConfigMap() {
            // Given: app-config mounted as a volume, feature-flags read from env, legacy-settings unused
            PodInfo pod = runningPod("web", "frontend", "node-1").toBuilder()
                    .configMapReferences(List.of(
                            ConfigMapReference.volume("app-config"),
                            ConfigMapReference.env("feature-flags")))
                    .build();
            ClusterSnapshot snapshot = healthyCluster(1, 0)
                    .pods(List.of(pod))
                    .configMaps(List.of(
                            configMap("web", "app-config"),
                            configMap("web", "feature-flags"),
                            configMap("web", "legacy-settings")))
                    .build();

            // When
            List<CleanupRecommendation> first = analyzer.analyze(snapshot);
            List<CleanupRecommendation> second = analyzer.analyze(snapshot);

            // Then
            assertThat(first).singleElement().satisfies(recommendation -> {
                assertThat(recommendation.resourceKind()).isEqualTo(ResourceKind.CONFIG_MAP);
                assertThat(recommendation.name()).isEqualTo("legacy-settings");
                assertThat(recommendation.reason()).isEqualTo("Not referenced by any pod");
                assertThat(recommendation.age()).isEqualTo(Duration.ofDays(20));
            });
            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Should not count a reference from another namespace")
        void shouldMatchReferencesWithinNamespace() {
            PodInfo pod = runningPod("payments", "api", "node-1").toBuilder()
                    .configMapReferences(List.of(ConfigMapReference.volume("shared")))
                    .build();
            ClusterSnapshot snapshot = healthyCluster(1, 0)
                    .pods(List.of(pod))
                    .configMaps(List.of(configMap("payments", "shared"), configMap("web", "shared")))
                    .build();

            assertThat(analyzer.analyze(snapshot))
                    .extracting(r -> r.key().toString())
                    .containsExactly("web/shared");
        }

        @Test
        @DisplayName("Should leave excluded namespaces alone")
        void shouldSkipExcludedNamespaces() {
            ClusterSnapshot snapshot = healthyCluster(1, 0)
                    .pods(List.of())
                    .configMaps(List.of(configMap("kube-system", "kubeadm-config")))
                    .build();

            assertThat(analyzer.analyze(snapshot)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Stale pods")
    class StalePodTests {

        @Test
        @DisplayName("Should flag Failed and Succeeded pods older than the retention period")
        void shouldFlagStalePods() {
            ClusterSnapshot snapshot = healthyCluster(1, 0)
                    .pods(List.of(
                            finishedPod("old-failure", PodPhase.FAILED, Duration.ofDays(10)),
                            finishedPod("old-job", PodPhase.SUCCEEDED, Duration.ofDays(8)),
                            finishedPod("recent-job", PodPhase.SUCCEEDED, Duration.ofDays(2)),
                            finishedPod("old-but-running", PodPhase.RUNNING, Duration.ofDays(30))))
                    .build();

            List<CleanupRecommendation> recommendations = analyzer.analyze(snapshot);

            assertThat(recommendations)
                    .extracting(CleanupRecommendation::name)
                    .containsExactly("old-failure", "old-job");
            assertThat(recommendations.get(0).reason())
                    .isEqualTo("Failed/Completed pod older than 7 days (status: Failed)");
            assertThat(recommendations.get(1).reason()).endsWith("(status: Succeeded)");
        }

        @Test
        @DisplayName("Should not flag a pod exactly at the retention age")
        void shouldRequireAgeAboveRetention() {
            ClusterSnapshot snapshot = healthyCluster(1, 0)
                    .pods(List.of(finishedPod("boundary", PodPhase.FAILED, Duration.ofDays(7))))
                    .build();

            assertThat(analyzer.analyze(snapshot)).isEmpty();
        }

        @Test
        @DisplayName("Should order by kind, then namespace and name")
        void shouldOrderByKindNamespaceAndName() {
            ClusterSnapshot snapshot = healthyCluster(1, 0)
                    .pods(List.of(finishedPod("z-old", PodPhase.FAILED, Duration.ofDays(9))))
                    .configMaps(List.of(configMap("web", "b"), configMap("batch", "a")))
                    .build();

            assertThat(analyzer.analyze(snapshot))
                    .extracting(r -> r.resourceKind() + ":" + r.key())
                    .containsExactly("POD:batch/z-old", "CONFIG_MAP:batch/a", "CONFIG_MAP:web/b");
        }
    }

    @Test
    @DisplayName("Should fail when pods or ConfigMaps were not listed")
    void shouldFailWithoutRequiredSections() {
        assertThatThrownBy(() -> analyzer.analyze(healthyCluster(1, 1).pods(null).build()))
                .isInstanceOf(SnapshotUnavailableException.class);
        assertThatThrownBy(() -> analyzer.analyze(healthyCluster(1, 1).configMaps(null).build()))
                .isInstanceOf(SnapshotUnavailableException.class);
    }
}
