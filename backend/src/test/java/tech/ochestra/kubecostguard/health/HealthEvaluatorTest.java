package tech.ochestra.kubecostguard.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.model.IssueSeverity;
import tech.ochestra.kubecostguard.domain.model.NodeConditionType;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.NodeInfo;
import tech.ochestra.kubecostguard.exception.SnapshotUnavailableException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tech.ochestra.kubecostguard.SnapshotFixtures.healthyCluster;
import static tech.ochestra.kubecostguard.SnapshotFixtures.notReadyNode;
import static tech.ochestra.kubecostguard.SnapshotFixtures.readyNode;

/**
 * Tests for HealthEvaluator wired with the real checks.
 *
 * Test strategy:
 * 1. Reference scenarios with known composite scores
 * 2. Fatal versus degraded failures
 * 3. Determinism and monotonicity of the score
 */
class HealthEvaluatorTest {

    private HealthEvaluator evaluator;

    @BeforeEach
    void setUp() {
        KubeCostGuardProperties properties = new KubeCostGuardProperties();
        PodHealthCheck podCheck = new PodHealthCheck(properties);
        HealthScoreCalculator calculator = new HealthScoreCalculator();
        evaluator = new HealthEvaluator(
                new NodeHealthCheck(),
                podCheck,
                new ControlPlaneHealthCheck(properties),
                new NetworkHealthCheck(),
                new ResourceUsageCheck(properties),
                new NamespaceHealthEvaluator(podCheck, calculator, properties),
                calculator,
                new HealthIssueIdentifier(properties),
                Runnable::run
        );
    }

    @Nested
    @DisplayName("Reference scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("Healthy 3-node cluster with 48 running pods scores 100")
        void shouldScoreHealthyCluster() {
            // Given
            ClusterSnapshot snapshot = healthyCluster(3, 16).build();

            // When
            ClusterHealth health = evaluator.evaluate(snapshot);

            // Then
            assertThat(health.podStatus().totalPods()).isEqualTo(48);
            assertThat(health.healthScore()).isBetween(96, 100);
            assertThat(health.healthScore()).isEqualTo(100);
            assertThat(health.issues()).isEmpty();
            assertThat(health.categoryScores().values()).allMatch(CategoryScore::isKnown);
        }

        @Test
        @DisplayName("One NotReady node under memory pressure scores 88 or 89")
        void shouldScoreNodeUnderPressure() {
            // Given
            ClusterSnapshot snapshot = healthyCluster(3, 16)
                    .nodes(List.of(
                            readyNode("node-1"),
                            readyNode("node-2"),
                            notReadyNode("node-3", NodeConditionType.MEMORY_PRESSURE)))
                    .build();

            // When
            ClusterHealth health = evaluator.evaluate(snapshot);

            // Then
            assertThat(health.scoreOf(HealthCategory.NODE).score()).isBetween(61.66, 61.67);
            assertThat(health.healthScore()).isBetween(88, 89);
            assertThat(health.issues())
                    .filteredOn(issue -> issue.severity() == IssueSeverity.CRITICAL)
                    .extracting(HealthIssue::name)
                    .containsExactly("node-3", "node-3");
        }
    }

    @Nested
    @DisplayName("Failure semantics")
    class FailureTests {

        @Test
        @DisplayName("Should abort when nodes cannot be enumerated")
        void shouldFailWithoutNodes() {
            ClusterSnapshot snapshot = healthyCluster(3, 2).nodes(null).build();

            assertThatThrownBy(() -> evaluator.evaluate(snapshot))
                    .isInstanceOf(SnapshotUnavailableException.class);
        }

        @Test
        @DisplayName("Should abort when pods cannot be enumerated")
        void shouldFailWithoutPods() {
            ClusterSnapshot snapshot = healthyCluster(3, 2).pods(null).build();

            assertThatThrownBy(() -> evaluator.evaluate(snapshot))
                    .isInstanceOf(SnapshotUnavailableException.class);
        }

        @Test
        @DisplayName("Should mark the control plane unknown and renormalize the remaining weights")
        void shouldDegradeControlPlane() {
            // Given: node sub-score 61.67 and no API server probe
            ClusterSnapshot snapshot = healthyCluster(3, 4)
                    .nodes(List.of(
                            readyNode("node-1"),
                            readyNode("node-2"),
                            notReadyNode("node-3", NodeConditionType.MEMORY_PRESSURE)))
                    .apiServerProbe(null)
                    .build();

            // When
            ClusterHealth health = evaluator.evaluate(snapshot);

            // Then: (0.30 x 61.67 + 0.45 x 100) / 0.75
            assertThat(health.controlPlaneStatus()).isNull();
            assertThat(health.scoreOf(HealthCategory.CONTROL_PLANE).isKnown()).isFalse();
            assertThat(health.healthScore()).isEqualTo(85);
            assertThat(health.issues())
                    .anyMatch(issue -> issue.severity() == IssueSeverity.INFO
                            && issue.message().startsWith("Control plane health could not be evaluated"));
        }

        @Test
        @DisplayName("Should name the exception type when a degraded check gives no message")
        void shouldDescribeDegradedCheckWithoutMessage() {
            // Given
            KubeCostGuardProperties properties = new KubeCostGuardProperties();
            PodHealthCheck podCheck = new PodHealthCheck(properties);
            HealthScoreCalculator calculator = new HealthScoreCalculator();
            NetworkHealthCheck failingNetwork = new NetworkHealthCheck() {
                @Override
                public NetworkStatus evaluate(ClusterSnapshot snapshot) {
                    throw new IllegalStateException();
                }
            };
            HealthEvaluator degraded = new HealthEvaluator(
                    new NodeHealthCheck(),
                    podCheck,
                    new ControlPlaneHealthCheck(properties),
                    failingNetwork,
                    new ResourceUsageCheck(properties),
                    new NamespaceHealthEvaluator(podCheck, calculator, properties),
                    calculator,
                    new HealthIssueIdentifier(properties),
                    Runnable::run
            );

            // When
            ClusterHealth health = degraded.evaluate(healthyCluster(3, 2).build());

            // Then
            assertThat(health.networkStatus()).isNull();
            assertThat(health.issues())
                    .filteredOn(issue -> issue.message().startsWith("Network health could not be evaluated"))
                    .singleElement()
                    .satisfies(issue -> assertThat(issue.message())
                            .endsWith("IllegalStateException")
                            .doesNotContain("null"));
        }

        @Test
        @DisplayName("Should report resource usage as unknown when metrics are unavailable")
        void shouldDegradeResourceUsage() {
            List<NodeInfo> blind = new ArrayList<>();
            for (String name : List.of("node-1", "node-2")) {
                blind.add(readyNode(name).toBuilder().usage(null).build());
            }
            ClusterSnapshot snapshot = healthyCluster(2, 2).nodes(blind).build();

            ClusterHealth health = evaluator.evaluate(snapshot);

            assertThat(health.resourceUsage()).isNull();
            assertThat(health.scoreOf(HealthCategory.RESOURCE_USAGE).score()).isNull();
            assertThat(health.healthScore()).isEqualTo(100);
        }
    }

    @Nested
    @DisplayName("Score properties")
    class PropertyTests {

        @Test
        @DisplayName("Should produce identical results for identical snapshots")
        void shouldBeDeterministic() {
            ClusterSnapshot snapshot = healthyCluster(3, 5)
                    .nodes(List.of(readyNode("node-1"), readyNode("node-2"),
                            notReadyNode("node-3", NodeConditionType.DISK_PRESSURE)))
                    .build();

            ClusterHealth first = evaluator.evaluate(snapshot);
            ClusterHealth second = evaluator.evaluate(snapshot);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Adding a NotReady node never increases the node or composite score")
        void shouldBeMonotonicInNotReadyNodes() {
            List<NodeInfo> nodes = new ArrayList<>(List.of(readyNode("node-1"), readyNode("node-2")));
            ClusterHealth previous = evaluator.evaluate(healthyCluster(2, 3).nodes(nodes).build());

            for (int i = 3; i <= 6; i++) {
                nodes.add(notReadyNode("node-" + i));
                ClusterHealth next = evaluator.evaluate(healthyCluster(2, 3).nodes(nodes).build());

                assertThat(next.scoreOf(HealthCategory.NODE).score())
                        .isLessThanOrEqualTo(previous.scoreOf(HealthCategory.NODE).score());
                assertThat(next.healthScore()).isLessThanOrEqualTo(previous.healthScore());
                assertThat(next.healthScore()).isBetween(0, 100);
                previous = next;
            }
        }

        @Test
        @DisplayName("Should compute per-namespace health")
        void shouldComputeNamespaceHealth() {
            ClusterHealth health = evaluator.evaluate(healthyCluster(2, 4).build());

            assertThat(health.namespaceHealth()).containsOnlyKeys("payments", "web");
            assertThat(health.namespaceHealth().get("web").podStatus().totalPods()).isEqualTo(4);
            assertThat(health.namespaceHealth().get("web").healthScore()).isEqualTo(100);
        }
    }
}
