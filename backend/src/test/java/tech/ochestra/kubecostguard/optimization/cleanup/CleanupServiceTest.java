package tech.ochestra.kubecostguard.optimization.cleanup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import tech.ochestra.kubecostguard.adapters.ClusterResourceClient;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.PodPhase;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.exception.ClusterOperationException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static tech.ochestra.kubecostguard.SnapshotFixtures.NOW;
import static tech.ochestra.kubecostguard.SnapshotFixtures.configMap;
import static tech.ochestra.kubecostguard.SnapshotFixtures.healthyCluster;
import static tech.ochestra.kubecostguard.SnapshotFixtures.runningPod;

@ExtendWith(MockitoExtension.class)
class CleanupServiceTest {

    @Mock
    private ObjectProvider<ClusterResourceClient> clientProvider;

    @Mock
    private ClusterResourceClient client;

    private CleanupService service;

    // Two unused ConfigMaps and one stale pod
    private final ClusterSnapshot snapshot = healthyCluster(1, 0)
            .pods(List.of(runningPod("batch", "report-123", "node-1").toBuilder()
                    .phase(PodPhase.SUCCEEDED)
                    .createdAt(NOW.minus(Duration.ofDays(14)))
                    .build()))
            .configMaps(List.of(configMap("web", "old-a"), configMap("web", "old-b")))
            .build();

    @BeforeEach
    void setUp() {
        service = new CleanupService(new CleanupAnalyzer(new KubeCostGuardProperties()), clientProvider);
    }

    @Test
    @DisplayName("Dry run should list candidates without touching the cluster")
    void dryRunShouldNotMutate() {
        CleanupResult first = service.dryRun(snapshot);
        CleanupResult second = service.dryRun(snapshot);

        assertThat(first.mode()).isEqualTo(CleanupMode.DRY_RUN);
        assertThat(first.recommendations()).hasSize(3);
        assertThat(first.items()).isEmpty();
        assertThat(second).isEqualTo(first);
        verifyNoInteractions(clientProvider, client);
    }

    @Test
    @DisplayName("Apply should delete exactly the recommended resources in order")
    void applyShouldDeleteRecommendations() {
        when(clientProvider.getIfAvailable()).thenReturn(client);

        CleanupResult result = service.apply(snapshot);

        InOrder order = inOrder(client);
        order.verify(client).deletePod("batch", "report-123");
        order.verify(client).deleteConfigMap("web", "old-a");
        order.verify(client).deleteConfigMap("web", "old-b");
        assertThat(result.count(CleanupOutcome.DELETED)).isEqualTo(3);
        assertThat(result.partial()).isFalse();
    }

    @Test
    @DisplayName("Apply should continue past a failed deletion and report a partial run")
    void applyShouldContinueAfterFailure() {
        when(clientProvider.getIfAvailable()).thenReturn(client);
        doThrow(new ClusterOperationException("forbidden")).when(client).deleteConfigMap("web", "old-a");

        CleanupResult result = service.apply(snapshot);

        verify(client).deletePod("batch", "report-123");
        verify(client).deleteConfigMap("web", "old-b");
        assertThat(result.partial()).isTrue();
        assertThat(result.items().get(1).outcome()).isEqualTo(CleanupOutcome.FAILED);
        assertThat(result.items().get(1).error()).isEqualTo("forbidden");
        assertThat(result.count(CleanupOutcome.DELETED)).isEqualTo(2);
    }

    @Test
    @DisplayName("Apply should stop between deletions once cancelled")
    void applyShouldHonourCancellation() {
        when(clientProvider.getIfAvailable()).thenReturn(client);
        AtomicInteger checks = new AtomicInteger();

        CleanupResult result = service.apply(snapshot, () -> checks.incrementAndGet() > 1);

        verify(client).deletePod("batch", "report-123");
        verify(client, never()).deleteConfigMap("web", "old-a");
        verify(client, never()).deleteConfigMap("web", "old-b");
        assertThat(result.count(CleanupOutcome.SKIPPED_CANCELLED)).isEqualTo(2);
        assertThat(result.partial()).isTrue();
    }

    @Test
    @DisplayName("Apply without a cluster client should fail")
    void applyShouldRequireClient() {
        when(clientProvider.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> service.apply(snapshot))
                .isInstanceOf(ClusterOperationException.class)
                .hasMessageContaining("no cluster client");
    }
}
