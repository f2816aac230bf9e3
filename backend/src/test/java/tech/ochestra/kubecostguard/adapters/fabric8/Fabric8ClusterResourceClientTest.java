package tech.ochestra.kubecostguard.adapters.fabric8;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapList;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.fabric8.kubernetes.client.dsl.Resource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.ochestra.kubecostguard.exception.ClusterOperationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for Fabric8ClusterResourceClient against a mocked fabric8 DSL chain.
 */
@ExtendWith(MockitoExtension.class)
class Fabric8ClusterResourceClientTest {

    @Mock
    private KubernetesClient kubernetesClient;

    @Mock
    private MixedOperation<ConfigMap, ConfigMapList, Resource<ConfigMap>> configMaps;

    @Mock
    private NonNamespaceOperation<ConfigMap, ConfigMapList, Resource<ConfigMap>> configMapsInNamespace;

    @Mock
    private Resource<ConfigMap> configMapResource;

    @Mock
    private MixedOperation<Pod, PodList, PodResource> pods;

    @Mock
    private NonNamespaceOperation<Pod, PodList, PodResource> podsInNamespace;

    @Mock
    private PodResource podResource;

    private Fabric8ClusterResourceClient client;

    @BeforeEach
    void setUp() {
        client = new Fabric8ClusterResourceClient(kubernetesClient);
    }

    @Test
    @DisplayName("Should delete the named ConfigMap in its namespace")
    void shouldDeleteConfigMap() {
        // Given
        when(kubernetesClient.configMaps()).thenReturn(configMaps);
        when(configMaps.inNamespace("web")).thenReturn(configMapsInNamespace);
        when(configMapsInNamespace.withName("legacy-settings")).thenReturn(configMapResource);
        when(configMapResource.delete()).thenReturn(List.of(new StatusDetails()));

        // When
        client.deleteConfigMap("web", "legacy-settings");

        // Then
        verify(configMapResource).delete();
    }

    @Test
    @DisplayName("Should treat a pod that is already gone as deleted")
    void shouldAcceptMissingPod() {
        givenPod("batch", "report-123");
        when(podResource.delete()).thenReturn(List.of());

        assertThatCode(() -> client.deletePod("batch", "report-123")).doesNotThrowAnyException();
        verify(podResource).delete();
    }

    @Test
    @DisplayName("Should wrap API errors in ClusterOperationException")
    void shouldWrapApiErrors() {
        givenPod("batch", "report-123");
        when(podResource.delete())
                .thenThrow(new KubernetesClientException("pods \"report-123\" is forbidden"));

        assertThatThrownBy(() -> client.deletePod("batch", "report-123"))
                .isInstanceOf(ClusterOperationException.class)
                .hasMessageContaining("batch/report-123")
                .hasMessageContaining("forbidden")
                .hasCauseInstanceOf(KubernetesClientException.class);
    }

    private void givenPod(String namespace, String name) {
        when(kubernetesClient.pods()).thenReturn(pods);
        when(pods.inNamespace(namespace)).thenReturn(podsInNamespace);
        when(podsInNamespace.withName(name)).thenReturn(podResource);
    }
}
