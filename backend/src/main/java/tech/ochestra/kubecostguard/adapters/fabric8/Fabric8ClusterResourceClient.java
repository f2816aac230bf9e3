package tech.ochestra.kubecostguard.adapters.fabric8;

import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tech.ochestra.kubecostguard.adapters.ClusterResourceClient;
import tech.ochestra.kubecostguard.exception.ClusterOperationException;

import java.util.List;

/**
 * {@link ClusterResourceClient} backed by the fabric8 Kubernetes client.
 */
@RequiredArgsConstructor
@Slf4j
public class Fabric8ClusterResourceClient implements ClusterResourceClient {

    private final KubernetesClient client;

    @Override
    public void deleteConfigMap(String namespace, String name) {
        try {
            List<StatusDetails> deleted = client.configMaps().inNamespace(namespace).withName(name).delete();
            logResult("ConfigMap", namespace, name, deleted);
        } catch (KubernetesClientException e) {
            throw new ClusterOperationException(
                    "Failed to delete ConfigMap " + namespace + "/" + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void deletePod(String namespace, String name) {
        try {
            List<StatusDetails> deleted = client.pods().inNamespace(namespace).withName(name).delete();
            logResult("Pod", namespace, name, deleted);
        } catch (KubernetesClientException e) {
            throw new ClusterOperationException(
                    "Failed to delete Pod " + namespace + "/" + name + ": " + e.getMessage(), e);
        }
    }

    private void logResult(String kind, String namespace, String name, List<StatusDetails> deleted) {
        if (deleted == null || deleted.isEmpty()) {
            log.debug("{} {}/{} was already gone", kind, namespace, name);
        } else {
            log.debug("Delete request accepted for {} {}/{}", kind, namespace, name);
        }
    }
}
