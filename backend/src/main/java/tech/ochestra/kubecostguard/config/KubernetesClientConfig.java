package tech.ochestra.kubecostguard.config;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.ochestra.kubecostguard.adapters.ClusterResourceClient;
import tech.ochestra.kubecostguard.adapters.fabric8.Fabric8ClusterResourceClient;

/**
 * Live cluster access.
 *
 * ENABLED WHEN: kubecostguard.kubernetes.enabled=true
 *
 * The client resolves credentials the usual fabric8 way: in-cluster service
 * account first, then the local kubeconfig.
 */
@Configuration
@ConditionalOnProperty(name = "kubecostguard.kubernetes.enabled", havingValue = "true")
@Slf4j
public class KubernetesClientConfig {

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        KubernetesClient client = new KubernetesClientBuilder().build();
        log.info("Kubernetes client configured for {}", client.getMasterUrl());
        return client;
    }

    @Bean
    public ClusterResourceClient clusterResourceClient(KubernetesClient kubernetesClient) {
        return new Fabric8ClusterResourceClient(kubernetesClient);
    }
}
