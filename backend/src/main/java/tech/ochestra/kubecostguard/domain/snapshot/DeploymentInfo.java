package tech.ochestra.kubecostguard.domain.snapshot;

import java.util.Map;

public record DeploymentInfo(
        String namespace,
        String name,
        Map<String, String> labels,
        int desiredReplicas,
        int readyReplicas
) {
    public DeploymentInfo {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public boolean isFullyReady() {
        return readyReplicas >= desiredReplicas;
    }
}
