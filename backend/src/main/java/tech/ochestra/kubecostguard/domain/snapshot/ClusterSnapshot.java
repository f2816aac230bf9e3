package tech.ochestra.kubecostguard.domain.snapshot;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, point-in-time capture of cluster state used as the sole input
 * of one evaluation cycle.
 *
 * SECTION AVAILABILITY:
 * A null list means the collaborator could not enumerate that section.
 * Missing nodes or pods make the snapshot unusable; every other section
 * only degrades the checks that depend on it.
 */
@Builder(toBuilder = true)
public record ClusterSnapshot(
        Instant capturedAt,
        List<NodeInfo> nodes,
        List<PodInfo> pods,
        List<PodInfo> controlPlanePods,
        ApiServerProbe apiServerProbe,
        List<ServiceInfo> services,
        List<EndpointsInfo> endpoints,
        List<DeploymentInfo> ingressControllers,
        List<NetworkPolicyInfo> networkPolicies,
        List<ConfigMapInfo> configMaps,
        List<UsageSample> usageHistory
) {
    public ClusterSnapshot {
        Objects.requireNonNull(capturedAt, "capturedAt");
        nodes = copyOrNull(nodes);
        pods = copyOrNull(pods);
        controlPlanePods = copyOrNull(controlPlanePods);
        services = copyOrNull(services);
        endpoints = copyOrNull(endpoints);
        ingressControllers = copyOrNull(ingressControllers);
        networkPolicies = copyOrNull(networkPolicies);
        configMaps = copyOrNull(configMaps);
        usageHistory = usageHistory == null ? List.of() : List.copyOf(usageHistory);
    }

    private static <T> List<T> copyOrNull(List<T> items) {
        return items == null ? null : List.copyOf(items);
    }
}
