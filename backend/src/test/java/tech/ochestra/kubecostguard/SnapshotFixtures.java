package tech.ochestra.kubecostguard;

import tech.ochestra.kubecostguard.domain.model.NodeConditionType;
import tech.ochestra.kubecostguard.domain.model.PodPhase;
import tech.ochestra.kubecostguard.domain.snapshot.ApiServerProbe;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.ConfigMapInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ContainerStatusInfo;
import tech.ochestra.kubecostguard.domain.snapshot.DeploymentInfo;
import tech.ochestra.kubecostguard.domain.snapshot.EndpointsInfo;
import tech.ochestra.kubecostguard.domain.snapshot.NetworkPolicyInfo;
import tech.ochestra.kubecostguard.domain.snapshot.NodeInfo;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceQuantities;
import tech.ochestra.kubecostguard.domain.snapshot.ServiceInfo;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builders for cluster snapshots used across tests.
 */
public final class SnapshotFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    public static final long MIB = 1024L * 1024L;
    public static final long GIB = 1024L * MIB;

    private SnapshotFixtures() {
    }

    /**
     * Ready m5.xlarge-sized node (4 cores, 16 GiB) at 65% CPU and 72% memory.
     */
    public static NodeInfo readyNode(String name) {
        return NodeInfo.builder()
                .name(name)
                .instanceType("m5.xlarge")
                .region("us-east-1")
                .zone("us-east-1a")
                .allocatable(ResourceQuantities.of(4000, 16 * GIB))
                .conditions(Set.of(NodeConditionType.READY))
                .usage(ResourceQuantities.of(2600, (long) (16 * GIB * 0.72)))
                .build();
    }

    public static NodeInfo notReadyNode(String name, NodeConditionType... conditions) {
        return readyNode(name).toBuilder()
                .conditions(Set.of(conditions))
                .build();
    }

    public static PodInfo runningPod(String namespace, String name, String node) {
        return PodInfo.builder()
                .namespace(namespace)
                .name(name)
                .nodeName(node)
                .phase(PodPhase.RUNNING)
                .createdAt(NOW.minus(Duration.ofDays(1)))
                .containers(List.of(new ContainerStatusInfo("app", 0, null)))
                .requests(ResourceQuantities.of(250, 512 * MIB))
                .usage(ResourceQuantities.of(100, 256 * MIB))
                .build();
    }

    public static PodInfo systemPod(String name, String k8sApp, PodPhase phase) {
        return PodInfo.builder()
                .namespace("kube-system")
                .name(name)
                .nodeName("node-1")
                .labels(k8sApp == null ? Map.of() : Map.of("k8s-app", k8sApp))
                .phase(phase)
                .createdAt(NOW.minus(Duration.ofDays(30)))
                .build();
    }

    public static List<PodInfo> healthyControlPlane() {
        return List.of(
                systemPod("kube-controller-manager-cp-1", null, PodPhase.RUNNING),
                systemPod("kube-scheduler-cp-1", null, PodPhase.RUNNING),
                systemPod("etcd-cp-1", null, PodPhase.RUNNING),
                systemPod("coredns-5d78c9869d-abcde", "kube-dns", PodPhase.RUNNING),
                systemPod("calico-node-xk2lp", "calico-node", PodPhase.RUNNING)
        );
    }

    public static DeploymentInfo ingressController(int desired, int ready) {
        return new DeploymentInfo("ingress-nginx", "ingress-nginx-controller",
                Map.of("app", "ingress-nginx"), desired, ready);
    }

    /**
     * Fully healthy cluster: every node Ready, every pod Running, control plane
     * and network checks passing, usage below the penalty threshold.
     */
    public static ClusterSnapshot.ClusterSnapshotBuilder healthyCluster(int nodeCount, int podsPerNode) {
        List<NodeInfo> nodes = new ArrayList<>();
        List<PodInfo> pods = new ArrayList<>();
        for (int n = 1; n <= nodeCount; n++) {
            String node = "node-" + n;
            nodes.add(readyNode(node));
            for (int p = 1; p <= podsPerNode; p++) {
                pods.add(runningPod(p % 2 == 0 ? "payments" : "web", "app-" + n + "-" + p, node));
            }
        }
        return ClusterSnapshot.builder()
                .capturedAt(NOW)
                .nodes(nodes)
                .pods(pods)
                .controlPlanePods(healthyControlPlane())
                .apiServerProbe(ApiServerProbe.healthy(40))
                .services(List.of(new ServiceInfo("web", "frontend", Map.of("app", "frontend"))))
                .endpoints(List.of(new EndpointsInfo("web", "frontend", 1)))
                .ingressControllers(List.of(ingressController(2, 2)))
                .networkPolicies(List.of(new NetworkPolicyInfo("web", "default-deny")))
                .configMaps(List.of())
                .usageHistory(List.of());
    }

    public static ConfigMapInfo configMap(String namespace, String name) {
        return new ConfigMapInfo(namespace, name, NOW.minus(Duration.ofDays(20)));
    }
}
