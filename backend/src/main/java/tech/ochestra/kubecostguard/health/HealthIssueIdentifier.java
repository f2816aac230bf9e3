package tech.ochestra.kubecostguard.health;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.model.IssueSeverity;
import tech.ochestra.kubecostguard.domain.model.ResourceKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Derives the issue list from computed statuses.
 *
 * Deterministic: the same statuses always produce the same issues in the
 * same order (severity, resource kind, namespace, name).
 */
@Component
@RequiredArgsConstructor
public class HealthIssueIdentifier {

    static final Comparator<HealthIssue> ISSUE_ORDER = Comparator
            .comparing(HealthIssue::severity)
            .thenComparing(HealthIssue::resourceKind)
            .thenComparing(HealthIssue::namespace, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(HealthIssue::name, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(HealthIssue::message);

    private final KubeCostGuardProperties properties;

    public List<HealthIssue> identify(
            NodeHealthStatus nodes,
            PodHealthStatus pods,
            ControlPlaneStatus controlPlane,
            NetworkStatus network,
            ResourceUsageStatus resources,
            Map<HealthCategory, CategoryScore> categoryScores,
            boolean namespaceHealthAvailable,
            Instant detectedAt) {

        List<HealthIssue> issues = new ArrayList<>();
        IssueCollector collect = new IssueCollector(issues, detectedAt);

        nodeIssues(nodes, collect);
        podIssues(pods, collect);
        if (controlPlane != null) {
            controlPlaneIssues(controlPlane, collect);
        }
        if (network != null) {
            networkIssues(network, collect);
        }
        if (resources != null) {
            resourceIssues(resources, collect);
        }

        categoryScores.values().stream()
                .filter(score -> !score.isKnown())
                .forEach(score -> collect.add(IssueSeverity.INFO, ResourceKind.CLUSTER, null,
                        score.category().name(),
                        score.category().getDisplayName() + " health could not be evaluated: " + score.unknownReason(),
                        "Check API access for this category; it is excluded from the health score until then"));
        if (!namespaceHealthAvailable) {
            collect.add(IssueSeverity.INFO, ResourceKind.NAMESPACE, null, null,
                    "Per-namespace health could not be evaluated",
                    "Check pod metrics availability");
        }

        issues.sort(ISSUE_ORDER);
        return List.copyOf(issues);
    }

    private void nodeIssues(NodeHealthStatus nodes, IssueCollector collect) {
        for (String node : nodes.notReadyNodes()) {
            collect.add(IssueSeverity.CRITICAL, ResourceKind.NODE, null, node,
                    "Node is not Ready",
                    "Check kubelet status and node events with 'kubectl describe node " + node + "'");
        }
        nodes.pressuredNodes().forEach((node, conditions) -> collect.add(
                IssueSeverity.CRITICAL, ResourceKind.NODE, null, node,
                "Node reports " + String.join(", ", conditions),
                "Free resources on the node or move workloads to other nodes"));
    }

    private void podIssues(PodHealthStatus pods, IssueCollector collect) {
        for (String key : pods.crashLoopingPods()) {
            collect.addForKey(IssueSeverity.CRITICAL, ResourceKind.POD, key,
                    "Pod is in CrashLoopBackOff",
                    "Inspect container logs with 'kubectl logs --previous'");
        }
        for (String key : pods.restartingPods()) {
            collect.addForKey(IssueSeverity.WARNING, ResourceKind.POD, key,
                    "Container restarted more than " + properties.getHealth().getRestartThreshold() + " times",
                    "Review liveness probes and resource limits");
        }
        if (pods.notRunningPods() > 0) {
            collect.add(IssueSeverity.WARNING, ResourceKind.POD, null, null,
                    pods.notRunningPods() + " of " + pods.totalPods() + " pods are not Running ("
                            + pods.pendingPods() + " pending, " + pods.failedPods() + " failed, "
                            + pods.succeededPods() + " succeeded, " + pods.unknownPods() + " unknown)",
                    "Check pending pods for scheduling problems and clean up completed pods");
        }
    }

    private void controlPlaneIssues(ControlPlaneStatus status, IssueCollector collect) {
        if (!status.apiServerReachable()) {
            collect.add(IssueSeverity.WARNING, ResourceKind.CONTROL_PLANE, null, "kube-apiserver",
                    "API server is not reachable",
                    "Check API server availability and network connectivity");
        } else if (!status.apiServerHealthy()) {
            collect.add(IssueSeverity.WARNING, ResourceKind.CONTROL_PLANE, null, "kube-apiserver",
                    "API server responded in " + status.apiServerLatencyMillis() + "ms",
                    "Check API server load and etcd latency");
        }
        componentIssue(status.controllerHealthy(), "kube-controller-manager", collect);
        componentIssue(status.schedulerHealthy(), "kube-scheduler", collect);
        componentIssue(status.etcdHealthy(), "etcd", collect);
        componentIssue(status.coreDnsHealthy(), "coredns", collect);
    }

    private void componentIssue(boolean healthy, String component, IssueCollector collect) {
        if (!healthy) {
            collect.add(IssueSeverity.WARNING, ResourceKind.CONTROL_PLANE, "kube-system", component,
                    component + " pods are not all Running",
                    "Check the " + component + " pods in kube-system");
        }
    }

    private void networkIssues(NetworkStatus network, IssueCollector collect) {
        if (!network.cniHealthy()) {
            collect.add(IssueSeverity.WARNING, ResourceKind.NETWORK, "kube-system", "cni",
                    "CNI plugin pods are not all Running",
                    "Check the network plugin daemonset");
        }
        if (!network.dnsResolutionOk()) {
            collect.add(IssueSeverity.WARNING, ResourceKind.NETWORK, "kube-system", "kube-dns",
                    "Cluster DNS pods are not all Running",
                    "Check the kube-dns / CoreDNS deployment");
        }
        for (String key : network.servicesWithoutEndpoints()) {
            collect.addForKey(IssueSeverity.WARNING, ResourceKind.SERVICE, key,
                    "Service has no endpoints",
                    "Verify the service selector matches ready pods");
        }
        for (String key : network.unreadyIngressControllers()) {
            collect.addForKey(IssueSeverity.WARNING, ResourceKind.DEPLOYMENT, key,
                    "Ingress controller has fewer ready replicas than desired",
                    "Check the ingress controller pods");
        }
    }

    private void resourceIssues(ResourceUsageStatus usage, IssueCollector collect) {
        usageIssue("CPU", usage.cpuPercent(), collect);
        usageIssue("Memory", usage.memoryPercent(), collect);
        for (String node : usage.highCpuNodes()) {
            collect.add(IssueSeverity.INFO, ResourceKind.NODE, null, node,
                    "High CPU usage on node", "Spread workloads or add capacity");
        }
        for (String node : usage.highMemoryNodes()) {
            collect.add(IssueSeverity.INFO, ResourceKind.NODE, null, node,
                    "High memory usage on node", "Spread workloads or add capacity");
        }
        for (String namespace : usage.highUsageNamespaces()) {
            collect.add(IssueSeverity.INFO, ResourceKind.NAMESPACE, namespace, namespace,
                    "Namespace uses more than " + formatPercent(properties.getHealth().getResourceUsageThresholdPercent())
                            + " of its requests",
                    "Raise requests to match actual usage");
        }
    }

    private void usageIssue(String resource, double percent, IssueCollector collect) {
        KubeCostGuardProperties.Health health = properties.getHealth();
        if (percent >= health.getResourceUsageWarningPercent()) {
            collect.add(IssueSeverity.WARNING, ResourceKind.CLUSTER, null, resource.toLowerCase(),
                    resource + " usage at " + formatPercent(percent) + " of allocatable",
                    "Add nodes or reduce workload requests");
        } else if (percent > health.getResourceUsageThresholdPercent()) {
            collect.add(IssueSeverity.INFO, ResourceKind.CLUSTER, null, resource.toLowerCase(),
                    resource + " usage at " + formatPercent(percent) + " of allocatable",
                    "Plan for additional capacity");
        }
    }

    private static String formatPercent(double percent) {
        return String.format("%.1f%%", percent);
    }

    private record IssueCollector(List<HealthIssue> issues, Instant detectedAt) {

        void add(IssueSeverity severity, ResourceKind kind, String namespace, String name,
                 String message, String suggestion) {
            issues.add(new HealthIssue(severity, kind, namespace, name, message, suggestion, detectedAt));
        }

        void addForKey(IssueSeverity severity, ResourceKind kind, String key, String message, String suggestion) {
            int slash = key.indexOf('/');
            add(severity, kind, key.substring(0, slash), key.substring(slash + 1), message, suggestion);
        }
    }
}
