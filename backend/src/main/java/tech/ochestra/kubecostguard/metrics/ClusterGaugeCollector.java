package tech.ochestra.kubecostguard.metrics;

import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.cost.CostReport;
import tech.ochestra.kubecostguard.domain.model.PodPhase;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceQuantities;
import tech.ochestra.kubecostguard.health.ClusterHealth;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives the per-cycle gauges handed to the metrics exporter.
 *
 * GAUGES:
 * - kubecostguard_node_ready{node}: 1 when Ready, else 0
 * - kubecostguard_pod_status{namespace,phase}: pod count
 * - kubecostguard_namespace_cpu_usage_millicores{namespace}
 * - kubecostguard_namespace_memory_usage_bytes{namespace}
 * - kubecostguard_namespace_cost_per_hour{namespace}
 * - kubecostguard_resource_efficiency_ratio{resource}: usage / requests over pods declaring both
 * - kubecostguard_cluster_health_score
 */
@Component
public class ClusterGaugeCollector {

    public static final String NODE_READY = "kubecostguard_node_ready";
    public static final String POD_STATUS = "kubecostguard_pod_status";
    public static final String NAMESPACE_CPU_USAGE = "kubecostguard_namespace_cpu_usage_millicores";
    public static final String NAMESPACE_MEMORY_USAGE = "kubecostguard_namespace_memory_usage_bytes";
    public static final String NAMESPACE_COST = "kubecostguard_namespace_cost_per_hour";
    public static final String RESOURCE_EFFICIENCY = "kubecostguard_resource_efficiency_ratio";
    public static final String CLUSTER_HEALTH_SCORE = "kubecostguard_cluster_health_score";

    public List<GaugeSample> collect(ClusterSnapshot snapshot, ClusterHealth health, CostReport costs) {
        List<GaugeSample> samples = new ArrayList<>();

        Map<String, List<String>> nodeConditions = health.nodeStatus().nodeConditions();
        List<String> notReady = health.nodeStatus().notReadyNodes();
        nodeConditions.keySet().forEach(node -> samples.add(
                new GaugeSample(NODE_READY, Map.of("node", node), notReady.contains(node) ? 0 : 1)));

        Map<String, Map<PodPhase, Integer>> phases = new TreeMap<>();
        Map<String, long[]> usage = new TreeMap<>();
        long[] efficiency = new long[4];
        for (PodInfo pod : snapshot.pods()) {
            phases.computeIfAbsent(pod.namespace(), ns -> new EnumMap<>(PodPhase.class))
                    .merge(pod.phase(), 1, Integer::sum);
            ResourceQuantities used = pod.usage();
            if (used == null) {
                continue;
            }
            long[] totals = usage.computeIfAbsent(pod.namespace(), ns -> new long[2]);
            totals[0] += used.cpuMillis() == null ? 0 : used.cpuMillis();
            totals[1] += used.memoryBytes() == null ? 0 : used.memoryBytes();

            ResourceQuantities requested = pod.requests();
            if (requested != null && used.cpuMillis() != null && requested.cpuMillis() != null) {
                efficiency[0] += used.cpuMillis();
                efficiency[1] += requested.cpuMillis();
            }
            if (requested != null && used.memoryBytes() != null && requested.memoryBytes() != null) {
                efficiency[2] += used.memoryBytes();
                efficiency[3] += requested.memoryBytes();
            }
        }

        phases.forEach((namespace, counts) -> counts.forEach((phase, count) -> samples.add(
                new GaugeSample(POD_STATUS, Map.of("namespace", namespace, "phase", phase.toApiValue()), count))));

        usage.forEach((namespace, totals) -> {
            samples.add(new GaugeSample(NAMESPACE_CPU_USAGE, Map.of("namespace", namespace), totals[0]));
            samples.add(new GaugeSample(NAMESPACE_MEMORY_USAGE, Map.of("namespace", namespace), totals[1]));
        });

        costs.namespaceCosts().forEach((namespace, cost) -> samples.add(
                new GaugeSample(NAMESPACE_COST, Map.of("namespace", namespace), cost.hourlyCost())));

        // Omitted rather than reported as 0 when nothing is measurable
        if (efficiency[1] > 0) {
            samples.add(new GaugeSample(RESOURCE_EFFICIENCY, Map.of("resource", "cpu"),
                    (double) efficiency[0] / efficiency[1]));
        }
        if (efficiency[3] > 0) {
            samples.add(new GaugeSample(RESOURCE_EFFICIENCY, Map.of("resource", "memory"),
                    (double) efficiency[2] / efficiency[3]));
        }

        samples.add(GaugeSample.of(CLUSTER_HEALTH_SCORE, health.healthScore()));
        return List.copyOf(samples);
    }
}
