package tech.ochestra.kubecostguard.optimization;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.cost.CostAggregator;
import tech.ochestra.kubecostguard.cost.CostReport;
import tech.ochestra.kubecostguard.cost.NodeCost;
import tech.ochestra.kubecostguard.cost.NodeUtilization;
import tech.ochestra.kubecostguard.cost.PodCost;
import tech.ochestra.kubecostguard.domain.model.PodPhase;
import tech.ochestra.kubecostguard.domain.model.PricedResource;
import tech.ochestra.kubecostguard.domain.model.RecommendationAction;
import tech.ochestra.kubecostguard.domain.model.ResourceKind;
import tech.ochestra.kubecostguard.domain.model.UtilizationStatus;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.NodeInfo;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceKey;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceQuantities;
import tech.ochestra.kubecostguard.health.ClusterHealth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns cost and utilization into rightsizing and idle-resource recommendations.
 *
 * DECISION FLOW:
 * 1. Classify every node by peak utilization of its allocatable capacity
 * 2. Idle nodes: remove, saving the full monthly cost
 * 3. Under-utilized nodes: downsize to peak plus headroom
 * 4. Pods on nodes kept: classify by peak usage of their requests, then remove or rightsize
 * 5. Drop anything below the minimum monthly saving and rank by saving
 *
 * NotReady nodes and crash-looping pods are skipped: their low usage reflects
 * the failure, not spare capacity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptimizationAdvisor {

    private static final Comparator<Recommendation> BY_SAVING = Comparator
            .comparingDouble(Recommendation::potentialMonthlySaving).reversed()
            .thenComparing(Recommendation::resourceKind)
            .thenComparing(r -> r.namespace() == null ? "" : r.namespace())
            .thenComparing(Recommendation::name);

    private final UtilizationClassifier classifier;
    private final KubeCostGuardProperties properties;

    public OptimizationReport advise(ClusterSnapshot snapshot, ClusterHealth health, CostReport costs) {
        Set<String> notReadyNodes = new HashSet<>(health.nodeStatus().notReadyNodes());
        Set<String> crashLooping = new HashSet<>(health.podStatus().crashLoopingPods());

        List<Recommendation> recommendations = new ArrayList<>();
        Map<String, UtilizationStatus> nodeStatuses = new TreeMap<>();
        Set<String> removedNodes = new HashSet<>();

        for (NodeInfo node : snapshot.nodes()) {
            NodeCost cost = costs.nodeCost(node.name()).orElse(null);
            NodeUtilization peak = NodeUtilization.of(node.sizingUsage(), node.allocatable());
            UtilizationStatus status = classifier.classify(peak.max());
            nodeStatuses.put(node.name(), status);

            if (cost == null || !cost.costKnown() || notReadyNodes.contains(node.name())) {
                continue;
            }
            if (status == UtilizationStatus.IDLE) {
                removedNodes.add(node.name());
                recommendations.add(removeNode(node, cost, peak));
            } else if (status == UtilizationStatus.UNDERUTILIZED) {
                recommendations.add(downsizeNode(node, cost, peak));
            }
        }

        Map<ResourceKey, PodInfo> pods = new HashMap<>();
        snapshot.pods().forEach(pod -> pods.put(pod.key(), pod));

        for (PodCost cost : costs.podCosts()) {
            PodInfo pod = pods.get(cost.key());
            if (pod == null
                    || pod.phase() != PodPhase.RUNNING
                    || removedNodes.contains(cost.nodeName())
                    || crashLooping.contains(cost.key().toString())) {
                continue;
            }
            Double cpuUtilization = ratio(pod.sizingUsage(), pod.requests(), true);
            Double memoryUtilization = ratio(pod.sizingUsage(), pod.requests(), false);
            Double peak = max(cpuUtilization, memoryUtilization);
            UtilizationStatus status = classifier.classify(peak);

            if (status == UtilizationStatus.IDLE) {
                recommendations.add(removePod(cost, peak));
            } else if (status == UtilizationStatus.UNDERUTILIZED) {
                recommendations.add(rightsizePod(pod, cost, cpuUtilization, memoryUtilization, peak));
            }
        }

        double minimumSaving = properties.getOptimization().getMinimumMonthlySaving();
        List<Recommendation> ranked = recommendations.stream()
                .filter(r -> r.potentialMonthlySaving() >= minimumSaving)
                .sorted(BY_SAVING)
                .toList();
        double totalSaving = ranked.stream().mapToDouble(Recommendation::potentialMonthlySaving).sum();

        log.info("Optimization analysis complete: {} recommendations, potential saving ${}/month",
                ranked.size(), String.format("%.2f", totalSaving));

        return new OptimizationReport(snapshot.capturedAt(), totalSaving, ranked,
                Collections.unmodifiableMap(nodeStatuses));
    }

    private Recommendation removeNode(NodeInfo node, NodeCost cost, NodeUtilization peak) {
        return new Recommendation(
                RecommendationAction.REMOVE_IDLE_NODE,
                ResourceKind.NODE,
                null,
                node.name(),
                node.name(),
                UtilizationStatus.IDLE,
                peak.max(),
                cost.monthlyCost(),
                0.0,
                cost.monthlyCost(),
                null,
                String.format("Peak utilization %s; drain the node and remove it", percent(peak.max()))
        );
    }

    private Recommendation downsizeNode(NodeInfo node, NodeCost cost, NodeUtilization peak) {
        double cpuHourly = cost.hourlyCostOf(PricedResource.CPU) * classifier.resizedFraction(peak.cpu());
        double memoryHourly = cost.hourlyCostOf(PricedResource.MEMORY) * classifier.resizedFraction(peak.memory());
        double fixedHourly = cost.hourlyCost()
                - cost.hourlyCostOf(PricedResource.CPU)
                - cost.hourlyCostOf(PricedResource.MEMORY);
        double projected = (cpuHourly + memoryHourly + fixedHourly) * CostAggregator.HOURS_PER_MONTH;

        return new Recommendation(
                RecommendationAction.DOWNSIZE_NODE,
                ResourceKind.NODE,
                null,
                node.name(),
                node.name(),
                UtilizationStatus.UNDERUTILIZED,
                peak.max(),
                cost.monthlyCost(),
                projected,
                cost.monthlyCost() - projected,
                null,
                String.format("Peak CPU %s, memory %s; a smaller instance type with %.0f%% headroom fits",
                        percent(peak.cpu()), percent(peak.memory()),
                        properties.getOptimization().getHeadroom() * 100)
        );
    }

    private Recommendation removePod(PodCost cost, Double peak) {
        return new Recommendation(
                RecommendationAction.REMOVE_IDLE_POD,
                ResourceKind.POD,
                cost.namespace(),
                cost.name(),
                cost.nodeName(),
                UtilizationStatus.IDLE,
                peak,
                cost.monthlyCost(),
                0.0,
                cost.monthlyCost(),
                null,
                String.format("Peak usage %s of requests; scale the workload down or delete it", percent(peak))
        );
    }

    private Recommendation rightsizePod(PodInfo pod, PodCost cost, Double cpuUtilization,
                                        Double memoryUtilization, Double peak) {
        double cpuFraction = classifier.resizedFraction(cpuUtilization);
        double memoryFraction = classifier.resizedFraction(memoryUtilization);
        double projectedHourly = cost.cpuHourlyCost() * cpuFraction
                + cost.memoryHourlyCost() * memoryFraction
                + cost.sharedHourlyCost();
        double projected = projectedHourly * CostAggregator.HOURS_PER_MONTH;

        ResourceQuantities requests = pod.requests();
        ResourceQuantities recommended = new ResourceQuantities(
                scale(requests.cpuMillis(), cpuFraction),
                scale(requests.memoryBytes(), memoryFraction),
                requests.storageBytes());

        return new Recommendation(
                RecommendationAction.RIGHTSIZE_POD_REQUESTS,
                ResourceKind.POD,
                cost.namespace(),
                cost.name(),
                cost.nodeName(),
                UtilizationStatus.UNDERUTILIZED,
                peak,
                cost.monthlyCost(),
                projected,
                cost.monthlyCost() - projected,
                recommended,
                String.format("Peak CPU %s, memory %s of requests", percent(cpuUtilization), percent(memoryUtilization))
        );
    }

    private static Double ratio(ResourceQuantities used, ResourceQuantities requested, boolean cpu) {
        if (used == null || requested == null) {
            return null;
        }
        Long usedValue = cpu ? used.cpuMillis() : used.memoryBytes();
        Long requestedValue = cpu ? requested.cpuMillis() : requested.memoryBytes();
        if (usedValue == null || requestedValue == null || requestedValue <= 0) {
            return null;
        }
        return (double) usedValue / requestedValue;
    }

    private static Double max(Double a, Double b) {
        if (a == null) {
            return b;
        }
        return b == null ? a : Math.max(a, b);
    }

    private static Long scale(Long value, double fraction) {
        return value == null ? null : (long) Math.ceil(value * fraction);
    }

    private static String percent(Double fraction) {
        return fraction == null ? "unknown" : String.format("%.1f%%", fraction * 100);
    }
}
