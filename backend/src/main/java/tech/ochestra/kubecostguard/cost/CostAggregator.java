package tech.ochestra.kubecostguard.cost;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.PricedResource;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.NodeInfo;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceKey;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceQuantities;
import tech.ochestra.kubecostguard.exception.SnapshotUnavailableException;
import tech.ochestra.kubecostguard.pricing.PricingConfig;
import tech.ochestra.kubecostguard.pricing.PricingResolver;
import tech.ochestra.kubecostguard.pricing.ResolvedPrices;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes node costs from resolved prices and attributes them down to pods
 * and namespaces.
 *
 * NODE COST (hourly):
 * cpu cores x cpu price + memory GiB x memory price + storage GiB x storage price
 * + network price (per node) + GPU count x GPU price
 *
 * Monthly cost is hourly x 720. A node without allocatable CPU and memory has
 * unknown cost: it is excluded from totals and its pods stay unattributed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostAggregator {

    public static final double HOURS_PER_MONTH = 720.0;

    private final PricingResolver pricingResolver;
    private final PodCostAttributor podCostAttributor;
    private final CostForecastService forecastService;
    private final PricingConfig pricingConfig;
    private final KubeCostGuardProperties properties;

    public CostReport computeCosts(ClusterSnapshot snapshot) {
        return computeCosts(snapshot, pricingConfig);
    }

    public CostReport computeCosts(ClusterSnapshot snapshot, PricingConfig pricing) {
        if (snapshot.nodes() == null) {
            throw new SnapshotUnavailableException("Cannot compute costs: node list is not available");
        }
        if (snapshot.pods() == null) {
            throw new SnapshotUnavailableException("Cannot compute costs: pod list is not available");
        }

        List<String> warnings = new ArrayList<>();
        List<String> unknownNodes = new ArrayList<>();
        Map<String, NodeCost> nodeCosts = new LinkedHashMap<>();
        List<NodeInfo> nodes = snapshot.nodes().stream()
                .sorted(Comparator.comparing(NodeInfo::name))
                .toList();

        double totalHourly = 0;
        for (NodeInfo node : nodes) {
            NodeCost cost = nodeCost(node, pricing);
            nodeCosts.put(node.name(), cost);
            if (cost.costKnown()) {
                totalHourly += cost.hourlyCost();
                warnings.addAll(cost.prices().gaps());
            } else {
                unknownNodes.add(node.name());
                warnings.add("Cost of node " + node.name() + " is unknown: " + cost.unknownReason());
            }
        }

        Map<String, List<PodInfo>> residentPods = new TreeMap<>();
        List<ResourceKey> unattributed = new ArrayList<>();
        snapshot.pods().stream()
                .filter(PodInfo::isResident)
                .sorted(Comparator.comparing(PodInfo::namespace).thenComparing(PodInfo::name))
                .forEach(pod -> {
                    NodeCost node = nodeCosts.get(pod.nodeName());
                    if (node == null || !node.costKnown()) {
                        unattributed.add(pod.key());
                    } else {
                        residentPods.computeIfAbsent(pod.nodeName(), name -> new ArrayList<>()).add(pod);
                    }
                });

        List<PodCost> podCosts = new ArrayList<>();
        residentPods.forEach((nodeName, pods) ->
                podCosts.addAll(podCostAttributor.attribute(nodeCosts.get(nodeName), pods)));
        podCosts.sort(Comparator.comparing(PodCost::namespace).thenComparing(PodCost::name));

        Map<String, NamespaceCost> namespaceCosts = namespaceCosts(podCosts);

        warnings.forEach(warning -> log.warn("Pricing: {}", warning));

        double totalMonthly = totalHourly * HOURS_PER_MONTH;
        CostForecast forecast = forecastService.forecast(
                snapshot.usageHistory(), totalMonthly, properties.getForecast().getHorizonDays());

        log.info("Cost computation complete: {} nodes ({} unknown), {} pods attributed, ${}/hour",
                nodeCosts.size(), unknownNodes.size(), podCosts.size(), String.format("%.4f", totalHourly));

        return new CostReport(
                snapshot.capturedAt(),
                List.copyOf(nodeCosts.values()),
                List.copyOf(podCosts),
                namespaceCosts,
                totalHourly,
                totalMonthly,
                List.copyOf(unknownNodes),
                List.copyOf(unattributed),
                List.copyOf(warnings),
                forecast
        );
    }

    NodeCost nodeCost(NodeInfo node, PricingConfig pricing) {
        NodeUtilization utilization = NodeUtilization.of(node.usage(), node.allocatable());
        ResourceQuantities allocatable = node.allocatable();
        if (allocatable == null || allocatable.cpuMillis() == null || allocatable.memoryBytes() == null) {
            return NodeCost.unknown(node.name(), node.instanceType(), node.region(), utilization,
                    "allocatable CPU and memory not reported");
        }

        ResolvedPrices prices = pricingResolver.resolve(node, pricing);
        Map<PricedResource, Double> breakdown = new EnumMap<>(PricedResource.class);
        breakdown.put(PricedResource.CPU, allocatable.cpuCores() * prices.price(PricedResource.CPU));
        breakdown.put(PricedResource.MEMORY, allocatable.memoryGiB() * prices.price(PricedResource.MEMORY));
        Double storageGiB = allocatable.storageGiB();
        breakdown.put(PricedResource.STORAGE, (storageGiB == null ? 0.0 : storageGiB) * prices.price(PricedResource.STORAGE));
        breakdown.put(PricedResource.NETWORK, prices.price(PricedResource.NETWORK));
        double gpuCost = prices.gpu() == null ? 0.0 : prices.gpu().hourlyCost();

        double hourly = breakdown.values().stream().mapToDouble(Double::doubleValue).sum() + gpuCost;
        return new NodeCost(
                node.name(),
                node.instanceType(),
                node.region(),
                true,
                breakdown,
                gpuCost,
                hourly,
                hourly * HOURS_PER_MONTH,
                prices,
                utilization,
                null
        );
    }

    private static Map<String, NamespaceCost> namespaceCosts(List<PodCost> podCosts) {
        Map<String, List<PodCost>> byNamespace = new TreeMap<>();
        for (PodCost cost : podCosts) {
            byNamespace.computeIfAbsent(cost.namespace(), ns -> new ArrayList<>()).add(cost);
        }
        Map<String, NamespaceCost> result = new LinkedHashMap<>();
        byNamespace.forEach((namespace, costs) -> {
            double hourly = 0;
            double monthly = 0;
            for (PodCost cost : costs) {
                hourly += cost.hourlyCost();
                monthly += cost.monthlyCost();
            }
            result.put(namespace, new NamespaceCost(namespace, costs.size(), hourly, monthly));
        });
        return Collections.unmodifiableMap(result);
    }
}
