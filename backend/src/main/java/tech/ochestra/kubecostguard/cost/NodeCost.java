package tech.ochestra.kubecostguard.cost;

import tech.ochestra.kubecostguard.domain.model.PricedResource;
import tech.ochestra.kubecostguard.pricing.ResolvedPrices;

import java.util.Map;

/**
 * Hourly and monthly cost of one node.
 *
 * When {@code costKnown} is false the node did not report allocatable CPU and
 * memory; its costs are zero, it is excluded from cluster totals and
 * {@code unknownReason} says why.
 *
 * @param hourlyBreakdown hourly cost per priced resource, GPU excluded
 */
public record NodeCost(
        String nodeName,
        String instanceType,
        String region,
        boolean costKnown,
        Map<PricedResource, Double> hourlyBreakdown,
        double gpuHourlyCost,
        double hourlyCost,
        double monthlyCost,
        ResolvedPrices prices,
        NodeUtilization utilization,
        String unknownReason
) {
    public NodeCost {
        hourlyBreakdown = Map.copyOf(hourlyBreakdown);
    }

    public static NodeCost unknown(String nodeName, String instanceType, String region,
                                   NodeUtilization utilization, String reason) {
        return new NodeCost(nodeName, instanceType, region, false, Map.of(), 0.0, 0.0, 0.0,
                null, utilization, reason);
    }

    public double hourlyCostOf(PricedResource resource) {
        return hourlyBreakdown.getOrDefault(resource, 0.0);
    }
}
