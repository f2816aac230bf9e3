package tech.ochestra.kubecostguard.cost;

import tech.ochestra.kubecostguard.domain.snapshot.ResourceKey;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cost attribution for one snapshot. Rebuilt from scratch every cycle.
 *
 * @param totalHourlyCost  sum over nodes with known cost
 * @param unknownCostNodes nodes left out of the totals
 * @param unattributedPods resident pods whose node has no known cost
 * @param pricingWarnings  pricing gaps and unknown costs, for operator attention
 */
public record CostReport(
        Instant timestamp,
        List<NodeCost> nodeCosts,
        List<PodCost> podCosts,
        Map<String, NamespaceCost> namespaceCosts,
        double totalHourlyCost,
        double totalMonthlyCost,
        List<String> unknownCostNodes,
        List<ResourceKey> unattributedPods,
        List<String> pricingWarnings,
        CostForecast forecast
) {
    public Optional<NodeCost> nodeCost(String nodeName) {
        return nodeCosts.stream().filter(cost -> cost.nodeName().equals(nodeName)).findFirst();
    }
}
