package tech.ochestra.kubecostguard.pricing;

import tech.ochestra.kubecostguard.domain.model.PricedResource;

import java.util.List;
import java.util.Map;

/**
 * Hourly unit prices resolved for one node, region multiplier included.
 *
 * @param instanceOverride true when the node's instance type has an entry in the table
 * @param gpu              null when the node has no GPUs
 * @param gaps             human readable notes on prices that fell back to 0
 */
public record ResolvedPrices(
        Map<PricedResource, Double> unitPrices,
        double regionMultiplier,
        boolean instanceOverride,
        GpuPrice gpu,
        List<String> gaps
) {
    public ResolvedPrices {
        unitPrices = Map.copyOf(unitPrices);
        gaps = List.copyOf(gaps);
    }

    public double price(PricedResource resource) {
        return unitPrices.getOrDefault(resource, 0.0);
    }

    public boolean hasGaps() {
        return !gaps.isEmpty();
    }
}
