package tech.ochestra.kubecostguard.pricing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.domain.model.PricedResource;
import tech.ochestra.kubecostguard.domain.snapshot.GpuInfo;
import tech.ochestra.kubecostguard.domain.snapshot.NodeInfo;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves the hourly unit prices of a node from a {@link PricingConfig}.
 *
 * RESOLUTION ORDER (per resource type):
 * 1. instanceTypes[node.instanceType][type]
 * 2. defaults[type]
 * 3. 0.0, recorded as a gap
 *
 * The result is multiplied by regionMultipliers[node.region], or 1.0 when the
 * region is absent or unlisted. GPUs resolve by model through defaults.gpuPricing.
 *
 * Pure and total: never throws for missing data and has no side effects.
 */
@Component
@Slf4j
public class PricingResolver {

    static final double DEFAULT_REGION_MULTIPLIER = 1.0;

    public ResolvedPrices resolve(NodeInfo node, PricingConfig pricing) {
        UnitPrices override = instanceOverride(node.instanceType(), pricing);
        double multiplier = regionMultiplier(node.region(), pricing);
        List<String> gaps = new ArrayList<>();

        Map<PricedResource, Double> unitPrices = new EnumMap<>(PricedResource.class);
        for (PricedResource resource : PricedResource.values()) {
            Double price = override != null ? override.priceOf(resource) : null;
            if (price == null) {
                price = pricing.defaults().priceOf(resource);
            }
            if (price == null) {
                gaps.add("No " + resource.getKey() + " price for node " + node.name());
                price = 0.0;
            }
            unitPrices.put(resource, price * multiplier);
        }

        GpuPrice gpu = resolveGpu(node, pricing, multiplier, gaps);

        return new ResolvedPrices(unitPrices, multiplier, override != null, gpu, gaps);
    }

    private GpuPrice resolveGpu(NodeInfo node, PricingConfig pricing, double multiplier, List<String> gaps) {
        GpuInfo gpu = node.gpu();
        if (gpu == null || gpu.count() <= 0) {
            return null;
        }
        Double price = gpu.model() == null ? null : pricing.defaults().gpuPricing().get(gpu.model());
        if (price == null) {
            gaps.add("Unrecognized GPU model '" + gpu.model() + "' on node " + node.name() + " priced at 0");
            return new GpuPrice(gpu.model(), gpu.count(), 0.0, false);
        }
        return new GpuPrice(gpu.model(), gpu.count(), price * multiplier, true);
    }

    private UnitPrices instanceOverride(String instanceType, PricingConfig pricing) {
        if (instanceType == null || instanceType.isBlank()) {
            return null;
        }
        return pricing.instanceTypes().get(instanceType);
    }

    /**
     * Region keys are matched as given first, then case-insensitively.
     */
    double regionMultiplier(String region, PricingConfig pricing) {
        if (region == null || region.isBlank()) {
            return DEFAULT_REGION_MULTIPLIER;
        }
        Double multiplier = pricing.regionMultipliers().get(region);
        if (multiplier == null) {
            String normalized = region.toLowerCase(Locale.ROOT).trim();
            multiplier = pricing.regionMultipliers().entrySet().stream()
                    .filter(entry -> entry.getKey().toLowerCase(Locale.ROOT).equals(normalized))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
        }
        return multiplier != null ? multiplier : DEFAULT_REGION_MULTIPLIER;
    }
}
