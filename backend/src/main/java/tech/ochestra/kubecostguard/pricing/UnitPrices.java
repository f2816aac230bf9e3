package tech.ochestra.kubecostguard.pricing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import tech.ochestra.kubecostguard.domain.model.PricedResource;

import java.util.Map;

/**
 * Hourly unit prices for one tier of the pricing table. Null means the tier
 * does not set a price for that resource type.
 *
 * @param gpuPricing GPU model to hourly price per device; only read from the defaults tier
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UnitPrices(
        Double cpu,
        Double memory,
        Double storage,
        Double network,
        Map<String, Double> gpuPricing
) {
    public UnitPrices {
        gpuPricing = gpuPricing == null ? Map.of() : Map.copyOf(gpuPricing);
    }

    public Double priceOf(PricedResource resource) {
        return switch (resource) {
            case CPU -> cpu;
            case MEMORY -> memory;
            case STORAGE -> storage;
            case NETWORK -> network;
        };
    }
}
