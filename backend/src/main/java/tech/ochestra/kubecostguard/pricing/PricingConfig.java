package tech.ochestra.kubecostguard.pricing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Tiered pricing table: per-instance-type overrides on top of defaults,
 * scaled by a per-region multiplier.
 *
 * Loaded once per process and never modified afterwards.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PricingConfig(
        UnitPrices defaults,
        Map<String, UnitPrices> instanceTypes,
        Map<String, Double> regionMultipliers
) {
    public PricingConfig {
        defaults = defaults == null ? new UnitPrices(null, null, null, null, null) : defaults;
        instanceTypes = instanceTypes == null ? Map.of() : Map.copyOf(instanceTypes);
        regionMultipliers = regionMultipliers == null ? Map.of() : Map.copyOf(regionMultipliers);
    }

    public static PricingConfig defaultsOnly(UnitPrices defaults) {
        return new PricingConfig(defaults, null, null);
    }
}
