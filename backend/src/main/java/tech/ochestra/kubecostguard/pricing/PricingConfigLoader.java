package tech.ochestra.kubecostguard.pricing;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the pricing table from a JSON document.
 *
 * Locations use Spring resource syntax ({@code classpath:}, {@code file:}).
 * A document holding only {@code defaults} is valid.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PricingConfigLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public PricingConfig load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Pricing configuration not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            PricingConfig config = parse(in);
            log.info("Loaded pricing configuration from {}: {} instance types, {} region multipliers, {} GPU models",
                    location,
                    config.instanceTypes().size(),
                    config.regionMultipliers().size(),
                    config.defaults().gpuPricing().size());
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read pricing configuration from " + location, e);
        }
    }

    PricingConfig parse(InputStream in) throws IOException {
        PricingConfig config = objectMapper.readValue(in, PricingConfig.class);
        if (config == null) {
            throw new IOException("Pricing document is empty");
        }
        return config;
    }
}
