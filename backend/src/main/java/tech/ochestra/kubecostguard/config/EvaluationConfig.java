package tech.ochestra.kubecostguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tech.ochestra.kubecostguard.pricing.PricingConfig;
import tech.ochestra.kubecostguard.pricing.PricingConfigLoader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Beans shared by the evaluation pipeline.
 */
@Configuration
public class EvaluationConfig {

    /**
     * Runs health checks and cost computation. Sized for the five checks,
     * the namespace pass and the cost task of one cycle.
     */
    @Bean(name = "evaluationExecutor", destroyMethod = "shutdown")
    public ExecutorService evaluationExecutor() {
        return Executors.newFixedThreadPool(8, new CustomizableThreadFactory("evaluation-"));
    }

    @Bean
    public PricingConfig pricingConfig(PricingConfigLoader loader, KubeCostGuardProperties properties) {
        return loader.load(properties.getPricing().getLocation());
    }
}
