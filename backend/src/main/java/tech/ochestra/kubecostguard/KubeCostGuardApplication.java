package tech.ochestra.kubecostguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Kubernetes cluster health, cost attribution and cleanup advisor.
 *
 * Evaluates cluster snapshots into a health score, per-workload costs and
 * optimization recommendations, optionally on a fixed schedule.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class KubeCostGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(KubeCostGuardApplication.class, args);
    }
}
