package tech.ochestra.kubecostguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Application settings bound from the {@code kubecostguard.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "kubecostguard")
public class KubeCostGuardProperties {

    private Pricing pricing = new Pricing();
    private Health health = new Health();
    private Optimization optimization = new Optimization();
    private Forecast forecast = new Forecast();
    private Cleanup cleanup = new Cleanup();
    private Monitoring monitoring = new Monitoring();
    private Kubernetes kubernetes = new Kubernetes();

    @Data
    public static class Pricing {
        private String location = "classpath:pricing-config.json";
    }

    @Data
    public static class Health {
        /** Container restarts above this count mark a pod as restarting. */
        private int restartThreshold = 5;
        private long apiLatencyThresholdMillis = 1000;
        /** Cluster usage above this percentage starts reducing the resource score. */
        private double resourceUsageThresholdPercent = 80.0;
        /** Usage above this percentage is reported as a warning instead of info. */
        private double resourceUsageWarningPercent = 95.0;
    }

    @Data
    public static class Optimization {
        private double idleThreshold = 0.05;
        private double underutilizedThreshold = 0.20;
        private double overutilizedThreshold = 0.80;
        /** Headroom added on top of observed peak when sizing down. */
        private double headroom = 0.20;
        private double minimumMonthlySaving = 1.0;
    }

    @Data
    public static class Forecast {
        private int horizonDays = 30;
    }

    @Data
    public static class Cleanup {
        private Duration retention = Duration.ofDays(7);
        private List<String> excludedNamespaces = new ArrayList<>();
        private boolean applyOnSchedule = false;
    }

    @Data
    public static class Monitoring {
        private boolean enabled = false;
        private long intervalMillis = 300_000;
        private long cycleTimeoutMillis = 120_000;
    }

    @Data
    public static class Kubernetes {
        private boolean enabled = false;
    }
}
