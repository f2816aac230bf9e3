package tech.ochestra.kubecostguard.domain.snapshot;

import java.time.Instant;

/**
 * Cluster-wide utilization at one point in the history window, as fractions (0.0-1.0).
 */
public record UsageSample(
        Instant timestamp,
        double cpuUtilization,
        double memoryUtilization
) {
    public double meanUtilization() {
        return (cpuUtilization + memoryUtilization) / 2.0;
    }
}
