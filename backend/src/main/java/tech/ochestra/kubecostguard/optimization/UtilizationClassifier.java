package tech.ochestra.kubecostguard.optimization;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.UtilizationStatus;

/**
 * Classifies peak utilization against the configured thresholds.
 *
 * THRESHOLDS (defaults):
 * - IDLE: below 5%
 * - UNDERUTILIZED: below 20%
 * - OVERUTILIZED: above 80%
 * - OPTIMIZED: everything in between
 */
@Component
@RequiredArgsConstructor
public class UtilizationClassifier {

    private final KubeCostGuardProperties properties;

    public UtilizationStatus classify(Double utilization) {
        if (utilization == null) {
            return UtilizationStatus.INSUFFICIENT_DATA;
        }
        KubeCostGuardProperties.Optimization thresholds = properties.getOptimization();
        if (utilization < thresholds.getIdleThreshold()) {
            return UtilizationStatus.IDLE;
        } else if (utilization < thresholds.getUnderutilizedThreshold()) {
            return UtilizationStatus.UNDERUTILIZED;
        } else if (utilization > thresholds.getOverutilizedThreshold()) {
            return UtilizationStatus.OVERUTILIZED;
        }
        return UtilizationStatus.OPTIMIZED;
    }

    /**
     * Fraction of the current allocation needed to hold the peak plus headroom,
     * capped at 1. Unknown utilization keeps the full allocation.
     */
    public double resizedFraction(Double peakUtilization) {
        if (peakUtilization == null) {
            return 1.0;
        }
        return Math.min(1.0, peakUtilization * (1.0 + properties.getOptimization().getHeadroom()));
    }
}
