package tech.ochestra.kubecostguard.domain.model;

/**
 * Utilization classification of a node or pod.
 *
 * Default thresholds (configurable):
 * - IDLE: peak utilization below 5%
 * - UNDERUTILIZED: below 20%
 * - OPTIMIZED: 20-80%
 * - OVERUTILIZED: above 80%
 */
public enum UtilizationStatus {
    /**
     * Allocated capacity well above observed peak.
     * Primary candidate for downsizing.
     */
    UNDERUTILIZED,

    /**
     * Appropriately sized for the workload.
     */
    OPTIMIZED,

    /**
     * Nearing capacity limits.
     */
    OVERUTILIZED,

    /**
     * Minimal to no activity. Candidate for removal.
     */
    IDLE,

    /**
     * No usage metrics available for classification.
     */
    INSUFFICIENT_DATA
}
