package tech.ochestra.kubecostguard.domain.model;

/**
 * Actionable optimization recommendations.
 */
public enum RecommendationAction {
    /**
     * Drain and remove a node with near-zero utilization.
     */
    REMOVE_IDLE_NODE,

    /**
     * Move to a smaller instance that matches observed peak plus headroom.
     */
    DOWNSIZE_NODE,

    /**
     * Scale down or delete a workload that is not doing any work.
     */
    REMOVE_IDLE_POD,

    /**
     * Lower container requests to observed peak plus headroom.
     */
    RIGHTSIZE_POD_REQUESTS
}
