package tech.ochestra.kubecostguard.health;

/**
 * @param resourceUsage null when the namespace's pods report no usage or declare no requests
 */
public record NamespaceHealth(
        String namespace,
        PodHealthStatus podStatus,
        NamespaceResourceUsage resourceUsage,
        int healthScore
) {
    /**
     * Namespace usage as a percentage of its pods' requests.
     */
    public record NamespaceResourceUsage(
            long cpuUsageMillis,
            long memoryUsageBytes,
            Double cpuPercentOfRequests,
            Double memoryPercentOfRequests,
            double score
    ) {}
}
