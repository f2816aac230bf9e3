package tech.ochestra.kubecostguard.health;

public record ControlPlaneStatus(
        boolean apiServerReachable,
        boolean apiServerHealthy,
        boolean controllerHealthy,
        boolean schedulerHealthy,
        boolean etcdHealthy,
        boolean coreDnsHealthy,
        long apiServerLatencyMillis,
        double score
) implements CategoryStatus {

    public boolean overallHealthy() {
        return apiServerHealthy && controllerHealthy && schedulerHealthy && etcdHealthy && coreDnsHealthy;
    }

}
