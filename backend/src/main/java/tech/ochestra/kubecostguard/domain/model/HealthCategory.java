package tech.ochestra.kubecostguard.domain.model;

/**
 * Health categories combined into the composite cluster score.
 *
 * Weights sum to 1.0. When a category cannot be evaluated its weight is
 * dropped and the remaining weights are renormalized.
 */
public enum HealthCategory {
    NODE("Node", 0.30),
    POD("Pod", 0.25),
    CONTROL_PLANE("Control plane", 0.25),
    NETWORK("Network", 0.10),
    RESOURCE_USAGE("Resource usage", 0.10);

    private final String displayName;
    private final double weight;

    HealthCategory(String displayName, double weight) {
        this.displayName = displayName;
        this.weight = weight;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getWeight() {
        return weight;
    }
}
