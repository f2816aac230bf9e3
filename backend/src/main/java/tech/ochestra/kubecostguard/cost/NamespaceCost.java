package tech.ochestra.kubecostguard.cost;

/**
 * Sum of the attributed costs of a namespace's pods.
 */
public record NamespaceCost(String namespace, int podCount, double hourlyCost, double monthlyCost) {
}
