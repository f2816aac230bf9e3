package tech.ochestra.kubecostguard.cost;

import tech.ochestra.kubecostguard.domain.snapshot.ResourceKey;

/**
 * Share of a node's cost attributed to one resident pod.
 *
 * @param sharedHourlyCost storage, network and GPU cost, split by the pod's mean share
 */
public record PodCost(
        String namespace,
        String name,
        String nodeName,
        double cpuHourlyCost,
        double memoryHourlyCost,
        double sharedHourlyCost,
        double hourlyCost,
        double monthlyCost,
        AttributionBasis basis
) {
    public ResourceKey key() {
        return ResourceKey.of(namespace, name);
    }
}
