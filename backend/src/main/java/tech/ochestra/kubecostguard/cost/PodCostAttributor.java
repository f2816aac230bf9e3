package tech.ochestra.kubecostguard.cost;

import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.domain.model.PricedResource;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceQuantities;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Splits a node's cost across its resident pods.
 *
 * ATTRIBUTION:
 * - CPU cost by each pod's share of effective CPU (request, else usage)
 * - Memory cost by each pod's share of effective memory
 * - Storage, network and GPU cost by the pod's mean share over the dimensions with a non-zero total
 * - Even split when no pod declares requests or reports usage
 *
 * A dimension whose total is zero falls back to the mean share, so the pod
 * costs always add up to the node cost.
 */
@Component
public class PodCostAttributor {

    public List<PodCost> attribute(NodeCost node, List<PodInfo> pods) {
        if (pods.isEmpty()) {
            return List.of();
        }
        int n = pods.size();
        double[] cpu = effective(pods, ResourceQuantities::cpuMillis);
        double[] memory = effective(pods, ResourceQuantities::memoryBytes);
        double cpuTotal = sum(cpu);
        double memoryTotal = sum(memory);
        boolean equalSplit = cpuTotal == 0 && memoryTotal == 0;

        double cpuCost = node.hourlyCostOf(PricedResource.CPU);
        double memoryCost = node.hourlyCostOf(PricedResource.MEMORY);
        double sharedCost = node.hourlyCostOf(PricedResource.STORAGE)
                + node.hourlyCostOf(PricedResource.NETWORK)
                + node.gpuHourlyCost();

        List<PodCost> costs = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            PodInfo pod = pods.get(i);
            double meanShare = meanShare(cpu[i], cpuTotal, memory[i], memoryTotal, n);
            double cpuShare = cpuTotal > 0 ? cpu[i] / cpuTotal : meanShare;
            double memoryShare = memoryTotal > 0 ? memory[i] / memoryTotal : meanShare;

            double podCpu = cpuCost * cpuShare;
            double podMemory = memoryCost * memoryShare;
            double podShared = sharedCost * meanShare;
            double hourly = podCpu + podMemory + podShared;

            costs.add(new PodCost(
                    pod.namespace(),
                    pod.name(),
                    node.nodeName(),
                    podCpu,
                    podMemory,
                    podShared,
                    hourly,
                    hourly * CostAggregator.HOURS_PER_MONTH,
                    equalSplit ? AttributionBasis.EQUAL_SPLIT : basisOf(pod)
            ));
        }
        return costs;
    }

    private static double meanShare(double cpu, double cpuTotal, double memory, double memoryTotal, int podCount) {
        if (cpuTotal > 0 && memoryTotal > 0) {
            return (cpu / cpuTotal + memory / memoryTotal) / 2.0;
        }
        if (cpuTotal > 0) {
            return cpu / cpuTotal;
        }
        if (memoryTotal > 0) {
            return memory / memoryTotal;
        }
        return 1.0 / podCount;
    }

    /**
     * Per-pod amount: the declared request, else observed usage, else 0.
     */
    private static double[] effective(List<PodInfo> pods, Function<ResourceQuantities, Long> field) {
        double[] values = new double[pods.size()];
        for (int i = 0; i < pods.size(); i++) {
            Long value = amount(pods.get(i).requests(), field);
            if (value == null) {
                value = amount(pods.get(i).usage(), field);
            }
            values[i] = value == null ? 0.0 : Math.max(0L, value);
        }
        return values;
    }

    private static AttributionBasis basisOf(PodInfo pod) {
        if (hasAny(pod.requests())) {
            return AttributionBasis.REQUESTS;
        }
        if (hasAny(pod.usage())) {
            return AttributionBasis.USAGE;
        }
        return AttributionBasis.NO_SIGNAL;
    }

    private static boolean hasAny(ResourceQuantities quantities) {
        return quantities != null && (quantities.cpuMillis() != null || quantities.memoryBytes() != null);
    }

    private static Long amount(ResourceQuantities quantities, Function<ResourceQuantities, Long> field) {
        return quantities == null ? null : field.apply(quantities);
    }

    private static double sum(double[] values) {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total;
    }
}
