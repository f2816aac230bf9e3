package tech.ochestra.kubecostguard.health;

import java.util.List;
import java.util.Map;

/**
 * Pod phase counts and restart signals for a set of pods.
 *
 * @param crashLoopingPods  {@code namespace/name} of pods with a container in CrashLoopBackOff
 * @param restartingPods    {@code namespace/name} of pods with a container above the restart threshold
 */
public record PodHealthStatus(
        int totalPods,
        int runningPods,
        int pendingPods,
        int succeededPods,
        int failedPods,
        int unknownPods,
        Map<String, Integer> podsPerNode,
        List<String> crashLoopingPods,
        List<String> restartingPods,
        double score
) implements CategoryStatus {

    public int notRunningPods() {
        return totalPods - runningPods;
    }
}
