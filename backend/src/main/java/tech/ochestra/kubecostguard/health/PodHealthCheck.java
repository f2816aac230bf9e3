package tech.ochestra.kubecostguard.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.exception.SnapshotUnavailableException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pod phases, crash loops and restart counts.
 *
 * SCORING:
 * 100 x running / total, minus 2 per crash-looping pod and 1 per pod with a
 * container restarted more than the threshold, floored at 0. No pods scores 100.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PodHealthCheck implements HealthCheck<PodHealthStatus> {

    static final double CRASH_LOOP_PENALTY = 2.0;
    static final double RESTART_PENALTY = 1.0;

    private final KubeCostGuardProperties properties;

    @Override
    public HealthCategory getCategory() {
        return HealthCategory.POD;
    }

    @Override
    public PodHealthStatus evaluate(ClusterSnapshot snapshot) {
        if (snapshot.pods() == null) {
            throw new SnapshotUnavailableException("Pod list is not available in the snapshot");
        }
        PodHealthStatus status = summarize(snapshot.pods());
        log.debug("Pod check: {}/{} running, {} crash looping, score {}",
                status.runningPods(), status.totalPods(), status.crashLoopingPods().size(), status.score());
        return status;
    }

    /**
     * Summarize any set of pods. Also used for per-namespace health.
     */
    public PodHealthStatus summarize(Collection<PodInfo> pods) {
        int restartThreshold = properties.getHealth().getRestartThreshold();

        int running = 0;
        int pending = 0;
        int succeeded = 0;
        int failed = 0;
        int unknown = 0;
        Map<String, Integer> podsPerNode = new TreeMap<>();
        List<String> crashLooping = new ArrayList<>();
        List<String> restarting = new ArrayList<>();

        for (PodInfo pod : pods) {
            if (pod.nodeName() != null && !pod.nodeName().isEmpty()) {
                podsPerNode.merge(pod.nodeName(), 1, Integer::sum);
            }

            switch (pod.phase()) {
                case RUNNING -> running++;
                case PENDING -> pending++;
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                default -> unknown++;
            }

            if (pod.isCrashLooping()) {
                crashLooping.add(pod.key().toString());
            }
            if (pod.maxRestartCount() > restartThreshold) {
                restarting.add(pod.key().toString());
            }
        }

        crashLooping.sort(String::compareTo);
        restarting.sort(String::compareTo);

        return new PodHealthStatus(
                pods.size(),
                running,
                pending,
                succeeded,
                failed,
                unknown,
                podsPerNode,
                List.copyOf(crashLooping),
                List.copyOf(restarting),
                score(pods.size(), running, crashLooping.size(), restarting.size())
        );
    }

    static double score(int total, int running, int crashLooping, int restarting) {
        if (total == 0) {
            return 100.0;
        }
        double score = 100.0 * running / total
                - CRASH_LOOP_PENALTY * crashLooping
                - RESTART_PENALTY * restarting;
        return Math.max(0.0, score);
    }
}
