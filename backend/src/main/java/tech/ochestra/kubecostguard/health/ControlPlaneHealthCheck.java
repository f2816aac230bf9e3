package tech.ochestra.kubecostguard.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.model.PodPhase;
import tech.ochestra.kubecostguard.domain.snapshot.ApiServerProbe;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.exception.HealthCheckException;

import java.util.List;

/**
 * API server responsiveness and kube-system component pods.
 *
 * SCORING:
 * 100 when the API server answers under the latency threshold and the
 * controller-manager, scheduler, etcd and CoreDNS pods are Running.
 * Otherwise 100 x healthy / 5, reduced by min(20, latency / 50) when the
 * API server is reachable but slow.
 *
 * A component with no pod in kube-system counts as healthy, since managed
 * control planes do not expose those pods.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ControlPlaneHealthCheck implements HealthCheck<ControlPlaneStatus> {

    static final int COMPONENT_COUNT = 5;
    static final double MAX_LATENCY_PENALTY = 20.0;
    static final double LATENCY_PENALTY_DIVISOR_MILLIS = 50.0;

    private final KubeCostGuardProperties properties;

    @Override
    public HealthCategory getCategory() {
        return HealthCategory.CONTROL_PLANE;
    }

    @Override
    public ControlPlaneStatus evaluate(ClusterSnapshot snapshot) {
        ApiServerProbe probe = snapshot.apiServerProbe();
        if (probe == null) {
            throw new HealthCheckException(getCategory(), "API server probe result is not available");
        }
        List<PodInfo> systemPods = snapshot.controlPlanePods();
        if (systemPods == null) {
            throw new HealthCheckException(getCategory(), "kube-system pods could not be listed");
        }

        long latencyThreshold = properties.getHealth().getApiLatencyThresholdMillis();
        boolean apiHealthy = probe.reachable() && probe.latencyMillis() < latencyThreshold;

        boolean controllerHealthy = componentRunning(systemPods, "kube-controller-manager");
        boolean schedulerHealthy = componentRunning(systemPods, "kube-scheduler");
        boolean etcdHealthy = componentRunning(systemPods, "etcd");
        boolean coreDnsHealthy = componentRunning(systemPods, "coredns");

        int healthy = 0;
        for (boolean component : new boolean[]{
                apiHealthy, controllerHealthy, schedulerHealthy, etcdHealthy, coreDnsHealthy}) {
            if (component) {
                healthy++;
            }
        }

        double score;
        if (healthy == COMPONENT_COUNT) {
            score = 100.0;
        } else {
            score = 100.0 * healthy / COMPONENT_COUNT;
            if (probe.reachable() && probe.latencyMillis() >= latencyThreshold) {
                score -= Math.min(MAX_LATENCY_PENALTY, probe.latencyMillis() / LATENCY_PENALTY_DIVISOR_MILLIS);
            }
            score = Math.max(0.0, score);
        }

        log.debug("Control plane check: {}/{} components healthy, api latency {}ms, score {}",
                healthy, COMPONENT_COUNT, probe.latencyMillis(), score);

        return new ControlPlaneStatus(
                probe.reachable(),
                apiHealthy,
                controllerHealthy,
                schedulerHealthy,
                etcdHealthy,
                coreDnsHealthy,
                probe.latencyMillis(),
                score
        );
    }

    private boolean componentRunning(List<PodInfo> systemPods, String nameFragment) {
        return systemPods.stream()
                .filter(pod -> pod.name() != null && pod.name().contains(nameFragment))
                .allMatch(pod -> pod.phase() == PodPhase.RUNNING);
    }
}
