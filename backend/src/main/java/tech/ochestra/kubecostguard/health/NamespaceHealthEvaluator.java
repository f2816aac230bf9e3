package tech.ochestra.kubecostguard.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.config.KubeCostGuardProperties;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceQuantities;
import tech.ochestra.kubecostguard.exception.HealthCheckException;
import tech.ochestra.kubecostguard.health.NamespaceHealth.NamespaceResourceUsage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-namespace health: the pod and resource-usage formulas applied to the
 * pods of each namespace, with usage measured against the pods' requests.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NamespaceHealthEvaluator {

    private final PodHealthCheck podHealthCheck;
    private final HealthScoreCalculator scoreCalculator;
    private final KubeCostGuardProperties properties;

    public Map<String, NamespaceHealth> evaluate(ClusterSnapshot snapshot) {
        if (snapshot.pods() == null) {
            throw new HealthCheckException(HealthCategory.POD, "Pod list is not available");
        }
        Map<String, List<PodInfo>> byNamespace = new TreeMap<>();
        for (PodInfo pod : snapshot.pods()) {
            byNamespace.computeIfAbsent(pod.namespace(), ns -> new ArrayList<>()).add(pod);
        }

        Map<String, NamespaceHealth> result = new TreeMap<>();
        byNamespace.forEach((namespace, pods) -> {
            PodHealthStatus podStatus = podHealthCheck.summarize(pods);
            NamespaceResourceUsage usage = resourceUsage(pods);
            int score = scoreCalculator.namespaceScore(podStatus.score(), usage == null ? null : usage.score());
            result.put(namespace, new NamespaceHealth(namespace, podStatus, usage, score));
        });

        log.debug("Evaluated health of {} namespaces", result.size());
        return Collections.unmodifiableMap(result);
    }

    private NamespaceResourceUsage resourceUsage(List<PodInfo> pods) {
        long cpuUsage = 0;
        long memoryUsage = 0;
        long cpuRequests = 0;
        long memoryRequests = 0;
        boolean anyUsage = false;

        for (PodInfo pod : pods) {
            ResourceQuantities usage = pod.usage();
            if (usage == null) {
                continue;
            }
            anyUsage = true;
            ResourceQuantities requests = pod.requests();
            if (usage.cpuMillis() != null) {
                cpuUsage += usage.cpuMillis();
                if (requests != null && requests.cpuMillis() != null) {
                    cpuRequests += requests.cpuMillis();
                }
            }
            if (usage.memoryBytes() != null) {
                memoryUsage += usage.memoryBytes();
                if (requests != null && requests.memoryBytes() != null) {
                    memoryRequests += requests.memoryBytes();
                }
            }
        }

        if (!anyUsage || (cpuRequests == 0 && memoryRequests == 0)) {
            return null;
        }

        Double cpuPercent = cpuRequests > 0 ? ResourceUsageCheck.percent(cpuUsage, cpuRequests) : null;
        Double memoryPercent = memoryRequests > 0 ? ResourceUsageCheck.percent(memoryUsage, memoryRequests) : null;
        double score = ResourceUsageCheck.usageScore(
                cpuPercent == null ? 0.0 : cpuPercent,
                memoryPercent == null ? 0.0 : memoryPercent,
                properties.getHealth().getResourceUsageThresholdPercent());

        return new NamespaceResourceUsage(cpuUsage, memoryUsage, cpuPercent, memoryPercent, score);
    }
}
