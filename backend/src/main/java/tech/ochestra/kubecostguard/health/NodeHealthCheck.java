package tech.ochestra.kubecostguard.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.model.NodeConditionType;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.NodeInfo;
import tech.ochestra.kubecostguard.exception.SnapshotUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Node readiness and pressure conditions.
 *
 * SCORING:
 * 100 x ready / total, minus 5 points per node carrying any pressure
 * condition, floored at 0. An empty node list scores 100.
 */
@Component
@Slf4j
public class NodeHealthCheck implements HealthCheck<NodeHealthStatus> {

    static final double PRESSURE_PENALTY = 5.0;

    @Override
    public HealthCategory getCategory() {
        return HealthCategory.NODE;
    }

    @Override
    public NodeHealthStatus evaluate(ClusterSnapshot snapshot) {
        List<NodeInfo> nodes = snapshot.nodes();
        if (nodes == null) {
            throw new SnapshotUnavailableException("Node list is not available in the snapshot");
        }

        int ready = 0;
        int memoryPressure = 0;
        int diskPressure = 0;
        int pidPressure = 0;
        int networkUnavailable = 0;
        List<String> notReady = new ArrayList<>();
        Map<String, List<String>> pressured = new TreeMap<>();
        Map<String, List<String>> conditions = new TreeMap<>();

        for (NodeInfo node : nodes) {
            conditions.put(node.name(), node.conditions().stream()
                    .sorted()
                    .map(NodeConditionType::getApiName)
                    .toList());

            if (node.isReady()) {
                ready++;
            } else {
                notReady.add(node.name());
            }

            Set<NodeConditionType> pressure = node.pressureConditions();
            if (pressure.isEmpty()) {
                continue;
            }
            pressured.put(node.name(), pressure.stream()
                    .sorted()
                    .map(NodeConditionType::getApiName)
                    .toList());

            for (NodeConditionType condition : pressure) {
                switch (condition) {
                    case MEMORY_PRESSURE -> memoryPressure++;
                    case DISK_PRESSURE -> diskPressure++;
                    case PID_PRESSURE -> pidPressure++;
                    case NETWORK_UNAVAILABLE -> networkUnavailable++;
                    default -> {}
                }
            }
        }

        notReady.sort(String::compareTo);
        double score = score(nodes.size(), ready, pressured.size());

        log.debug("Node check: {}/{} ready, {} under pressure, score {}",
                ready, nodes.size(), pressured.size(), score);

        return new NodeHealthStatus(
                nodes.size(),
                ready,
                memoryPressure,
                diskPressure,
                pidPressure,
                networkUnavailable,
                List.copyOf(notReady),
                pressured,
                conditions,
                score
        );
    }

    static double score(int total, int ready, int pressuredNodes) {
        if (total == 0) {
            return 100.0;
        }
        double score = 100.0 * ready / total - PRESSURE_PENALTY * pressuredNodes;
        return Math.max(0.0, score);
    }
}
