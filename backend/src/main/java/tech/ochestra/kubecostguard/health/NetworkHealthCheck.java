package tech.ochestra.kubecostguard.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.model.PodPhase;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;
import tech.ochestra.kubecostguard.domain.snapshot.DeploymentInfo;
import tech.ochestra.kubecostguard.domain.snapshot.EndpointsInfo;
import tech.ochestra.kubecostguard.domain.snapshot.PodInfo;
import tech.ochestra.kubecostguard.domain.snapshot.ResourceKey;
import tech.ochestra.kubecostguard.domain.snapshot.ServiceInfo;
import tech.ochestra.kubecostguard.exception.HealthCheckException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * CNI, DNS, service endpoints and ingress controller readiness.
 *
 * SCORING:
 * 100 x passing / 4. A component with no pods or deployments present passes.
 */
@Component
@Slf4j
public class NetworkHealthCheck implements HealthCheck<NetworkStatus> {

    static final int CHECK_COUNT = 4;
    static final String K8S_APP_LABEL = "k8s-app";
    static final String APP_LABEL = "app";
    static final Set<String> CNI_APPS = Set.of("calico-node", "flannel", "weave-net", "cilium");
    static final String DNS_APP = "kube-dns";
    static final Set<String> INGRESS_APPS = Set.of("ingress-nginx", "traefik", "istio-ingressgateway");

    @Override
    public HealthCategory getCategory() {
        return HealthCategory.NETWORK;
    }

    @Override
    public NetworkStatus evaluate(ClusterSnapshot snapshot) {
        List<PodInfo> systemPods = require(snapshot.controlPlanePods(), "kube-system pods");
        List<ServiceInfo> services = require(snapshot.services(), "services");
        List<EndpointsInfo> endpoints = require(snapshot.endpoints(), "endpoints");
        List<DeploymentInfo> deployments = require(snapshot.ingressControllers(), "ingress controller deployments");

        boolean cniHealthy = allRunning(systemPods, pod -> hasLabelIn(pod.labels(), K8S_APP_LABEL, CNI_APPS));
        boolean dnsOk = allRunning(systemPods, pod -> pod.labels() != null && DNS_APP.equals(pod.labels().get(K8S_APP_LABEL)));

        Map<ResourceKey, EndpointsInfo> endpointsByKey = endpoints.stream()
                .collect(Collectors.toMap(EndpointsInfo::key, Function.identity(), (a, b) -> a));
        List<String> withoutEndpoints = new ArrayList<>();
        for (ServiceInfo service : services) {
            if (!service.hasSelector()) {
                continue;
            }
            EndpointsInfo ep = endpointsByKey.get(service.key());
            if (ep == null || ep.subsetCount() == 0) {
                withoutEndpoints.add(service.key().toString());
            }
        }
        withoutEndpoints.sort(String::compareTo);

        List<String> unreadyIngress = deployments.stream()
                .filter(d -> hasLabelIn(d.labels(), APP_LABEL, INGRESS_APPS))
                .filter(d -> !d.isFullyReady())
                .map(d -> ResourceKey.of(d.namespace(), d.name()).toString())
                .sorted()
                .toList();

        Integer policyCount = snapshot.networkPolicies() == null ? null : snapshot.networkPolicies().size();

        boolean endpointsHealthy = withoutEndpoints.isEmpty();
        boolean ingressHealthy = unreadyIngress.isEmpty();
        int passing = 0;
        for (boolean check : new boolean[]{cniHealthy, dnsOk, endpointsHealthy, ingressHealthy}) {
            if (check) {
                passing++;
            }
        }
        double score = 100.0 * passing / CHECK_COUNT;

        log.debug("Network check: cni={} dns={} endpoints={} ingress={}, score {}",
                cniHealthy, dnsOk, endpointsHealthy, ingressHealthy, score);

        return new NetworkStatus(
                cniHealthy,
                dnsOk,
                endpointsHealthy,
                ingressHealthy,
                List.copyOf(withoutEndpoints),
                unreadyIngress,
                policyCount,
                score
        );
    }

    private boolean allRunning(List<PodInfo> pods, Predicate<PodInfo> selector) {
        return pods.stream()
                .filter(selector)
                .allMatch(pod -> pod.phase() == PodPhase.RUNNING);
    }

    // Set.of(...) rejects null lookups
    private static boolean hasLabelIn(Map<String, String> labels, String key, Set<String> values) {
        String value = labels == null ? null : labels.get(key);
        return value != null && values.contains(value);
    }

    private <T> List<T> require(List<T> section, String description) {
        if (section == null) {
            throw new HealthCheckException(getCategory(), "Snapshot does not contain " + description);
        }
        return section;
    }
}
