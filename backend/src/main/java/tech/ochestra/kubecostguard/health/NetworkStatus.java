package tech.ochestra.kubecostguard.health;

import java.util.List;

/**
 * @param networkPoliciesCount null when network policies could not be listed
 */
public record NetworkStatus(
        boolean cniHealthy,
        boolean dnsResolutionOk,
        boolean serviceEndpointsHealthy,
        boolean ingressHealthy,
        List<String> servicesWithoutEndpoints,
        List<String> unreadyIngressControllers,
        Integer networkPoliciesCount,
        double score
) implements CategoryStatus {
}
