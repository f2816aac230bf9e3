package tech.ochestra.kubecostguard.domain.snapshot;

public record NetworkPolicyInfo(String namespace, String name) {
}
