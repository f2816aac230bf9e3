package tech.ochestra.kubecostguard.domain.model;

/**
 * Pod lifecycle phase as reported by the kubelet.
 */
public enum PodPhase {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    UNKNOWN;

    /**
     * Terminal pods no longer hold node resources.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public String toApiValue() {
        return name().charAt(0) + name().substring(1).toLowerCase();
    }
}
