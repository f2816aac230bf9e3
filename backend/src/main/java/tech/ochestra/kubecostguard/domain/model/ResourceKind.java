package tech.ochestra.kubecostguard.domain.model;

/**
 * Kinds of cluster objects referenced by issues and recommendations.
 */
public enum ResourceKind {
    CLUSTER("Cluster"),
    NODE("Node"),
    POD("Pod"),
    NAMESPACE("Namespace"),
    SERVICE("Service"),
    DEPLOYMENT("Deployment"),
    CONFIG_MAP("ConfigMap"),
    CONTROL_PLANE("ControlPlane"),
    NETWORK("Network");

    private final String displayName;

    ResourceKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
