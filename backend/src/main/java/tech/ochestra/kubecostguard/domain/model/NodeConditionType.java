package tech.ochestra.kubecostguard.domain.model;

/**
 * Node conditions evaluated by the health checks.
 *
 * Every condition except READY signals a problem when true.
 */
public enum NodeConditionType {
    READY("Ready"),
    MEMORY_PRESSURE("MemoryPressure"),
    DISK_PRESSURE("DiskPressure"),
    PID_PRESSURE("PIDPressure"),
    NETWORK_UNAVAILABLE("NetworkUnavailable");

    private final String apiName;

    NodeConditionType(String apiName) {
        this.apiName = apiName;
    }

    public String getApiName() {
        return apiName;
    }

    public boolean isPressure() {
        return this != READY;
    }
}
