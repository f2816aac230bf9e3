package tech.ochestra.kubecostguard.domain.model;

/**
 * Severity of a detected health issue, ordered from most to least urgent.
 */
public enum IssueSeverity {
    CRITICAL("critical"),
    WARNING("warning"),
    INFO("info");

    private final String label;

    IssueSeverity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
