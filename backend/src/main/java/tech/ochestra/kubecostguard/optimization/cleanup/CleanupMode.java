package tech.ochestra.kubecostguard.optimization.cleanup;

public enum CleanupMode {
    /** Compute recommendations only. */
    DRY_RUN,
    /** Delete exactly the recommended resources. */
    APPLY
}
