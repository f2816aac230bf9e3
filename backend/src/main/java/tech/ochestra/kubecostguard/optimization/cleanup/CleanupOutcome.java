package tech.ochestra.kubecostguard.optimization.cleanup;

/**
 * What happened to one recommendation in apply mode.
 */
public enum CleanupOutcome {
    DELETED,
    FAILED,
    /** Not attempted because the run was cancelled first. */
    SKIPPED_CANCELLED
}
