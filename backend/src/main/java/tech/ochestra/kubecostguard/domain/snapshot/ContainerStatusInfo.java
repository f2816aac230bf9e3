package tech.ochestra.kubecostguard.domain.snapshot;

/**
 * Restart count and current waiting reason of one container.
 */
public record ContainerStatusInfo(
        String name,
        int restartCount,
        String waitingReason
) {
    public static final String CRASH_LOOP_BACK_OFF = "CrashLoopBackOff";

    public boolean isCrashLooping() {
        return CRASH_LOOP_BACK_OFF.equals(waitingReason);
    }
}
