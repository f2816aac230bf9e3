package tech.ochestra.kubecostguard.domain.snapshot;

/**
 * Result of a lightweight API server call made while capturing the snapshot.
 */
public record ApiServerProbe(boolean reachable, long latencyMillis) {

    public static ApiServerProbe healthy(long latencyMillis) {
        return new ApiServerProbe(true, latencyMillis);
    }

    public static ApiServerProbe unreachable() {
        return new ApiServerProbe(false, 0);
    }
}
