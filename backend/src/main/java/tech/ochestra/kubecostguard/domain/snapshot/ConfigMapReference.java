package tech.ochestra.kubecostguard.domain.snapshot;

/**
 * A pod's reference to a ConfigMap in its own namespace.
 */
public record ConfigMapReference(String name, Source source) {

    public enum Source {
        VOLUME,
        PROJECTED_VOLUME,
        ENV,
        ENV_FROM
    }

    public static ConfigMapReference volume(String name) {
        return new ConfigMapReference(name, Source.VOLUME);
    }

    public static ConfigMapReference env(String name) {
        return new ConfigMapReference(name, Source.ENV);
    }
}
