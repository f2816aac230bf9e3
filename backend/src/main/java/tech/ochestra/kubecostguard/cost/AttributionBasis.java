package tech.ochestra.kubecostguard.cost;

/**
 * What a pod's share of its node's cost was derived from.
 */
public enum AttributionBasis {
    /** Declared container requests. */
    REQUESTS,
    /** Observed usage, because the pod declares no requests. */
    USAGE,
    /** No co-resident pod declared requests or reported usage; the node cost is split evenly. */
    EQUAL_SPLIT,
    /** The pod has neither requests nor usage while its neighbours do, so it carries no share. */
    NO_SIGNAL
}
