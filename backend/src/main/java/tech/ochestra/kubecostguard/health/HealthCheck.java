package tech.ochestra.kubecostguard.health;

import tech.ochestra.kubecostguard.domain.model.HealthCategory;
import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;

/**
 * One independent health sub-check.
 *
 * Each implementation reads only the snapshot and returns a fresh status,
 * so checks can run concurrently without coordination.
 *
 * @param <S> status type produced by the check
 */
public interface HealthCheck<S extends CategoryStatus> {

    /**
     * Returns the category this check scores.
     */
    HealthCategory getCategory();

    /**
     * Evaluate the category against the snapshot.
     *
     * @throws tech.ochestra.kubecostguard.exception.HealthCheckException when the
     *         inputs this check needs are missing from the snapshot
     */
    S evaluate(ClusterSnapshot snapshot);
}
