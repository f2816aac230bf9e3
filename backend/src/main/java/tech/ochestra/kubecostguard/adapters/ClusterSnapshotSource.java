package tech.ochestra.kubecostguard.adapters;

import tech.ochestra.kubecostguard.domain.snapshot.ClusterSnapshot;

/**
 * Port interface for snapshot acquisition.
 *
 * Implementations read the cluster API and metrics API once and return an
 * immutable snapshot. Sections that could not be listed are left null.
 */
public interface ClusterSnapshotSource {

    /**
     * Capture the current cluster state.
     *
     * @throws tech.ochestra.kubecostguard.exception.SnapshotUnavailableException when
     *         the cluster cannot be reached at all
     */
    ClusterSnapshot capture();
}
