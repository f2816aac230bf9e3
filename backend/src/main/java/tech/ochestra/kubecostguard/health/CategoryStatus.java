package tech.ochestra.kubecostguard.health;

/**
 * Result of one health category check carrying its 0-100 sub-score.
 */
public interface CategoryStatus {

    double score();
}
