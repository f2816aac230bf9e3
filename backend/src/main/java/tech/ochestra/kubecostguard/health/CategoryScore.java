package tech.ochestra.kubecostguard.health;

import tech.ochestra.kubecostguard.domain.model.HealthCategory;

/**
 * Sub-score of one category. A null score marks the category as unknown;
 * it is then left out of the composite and the weights are renormalized.
 */
public record CategoryScore(
        HealthCategory category,
        Double score,
        String unknownReason
) {
    public static CategoryScore known(HealthCategory category, double score) {
        return new CategoryScore(category, score, null);
    }

    public static CategoryScore unknown(HealthCategory category, String reason) {
        return new CategoryScore(category, null, reason);
    }

    public boolean isKnown() {
        return score != null;
    }
}
