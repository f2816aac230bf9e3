package tech.ochestra.kubecostguard.health;

import org.springframework.stereotype.Component;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Combines category sub-scores into a composite 0-100 score.
 *
 * Unknown categories are left out and the weights of the remaining ones are
 * renormalized so they still sum to 1. The result is rounded half-up and
 * clamped to [0, 100].
 */
@Component
public class HealthScoreCalculator {

    public int compositeScore(Collection<CategoryScore> scores) {
        Double weighted = weightedMean(scores);
        if (weighted == null) {
            return 0;
        }
        return clamp((int) Math.round(weighted));
    }

    /**
     * Weighted mean of the known scores, or null when none is known.
     */
    public Double weightedMean(Collection<CategoryScore> scores) {
        double weightSum = 0;
        double weightedSum = 0;
        for (CategoryScore score : scores) {
            if (!score.isKnown()) {
                continue;
            }
            double weight = score.category().getWeight();
            weightSum += weight;
            weightedSum += weight * score.score();
        }
        if (weightSum == 0) {
            return null;
        }
        return weightedSum / weightSum;
    }

    /**
     * Namespace score: the pod and resource-usage formulas scoped to one namespace,
     * combined with their cluster weights.
     */
    public int namespaceScore(double podScore, Double resourceScore) {
        List<CategoryScore> scores = new ArrayList<>();
        scores.add(CategoryScore.known(HealthCategory.POD, podScore));
        if (resourceScore != null) {
            scores.add(CategoryScore.known(HealthCategory.RESOURCE_USAGE, resourceScore));
        }
        return compositeScore(scores);
    }

    private int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
