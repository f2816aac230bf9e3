package tech.ochestra.kubecostguard.optimization.cleanup;

import java.util.List;

/**
 * Result of one cleanup run.
 *
 * In dry-run mode {@code items} is empty. In apply mode there is one item per
 * recommendation, in the same order. A run with failed or skipped items is
 * still a completed run and reports {@code partial = true}.
 */
public record CleanupResult(
        CleanupMode mode,
        List<CleanupRecommendation> recommendations,
        List<Item> items,
        boolean partial
) {
    public record Item(CleanupRecommendation recommendation, CleanupOutcome outcome, String error) {}

    public static CleanupResult dryRun(List<CleanupRecommendation> recommendations) {
        return new CleanupResult(CleanupMode.DRY_RUN, List.copyOf(recommendations), List.of(), false);
    }

    public long count(CleanupOutcome outcome) {
        return items.stream().filter(item -> item.outcome() == outcome).count();
    }
}
