package tech.ochestra.kubecostguard.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.ochestra.kubecostguard.domain.model.HealthCategory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HealthScoreCalculatorTest {

    private final HealthScoreCalculator calculator = new HealthScoreCalculator();

    @Test
    @DisplayName("Should weight categories 30/25/25/10/10")
    void shouldApplyCategoryWeights() {
        List<CategoryScore> scores = List.of(
                CategoryScore.known(HealthCategory.NODE, 50),
                CategoryScore.known(HealthCategory.POD, 100),
                CategoryScore.known(HealthCategory.CONTROL_PLANE, 100),
                CategoryScore.known(HealthCategory.NETWORK, 0),
                CategoryScore.known(HealthCategory.RESOURCE_USAGE, 100));

        // 15 + 25 + 25 + 0 + 10
        assertThat(calculator.compositeScore(scores)).isEqualTo(75);
    }

    @Test
    @DisplayName("Should leave unknown categories out and renormalize")
    void shouldRenormalizeOverKnownCategories() {
        List<CategoryScore> scores = List.of(
                CategoryScore.known(HealthCategory.NODE, 100),
                CategoryScore.known(HealthCategory.POD, 40),
                CategoryScore.unknown(HealthCategory.CONTROL_PLANE, "probe failed"),
                CategoryScore.unknown(HealthCategory.NETWORK, "services not listed"),
                CategoryScore.unknown(HealthCategory.RESOURCE_USAGE, "no metrics"));

        // (0.30 x 100 + 0.25 x 40) / 0.55 = 72.7
        assertThat(calculator.compositeScore(scores)).isEqualTo(73);
    }

    @Test
    @DisplayName("Should score 0 when nothing is known")
    void shouldHandleNoKnownCategories() {
        assertThat(calculator.compositeScore(List.of(
                CategoryScore.unknown(HealthCategory.NETWORK, "n/a")))).isZero();
        assertThat(calculator.weightedMean(List.of())).isNull();
    }

    @Test
    @DisplayName("Should combine namespace pod and resource scores with their cluster weights")
    void shouldScoreNamespace() {
        // (0.25 x 80 + 0.10 x 45) / 0.35 = 70
        assertThat(calculator.namespaceScore(80, 45.0)).isEqualTo(70);
        assertThat(calculator.namespaceScore(80, null)).isEqualTo(80);
    }
}
