package dev.jobmatcher.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoreBreakdownTest {

    @Test
    @DisplayName("Should weight sub-scores 30/25/15/15/15")
    void shouldWeightSubScores() {
        ScoreBreakdown breakdown = new ScoreBreakdown(100, 80, 60, 40, 20);

        assertThat(breakdown.overall()).isCloseTo(30 + 20 + 9 + 6 + 3, within(1e-9));
    }

    @Test
    @DisplayName("Should derive the ranked score from the breakdown")
    void shouldDeriveRankedScore() {
        RankedJob ranked = new RankedJob("job-1", new ScoreBreakdown(100, 100, 100, 100, 100), "fits");

        assertThat(ranked.score()).isCloseTo(100, within(1e-9));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 100.1, Double.NaN})
    @DisplayName("Should reject sub-scores outside 0..100")
    void shouldRejectOutOfRange(double value) {
        assertThatThrownBy(() -> new ScoreBreakdown(50, 50, value, 50, 50))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("client_quality");
    }
}
