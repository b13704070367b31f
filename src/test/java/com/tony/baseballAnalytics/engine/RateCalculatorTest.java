package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.Hand;
import com.tony.baseballAnalytics.model.RateStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RateCalculatorTest {

    private static PlayerAccumulator withGroundouts(int count) {
        PlayerAccumulator acc = new PlayerAccumulator();
        for (int i = 0; i < count; i++) acc.addAtBat(AtBats.groundout(), Hand.R, Hand.R);
        return acc;
    }

    @Test
    @DisplayName("Seuil BIP : 9 balles en jeu -> pas de profil, 10 -> profil publié")
    void battedBallProfileIsGatedOnMinBip() {
        RateStats below = RateCalculator.getStats(withGroundouts(9), true, StatsPolicy.DEFAULTS);
        RateStats atThreshold = RateCalculator.getStats(withGroundouts(10), true, StatsPolicy.DEFAULTS);

        assertThat(below.has(RateStats.GB_PCT)).isFalse();
        assertThat(below.get(RateStats.BIP)).isEqualTo(9);
        assertThat(atThreshold.getRate(RateStats.GB_PCT)).isEqualTo(1.0);
        assertThat(atThreshold.getRate(RateStats.FB_PCT)).isEqualTo(0.0);
    }

    @Test
    void emptyTotalsOnlyReportZeroBip() {
        RateStats stats = RateCalculator.getStats(new StatTotals(), true, StatsPolicy.DEFAULTS);

        assertThat(stats.asMap()).containsOnlyKeys(RateStats.BIP);
        assertThat(stats.get(RateStats.BIP)).isEqualTo(0);
    }

    @Test
    void hrPerFlyBallNeedsAtLeastOneFlyBall() {
        RateStats stats = RateCalculator.getStats(withGroundouts(12), true, StatsPolicy.DEFAULTS);

        assertThat(stats.has(RateStats.GB_PCT)).isTrue();
        assertThat(stats.has(RateStats.HR_PER_FB)).isFalse();
    }

    @Test
    void profileRatesSumToOne() {
        PlayerAccumulator acc = new PlayerAccumulator();
        for (int i = 0; i < 5; i++) acc.addAtBat(AtBats.groundout(), Hand.R, Hand.R);
        for (int i = 0; i < 4; i++) acc.addAtBat(AtBats.flyout(), Hand.R, Hand.R);
        for (int i = 0; i < 2; i++) acc.addAtBat(AtBats.lineout(), Hand.R, Hand.R);

        RateStats stats = RateCalculator.getStats(acc, true, StatsPolicy.DEFAULTS);
        double sum = stats.getRate(RateStats.GB_PCT) + stats.getRate(RateStats.FB_PCT) + stats.getRate(RateStats.LD_PCT);

        assertThat(sum).isCloseTo(1.0, within(0.002));
        assertThat(stats.getRate(RateStats.GB_PCT)).isEqualTo(0.455);
    }

    @Test
    @DisplayName("Pas de Pull% pour un lanceur, même avec des directions connues")
    void pitchersNeverReportPull() {
        PlayerAccumulator acc = new PlayerAccumulator();
        for (int i = 0; i < 12; i++) {
            acc.addAtBat(AtBats.inPlay("Flyout", "field_out", "fly_ball", 170.0, Hand.R), Hand.R, Hand.R);
        }

        assertThat(RateCalculator.getStats(acc, true, StatsPolicy.DEFAULTS).has(RateStats.PULL_PCT)).isTrue();
        assertThat(RateCalculator.getStats(acc, false, StatsPolicy.DEFAULTS).has(RateStats.PULL_PCT)).isFalse();
    }

    @Test
    void roundsToThreeDecimals() {
        assertThat(RateCalculator.rate(1, 3)).isEqualTo(0.333);
        assertThat(RateCalculator.rate(2, 3)).isEqualTo(0.667);
    }

    @Test
    void policyRejectsNonPositiveThresholds() {
        assertThatThrownBy(() -> new StatsPolicy(0, 50, 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
