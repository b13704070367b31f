package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.AtBatEvent;
import com.tony.baseballAnalytics.model.BattedBallType;
import com.tony.baseballAnalytics.model.Hand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class BattedBallClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "ground_ball, GROUND_BALL",
            "fly_ball, FLY_BALL",
            "popup, FLY_BALL",
            "line_drive, LINE_DRIVE",
            "bunt_grounder, GROUND_BALL"
    })
    void trajectoryOnFinalPitchWins(String trajectory, BattedBallType expected) {
        // Un "Single" n'est pas classable par libellé : seule la trajectoire décide
        AtBatEvent atBat = AtBats.inPlay("Single", "single", trajectory, 125.0, Hand.R);

        assertThat(BattedBallClassifier.classify(atBat)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "Groundout, GROUND_BALL",
            "Grounded Into DP, GROUND_BALL",
            "Fielders Choice Out, GROUND_BALL",
            "Flyout, FLY_BALL",
            "Pop Out, FLY_BALL",
            "Sac Fly, FLY_BALL",
            "Lineout, LINE_DRIVE"
    })
    void outLabelsAreUsedWithoutTrajectory(String result, BattedBallType expected) {
        AtBatEvent atBat = AtBats.base("1", "2").eventType("field_out").result(result).build();

        assertThat(BattedBallClassifier.classify(atBat)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Un coup de circuit est toujours une flyball, même avec une autre trajectoire")
    void homeRunIsAlwaysFlyBall() {
        AtBatEvent withLineDrive = AtBats.inPlay("Home Run", "home_run", "line_drive", 160.0, Hand.R);
        AtBatEvent legacy = AtBats.base("1", "2").eventType("home_run").result("Home Run").build();

        assertThat(BattedBallClassifier.classify(withLineDrive)).isEqualTo(BattedBallType.FLY_BALL);
        assertThat(BattedBallClassifier.classify(legacy)).isEqualTo(BattedBallType.FLY_BALL);
    }

    @Test
    void hitsWithoutTrajectoryAreUnclassified() {
        assertThat(BattedBallClassifier.classify(AtBats.single())).isEqualTo(BattedBallType.UNCLASSIFIED);
        AtBatEvent dbl = AtBats.base("1", "2").eventType("double").result("Double").build();
        assertThat(BattedBallClassifier.classify(dbl)).isEqualTo(BattedBallType.UNCLASSIFIED);
    }

    @Test
    void strikeoutsAndEmptyResultsAreUnclassified() {
        assertThat(BattedBallClassifier.classify(AtBats.strikeout())).isEqualTo(BattedBallType.UNCLASSIFIED);
        assertThat(BattedBallClassifier.classify(AtBats.base("1", "2").build())).isEqualTo(BattedBallType.UNCLASSIFIED);
        assertThat(BattedBallClassifier.classify(null)).isEqualTo(BattedBallType.UNCLASSIFIED);
    }

    @Test
    void unknownTrajectoryFallsBackToResultLabel() {
        AtBatEvent atBat = AtBats.inPlay("Groundout", "field_out", "something_new", null, Hand.L);

        assertThat(BattedBallClassifier.classify(atBat)).isEqualTo(BattedBallType.GROUND_BALL);
    }
}
