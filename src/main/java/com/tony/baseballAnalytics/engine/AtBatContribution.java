package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.AtBatEvent;
import com.tony.baseballAnalytics.model.BattedBallType;
import com.tony.baseballAnalytics.model.Hand;
import com.tony.baseballAnalytics.model.PullDirection;

/**
 * Classification complète d'une présence au bâton pour un rôle donné.
 * Calculée une fois puis appliquée à chaque vue (total, niveau, match, split).
 */
public record AtBatContribution(BattedBallType battedBall,
                                boolean homeRun,
                                PullDirection direction,
                                DisciplineTally discipline,
                                boolean pitchLevel) {

    /**
     * @param batterHand main du frappeur pour la direction ; null pour un lanceur (pas de suivi Pull)
     */
    public static AtBatContribution of(AtBatEvent atBat, Hand batterHand, PullZone zone) {
        BattedBallType type = BattedBallClassifier.classify(atBat);
        boolean homeRun = type == BattedBallType.FLY_BALL && atBat.isHomeRun();
        PullDirection direction = PullDirectionClassifier.classify(atBat, batterHand, zone);
        DisciplineTally discipline = PitchDisciplineTallier.tally(atBat);
        boolean pitchLevel = !discipline.estimated() && discipline.pitches() > 0;
        return new AtBatContribution(type, homeRun, direction, discipline, pitchLevel);
    }
}
