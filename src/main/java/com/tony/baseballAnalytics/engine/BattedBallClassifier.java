package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.AtBatEvent;
import com.tony.baseballAnalytics.model.BattedBallType;
import com.tony.baseballAnalytics.model.PitchEvent;

import java.util.Map;
import java.util.Set;

/**
 * Classe une présence au bâton en GB / FB / LD, ou {@link BattedBallType#UNCLASSIFIED}.
 *
 * <p>Ordre d'évaluation :
 * <ol>
 *   <li>coup de circuit → FB, toujours</li>
 *   <li>trajectoire du dernier lancer si présente</li>
 *   <li>libellé du résultat pour les retraits (groundout, flyout, lineout...)</li>
 * </ol>
 * Les coups sûrs sans trajectoire restent non classés : les taux GB/FB/LD
 * et HR/FB ne portent que sur le sous-ensemble classable.
 */
public final class BattedBallClassifier {

    static final Set<String> GROUNDBALL_RESULTS = Set.of(
            "Groundout", "Bunt Groundout", "Grounded Into DP", "Forceout",
            "Fielders Choice", "Fielders Choice Out", "Double Play");

    static final Set<String> FLYBALL_RESULTS = Set.of(
            "Flyout", "Pop Out", "Bunt Pop Out", "Sac Fly", "Sac Fly Double Play");

    static final Set<String> LINEDRIVE_RESULTS = Set.of("Lineout", "Bunt Lineout");

    private static final Map<String, BattedBallType> TRAJECTORIES = Map.of(
            "ground_ball", BattedBallType.GROUND_BALL,
            "bunt_grounder", BattedBallType.GROUND_BALL,
            "fly_ball", BattedBallType.FLY_BALL,
            "popup", BattedBallType.FLY_BALL,
            "bunt_popup", BattedBallType.FLY_BALL,
            "line_drive", BattedBallType.LINE_DRIVE,
            "bunt_line_drive", BattedBallType.LINE_DRIVE);

    private BattedBallClassifier() {}

    public static BattedBallType classify(AtBatEvent atBat) {
        if (atBat == null) return BattedBallType.UNCLASSIFIED;

        if (atBat.isHomeRun()) {
            return BattedBallType.FLY_BALL;
        }

        BattedBallType fromTrajectory = fromTrajectory(atBat.finalPitch());
        if (fromTrajectory.isClassified()) {
            return fromTrajectory;
        }

        return fromResult(atBat.getResult());
    }

    static BattedBallType fromTrajectory(PitchEvent finalPitch) {
        if (finalPitch == null || !finalPitch.hasTrajectory()) return BattedBallType.UNCLASSIFIED;
        return TRAJECTORIES.getOrDefault(finalPitch.trajectory().trim().toLowerCase(), BattedBallType.UNCLASSIFIED);
    }

    static BattedBallType fromResult(String result) {
        if (result == null || result.isBlank()) return BattedBallType.UNCLASSIFIED;
        if (GROUNDBALL_RESULTS.contains(result)) return BattedBallType.GROUND_BALL;
        if (FLYBALL_RESULTS.contains(result)) return BattedBallType.FLY_BALL;
        if (LINEDRIVE_RESULTS.contains(result)) return BattedBallType.LINE_DRIVE;
        return BattedBallType.UNCLASSIFIED;
    }
}
