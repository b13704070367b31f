package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.AtBatEvent;
import com.tony.baseballAnalytics.model.Hand;
import com.tony.baseballAnalytics.model.PitchEvent;
import com.tony.baseballAnalytics.model.PullDirection;

/**
 * Direction d'une balle en jeu à partir de la coordonnée horizontale de frappe.
 *
 * <p>Droitier : tirée si {@code coordX > centerRight}. Gaucher : tirée si
 * {@code coordX < centerLeft}. La bande centrale est toujours inconnue.
 */
public final class PullDirectionClassifier {

    private PullDirectionClassifier() {}

    public static PullDirection classify(AtBatEvent atBat, Hand batterHand, PullZone zone) {
        if (atBat == null || !atBat.isBallInPlay()) return PullDirection.UNKNOWN;
        PitchEvent finalPitch = atBat.finalPitch();
        return classify(finalPitch == null ? null : finalPitch.coordX(), batterHand, zone);
    }

    public static PullDirection classify(Double coordX, Hand batterHand, PullZone zone) {
        if (coordX == null || coordX.isNaN()) return PullDirection.UNKNOWN;
        if (batterHand == null || !batterHand.isSingleSided()) return PullDirection.UNKNOWN;
        if (zone.isCenter(coordX)) return PullDirection.UNKNOWN;

        boolean pulled = batterHand == Hand.R
                ? coordX > zone.centerRight()
                : coordX < zone.centerLeft();
        return pulled ? PullDirection.PULL : PullDirection.NOT_PULL;
    }
}
