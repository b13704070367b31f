package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.Hand;
import lombok.Getter;

/**
 * Paire de totaux vsL / vsR. Un seul niveau : un split ne porte jamais de sous-split.
 */
@Getter
public class HandSplits {

    public static final String VS_LEFT = "vsL";
    public static final String VS_RIGHT = "vsR";

    private final StatTotals vsLeft = new StatTotals();
    private final StatTotals vsRight = new StatTotals();

    /**
     * Totaux du split pour la main adverse, ou null (main inconnue, ambidextre).
     */
    StatTotals forHand(Hand opponentHand) {
        if (opponentHand == Hand.L) return vsLeft;
        if (opponentHand == Hand.R) return vsRight;
        return null;
    }

    void add(HandSplits other) {
        vsLeft.add(other.vsLeft);
        vsRight.add(other.vsRight);
    }
}
