package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.AtBatEvent;
import com.tony.baseballAnalytics.model.Hand;
import com.tony.baseballAnalytics.model.RateStats;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulateur d'un joueur sur un périmètre d'agrégation : un {@link StatTotals}
 * et, à côté, la paire de splits par main adverse.
 *
 * <p>Créé vide, alimenté par {@link #addAtBat}, lu une fois par le calcul des taux.
 */
@Getter
public class PlayerAccumulator {

    private final PullZone pullZone;
    private final StatTotals totals = new StatTotals();
    private final HandSplits splits = new HandSplits();

    public PlayerAccumulator() {
        this(PullZone.DEFAULT);
    }

    public PlayerAccumulator(PullZone pullZone) {
        this.pullZone = pullZone;
    }

    /**
     * @param opponentHand main de l'adversaire (L/R alimente le split correspondant)
     * @param batterHand   main du frappeur pour la direction ; null désactive le suivi Pull
     */
    public void addAtBat(AtBatEvent atBat, Hand opponentHand, Hand batterHand) {
        if (atBat == null) return;
        add(AtBatContribution.of(atBat, batterHand, pullZone), opponentHand);
    }

    void add(AtBatContribution contribution, Hand opponentHand) {
        totals.record(contribution);
        StatTotals split = splits.forHand(opponentHand);
        if (split != null) {
            split.record(contribution);
        }
    }

    /**
     * Combine les compteurs d'un autre accumulateur (ex: résultats de deux shards).
     */
    public void merge(PlayerAccumulator other) {
        totals.add(other.totals);
        splits.add(other.splits);
    }

    PlayerAccumulator copy() {
        PlayerAccumulator copy = new PlayerAccumulator(pullZone);
        copy.merge(this);
        return copy;
    }

    public RateStats snapshot(boolean isBatter, StatsPolicy policy) {
        return RateCalculator.getStats(totals, isBatter, policy);
    }

    /**
     * Stats vsL / vsR ; un split sans aucune présence au bâton est omis.
     */
    public Map<String, RateStats> splitSnapshot(boolean isBatter, StatsPolicy policy) {
        Map<String, RateStats> result = new LinkedHashMap<>();
        if (!splits.getVsLeft().isEmpty()) {
            result.put(HandSplits.VS_LEFT, RateCalculator.getStats(splits.getVsLeft(), isBatter, policy));
        }
        if (!splits.getVsRight().isEmpty()) {
            result.put(HandSplits.VS_RIGHT, RateCalculator.getStats(splits.getVsRight(), isBatter, policy));
        }
        return result;
    }
}
