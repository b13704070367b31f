package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.AtBatEvent;
import com.tony.baseballAnalytics.model.GameRecord;
import com.tony.baseballAnalytics.model.Hand;

import java.util.Collection;

/**
 * Parcourt une collection de matchs et alimente, pour chaque frappeur et chaque lanceur,
 * trois vues indépendantes : total, par niveau, par match.
 *
 * <p>Somme pure : l'ordre des matchs et des présences au bâton n'a aucun effet.
 * Chaque appel construit des accumulateurs neufs ; aucun état partagé entre appels.
 */
public class AdvancedStatsAggregator {

    public static final String DEFAULT_LEVEL = "MiLB";

    private final PullZone pullZone;
    private final String defaultLevel;

    public AdvancedStatsAggregator() {
        this(PullZone.DEFAULT, DEFAULT_LEVEL);
    }

    public AdvancedStatsAggregator(PullZone pullZone, String defaultLevel) {
        this.pullZone = pullZone;
        this.defaultLevel = defaultLevel;
    }

    public AggregationResult aggregate(Collection<GameRecord> games) {
        AggregationResult result = new AggregationResult(pullZone);
        if (games == null) return result;

        for (GameRecord game : games) {
            if (game == null || game.getAtBats() == null) continue;
            result.countGame();

            String level = (game.getLevel() == null || game.getLevel().isBlank()) ? defaultLevel : game.getLevel();
            String gameId = game.getGameId();

            for (AtBatEvent atBat : game.getAtBats()) {
                if (atBat == null) continue;
                Hand batterHand = atBat.getBatterHand();
                Hand pitcherHand = atBat.getPitcherHand();

                if (atBat.getBatterId() != null) {
                    // Frappeur : split indexé par la main du lanceur, direction suivie
                    AtBatContribution c = AtBatContribution.of(atBat, batterHand, pullZone);
                    result.getBatters().record(atBat.getBatterId(), level, gameId, c, pitcherHand);
                }

                if (atBat.getPitcherId() != null) {
                    // Lanceur : split indexé par la main du frappeur, pas de suivi Pull
                    AtBatContribution c = AtBatContribution.of(atBat, null, pullZone);
                    result.getPitchers().record(atBat.getPitcherId(), level, gameId, c, batterHand);
                }
            }
        }
        return result;
    }
}
