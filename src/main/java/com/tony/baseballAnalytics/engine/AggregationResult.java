package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.StatType;
import lombok.Getter;

@Getter
public class AggregationResult {

    private final PlayerAggregates batters;
    private final PlayerAggregates pitchers;
    private int gamesProcessed;

    AggregationResult(PullZone pullZone) {
        this.batters = new PlayerAggregates(StatType.BATTING, pullZone);
        this.pitchers = new PlayerAggregates(StatType.PITCHING, pullZone);
    }

    void countGame() {
        gamesProcessed++;
    }

    /**
     * Ajoute les compteurs d'une autre agrégation (shard) à celle-ci.
     */
    public AggregationResult combine(AggregationResult other) {
        batters.combine(other.batters);
        pitchers.combine(other.pitchers);
        gamesProcessed += other.gamesProcessed;
        return this;
    }
}
