package com.tony.baseballAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Ensemble des vues calculées pour un joueur et un rôle : total, splits vsL/vsR,
 * par niveau et par match.
 */
@Value
@Builder
public class PlayerAdvancedStats {
    String playerId;
    StatType statType;
    RateStats overall;

    @Builder.Default
    Map<String, RateStats> splits = Map.of();

    @Builder.Default
    Map<String, RateStats> byLevel = Map.of();

    @Builder.Default
    Map<String, RateStats> perGame = Map.of();
}
