package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.Hand;
import com.tony.baseballAnalytics.model.PlayerAdvancedStats;
import com.tony.baseballAnalytics.model.RateStats;
import com.tony.baseballAnalytics.model.StatType;
import lombok.Getter;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Les trois vues d'un rôle (frappeurs ou lanceurs) : total, par niveau, par match.
 * Chaque vue possède ses propres accumulateurs, jamais partagés.
 */
@Getter
public class PlayerAggregates {

    private final StatType statType;
    private final PullZone pullZone;

    private final Map<String, PlayerAccumulator> overall = new HashMap<>();
    private final Map<String, Map<String, PlayerAccumulator>> byLevel = new HashMap<>();
    private final Map<String, Map<String, PlayerAccumulator>> perGame = new HashMap<>();

    public PlayerAggregates(StatType statType, PullZone pullZone) {
        this.statType = statType;
        this.pullZone = pullZone;
    }

    void record(String playerId, String level, String gameId, AtBatContribution contribution, Hand opponentHand) {
        overall.computeIfAbsent(playerId, id -> new PlayerAccumulator(pullZone))
                .add(contribution, opponentHand);
        byLevel.computeIfAbsent(playerId, id -> new HashMap<>())
                .computeIfAbsent(level, l -> new PlayerAccumulator(pullZone))
                .add(contribution, opponentHand);
        if (gameId != null) {
            perGame.computeIfAbsent(playerId, id -> new HashMap<>())
                    .computeIfAbsent(gameId, g -> new PlayerAccumulator(pullZone))
                    .add(contribution, opponentHand);
        }
    }

    /**
     * Somme des compteurs bruts (shards indépendants, ex: un par mois ou par worker).
     * Les seuils sont appliqués ensuite, une seule fois, sur les compteurs combinés.
     */
    void combine(PlayerAggregates other) {
        other.overall.forEach((id, acc) -> mergeInto(overall, id, acc));
        other.byLevel.forEach((id, levels) -> {
            Map<String, PlayerAccumulator> target = byLevel.computeIfAbsent(id, k -> new HashMap<>());
            levels.forEach((level, acc) -> mergeInto(target, level, acc));
        });
        other.perGame.forEach((id, games) -> {
            Map<String, PlayerAccumulator> target = perGame.computeIfAbsent(id, k -> new HashMap<>());
            games.forEach((game, acc) -> mergeInto(target, game, acc));
        });
    }

    private static void mergeInto(Map<String, PlayerAccumulator> target, String key, PlayerAccumulator acc) {
        PlayerAccumulator existing = target.get(key);
        if (existing == null) {
            target.put(key, acc.copy());
        } else {
            existing.merge(acc);
        }
    }

    public Map<String, RateStats> overallStats(StatsPolicy policy) {
        Map<String, RateStats> result = new TreeMap<>();
        overall.forEach((id, acc) -> result.put(id, acc.snapshot(statType.isBatter(), policy)));
        return result;
    }

    public Map<String, Map<String, RateStats>> levelStats(StatsPolicy policy) {
        return viewStats(byLevel, policy);
    }

    public Map<String, Map<String, RateStats>> perGameStats(StatsPolicy policy) {
        return viewStats(perGame, policy);
    }

    private Map<String, Map<String, RateStats>> viewStats(Map<String, Map<String, PlayerAccumulator>> view, StatsPolicy policy) {
        Map<String, Map<String, RateStats>> result = new TreeMap<>();
        view.forEach((id, byKey) -> {
            Map<String, RateStats> stats = new TreeMap<>();
            byKey.forEach((key, acc) -> stats.put(key, acc.snapshot(statType.isBatter(), policy)));
            result.put(id, stats);
        });
        return result;
    }

    /**
     * Assemble, pour chaque joueur, les stats prêtes à fusionner.
     *
     * @param policy        seuils du total, des splits et des niveaux
     * @param perGamePolicy seuils (relâchés) des stats par match
     */
    public Map<String, PlayerAdvancedStats> toAdvancedStats(StatsPolicy policy, StatsPolicy perGamePolicy) {
        boolean isBatter = statType.isBatter();
        Map<String, Map<String, RateStats>> levels = levelStats(policy);
        Map<String, Map<String, RateStats>> games = perGameStats(perGamePolicy);

        Map<String, PlayerAdvancedStats> result = new LinkedHashMap<>();
        new TreeMap<>(overall).forEach((id, acc) -> result.put(id, PlayerAdvancedStats.builder()
                .playerId(id)
                .statType(statType)
                .overall(acc.snapshot(isBatter, policy))
                .splits(acc.splitSnapshot(isBatter, policy))
                .byLevel(levels.getOrDefault(id, Map.of()))
                .perGame(games.getOrDefault(id, Map.of()))
                .build()));
        return result;
    }

    public boolean isEmpty() {
        return overall.isEmpty();
    }
}
