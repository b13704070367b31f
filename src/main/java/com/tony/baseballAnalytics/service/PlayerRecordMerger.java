package com.tony.baseballAnalytics.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tony.baseballAnalytics.engine.HandSplits;
import com.tony.baseballAnalytics.model.PlayerAdvancedStats;
import com.tony.baseballAnalytics.model.RateStats;
import com.tony.baseballAnalytics.model.StatType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Fusionne les stats avancées calculées dans un enregistrement joueur persisté.
 *
 * <p>Seules les clés de {@link RateStats#OWNED_KEYS} sont écrites ou supprimées :
 * les stats traditionnelles (AVG, HR, ERA...) et les champs des entrées de game log
 * appartiennent à un autre sous-système et ne sont jamais touchés.
 * Avant écriture, les anciennes clés avancées non reproduites sont retirées,
 * ce qui rend la fusion idempotente.
 */
@Service
public class PlayerRecordMerger {

    private static final List<String> SPLIT_KEYS = List.of(HandSplits.VS_LEFT, HandSplits.VS_RIGHT);

    public void apply(ObjectNode record, PlayerAdvancedStats stats) {
        updatePlayerRecord(record, stats.getOverall(), stats.getSplits(), stats.getStatType(), stats.getByLevel());
        injectPerGameStats(record, stats.getPerGame(), stats.getStatType());
    }

    /**
     * @param levelStats null pour ne pas toucher aux stats par niveau
     */
    public void updatePlayerRecord(ObjectNode record, RateStats stats, Map<String, RateStats> splits,
                                   StatType statType, Map<String, RateStats> levelStats) {
        // 1. Stats principales
        writeOwned(objectChild(record, statType.statsKey()), stats);

        // 2. Splits vsL / vsR (les autres splits : last7, yesterday... restent en place)
        Map<String, RateStats> freshSplits = splits == null ? Map.of() : splits;
        JsonNode existingSplits = record.get(statType.splitsKey());
        if (!freshSplits.isEmpty() || (existingSplits != null && existingSplits.isObject())) {
            ObjectNode splitsNode = objectChild(record, statType.splitsKey());
            for (String key : SPLIT_KEYS) {
                RateStats split = freshSplits.get(key);
                if (split != null && !split.isEmpty()) {
                    writeOwned(objectChild(splitsNode, key), split);
                } else {
                    cleanStale(splitsNode, key);
                }
            }
            if (splitsNode.isEmpty()) record.remove(statType.splitsKey());
        }

        // 3. Par niveau (AAA, AA, A+, A, CPX, MiLB)
        if (levelStats != null) {
            JsonNode existingLevels = record.get(statType.byLevelKey());
            if (levelStats.isEmpty() && (existingLevels == null || !existingLevels.isObject())) return;

            ObjectNode byLevelNode = objectChild(record, statType.byLevelKey());
            for (String level : fieldNames(byLevelNode)) {
                if (!levelStats.containsKey(level)) cleanStale(byLevelNode, level);
            }
            levelStats.forEach((level, levelRates) -> writeOwned(objectChild(byLevelNode, level), levelRates));
            if (byLevelNode.isEmpty()) record.remove(statType.byLevelKey());
        }
    }

    /**
     * Retire les clés avancées d'un type de stats pour un joueur absent du calcul :
     * stats principales, splits vsL / vsR et stats par niveau. Les sous-objets vidés
     * sont supprimés ; aucun nœud n'est créé.
     */
    public void clearAdvancedStats(ObjectNode record, StatType statType) {
        JsonNode stats = record.get(statType.statsKey());
        if (stats != null && stats.isObject()) {
            ((ObjectNode) stats).remove(RateStats.OWNED_KEYS);
        }

        JsonNode splits = record.get(statType.splitsKey());
        if (splits != null && splits.isObject()) {
            ObjectNode splitsNode = (ObjectNode) splits;
            for (String key : SPLIT_KEYS) cleanStale(splitsNode, key);
            if (splitsNode.isEmpty()) record.remove(statType.splitsKey());
        }

        JsonNode levels = record.get(statType.byLevelKey());
        if (levels != null && levels.isObject()) {
            ObjectNode byLevelNode = (ObjectNode) levels;
            for (String level : fieldNames(byLevelNode)) cleanStale(byLevelNode, level);
            if (byLevelNode.isEmpty()) record.remove(statType.byLevelKey());
        }
    }

    /**
     * Injecte les stats par match dans les entrées existantes du game log (par gameId).
     * Les entrées sans données PBP correspondantes restent intactes.
     *
     * @return nombre d'entrées mises à jour
     */
    public int injectPerGameStats(ObjectNode record, Map<String, RateStats> perGame, StatType statType) {
        if (perGame == null || perGame.isEmpty()) return 0;
        JsonNode gameLog = record.get(statType.gameLogKey());
        if (gameLog == null || !gameLog.isArray()) return 0;

        int injected = 0;
        for (JsonNode entry : gameLog) {
            if (!entry.isObject()) continue;
            JsonNode gameId = entry.get("gameId");
            if (gameId == null || gameId.isNull()) continue;

            RateStats gameStats = perGame.get(gameId.asText());
            if (gameStats == null) continue;

            writeOwned(objectChild((ObjectNode) entry, "stats"), gameStats);
            injected++;
        }
        return injected;
    }

    // --- HELPERS ---

    private void writeOwned(ObjectNode node, RateStats stats) {
        for (String key : RateStats.OWNED_KEYS) {
            if (!stats.has(key)) node.remove(key);
        }
        stats.asMap().forEach((key, value) -> putNumber(node, key, value));
    }

    /**
     * Retire les clés avancées d'un sous-objet ; le supprime s'il ne reste rien.
     */
    private void cleanStale(ObjectNode parent, String key) {
        JsonNode child = parent.get(key);
        if (child == null || !child.isObject()) return;
        ObjectNode childObject = (ObjectNode) child;
        childObject.remove(RateStats.OWNED_KEYS);
        if (childObject.isEmpty()) parent.remove(key);
    }

    private ObjectNode objectChild(ObjectNode parent, String key) {
        JsonNode child = parent.get(key);
        if (child != null && child.isObject()) return (ObjectNode) child;
        return parent.putObject(key);
    }

    private void putNumber(ObjectNode node, String key, Number value) {
        if (value == null) return;
        if (value instanceof Integer) {
            node.put(key, value.intValue());
        } else if (value instanceof Long) {
            node.put(key, value.longValue());
        } else {
            node.put(key, value.doubleValue());
        }
    }

    private List<String> fieldNames(ObjectNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }
}
