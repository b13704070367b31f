package com.tony.baseballAnalytics.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tony.baseballAnalytics.config.AdvancedStatsProperties;
import com.tony.baseballAnalytics.engine.AdvancedStatsAggregator;
import com.tony.baseballAnalytics.engine.AggregationResult;
import com.tony.baseballAnalytics.exception.StatsNotFoundException;
import com.tony.baseballAnalytics.model.GameRecord;
import com.tony.baseballAnalytics.model.PlayerAdvancedStats;
import com.tony.baseballAnalytics.model.StatType;
import com.tony.baseballAnalytics.model.StatsComputationRun;
import com.tony.baseballAnalytics.model.dto.CalculationReport;
import com.tony.baseballAnalytics.repository.MonthlyStatsRepository;
import com.tony.baseballAnalytics.repository.PbpRepository;
import com.tony.baseballAnalytics.repository.StatsComputationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Orchestration d'un recalcul : PBP du mois → agrégation → taux → fusion dans le fichier mensuel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdvancedStatsService {

    private final PbpRepository pbpRepository;
    private final MonthlyStatsRepository monthlyStatsRepository;
    private final StatsComputationRunRepository runRepository;
    private final PbpGameMapper gameMapper;
    private final PlayerRecordMerger merger;
    private final AdvancedStatsProperties properties;

    /**
     * Recalcule tout le mois : les stats cumulées ne peuvent pas être mises à jour jour par jour.
     * Seuls les joueurs déjà présents dans le fichier mensuel sont mis à jour (jamais créés).
     */
    public CalculationReport calculateForMonth(YearMonth month) {
        long start = System.currentTimeMillis();
        LocalDateTime startedAt = LocalDateTime.now();
        String period = month.toString();
        log.info("🚀 Calcul des stats avancées pour {}", period);

        List<GameRecord> games = gameMapper.toGameRecords(pbpRepository.findGamesForMonth(month));
        if (games.isEmpty()) {
            log.info("Aucune donnée PBP pour {}", period);
            return CalculationReport.empty(period);
        }
        log.info("⚾ {} matchs à traiter", games.size());

        AggregationResult aggregation = aggregate(games);

        ObjectNode monthlyData = monthlyStatsRepository.load(month);
        ObjectNode players = (ObjectNode) monthlyData.get("players");

        MergeCounts batters = mergeAll(players, StatType.BATTING,
                aggregation.getBatters().toAdvancedStats(properties.statsPolicy(), properties.perGamePolicy()));
        MergeCounts pitchers = mergeAll(players, StatType.PITCHING,
                aggregation.getPitchers().toAdvancedStats(properties.statsPolicy(), properties.perGamePolicy()));

        monthlyStatsRepository.save(month, monthlyData);

        CalculationReport report = new CalculationReport(period, games.size(),
                batters.updated, pitchers.updated, batters.failed + pitchers.failed);
        recordRun(report, startedAt, start);

        log.info("✅ {} : {} frappeurs, {} lanceurs mis à jour ({} échecs, {} ms)",
                period, report.getBattersUpdated(), report.getPitchersUpdated(),
                report.getFailedPlayers(), System.currentTimeMillis() - start);
        return report;
    }

    public CalculationReport calculateForDate(LocalDate date) {
        log.info("Calcul pour le {} (recalcul du mois complet)", date);
        return calculateForMonth(YearMonth.from(date));
    }

    public CalculationReport calculateForYesterday() {
        return calculateForDate(LocalDate.now().minusDays(1));
    }

    public CalculationReport calculateForYear(int year) {
        log.info("📅 Calcul de la saison {}", year);
        CalculationReport total = CalculationReport.empty(String.valueOf(year));
        for (Integer month : properties.getSeasonMonths()) {
            total = total.plus(calculateForMonth(YearMonth.of(year, month)));
        }
        return total;
    }

    public AggregationResult aggregate(List<GameRecord> games) {
        AdvancedStatsAggregator aggregator = new AdvancedStatsAggregator(properties.pullZone(), properties.getDefaultLevel());
        return aggregator.aggregate(games);
    }

    public JsonNode getPlayerRecord(YearMonth month, String playerId) {
        if (!monthlyStatsRepository.exists(month)) {
            throw new StatsNotFoundException("Aucune stat pour le mois " + month);
        }
        JsonNode player = monthlyStatsRepository.load(month).path("players").get(playerId);
        if (player == null || player.isNull()) {
            throw new StatsNotFoundException("Joueur " + playerId + " introuvable pour " + month);
        }
        return player;
    }

    /**
     * Fusionne chaque joueur indépendamment : un échec restaure l'enregistrement de ce joueur
     * sans affecter les autres. Les joueurs du fichier absents du calcul perdent leurs
     * anciennes clés avancées pour ce type de stats.
     */
    MergeCounts mergeAll(ObjectNode players, StatType statType, Map<String, PlayerAdvancedStats> computed) {
        MergeCounts counts = new MergeCounts();
        for (String playerId : fieldNames(players)) {
            JsonNode existing = players.get(playerId);
            if (existing == null || !existing.isObject()) continue;

            ObjectNode record = (ObjectNode) existing;
            PlayerAdvancedStats stats = computed.get(playerId);
            ObjectNode backup = record.deepCopy();
            try {
                if (stats == null) {
                    merger.clearAdvancedStats(record, statType);
                    continue;
                }
                merger.apply(record, stats);
                counts.updated++;
            } catch (RuntimeException e) {
                players.set(playerId, backup);
                counts.failed++;
                log.warn("Fusion {} échouée pour le joueur {} (enregistrement restauré) : {}",
                        statType.statsKey(), playerId, e.getMessage());
            }
        }
        return counts;
    }

    private List<String> fieldNames(ObjectNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private void recordRun(CalculationReport report, LocalDateTime startedAt, long start) {
        StatsComputationRun run = new StatsComputationRun(report.getPeriod(), startedAt);
        run.setGamesProcessed(report.getGamesProcessed());
        run.setBattersUpdated(report.getBattersUpdated());
        run.setPitchersUpdated(report.getPitchersUpdated());
        run.setFailedPlayers(report.getFailedPlayers());
        run.setDurationMs(System.currentTimeMillis() - start);
        try {
            runRepository.save(run);
        } catch (DataAccessException e) {
            // Le fichier mensuel est déjà écrit : l'historique seul est perdu
            log.warn("Historique du calcul {} non enregistré : {}", report.getPeriod(), e.getMessage());
        }
    }

    static class MergeCounts {
        int updated = 0;
        int failed = 0;
    }
}
