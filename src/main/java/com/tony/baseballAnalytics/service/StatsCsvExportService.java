package com.tony.baseballAnalytics.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.opencsv.CSVWriter;
import com.tony.baseballAnalytics.exception.StatsNotFoundException;
import com.tony.baseballAnalytics.model.RateStats;
import com.tony.baseballAnalytics.model.StatType;
import com.tony.baseballAnalytics.repository.MonthlyStatsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Export CSV des stats avancées d'un mois : une ligne par joueur ayant des stats du type demandé.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatsCsvExportService {

    private final MonthlyStatsRepository monthlyStatsRepository;

    public String exportMonth(YearMonth month, StatType statType) {
        if (!monthlyStatsRepository.exists(month)) {
            throw new StatsNotFoundException("Aucune stat pour le mois " + month);
        }
        JsonNode players = monthlyStatsRepository.load(month).path("players");

        StringWriter out = new StringWriter();
        int rows = 0;
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(header(), false);

            Iterator<Map.Entry<String, JsonNode>> it = players.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> player = it.next();
                JsonNode stats = player.getValue().path(statType.statsKey());
                if (!stats.has(RateStats.BIP)) continue; // Pas de stats avancées pour ce rôle

                writer.writeNext(row(player.getKey(), player.getValue(), stats), false);
                rows++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Export CSV impossible pour " + month, e);
        }

        log.info("📄 Export CSV {} {} : {} joueurs", month, statType.statsKey(), rows);
        return out.toString();
    }

    private String[] header() {
        List<String> columns = new ArrayList<>();
        columns.add("playerId");
        columns.add("name");
        columns.addAll(RateStats.OWNED_KEYS);
        return columns.toArray(new String[0]);
    }

    private String[] row(String playerId, JsonNode player, JsonNode stats) {
        List<String> values = new ArrayList<>();
        values.add(playerId);
        values.add(player.path("name").asText(""));
        for (String key : RateStats.OWNED_KEYS) {
            JsonNode value = stats.get(key);
            values.add(value == null || value.isNull() ? "" : value.asText());
        }
        return values.toArray(new String[0]);
    }
}
