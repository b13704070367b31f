package com.tony.baseballAnalytics.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tony.baseballAnalytics.config.AdvancedStatsProperties;
import com.tony.baseballAnalytics.exception.StatsStorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.YearMonth;

/**
 * Fichiers de stats mensuels : {dataDir}/stats/{yyyy}/{MM}.json
 * Format : {"year", "month", "updated", "players": {id: enregistrement}}
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class MonthlyStatsRepository {

    private final ObjectMapper objectMapper;
    private final AdvancedStatsProperties properties;

    public boolean exists(YearMonth month) {
        return Files.exists(monthFile(month));
    }

    /**
     * Charge le fichier du mois ; squelette vide s'il n'existe pas encore.
     */
    public ObjectNode load(YearMonth month) {
        Path file = monthFile(month);
        if (!Files.exists(file)) {
            return emptyMonth(month);
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                throw new StatsStorageException("Fichier de stats invalide : " + file, null);
            }
            ObjectNode data = (ObjectNode) root;
            if (!data.path("players").isObject()) {
                data.putObject("players");
            }
            return data;
        } catch (IOException e) {
            throw new StatsStorageException("Lecture impossible : " + file, e);
        }
    }

    public void save(YearMonth month, ObjectNode data) {
        Path file = monthFile(month);
        data.put("updated", LocalDateTime.now().toString());
        try {
            Files.createDirectories(file.getParent());
            // Écriture dans un fichier temporaire puis remplacement
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), data);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.info("💾 Stats sauvegardées dans {}", file);
        } catch (IOException e) {
            throw new StatsStorageException("Écriture impossible : " + file, e);
        }
    }

    private ObjectNode emptyMonth(YearMonth month) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("year", month.getYear());
        data.put("month", month.getMonthValue());
        data.put("updated", LocalDateTime.now().toString());
        data.putObject("players");
        return data;
    }

    private Path monthFile(YearMonth month) {
        return Path.of(properties.getDataDir(), "stats",
                String.valueOf(month.getYear()), String.format("%02d.json", month.getMonthValue()));
    }
}
