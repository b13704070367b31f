package com.tony.baseballAnalytics.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.baseballAnalytics.config.AdvancedStatsProperties;
import com.tony.baseballAnalytics.model.dto.PbpDayFile;
import com.tony.baseballAnalytics.model.dto.PbpGameRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lecture du stockage PBP journalier : {dataDir}/pbp/{yyyy}/{MM}/{dd}.json
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class PbpRepository {

    private final ObjectMapper objectMapper;
    private final AdvancedStatsProperties properties;

    public List<PbpGameRow> findGamesForMonth(YearMonth month) {
        Path monthDir = monthDir(month);
        if (!Files.isDirectory(monthDir)) return List.of();

        List<Path> dayFiles;
        try (Stream<Path> files = Files.list(monthDir)) {
            dayFiles = files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Impossible de lister {} : {}", monthDir, e.getMessage());
            return List.of();
        }

        List<PbpGameRow> games = new ArrayList<>();
        for (Path dayFile : dayFiles) {
            games.addAll(readDayFile(dayFile));
        }
        return games;
    }

    /**
     * Un fichier illisible est ignoré (et journalisé) : il ne doit pas faire échouer tout le mois.
     */
    private List<PbpGameRow> readDayFile(Path dayFile) {
        try {
            PbpDayFile data = objectMapper.readValue(dayFile.toFile(), PbpDayFile.class);
            return data.getGames() == null ? List.of() : data.getGames();
        } catch (IOException e) {
            log.warn("Erreur de lecture {} : {}", dayFile, e.getMessage());
            return List.of();
        }
    }

    private Path monthDir(YearMonth month) {
        return Path.of(properties.getDataDir(), "pbp",
                String.valueOf(month.getYear()), String.format("%02d", month.getMonthValue()));
    }
}
