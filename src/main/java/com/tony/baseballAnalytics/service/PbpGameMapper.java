package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.config.AdvancedStatsProperties;
import com.tony.baseballAnalytics.model.*;
import com.tony.baseballAnalytics.model.dto.PbpAtBatRow;
import com.tony.baseballAnalytics.model.dto.PbpGameRow;
import com.tony.baseballAnalytics.model.dto.PbpPitchRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Convertit les lignes JSON du stockage PBP en {@link GameRecord} propres.
 * Les matchs incomplets sont filtrés ici, avant d'atteindre le moteur de calcul.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PbpGameMapper {

    static final Set<String> KNOWN_LEVELS = Set.of("AAA", "AA", "A+", "A", "CPX");

    private final AdvancedStatsProperties properties;

    public List<GameRecord> toGameRecords(List<PbpGameRow> rows) {
        List<GameRecord> games = new ArrayList<>();
        int skipped = 0;
        for (PbpGameRow row : rows) {
            GameRecord game = toGameRecord(row);
            if (game == null) {
                skipped++;
                continue;
            }
            games.add(game);
        }
        if (skipped > 0) {
            log.warn("⚠️ {} matchs PBP ignorés (gamePk ou at-bats manquants)", skipped);
        }
        return games;
    }

    /**
     * @return null si le match est inexploitable (pas d'identifiant, aucune présence au bâton valide)
     */
    public GameRecord toGameRecord(PbpGameRow row) {
        if (row == null || row.getGamePk() == null || row.getAtBats() == null) return null;

        List<AtBatEvent> atBats = new ArrayList<>();
        for (PbpAtBatRow abRow : row.getAtBats()) {
            AtBatEvent atBat = toAtBat(abRow);
            if (atBat != null) atBats.add(atBat);
        }
        if (atBats.isEmpty()) return null;

        return GameRecord.builder()
                .gameId(String.valueOf(row.getGamePk()))
                .date(parseDate(row.getDate()))
                .level(resolveLevel(row.getLevel()))
                .atBats(atBats)
                .build();
    }

    AtBatEvent toAtBat(PbpAtBatRow row) {
        if (row == null) return null;
        // Une présence au bâton référence toujours au moins un joueur
        if (row.getBatterId() == null && row.getPitcherId() == null) return null;

        return AtBatEvent.builder()
                .batterId(row.getBatterId() == null ? null : String.valueOf(row.getBatterId()))
                .pitcherId(row.getPitcherId() == null ? null : String.valueOf(row.getPitcherId()))
                .batterHand(Hand.fromCode(row.getBatterHand()))
                .pitcherHand(Hand.fromCode(row.getPitcherHand()))
                .eventType(row.getEventType())
                .result(row.getResult())
                .description(row.getDescription())
                .pitchDetail(toPitchDetail(row))
                .build();
    }

    /**
     * Résolution unique du format : détail lancer par lancer si présent, sinon compteurs agrégés.
     */
    PitchDetail toPitchDetail(PbpAtBatRow row) {
        List<PbpPitchRow> pitches = row.getPitches();
        int last = lastPitchIndex(pitches);
        if (last >= 0) {
            List<PitchEvent> events = new ArrayList<>(last + 1);
            for (int i = 0; i <= last; i++) {
                PbpPitchRow p = pitches.get(i);
                if (p == null) continue;
                // Seul le dernier lancer (balle en jeu) garde trajectoire et coordonnée
                events.add(i == last
                        ? new PitchEvent(p.getCode(), p.getTrajectory(), p.getCoordX())
                        : PitchEvent.of(p.getCode()));
            }
            return new PitchDetail.PitchLevel(events);
        }
        return new PitchDetail.Aggregate(orZero(row.getPitchCount()), orZero(row.getBalls()), orZero(row.getStrikes()));
    }

    /**
     * Index du dernier lancer non nul, -1 si la liste est absente ou ne contient que des trous.
     */
    private int lastPitchIndex(List<PbpPitchRow> pitches) {
        if (pitches == null) return -1;
        for (int i = pitches.size() - 1; i >= 0; i--) {
            if (pitches.get(i) != null) return i;
        }
        return -1;
    }

    String resolveLevel(String level) {
        if (level != null && KNOWN_LEVELS.contains(level.trim())) return level.trim();
        return properties.getDefaultLevel();
    }

    private LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) return null;
        try {
            return LocalDate.parse(date.length() > 10 ? date.substring(0, 10) : date);
        } catch (DateTimeParseException e) {
            log.debug("Date de match illisible : {}", date);
            return null;
        }
    }

    private int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
