package com.tony.baseballAnalytics.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.baseballAnalytics.exception.StatsNotFoundException;
import com.tony.baseballAnalytics.model.StatType;
import com.tony.baseballAnalytics.service.AdvancedStatsService;
import com.tony.baseballAnalytics.service.StatsCsvExportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.YearMonth;
import java.time.format.DateTimeParseException;

@RestController
@RequestMapping("/api/v1/stats")
@RequiredArgsConstructor
public class PlayerStatsController {
    private final AdvancedStatsService advancedStatsService;
    private final StatsCsvExportService csvExportService;

    // Ex: GET /api/v1/stats/2025-06/players/691185
    @GetMapping("/{month}/players/{playerId}")
    public ResponseEntity<JsonNode> getPlayer(
            @PathVariable String month,
            @PathVariable String playerId) {
        return ResponseEntity.ok(advancedStatsService.getPlayerRecord(YearMonth.parse(month), playerId));
    }

    @GetMapping(value = "/{month}/export", produces = "text/csv")
    public ResponseEntity<String> exportCsv(
            @PathVariable String month,
            @RequestParam(defaultValue = "batting") String type) {
        StatType statType = StatType.fromKey(type);
        String csv = csvExportService.exportMonth(YearMonth.parse(month), statType);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"advanced-" + statType.statsKey() + "-" + month + ".csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    @ExceptionHandler(StatsNotFoundException.class)
    public ResponseEntity<String> handleNotFound(StatsNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
    }

    @ExceptionHandler(DateTimeParseException.class)
    public ResponseEntity<String> handleBadPeriod(DateTimeParseException e) {
        return ResponseEntity.badRequest().body("Période invalide (attendu yyyy-MM) : " + e.getParsedString());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
