package com.tony.baseballAnalytics.controller;

import com.tony.baseballAnalytics.job.NightlyAdvancedStatsJob;
import com.tony.baseballAnalytics.model.StatsComputationRun;
import com.tony.baseballAnalytics.model.dto.CalculationReport;
import com.tony.baseballAnalytics.repository.StatsComputationRunRepository;
import com.tony.baseballAnalytics.service.AdvancedStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/v1/admin/advanced-stats")
@RequiredArgsConstructor
@Slf4j
public class AdminController {
    private final AdvancedStatsService advancedStatsService;
    private final NightlyAdvancedStatsJob nightlyJob;
    private final StatsComputationRunRepository runRepository;

    // Ex: POST /api/v1/admin/advanced-stats/month/2025-06
    @PostMapping("/month/{month}")
    public ResponseEntity<?> calculateMonth(@PathVariable String month) {
        YearMonth period = YearMonth.parse(month);
        return run("mois " + period, () -> advancedStatsService.calculateForMonth(period));
    }

    @PostMapping("/date/{date}")
    public ResponseEntity<?> calculateDate(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return run("date " + date, () -> advancedStatsService.calculateForDate(date));
    }

    @PostMapping("/year/{year}")
    public ResponseEntity<?> calculateYear(@PathVariable int year) {
        return run("saison " + year, () -> advancedStatsService.calculateForYear(year));
    }

    /**
     * Lance manuellement le job nocturne (rattrapage, environnement local).
     */
    @PostMapping("/yesterday")
    public ResponseEntity<?> calculateYesterday() {
        return run("veille", nightlyJob::updateAdvancedStats);
    }

    @ExceptionHandler(DateTimeParseException.class)
    public ResponseEntity<String> handleBadPeriod(DateTimeParseException e) {
        return ResponseEntity.badRequest().body("Période invalide (attendu yyyy-MM) : " + e.getParsedString());
    }

    @GetMapping("/runs")
    public ResponseEntity<List<StatsComputationRun>> getRecentRuns() {
        return ResponseEntity.ok(runRepository.findTop20ByOrderByStartedAtDesc());
    }

    // Ex: GET /api/v1/admin/advanced-stats/runs/2025-06
    @GetMapping("/runs/{period}")
    public ResponseEntity<List<StatsComputationRun>> getRunsForPeriod(@PathVariable String period) {
        return ResponseEntity.ok(runRepository.findByPeriodOrderByStartedAtDesc(period));
    }

    private ResponseEntity<?> run(String label, Supplier<CalculationReport> calculation) {
        log.info("🚀 Recalcul des stats avancées demandé par l'admin ({})", label);
        try {
            return ResponseEntity.ok(calculation.get());
        } catch (Exception e) {
            log.error("❌ Echec du recalcul ({})", label, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Erreur technique lors du calcul : " + e.getMessage());
        }
    }
}
