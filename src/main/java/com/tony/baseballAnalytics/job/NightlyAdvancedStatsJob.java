package com.tony.baseballAnalytics.job;

import com.tony.baseballAnalytics.model.dto.CalculationReport;
import com.tony.baseballAnalytics.service.AdvancedStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class NightlyAdvancedStatsJob {

    private final AdvancedStatsService advancedStatsService;

    /**
     * Recalcule le mois de la veille une fois le PBP de la nuit récupéré.
     */
    @Scheduled(cron = "${advanced-stats.nightly-cron:0 30 7 * * *}")
    public void scheduledRun() {
        log.info("⏰ [CRON] Démarrage automatique : stats avancées de la veille...");
        try {
            CalculationReport report = updateAdvancedStats();
            log.info("✅ [CRON] {} joueurs mis à jour sur {} matchs.", report.playersUpdated(), report.getGamesProcessed());
        } catch (Exception e) {
            log.error("❌ [CRON] Echec du calcul des stats avancées", e);
        }
    }

    public CalculationReport updateAdvancedStats() {
        return advancedStatsService.calculateForYesterday();
    }
}
