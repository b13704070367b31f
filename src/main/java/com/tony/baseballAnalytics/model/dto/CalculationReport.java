package com.tony.baseballAnalytics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CalculationReport {
    private String period;          // "2025-06" ou "2025" pour une saison
    private int gamesProcessed;
    private int battersUpdated;
    private int pitchersUpdated;
    private int failedPlayers;      // Enregistrements restaurés après échec de fusion

    public static CalculationReport empty(String period) {
        return new CalculationReport(period, 0, 0, 0, 0);
    }

    public int playersUpdated() {
        return battersUpdated + pitchersUpdated;
    }

    public CalculationReport plus(CalculationReport other) {
        return new CalculationReport(period,
                gamesProcessed + other.gamesProcessed,
                battersUpdated + other.battersUpdated,
                pitchersUpdated + other.pitchersUpdated,
                failedPlayers + other.failedPlayers);
    }
}
