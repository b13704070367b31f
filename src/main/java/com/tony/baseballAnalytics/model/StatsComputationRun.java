package com.tony.baseballAnalytics.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Historique des recalculs (un enregistrement par mois traité).
 */
@Entity
@Table(name = "stats_computation_run")
@Data
@NoArgsConstructor
public class StatsComputationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String period; // Ex: "2025-06"

    private Integer gamesProcessed;
    private Integer battersUpdated;
    private Integer pitchersUpdated;
    private Integer failedPlayers;

    private LocalDateTime startedAt;
    private Long durationMs;

    public StatsComputationRun(String period, LocalDateTime startedAt) {
        this.period = period;
        this.startedAt = startedAt;
    }
}
