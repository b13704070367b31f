package com.tony.baseballAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PbpAtBatRow {
    private Long batterId;
    private String batterName;
    private String batterHand;   // L, R ou S

    private Long pitcherId;
    private String pitcherName;
    private String pitcherHand;  // L ou R

    private String result;
    private String eventType;
    private String description;

    // --- Format historique (compteurs agrégés) ---
    private Integer pitchCount;
    private Integer balls;
    private Integer strikes;

    // --- Format détaillé (lancer par lancer), null dans les anciens fichiers ---
    private List<PbpPitchRow> pitches;
}
