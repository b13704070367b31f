package com.tony.baseballAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Forme JSON d'un match dans les fichiers journaliers PBP (data/pbp/{yyyy}/{MM}/{dd}.json).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PbpGameRow {
    private Long gamePk;
    private String date;
    private String level;
    private List<PbpAtBatRow> atBats = new ArrayList<>();
}
