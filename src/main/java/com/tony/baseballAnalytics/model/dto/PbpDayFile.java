package com.tony.baseballAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PbpDayFile {
    private String date;
    private String updated;
    private Integer gameCount;
    private List<PbpGameRow> games = new ArrayList<>();
}
