package com.tony.baseballAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PbpPitchRow {
    @JsonAlias({"call", "callCode"})
    private String code;
    private String trajectory;
    private Double coordX;
}
