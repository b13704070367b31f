package com.tony.baseballAnalytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class GameRecord {
    String gameId;      // gamePk
    LocalDate date;
    String level;       // AAA, AA, A+, A, CPX ou MiLB par défaut

    @Singular
    List<AtBatEvent> atBats;
}
