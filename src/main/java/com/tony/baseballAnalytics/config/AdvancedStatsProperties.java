package com.tony.baseballAnalytics.config;

import com.tony.baseballAnalytics.engine.PullZone;
import com.tony.baseballAnalytics.engine.StatsPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@ConfigurationProperties(prefix = "advanced-stats")
@Validated
@Data
public class AdvancedStatsProperties {

    // Racine du stockage : data/pbp/{yyyy}/{MM}/{dd}.json et data/stats/{yyyy}/{MM}.json
    @NotBlank
    private String dataDir = "data";

    // Mois de saison (avril -> septembre)
    @NotEmpty
    private List<Integer> seasonMonths = List.of(4, 5, 6, 7, 8, 9);

    @NotBlank
    private String defaultLevel = "MiLB";

    @Valid
    private Pull pull = new Pull();

    // Seuils mensuels / saison
    @Valid
    private Thresholds thresholds = new Thresholds();

    // Seuils par match (relâchés)
    @Valid
    private Thresholds perGameThresholds = new Thresholds(1, 1, 1);

    public PullZone pullZone() {
        return new PullZone(pull.getCenterLeft(), pull.getCenterRight());
    }

    public StatsPolicy statsPolicy() {
        return thresholds.toPolicy();
    }

    public StatsPolicy perGamePolicy() {
        return perGameThresholds.toPolicy();
    }

    @Data
    public static class Pull {
        private double centerLeft = 110.0;
        private double centerRight = 140.0;
    }

    @Data
    public static class Thresholds {
        @Min(1)
        private int minBip = 10;
        @Min(1)
        private int minPitches = 50;
        @Min(1)
        private int minDirection = 10;

        public Thresholds() {
        }

        public Thresholds(int minBip, int minPitches, int minDirection) {
            this.minBip = minBip;
            this.minPitches = minPitches;
            this.minDirection = minDirection;
        }

        StatsPolicy toPolicy() {
            return new StatsPolicy(minBip, minPitches, minDirection);
        }
    }
}
