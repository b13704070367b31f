package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.RateStats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Convertit des compteurs bruts en taux publiés, avec un seuil d'échantillon par famille.
 * Un taux sous le seuil est simplement absent : jamais de NaN ni de division par zéro.
 */
public final class RateCalculator {

    private RateCalculator() {}

    public static RateStats getStats(PlayerAccumulator accumulator, boolean isBatter, StatsPolicy policy) {
        return getStats(accumulator.getTotals(), isBatter, policy);
    }

    public static RateStats getStats(StatTotals t, boolean isBatter, StatsPolicy policy) {
        Map<String, Number> stats = new LinkedHashMap<>();

        // 1. Profil de balles frappées (parmi les BIP classables)
        int bip = t.classifiableBip();
        if (bip >= policy.minBip()) {
            stats.put(RateStats.GB_PCT, rate(t.getGroundBalls(), bip));
            stats.put(RateStats.FB_PCT, rate(t.getFlyBalls(), bip));
            stats.put(RateStats.LD_PCT, rate(t.getLineDrives(), bip));
            if (t.getFlyBalls() > 0) {
                stats.put(RateStats.HR_PER_FB, rate(t.getHomeRuns(), t.getFlyBalls()));
            }
        }

        // 2. Direction (frappeurs uniquement)
        if (isBatter) {
            if (t.getDirectionBip() >= policy.minDirection()) {
                stats.put(RateStats.PULL_PCT, rate(t.getPulls(), t.getDirectionBip()));
            }
            if (t.getAirDirectionBip() >= policy.minDirection()) {
                stats.put(RateStats.PULL_AIR_PCT, rate(t.getAirPulls(), t.getAirDirectionBip()));
            }
        }

        // 3. Discipline : uniquement avec de vraies données lancer par lancer
        if (t.hasPitchData() && t.getTotalPitches() >= policy.minPitches()) {
            stats.put(RateStats.SWING_PCT, rate(t.getSwings(), t.getTotalPitches()));
            if (t.getSwings() > 0) {
                stats.put(RateStats.CONTACT_PCT, rate(t.getContacts(), t.getSwings()));
            }
            stats.put(RateStats.CSW_PCT, rate(t.getCalledStrikesWhiffs(), t.getTotalPitches()));
        }

        // Toujours présent : permet de pondérer plusieurs périodes en aval
        stats.put(RateStats.BIP, bip);

        return RateStats.of(stats);
    }

    static double rate(int numerator, int denominator) {
        return round((double) numerator / denominator);
    }

    static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
