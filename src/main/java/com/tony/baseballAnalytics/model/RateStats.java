package com.tony.baseballAnalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stats de taux calculées depuis un instantané de compteurs. Immuable.
 */
@EqualsAndHashCode
@ToString
public final class RateStats {

    public static final String GB_PCT = "GB%";
    public static final String FB_PCT = "FB%";
    public static final String LD_PCT = "LD%";
    public static final String HR_PER_FB = "HR/FB";
    public static final String PULL_PCT = "Pull%";
    public static final String PULL_AIR_PCT = "Pull-Air%";
    public static final String SWING_PCT = "Swing%";
    public static final String CONTACT_PCT = "Contact%";
    public static final String CSW_PCT = "CSW%";
    public static final String BIP = "BIP";

    /**
     * Clés dont le moteur est propriétaire dans un enregistrement joueur (ordre d'export).
     */
    public static final List<String> OWNED_KEYS = List.of(
            GB_PCT, FB_PCT, LD_PCT, HR_PER_FB, PULL_PCT, PULL_AIR_PCT,
            SWING_PCT, CONTACT_PCT, CSW_PCT, BIP);

    public static final RateStats EMPTY = new RateStats(Map.of());

    private final Map<String, Number> values;

    private RateStats(Map<String, Number> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RateStats of(Map<String, Number> values) {
        return new RateStats(values);
    }

    public Number get(String key) {
        return values.get(key);
    }

    public Double getRate(String key) {
        Number n = values.get(key);
        return n == null ? null : n.doubleValue();
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, Number> asMap() {
        return values;
    }
}
