package com.tony.baseballAnalytics.model;

/**
 * Famille de stats d'un enregistrement joueur. Donne les clés JSON dont le moteur est propriétaire.
 */
public enum StatType {
    BATTING("batting"),
    PITCHING("pitching");

    private final String key;

    StatType(String key) {
        this.key = key;
    }

    public String statsKey() { return key; }
    public String splitsKey() { return key + "Splits"; }
    public String byLevelKey() { return key + "ByLevel"; }
    public String gameLogKey() { return key + "GameLog"; }

    public boolean isBatter() {
        return this == BATTING;
    }

    public static StatType fromKey(String key) {
        for (StatType type : values()) {
            if (type.key.equalsIgnoreCase(key)) return type;
        }
        throw new IllegalArgumentException("Type de stats inconnu : " + key);
    }
}
