package com.tony.baseballAnalytics.model;

/**
 * Latéralité d'un joueur : L (gaucher), R (droitier), S (ambidextre, frappeurs uniquement).
 */
public enum Hand {
    L, R, S;

    /**
     * Conversion tolérante depuis le code PBP ("L", "R", "S").
     * Retourne null si le code est absent ou inconnu.
     */
    public static Hand fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        return switch (code.trim().toUpperCase()) {
            case "L" -> L;
            case "R" -> R;
            case "S" -> S;
            default -> null;
        };
    }

    public boolean isSingleSided() {
        return this == L || this == R;
    }
}
