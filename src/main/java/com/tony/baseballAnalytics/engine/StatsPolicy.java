package com.tony.baseballAnalytics.engine;

/**
 * Tailles d'échantillon minimales par famille de stats.
 * Paramètre de l'appelant : mensuel/saison avec les valeurs par défaut, par match avec 1/1/1.
 */
public record StatsPolicy(int minBip, int minPitches, int minDirection) {

    public static final StatsPolicy DEFAULTS = new StatsPolicy(10, 50, 10);

    // Les moyennes glissantes en aval gèrent elles-mêmes le bruit des petits échantillons
    public static final StatsPolicy PER_GAME = new StatsPolicy(1, 1, 1);

    public StatsPolicy {
        if (minBip < 1 || minPitches < 1 || minDirection < 1) {
            throw new IllegalArgumentException("Les seuils minimaux doivent être >= 1");
        }
    }
}
