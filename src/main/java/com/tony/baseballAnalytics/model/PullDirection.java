package com.tony.baseballAnalytics.model;

public enum PullDirection {
    PULL,
    NOT_PULL,
    // Balle au centre, main inconnue/ambidextre, pas de coordonnée ou pas en jeu
    UNKNOWN;

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
