package com.tony.baseballAnalytics.model;

/**
 * Un lancer d'une présence au bâton. Seul le dernier lancer (balle en jeu)
 * porte la trajectoire et la coordonnée horizontale.
 */
public record PitchEvent(String callCode, String trajectory, Double coordX) {

    public static PitchEvent of(String callCode) {
        return new PitchEvent(callCode, null, null);
    }

    public boolean hasTrajectory() {
        return trajectory != null && !trajectory.isBlank();
    }
}
