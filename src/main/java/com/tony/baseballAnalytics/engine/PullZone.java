package com.tony.baseballAnalytics.engine;

/**
 * Bande centrale de la coordonnée horizontale de frappe. Une balle dans
 * [centerLeft, centerRight] n'est ni tirée ni à contre-champ.
 */
public record PullZone(double centerLeft, double centerRight) {

    public static final PullZone DEFAULT = new PullZone(110.0, 140.0);

    public PullZone {
        if (centerLeft > centerRight) {
            throw new IllegalArgumentException(
                    "centerLeft (" + centerLeft + ") doit être <= centerRight (" + centerRight + ")");
        }
    }

    public boolean isCenter(double coordX) {
        return coordX >= centerLeft && coordX <= centerRight;
    }
}
