package com.tony.baseballAnalytics.model;

public enum BattedBallType {
    GROUND_BALL,
    FLY_BALL,
    LINE_DRIVE,
    // Frappe non classable (coup sûr sans trajectoire, retrait au bâton, but sur balles...)
    UNCLASSIFIED;

    public boolean isClassified() {
        return this != UNCLASSIFIED;
    }

    public boolean isAirBall() {
        return this == FLY_BALL || this == LINE_DRIVE;
    }
}
