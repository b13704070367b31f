package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.BattedBallType;
import com.tony.baseballAnalytics.model.PullDirection;
import lombok.Getter;
import lombok.ToString;

/**
 * Compteurs bruts d'un joueur sur un périmètre (total, split, niveau ou match).
 * Additifs : deux totaux se combinent sans repasser par les présences au bâton.
 */
@Getter
@ToString
public class StatTotals {

    private int atBats;

    // --- Balles frappées (sous-ensemble classable uniquement) ---
    private int groundBalls;
    private int flyBalls;
    private int lineDrives;
    private int homeRuns; // Sous-ensemble des flyBalls

    // --- Direction ---
    private int directionBip;
    private int pulls;
    private int airDirectionBip;
    private int airPulls;

    // --- Discipline ---
    private int totalPitches;
    private int swings;
    private int contacts;
    private int calledStrikesWhiffs;
    private int estimatedPitches; // Part des lancers venant de l'approximation historique
    private boolean pitchData;

    void record(AtBatContribution c) {
        atBats++;

        BattedBallType type = c.battedBall();
        switch (type) {
            case GROUND_BALL -> groundBalls++;
            case FLY_BALL -> {
                flyBalls++;
                if (c.homeRun()) homeRuns++;
            }
            case LINE_DRIVE -> lineDrives++;
            default -> { }
        }

        PullDirection direction = c.direction();
        if (direction.isKnown()) {
            boolean pulled = direction == PullDirection.PULL;
            directionBip++;
            if (pulled) pulls++;
            if (type.isAirBall()) {
                airDirectionBip++;
                if (pulled) airPulls++;
            }
        }

        DisciplineTally d = c.discipline();
        totalPitches += d.pitches();
        swings += d.swings();
        contacts += d.contacts();
        calledStrikesWhiffs += d.calledStrikesWhiffs();
        if (d.estimated()) estimatedPitches += d.pitches();
        if (c.pitchLevel()) pitchData = true;
    }

    void add(StatTotals other) {
        atBats += other.atBats;
        groundBalls += other.groundBalls;
        flyBalls += other.flyBalls;
        lineDrives += other.lineDrives;
        homeRuns += other.homeRuns;
        directionBip += other.directionBip;
        pulls += other.pulls;
        airDirectionBip += other.airDirectionBip;
        airPulls += other.airPulls;
        totalPitches += other.totalPitches;
        swings += other.swings;
        contacts += other.contacts;
        calledStrikesWhiffs += other.calledStrikesWhiffs;
        estimatedPitches += other.estimatedPitches;
        pitchData = pitchData || other.pitchData;
    }

    StatTotals copy() {
        StatTotals copy = new StatTotals();
        copy.add(this);
        return copy;
    }

    public int classifiableBip() {
        return groundBalls + flyBalls + lineDrives;
    }

    public boolean hasPitchData() {
        return pitchData;
    }

    public boolean isEmpty() {
        return atBats == 0;
    }
}
