package com.tony.baseballAnalytics.engine;

/**
 * Contribution d'un lancer (ou d'une présence au bâton entière) aux compteurs de discipline.
 * {@code estimated} signale une approximation issue des compteurs agrégés historiques.
 */
public record DisciplineTally(int pitches, int swings, int contacts, int calledStrikesWhiffs, boolean estimated) {

    public static final DisciplineTally NONE = new DisciplineTally(0, 0, 0, 0, false);

    DisciplineTally plus(DisciplineTally other) {
        return new DisciplineTally(
                pitches + other.pitches,
                swings + other.swings,
                contacts + other.contacts,
                calledStrikesWhiffs + other.calledStrikesWhiffs,
                estimated || other.estimated);
    }
}
