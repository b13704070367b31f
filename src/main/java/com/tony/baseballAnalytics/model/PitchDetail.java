package com.tony.baseballAnalytics.model;

import java.util.List;

/**
 * Détail des lancers d'une présence au bâton, résolu une seule fois à l'ingestion :
 * soit la séquence complète des lancers, soit les compteurs agrégés des anciens fichiers.
 */
public sealed interface PitchDetail permits PitchDetail.PitchLevel, PitchDetail.Aggregate {

    PitchDetail EMPTY = new Aggregate(0, 0, 0);

    /**
     * Dernier lancer (balle en jeu), ou null si indisponible.
     */
    PitchEvent finalPitch();

    record PitchLevel(List<PitchEvent> pitches) implements PitchDetail {
        public PitchLevel {
            pitches = List.copyOf(pitches);
        }

        @Override
        public PitchEvent finalPitch() {
            return pitches.isEmpty() ? null : pitches.get(pitches.size() - 1);
        }
    }

    // Format historique : aucun détail lancer par lancer
    record Aggregate(int pitchCount, int balls, int strikes) implements PitchDetail {
        @Override
        public PitchEvent finalPitch() {
            return null;
        }
    }
}
