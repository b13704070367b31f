package com.tony.baseballAnalytics.engine;

import com.tony.baseballAnalytics.model.AtBatEvent;
import com.tony.baseballAnalytics.model.PitchCall;
import com.tony.baseballAnalytics.model.PitchDetail;
import com.tony.baseballAnalytics.model.PitchEvent;

/**
 * Compteurs de discipline (lancers, swings, contacts, CSW).
 *
 * <p>Avec le détail lancer par lancer, chaque code d'appel est lu dans {@link PitchCall}.
 * Sans détail (anciens fichiers), on estime depuis pitchCount / balls / strikes ;
 * les deux chemins ne sont jamais mélangés au sein d'une même présence au bâton.
 */
public final class PitchDisciplineTallier {

    private PitchDisciplineTallier() {}

    /**
     * Un code inconnu ne compte pour rien, pas même comme lancer.
     */
    public static DisciplineTally tallyPitch(String callCode) {
        PitchCall call = PitchCall.fromCode(callCode);
        if (call == null) return DisciplineTally.NONE;
        return new DisciplineTally(
                1,
                call.isSwing() ? 1 : 0,
                call.isContact() ? 1 : 0,
                call.isCsw() ? 1 : 0,
                false);
    }

    public static DisciplineTally tally(AtBatEvent atBat) {
        if (atBat == null || atBat.getPitchDetail() == null) return DisciplineTally.NONE;

        PitchDetail detail = atBat.getPitchDetail();
        if (detail instanceof PitchDetail.PitchLevel pitchLevel) {
            DisciplineTally total = DisciplineTally.NONE;
            for (PitchEvent pitch : pitchLevel.pitches()) {
                if (pitch == null) continue;
                total = total.plus(tallyPitch(pitch.callCode()));
            }
            return total;
        }
        return estimate(atBat, (PitchDetail.Aggregate) detail);
    }

    /**
     * Approximation au niveau de la présence au bâton :
     * swings ≈ pitchCount - balls, contacts et CSW déduits des prises.
     */
    static DisciplineTally estimate(AtBatEvent atBat, PitchDetail.Aggregate counts) {
        int pitchCount = counts.pitchCount();
        if (pitchCount <= 0) return DisciplineTally.NONE;

        int balls = Math.max(0, counts.balls());
        int strikes = Math.max(0, counts.strikes());
        int swings = Math.max(0, pitchCount - balls);

        int contacts;
        int csw;
        if (atBat.isStrikeout()) {
            // La 3e prise est un whiff ou une prise appelée : le reste, des fausses balles
            contacts = Math.max(0, strikes - 3);
            csw = 3;
        } else if (atBat.isWalkOrHitByPitch()) {
            contacts = 0;
            csw = strikes;
        } else {
            // Contact sur le dernier lancer + fausses balles estimées avant
            contacts = 1 + Math.max(0, strikes - 1);
            csw = 0;
        }
        return new DisciplineTally(pitchCount, swings, contacts, csw, true);
    }
}
