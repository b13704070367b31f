package com.tony.baseballAnalytics.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * Taxonomie fixe des codes d'appel d'un lancer (vocabulaire "call.code" du PBP).
 * Tout code connu compte comme un lancer ; chacun indique en plus s'il compte
 * comme swing, contact ou CSW. Balles et HBP ne comptent que comme lancer.
 */
@Getter
public enum PitchCall {
    // --- BALLES ---
    BALL('B', false, false, false),
    INTENT_BALL('I', false, false, false),
    PITCHOUT('P', false, false, false),
    AUTOMATIC_BALL('V', false, false, false),

    // --- PRISE APPELÉE ---
    CALLED_STRIKE('C', false, false, true),

    // --- WHIFFS ---
    SWINGING_STRIKE('S', true, false, true),
    MISSED_BUNT('M', true, false, true),
    SWINGING_STRIKE_BLOCKED('W', true, false, true),
    SWINGING_PITCHOUT('Q', true, false, true),

    // --- FAUSSES BALLES ---
    FOUL('F', true, true, false),
    FOUL_TIP('T', true, true, false),
    FOUL_BUNT('L', true, true, false),
    FOUL_TIP_BUNT('O', true, true, false),
    FOUL_PITCHOUT('R', true, true, false),

    // --- EN JEU ---
    IN_PLAY_OUT('X', true, true, false),
    IN_PLAY_NO_OUT('D', true, true, false),
    IN_PLAY_RUNS('E', true, true, false),

    HIT_BY_PITCH('H', false, false, false);

    private static final Map<Character, PitchCall> BY_CODE = new HashMap<>();
    static {
        for (PitchCall call : values()) {
            BY_CODE.put(call.code, call);
        }
    }

    @Getter(AccessLevel.NONE)
    private final char code;
    private final boolean swing;
    private final boolean contact;
    private final boolean csw;

    PitchCall(char code, boolean swing, boolean contact, boolean csw) {
        this.code = code;
        this.swing = swing;
        this.contact = contact;
        this.csw = csw;
    }

    /**
     * Retourne null pour un code inconnu ou vide : l'appelant l'ignore purement et simplement.
     */
    public static PitchCall fromCode(String code) {
        if (code == null || code.length() != 1) return null;
        return BY_CODE.get(Character.toUpperCase(code.charAt(0)));
    }
}
