package com.tony.baseballAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder(toBuilder = true)
public class AtBatEvent {

    public static final Set<String> STRIKEOUT_EVENTS = Set.of(
            "strikeout", "strikeout_double_play", "strikeout_triple_play");

    public static final Set<String> WALK_EVENTS = Set.of(
            "walk", "intent_walk", "hit_by_pitch");

    public static final String HOME_RUN = "home_run";

    String batterId;
    String pitcherId;
    Hand batterHand;
    Hand pitcherHand;

    String eventType;   // Token canonique (ex: "strikeout", "home_run")
    String result;      // Libellé (ex: "Flyout")
    String description;

    @Builder.Default
    PitchDetail pitchDetail = PitchDetail.EMPTY;

    public boolean isStrikeout() {
        return eventType != null && STRIKEOUT_EVENTS.contains(eventType);
    }

    public boolean isWalkOrHitByPitch() {
        return eventType != null && WALK_EVENTS.contains(eventType);
    }

    public boolean isHomeRun() {
        return HOME_RUN.equals(eventType);
    }

    /**
     * BIP = tout sauf retrait au bâton, but sur balles et atteint par un lancer.
     */
    public boolean isBallInPlay() {
        if (eventType == null || eventType.isBlank()) return false;
        return !isStrikeout() && !isWalkOrHitByPitch();
    }

    public PitchEvent finalPitch() {
        return pitchDetail == null ? null : pitchDetail.finalPitch();
    }
}
