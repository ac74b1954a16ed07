package dev.ebullient.riddle.model;

/**
 * Full state of one character after a change, with the combat view it now
 * appears in (null when there is no active combat).
 * <p>
 * When the change defeats the last enemy, this is the only event sent: no
 * {@code CombatEnded} follows. Receivers that held a combat view treat a null
 * {@code combat} as the end of that combat.
 */
public record CharacterStatePayload(
        long version,
        Character character,
        VitalityState state,
        CombatStatePayload combat) {
}
